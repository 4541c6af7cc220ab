package io.projectdesk.backend.exception;

import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    log.warn(
        "Forbidden: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(AuthenticationFailedException.class)
  public ResponseEntity<ProblemDetail> handleAuthenticationFailed(
      AuthenticationFailedException ex) {
    log.info("Login rejected: {}", ex.getReason());
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ex.getBody());
  }

  @ExceptionHandler(BillingProviderException.class)
  public ResponseEntity<ProblemDetail> handleBillingProvider(BillingProviderException ex) {
    log.warn("Billing provider call failed: {}", ex.getBody().getDetail(), ex.getCause());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ex.getBody());
  }

  @ExceptionHandler(EmailDeliveryException.class)
  public ResponseEntity<ProblemDetail> handleEmailDelivery(EmailDeliveryException ex) {
    log.warn("Email delivery failed: {}", ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ex.getBody());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
    log.error(
        "Unhandled error: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Internal server error");
    problem.setDetail("An unexpected error occurred");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    var fieldErrors = new LinkedHashMap<String, String>();
    ex.getBindingResult()
        .getFieldErrors()
        .forEach(
            error ->
                fieldErrors.putIfAbsent(
                    error.getField(),
                    error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid"));
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(
        "Request contains invalid fields: " + String.join(", ", fieldErrors.keySet()));
    problem.setProperty("fieldErrors", fieldErrors);
    return handleExceptionInternal(ex, problem, headers, HttpStatus.BAD_REQUEST, request);
  }

  @Override
  protected ResponseEntity<Object> handleExceptionInternal(
      Exception ex,
      @Nullable Object body,
      HttpHeaders headers,
      HttpStatusCode statusCode,
      WebRequest request) {
    if (statusCode.is5xxServerError()) {
      log.error("Request failed with status {}", statusCode.value(), ex);
    } else {
      log.debug("Request rejected with status {}: {}", statusCode.value(), ex.getMessage());
    }
    return super.handleExceptionInternal(ex, body, headers, statusCode, request);
  }
}
