package io.projectdesk.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a login attempt is rejected. The rejection reason is the problem detail. */
public class AuthenticationFailedException extends ErrorResponseException {

  private final String reason;

  public AuthenticationFailedException(String reason) {
    super(HttpStatus.UNAUTHORIZED, createProblem(reason), null);
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }

  private static ProblemDetail createProblem(String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Authentication failed");
    problem.setDetail(reason);
    return problem;
  }
}
