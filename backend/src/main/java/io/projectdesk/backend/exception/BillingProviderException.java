package io.projectdesk.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a call to the billing provider fails. Results in HTTP 502 with the provider's own
 * message as detail so the user sees why the operation was aborted.
 */
public class BillingProviderException extends ErrorResponseException {

  public BillingProviderException(String detail) {
    this(detail, null);
  }

  public BillingProviderException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Billing provider error");
    problem.setDetail(detail);
    return problem;
  }
}
