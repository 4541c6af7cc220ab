package io.projectdesk.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** An email the request depends on could not be handed to the mail provider. HTTP 502. */
public class EmailDeliveryException extends ErrorResponseException {

  public EmailDeliveryException(String detail) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Email delivery failed");
    problem.setDetail(detail);
    return problem;
  }
}
