package io.projectdesk.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when granting a sponsorship would take a supervisor past the sponsored-account limit.
 * Results in HTTP 400 with the limit and current count as problem properties.
 */
public class SponsorLimitExceededException extends ErrorResponseException {

  public SponsorLimitExceededException(int limit, long currentCount) {
    super(HttpStatus.BAD_REQUEST, createProblem(limit, currentCount), null);
  }

  private static ProblemDetail createProblem(int limit, long currentCount) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Sponsor limit reached");
    problem.setDetail("Sponsor limit of " + limit + " reached");
    problem.setProperty("sponsorLimit", limit);
    problem.setProperty("sponsoredCount", currentCount);
    return problem;
  }
}
