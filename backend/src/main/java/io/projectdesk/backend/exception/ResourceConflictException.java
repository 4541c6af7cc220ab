package io.projectdesk.backend.exception;

import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    this(title, detail, Map.of());
  }

  /**
   * Conflict carrying extra problem properties, e.g. a machine-readable {@code code} and the
   * entities that caused the conflict.
   */
  public ResourceConflictException(String title, String detail, Map<String, Object> properties) {
    super(HttpStatus.CONFLICT, createProblem(title, detail, properties), null);
  }

  private static ProblemDetail createProblem(
      String title, String detail, Map<String, Object> properties) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    properties.forEach(problem::setProperty);
    return problem;
  }
}
