package io.b2mash.b2b.mediaflow.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a preventive creation check rejects a job, order or upload before it reaches the
 * store. Results in HTTP 400 with the individual errors listed under {@code errors}.
 */
public class ValidationFailedException extends ErrorResponseException {

  private final List<String> errors;

  public ValidationFailedException(String entityType, List<String> errors) {
    super(HttpStatus.BAD_REQUEST, createProblem(entityType, errors), null);
    this.errors = List.copyOf(errors);
  }

  public List<String> getErrors() {
    return errors;
  }

  private static ProblemDetail createProblem(String entityType, List<String> errors) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(entityType + " validation failed");
    problem.setDetail(String.join("; ", errors));
    problem.setProperty("errors", errors);
    return problem;
  }
}
