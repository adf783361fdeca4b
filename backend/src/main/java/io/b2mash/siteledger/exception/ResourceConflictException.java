package io.b2mash.siteledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail, null, null), null);
  }

  /** Duplicate unique key: {@code field} holds the key name, {@code value} the clashing value. */
  public static ResourceConflictException duplicate(String title, String field, Object value) {
    return new ResourceConflictException(
        title, "A record with " + field + " '" + value + "' already exists", field, value);
  }

  private ResourceConflictException(String title, String detail, String field, Object value) {
    super(HttpStatus.CONFLICT, createProblem(title, detail, field, value), null);
  }

  private static ProblemDetail createProblem(
      String title, String detail, String field, Object value) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (field != null) {
      problem.setProperty("field", field);
      problem.setProperty("value", String.valueOf(value));
    }
    return problem;
  }
}
