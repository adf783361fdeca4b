package io.b2mash.siteledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Malformed or out-of-range input. Carries the offending field name when known. */
public class InvalidStateException extends ErrorResponseException {

  private final String field;

  public InvalidStateException(String title, String detail) {
    this(title, detail, null);
  }

  public InvalidStateException(String title, String detail, String field) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, field), null);
    this.field = field;
  }

  public static InvalidStateException forField(String field, String detail) {
    return new InvalidStateException("Invalid " + field, detail, field);
  }

  private static ProblemDetail createProblem(String title, String detail, String field) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (field != null) {
      problem.setProperty("field", field);
    }
    return problem;
  }

  public String getField() {
    return field;
  }
}
