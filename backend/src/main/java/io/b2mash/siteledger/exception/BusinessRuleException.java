package io.b2mash.siteledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Well-formed request refused by a business rule, e.g. an amendment that empties the budget. */
public class BusinessRuleException extends ErrorResponseException {

  private final String rule;

  public BusinessRuleException(String rule, String title, String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(rule, title, detail), null);
    this.rule = rule;
  }

  private static ProblemDetail createProblem(String rule, String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("rule", rule);
    return problem;
  }

  public String getRule() {
    return rule;
  }
}
