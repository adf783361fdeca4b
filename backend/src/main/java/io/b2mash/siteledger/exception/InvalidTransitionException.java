package io.b2mash.siteledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A state machine guard refused a transition. The problem detail carries the entity and both
 * states so callers can render a precise message without parsing the detail text.
 */
public class InvalidTransitionException extends ErrorResponseException {

  private final String entityType;
  private final Object entityId;
  private final String currentState;
  private final String requestedState;

  public InvalidTransitionException(
      String entityType, Object entityId, Enum<?> currentState, Enum<?> requestedState) {
    this(entityType, entityId, currentState.name(), requestedState.name());
  }

  public InvalidTransitionException(
      String entityType, Object entityId, String currentState, String requestedState) {
    super(
        HttpStatus.CONFLICT,
        createProblem(entityType, entityId, currentState, requestedState),
        null);
    this.entityType = entityType;
    this.entityId = entityId;
    this.currentState = currentState;
    this.requestedState = requestedState;
  }

  /**
   * Guard failure for an operation that is not itself a state change, such as editing a document
   * that has left draft. {@code requestedState} then holds the operation name.
   */
  public static InvalidTransitionException forOperation(
      String entityType, Object entityId, Enum<?> currentState, String operation) {
    return new InvalidTransitionException(entityType, entityId, currentState.name(), operation);
  }

  private static ProblemDetail createProblem(
      String entityType, Object entityId, String currentState, String requestedState) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Invalid " + entityType.toLowerCase() + " transition");
    problem.setDetail(
        "Cannot move "
            + entityType.toLowerCase()
            + " "
            + entityId
            + " from "
            + currentState
            + " to "
            + requestedState);
    problem.setProperty("entityType", entityType);
    problem.setProperty("entityId", String.valueOf(entityId));
    problem.setProperty("currentState", currentState);
    problem.setProperty("requestedState", requestedState);
    return problem;
  }

  public String getEntityType() {
    return entityType;
  }

  public Object getEntityId() {
    return entityId;
  }

  public String getCurrentState() {
    return currentState;
  }

  public String getRequestedState() {
    return requestedState;
  }
}
