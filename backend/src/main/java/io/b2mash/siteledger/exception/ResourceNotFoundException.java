package io.b2mash.siteledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** No live (non-deleted) record exists for the requested id. */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;
  private final Object resourceId;

  public ResourceNotFoundException(String resourceType, Object id) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType, id), null);
    this.resourceType = resourceType;
    this.resourceId = id;
  }

  private static ProblemDetail createProblem(String resourceType, Object id) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail("No " + resourceType.toLowerCase() + " found with id " + id);
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("resourceId", String.valueOf(id));
    return problem;
  }

  public String getResourceType() {
    return resourceType;
  }

  public Object getResourceId() {
    return resourceId;
  }
}
