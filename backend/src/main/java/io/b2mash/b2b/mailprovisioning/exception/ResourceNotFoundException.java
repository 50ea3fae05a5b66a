package io.b2mash.b2b.mailprovisioning.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    this(
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id);
  }

  /** Unknown provider id in a path or request body. */
  public static ResourceNotFoundException provider(String providerId) {
    return new ResourceNotFoundException(
        "Email provider not found", "No email provider registered as '" + providerId + "'");
  }

  /** A one-time password token that is unknown, expired, used, or bound to another account. */
  public static ResourceNotFoundException passwordToken() {
    return new ResourceNotFoundException(
        "Password token not found", "The password token has expired or was already used");
  }

  private ResourceNotFoundException(String title, String detail) {
    super(HttpStatus.NOT_FOUND, problem(title, detail), null);
  }

  private static ProblemDetail problem(String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, detail);
    problem.setTitle(title);
    return problem;
  }
}
