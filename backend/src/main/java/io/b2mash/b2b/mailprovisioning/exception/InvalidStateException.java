package io.b2mash.b2b.mailprovisioning.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when an email account is asked to move along an edge its lifecycle does not allow. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, problem(title, detail), null);
  }

  public static InvalidStateException transition(Object from, Object to) {
    return new InvalidStateException(
        "Invalid status transition", "Cannot transition email account from " + from + " to " + to);
  }

  private static ProblemDetail problem(String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
    problem.setTitle(title);
    return problem;
  }
}
