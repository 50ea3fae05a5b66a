package io.b2mash.b2b.mailprovisioning.emailaccount;

import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A create request failed local validation. Rendered as a problem detail whose {@code code}
 * property is the {@link RejectionReason#code()}. Nothing was written and no job was enqueued.
 */
public class EmailAccountRejectedException extends ErrorResponseException {

  private final RejectionReason reason;

  public EmailAccountRejectedException(RejectionReason reason, String detail) {
    super(reason.status(), createProblem(reason, detail), null);
    this.reason = reason;
  }

  public RejectionReason getReason() {
    return reason;
  }

  private static ProblemDetail createProblem(RejectionReason reason, String detail) {
    var problem = ProblemDetail.forStatus(reason.status());
    problem.setTitle(reason.title());
    problem.setDetail(detail);
    problem.setProperty("code", reason.code());
    return problem;
  }
}
