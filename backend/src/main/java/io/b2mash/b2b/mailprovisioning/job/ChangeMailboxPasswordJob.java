package io.b2mash.b2b.mailprovisioning.job;

import java.util.UUID;

/** The new password travels through the token store's handoff, never in the job itself. */
public record ChangeMailboxPasswordJob(UUID accountId) implements AsyncJob {

  @Override
  public String jobName() {
    return "email_account.change_password";
  }
}
