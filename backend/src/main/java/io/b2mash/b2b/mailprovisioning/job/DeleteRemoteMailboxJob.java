package io.b2mash.b2b.mailprovisioning.job;

/**
 * Best-effort remote delete. Carries only the address and provider because the local row is gone
 * by the time it runs.
 */
public record DeleteRemoteMailboxJob(String emailAddress, String provider) implements AsyncJob {

  @Override
  public String jobName() {
    return "email_account.delete_remote";
  }
}
