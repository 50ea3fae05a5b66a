package io.b2mash.b2b.mailprovisioning.job;

import java.util.UUID;

public record ProvisionEmailAccountJob(UUID accountId) implements AsyncJob {

  @Override
  public String jobName() {
    return "email_account.provision";
  }
}
