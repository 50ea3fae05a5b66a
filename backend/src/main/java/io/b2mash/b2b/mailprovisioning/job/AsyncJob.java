package io.b2mash.b2b.mailprovisioning.job;

/**
 * A unit of off-request work. Each job type has exactly one handler method in {@link
 * AsyncJobListener}; there is no name-based dispatch.
 */
public sealed interface AsyncJob
    permits ProvisionEmailAccountJob, DeleteRemoteMailboxJob, ChangeMailboxPasswordJob {

  String jobName();
}
