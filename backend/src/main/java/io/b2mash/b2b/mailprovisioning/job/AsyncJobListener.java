package io.b2mash.b2b.mailprovisioning.job;

import io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccountProvisioner;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Dispatch table for {@link AsyncJob}s. Each handler runs on the async executor once the
 * publishing transaction has committed (or immediately when there was none), so the job always
 * sees the committed account row.
 */
@Component
public class AsyncJobListener {

  static final String MDC_ACCOUNT_ID = "emailAccountId";
  static final String MDC_JOB = "job";

  private final EmailAccountProvisioner provisioner;

  public AsyncJobListener(EmailAccountProvisioner provisioner) {
    this.provisioner = provisioner;
  }

  @Async
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onProvision(ProvisionEmailAccountJob job) {
    try {
      MDC.put(MDC_JOB, job.jobName());
      MDC.put(MDC_ACCOUNT_ID, String.valueOf(job.accountId()));
      provisioner.provision(job);
    } finally {
      MDC.remove(MDC_ACCOUNT_ID);
      MDC.remove(MDC_JOB);
    }
  }

  @Async
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onDeleteRemote(DeleteRemoteMailboxJob job) {
    try {
      MDC.put(MDC_JOB, job.jobName());
      provisioner.deleteRemote(job);
    } finally {
      MDC.remove(MDC_JOB);
    }
  }

  @Async
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onChangePassword(ChangeMailboxPasswordJob job) {
    try {
      MDC.put(MDC_JOB, job.jobName());
      MDC.put(MDC_ACCOUNT_ID, String.valueOf(job.accountId()));
      provisioner.changePassword(job);
    } finally {
      MDC.remove(MDC_ACCOUNT_ID);
      MDC.remove(MDC_JOB);
    }
  }
}
