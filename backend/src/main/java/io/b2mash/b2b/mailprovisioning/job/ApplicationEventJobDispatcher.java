package io.b2mash.b2b.mailprovisioning.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * In-process dispatcher: publishes the job as an application event, picked up after commit by
 * {@link AsyncJobListener} on the async task executor. Jobs are not persisted; a crash before
 * delivery loses them.
 */
@Component
public class ApplicationEventJobDispatcher implements AsyncJobDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ApplicationEventJobDispatcher.class);

  private final ApplicationEventPublisher eventPublisher;

  public ApplicationEventJobDispatcher(ApplicationEventPublisher eventPublisher) {
    this.eventPublisher = eventPublisher;
  }

  @Override
  public void dispatch(AsyncJob job) {
    log.debug("Enqueuing {}: {}", job.jobName(), job);
    eventPublisher.publishEvent(job);
  }
}
