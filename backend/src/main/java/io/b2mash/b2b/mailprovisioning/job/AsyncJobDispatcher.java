package io.b2mash.b2b.mailprovisioning.job;

/**
 * Fire-and-forget job queue. Implementations deliver each job to its handler off the request path,
 * after the dispatching transaction commits.
 */
public interface AsyncJobDispatcher {

  void dispatch(AsyncJob job);
}
