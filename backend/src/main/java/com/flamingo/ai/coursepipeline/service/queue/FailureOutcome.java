package com.flamingo.ai.coursepipeline.service.queue;

/** What the queue did with a job whose attempt failed. */
public enum FailureOutcome {
  /** Another attempt is scheduled after the backoff delay. */
  RETRY_SCHEDULED,

  /** No attempts remain; the job is terminally failed. */
  EXHAUSTED
}
