package com.flamingo.ai.coursepipeline.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/** Queue-side state of a job, independent of the tracker's {@link JobStatus}. */
public enum QueueState {
  /** Ready to be claimed. */
  WAITING,

  /** Waiting for its retry backoff to elapse. */
  DELAYED,

  /** Claimed by a worker. */
  ACTIVE,

  COMPLETED,

  /** Retries exhausted; only a manual re-enqueue runs the work again. */
  FAILED;

  /** States in which the job still holds its dedupe key. */
  public static final Set<QueueState> LIVE = EnumSet.of(WAITING, DELAYED, ACTIVE);
}
