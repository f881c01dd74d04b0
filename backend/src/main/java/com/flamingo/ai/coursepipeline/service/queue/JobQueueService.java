package com.flamingo.ai.coursepipeline.service.queue;

import com.flamingo.ai.coursepipeline.domain.entity.QueuedJob;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.exception.DuplicateJobException;
import java.util.List;
import java.util.Optional;

/**
 * Durable, priority-ordered work queue with per-job retry bookkeeping.
 *
 * <p>A job holds its dedupe key from enqueue until it completes or fails for good; while it does,
 * no second job with the same key can be enqueued. Failed attempts are retried with exponential
 * backoff until the attempt limit is reached.
 */
public interface JobQueueService {

  /**
   * Adds a job to the queue and creates its job tracker record.
   *
   * @param jobType type of work
   * @param payload job data
   * @param dedupeKey deterministic key of the work, e.g. {@code extract-<materialId>}
   * @param priority lower runs first
   * @return handle of the new job
   * @throws DuplicateJobException if a waiting, delayed or active job holds the same key
   */
  JobHandle enqueue(JobType jobType, JobPayload payload, String dedupeKey, int priority);

  /** Whether a job of the type is due to run. */
  boolean hasClaimable(JobType jobType);

  /**
   * Claims the next due job of a type and counts the attempt.
   *
   * @return the claimed job, now active and leased, or empty if none is due
   */
  Optional<QueuedJob> claimNext(JobType jobType);

  /** Persists the last reported progress of an active job and extends its lease. */
  void updateProgress(String jobId, int progress);

  void complete(String jobId);

  /**
   * Records a failed attempt.
   *
   * @param retryable {@code false} fails the job immediately regardless of remaining attempts
   * @return whether a retry was scheduled
   */
  FailureOutcome fail(String jobId, String reason, boolean retryable);

  /**
   * Fails the waiting or delayed job holding a dedupe key so the key can be used again. An active
   * job is left to finish.
   *
   * @return id of the cancelled job, or empty if no queued job held the key
   */
  Optional<String> cancelQueued(String dedupeKey, String reason);

  /** Takes back active jobs whose lease expired. */
  List<StalledJob> recoverStalled();

  Optional<QueuedJob> findJob(String jobId);

  QueueStats stats(JobType jobType);
}
