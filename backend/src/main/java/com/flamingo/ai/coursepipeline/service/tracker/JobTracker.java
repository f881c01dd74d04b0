package com.flamingo.ai.coursepipeline.service.tracker;

import com.flamingo.ai.coursepipeline.domain.entity.JobRecord;
import com.flamingo.ai.coursepipeline.domain.enums.EntityType;
import com.flamingo.ai.coursepipeline.domain.enums.JobStatus;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent audit trail of job lifecycles, kept separately from the queue's own state.
 *
 * <p>Records are created at enqueue time and afterwards only updated by the worker running the
 * job. They are never deleted by the pipeline.
 */
public interface JobTracker {

  /** Creates a pending record for a freshly enqueued job. */
  JobRecord recordEnqueued(String jobId, JobType jobType, EntityType entityType, UUID entityId);

  void markStarted(String jobId);

  void updateProgress(String jobId, int progress);

  void markCompleted(String jobId);

  /** Records a failed attempt that will be retried; the record returns to pending. */
  void markRetrying(String jobId, String errorMessage);

  /** Records terminal failure after retries are exhausted. */
  void markFailed(String jobId, String errorMessage);

  Optional<JobRecord> findById(String jobId);

  /** Jobs that targeted an entity, newest first. */
  List<JobRecord> findByEntity(EntityType entityType, UUID entityId);

  /** Jobs of a type in a status, oldest first, at most {@code limit}. */
  List<JobRecord> findByTypeAndStatus(JobType jobType, JobStatus status, int limit);
}
