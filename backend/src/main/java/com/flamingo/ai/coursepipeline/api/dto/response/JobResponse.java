package com.flamingo.ai.coursepipeline.api.dto.response;

import com.flamingo.ai.coursepipeline.domain.entity.JobRecord;
import com.flamingo.ai.coursepipeline.domain.entity.QueuedJob;
import com.flamingo.ai.coursepipeline.domain.enums.EntityType;
import com.flamingo.ai.coursepipeline.domain.enums.JobStatus;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.domain.enums.QueueState;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a job. Combines the tracker record with the queue's view of the job when the
 * queue still holds it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

  private String id;
  private JobType jobType;
  private EntityType entityType;
  private UUID entityId;
  private JobStatus status;
  private int progress;
  private String errorMessage;

  /** Queue state; null once the queue no longer knows the job. */
  private QueueState queueState;

  private Integer attemptsMade;
  private Integer maxAttempts;
  private LocalDateTime nextRunAt;
  private LocalDateTime createdAt;
  private LocalDateTime startedAt;
  private LocalDateTime completedAt;

  public static JobResponse fromRecord(JobRecord record) {
    return JobResponse.builder()
        .id(record.getId())
        .jobType(record.getJobType())
        .entityType(record.getEntityType())
        .entityId(record.getEntityId())
        .status(record.getStatus())
        .progress(record.getProgress())
        .errorMessage(record.getErrorMessage())
        .createdAt(record.getCreatedAt())
        .startedAt(record.getStartedAt())
        .completedAt(record.getCompletedAt())
        .build();
  }

  /** Adds the queue-side state to a response built from the tracker record. */
  public JobResponse withQueueState(QueuedJob job) {
    this.queueState = job.getState();
    this.attemptsMade = job.getAttemptsMade();
    this.maxAttempts = job.getMaxAttempts();
    this.nextRunAt = job.getNextRunAt();
    if (errorMessage == null) {
      this.errorMessage = job.getFailedReason();
    }
    return this;
  }
}
