package com.flamingo.ai.coursepipeline.domain.entity;

import com.flamingo.ai.coursepipeline.domain.enums.EntityType;
import com.flamingo.ai.coursepipeline.domain.enums.JobStatus;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Audit record of a job's lifecycle, kept apart from the queue's own bookkeeping and retained
 * indefinitely.
 */
@Entity
@Table(
    name = "job_metadata",
    indexes = @Index(name = "idx_job_metadata_entity", columnList = "entityType, entityId"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobRecord {

  /** Same value as the queue job id. */
  @Id private String id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private JobType jobType;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private EntityType entityType;

  @Column(nullable = false)
  private UUID entityId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private JobStatus status = JobStatus.PENDING;

  @Builder.Default private int progress = 0;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime startedAt;

  private LocalDateTime completedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  public void markStarted() {
    this.status = JobStatus.PROCESSING;
    this.startedAt = LocalDateTime.now();
  }

  public void markCompleted() {
    this.status = JobStatus.COMPLETED;
    this.progress = 100;
    this.errorMessage = null;
    this.completedAt = LocalDateTime.now();
  }

  public void markFailed(String errorMessage) {
    this.status = JobStatus.FAILED;
    this.errorMessage = errorMessage;
    this.completedAt = LocalDateTime.now();
  }

  /** Records a failed attempt that the queue will retry. */
  public void markRetrying(String errorMessage) {
    this.status = JobStatus.PENDING;
    this.errorMessage = errorMessage;
  }
}
