package com.flamingo.ai.coursepipeline.domain.entity;

import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.domain.enums.QueueState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A unit of work in the durable job queue.
 *
 * <p>{@link #activeDedupeKey} mirrors {@link #dedupeKey} while the job is live (waiting, delayed
 * or active) and is cleared when it reaches a terminal state. Its unique constraint is what makes
 * a second live job with the same key impossible, even across processes sharing the database.
 */
@Entity
@Table(
    name = "job_queue",
    indexes = @Index(name = "idx_job_queue_claim", columnList = "jobType, state, nextRunAt"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueuedJob {

  @Id private String id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private JobType jobType;

  /** JSON-serialized job payload. */
  @Column(nullable = false, columnDefinition = "TEXT")
  private String payload;

  @Column(nullable = false)
  private String dedupeKey;

  @Column(unique = true)
  private String activeDedupeKey;

  /** Lower value runs first. */
  private int priority;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private QueueState state = QueueState.WAITING;

  private int attemptsMade;

  private int maxAttempts;

  /** Backoff before the first retry; doubled on each further attempt. */
  private long initialBackoffMillis;

  private int progress;

  @Column(columnDefinition = "TEXT")
  private String failedReason;

  @Column(nullable = false)
  private LocalDateTime nextRunAt;

  /** Lease of the worker that claimed the job; an expired lease marks the job as stalled. */
  private LocalDateTime lockedUntil;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime startedAt;

  private LocalDateTime finishedAt;

  @Version private Long version;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    if (nextRunAt == null) {
      nextRunAt = createdAt;
    }
  }

  public boolean hasAttemptsLeft() {
    return attemptsMade < maxAttempts;
  }
}
