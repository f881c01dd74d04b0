package com.flamingo.ai.coursepipeline.service.queue;

import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import java.util.function.IntConsumer;

/**
 * A claimed job handed to a {@link JobWorker}.
 *
 * @param <P> payload type
 */
public final class JobExecution<P extends JobPayload> {

  private final String jobId;
  private final JobType jobType;
  private final P payload;
  private final int attempt;
  private final int maxAttempts;
  private final IntConsumer progressSink;

  public JobExecution(
      String jobId,
      JobType jobType,
      P payload,
      int attempt,
      int maxAttempts,
      IntConsumer progressSink) {
    this.jobId = jobId;
    this.jobType = jobType;
    this.payload = payload;
    this.attempt = attempt;
    this.maxAttempts = maxAttempts;
    this.progressSink = progressSink;
  }

  public String getJobId() {
    return jobId;
  }

  public JobType getJobType() {
    return jobType;
  }

  public P getPayload() {
    return payload;
  }

  /** One-based number of the current attempt. */
  public int getAttempt() {
    return attempt;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  /** Persists progress (0-100) on the queue job and its tracker record. */
  public void reportProgress(int progress) {
    progressSink.accept(progress);
  }
}
