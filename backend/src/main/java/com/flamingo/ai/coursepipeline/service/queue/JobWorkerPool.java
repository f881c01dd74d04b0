package com.flamingo.ai.coursepipeline.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.coursepipeline.domain.entity.QueuedJob;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.service.tracker.JobTracker;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-size pool of workers pulling the jobs of one type from the queue.
 *
 * <p>At most {@code concurrency} jobs run at once. Every claim takes a permit from the rate
 * limiter first; when none is left the poll ends and due jobs stay queued until the next window.
 *
 * @param <P> payload type of the pool's jobs
 */
@Slf4j
public class JobWorkerPool<P extends JobPayload> {

  private final JobWorker<P> worker;
  private final JobQueueService jobQueue;
  private final JobTracker jobTracker;
  private final RateLimiter rateLimiter;
  private final ExecutorService executor;
  private final Semaphore slots;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final AtomicBoolean paused = new AtomicBoolean(false);

  public JobWorkerPool(
      JobWorker<P> worker,
      JobQueueService jobQueue,
      JobTracker jobTracker,
      RateLimiter rateLimiter,
      ExecutorService executor,
      int concurrency,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.worker = worker;
    this.jobQueue = jobQueue;
    this.jobTracker = jobTracker;
    this.rateLimiter = rateLimiter;
    this.executor = executor;
    this.slots = new Semaphore(concurrency);
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
  }

  public JobType getJobType() {
    return worker.getJobType();
  }

  /** Claims due jobs while workers are free and dispatches them to the executor. */
  public void poll() {
    while (!paused.get() && slots.tryAcquire()) {
      Optional<QueuedJob> claimed;
      try {
        claimed = claimWithinRateLimit();
      } catch (RuntimeException e) {
        slots.release();
        log.error("Polling {} queue failed: {}", getJobType(), e.getMessage(), e);
        return;
      }
      if (claimed.isEmpty()) {
        slots.release();
        return;
      }
      QueuedJob job = claimed.get();
      try {
        executor.execute(
            () -> {
              try {
                run(job);
              } finally {
                slots.release();
              }
            });
      } catch (RejectedExecutionException e) {
        slots.release();
        handOffFailed(job, e);
        return;
      }
    }
  }

  private void handOffFailed(QueuedJob job, RejectedExecutionException e) {
    String jobId = job.getId();
    String reason = "Worker pool rejected the job: " + describe(e);
    log.warn("{} job {} could not be handed to a worker: {}", getJobType(), jobId, reason);
    FailureOutcome outcome = jobQueue.fail(jobId, reason, true);
    if (outcome == FailureOutcome.RETRY_SCHEDULED) {
      jobTracker.markRetrying(jobId, reason);
    } else {
      jobTracker.markFailed(jobId, reason);
      job.setFailedReason(reason);
      handleExhausted(job);
    }
  }

  @VisibleForTesting
  int availableSlots() {
    return slots.availablePermits();
  }

  /**
   * Claims and runs one due job on the calling thread.
   *
   * @return {@code true} if a job was run
   */
  public boolean processNext() {
    if (paused.get()) {
      return false;
    }
    Optional<QueuedJob> claimed = claimWithinRateLimit();
    claimed.ifPresent(this::run);
    return claimed.isPresent();
  }

  private Optional<QueuedJob> claimWithinRateLimit() {
    if (!jobQueue.hasClaimable(getJobType())) {
      return Optional.empty();
    }
    if (!rateLimiter.acquirePermission()) {
      log.debug("{} queue rate limit reached, jobs wait for the next window", getJobType());
      meterRegistry.counter("pipeline.jobs.rate_limited", "type", getJobType().name()).increment();
      return Optional.empty();
    }
    return jobQueue.claimNext(getJobType());
  }

  private void run(QueuedJob job) {
    String jobId = job.getId();
    P payload;
    try {
      payload = objectMapper.readValue(job.getPayload(), worker.getPayloadType());
    } catch (Exception e) {
      log.error("Unreadable payload for job {}: {}", jobId, e.getMessage());
      jobQueue.fail(jobId, "Unreadable job payload: " + e.getMessage(), false);
      jobTracker.markFailed(jobId, "Unreadable job payload");
      return;
    }

    JobExecution<P> execution =
        new JobExecution<>(
            jobId,
            getJobType(),
            payload,
            job.getAttemptsMade(),
            job.getMaxAttempts(),
            progress -> {
              jobQueue.updateProgress(jobId, progress);
              jobTracker.updateProgress(jobId, progress);
            });

    jobTracker.markStarted(jobId);
    try {
      worker.process(execution);
      jobQueue.complete(jobId);
      jobTracker.markCompleted(jobId);
    } catch (Exception e) {
      String reason = describe(e);
      FailureOutcome outcome = jobQueue.fail(jobId, reason, true);
      if (outcome == FailureOutcome.RETRY_SCHEDULED) {
        jobTracker.markRetrying(jobId, reason);
      } else {
        jobTracker.markFailed(jobId, reason);
        notifyExhausted(execution, reason);
      }
    }
  }

  /** Runs the worker's exhaustion hook for a job the queue failed outside a worker thread. */
  void handleExhausted(QueuedJob job) {
    try {
      P payload = objectMapper.readValue(job.getPayload(), worker.getPayloadType());
      notifyExhausted(
          new JobExecution<>(
              job.getId(),
              getJobType(),
              payload,
              job.getAttemptsMade(),
              job.getMaxAttempts(),
              progress -> {}),
          job.getFailedReason());
    } catch (Exception e) {
      log.error("Cannot run failure handling for job {}: {}", job.getId(), e.getMessage(), e);
    }
  }

  private void notifyExhausted(JobExecution<P> execution, String reason) {
    try {
      worker.onExhausted(execution, reason);
    } catch (Exception e) {
      log.error(
          "Failure handling for {} job {} threw: {}",
          getJobType(),
          execution.getJobId(),
          e.getMessage(),
          e);
    }
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  public void pause() {
    if (!paused.getAndSet(true)) {
      log.info("{} worker pool paused", getJobType());
    }
  }

  public void resume() {
    if (paused.getAndSet(false)) {
      log.info("{} worker pool resumed", getJobType());
    }
  }

  public boolean isPaused() {
    return paused.get();
  }

  void shutdown() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("{} workers still running after 30s, interrupting", getJobType());
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
