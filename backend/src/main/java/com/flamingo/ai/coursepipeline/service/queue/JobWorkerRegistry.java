package com.flamingo.ai.coursepipeline.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.service.tracker.JobTracker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Holds one {@link JobWorkerPool} per job type and drives their polling.
 *
 * <p>Pools are built from the {@link JobWorker} beans and the per-type queue settings. When {@code
 * pipeline.workers.enabled} is false nothing is scheduled and jobs only run through {@link
 * #processNext(JobType)}.
 */
@Component
@Slf4j
public class JobWorkerRegistry {

  private static final Duration STALLED_CHECK_INTERVAL = Duration.ofSeconds(30);

  private final Map<JobType, JobWorkerPool<?>> pools = new EnumMap<>(JobType.class);
  private final JobQueueService jobQueue;
  private final PipelineConfig pipelineConfig;
  private ThreadPoolTaskScheduler scheduler;

  public JobWorkerRegistry(
      List<JobWorker<?>> workers,
      JobQueueService jobQueue,
      JobTracker jobTracker,
      PipelineConfig pipelineConfig,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.jobQueue = jobQueue;
    this.pipelineConfig = pipelineConfig;
    for (JobWorker<?> worker : workers) {
      PipelineConfig.JobQueue settings = pipelineConfig.getQueue().forType(worker.getJobType());
      pools.put(
          worker.getJobType(),
          createPool(worker, settings, jobTracker, objectMapper, meterRegistry));
    }
  }

  private <P extends JobPayload> JobWorkerPool<P> createPool(
      JobWorker<P> worker,
      PipelineConfig.JobQueue settings,
      JobTracker jobTracker,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    String name = worker.getJobType().getKeyPrefix();
    RateLimiter rateLimiter =
        RateLimiter.of(
            name + "-jobs",
            RateLimiterConfig.custom()
                .limitForPeriod(settings.getRateLimit().getMaxJobs())
                .limitRefreshPeriod(settings.getRateLimit().getWindow())
                .timeoutDuration(Duration.ZERO)
                .build());
    int concurrency = Math.max(1, settings.getConcurrency());
    log.info(
        "{} worker pool: concurrency={}, rate limit={} jobs per {}",
        worker.getJobType(),
        concurrency,
        settings.getRateLimit().getMaxJobs(),
        settings.getRateLimit().getWindow());
    return new JobWorkerPool<>(
        worker,
        jobQueue,
        jobTracker,
        rateLimiter,
        Executors.newFixedThreadPool(
            concurrency, new CustomizableThreadFactory(name + "-worker-")),
        concurrency,
        objectMapper,
        meterRegistry);
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    if (!pipelineConfig.getWorkers().isEnabled()) {
      log.info("Job workers disabled, queues will not be polled");
      return;
    }
    scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(pools.size() + 1);
    scheduler.setThreadNamePrefix("queue-poller-");
    scheduler.initialize();

    Duration pollInterval = pipelineConfig.getQueue().getPollInterval();
    for (JobWorkerPool<?> pool : pools.values()) {
      scheduler.scheduleWithFixedDelay(pool::poll, pollInterval);
    }
    scheduler.scheduleWithFixedDelay(this::recoverStalled, STALLED_CHECK_INTERVAL);
    log.info("Started {} worker pool(s), polling every {}", pools.size(), pollInterval);
  }

  /** Returns stalled jobs to the queue and runs failure handling for those out of attempts. */
  public int recoverStalled() {
    try {
      List<StalledJob> stalled = jobQueue.recoverStalled();
      for (StalledJob entry : stalled) {
        if (entry.outcome() == FailureOutcome.EXHAUSTED) {
          JobWorkerPool<?> pool = pools.get(entry.job().getJobType());
          if (pool != null) {
            pool.handleExhausted(entry.job());
          }
        }
      }
      return stalled.size();
    } catch (RuntimeException e) {
      log.error("Stalled job recovery failed: {}", e.getMessage(), e);
      return 0;
    }
  }

  /**
   * Claims and runs one due job of a type on the calling thread.
   *
   * @return {@code true} if a job ran
   */
  public boolean processNext(JobType jobType) {
    return pool(jobType).processNext();
  }

  /** Runs due jobs of a type until none is left, returning how many ran. */
  public int drain(JobType jobType) {
    int processed = 0;
    while (processNext(jobType)) {
      processed++;
    }
    return processed;
  }

  public void pause(JobType jobType) {
    pool(jobType).pause();
  }

  public void resume(JobType jobType) {
    pool(jobType).resume();
  }

  public QueueStats stats(JobType jobType) {
    return jobQueue.stats(jobType).withPaused(pool(jobType).isPaused());
  }

  private JobWorkerPool<?> pool(JobType jobType) {
    JobWorkerPool<?> pool = pools.get(jobType);
    if (pool == null) {
      throw new IllegalArgumentException("No worker registered for job type " + jobType);
    }
    return pool;
  }

  @PreDestroy
  public void stop() {
    if (scheduler != null) {
      scheduler.shutdown();
    }
    pools.values().forEach(JobWorkerPool::shutdown);
  }
}
