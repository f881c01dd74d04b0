package com.flamingo.ai.coursepipeline.service.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import com.flamingo.ai.coursepipeline.domain.entity.QueuedJob;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.domain.enums.QueueState;
import com.flamingo.ai.coursepipeline.domain.repository.QueuedJobRepository;
import com.flamingo.ai.coursepipeline.exception.DuplicateJobException;
import com.flamingo.ai.coursepipeline.service.tracker.JobTracker;
import com.google.common.util.concurrent.Striped;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link JobQueueService} stored in the {@code job_queue} table.
 *
 * <p>Dedupe is enforced twice: a striped in-process lock serializes enqueues of the same key, and
 * the unique {@code activeDedupeKey} column rejects a concurrent insert from another process.
 * Claims use optimistic locking, so two pollers never run the same job.
 */
@Service
@Slf4j
public class JobQueueServiceImpl implements JobQueueService {

  private static final Set<QueueState> CLAIMABLE =
      EnumSet.of(QueueState.WAITING, QueueState.DELAYED);
  private static final int CLAIM_BATCH = 5;

  private final QueuedJobRepository queuedJobRepository;
  private final JobTracker jobTracker;
  private final PipelineConfig pipelineConfig;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate transactionTemplate;

  private final Striped<Lock> dedupeLocks = Striped.lazyWeakLock(64);

  public JobQueueServiceImpl(
      QueuedJobRepository queuedJobRepository,
      JobTracker jobTracker,
      PipelineConfig pipelineConfig,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.queuedJobRepository = queuedJobRepository;
    this.jobTracker = jobTracker;
    this.pipelineConfig = pipelineConfig;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  @Override
  public JobHandle enqueue(JobType jobType, JobPayload payload, String dedupeKey, int priority) {
    String serialized = serialize(payload);
    PipelineConfig.Retry retry = pipelineConfig.getQueue().getRetry();

    Lock lock = dedupeLocks.get(dedupeKey);
    lock.lock();
    try {
      JobHandle handle =
          transactionTemplate.execute(
              status -> {
                queuedJobRepository
                    .findByActiveDedupeKey(dedupeKey)
                    .ifPresent(
                        existing -> {
                          throw new DuplicateJobException(dedupeKey, existing.getId());
                        });

                String jobId = jobType.getKeyPrefix() + "-" + UUID.randomUUID();
                QueuedJob job =
                    QueuedJob.builder()
                        .id(jobId)
                        .jobType(jobType)
                        .payload(serialized)
                        .dedupeKey(dedupeKey)
                        .activeDedupeKey(dedupeKey)
                        .priority(priority)
                        .state(QueueState.WAITING)
                        .maxAttempts(Math.max(1, retry.getAttempts()))
                        .initialBackoffMillis(retry.getInitialBackoff().toMillis())
                        .build();
                queuedJobRepository.saveAndFlush(job);
                jobTracker.recordEnqueued(
                    jobId, jobType, payload.entityType(), payload.entityId());
                return new JobHandle(jobId, jobType, dedupeKey);
              });

      meterRegistry.counter("pipeline.jobs.enqueued", "type", jobType.name()).increment();
      log.info(
          "Enqueued {} job {} (key={}, priority={})",
          jobType,
          handle.jobId(),
          dedupeKey,
          priority);
      return handle;
    } catch (DataIntegrityViolationException e) {
      // Another process inserted a live job with the same key between our check and insert
      String existingId =
          queuedJobRepository.findByActiveDedupeKey(dedupeKey).map(QueuedJob::getId).orElse(null);
      log.warn("Concurrent enqueue rejected for key {}", dedupeKey);
      throw new DuplicateJobException(dedupeKey, existingId);
    } finally {
      lock.unlock();
    }
  }

  @Override
  @Transactional(readOnly = true)
  public boolean hasClaimable(JobType jobType) {
    return queuedJobRepository.existsByJobTypeAndStateInAndNextRunAtLessThanEqual(
        jobType, CLAIMABLE, LocalDateTime.now());
  }

  @Override
  public Optional<QueuedJob> claimNext(JobType jobType) {
    LocalDateTime now = LocalDateTime.now();
    List<String> candidateIds =
        transactionTemplate.execute(
            status ->
                queuedJobRepository
                    .findClaimable(jobType, CLAIMABLE, now, PageRequest.of(0, CLAIM_BATCH))
                    .stream()
                    .map(QueuedJob::getId)
                    .toList());
    if (candidateIds == null) {
      return Optional.empty();
    }

    for (String jobId : candidateIds) {
      try {
        QueuedJob claimed = transactionTemplate.execute(status -> claim(jobId, now));
        if (claimed != null) {
          log.debug(
              "Claimed {} job {} (attempt {}/{})",
              jobType,
              jobId,
              claimed.getAttemptsMade(),
              claimed.getMaxAttempts());
          return Optional.of(claimed);
        }
      } catch (ObjectOptimisticLockingFailureException | CannotAcquireLockException e) {
        log.debug("Job {} was claimed concurrently, trying next candidate", jobId);
      }
    }
    return Optional.empty();
  }

  private QueuedJob claim(String jobId, LocalDateTime now) {
    QueuedJob job = queuedJobRepository.findById(jobId).orElse(null);
    if (job == null || !CLAIMABLE.contains(job.getState()) || job.getNextRunAt().isAfter(now)) {
      return null;
    }
    job.setState(QueueState.ACTIVE);
    job.setAttemptsMade(job.getAttemptsMade() + 1);
    job.setStartedAt(now);
    job.setLockedUntil(now.plus(pipelineConfig.getQueue().getLeaseDuration()));
    return queuedJobRepository.saveAndFlush(job);
  }

  @Override
  @Transactional
  public void updateProgress(String jobId, int progress) {
    queuedJobRepository
        .findById(jobId)
        .filter(job -> job.getState() == QueueState.ACTIVE)
        .ifPresent(
            job -> {
              job.setProgress(Math.max(0, Math.min(100, progress)));
              job.setLockedUntil(
                  LocalDateTime.now().plus(pipelineConfig.getQueue().getLeaseDuration()));
              queuedJobRepository.save(job);
            });
  }

  @Override
  @Transactional
  public void complete(String jobId) {
    QueuedJob job = require(jobId);
    job.setState(QueueState.COMPLETED);
    job.setProgress(100);
    job.setActiveDedupeKey(null);
    job.setLockedUntil(null);
    job.setFinishedAt(LocalDateTime.now());
    queuedJobRepository.save(job);
    meterRegistry.counter("pipeline.jobs.completed", "type", job.getJobType().name()).increment();
    log.info("{} job {} completed", job.getJobType(), jobId);
  }

  @Override
  @Transactional
  public FailureOutcome fail(String jobId, String reason, boolean retryable) {
    QueuedJob job = require(jobId);
    FailureOutcome outcome = applyFailure(job, reason, retryable);
    queuedJobRepository.save(job);
    return outcome;
  }

  private FailureOutcome applyFailure(QueuedJob job, String reason, boolean retryable) {
    LocalDateTime now = LocalDateTime.now();
    job.setFailedReason(reason);
    job.setLockedUntil(null);

    if (retryable && job.hasAttemptsLeft()) {
      Duration delay = backoffFor(job);
      job.setState(delay.isZero() ? QueueState.WAITING : QueueState.DELAYED);
      job.setNextRunAt(now.plus(delay));
      meterRegistry.counter("pipeline.jobs.retried", "type", job.getJobType().name()).increment();
      log.warn(
          "{} job {} attempt {}/{} failed, retrying in {}: {}",
          job.getJobType(),
          job.getId(),
          job.getAttemptsMade(),
          job.getMaxAttempts(),
          delay,
          reason);
      return FailureOutcome.RETRY_SCHEDULED;
    }

    job.setState(QueueState.FAILED);
    job.setActiveDedupeKey(null);
    job.setFinishedAt(now);
    meterRegistry.counter("pipeline.jobs.failed", "type", job.getJobType().name()).increment();
    log.error(
        "{} job {} failed after {} attempt(s): {}",
        job.getJobType(),
        job.getId(),
        job.getAttemptsMade(),
        reason);
    return FailureOutcome.EXHAUSTED;
  }

  /** Exponential backoff: the initial delay doubled for each attempt after the first. */
  static Duration backoffFor(QueuedJob job) {
    int exponent = Math.max(0, job.getAttemptsMade() - 1);
    return Duration.ofMillis(job.getInitialBackoffMillis() * (1L << Math.min(exponent, 20)));
  }

  @Override
  public Optional<String> cancelQueued(String dedupeKey, String reason) {
    Lock lock = dedupeLocks.get(dedupeKey);
    lock.lock();
    try {
      Optional<QueuedJob> cancelled =
          transactionTemplate.execute(
              status -> {
                Optional<QueuedJob> queued =
                    queuedJobRepository
                        .findByActiveDedupeKey(dedupeKey)
                        .filter(job -> CLAIMABLE.contains(job.getState()));
                queued.ifPresent(
                    job -> {
                      job.setState(QueueState.FAILED);
                      job.setFailedReason(reason);
                      job.setActiveDedupeKey(null);
                      job.setFinishedAt(LocalDateTime.now());
                      queuedJobRepository.save(job);
                      jobTracker.markFailed(job.getId(), reason);
                    });
                return queued;
              });
      if (cancelled == null || cancelled.isEmpty()) {
        return Optional.empty();
      }
      QueuedJob job = cancelled.get();
      meterRegistry.counter("pipeline.jobs.cancelled", "type", job.getJobType().name()).increment();
      log.info(
          "Cancelled queued {} job {} (key={}): {}",
          job.getJobType(),
          job.getId(),
          dedupeKey,
          reason);
      return Optional.of(job.getId());
    } finally {
      lock.unlock();
    }
  }

  @Override
  @Transactional
  public List<StalledJob> recoverStalled() {
    List<StalledJob> recovered = new ArrayList<>();
    for (QueuedJob job :
        queuedJobRepository.findByStateAndLockedUntilBefore(
            QueueState.ACTIVE, LocalDateTime.now())) {
      FailureOutcome outcome = applyFailure(job, "Job stalled: worker lease expired", true);
      queuedJobRepository.save(job);
      recovered.add(new StalledJob(job, outcome));
    }
    if (!recovered.isEmpty()) {
      log.warn("Recovered {} stalled job(s)", recovered.size());
    }
    return recovered;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<QueuedJob> findJob(String jobId) {
    return queuedJobRepository.findById(jobId);
  }

  @Override
  @Transactional(readOnly = true)
  public QueueStats stats(JobType jobType) {
    return new QueueStats(
        jobType,
        queuedJobRepository.countByJobTypeAndState(jobType, QueueState.WAITING),
        queuedJobRepository.countByJobTypeAndState(jobType, QueueState.ACTIVE),
        queuedJobRepository.countByJobTypeAndState(jobType, QueueState.COMPLETED),
        queuedJobRepository.countByJobTypeAndState(jobType, QueueState.FAILED),
        queuedJobRepository.countByJobTypeAndState(jobType, QueueState.DELAYED),
        false);
  }

  private QueuedJob require(String jobId) {
    return queuedJobRepository
        .findById(jobId)
        .orElseThrow(() -> new IllegalStateException("Queued job not found: " + jobId));
  }

  private String serialize(JobPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Job payload is not serializable: " + e.getMessage(), e);
    }
  }
}
