package com.flamingo.ai.coursepipeline.service.tracker;

import com.flamingo.ai.coursepipeline.domain.entity.JobRecord;
import com.flamingo.ai.coursepipeline.domain.enums.EntityType;
import com.flamingo.ai.coursepipeline.domain.enums.JobStatus;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.domain.repository.JobRecordRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** JPA-backed {@link JobTracker}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobTrackerImpl implements JobTracker {

  private final JobRecordRepository jobRecordRepository;

  @Override
  @Transactional
  public JobRecord recordEnqueued(
      String jobId, JobType jobType, EntityType entityType, UUID entityId) {
    JobRecord record =
        JobRecord.builder()
            .id(jobId)
            .jobType(jobType)
            .entityType(entityType)
            .entityId(entityId)
            .status(JobStatus.PENDING)
            .build();
    return jobRecordRepository.save(record);
  }

  @Override
  @Transactional
  public void markStarted(String jobId) {
    update(jobId, JobRecord::markStarted);
  }

  @Override
  @Transactional
  public void updateProgress(String jobId, int progress) {
    update(jobId, record -> record.setProgress(Math.max(0, Math.min(100, progress))));
  }

  @Override
  @Transactional
  public void markCompleted(String jobId) {
    update(jobId, JobRecord::markCompleted);
  }

  @Override
  @Transactional
  public void markRetrying(String jobId, String errorMessage) {
    update(jobId, record -> record.markRetrying(errorMessage));
  }

  @Override
  @Transactional
  public void markFailed(String jobId, String errorMessage) {
    update(jobId, record -> record.markFailed(errorMessage));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<JobRecord> findById(String jobId) {
    return jobRecordRepository.findById(jobId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<JobRecord> findByEntity(EntityType entityType, UUID entityId) {
    return jobRecordRepository.findByEntityTypeAndEntityIdOrderByCreatedAtDesc(
        entityType, entityId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<JobRecord> findByTypeAndStatus(JobType jobType, JobStatus status, int limit) {
    return jobRecordRepository.findByJobTypeAndStatusOrderByCreatedAtAsc(
        jobType, status, PageRequest.of(0, Math.max(1, limit)));
  }

  private void update(String jobId, Consumer<JobRecord> change) {
    jobRecordRepository
        .findById(jobId)
        .ifPresentOrElse(
            record -> {
              change.accept(record);
              jobRecordRepository.save(record);
            },
            () -> log.warn("No job record found for job {}", jobId));
  }
}
