package com.flamingo.ai.coursepipeline.domain.repository;

import com.flamingo.ai.coursepipeline.domain.entity.JobRecord;
import com.flamingo.ai.coursepipeline.domain.enums.EntityType;
import com.flamingo.ai.coursepipeline.domain.enums.JobStatus;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for job audit records. */
@Repository
public interface JobRecordRepository extends JpaRepository<JobRecord, String> {

  /** Finds the jobs that targeted an entity, newest first. */
  List<JobRecord> findByEntityTypeAndEntityIdOrderByCreatedAtDesc(
      EntityType entityType, UUID entityId);

  /** Finds jobs of a type in a status, oldest first. */
  List<JobRecord> findByJobTypeAndStatusOrderByCreatedAtAsc(
      JobType jobType, JobStatus status, Pageable pageable);
}
