package com.flamingo.ai.coursepipeline.domain.repository;

import com.flamingo.ai.coursepipeline.domain.entity.QueuedJob;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.domain.enums.QueueState;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for the durable job queue. */
@Repository
public interface QueuedJobRepository extends JpaRepository<QueuedJob, String> {

  /** Finds the live job holding a dedupe key, if any. */
  Optional<QueuedJob> findByActiveDedupeKey(String activeDedupeKey);

  /** Finds claimable jobs of a type: due, highest priority first, then oldest. */
  @Query(
      "SELECT j FROM QueuedJob j WHERE j.jobType = :jobType AND j.state IN :states "
          + "AND j.nextRunAt <= :now ORDER BY j.priority ASC, j.createdAt ASC")
  List<QueuedJob> findClaimable(
      @Param("jobType") JobType jobType,
      @Param("states") Collection<QueueState> states,
      @Param("now") LocalDateTime now,
      Pageable pageable);

  /** Whether any job of a type is due to be claimed. */
  boolean existsByJobTypeAndStateInAndNextRunAtLessThanEqual(
      JobType jobType, Collection<QueueState> states, LocalDateTime now);

  /** Finds active jobs whose worker lease has expired. */
  List<QueuedJob> findByStateAndLockedUntilBefore(QueueState state, LocalDateTime now);

  /** Counts jobs of a type in a state. */
  long countByJobTypeAndState(JobType jobType, QueueState state);
}
