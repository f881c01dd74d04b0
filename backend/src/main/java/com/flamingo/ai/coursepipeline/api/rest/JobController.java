package com.flamingo.ai.coursepipeline.api.rest;

import com.flamingo.ai.coursepipeline.api.dto.response.JobResponse;
import com.flamingo.ai.coursepipeline.api.dto.response.QueueStatsResponse;
import com.flamingo.ai.coursepipeline.domain.entity.JobRecord;
import com.flamingo.ai.coursepipeline.domain.entity.QueuedJob;
import com.flamingo.ai.coursepipeline.domain.enums.EntityType;
import com.flamingo.ai.coursepipeline.domain.enums.JobStatus;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.exception.JobNotFoundException;
import com.flamingo.ai.coursepipeline.service.queue.JobQueueService;
import com.flamingo.ai.coursepipeline.service.queue.JobWorkerRegistry;
import com.flamingo.ai.coursepipeline.service.tracker.JobTracker;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for job status and queue administration. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class JobController {

  private final JobTracker jobTracker;
  private final JobQueueService jobQueue;
  private final JobWorkerRegistry workerRegistry;

  /** Gets a job's tracker record merged with its queue state. */
  @GetMapping("/jobs/{jobId}")
  public ResponseEntity<JobResponse> getJob(@PathVariable String jobId) {
    Optional<QueuedJob> queued = jobQueue.findJob(jobId);
    JobResponse response =
        jobTracker
            .findById(jobId)
            .map(JobResponse::fromRecord)
            .orElseThrow(() -> new JobNotFoundException(jobId));
    queued.ifPresent(response::withQueueState);
    return ResponseEntity.ok(response);
  }

  /** Lists the jobs that targeted an entity, newest first. */
  @GetMapping("/jobs")
  public ResponseEntity<List<JobResponse>> getJobsByEntity(
      @RequestParam EntityType entityType, @RequestParam UUID entityId) {
    return ResponseEntity.ok(toResponses(jobTracker.findByEntity(entityType, entityId)));
  }

  /** Lists jobs of a type in a status, oldest first. */
  @GetMapping("/queues/{jobType}/jobs")
  public ResponseEntity<List<JobResponse>> getJobsByStatus(
      @PathVariable JobType jobType,
      @RequestParam(defaultValue = "PENDING") JobStatus status,
      @RequestParam(defaultValue = "50") int limit) {
    return ResponseEntity.ok(
        toResponses(jobTracker.findByTypeAndStatus(jobType, status, Math.min(limit, 500))));
  }

  /** Gets the job counts of every queue. */
  @GetMapping("/queues")
  public ResponseEntity<List<QueueStatsResponse>> getAllQueueStats() {
    return ResponseEntity.ok(
        Arrays.stream(JobType.values())
            .map(workerRegistry::stats)
            .map(QueueStatsResponse::from)
            .toList());
  }

  @GetMapping("/queues/{jobType}")
  public ResponseEntity<QueueStatsResponse> getQueueStats(@PathVariable JobType jobType) {
    return ResponseEntity.ok(QueueStatsResponse.from(workerRegistry.stats(jobType)));
  }

  /** Stops the workers of a queue from claiming new jobs. Running jobs finish. */
  @PostMapping("/queues/{jobType}/pause")
  public ResponseEntity<QueueStatsResponse> pauseQueue(@PathVariable JobType jobType) {
    workerRegistry.pause(jobType);
    return ResponseEntity.ok(QueueStatsResponse.from(workerRegistry.stats(jobType)));
  }

  @PostMapping("/queues/{jobType}/resume")
  public ResponseEntity<QueueStatsResponse> resumeQueue(@PathVariable JobType jobType) {
    workerRegistry.resume(jobType);
    return ResponseEntity.ok(QueueStatsResponse.from(workerRegistry.stats(jobType)));
  }

  private List<JobResponse> toResponses(List<JobRecord> records) {
    return records.stream()
        .map(
            jobRecord -> {
              JobResponse response = JobResponse.fromRecord(jobRecord);
              jobQueue.findJob(jobRecord.getId()).ifPresent(response::withQueueState);
              return response;
            })
        .toList();
  }
}
