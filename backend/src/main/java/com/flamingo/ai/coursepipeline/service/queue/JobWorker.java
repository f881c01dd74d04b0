package com.flamingo.ai.coursepipeline.service.queue;

import com.flamingo.ai.coursepipeline.domain.enums.JobType;

/**
 * Processes the jobs of one {@link JobType}.
 *
 * @param <P> payload type of the jobs
 */
public interface JobWorker<P extends JobPayload> {

  JobType getJobType();

  Class<P> getPayloadType();

  /**
   * Runs one attempt of a job. Throwing fails the attempt; the queue retries it until the attempt
   * limit is reached.
   *
   * @param execution the job being run
   */
  void process(JobExecution<P> execution) throws Exception;

  /**
   * Called once after the last attempt of a job failed, to record the failure on the target
   * entity. The default does nothing.
   *
   * @param execution the failed job
   * @param errorMessage message of the last failure
   */
  default void onExhausted(JobExecution<P> execution, String errorMessage) {}
}
