package com.flamingo.ai.coursepipeline.service.pipeline;

import com.flamingo.ai.coursepipeline.service.notification.ProgressEmitter;
import com.flamingo.ai.coursepipeline.service.queue.JobExecution;
import com.flamingo.ai.coursepipeline.service.queue.JobPayload;
import com.flamingo.ai.coursepipeline.service.queue.JobWorker;
import java.util.Map;
import java.util.UUID;

/**
 * Base class for workers that process one material per job.
 *
 * <p>Provides stage reporting that persists the job's progress and notifies the course owner in a
 * single call.
 *
 * @param <P> payload type
 */
public abstract class AbstractMaterialJobWorker<P extends JobPayload> implements JobWorker<P> {

  protected final ProgressEmitter progressEmitter;

  protected AbstractMaterialJobWorker(ProgressEmitter progressEmitter) {
    this.progressEmitter = progressEmitter;
  }

  protected void reportStage(
      JobExecution<P> execution, UUID userId, int percentage, String stage) {
    reportStage(execution, userId, percentage, stage, Map.of());
  }

  protected void reportStage(
      JobExecution<P> execution,
      UUID userId,
      int percentage,
      String stage,
      Map<String, Object> metadata) {
    execution.reportProgress(percentage);
    progressEmitter.emitProgress(userId, execution.getJobId(), percentage, stage, metadata);
  }
}
