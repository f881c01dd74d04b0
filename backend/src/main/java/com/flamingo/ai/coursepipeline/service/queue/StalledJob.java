package com.flamingo.ai.coursepipeline.service.queue;

import com.flamingo.ai.coursepipeline.domain.entity.QueuedJob;

/**
 * An active job whose lease expired and that the queue has taken back.
 *
 * @param job the job after recovery
 * @param outcome whether it was returned to waiting or failed for good
 */
public record StalledJob(QueuedJob job, FailureOutcome outcome) {}
