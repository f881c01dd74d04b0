package com.flamingo.ai.coursepipeline.service.queue;

import com.flamingo.ai.coursepipeline.domain.enums.JobType;

/** Job counts of one queue by state. */
public record QueueStats(
    JobType jobType,
    long waiting,
    long active,
    long completed,
    long failed,
    long delayed,
    boolean paused) {

  public QueueStats withPaused(boolean isPaused) {
    return new QueueStats(jobType, waiting, active, completed, failed, delayed, isPaused);
  }
}
