package com.flamingo.ai.coursepipeline.api.dto.response;

import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.service.queue.QueueStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for per-type queue counts. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatsResponse {

  private JobType jobType;
  private long waiting;
  private long active;
  private long completed;
  private long failed;
  private long delayed;
  private boolean paused;

  public static QueueStatsResponse from(QueueStats stats) {
    return QueueStatsResponse.builder()
        .jobType(stats.jobType())
        .waiting(stats.waiting())
        .active(stats.active())
        .completed(stats.completed())
        .failed(stats.failed())
        .delayed(stats.delayed())
        .paused(stats.paused())
        .build();
  }
}
