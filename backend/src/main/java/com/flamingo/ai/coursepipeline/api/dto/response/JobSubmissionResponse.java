package com.flamingo.ai.coursepipeline.api.dto.response;

import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.service.queue.JobHandle;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a queued job. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmissionResponse {

  private String jobId;
  private JobType jobType;
  private String dedupeKey;

  public static JobSubmissionResponse from(JobHandle handle) {
    return new JobSubmissionResponse(handle.jobId(), handle.jobType(), handle.dedupeKey());
  }
}
