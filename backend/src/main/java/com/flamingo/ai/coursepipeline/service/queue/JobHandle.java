package com.flamingo.ai.coursepipeline.service.queue;

import com.flamingo.ai.coursepipeline.domain.enums.JobType;

/**
 * Reference to an enqueued job.
 *
 * @param jobId queue job id, also the job tracker record id
 * @param jobType type of the job
 * @param dedupeKey key that blocks a second live job for the same work
 */
public record JobHandle(String jobId, JobType jobType, String dedupeKey) {}
