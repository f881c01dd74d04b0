package com.flamingo.ai.coursepipeline.service.queue;

import com.flamingo.ai.coursepipeline.domain.enums.EntityType;
import java.util.UUID;

/** Data carried by a queued job. Serialized to JSON in the queue table. */
public interface JobPayload {

  /** Kind of entity the job works on, recorded by the job tracker. */
  EntityType entityType();

  UUID entityId();
}
