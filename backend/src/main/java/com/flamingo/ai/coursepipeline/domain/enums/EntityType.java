package com.flamingo.ai.coursepipeline.domain.enums;

/** Type of entity a job targets. */
public enum EntityType {
  MATERIAL,
  CHAPTER
}
