package com.flamingo.ai.coursepipeline.service.structuring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Identity {@link ContentStructuringService} used when structuring is disabled. */
@Service
@ConditionalOnProperty(name = "pipeline.structuring.enabled", havingValue = "false")
@Slf4j
public class NoOpContentStructuringService implements ContentStructuringService {

  @Override
  public String structureContent(String rawText, String language) {
    log.debug("Content structuring disabled, keeping raw text");
    return rawText;
  }
}
