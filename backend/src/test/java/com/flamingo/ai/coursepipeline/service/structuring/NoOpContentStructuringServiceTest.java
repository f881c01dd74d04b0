package com.flamingo.ai.coursepipeline.service.structuring;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NoOpContentStructuringServiceTest {

  @Test
  @DisplayName("Should return the raw text unchanged")
  void shouldReturnRawText() {
    String raw = "Page one\n\nPage two with a table | a | b |";

    assertThat(new NoOpContentStructuringService().structureContent(raw, "en")).isSameAs(raw);
  }
}
