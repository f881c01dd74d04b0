package com.flamingo.ai.coursepipeline.api.dto.response;

import com.flamingo.ai.coursepipeline.domain.entity.Chapter;
import com.flamingo.ai.coursepipeline.domain.enums.ChapterStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chapter's processing state. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChapterResponse {

  private UUID id;
  private String title;
  private ChapterStatus status;
  private int materialCount;
  private String processedContent;
  private LocalDateTime updatedAt;

  public static ChapterResponse fromEntity(Chapter chapter, int materialCount) {
    return ChapterResponse.builder()
        .id(chapter.getId())
        .title(chapter.getTitle())
        .status(chapter.getStatus())
        .materialCount(materialCount)
        .processedContent(chapter.getProcessedContent())
        .updatedAt(chapter.getUpdatedAt())
        .build();
  }
}
