package com.flamingo.ai.coursepipeline.api.dto.response;

import com.flamingo.ai.coursepipeline.domain.entity.Material;
import com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for material data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaterialResponse {

  private UUID id;
  private UUID chapterId;
  private String fileName;
  private String mimeType;
  private Long fileSize;
  private MaterialStatus status;
  private Integer extractedTextLength;
  private String processingError;

  /** Extraction job queued for a fresh upload; null elsewhere. */
  private String jobId;

  private LocalDateTime createdAt;
  private LocalDateTime processedAt;

  /** Creates a MaterialResponse from a Material entity. */
  public static MaterialResponse fromEntity(Material material) {
    String text = material.getExtractedText();
    return MaterialResponse.builder()
        .id(material.getId())
        .chapterId(material.getChapter().getId())
        .fileName(material.getFileName())
        .mimeType(material.getMimeType())
        .fileSize(material.getFileSize())
        .status(material.getStatus())
        .extractedTextLength(text != null ? text.length() : null)
        .processingError(material.getProcessingError())
        .createdAt(material.getCreatedAt())
        .processedAt(material.getProcessedAt())
        .build();
  }
}
