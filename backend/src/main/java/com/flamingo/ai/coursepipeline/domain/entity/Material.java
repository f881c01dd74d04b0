package com.flamingo.ai.coursepipeline.domain.entity;

import com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/** One uploaded source file of a chapter. Mutated only by the ingestion pipeline. */
@Entity
@Table(name = "materials")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Material {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "chapter_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private Chapter chapter;

  @Column(nullable = false)
  private String fileName;

  @Column(nullable = false)
  private String filePath;

  @Column(nullable = false)
  private String mimeType;

  private Long fileSize;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private MaterialStatus status = MaterialStatus.PENDING;

  /** Extracted text; only non-null together with {@link MaterialStatus#COMPLETED}. */
  @Column(columnDefinition = "TEXT")
  private String extractedText;

  /** Error message if processing failed, surfaced verbatim to the user. */
  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
