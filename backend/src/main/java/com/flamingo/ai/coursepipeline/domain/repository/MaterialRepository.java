package com.flamingo.ai.coursepipeline.domain.repository;

import com.flamingo.ai.coursepipeline.domain.entity.Material;
import com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for Material entities. */
@Repository
public interface MaterialRepository extends JpaRepository<Material, UUID> {

  /** Finds all materials of a chapter in upload order. */
  List<Material> findByChapterIdOrderByCreatedAtAsc(UUID chapterId);

  /** Finds the statuses of a chapter's materials. */
  @Query("SELECT m.status FROM Material m WHERE m.chapter.id = :chapterId")
  List<MaterialStatus> findStatusesByChapterId(@Param("chapterId") UUID chapterId);

  /** Loads the material's chapter, course and owner ids. */
  @Query(
      "SELECT new com.flamingo.ai.coursepipeline.domain.repository.MaterialContext("
          + "m.id, c.id, co.id, co.userId, co.language) "
          + "FROM Material m JOIN m.chapter c JOIN c.course co WHERE m.id = :materialId")
  Optional<MaterialContext> findContextById(@Param("materialId") UUID materialId);

  /** Sets the status and clears the error, leaving the extracted text untouched. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE Material m SET m.status = :status, m.processingError = NULL WHERE m.id = :id")
  int updateStatus(@Param("id") UUID id, @Param("status") MaterialStatus status);

  /** Stores the extracted text and the completed status in one statement. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Material m SET m.status = "
          + "com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus.COMPLETED, "
          + "m.extractedText = :text, m.processingError = NULL, m.processedAt = :at "
          + "WHERE m.id = :id")
  int markCompleted(
      @Param("id") UUID id, @Param("text") String text, @Param("at") LocalDateTime at);

  /** Marks the material failed; the previous extracted text is dropped with the status. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Material m SET m.status = "
          + "com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus.FAILED, "
          + "m.extractedText = NULL, m.processingError = :error, m.processedAt = :at "
          + "WHERE m.id = :id")
  int markFailed(
      @Param("id") UUID id, @Param("error") String error, @Param("at") LocalDateTime at);

  /** Resets the material to pending so a fresh extraction job can run. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Material m SET m.status = "
          + "com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus.PENDING, "
          + "m.extractedText = NULL, m.processingError = NULL, m.processedAt = NULL "
          + "WHERE m.id = :id")
  int resetToPending(@Param("id") UUID id);
}
