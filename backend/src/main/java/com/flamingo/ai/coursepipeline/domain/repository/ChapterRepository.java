package com.flamingo.ai.coursepipeline.domain.repository;

import com.flamingo.ai.coursepipeline.domain.entity.Chapter;
import com.flamingo.ai.coursepipeline.domain.enums.ChapterStatus;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for Chapter entities. */
@Repository
public interface ChapterRepository extends JpaRepository<Chapter, UUID> {

  /** Reads only the current status of a chapter. */
  @Query("SELECT c.status FROM Chapter c WHERE c.id = :chapterId")
  Optional<ChapterStatus> findStatusById(@Param("chapterId") UUID chapterId);

  /** Reads the owning course id without loading the course. */
  @Query("SELECT c.course.id FROM Chapter c WHERE c.id = :chapterId")
  Optional<UUID> findCourseIdById(@Param("chapterId") UUID chapterId);

  /**
   * Updates the derived status. A chapter already marked completed by the user is left untouched.
   *
   * @return number of rows updated (0 if the chapter is completed or missing)
   */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Chapter c SET c.status = :status WHERE c.id = :chapterId "
          + "AND c.status <> com.flamingo.ai.coursepipeline.domain.enums.ChapterStatus.COMPLETED")
  int updateDerivedStatus(
      @Param("chapterId") UUID chapterId, @Param("status") ChapterStatus status);

  /** Sets the ready status and the merged content together, unless the chapter is completed. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Chapter c SET c.status = "
          + "com.flamingo.ai.coursepipeline.domain.enums.ChapterStatus.READY, "
          + "c.processedContent = :content WHERE c.id = :chapterId "
          + "AND c.status <> com.flamingo.ai.coursepipeline.domain.enums.ChapterStatus.COMPLETED")
  int markReady(@Param("chapterId") UUID chapterId, @Param("content") String content);
}
