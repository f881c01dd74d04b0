package com.flamingo.ai.coursepipeline.service.pipeline;

import com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialRepository;
import java.time.LocalDateTime;
import java.util.UUID;
import java.util.function.IntSupplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Component;

/**
 * Applies material status changes as single-statement updates, retrying when SQLite reports lock
 * contention.
 *
 * <p>Every method returns {@code false} when the material no longer exists, which happens when it
 * is deleted while a job is still working on it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MaterialStatusWriter {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final MaterialRepository materialRepository;

  public boolean markProcessing(UUID materialId) {
    return update(
        materialId,
        "processing",
        () -> materialRepository.updateStatus(materialId, MaterialStatus.PROCESSING));
  }

  /**
   * Stores the extracted text together with the completed status.
   *
   * @throws IllegalArgumentException if the text is blank
   */
  public boolean markCompleted(UUID materialId, String extractedText) {
    if (extractedText == null || extractedText.isBlank()) {
      throw new IllegalArgumentException("Completed material " + materialId + " needs text");
    }
    return update(
        materialId,
        "completed",
        () -> materialRepository.markCompleted(materialId, extractedText, LocalDateTime.now()));
  }

  public boolean markFailed(UUID materialId, String error) {
    return update(
        materialId,
        "failed",
        () -> materialRepository.markFailed(materialId, error, LocalDateTime.now()));
  }

  public boolean resetToPending(UUID materialId) {
    return update(materialId, "pending", () -> materialRepository.resetToPending(materialId));
  }

  private boolean update(UUID materialId, String target, IntSupplier statement) {
    for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
      try {
        int rows = statement.getAsInt();
        if (rows == 0) {
          log.warn("Material {} not found, status {} not applied", materialId, target);
          return false;
        }
        log.debug("Material {} -> {}", materialId, target);
        return true;
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update material {} after {} retries", materialId, MAX_RETRIES);
          throw e;
        }
        log.warn(
            "SQLite lock contention on material {}, retry {}/{}", materialId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
    return false;
  }
}
