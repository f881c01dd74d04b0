package com.flamingo.ai.coursepipeline.service.storage;

import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import com.flamingo.ai.coursepipeline.exception.MaterialProcessingException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Keeps uploaded material files on local disk, one directory per chapter. */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadStorageService {

  private final PipelineConfig pipelineConfig;

  /**
   * Copies an upload to {@code <uploadDir>/<chapterId>/<random>-<fileName>}.
   *
   * @return absolute path of the stored file
   */
  public Path store(UUID chapterId, MultipartFile file) {
    Path dir = Path.of(pipelineConfig.getStorage().getUploadDir(), chapterId.toString());
    Path target = dir.resolve(UUID.randomUUID() + "-" + sanitize(file.getOriginalFilename()));
    try (InputStream in = file.getInputStream()) {
      Files.createDirectories(dir);
      Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new MaterialProcessingException(
          null,
          "Failed to store upload " + file.getOriginalFilename() + ": " + e.getMessage(),
          "The file could not be saved. Please try uploading again.",
          e);
    }
    log.debug("Stored upload {} at {}", file.getOriginalFilename(), target);
    return target.toAbsolutePath();
  }

  /** Removes a stored upload. A missing file is not an error. */
  public void delete(String filePath) {
    if (filePath == null) {
      return;
    }
    try {
      Files.deleteIfExists(Path.of(filePath));
    } catch (IOException e) {
      log.warn("Failed to delete upload {}: {}", filePath, e.getMessage());
    }
  }

  private static String sanitize(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      return "upload";
    }
    String name = Path.of(fileName).getFileName().toString();
    return name.replaceAll("[^A-Za-z0-9._-]", "_");
  }
}
