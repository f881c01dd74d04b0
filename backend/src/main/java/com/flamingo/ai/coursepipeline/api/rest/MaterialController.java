package com.flamingo.ai.coursepipeline.api.rest;

import com.flamingo.ai.coursepipeline.api.dto.response.ChapterResponse;
import com.flamingo.ai.coursepipeline.api.dto.response.JobSubmissionResponse;
import com.flamingo.ai.coursepipeline.api.dto.response.MaterialResponse;
import com.flamingo.ai.coursepipeline.domain.entity.Material;
import com.flamingo.ai.coursepipeline.service.pipeline.MaterialIngestionService;
import com.flamingo.ai.coursepipeline.service.pipeline.MaterialIngestionService.MaterialUpload;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for chapter materials. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MaterialController {

  private final MaterialIngestionService ingestionService;

  /** Uploads a material to a chapter and queues its extraction. */
  @PostMapping(
      value = "/chapters/{chapterId}/materials",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<MaterialResponse> uploadMaterial(
      @PathVariable UUID chapterId, @RequestParam("file") MultipartFile file) {
    MaterialUpload upload = ingestionService.submitUpload(chapterId, file);
    MaterialResponse response = MaterialResponse.fromEntity(upload.material());
    response.setJobId(upload.extractionJob().jobId());
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  /** Gets all materials of a chapter in upload order. */
  @GetMapping("/chapters/{chapterId}/materials")
  public ResponseEntity<List<MaterialResponse>> getMaterialsByChapter(
      @PathVariable UUID chapterId) {
    List<MaterialResponse> responses =
        ingestionService.getMaterialsByChapter(chapterId).stream()
            .map(MaterialResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(responses);
  }

  /** Gets the derived status and merged content of a chapter. */
  @GetMapping("/chapters/{chapterId}")
  public ResponseEntity<ChapterResponse> getChapter(@PathVariable UUID chapterId) {
    int materialCount = ingestionService.getMaterialsByChapter(chapterId).size();
    return ResponseEntity.ok(
        ChapterResponse.fromEntity(ingestionService.getChapter(chapterId), materialCount));
  }

  /** Gets a material, including its processing status and error. */
  @GetMapping("/materials/{materialId}")
  public ResponseEntity<MaterialResponse> getMaterial(@PathVariable UUID materialId) {
    Material material = ingestionService.getMaterial(materialId);
    return ResponseEntity.ok(MaterialResponse.fromEntity(material));
  }

  /** Runs extraction again for a failed or completed material. */
  @PostMapping("/materials/{materialId}/reprocess")
  public ResponseEntity<JobSubmissionResponse> reprocessMaterial(@PathVariable UUID materialId) {
    return ResponseEntity.accepted()
        .body(JobSubmissionResponse.from(ingestionService.reprocessMaterial(materialId)));
  }

  /** Rebuilds the vector store chunks of a completed material. */
  @PostMapping("/materials/{materialId}/embeddings")
  public ResponseEntity<JobSubmissionResponse> regenerateEmbeddings(
      @PathVariable UUID materialId) {
    return ResponseEntity.accepted()
        .body(JobSubmissionResponse.from(ingestionService.regenerateEmbeddings(materialId)));
  }

  /** Deletes a material and its chunks. */
  @DeleteMapping("/materials/{materialId}")
  public ResponseEntity<Void> deleteMaterial(@PathVariable UUID materialId) {
    ingestionService.deleteMaterial(materialId);
    return ResponseEntity.noContent().build();
  }
}
