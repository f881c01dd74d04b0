package com.flamingo.ai.coursepipeline.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.coursepipeline.domain.entity.Chapter;
import com.flamingo.ai.coursepipeline.domain.entity.Material;
import com.flamingo.ai.coursepipeline.domain.enums.ChapterStatus;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus;
import com.flamingo.ai.coursepipeline.exception.ApiError;
import com.flamingo.ai.coursepipeline.exception.ChapterNotFoundException;
import com.flamingo.ai.coursepipeline.exception.DuplicateJobException;
import com.flamingo.ai.coursepipeline.exception.GlobalExceptionHandler;
import com.flamingo.ai.coursepipeline.exception.InvalidMaterialStateException;
import com.flamingo.ai.coursepipeline.exception.MaterialNotFoundException;
import com.flamingo.ai.coursepipeline.exception.UnsupportedFormatException;
import com.flamingo.ai.coursepipeline.service.pipeline.MaterialIngestionService;
import com.flamingo.ai.coursepipeline.service.pipeline.MaterialIngestionService.MaterialUpload;
import com.flamingo.ai.coursepipeline.service.queue.JobHandle;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("MaterialController Tests")
class MaterialControllerTest {

  private MockMvc mockMvc;

  @Mock private MaterialIngestionService ingestionService;

  private Chapter chapter;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new MaterialController(ingestionService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    chapter =
        Chapter.builder()
            .id(UUID.randomUUID())
            .title("Cell respiration")
            .status(ChapterStatus.DRAFT)
            .build();
  }

  private Material material(MaterialStatus status) {
    return Material.builder()
        .id(UUID.randomUUID())
        .chapter(chapter)
        .fileName("lecture.pdf")
        .filePath("/tmp/lecture.pdf")
        .mimeType("application/pdf")
        .fileSize(1024L)
        .status(status)
        .createdAt(LocalDateTime.now())
        .build();
  }

  @Test
  @DisplayName("Should accept an upload and return the extraction job id")
  void shouldAcceptUpload() throws Exception {
    Material material = material(MaterialStatus.PENDING);
    MockMultipartFile file =
        new MockMultipartFile("file", "lecture.pdf", "application/pdf", new byte[] {1, 2, 3});
    when(ingestionService.submitUpload(eq(chapter.getId()), any()))
        .thenReturn(
            new MaterialUpload(
                material,
                new JobHandle("job-1", JobType.EXTRACTION, "extract:" + material.getId())));

    mockMvc
        .perform(multipart("/api/chapters/{chapterId}/materials", chapter.getId()).file(file))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(material.getId().toString()))
        .andExpect(jsonPath("$.chapterId").value(chapter.getId().toString()))
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.jobId").value("job-1"));
  }

  @Test
  @DisplayName("Should reject an unsupported upload with 400")
  void shouldRejectUnsupportedUpload() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile("file", "picture.png", "image/png", new byte[] {1});
    when(ingestionService.submitUpload(eq(chapter.getId()), any()))
        .thenThrow(new UnsupportedFormatException(null, "image/png", "Unsupported: image/png"));

    mockMvc
        .perform(multipart("/api/chapters/{chapterId}/materials", chapter.getId()).file(file))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.UNSUPPORTED_FORMAT));
  }

  @Test
  @DisplayName("Should return 404 when uploading to an unknown chapter")
  void shouldReturn404ForUnknownChapter() throws Exception {
    UUID unknown = UUID.randomUUID();
    MockMultipartFile file =
        new MockMultipartFile("file", "lecture.pdf", "application/pdf", new byte[] {1});
    when(ingestionService.submitUpload(eq(unknown), any()))
        .thenThrow(new ChapterNotFoundException(unknown));

    mockMvc
        .perform(multipart("/api/chapters/{chapterId}/materials", unknown).file(file))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.CHAPTER_NOT_FOUND));
  }

  @Test
  @DisplayName("Should list chapter materials")
  void shouldListMaterials() throws Exception {
    when(ingestionService.getMaterialsByChapter(chapter.getId()))
        .thenReturn(List.of(material(MaterialStatus.COMPLETED), material(MaterialStatus.FAILED)));

    mockMvc
        .perform(get("/api/chapters/{chapterId}/materials", chapter.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].status").value("COMPLETED"))
        .andExpect(jsonPath("$[1].status").value("FAILED"));
  }

  @Test
  @DisplayName("Should return the chapter with its material count")
  void shouldReturnChapter() throws Exception {
    chapter.setStatus(ChapterStatus.READY);
    chapter.setProcessedContent("Merged content");
    when(ingestionService.getChapter(chapter.getId())).thenReturn(chapter);
    when(ingestionService.getMaterialsByChapter(chapter.getId()))
        .thenReturn(List.of(material(MaterialStatus.COMPLETED)));

    mockMvc
        .perform(get("/api/chapters/{chapterId}", chapter.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("READY"))
        .andExpect(jsonPath("$.materialCount").value(1));
  }

  @Test
  @DisplayName("Should return 404 for an unknown material")
  void shouldReturn404ForUnknownMaterial() throws Exception {
    UUID unknown = UUID.randomUUID();
    when(ingestionService.getMaterial(unknown)).thenThrow(new MaterialNotFoundException(unknown));

    mockMvc
        .perform(get("/api/materials/{materialId}", unknown))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.MATERIAL_NOT_FOUND))
        .andExpect(jsonPath("$.path").value("/api/materials/" + unknown));
  }

  @Test
  @DisplayName("Should accept a reprocess request with 202")
  void shouldAcceptReprocess() throws Exception {
    UUID materialId = UUID.randomUUID();
    when(ingestionService.reprocessMaterial(materialId))
        .thenReturn(new JobHandle("job-2", JobType.EXTRACTION, "extract:" + materialId));

    mockMvc
        .perform(post("/api/materials/{materialId}/reprocess", materialId))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-2"))
        .andExpect(jsonPath("$.jobType").value("EXTRACTION"));
  }

  @Test
  @DisplayName("Should return 409 when a job for the material is already queued")
  void shouldReturn409ForDuplicateJob() throws Exception {
    UUID materialId = UUID.randomUUID();
    when(ingestionService.reprocessMaterial(materialId))
        .thenThrow(new DuplicateJobException("extract:" + materialId, "job-1"));

    mockMvc
        .perform(post("/api/materials/{materialId}/reprocess", materialId))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value(ApiError.DUPLICATE_JOB));
  }

  @Test
  @DisplayName("Should return 409 when regenerating embeddings of an unfinished material")
  void shouldReturn409ForRegenerateOnUnfinishedMaterial() throws Exception {
    UUID materialId = UUID.randomUUID();
    when(ingestionService.regenerateEmbeddings(materialId))
        .thenThrow(
            new InvalidMaterialStateException(
                materialId, MaterialStatus.PROCESSING, "Material has not finished extraction"));

    mockMvc
        .perform(post("/api/materials/{materialId}/embeddings", materialId))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value(ApiError.MATERIAL_STATE_CONFLICT))
        .andExpect(jsonPath("$.message").value("Material has not finished extraction"));
  }

  @Test
  @DisplayName("Should delete a material with 204")
  void shouldDeleteMaterial() throws Exception {
    UUID materialId = UUID.randomUUID();

    mockMvc
        .perform(delete("/api/materials/{materialId}", materialId))
        .andExpect(status().isNoContent());

    verify(ingestionService).deleteMaterial(materialId);
  }

  @Test
  @DisplayName("Should return 404 when deleting an unknown material")
  void shouldReturn404WhenDeletingUnknownMaterial() throws Exception {
    UUID unknown = UUID.randomUUID();
    doThrow(new MaterialNotFoundException(unknown)).when(ingestionService).deleteMaterial(unknown);

    mockMvc
        .perform(delete("/api/materials/{materialId}", unknown))
        .andExpect(status().isNotFound());
  }
}
