package com.flamingo.ai.coursepipeline;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.coursepipeline.agent.ContentStructuringAgent;
import com.flamingo.ai.coursepipeline.domain.entity.Chapter;
import com.flamingo.ai.coursepipeline.domain.entity.Course;
import com.flamingo.ai.coursepipeline.domain.repository.ChapterRepository;
import com.flamingo.ai.coursepipeline.domain.repository.CourseRepository;
import com.flamingo.ai.coursepipeline.domain.repository.JobRecordRepository;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialRepository;
import com.flamingo.ai.coursepipeline.domain.repository.QueuedJobRepository;
import com.flamingo.ai.coursepipeline.service.embedding.InMemoryVectorStore;
import com.flamingo.ai.coursepipeline.service.notification.NotificationSink;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Shared setup for tests that run against the full application context with a real SQLite
 * database. Model backends and Elasticsearch are mocked, chunks go to an {@link
 * InMemoryVectorStore}, and pollers are disabled so tests drive the queues themselves.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(PipelineIntegrationTestBase.InMemoryVectorStoreConfig.class)
public abstract class PipelineIntegrationTestBase {

  @MockitoBean protected ChatModel chatModel;
  @MockitoBean protected EmbeddingModel embeddingModel;
  @MockitoBean protected ElasticsearchClient elasticsearchClient;
  @MockitoBean protected ContentStructuringAgent structuringAgent;
  @MockitoBean protected NotificationSink notificationSink;

  @Autowired protected CourseRepository courseRepository;
  @Autowired protected ChapterRepository chapterRepository;
  @Autowired protected MaterialRepository materialRepository;
  @Autowired protected QueuedJobRepository queuedJobRepository;
  @Autowired protected JobRecordRepository jobRecordRepository;
  @Autowired protected InMemoryVectorStore vectorStore;

  @BeforeEach
  void cleanDatabase() {
    queuedJobRepository.deleteAll();
    jobRecordRepository.deleteAll();
    materialRepository.deleteAll();
    chapterRepository.deleteAll();
    courseRepository.deleteAll();
    vectorStore.clear();
  }

  protected Chapter createChapter(String courseName, String title) {
    Course course =
        courseRepository.save(
            Course.builder().userId(UUID.randomUUID()).name(courseName).language("en").build());
    return chapterRepository.save(Chapter.builder().course(course).title(title).build());
  }

  /** Builds a PDF with one page per entry, each page holding the given lines. */
  protected static byte[] pdf(List<List<String>> pages) throws IOException {
    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      for (List<String> lines : pages) {
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          content.beginText();
          content.setFont(font, 10);
          content.setLeading(14);
          content.newLineAtOffset(40, 740);
          for (String line : lines) {
            content.showText(line);
            content.newLine();
          }
          content.endText();
        }
      }
      document.save(out);
      return out.toByteArray();
    }
  }

  @TestConfiguration
  static class InMemoryVectorStoreConfig {

    @Bean
    @Primary
    InMemoryVectorStore inMemoryVectorStore() {
      return new InMemoryVectorStore();
    }
  }
}
