package com.flamingo.ai.coursepipeline.service.extraction;

import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import com.flamingo.ai.coursepipeline.exception.UnsupportedFormatException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@link DocumentTextExtractor} for PDF files.
 *
 * <p>Loads the document from its file (PDFBox reads it through a buffered random-access file, the
 * raw bytes are never held in memory) and strips text one page at a time, up to the configured page
 * limit.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class PdfBoxTextExtractor implements DocumentTextExtractor {

  static final String PDF_MIME_TYPE = "application/pdf";

  private final PipelineConfig pipelineConfig;

  @Override
  public ExtractionResult extract(UUID materialId, Path file, String mimeType) {
    int maxPages = pipelineConfig.getExtraction().getMaxPages();

    try (PDDocument pdfDoc = Loader.loadPDF(file.toFile())) {
      int pageCount = pdfDoc.getNumberOfPages();
      int pagesToRead = Math.min(pageCount, maxPages);
      if (pageCount > maxPages) {
        log.warn(
            "PDF for material {} has {} pages, extracting the first {}",
            materialId,
            pageCount,
            maxPages);
      }

      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);

      List<ExtractedPage> pages = new ArrayList<>();
      StringBuilder fullText = new StringBuilder();
      for (int pageNumber = 1; pageNumber <= pagesToRead; pageNumber++) {
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        String pageText = stripper.getText(pdfDoc).trim();
        if (pageText.isEmpty()) {
          continue;
        }
        pages.add(new ExtractedPage(pageNumber, pageText));
        if (fullText.length() > 0) {
          fullText.append("\n\n");
        }
        fullText.append(pageText);
      }

      log.debug(
          "Extracted {} chars from {} of {} PDF pages for material {}",
          fullText.length(),
          pages.size(),
          pageCount,
          materialId);
      return new ExtractionResult(fullText.toString(), pages, Math.max(pageCount, 1));
    } catch (IOException e) {
      log.error("PDFBox extraction failed for material {}: {}", materialId, e.getMessage());
      throw new UnsupportedFormatException(
          materialId, mimeType, "File is corrupted or not a readable PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return PDF_MIME_TYPE.equalsIgnoreCase(mimeType);
  }
}
