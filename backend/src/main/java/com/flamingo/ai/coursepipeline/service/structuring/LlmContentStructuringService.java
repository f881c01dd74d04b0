package com.flamingo.ai.coursepipeline.service.structuring;

import com.flamingo.ai.coursepipeline.agent.ContentStructuringAgent;
import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import com.flamingo.ai.coursepipeline.exception.GenerationTimeoutException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** {@link ContentStructuringService} backed by the {@link ContentStructuringAgent}. */
@Service
@ConditionalOnProperty(
    name = "pipeline.structuring.enabled",
    havingValue = "true",
    matchIfMissing = true)
@Slf4j
public class LlmContentStructuringService implements ContentStructuringService {

  private static final Pattern THINK_BLOCK = Pattern.compile("(?is)<think>.*?</think>");
  private static final Pattern UNCLOSED_THINK = Pattern.compile("(?is)<think>.*");

  private static final Parser PARSER = Parser.builder().build();
  private static final TextContentRenderer TEXT_RENDERER = TextContentRenderer.builder().build();

  private final ContentStructuringAgent agent;
  private final PipelineConfig pipelineConfig;
  private final Executor structuringExecutor;
  private final MeterRegistry meterRegistry;

  public LlmContentStructuringService(
      ContentStructuringAgent agent,
      PipelineConfig pipelineConfig,
      @Qualifier("structuringExecutor") Executor structuringExecutor,
      MeterRegistry meterRegistry) {
    this.agent = agent;
    this.pipelineConfig = pipelineConfig;
    this.structuringExecutor = structuringExecutor;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "structuring.duration", description = "Time to structure extracted content")
  public String structureContent(String rawText, String language) {
    PipelineConfig.Structuring config = pipelineConfig.getStructuring();
    if (rawText == null || rawText.trim().length() < config.getMinInputChars()) {
      log.debug("Skipping structuring: input below {} chars", config.getMinInputChars());
      return rawText;
    }

    String input = rawText;
    if (input.length() > config.getMaxInputChars()) {
      log.warn(
          "Structuring input truncated from {} to {} characters",
          rawText.length(),
          config.getMaxInputChars());
      input = input.substring(0, config.getMaxInputChars());
    }

    try {
      String output = callWithTimeout(languageInstruction(language), input, config.getTimeout());
      String structured = validate(output);
      if (structured == null) {
        log.warn("Structuring returned malformed output, using raw text");
        return fallback(rawText, "malformed");
      }
      log.debug("Structured {} chars into {} chars", input.length(), structured.length());
      return structured;
    } catch (GenerationTimeoutException e) {
      log.warn("Structuring timed out after {}, using raw text", e.getTimeout());
      return fallback(rawText, "timeout");
    } catch (Exception e) {
      log.warn("Structuring failed, using raw text: {}", e.getMessage());
      return fallback(rawText, "error");
    }
  }

  private String callWithTimeout(String languageInstruction, String input, Duration timeout)
      throws InterruptedException, ExecutionException {
    CompletableFuture<String> call =
        CompletableFuture.supplyAsync(
            () -> agent.structure(languageInstruction, input), structuringExecutor);
    try {
      return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      call.cancel(true);
      throw new GenerationTimeoutException(timeout, e);
    } catch (InterruptedException e) {
      call.cancel(true);
      Thread.currentThread().interrupt();
      throw e;
    }
  }

  /**
   * Cleans the model output and checks it parses into Markdown with readable text.
   *
   * @return cleaned Markdown, or {@code null} if the output is unusable
   */
  static String validate(String output) {
    if (output == null) {
      return null;
    }
    String cleaned = THINK_BLOCK.matcher(output).replaceAll("");
    cleaned = UNCLOSED_THINK.matcher(cleaned).replaceAll("").trim();
    if (cleaned.isEmpty()) {
      return null;
    }

    Node document = PARSER.parse(cleaned);
    Node first = document.getFirstChild();
    if (first == null) {
      return null;
    }
    // Some models wrap the whole answer in a ```markdown fence
    if (first instanceof FencedCodeBlock fence
        && first.getNext() == null
        && isMarkdownFence(fence.getInfo())) {
      String inner = fence.getLiteral().trim();
      return inner.isEmpty() ? null : validate(inner);
    }
    if (TEXT_RENDERER.render(document).isBlank()) {
      return null;
    }
    return cleaned;
  }

  private static boolean isMarkdownFence(String info) {
    return info == null
        || info.isBlank()
        || "markdown".equalsIgnoreCase(info.trim())
        || "md".equalsIgnoreCase(info.trim());
  }

  private String fallback(String rawText, String reason) {
    meterRegistry.counter("structuring.fallback", "reason", reason).increment();
    return rawText;
  }

  private static String languageInstruction(String language) {
    if ("fr".equalsIgnoreCase(language)) {
      return "The content is in French. Keep it in French and ensure proper French grammar.";
    }
    return "The content is in English. Ensure proper English grammar.";
  }
}
