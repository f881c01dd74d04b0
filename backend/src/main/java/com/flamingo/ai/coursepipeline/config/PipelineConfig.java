package com.flamingo.ai.coursepipeline.config;

import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private Chunking chunking = new Chunking();
  private Extraction extraction = new Extraction();
  private Structuring structuring = new Structuring();
  private Queue queue = new Queue();
  private Workers workers = new Workers();
  private Storage storage = new Storage();

  @Getter
  @Setter
  public static class Chunking {
    private int size = 700;
    private int overlap = 100;
  }

  @Getter
  @Setter
  public static class Extraction {
    private int minTextLength = 50;
    private int maxPages = 100;

    /** Cap applied to extracted text before structuring. */
    private int maxTextLength = 50_000;
  }

  @Getter
  @Setter
  public static class Structuring {
    private boolean enabled = true;
    private int minInputChars = 100;
    private int maxInputChars = 50_000;
    private Duration timeout = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class Queue {
    private Duration pollInterval = Duration.ofSeconds(1);

    /** How long a claimed job may run before it is considered stalled. */
    private Duration leaseDuration = Duration.ofMinutes(10);

    private Retry retry = new Retry();
    private JobQueue extraction = new JobQueue(2, 5, 1);
    private JobQueue embedding = new JobQueue(3, 20, 3);

    public JobQueue forType(JobType jobType) {
      return switch (jobType) {
        case EXTRACTION -> extraction;
        case EMBEDDING_GENERATION -> embedding;
      };
    }
  }

  @Getter
  @Setter
  public static class Retry {
    private int attempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(5);
  }

  @Getter
  @Setter
  public static class JobQueue {
    private int concurrency;
    private RateLimit rateLimit = new RateLimit();
    private int priority;

    public JobQueue() {}

    JobQueue(int concurrency, int maxJobs, int priority) {
      this.concurrency = concurrency;
      this.rateLimit.setMaxJobs(maxJobs);
      this.priority = priority;
    }
  }

  @Getter
  @Setter
  public static class RateLimit {
    private int maxJobs = 10;
    private Duration window = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class Workers {
    /** When false no pollers start and jobs only run through explicit processNext calls. */
    private boolean enabled = true;
  }

  @Getter
  @Setter
  public static class Storage {
    private String uploadDir = "./data/uploads";
  }
}
