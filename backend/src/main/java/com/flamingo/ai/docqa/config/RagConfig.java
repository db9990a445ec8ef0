package com.flamingo.ai.docqa.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval-augmented answering pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Synthesis synthesis = new Synthesis();
  private Confidence confidence = new Confidence();
  private Capability capability = new Capability();
  private Upload upload = new Upload();

  /** Chunk sizes are measured in characters. */
  @Getter
  @Setter
  public static class Chunking {
    private int size = 1000;
    private int overlap = 200;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 4;
    private int minTopK = 1;
    private int maxTopK = 20;

    /** Chunks scoring at or below this value are not considered usable context. */
    private double minScore = 0.0;
  }

  @Getter
  @Setter
  public static class Synthesis {
    /** Upper bound on the number of context characters sent to the generation model. */
    private int maxContextChars = 6000;
  }

  @Getter
  @Setter
  public static class Confidence {
    private double topScoreWeight = 0.6;
    private double meanScoreWeight = 0.25;
    private double coverageWeight = 0.15;

    /** Multiplier applied when the generated answer says the document does not cover it. */
    private double abstentionPenalty = 0.5;

    private double highThreshold = 0.7;
    private double mediumThreshold = 0.4;
  }

  /** Limits for calls into the embedding/generation capability. */
  @Getter
  @Setter
  public static class Capability {
    private Duration timeout = Duration.ofSeconds(30);

    /** Total attempts per call, including the first one. */
    private int maxAttempts = 2;

    private Duration backoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
  }

  @Getter
  @Setter
  public static class Upload {
    private long maxFileSizeBytes = 10 * 1024 * 1024L; // 10 MB
  }
}
