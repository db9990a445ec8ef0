package com.flamingo.ai.docqa.service.rag.synthesis;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Derives a confidence value for a synthesized answer from its retrieval evidence.
 *
 * <p>The score is a weighted sum of the top chunk score, the mean chunk score and the share of
 * question keywords found in the top chunk, clamped to [0, 1]. Answers in which the model declares
 * that the document does not contain the answer are penalized. The result never decreases when any
 * retrieval score increases.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConfidenceCalculator {

  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "is", "at", "which", "on", "a", "an", "and", "or", "but", "in", "with", "what",
          "who", "how", "why", "when", "where", "does", "did", "are", "was", "were", "of", "to",
          "for", "this", "that", "from", "about");

  private static final List<String> ABSTENTION_PHRASES =
      List.of(
          "not found in the document",
          "not mentioned in the document",
          "does not contain",
          "doesn't contain",
          "no information",
          "cannot find",
          "can't find",
          "not provided in the");

  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Calculates confidence for an answer.
   *
   * @param question the user question
   * @param sources retrieved chunks in retrieval order; must not be empty
   * @param answer the generated answer
   * @return confidence score with its level
   */
  public ConfidenceScore calculate(String question, List<ScoredChunk> sources, String answer) {
    if (sources.isEmpty()) {
      return new ConfidenceScore(0.0, ConfidenceLevel.LOW);
    }
    RagConfig.Confidence weights = ragConfig.getConfidence();

    double top = sources.stream().mapToDouble(ScoredChunk::score).max().orElse(0.0);
    double mean = sources.stream().mapToDouble(ScoredChunk::score).average().orElse(0.0);
    double coverage = keywordCoverage(question, sources.get(0).chunk().text());

    double score =
        weights.getTopScoreWeight() * top
            + weights.getMeanScoreWeight() * mean
            + weights.getCoverageWeight() * coverage;
    boolean abstained = isAbstention(answer);
    if (abstained) {
      score *= weights.getAbstentionPenalty();
    }
    score = Math.max(0.0, Math.min(1.0, score));

    ConfidenceLevel level = levelOf(score);
    meterRegistry.counter("qa.confidence." + level.name().toLowerCase(Locale.ROOT)).increment();
    log.debug(
        "Confidence {} ({}): top={}, mean={}, coverage={}, abstained={}",
        String.format("%.3f", score),
        level,
        String.format("%.3f", top),
        String.format("%.3f", mean),
        String.format("%.3f", coverage),
        abstained);
    return new ConfidenceScore(score, level);
  }

  /** Share of the question's keywords that occur in the given text. */
  double keywordCoverage(String question, String text) {
    Set<String> keywords = keywords(question);
    if (keywords.isEmpty() || text == null) {
      return 0.0;
    }
    Set<String> textTerms = keywords(text);
    long matched = keywords.stream().filter(textTerms::contains).count();
    return (double) matched / keywords.size();
  }

  boolean isAbstention(String answer) {
    if (answer == null) {
      return false;
    }
    String lower = answer.toLowerCase(Locale.ROOT);
    return ABSTENTION_PHRASES.stream().anyMatch(lower::contains);
  }

  ConfidenceLevel levelOf(double score) {
    RagConfig.Confidence thresholds = ragConfig.getConfidence();
    if (score >= thresholds.getHighThreshold()) {
      return ConfidenceLevel.HIGH;
    } else if (score >= thresholds.getMediumThreshold()) {
      return ConfidenceLevel.MEDIUM;
    } else {
      return ConfidenceLevel.LOW;
    }
  }

  private static Set<String> keywords(String text) {
    Set<String> terms = new LinkedHashSet<>();
    if (text == null) {
      return terms;
    }
    for (String term : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{Nd}]+")) {
      if (term.length() > 2 && !STOP_WORDS.contains(term)) {
        terms.add(term);
      }
    }
    return terms;
  }

  /** Confidence level enum. */
  public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW
  }

  /** Confidence score result. */
  public record ConfidenceScore(double score, ConfidenceLevel level) {}
}
