package com.flamingo.ai.docqa.service.rag.synthesis;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.exception.GenerationUnavailableException;
import com.flamingo.ai.docqa.exception.NoContextException;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.rag.model.SynthesizedAnswer;
import com.flamingo.ai.docqa.service.rag.synthesis.ConfidenceCalculator.ConfidenceScore;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a question and its retrieved chunks into a grounded answer.
 *
 * <p>The chunks are placed into the prompt in retrieval order as numbered {@code [Source n]}
 * blocks, bounded by {@code rag.synthesis.max-context-chars}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerSynthesizer {

  static final String SOURCE_LABEL = "[Source %d]";

  // Below this many characters a truncated chunk is not worth sending
  private static final int MIN_TRUNCATED_CHARS = 200;

  private final GenerationService generationService;
  private final ConfidenceCalculator confidenceCalculator;
  private final RagConfig ragConfig;

  /**
   * Synthesizes an answer.
   *
   * @param question the user question
   * @param scoredChunks retrieved chunks, best first
   * @return the answer, its confidence and the chunks that were sent to the model
   * @throws NoContextException if no chunks were retrieved; generation is not called
   * @throws GenerationUnavailableException if generation fails or times out
   */
  @Timed(value = "synthesis.synthesize", description = "Time to synthesize an answer")
  public SynthesizedAnswer synthesize(String question, List<ScoredChunk> scoredChunks) {
    if (scoredChunks == null || scoredChunks.isEmpty()) {
      throw new NoContextException("No chunks were retrieved for the question");
    }

    List<ScoredChunk> included = new ArrayList<>();
    String context = buildContext(scoredChunks, included);
    String prompt = buildPrompt(context, question);
    log.debug(
        "Synthesizing from {} of {} chunks ({} context chars)",
        included.size(),
        scoredChunks.size(),
        context.length());

    String answer = generationService.generate(prompt);
    ConfidenceScore confidence = confidenceCalculator.calculate(question, included, answer);
    return new SynthesizedAnswer(
        answer, confidence.score(), confidence.level(), List.copyOf(included));
  }

  /**
   * Concatenates labelled chunk texts until the context budget is used up. The first chunk is
   * always included, truncated if it alone exceeds the budget.
   */
  String buildContext(List<ScoredChunk> scoredChunks, List<ScoredChunk> included) {
    int budget = ragConfig.getSynthesis().getMaxContextChars();
    StringBuilder context = new StringBuilder();

    for (ScoredChunk scored : scoredChunks) {
      String header = String.format(SOURCE_LABEL, included.size() + 1) + "\n";
      String text = scored.chunk().text();
      String separator = context.length() == 0 ? "" : "\n\n";
      int remaining = budget - context.length() - separator.length() - header.length();

      if (text.length() <= remaining) {
        context.append(separator).append(header).append(text);
        included.add(scored);
        continue;
      }
      if (included.isEmpty() || remaining >= MIN_TRUNCATED_CHARS) {
        int keep = Math.max(remaining, Math.min(text.length(), MIN_TRUNCATED_CHARS));
        context.append(separator).append(header).append(text, 0, keep);
        included.add(scored);
      }
      break;
    }
    return context.toString();
  }

  private String buildPrompt(String context, String question) {
    return "Document excerpts:\n\n" + context + "\n\nQuestion: " + question.strip() + "\n\nAnswer:";
  }
}
