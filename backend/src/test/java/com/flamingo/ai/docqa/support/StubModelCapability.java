package com.flamingo.ai.docqa.support;

import com.flamingo.ai.docqa.service.rag.capability.ModelCapability;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic {@link ModelCapability} for pipeline tests.
 *
 * <p>Embeddings are hashed bags of words, so texts sharing a keyword have positive cosine and texts
 * sharing none have cosine 0. Generation echoes the context sentences that share a keyword with
 * the question, or abstains when there are none.
 */
public class StubModelCapability implements ModelCapability {

  public static final String ABSTENTION = "The answer is not found in the document.";

  static final int DIMENSION = 512;

  private static final Set<String> STOP_WORDS =
      Set.of("the", "is", "at", "what", "which", "and", "for", "are", "was", "how", "who", "of");

  private static final Pattern QUESTION = Pattern.compile("\\n\\nQuestion: (.*?)\\n\\nAnswer:");
  private static final Pattern SOURCE_LABEL = Pattern.compile("\\[Source \\d+]\\n");

  private final AtomicInteger embedCalls = new AtomicInteger();
  private final AtomicInteger generateCalls = new AtomicInteger();

  private volatile int failEmbeddingsFromCall = -1;
  private volatile Runnable beforeNextEmbed;
  private volatile String lastPrompt;

  @Override
  public float[] embed(String text) {
    int call = embedCalls.incrementAndGet();
    Runnable hook = beforeNextEmbed;
    if (hook != null) {
      beforeNextEmbed = null;
      hook.run();
    }
    if (failEmbeddingsFromCall > 0 && call >= failEmbeddingsFromCall) {
      throw new IllegalStateException("embedding backend unavailable (call " + call + ")");
    }
    float[] vector = new float[DIMENSION];
    for (String keyword : keywords(text)) {
      vector[Math.floorMod(keyword.hashCode(), DIMENSION)] += 1.0f;
    }
    return vector;
  }

  @Override
  public String generate(String prompt) {
    generateCalls.incrementAndGet();
    lastPrompt = prompt;

    Matcher matcher = QUESTION.matcher(prompt);
    String question = matcher.find() ? matcher.group(1) : "";
    int contextEnd = matcher.find(0) ? matcher.start() : prompt.length();
    String context = SOURCE_LABEL.matcher(prompt.substring(0, contextEnd)).replaceAll("");

    Set<String> questionKeywords = keywords(question);
    List<String> matching = new ArrayList<>();
    for (String sentence : context.split("(?<=[.!?])\\s+|\\n\\n")) {
      Set<String> sentenceKeywords = keywords(sentence);
      sentenceKeywords.retainAll(questionKeywords);
      if (!sentenceKeywords.isEmpty()) {
        matching.add(sentence.strip());
      }
    }
    return matching.isEmpty() ? ABSTENTION : String.join(" ", matching);
  }

  @Override
  public String embeddingModelId() {
    return "stub-bag-of-words-" + DIMENSION;
  }

  /** Every embed call from the given 1-based call number on fails. */
  public void failEmbeddingsFromCall(int call) {
    this.failEmbeddingsFromCall = call;
  }

  public void recover() {
    this.failEmbeddingsFromCall = -1;
  }

  /** Runs the action once, at the start of the next embed call. */
  public void beforeNextEmbed(Runnable action) {
    this.beforeNextEmbed = action;
  }

  public int embedCalls() {
    return embedCalls.get();
  }

  public int generateCalls() {
    return generateCalls.get();
  }

  public String lastPrompt() {
    return lastPrompt;
  }

  static Set<String> keywords(String text) {
    Set<String> terms = new LinkedHashSet<>();
    for (String term : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{Nd}]+")) {
      if (term.length() > 2 && !STOP_WORDS.contains(term)) {
        terms.add(term);
      }
    }
    return terms;
  }
}
