package com.flamingo.ai.docqa.service.rag.model;

import com.flamingo.ai.docqa.service.rag.synthesis.ConfidenceCalculator.ConfidenceLevel;
import java.util.List;

/**
 * Answer produced from retrieved context.
 *
 * @param answer generated answer text
 * @param confidence confidence in [0, 1]
 * @param level bucketed confidence
 * @param sources chunks that were placed into the prompt, in retrieval order
 */
public record SynthesizedAnswer(
    String answer, double confidence, ConfidenceLevel level, List<ScoredChunk> sources) {}
