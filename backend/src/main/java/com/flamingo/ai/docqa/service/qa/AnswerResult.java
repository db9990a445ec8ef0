package com.flamingo.ai.docqa.service.qa;

import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.rag.synthesis.ConfidenceCalculator.ConfidenceLevel;
import java.util.List;
import java.util.UUID;

/**
 * An answered question.
 *
 * @param answer generated answer
 * @param confidence confidence in [0, 1]
 * @param confidenceLevel bucketed confidence
 * @param documentId document the answer was drawn from
 * @param documentName filename of that document
 * @param sources chunks the answer was grounded on
 */
public record AnswerResult(
    String answer,
    double confidence,
    ConfidenceLevel confidenceLevel,
    UUID documentId,
    String documentName,
    List<ScoredChunk> sources) {}
