package com.flamingo.ai.docqa.service.rag.model;

/**
 * A retrieved chunk and its similarity to the question.
 *
 * @param chunk the retrieved chunk
 * @param score similarity in [0, 1], 1.0 meaning identical direction
 */
public record ScoredChunk(TextChunk chunk, double score) {}
