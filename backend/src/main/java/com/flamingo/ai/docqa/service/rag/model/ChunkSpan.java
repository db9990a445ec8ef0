package com.flamingo.ai.docqa.service.rag.model;

/**
 * A contiguous span of the source text produced by the chunker.
 *
 * @param sequenceIndex zero-based position in the chunk sequence
 * @param text the span content, exactly the source characters starting at {@code startOffset}
 * @param startOffset character offset of the span in the source text
 * @param overlapChars number of leading characters shared with the previous span (0 for the first)
 */
public record ChunkSpan(int sequenceIndex, String text, int startOffset, int overlapChars) {}
