package com.flamingo.ai.docqa.service.ingestion;

/**
 * A validated upload reduced to its text.
 *
 * @param fileName original filename
 * @param size upload size in bytes
 * @param text extracted, non-blank text
 */
public record ExtractedUpload(String fileName, long size, String text) {}
