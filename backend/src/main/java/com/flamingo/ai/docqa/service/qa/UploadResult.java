package com.flamingo.ai.docqa.service.qa;

import java.time.Duration;
import java.util.UUID;

/**
 * Outcome of a successful upload.
 *
 * @param documentId identifier of the now active document
 * @param fileName original filename
 * @param chunkCount number of chunks in the new index
 * @param indexBuildDuration time spent chunking, embedding and publishing
 */
public record UploadResult(
    UUID documentId, String fileName, int chunkCount, Duration indexBuildDuration) {}
