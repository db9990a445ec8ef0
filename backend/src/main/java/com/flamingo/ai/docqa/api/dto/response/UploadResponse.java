package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.service.ingestion.ExtractedUpload;
import com.flamingo.ai.docqa.service.qa.UploadResult;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a processed upload. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {

  private UUID documentId;
  private String filename;
  private Long size;
  private Integer textLength;
  private Integer chunkCount;
  private Long indexBuildMillis;
  private String message;

  /** Creates an UploadResponse from the ingested file and its indexing result. */
  public static UploadResponse from(ExtractedUpload upload, UploadResult result) {
    return UploadResponse.builder()
        .documentId(result.documentId())
        .filename(result.fileName())
        .size(upload.size())
        .textLength(upload.text().length())
        .chunkCount(result.chunkCount())
        .indexBuildMillis(result.indexBuildDuration().toMillis())
        .message("File uploaded and processed successfully")
        .build();
  }
}
