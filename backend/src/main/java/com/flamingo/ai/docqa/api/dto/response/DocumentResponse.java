package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.service.state.ActiveDocument;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the active document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String fileName;
  private Integer textLength;
  private Integer chunkCount;
  private String embeddingModel;
  private LocalDateTime uploadedAt;
  private Instant indexBuiltAt;
  private Instant activatedAt;

  /** Creates a DocumentResponse from the active document snapshot. */
  public static DocumentResponse fromActive(ActiveDocument active) {
    return DocumentResponse.builder()
        .id(active.document().getId())
        .fileName(active.document().getFileName())
        .textLength(active.document().getContent().length())
        .chunkCount(active.index().size())
        .embeddingModel(active.index().embeddingModelId())
        .uploadedAt(active.document().getUploadedAt())
        .indexBuiltAt(active.index().builtAt())
        .activatedAt(active.activatedAt())
        .build();
  }
}
