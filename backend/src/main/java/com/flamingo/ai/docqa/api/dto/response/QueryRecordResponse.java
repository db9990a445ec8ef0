package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.domain.entity.QueryRecord;
import com.flamingo.ai.docqa.domain.enums.FailureKind;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a question log entry. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRecordResponse {

  private UUID id;
  private String question;
  private String answer;
  private Double confidence;
  private UUID documentId;
  private FailureKind failureKind;
  private LocalDateTime createdAt;

  /** Creates a QueryRecordResponse from a QueryRecord entity. */
  public static QueryRecordResponse fromEntity(QueryRecord record) {
    return QueryRecordResponse.builder()
        .id(record.getId())
        .question(record.getQuestion())
        .answer(record.getAnswer())
        .confidence(record.getConfidence())
        .documentId(record.getDocumentId())
        .failureKind(record.getFailureKind())
        .createdAt(record.getCreatedAt())
        .build();
  }
}
