package com.flamingo.ai.docqa.domain.entity;

import com.flamingo.ai.docqa.domain.enums.FailureKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One entry of the append-only question log.
 *
 * <p>Answered questions carry an answer and a confidence; failed ones carry a {@link FailureKind}
 * and a null answer.
 */
@Entity
@Table(name = "query_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class QueryRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String question;

  @Column(columnDefinition = "TEXT")
  private String answer;

  private Double confidence;

  /** Document the question was asked against; null when none was active. */
  private UUID documentId;

  @Enumerated(EnumType.STRING)
  private FailureKind failureKind;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }

  /** Creates a record for a successfully answered question. */
  public static QueryRecord answered(
      String question, String answer, double confidence, UUID documentId) {
    return QueryRecord.builder()
        .question(question)
        .answer(answer)
        .confidence(confidence)
        .documentId(documentId)
        .createdAt(LocalDateTime.now())
        .build();
  }

  /** Creates a record for a question that could not be answered. */
  public static QueryRecord failed(String question, UUID documentId, FailureKind failureKind) {
    return QueryRecord.builder()
        .question(question)
        .documentId(documentId)
        .failureKind(failureKind)
        .createdAt(LocalDateTime.now())
        .build();
  }

  public boolean isAnswered() {
    return failureKind == null;
  }
}
