package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.service.qa.AnswerResult;
import com.flamingo.ai.docqa.service.rag.synthesis.ConfidenceCalculator.ConfidenceLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerResponse {

  private String answer;
  private String documentName;
  private Double confidence;
  private ConfidenceLevel confidenceLevel;

  /** Creates an AnswerResponse from a service result. */
  public static AnswerResponse from(AnswerResult result) {
    return AnswerResponse.builder()
        .answer(result.answer())
        .documentName(result.documentName())
        .confidence(Math.round(result.confidence() * 1000) / 1000.0)
        .confidenceLevel(result.confidenceLevel())
        .build();
  }
}
