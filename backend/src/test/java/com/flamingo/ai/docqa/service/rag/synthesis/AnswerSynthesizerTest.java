package com.flamingo.ai.docqa.service.rag.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.exception.GenerationUnavailableException;
import com.flamingo.ai.docqa.exception.NoContextException;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.rag.model.SynthesizedAnswer;
import com.flamingo.ai.docqa.service.rag.model.TextChunk;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnswerSynthesizer Tests")
class AnswerSynthesizerTest {

  @Mock private GenerationService generationService;

  private RagConfig ragConfig;
  private AnswerSynthesizer synthesizer;
  private final UUID documentId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ConfidenceCalculator calculator =
        new ConfidenceCalculator(ragConfig, new SimpleMeterRegistry());
    synthesizer = new AnswerSynthesizer(generationService, calculator, ragConfig);
  }

  @Test
  void shouldThrowNoContext_withoutCallingGeneration_whenNoChunks() {
    assertThatThrownBy(() -> synthesizer.synthesize("What color is the sky?", List.of()))
        .isInstanceOf(NoContextException.class);

    verifyNoInteractions(generationService);
  }

  @Test
  void shouldLabelSourcesInRetrievalOrder() {
    // Given
    List<ScoredChunk> chunks =
        List.of(scored(3, "The sky is blue.", 0.9), scored(0, "Water boils at 100°C.", 0.4));
    when(generationService.generate(anyString())).thenReturn("The sky is blue.");

    // When
    SynthesizedAnswer answer = synthesizer.synthesize("What color is the sky?", chunks);

    // Then
    ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
    verify(generationService).generate(prompt.capture());
    assertThat(prompt.getValue())
        .contains("[Source 1]\nThe sky is blue.\n\n[Source 2]\nWater boils at 100°C.")
        .contains("Question: What color is the sky?");
    assertThat(answer.answer()).isEqualTo("The sky is blue.");
    assertThat(answer.sources()).isEqualTo(chunks);
    assertThat(answer.confidence()).isBetween(0.0, 1.0);
  }

  @Test
  void shouldStopAddingChunks_whenContextBudgetIsUsed() {
    // Given
    ragConfig.getSynthesis().setMaxContextChars(100);
    List<ScoredChunk> chunks =
        List.of(scored(0, "a".repeat(80), 0.9), scored(1, "b".repeat(80), 0.8));
    List<ScoredChunk> included = new ArrayList<>();

    // When
    String context = synthesizer.buildContext(chunks, included);

    // Then
    assertThat(context.length()).isLessThanOrEqualTo(100);
    assertThat(context).doesNotContain("b");
    assertThat(included).containsExactly(chunks.get(0));
  }

  @Test
  void shouldTruncateFirstChunk_whenItAloneExceedsBudget() {
    // Given
    ragConfig.getSynthesis().setMaxContextChars(300);
    List<ScoredChunk> chunks = List.of(scored(0, "c".repeat(1000), 0.9));
    List<ScoredChunk> included = new ArrayList<>();

    // When
    String context = synthesizer.buildContext(chunks, included);

    // Then
    assertThat(context).startsWith("[Source 1]\nccc").hasSize(300);
    assertThat(included).hasSize(1);
  }

  @Test
  void shouldPropagateGenerationFailure() {
    when(generationService.generate(anyString()))
        .thenThrow(new GenerationUnavailableException("model overloaded"));

    assertThatThrownBy(
            () -> synthesizer.synthesize("question", List.of(scored(0, "text", 0.5))))
        .isInstanceOf(GenerationUnavailableException.class);
  }

  private ScoredChunk scored(int sequenceIndex, String text, double score) {
    return new ScoredChunk(new TextChunk(documentId, sequenceIndex, text, 0, 0), score);
  }
}
