package com.flamingo.ai.docqa.service.rag.synthesis;

import com.flamingo.ai.docqa.exception.GenerationUnavailableException;
import com.flamingo.ai.docqa.service.rag.capability.CapabilityInvoker;
import com.flamingo.ai.docqa.service.rag.capability.ModelCapability;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Sends prompts to the generation side of the model capability. */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationService {

  private final ModelCapability modelCapability;
  private final CapabilityInvoker capabilityInvoker;
  private final MeterRegistry meterRegistry;

  /**
   * Generates text for the prompt.
   *
   * @param prompt fully assembled prompt
   * @return non-blank generated text
   * @throws GenerationUnavailableException if the capability fails, times out or returns nothing
   */
  @Timed(value = "generation.generate", description = "Time to generate an answer")
  public String generate(String prompt) {
    log.debug("Calling generation capability, prompt length: {} chars", prompt.length());
    String text =
        capabilityInvoker.invoke(
            "generate",
            () -> modelCapability.generate(prompt),
            GenerationUnavailableException::new);

    if (text == null || text.isBlank()) {
      meterRegistry.counter("generation.requests.failure").increment();
      throw new GenerationUnavailableException("Generation capability returned an empty answer");
    }
    meterRegistry.counter("generation.requests.success").increment();
    return text.strip();
  }
}
