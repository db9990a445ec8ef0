package com.flamingo.ai.docqa.service.rag.capability;

import com.flamingo.ai.docqa.agent.DocumentAnswerAgent;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** {@link ModelCapability} backed by a LangChain4j embedding model and answering agent. */
@Component
public class LangChain4jModelCapability implements ModelCapability {

  private final EmbeddingModel embeddingModel;
  private final DocumentAnswerAgent documentAnswerAgent;
  private final String embeddingModelName;

  public LangChain4jModelCapability(
      EmbeddingModel embeddingModel,
      DocumentAnswerAgent documentAnswerAgent,
      @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
          String embeddingModelName) {
    this.embeddingModel = embeddingModel;
    this.documentAnswerAgent = documentAnswerAgent;
    this.embeddingModelName = embeddingModelName;
  }

  @Override
  public float[] embed(String text) {
    Response<Embedding> response = embeddingModel.embed(text);
    return response.content().vector();
  }

  @Override
  public String generate(String prompt) {
    return documentAnswerAgent.answer(prompt);
  }

  @Override
  public String embeddingModelId() {
    return embeddingModelName;
  }
}
