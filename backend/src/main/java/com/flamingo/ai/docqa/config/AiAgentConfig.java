package com.flamingo.ai.docqa.config;

import com.flamingo.ai.docqa.agent.DocumentAnswerAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Pattern: define the agent interface with @SystemMessage/@UserMessage, build the concrete
 * implementation using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Grounded answering agent. Stateless: every call carries its own context in the prompt. */
  @Bean
  public DocumentAnswerAgent documentAnswerAgent(ChatModel chatModel) {
    return AiServices.builder(DocumentAnswerAgent.class).chatModel(chatModel).build();
  }
}
