package com.flamingo.ai.docqa.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;

/**
 * AI agent that answers a question from the document excerpts embedded in the prompt.
 *
 * <p>The prompt is assembled by the synthesizer; this agent only adds the grounding rules.
 */
public interface DocumentAnswerAgent {

  @SystemMessage(
      """
        You are a careful assistant that answers questions about a single uploaded document.

        Rules:
        - Use ONLY the numbered document excerpts provided in the message.
        - If the excerpts do not contain the answer, reply exactly:
          "The answer is not found in the document."
        - Keep the answer concise and factual. Do not speculate.
        - When helpful, cite excerpts as [Source N].
        """)
  String answer(@UserMessage String prompt);
}
