package com.flamingo.ai.casestudy.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>Only active when an API key is configured. Without one no model or agent beans exist and
 * generation always takes the heuristic path.
 */
@Configuration
@ConditionalOnExpression(LangChain4jConfig.BACKEND_CONFIGURED)
public class LangChain4jConfig {

  /** SpEL condition that holds when an OpenAI API key is configured. */
  public static final String BACKEND_CONFIGURED = "!'${langchain4j.openai.api-key:}'.isBlank()";

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:4000}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.timeout-seconds:60}")
  private int timeoutSeconds;

  /** JSON-mode model used for case study synthesis. */
  @Bean
  public ChatModel chatModel() {
    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  /** Plain-text model used by the editor agent. */
  @Bean
  public ChatModel textChatModel() {
    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .logRequests(false)
        .logResponses(false)
        .build();
  }
}
