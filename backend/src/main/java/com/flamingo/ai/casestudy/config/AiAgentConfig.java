package com.flamingo.ai.casestudy.config;

import com.flamingo.ai.casestudy.agent.CaseStudyWriterAgent;
import com.flamingo.ai.casestudy.agent.TextEditorAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Shares the activation condition of {@link LangChain4jConfig}.
 */
@Configuration
@ConditionalOnExpression(LangChain4jConfig.BACKEND_CONFIGURED)
public class AiAgentConfig {

  /** Case study writer. Uses the JSON-mode chat model. */
  @Bean
  public CaseStudyWriterAgent caseStudyWriterAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(CaseStudyWriterAgent.class).chatModel(chatModel).build();
  }

  /** Text editor for improve, simplify and extend. Uses the free-form text model. */
  @Bean
  public TextEditorAgent textEditorAgent(@Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(TextEditorAgent.class).chatModel(textChatModel).build();
  }
}
