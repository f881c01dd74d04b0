package com.flamingo.ai.coursepipeline.config;

import com.flamingo.ai.coursepipeline.agent.ContentStructuringAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agent interfaces declare their prompts with @SystemMessage/@UserMessage; concrete
 * implementations are generated by AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Content structuring agent, only created when structuring is enabled. */
  @Bean
  @ConditionalOnProperty(
      name = "pipeline.structuring.enabled",
      havingValue = "true",
      matchIfMissing = true)
  public ContentStructuringAgent contentStructuringAgent(ChatModel chatModel) {
    return AiServices.builder(ContentStructuringAgent.class).chatModel(chatModel).build();
  }
}
