package com.flamingo.ai.houseanalysis.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/** Configuration for the HTTP client talking to the OpenAI Files and Responses APIs. */
@Configuration
public class OpenAiClientConfig {

  @Bean(name = "openAiWebClient")
  public WebClient openAiWebClient(InferenceConfig inferenceConfig) {
    InferenceConfig.OpenAi openai = inferenceConfig.getOpenai();
    validateApiKey(openai.getApiKey());

    return WebClient.builder()
        .baseUrl(openai.getBaseUrl())
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + openai.getApiKey())
        .codecs(
            configurer -> configurer.defaultCodecs().maxInMemorySize(openai.getMaxInMemorySize()))
        .build();
  }

  private void validateApiKey(String apiKey) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
