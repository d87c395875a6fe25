package com.flamingo.ai.houseanalysis.service.analysis.inference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.houseanalysis.config.InferenceConfig;
import com.flamingo.ai.houseanalysis.domain.model.AssetReference;
import com.flamingo.ai.houseanalysis.domain.model.InferenceRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * {@link InferenceClient} backed by the OpenAI Files API ({@code /v1/files}) for asset
 * registration and the Responses API ({@code /v1/responses}) for completions.
 */
@Component
@Slf4j
public class OpenAiInferenceClient implements InferenceClient {

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final String model;
  private final Duration registrationTimeout;
  private final Duration completionTimeout;

  public OpenAiInferenceClient(
      @Qualifier("openAiWebClient") WebClient webClient,
      ObjectMapper objectMapper,
      InferenceConfig inferenceConfig) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.model = inferenceConfig.getOpenai().getModel();
    this.registrationTimeout = inferenceConfig.getOpenai().getRegistrationTimeout();
    InferenceConfig.Invocation invocation = inferenceConfig.getInvocation();
    this.completionTimeout = invocation.getDeadline().plus(invocation.getAbandonGrace());
  }

  @Override
  public AssetReference registerAsset(String assetName, byte[] bytes, String purpose) {
    MultipartBodyBuilder body = new MultipartBodyBuilder();
    body.part("file", bytes).filename(assetName).contentType(mediaTypeOf(assetName));
    body.part("purpose", purpose);

    String json;
    try {
      json =
          webClient
              .post()
              .uri("/v1/files")
              .contentType(MediaType.MULTIPART_FORM_DATA)
              .body(BodyInserters.fromMultipartData(body.build()))
              .retrieve()
              .bodyToMono(String.class)
              .timeout(registrationTimeout)
              .block();
    } catch (WebClientResponseException e) {
      throw new InferenceTransportException(
          "Asset store rejected " + assetName + " with status " + e.getStatusCode().value(), e);
    } catch (RuntimeException e) {
      throw new InferenceTransportException(
          "Asset store call failed for " + assetName + ": " + e.getMessage(), e);
    }

    String handle = readTree(json, "asset registration").path("id").asText("");
    if (handle.isBlank()) {
      throw new InferenceTransportException("Asset store returned no handle for " + assetName);
    }
    return new AssetReference(handle);
  }

  @Override
  public String complete(InferenceRequest request) {
    String json;
    try {
      json =
          webClient
              .post()
              .uri("/v1/responses")
              .contentType(MediaType.APPLICATION_JSON)
              .accept(MediaType.APPLICATION_JSON)
              .bodyValue(buildPayload(request))
              .retrieve()
              .bodyToMono(String.class)
              .timeout(completionTimeout)
              .block();
    } catch (WebClientResponseException e) {
      throw new InferenceTransportException(
          "Completion failed with status " + e.getStatusCode().value(), e);
    } catch (RuntimeException e) {
      throw new InferenceTransportException("Completion call failed: " + e.getMessage(), e);
    }

    String text = extractOutputText(readTree(json, "completion"));
    if (text.isBlank()) {
      throw new InferenceTransportException("Completion response carried no output text");
    }
    return text;
  }

  Map<String, Object> buildPayload(InferenceRequest request) {
    List<Map<String, Object>> content = new ArrayList<>();
    content.add(Map.of("type", "input_text", "text", request.instructionText()));
    request
        .assetRefs()
        .forEach(ref -> content.add(Map.of("type", "input_image", "file_id", ref.handle())));

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("model", model);
    payload.put("input", List.of(Map.of("role", "user", "content", content)));
    return payload;
  }

  /**
   * Reads the answer text: the top-level {@code output_text} when present, otherwise every {@code
   * output_text} item of every {@code message} in {@code output}, joined by newlines.
   */
  private String extractOutputText(JsonNode root) {
    String direct = root.path("output_text").asText("");
    if (!direct.isBlank()) {
      return direct;
    }
    StringBuilder sb = new StringBuilder();
    for (JsonNode item : root.path("output")) {
      if (!"message".equals(item.path("type").asText())) {
        continue;
      }
      for (JsonNode part : item.path("content")) {
        if ("output_text".equals(part.path("type").asText())) {
          if (sb.length() > 0) {
            sb.append("\n");
          }
          sb.append(part.path("text").asText(""));
        }
      }
    }
    return sb.toString();
  }

  private JsonNode readTree(String json, String call) {
    if (json == null || json.isBlank()) {
      throw new InferenceTransportException("Empty response body from " + call + " call");
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      log.warn("Malformed {} response: {}", call, e.getOriginalMessage());
      throw new InferenceTransportException("Malformed response from " + call + " call", e);
    }
  }

  private MediaType mediaTypeOf(String assetName) {
    String lower = assetName.toLowerCase();
    if (lower.endsWith(".png")) {
      return MediaType.IMAGE_PNG;
    }
    if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
      return MediaType.IMAGE_JPEG;
    }
    if (lower.endsWith(".gif")) {
      return MediaType.IMAGE_GIF;
    }
    if (lower.endsWith(".webp")) {
      return MediaType.parseMediaType("image/webp");
    }
    if (lower.endsWith(".bmp")) {
      return MediaType.parseMediaType("image/bmp");
    }
    return MediaType.APPLICATION_OCTET_STREAM;
  }
}
