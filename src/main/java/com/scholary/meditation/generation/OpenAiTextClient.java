package com.scholary.meditation.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>Network failures, 429 and 5xx responses are retried with exponential backoff and jitter. Other
 * 4xx responses fail fast: a bad key or model name will not fix itself.
 */
public class OpenAiTextClient implements GenerativeTextClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiTextClient.class);

  private final HttpClient httpClient;
  private final GenerationProperties properties;
  private final ObjectMapper objectMapper;

  public OpenAiTextClient(GenerationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized generation client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public String generate(String systemPrompt, String userPrompt, GenerationOptions options) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptGenerate(systemPrompt, userPrompt, options);
      } catch (IOException | InterruptedException e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
          throw new GenerationException("Generation interrupted", e);
        }
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Generation attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Generation interrupted", ie);
          }
        }
      }
    }

    throw new GenerationException(
        String.format("Generation failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private String attemptGenerate(
      String systemPrompt, String userPrompt, GenerationOptions options)
      throws IOException, InterruptedException {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/chat/completions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(buildRequestBody(systemPrompt, userPrompt, options)));
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }

    HttpResponse<String> response =
        httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());

    int status = response.statusCode();
    if (status == 429 || status >= 500) {
      throw new IOException(
          String.format("Generation API returned status %d: %s", status, response.body()));
    }
    if (status != 200) {
      throw new GenerationException(
          String.format("Generation API returned status %d: %s", status, response.body()));
    }

    String content = extractContent(response.body());
    LOGGER.debug("Generated {} chars", content.length());
    return content;
  }

  String buildRequestBody(String systemPrompt, String userPrompt, GenerationOptions options)
      throws IOException {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    ArrayNode messages = body.putArray("messages");
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      messages.addObject().put("role", "system").put("content", systemPrompt);
    }
    messages.addObject().put("role", "user").put("content", userPrompt);
    body.put("temperature", options.temperature());
    if (options.maxTokens() != null) {
      body.put("max_tokens", options.maxTokens());
    }
    return objectMapper.writeValueAsString(body);
  }

  String extractContent(String responseBody) throws IOException {
    JsonNode choices = objectMapper.readTree(responseBody).path("choices");
    JsonNode content = choices.path(0).path("message").path("content");
    if (!content.isTextual()) {
      throw new GenerationException("Invalid response format from generation API");
    }
    return content.asText();
  }
}
