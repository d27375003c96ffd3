package com.scholary.meditation.generation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes structured (JSON) answers from the generative text service.
 *
 * <p>Decoding is strict: the answer, minus an optional markdown code fence, must be exactly the
 * expected JSON. A malformed answer is sent back to the service for reformatting, up to the
 * configured number of attempts; after that the caller's fallback value is used. The result says
 * which path was taken so the stage can record a warning.
 */
public class StructuredOutputParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(StructuredOutputParser.class);

  private static final Pattern CODE_FENCE =
      Pattern.compile("^```[a-zA-Z]*\\s*\\n?(.*?)\\n?```$", Pattern.DOTALL);

  private static final String REFORMAT_SYSTEM_PROMPT =
      "You convert text into valid JSON. Return only the JSON document, with no explanation and"
          + " no markdown.";

  private final GenerativeTextClient client;
  private final ObjectMapper objectMapper;
  private final int reformatAttempts;

  public StructuredOutputParser(
      GenerativeTextClient client, ObjectMapper objectMapper, int reformatAttempts) {
    this.client = client;
    this.objectMapper = objectMapper;
    this.reformatAttempts = reformatAttempts;
  }

  /** Result of a decode; {@code fallbackUsed} is true when {@code value} is the fallback. */
  public record Decoded<T>(T value, boolean fallbackUsed, int reformatAttempts) {}

  public <T> Decoded<T> decode(
      String raw, Class<T> type, String schemaHint, Supplier<T> fallback) {
    return decode(raw, objectMapper.constructType(type), schemaHint, fallback);
  }

  public <T> Decoded<T> decode(
      String raw, TypeReference<T> type, String schemaHint, Supplier<T> fallback) {
    return decode(raw, objectMapper.getTypeFactory().constructType(type), schemaHint, fallback);
  }

  private <T> Decoded<T> decode(
      String raw, JavaType type, String schemaHint, Supplier<T> fallback) {
    String candidate = raw;
    for (int attempt = 0; ; attempt++) {
      try {
        T value = strictDecode(candidate, type);
        if (attempt > 0) {
          LOGGER.info(
              "Decoded {} after {} reformat attempt(s)",
              type.getRawClass().getSimpleName(),
              attempt);
        }
        return new Decoded<>(value, false, attempt);
      } catch (IOException | RuntimeException e) {
        LOGGER.warn(
            "Could not decode {} (attempt {}): {}",
            type.getRawClass().getSimpleName(),
            attempt + 1,
            e.getMessage());
      }

      if (attempt >= reformatAttempts) {
        LOGGER.warn(
            "Using fallback {} after {} reformat attempt(s)",
            type.getRawClass().getSimpleName(),
            attempt);
        return new Decoded<>(fallback.get(), true, attempt);
      }

      try {
        candidate =
            client.generate(
                REFORMAT_SYSTEM_PROMPT,
                reformatPrompt(candidate, schemaHint),
                GenerationOptions.withTemperature(0.0));
      } catch (GenerationException e) {
        LOGGER.warn("Reformat request failed, using fallback: {}", e.getMessage());
        return new Decoded<>(fallback.get(), true, attempt + 1);
      }
    }
  }

  <T> T strictDecode(String raw, JavaType type) throws IOException {
    if (raw == null || raw.isBlank()) {
      throw new IOException("Empty response");
    }
    T value = objectMapper.readValue(stripCodeFence(raw), type);
    if (value == null) {
      throw new IOException("Response decoded to null");
    }
    return value;
  }

  static String stripCodeFence(String raw) {
    String trimmed = raw.trim();
    Matcher matcher = CODE_FENCE.matcher(trimmed);
    return matcher.matches() ? matcher.group(1).trim() : trimmed;
  }

  private static String reformatPrompt(String previous, String schemaHint) {
    return "The following response could not be parsed as JSON matching this structure:\n\n"
        + schemaHint
        + "\n\nReformat it as valid JSON with exactly that structure. Return only the JSON.\n\n"
        + "Response:\n"
        + (previous == null ? "" : previous);
  }
}
