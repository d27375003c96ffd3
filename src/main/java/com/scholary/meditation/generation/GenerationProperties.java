package com.scholary.meditation.generation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the generative text service.
 *
 * <p>{@code baseUrl} points at any OpenAI-compatible API. {@code reformatAttempts} bounds how many
 * times a malformed structured answer is sent back for reformatting before the stage falls back to
 * a default; {@code reviewIterations} bounds the markup review loop.
 */
@ConfigurationProperties(prefix = "generation")
@Validated
public record GenerationProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @PositiveOrZero int reformatAttempts,
    @Positive int reviewIterations) {}
