package com.scholary.meditation.audio;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for mixing narration over a soundscape.
 *
 * <p>{@code randomSeed} is optional. When set, background offsets, sample offsets and soundscape
 * picks repeat from run to run.
 */
@ConfigurationProperties(prefix = "meditation.mixing")
@Validated
public record MixingProperties(
    @NotBlank String soundscapeDir,
    @DecimalMin("0.0") @DecimalMax("1.0") double backgroundVolume,
    boolean makeSample,
    @Positive double sampleSeconds,
    @PositiveOrZero double fadeInSeconds,
    @PositiveOrZero double fadeOutSeconds,
    Long randomSeed) {}
