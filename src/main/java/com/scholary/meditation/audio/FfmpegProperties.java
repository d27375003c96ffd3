package com.scholary.meditation.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>Every ffmpeg/ffprobe invocation is killed after {@code timeoutSeconds}. The quality is the
 * libmp3lame VBR setting used when the mix is re-encoded (0-9, lower is better).
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive long timeoutSeconds,
    @PositiveOrZero int audioQuality) {}
