package com.scholary.meditation.config;

import com.scholary.meditation.audio.AudioConcatenator;
import com.scholary.meditation.audio.AudioMixer;
import com.scholary.meditation.audio.AudioProbe;
import com.scholary.meditation.audio.FfmpegCommandRunner;
import com.scholary.meditation.audio.FfmpegProperties;
import com.scholary.meditation.audio.MixingProperties;
import com.scholary.meditation.audio.SoundscapeSelector;
import java.util.Random;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for ffmpeg-related beans.
 *
 * <p>Enables the FfmpegProperties and MixingProperties to be loaded from application.yml. The
 * mixer and the soundscape selector share one {@link Random}, seeded when {@code
 * meditation.mixing.randomSeed} is set.
 */
@Configuration
@EnableConfigurationProperties({FfmpegProperties.class, MixingProperties.class})
public class FfmpegConfig {

  @Bean
  public FfmpegCommandRunner ffmpegCommandRunner(FfmpegProperties properties) {
    return new FfmpegCommandRunner(properties);
  }

  @Bean
  public AudioProbe audioProbe(FfmpegCommandRunner runner) {
    return new AudioProbe(runner);
  }

  @Bean
  public AudioConcatenator audioConcatenator(FfmpegCommandRunner runner) {
    return new AudioConcatenator(runner);
  }

  @Bean
  public Random mixingRandom(MixingProperties properties) {
    return properties.randomSeed() == null ? new Random() : new Random(properties.randomSeed());
  }

  @Bean
  public AudioMixer audioMixer(
      FfmpegCommandRunner runner,
      AudioProbe probe,
      FfmpegProperties ffmpegProperties,
      MixingProperties mixingProperties,
      Random mixingRandom) {
    return new AudioMixer(runner, probe, ffmpegProperties, mixingProperties, mixingRandom);
  }

  @Bean
  public SoundscapeSelector soundscapeSelector(Random mixingRandom) {
    return new SoundscapeSelector(mixingRandom);
  }
}
