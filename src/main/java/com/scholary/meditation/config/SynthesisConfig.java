package com.scholary.meditation.config;

import com.scholary.meditation.audio.AudioConcatenator;
import com.scholary.meditation.synthesis.ChunkedSpeechSynthesizer;
import com.scholary.meditation.synthesis.MarkupChunker;
import com.scholary.meditation.synthesis.PollySpeechSynthesizer;
import com.scholary.meditation.synthesis.SpeechSynthesizer;
import com.scholary.meditation.synthesis.SynthesisProperties;
import com.scholary.meditation.synthesis.VoiceCatalog;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.polly.PollyClient;

/**
 * Configuration for speech synthesis.
 *
 * <p>This wires up the Polly client using properties from application.yml. Credentials come from
 * the default AWS provider chain (environment, profile, instance role).
 */
@Configuration
@EnableConfigurationProperties(SynthesisProperties.class)
public class SynthesisConfig {

  @Bean(destroyMethod = "close")
  public PollyClient pollyClient(SynthesisProperties properties) {
    return PollyClient.builder()
        .region(Region.of(properties.region()))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .overrideConfiguration(
            ClientOverrideConfiguration.builder()
                .apiCallTimeout(Duration.ofSeconds(properties.apiCallTimeoutSeconds()))
                .build())
        .build();
  }

  @Bean
  public SpeechSynthesizer speechSynthesizer(
      PollyClient pollyClient, SynthesisProperties properties) {
    return new PollySpeechSynthesizer(pollyClient, properties);
  }

  @Bean
  public MarkupChunker markupChunker() {
    return new MarkupChunker();
  }

  @Bean
  public ChunkedSpeechSynthesizer chunkedSpeechSynthesizer(
      SpeechSynthesizer speechSynthesizer,
      MarkupChunker markupChunker,
      AudioConcatenator audioConcatenator,
      SynthesisProperties properties,
      PipelineProperties pipelineProperties,
      Clock clock) {
    return new ChunkedSpeechSynthesizer(
        speechSynthesizer,
        markupChunker,
        audioConcatenator,
        properties,
        pipelineProperties.storage().audioPath(),
        clock);
  }

  @Bean
  public VoiceCatalog voiceCatalog() {
    return new VoiceCatalog();
  }
}
