package com.scholary.meditation.synthesis;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.polly.PollyClient;
import software.amazon.awssdk.services.polly.model.SynthesizeSpeechRequest;
import software.amazon.awssdk.services.polly.model.SynthesizeSpeechResponse;
import software.amazon.awssdk.services.polly.model.TextType;

/**
 * Amazon Polly implementation of SpeechSynthesizer.
 *
 * <p>Markup is sent as SSML. The SDK retries throttling and 5xx responses on its own; anything that
 * still fails is reported as {@link SynthesisException} and the partly written file is removed.
 */
public class PollySpeechSynthesizer implements SpeechSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(PollySpeechSynthesizer.class);

  private final PollyClient pollyClient;
  private final SynthesisProperties properties;

  public PollySpeechSynthesizer(PollyClient pollyClient, SynthesisProperties properties) {
    this.pollyClient = pollyClient;
    this.properties = properties;
  }

  @Override
  public Path synthesize(String markup, String voiceId, String languageCode, Path outputFile) {
    LOGGER.debug(
        "Synthesizing {} chars: voice={}, language={}, engine={}",
        markup.length(),
        voiceId,
        languageCode,
        properties.engine());

    SynthesizeSpeechRequest request =
        SynthesizeSpeechRequest.builder()
            .text(markup)
            .textType(TextType.SSML)
            .outputFormat(properties.outputFormat())
            .voiceId(voiceId)
            .languageCode(languageCode)
            .engine(properties.engine())
            .build();

    try (ResponseInputStream<SynthesizeSpeechResponse> audio =
        pollyClient.synthesizeSpeech(request)) {
      writeAudio(audio, outputFile);
    } catch (SdkException e) {
      deleteQuietly(outputFile);
      throw new SynthesisException("Polly synthesis failed: " + e.getMessage(), e);
    } catch (IOException e) {
      deleteQuietly(outputFile);
      throw new SynthesisException("Failed to write audio to " + outputFile, e);
    }

    LOGGER.info("Audio content written to file {}", outputFile);
    return outputFile;
  }

  private static void writeAudio(InputStream audio, Path outputFile) throws IOException {
    Path parent = outputFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    long bytes = Files.copy(audio, outputFile, StandardCopyOption.REPLACE_EXISTING);
    if (bytes == 0) {
      throw new IOException("Polly returned an empty audio stream");
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}", file, e);
    }
  }
}
