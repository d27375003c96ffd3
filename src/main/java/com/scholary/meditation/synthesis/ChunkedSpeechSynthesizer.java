package com.scholary.meditation.synthesis;

import com.scholary.meditation.audio.AudioConcatenator;
import com.scholary.meditation.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes markup of any length by splitting it under the provider's size limit.
 *
 * <p>Markup within the limit is synthesized with exactly one provider call. Longer markup is split
 * by the {@link MarkupChunker}; fragments are synthesized one at a time, in order, and each
 * fragment's file must exist and be non-empty before the next one is requested. The fragment files
 * are then joined with a stream copy and deleted.
 *
 * <p>Any failure aborts the whole document: fragment files already written are deleted and a
 * {@link SynthesisException} is thrown. A partial narration is never returned.
 */
public class ChunkedSpeechSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedSpeechSynthesizer.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

  private final SpeechSynthesizer synthesizer;
  private final MarkupChunker chunker;
  private final AudioConcatenator concatenator;
  private final SynthesisProperties properties;
  private final Path outputDir;
  private final Clock clock;

  public ChunkedSpeechSynthesizer(
      SpeechSynthesizer synthesizer,
      MarkupChunker chunker,
      AudioConcatenator concatenator,
      SynthesisProperties properties,
      Path outputDir,
      Clock clock) {
    this.synthesizer = synthesizer;
    this.chunker = chunker;
    this.concatenator = concatenator;
    this.properties = properties;
    this.outputDir = outputDir;
    this.clock = clock;
  }

  /**
   * Render markup to a single audio file.
   *
   * @return the narration file
   * @throws SynthesisException if any fragment or the concatenation fails
   */
  public Path synthesize(String markup, String voiceId, String languageCode) {
    if (markup == null || markup.isBlank()) {
      throw new IllegalArgumentException("No markup to synthesize");
    }
    createOutputDir();
    String timestamp = TIMESTAMP_FORMAT.format(LocalDateTime.now(clock));
    String extension = "." + properties.fileExtension();
    int maxChars = properties.maxChunkChars();

    if (markup.length() <= maxChars) {
      LOGGER.info("Markup is within limits ({} chars), no chunking needed", markup.length());
      Path output = outputDir.resolve("meditation_audio_" + voiceId + "_" + timestamp + extension);
      try {
        return synthesizeFragment(markup, voiceId, languageCode, output, 1, 1);
      } catch (SynthesisException e) {
        deleteQuietly(output);
        throw e;
      }
    }

    LOGGER.info(
        "Markup exceeds the {} char synthesis limit ({} chars), splitting into fragments",
        maxChars,
        markup.length());
    List<String> fragments = chunker.split(markup, maxChars);

    List<Path> written = new ArrayList<>();
    Path combined = outputDir.resolve("meditation_voice_" + timestamp + extension);
    try {
      for (int i = 0; i < fragments.size(); i++) {
        Path part =
            outputDir.resolve(
                "meditation_audio_" + voiceId + "_" + timestamp + "_chunk_" + (i + 1) + extension);
        written.add(part);
        synthesizeFragment(fragments.get(i), voiceId, languageCode, part, i + 1, fragments.size());
      }

      if (written.size() == 1) {
        return written.get(0);
      }

      concatenator.concat(written, combined);
      requireAudio(combined, "Concatenated narration");
      deleteAll(written);
      LOGGER.info("Combined {} fragments into {}", written.size(), combined);
      return combined;
    } catch (SynthesisException e) {
      deleteAll(written);
      deleteQuietly(combined);
      throw e;
    } catch (IOException e) {
      deleteAll(written);
      deleteQuietly(combined);
      throw new SynthesisException("Failed to concatenate audio fragments: " + e.getMessage(), e);
    }
  }

  private Path synthesizeFragment(
      String fragment, String voiceId, String languageCode, Path output, int index, int total) {
    LOGGER.info("Generating audio for fragment {}/{} ({} chars)", index, total, fragment.length());
    long start = System.currentTimeMillis();
    Path file;
    try {
      file = synthesizer.synthesize(fragment, voiceId, languageCode, output);
    } catch (SynthesisException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SynthesisException(
          "Fragment " + index + "/" + total + " failed: " + e.getMessage(), e);
    }
    requireAudio(file, "Fragment " + index + "/" + total);
    structuredLogger.logFragmentSynthesized(
        index, total, fragment.length(), System.currentTimeMillis() - start);
    return file;
  }

  private static void requireAudio(Path file, String what) {
    try {
      if (file == null || !Files.isRegularFile(file) || Files.size(file) == 0) {
        throw new SynthesisException(what + " produced no audio");
      }
    } catch (IOException e) {
      throw new SynthesisException(what + " could not be checked: " + e.getMessage(), e);
    }
  }

  private void createOutputDir() {
    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new SynthesisException("Failed to create audio directory " + outputDir, e);
    }
  }

  private static void deleteAll(List<Path> files) {
    for (Path file : files) {
      deleteQuietly(file);
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
