package com.scholary.meditation.audio;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks a background file for a soundscape tag.
 *
 * <p>Files whose name contains the tag (case-insensitive) are preferred; otherwise any audio file
 * in the directory will do. Ties are broken at random.
 */
public class SoundscapeSelector {

  private static final Logger LOGGER = LoggerFactory.getLogger(SoundscapeSelector.class);

  static final Set<String> AUDIO_EXTENSIONS = Set.of(".mp3", ".wav", ".ogg", ".m4a", ".flac");

  private final Random random;

  public SoundscapeSelector(Random random) {
    this.random = random;
  }

  /**
   * Select a soundscape file.
   *
   * @throws NoSoundscapeAvailableException if the directory is missing or holds no audio files
   */
  public Path select(Path directory, String tag) {
    List<Path> candidates = candidates(directory);
    if (candidates.isEmpty()) {
      throw new NoSoundscapeAvailableException(directory);
    }

    if (tag != null && !tag.isBlank()) {
      String needle = tag.toLowerCase(Locale.ROOT);
      List<Path> matches =
          candidates.stream()
              .filter(file -> fileName(file).contains(needle))
              .collect(Collectors.toList());
      if (!matches.isEmpty()) {
        return pick(matches);
      }
      LOGGER.warn("No soundscape matches '{}' in {}, picking at random", tag, directory);
    }
    return pick(candidates);
  }

  private Path pick(List<Path> files) {
    return files.get(random.nextInt(files.size()));
  }

  private static List<Path> candidates(Path directory) {
    if (directory == null || !Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(SoundscapeSelector::isAudioFile)
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list soundscapes in " + directory, e);
    }
  }

  private static String fileName(Path file) {
    return file.getFileName().toString().toLowerCase(Locale.ROOT);
  }

  private static boolean isAudioFile(Path file) {
    String name = fileName(file);
    int dot = name.lastIndexOf('.');
    return dot > 0 && AUDIO_EXTENSIONS.contains(name.substring(dot));
  }
}
