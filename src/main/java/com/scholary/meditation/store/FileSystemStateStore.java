package com.scholary.meditation.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores snapshots as JSON files in a single flat directory.
 *
 * <p>File names follow {@code state_<step-id>_<yyyyMMdd_HHmmss_SSS>.json}. The timestamp is fixed
 * width, so within one step lexical order is write order. Timestamps issued by one store instance
 * are strictly increasing: a save that lands in the same millisecond as the previous one is moved
 * to the next millisecond.
 */
public class FileSystemStateStore implements StateStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemStateStore.class);

  static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
  private static final String PREFIX = "state_";
  private static final String SUFFIX = ".json";
  private static final int MAX_CREATE_ATTEMPTS = 100;

  private final Path directory;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private LocalDateTime lastTimestamp;

  public FileSystemStateStore(Path directory, ObjectMapper objectMapper, Clock clock) {
    this.directory = directory;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public synchronized String save(PipelineState state, PipelineStep step) {
    byte[] json;
    try {
      json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state);
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new StateStoreException("Failed to prepare snapshot for step " + step, e);
    }

    for (int attempt = 0; attempt < MAX_CREATE_ATTEMPTS; attempt++) {
      String snapshotId = PREFIX + step.id() + "_" + nextTimestamp() + SUFFIX;
      Path file = directory.resolve(snapshotId);
      try (OutputStream out =
          Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
        out.write(json);
      } catch (FileAlreadyExistsException e) {
        // Written by another store on the same directory; try the next millisecond.
        continue;
      } catch (IOException e) {
        throw new StateStoreException("Failed to write snapshot " + snapshotId, e);
      }
      LOGGER.debug("Saved snapshot {} ({} bytes)", snapshotId, json.length);
      return snapshotId;
    }
    throw new StateStoreException(
        "Could not find a free snapshot name for step " + step + " in " + directory);
  }

  @Override
  public PipelineState load(String snapshotId) {
    Path file = resolve(snapshotId);
    try {
      return objectMapper.readValue(Files.readAllBytes(file), PipelineState.class);
    } catch (NoSuchFileException e) {
      throw new SnapshotNotFoundException(snapshotId);
    } catch (IOException | RuntimeException e) {
      throw new StateStoreException("Failed to load snapshot " + snapshotId, e);
    }
  }

  @Override
  public Optional<String> latest(PipelineStep step) {
    String prefix = PREFIX + step.id() + "_";
    return snapshotNames().filter(name -> name.startsWith(prefix)).max(Comparator.naturalOrder());
  }

  @Override
  public Optional<String> latest() {
    PipelineStep[] steps = PipelineStep.values();
    for (int i = steps.length - 1; i >= 0; i--) {
      Optional<String> latest = latest(steps[i]);
      if (latest.isPresent()) {
        return latest;
      }
    }
    return Optional.empty();
  }

  @Override
  public List<String> list() {
    return snapshotNames()
        .sorted(Comparator.comparing(FileSystemStateStore::timestampOf).thenComparing(name -> name))
        .collect(Collectors.toList());
  }

  public Path getDirectory() {
    return directory;
  }

  private Stream<String> snapshotNames() {
    if (!Files.isDirectory(directory)) {
      return Stream.empty();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .map(path -> path.getFileName().toString())
          .filter(name -> name.startsWith(PREFIX) && name.endsWith(SUFFIX))
          .filter(name -> name.indexOf('_', PREFIX.length()) > 0)
          .collect(Collectors.toList())
          .stream();
    } catch (IOException e) {
      throw new StateStoreException("Failed to list snapshots in " + directory, e);
    }
  }

  private Path resolve(String snapshotId) {
    if (snapshotId == null || snapshotId.isBlank()) {
      throw new SnapshotNotFoundException(String.valueOf(snapshotId));
    }
    String name = Path.of(snapshotId).getFileName().toString();
    if (!name.endsWith(SUFFIX)) {
      name = name + SUFFIX;
    }
    return directory.resolve(name);
  }

  /** Timestamps are UTC so names keep sorting in time order across offset changes. */
  private String nextTimestamp() {
    LocalDateTime now =
        LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    if (lastTimestamp != null && !now.isAfter(lastTimestamp)) {
      now = lastTimestamp.plus(1, ChronoUnit.MILLIS);
    }
    lastTimestamp = now;
    return TIMESTAMP_FORMAT.format(now);
  }

  /** The timestamp part of a snapshot name; step ids never contain underscores. */
  private static String timestampOf(String name) {
    int start = name.indexOf('_', PREFIX.length()) + 1;
    return name.substring(start, name.length() - SUFFIX.length());
  }
}
