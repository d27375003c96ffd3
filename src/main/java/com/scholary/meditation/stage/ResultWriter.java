package com.scholary.meditation.stage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meditation.config.PipelineProperties;
import com.scholary.meditation.state.PipelineState;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Writes the summary of a finished meditation.
 *
 * <p>Format:
 *
 * <pre>
 * {
 *   "request": {...},
 *   "script": {"content": "...", "sections": [...]},
 *   "prosody_analysis": {...},
 *   "prosody_profile": {...},
 *   "audio_output": {"narration_file": "...", "mixed_file": "...", "status": "completed"}
 * }
 * </pre>
 */
@Component
public class ResultWriter {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

  private final ObjectMapper objectMapper;
  private final Path jsonDir;
  private final Clock clock;

  public ResultWriter(ObjectMapper objectMapper, PipelineProperties properties, Clock clock) {
    this(objectMapper, properties.storage().jsonPath(), clock);
  }

  ResultWriter(ObjectMapper objectMapper, Path jsonDir, Clock clock) {
    this.objectMapper = objectMapper;
    this.jsonDir = jsonDir;
    this.clock = clock;
  }

  public byte[] writeJson(PipelineState state) throws IOException {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("request", state.getRequest());
    summary.put("script", state.getScript());
    summary.put("prosody_analysis", state.getProsodyAnalysis());
    summary.put("prosody_profile", state.getProsodyProfile());
    summary.put("audio_output", state.getAudioOutput());

    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(summary);
  }

  /**
   * Save the summary to the JSON output directory.
   *
   * @return the summary file
   */
  public Path save(PipelineState state) throws IOException {
    Files.createDirectories(jsonDir);
    String timestamp = TIMESTAMP_FORMAT.format(LocalDateTime.now(clock));
    Path file = jsonDir.resolve("meditation_" + timestamp + ".json");
    Files.write(file, writeJson(state));
    return file;
  }
}
