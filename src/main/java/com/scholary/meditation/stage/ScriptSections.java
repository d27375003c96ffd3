package com.scholary.meditation.stage;

import com.scholary.meditation.state.ScriptSection;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic section detection, used when the section analysis cannot be decoded.
 *
 * <p>Scripts are asked to mark sections as {@code [INTRODUCTION]}, {@code [BREATHING]} and so on;
 * when markers are present they win. Otherwise paragraphs are classified by keywords (English and
 * Spanish).
 */
final class ScriptSections {

  private static final Pattern MARKER = Pattern.compile("\\[([^\\]]+)\\]([^\\[]*)");
  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern BREATHING =
      Pattern.compile("inhala|exhala|respira|breathe|inhale|exhale");
  private static final Pattern BODY = Pattern.compile("body|cuerpo|scan|muscles|músculos");
  private static final Pattern IMAGERY = Pattern.compile("imagine|visualize|visualiza|imagina");

  private ScriptSections() {}

  static List<ScriptSection> detect(String content) {
    List<ScriptSection> marked = fromMarkers(content);
    return marked.isEmpty() ? fromParagraphs(content) : marked;
  }

  static List<ScriptSection> fromMarkers(String content) {
    List<ScriptSection> sections = new ArrayList<>();
    Matcher matcher = MARKER.matcher(content);
    while (matcher.find()) {
      String text = matcher.group(2).trim();
      if (!text.isEmpty()) {
        sections.add(new ScriptSection(normalizeType(matcher.group(1)), text));
      }
    }
    return sections;
  }

  static List<ScriptSection> fromParagraphs(String content) {
    String[] paragraphs = PARAGRAPH_BREAK.split(content.trim());
    List<ScriptSection> sections = new ArrayList<>();
    for (int i = 0; i < paragraphs.length; i++) {
      String paragraph = paragraphs[i].trim();
      if (paragraph.isEmpty()) {
        continue;
      }
      String lower = paragraph.toLowerCase(Locale.ROOT);
      String type;
      if (BREATHING.matcher(lower).find()) {
        type = "breathing";
      } else if (BODY.matcher(lower).find()) {
        type = "body_scan";
      } else if (IMAGERY.matcher(lower).find()) {
        type = "visualization";
      } else if (i == 0) {
        type = "introduction";
      } else if (i == paragraphs.length - 1) {
        type = "closing";
      } else {
        type = "body";
      }
      sections.add(new ScriptSection(type, paragraph));
    }
    return sections;
  }

  /** Map free-form marker names onto the standard section types. */
  static String normalizeType(String marker) {
    String type = marker.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    if (type.contains("intro")) {
      return "introduction";
    } else if (type.contains("breath")) {
      return "breathing";
    } else if (type.contains("body") && type.contains("scan")) {
      return "body_scan";
    } else if (type.contains("visual")) {
      return "visualization";
    } else if (type.contains("affirm")) {
      return "affirmations";
    } else if (type.contains("clos")) {
      return "closing";
    } else if (type.contains("ground")) {
      return "grounding";
    }
    return type;
  }
}
