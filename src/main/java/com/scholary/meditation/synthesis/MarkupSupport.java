package com.scholary.meditation.synthesis;

import java.io.StringReader;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXParseException;

/** Helpers for handling SSML returned by the generation stages. */
public final class MarkupSupport {

  private static final Pattern SPEAK_DOCUMENT =
      Pattern.compile("<speak\\b[^>]*>.*</speak>", Pattern.DOTALL);
  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SECTION_MARKER = Pattern.compile("\\[[A-Z_ ]+\\]");

  private static final ErrorHandler SILENT =
      new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {}

        @Override
        public void error(SAXParseException exception) throws SAXParseException {
          throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXParseException {
          throw exception;
        }
      };

  private MarkupSupport() {}

  /** The first {@code <speak>...</speak>} document in free text, if there is one. */
  public static Optional<String> extractSpeak(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Matcher matcher = SPEAK_DOCUMENT.matcher(text);
    return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
  }

  /** Whether the markup parses as XML with a {@code <speak>} root. */
  public static boolean isWellFormed(String markup) {
    if (markup == null || markup.isBlank()) {
      return false;
    }
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setNamespaceAware(true);
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(SILENT);
      return "speak"
          .equals(
              builder
                  .parse(new InputSource(new StringReader(markup.trim())))
                  .getDocumentElement()
                  .getLocalName());
    } catch (Exception e) {
      return false;
    }
  }

  /**
   * A plain rendition of narration text: one {@code <p>} per paragraph, section markers removed,
   * a short pause between paragraphs.
   */
  public static String plainTextSpeak(String text) {
    StringBuilder markup = new StringBuilder(MarkupChunker.OPEN);
    String cleaned = SECTION_MARKER.matcher(text == null ? "" : text).replaceAll("");
    boolean first = true;
    for (String paragraph : PARAGRAPH_BREAK.split(cleaned.trim())) {
      String trimmed = paragraph.trim().replaceAll("\\s+", " ");
      if (trimmed.isEmpty()) {
        continue;
      }
      if (!first) {
        markup.append("<break time=\"1s\"/>");
      }
      markup.append("<p>").append(MarkupChunker.escapeXml(trimmed)).append("</p>");
      first = false;
    }
    return markup.append(MarkupChunker.CLOSE).toString();
  }
}
