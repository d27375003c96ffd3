package com.scholary.meditation.synthesis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits an SSML document into standalone {@code <speak>} fragments no longer than a character
 * ceiling.
 *
 * <p>Strategy, in order of preference:
 *
 * <ol>
 *   <li>Split between paragraphs: the outermost {@code <p>} elements, or {@code <s>} elements when
 *       there are no paragraphs. A paragraph nested in style wrappers such as {@code <prosody>} is
 *       re-wrapped in copies of those wrappers, so every fragment keeps its styling. Nodes between
 *       paragraphs (breaks, loose text) travel with the paragraph that follows them.
 *   <li>Paragraphs are packed greedily. Length is measured on the serialized fragment including the
 *       {@code <speak>} root, since that is what the provider counts. Every fragment carries the
 *       source root's attributes, such as {@code xml:lang}.
 *   <li>Markup without paragraphs, and any paragraph too large on its own, is reduced to plain
 *       text, split into sentences and repacked. A sentence that still does not fit is split
 *       between words, and a word that does not fit is cut.
 * </ol>
 */
public class MarkupChunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(MarkupChunker.class);

  static final String OPEN = "<speak>";
  static final String CLOSE = "</speak>";
  private static final int WRAP_OVERHEAD = OPEN.length() + CLOSE.length();

  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern XML_DECLARATION = Pattern.compile("^<\\?xml[^>]*\\?>");

  /**
   * Split markup into fragments of at most {@code maxChars} characters each, in document order.
   *
   * @throws IllegalArgumentException if {@code maxChars} cannot hold even one character of text
   */
  public List<String> split(String markup, int maxChars) {
    if (maxChars <= WRAP_OVERHEAD) {
      throw new IllegalArgumentException("maxChars must exceed " + WRAP_OVERHEAD + ": " + maxChars);
    }

    String document = normalize(markup);
    Document doc = Jsoup.parse(document, "", Parser.xmlParser());
    doc.outputSettings().prettyPrint(false);
    Element speak = doc.selectFirst("speak");
    if (speak == null) {
      LOGGER.warn("No <speak> root after parsing, splitting as plain text");
      return splitPlainText(doc.text(), maxChars, OPEN);
    }
    String open = rootTag(speak, maxChars);

    Set<Element> units = paragraphUnits(speak);
    if (units.isEmpty()) {
      LOGGER.info("No paragraph structure found, splitting by sentences");
      return splitPlainText(speak.text(), maxChars, open);
    }

    List<String> segments = new ArrayList<>();
    List<String> pending = new ArrayList<>();
    collectSegments(speak, new ArrayList<>(), units, segments, pending);
    if (!pending.isEmpty() && !segments.isEmpty()) {
      int last = segments.size() - 1;
      segments.set(last, segments.get(last) + String.join("", pending));
    }

    List<String> fragments = pack(segments, maxChars, open);
    LOGGER.info(
        "Split {} chars of markup into {} fragments using {} paragraph units",
        markup.length(),
        fragments.size(),
        units.size());
    return fragments;
  }

  /** Drop any XML declaration and make sure the document has a {@code <speak>} root. */
  private static String normalize(String markup) {
    String text = XML_DECLARATION.matcher(markup.trim()).replaceFirst("").trim();
    if (!(text.startsWith("<speak") && text.endsWith(CLOSE))) {
      LOGGER.warn("Markup is not wrapped in <speak>, wrapping it");
      text = OPEN + text + CLOSE;
    }
    return text;
  }

  /** Opening root tag for each fragment; bare if the source attributes leave no room for text. */
  private static String rootTag(Element speak, int maxChars) {
    String open = "<speak" + speak.attributes().html() + ">";
    if (open.length() + CLOSE.length() >= maxChars) {
      LOGGER.warn("Root attributes do not fit the {} char ceiling, dropping them", maxChars);
      return OPEN;
    }
    return open;
  }

  /** Outermost {@code <p>} elements, or outermost {@code <s>} elements without paragraphs. */
  private static Set<Element> paragraphUnits(Element speak) {
    Set<Element> units = outermost(speak, "p");
    return units.isEmpty() ? outermost(speak, "s") : units;
  }

  private static Set<Element> outermost(Element root, String tag) {
    Set<Element> found = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Element candidate : root.getElementsByTag(tag)) {
      boolean nested = false;
      for (Element parent = candidate.parent();
          parent != null && parent != root;
          parent = parent.parent()) {
        if (parent.tagName().equals(tag)) {
          nested = true;
          break;
        }
      }
      if (!nested) {
        found.add(candidate);
      }
    }
    return found;
  }

  /**
   * Walk {@code parent}'s children in order. Each unit becomes one segment, prefixed by the nodes
   * seen since the previous unit. Wrappers holding units are descended into and recorded as
   * ancestors.
   */
  private void collectSegments(
      Element parent,
      List<Element> ancestors,
      Set<Element> units,
      List<String> segments,
      List<String> pending) {
    for (Node node : parent.childNodes()) {
      if (node instanceof TextNode && ((TextNode) node).isBlank()) {
        continue;
      }
      if (node instanceof Element && units.contains(node)) {
        String segment = String.join("", pending) + wrap(node.outerHtml(), ancestors);
        pending.clear();
        segments.add(segment);
      } else if (node instanceof Element && containsUnit((Element) node, units)) {
        ancestors.add((Element) node);
        collectSegments((Element) node, ancestors, units, segments, pending);
        ancestors.remove(ancestors.size() - 1);
      } else {
        pending.add(wrap(node.outerHtml(), ancestors));
      }
    }
  }

  private static boolean containsUnit(Element element, Set<Element> units) {
    for (Element descendant : element.getAllElements()) {
      if (units.contains(descendant)) {
        return true;
      }
    }
    return false;
  }

  /** Wrap serialized content in shallow copies of its ancestors, outermost first. */
  private static String wrap(String content, List<Element> ancestors) {
    StringBuilder open = new StringBuilder();
    StringBuilder close = new StringBuilder();
    for (Element ancestor : ancestors) {
      open.append('<').append(ancestor.tagName()).append(ancestor.attributes().html()).append('>');
    }
    for (int i = ancestors.size() - 1; i >= 0; i--) {
      close.append("</").append(ancestors.get(i).tagName()).append('>');
    }
    return open + content + close;
  }

  private List<String> pack(List<String> segments, int maxChars, String open) {
    int budget = maxChars - open.length() - CLOSE.length();
    List<String> fragments = new ArrayList<>();
    StringBuilder current = new StringBuilder();

    for (String segment : segments) {
      if (segment.length() > budget) {
        LOGGER.warn(
            "Paragraph of {} chars exceeds the {} char ceiling, splitting by sentences",
            segment.length(),
            maxChars);
        flush(current, fragments, open);
        String text = Jsoup.parse(segment, "", Parser.xmlParser()).text();
        fragments.addAll(splitPlainText(text, maxChars, open));
        continue;
      }
      if (current.length() + segment.length() > budget) {
        flush(current, fragments, open);
      }
      current.append(segment);
    }
    flush(current, fragments, open);
    return fragments;
  }

  private static void flush(StringBuilder current, List<String> fragments, String open) {
    if (current.length() > 0) {
      fragments.add(open + current + CLOSE);
      current.setLength(0);
    }
  }

  List<String> splitPlainText(String text, int maxChars) {
    return splitPlainText(text, maxChars, OPEN);
  }

  /** Sentence-level split of plain text; every piece is XML-escaped before it is measured. */
  private List<String> splitPlainText(String text, int maxChars, String open) {
    int budget = maxChars - open.length() - CLOSE.length();
    List<String> pieces = new ArrayList<>();

    for (String sentence : SENTENCE_BOUNDARY.split(text.trim())) {
      String trimmed = sentence.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      String escaped = escapeXml(trimmed);
      if (escaped.length() <= budget) {
        pieces.add(escaped);
        continue;
      }
      for (String word : WHITESPACE.split(trimmed)) {
        String escapedWord = escapeXml(word);
        if (escapedWord.length() <= budget) {
          pieces.add(escapedWord);
        } else {
          pieces.addAll(hardSplit(word, budget));
        }
      }
    }

    List<String> fragments = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String piece : pieces) {
      int needed = current.length() == 0 ? piece.length() : current.length() + 1 + piece.length();
      if (needed > budget) {
        flush(current, fragments, open);
      }
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(piece);
    }
    flush(current, fragments, open);
    return fragments;
  }

  /** Cut a word into escaped pieces of at most {@code budget} chars, never inside an entity. */
  private static List<String> hardSplit(String word, int budget) {
    List<String> pieces = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (int i = 0; i < word.length(); ) {
      int codePoint = word.codePointAt(i);
      String escaped = escapeXml(new String(Character.toChars(codePoint)));
      if (current.length() > 0 && current.length() + escaped.length() > budget) {
        pieces.add(current.toString());
        current.setLength(0);
      }
      current.append(escaped);
      i += Character.charCount(codePoint);
    }
    if (current.length() > 0) {
      pieces.add(current.toString());
    }
    return pieces;
  }

  static String escapeXml(String text) {
    StringBuilder escaped = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '&':
          escaped.append("&amp;");
          break;
        case '<':
          escaped.append("&lt;");
          break;
        case '>':
          escaped.append("&gt;");
          break;
        case '"':
          escaped.append("&quot;");
          break;
        case '\'':
          escaped.append("&apos;");
          break;
        default:
          escaped.append(c);
      }
    }
    return escaped.toString();
  }
}
