package org.folio.node2object.processors;

import static org.apache.commons.lang3.StringUtils.defaultString;

import java.util.regex.Pattern;
import org.folio.node2object.domain.XmlElement;

/**
 * Infers a JSON scalar from raw XML text. Trials run in fixed order: finite number, then boolean,
 * then the text itself.
 */
public final class TextValueParser {

  /**
   * Plain decimal literal: optional sign, digits with an optional fraction or a bare fraction,
   * optional exponent. Excludes what {@link Double#parseDouble(String)} would also accept, like
   * surrounding whitespace, hex floats and {@code d}/{@code f} suffixes.
   */
  private static final Pattern DECIMAL_PATTERN =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private TextValueParser() {
    throw new IllegalStateException("Utility class");
  }

  /**
   * Converts text to a {@link Double}, {@link Boolean} or {@link String}.
   *
   * @param text raw text, never null
   * @return the first successful interpretation; never null
   */
  public static Object parseText(String text) {
    Double number = parseFiniteNumber(text);
    if (number != null) {
      return number;
    }
    if ("true".equals(text)) {
      return Boolean.TRUE;
    }
    if ("false".equals(text)) {
      return Boolean.FALSE;
    }
    return text;
  }

  /**
   * Parses the element's text followed by its CDATA content.
   */
  public static Object parseTextContents(XmlElement element) {
    return parseText(defaultString(element.getText()) + defaultString(element.getCdata()));
  }

  private static Double parseFiniteNumber(String text) {
    if (!DECIMAL_PATTERN.matcher(text).matches()) {
      return null;
    }
    double value = Double.parseDouble(text);
    // overflow, e.g. 1e400, is not a JSON number
    return Double.isFinite(value) ? value : null;
  }
}
