package io.scoreread.parser;

/**
 * Text conversions shared by the score reader.
 *
 * <p>Numeric conversions are lenient the way older score writers require: surrounding whitespace
 * is ignored and unparsable text yields the caller's default instead of an exception.
 */
public final class ParsingUtils {
  private ParsingUtils() {}

  /**
   * Parses a decimal integer.
   *
   * @param text the text, may be {@code null}
   * @param defaultValue value returned for missing or unparsable text
   * @return the parsed value
   */
  public static int toInt(String text, int defaultValue) {
    if (text == null) {
      return defaultValue;
    }
    String s = text.trim();
    if (s.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * Parses a decimal floating point number.
   *
   * @param text the text, may be {@code null}
   * @param defaultValue value returned for missing or unparsable text
   * @return the parsed value
   */
  public static double toDouble(String text, double defaultValue) {
    if (text == null) {
      return defaultValue;
    }
    String s = text.trim();
    if (s.isEmpty()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(s);
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /** Escapes {@code <}, {@code >}, {@code &} and {@code "} as HTML entities. */
  public static String escapeHtml(CharSequence text) {
    StringBuilder sb = null;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      String replacement;
      switch (c) {
        case '<':
          replacement = "&lt;";
          break;
        case '>':
          replacement = "&gt;";
          break;
        case '&':
          replacement = "&amp;";
          break;
        case '"':
          replacement = "&quot;";
          break;
        default:
          replacement = null;
      }
      if (replacement != null) {
        if (sb == null) {
          sb = new StringBuilder(text.length() + 16);
          sb.append(text, 0, i);
        }
        sb.append(replacement);
      } else if (sb != null) {
        sb.append(c);
      }
    }
    return sb != null ? sb.toString() : text.toString();
  }

  /** Whether {@code text} consists of XML whitespace only. */
  public static boolean isWhitespace(CharSequence text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        return false;
      }
    }
    return true;
  }
}
