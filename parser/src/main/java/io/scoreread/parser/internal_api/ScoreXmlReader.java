package io.scoreread.parser.internal_api;

import io.scoreread.parser.ParsingUtils;
import io.scoreread.parser.api.Color;
import io.scoreread.parser.api.ElementPosition;
import io.scoreread.parser.api.ErrorHandler;
import io.scoreread.parser.api.Fraction;
import io.scoreread.parser.api.MissingAttributeException;
import io.scoreread.parser.api.PointF;
import io.scoreread.parser.api.ReaderOptions;
import io.scoreread.parser.api.RectF;
import io.scoreread.parser.api.ScoreIOException;
import io.scoreread.parser.api.SizeF;
import java.io.InputStream;
import java.io.Reader;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forward-only token reader over a score document.
 *
 * <p>Element handlers are entered positioned on their start tag and must leave positioned on
 * their end tag, either by reading the content ({@link #readElementText()} and the typed readers)
 * or by {@link #skipCurrentElement()}. The usual loop is:
 *
 * <pre>{@code
 * while (reader.readNextStartElement()) {
 *   switch (reader.name()) {
 *     case "tick" -> ...;
 *     default -> reader.unknown();
 *   }
 * }
 * }</pre>
 */
public final class ScoreXmlReader implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ScoreXmlReader.class);

  private static final XMLInputFactory FACTORY = createFactory();

  private final XMLStreamReader in;
  private final String docName;
  private final int offsetLines;
  private final ErrorHandler errorHandler;

  private ScoreXmlReader(XMLStreamReader in, ReaderOptions options) {
    this.in = in;
    this.docName = options.docName();
    this.offsetLines = options.offsetLines();
    this.errorHandler = options.errorHandler();
  }

  private static XMLInputFactory createFactory() {
    XMLInputFactory factory = XMLInputFactory.newInstance();
    factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    return factory;
  }

  /**
   * Opens a reader over a byte stream. The stream is not closed by {@link #close()}.
   *
   * @throws ScoreIOException if the stream does not start like an XML document
   */
  public static ScoreXmlReader open(InputStream input, ReaderOptions options)
      throws ScoreIOException {
    ReaderOptions opts = options != null ? options : ReaderOptions.DEFAULT;
    try {
      return new ScoreXmlReader(FACTORY.createXMLStreamReader(input), opts);
    } catch (XMLStreamException e) {
      throw ScoreIOException.malformedStream(null, e);
    }
  }

  /** Opens a reader over character data, mostly useful for in-memory fragments. */
  public static ScoreXmlReader open(Reader input, ReaderOptions options) throws ScoreIOException {
    ReaderOptions opts = options != null ? options : ReaderOptions.DEFAULT;
    try {
      return new ScoreXmlReader(FACTORY.createXMLStreamReader(input), opts);
    } catch (XMLStreamException e) {
      throw ScoreIOException.malformedStream(null, e);
    }
  }

  public ErrorHandler errorHandler() {
    return errorHandler;
  }

  /** Current position, with the session line offset applied. */
  public ElementPosition position() {
    javax.xml.stream.Location l = in.getLocation();
    return new ElementPosition(
        (long) l.getLineNumber() + offsetLines, l.getColumnNumber(), docName);
  }

  /** Local name of the current start or end tag. */
  public String name() {
    return in.getLocalName();
  }

  public boolean isStartElement() {
    return in.getEventType() == XMLStreamConstants.START_ELEMENT;
  }

  public boolean isEndElement() {
    return in.getEventType() == XMLStreamConstants.END_ELEMENT;
  }

  /**
   * Advances to the next start tag inside the current element.
   *
   * @return {@code true} on a start tag, {@code false} once the end tag of the current element (or
   *     the end of the document) is reached
   */
  public boolean readNextStartElement() throws ScoreIOException {
    try {
      while (in.hasNext()) {
        int event = in.next();
        if (event == XMLStreamConstants.START_ELEMENT) {
          return true;
        }
        if (event == XMLStreamConstants.END_ELEMENT || event == XMLStreamConstants.END_DOCUMENT) {
          return false;
        }
      }
      return false;
    } catch (XMLStreamException e) {
      throw ScoreIOException.malformedStream(position(), e);
    }
  }

  /** Skips to the end tag of the current element, including everything nested in it. */
  public void skipCurrentElement() throws ScoreIOException {
    if (!isStartElement()) {
      return;
    }
    try {
      int depth = 1;
      while (depth > 0 && in.hasNext()) {
        int event = in.next();
        if (event == XMLStreamConstants.START_ELEMENT) {
          depth++;
        } else if (event == XMLStreamConstants.END_ELEMENT) {
          depth--;
        }
      }
    } catch (XMLStreamException e) {
      throw ScoreIOException.malformedStream(position(), e);
    }
  }

  /**
   * Reports the current element as not understood and skips it. Never fatal unless the configured
   * {@link ErrorHandler} decides otherwise.
   */
  public void unknown() throws ScoreIOException {
    errorHandler.handleUnknownElement(position(), name());
    skipCurrentElement();
  }

  /** Reports a missing attribute through the error handler. */
  public void report(MissingAttributeException e) {
    errorHandler.handleRecoverableError(e);
  }

  public boolean hasAttribute(String name) {
    return in.getAttributeValue(null, name) != null;
  }

  /**
   * @throws MissingAttributeException if the current element has no such attribute
   */
  public String attribute(String name) throws MissingAttributeException {
    String value = in.getAttributeValue(null, name);
    if (value == null) {
      throw new MissingAttributeException(name, name(), position());
    }
    return value;
  }

  public String attribute(String name, String defaultValue) {
    String value = in.getAttributeValue(null, name);
    return value != null ? value : defaultValue;
  }

  /**
   * @throws MissingAttributeException if the current element has no such attribute
   */
  public int intAttribute(String name) throws MissingAttributeException {
    return ParsingUtils.toInt(attribute(name), 0);
  }

  public int intAttribute(String name, int defaultValue) {
    return ParsingUtils.toInt(in.getAttributeValue(null, name), defaultValue);
  }

  /**
   * @throws MissingAttributeException if the current element has no such attribute
   */
  public double doubleAttribute(String name) throws MissingAttributeException {
    return ParsingUtils.toDouble(attribute(name), 0.0);
  }

  public double doubleAttribute(String name, double defaultValue) {
    return ParsingUtils.toDouble(in.getAttributeValue(null, name), defaultValue);
  }

  /**
   * Reads the character content of the current element and moves to its end tag. Nested elements
   * are skipped.
   */
  public String readElementText() throws ScoreIOException {
    if (!isStartElement()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    try {
      while (in.hasNext()) {
        int event = in.next();
        switch (event) {
          case XMLStreamConstants.CHARACTERS:
          case XMLStreamConstants.CDATA:
          case XMLStreamConstants.SPACE:
          case XMLStreamConstants.ENTITY_REFERENCE:
            sb.append(in.getText());
            break;
          case XMLStreamConstants.START_ELEMENT:
            log.debug("Skipping <{}> inside text element at {}", name(), position());
            skipCurrentElement();
            break;
          case XMLStreamConstants.END_ELEMENT:
          case XMLStreamConstants.END_DOCUMENT:
            return sb.toString();
          default:
            break;
        }
      }
    } catch (XMLStreamException e) {
      throw ScoreIOException.malformedStream(position(), e);
    }
    return sb.toString();
  }

  public int readInt() throws ScoreIOException {
    return ParsingUtils.toInt(readElementText(), 0);
  }

  public double readDouble() throws ScoreIOException {
    return ParsingUtils.toDouble(readElementText(), 0.0);
  }

  /** Reads a number and clamps it into {@code [min, max]}. */
  public double readDouble(double min, double max) throws ScoreIOException {
    double value = readDouble();
    if (value < min) {
      return min;
    }
    return Math.min(value, max);
  }

  /** An empty element reads as {@code true}, otherwise any non-zero integer does. */
  public boolean readBool() throws ScoreIOException {
    String text = readElementText().trim();
    return text.isEmpty() || ParsingUtils.toInt(text, 0) != 0;
  }

  /** Reads {@code <e x=".." y=".."/>}. Missing coordinates read as 0 and are reported. */
  public PointF readPoint() throws ScoreIOException {
    if (!hasAttribute("x") || !hasAttribute("y")) {
      log.warn("Point <{}> at {} misses a coordinate", name(), position());
    }
    double x = doubleAttribute("x", 0.0);
    double y = doubleAttribute("y", 0.0);
    skipCurrentElement();
    return new PointF(x, y);
  }

  /** Reads {@code <e r=".." g=".." b=".." a=".."/>}, alpha defaults to opaque. */
  public Color readColor() throws ScoreIOException {
    Color c =
        new Color(
            intAttribute("r", 0), intAttribute("g", 0), intAttribute("b", 0), intAttribute("a", 255));
    skipCurrentElement();
    return c;
  }

  public SizeF readSize() throws ScoreIOException {
    SizeF s = new SizeF(doubleAttribute("w", 0.0), doubleAttribute("h", 0.0));
    skipCurrentElement();
    return s;
  }

  /** Same shape as {@link #readSize()}, used for scaling factors. */
  public SizeF readScale() throws ScoreIOException {
    return readSize();
  }

  public RectF readRect() throws ScoreIOException {
    RectF r =
        new RectF(
            doubleAttribute("x", 0.0),
            doubleAttribute("y", 0.0),
            doubleAttribute("w", 0.0),
            doubleAttribute("h", 0.0));
    skipCurrentElement();
    return r;
  }

  /**
   * Reads a fraction in either of its two forms: {@code <e z="2" n="4"/>} or {@code
   * <e>2/4</e>}. Non-empty text wins; text without a slash is a tick count.
   */
  public Fraction readFraction() throws ScoreIOException {
    int z = intAttribute("z", 0);
    int n = intAttribute("n", 1);
    String text = readElementText().trim();
    if (!text.isEmpty()) {
      int slash = text.indexOf('/');
      if (slash < 0) {
        return Fraction.fromTicks(ParsingUtils.toInt(text, 0));
      }
      z = ParsingUtils.toInt(text.substring(0, slash), 0);
      n = ParsingUtils.toInt(text.substring(slash + 1), 1);
    }
    if (n == 0) {
      log.warn("Fraction with zero denominator at {}, read as 0", position());
      return Fraction.ZERO;
    }
    return new Fraction(z, n);
  }

  /**
   * Returns the inner markup of the current element verbatim, with character data HTML-escaped
   * and comments dropped. Leaves the reader on the end tag.
   */
  public String readXml() throws ScoreIOException {
    StringBuilder sb = new StringBuilder();
    try {
      while (in.hasNext()) {
        int event = in.next();
        switch (event) {
          case XMLStreamConstants.START_ELEMENT:
            appendElement(sb);
            break;
          case XMLStreamConstants.END_ELEMENT:
          case XMLStreamConstants.END_DOCUMENT:
            return sb.toString();
          case XMLStreamConstants.CHARACTERS:
          case XMLStreamConstants.CDATA:
          case XMLStreamConstants.SPACE:
            appendText(sb);
            break;
          case XMLStreamConstants.COMMENT:
            break;
          default:
            log.debug("readXml: ignoring token {} at {}", event, position());
        }
      }
    } catch (XMLStreamException e) {
      throw ScoreIOException.malformedStream(position(), e);
    }
    return sb.toString();
  }

  private void appendElement(StringBuilder sb) throws XMLStreamException {
    sb.append('<').append(name());
    for (int i = 0; i < in.getAttributeCount(); i++) {
      sb.append(' ')
          .append(in.getAttributeLocalName(i))
          .append("=\"")
          .append(in.getAttributeValue(i))
          .append('"');
    }
    sb.append('>');
    while (in.hasNext()) {
      int event = in.next();
      switch (event) {
        case XMLStreamConstants.START_ELEMENT:
          appendElement(sb);
          break;
        case XMLStreamConstants.END_ELEMENT:
          sb.append("</").append(name()).append('>');
          return;
        case XMLStreamConstants.CHARACTERS:
        case XMLStreamConstants.CDATA:
        case XMLStreamConstants.SPACE:
          appendText(sb);
          break;
        default:
          break;
      }
    }
  }

  private void appendText(StringBuilder sb) {
    String text = in.getText();
    sb.append(ParsingUtils.isWhitespace(text) ? text : ParsingUtils.escapeHtml(text));
  }

  @Override
  public void close() throws ScoreIOException {
    try {
      in.close();
    } catch (XMLStreamException e) {
      throw ScoreIOException.malformedStream(null, e);
    }
  }
}
