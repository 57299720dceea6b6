package io.scoreread.parser.internal_api;

import static io.scoreread.parser.score.ScoreDocument.VOICES;

import io.scoreread.parser.api.Fraction;
import io.scoreread.parser.api.Location;
import io.scoreread.parser.api.MissingAttributeException;
import io.scoreread.parser.api.ReaderOptions;
import io.scoreread.parser.api.ScoreIOException;
import io.scoreread.parser.score.Beam;
import io.scoreread.parser.score.ChordRest;
import io.scoreread.parser.score.ConnectorElement;
import io.scoreread.parser.score.ConnectorType;
import io.scoreread.parser.score.DurationType;
import io.scoreread.parser.score.Measure;
import io.scoreread.parser.score.ScoreDocument;
import io.scoreread.parser.score.Spanner;
import io.scoreread.parser.score.TextElement;
import io.scoreread.parser.score.TextStyleType;
import io.scoreread.parser.score.Tuplet;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streaming score reader. Elements are handled as they arrive; references to beams and tuplets are
 * resolved through the session tables and connector fragments through the resolver, so a single
 * forward pass builds the whole document.
 *
 * <p>Reads full documents:
 *
 * <pre>{@code
 * <museScore>
 *   <Score>
 *     <Style><TextStyle><name>..</name></TextStyle></Style>
 *     <Staff id="1">
 *       <Measure len="4/4">
 *         <voice> location | tick | Beam | Tuplet | Chord | Rest | Spanner | StaffText </voice>
 *       </Measure>
 *     </Staff>
 *   </Score>
 * </museScore>
 * }</pre>
 *
 * and pasted fragments, {@code <StaffList tick=".." staff=".."><Staff id=".."><voice>..}.
 */
public final class StreamingScoreParser {
  private static final Logger log = LoggerFactory.getLogger(StreamingScoreParser.class);

  private static final Fraction DEFAULT_MEASURE_LENGTH = Fraction.of(4, 4);

  private final ReaderOptions options;

  public StreamingScoreParser(ReaderOptions options) {
    this.options = options != null ? options : ReaderOptions.DEFAULT;
  }

  /**
   * Reads a full document into {@code document}. The listener is called in this order:
   *
   * <ol>
   *   <li>listener.onDocumentStart()</li>
   *   <li>listener.onMeasureStart() and listener.onMeasureEnd(), per staff and measure</li>
   *   <li>listener.onDocumentEnd()</li>
   * </ol>
   *
   * @param reader the token stream, positioned before the root element
   * @param document the document to fill
   * @param listener the parser listener
   * @return what happened to connectors that never resolved
   * @throws ScoreIOException if the token stream cannot be read any further
   */
  public TeardownReport parse(
      ScoreXmlReader reader, ScoreDocument document, ScoreParserListener listener)
      throws ScoreIOException {
    ReadContext context = new ReadContext(document, options);
    Pass pass = new Pass(reader, context, listener);
    listener.onDocumentStart(context);
    TeardownReport report;
    try {
      while (reader.readNextStartElement()) {
        if ("museScore".equals(reader.name())) {
          pass.readMuseScore();
        } else {
          reader.unknown();
        }
      }
      int repaired = context.finishDocument();
      if (repaired > 0) {
        log.debug("{} connectors repaired", repaired);
      }
    } finally {
      report = context.close();
    }
    listener.onDocumentEnd(context, report);
    return report;
  }

  /**
   * Reads a pasted staff list into {@code document} at {@code dstTick}, first staff going to
   * {@code dstStaff}. The document must already contain the measures the content lands in.
   *
   * @param reader the token stream, positioned before the {@code StaffList} element
   * @param document the paste target
   * @param dstTick where the first tick of the content goes
   * @param dstStaff where the first staff of the content goes
   * @param listener the parser listener; measure callbacks are not made for pasted content
   * @return what happened to connectors that never resolved
   * @throws ScoreIOException if the token stream cannot be read any further
   */
  public TeardownReport paste(
      ScoreXmlReader reader,
      ScoreDocument document,
      Fraction dstTick,
      int dstStaff,
      ScoreParserListener listener)
      throws ScoreIOException {
    if (!reader.readNextStartElement()) {
      return TeardownReport.EMPTY;
    }
    if (!"StaffList".equals(reader.name())) {
      reader.unknown();
      return TeardownReport.EMPTY;
    }
    Fraction srcTick = Fraction.fromTicks(reader.intAttribute("tick", 0));
    int srcStaff = reader.intAttribute("staff", 0);
    ReadContext context =
        ReadContext.forPaste(
            document, options, srcTick, dstTick, srcStaff * VOICES, dstStaff * VOICES);
    Pass pass = new Pass(reader, context, listener);
    listener.onDocumentStart(context);
    TeardownReport report;
    try {
      while (reader.readNextStartElement()) {
        if ("Staff".equals(reader.name())) {
          pass.readPastedStaff(reader.intAttribute("id", srcStaff), srcTick);
        } else {
          reader.unknown();
        }
      }
      context.tables().checkTuplets(document);
      context.tables().clearTuplets();
      context.finishDocument();
    } finally {
      report = context.close();
    }
    listener.onDocumentEnd(context, report);
    return report;
  }

  /** State of one call to {@link #parse} or {@link #paste}. */
  private static final class Pass {
    private final ScoreXmlReader reader;
    private final ReadContext context;
    private final ReaderCursor cursor;
    private final ScoreDocument document;
    private final ScoreParserListener listener;
    private int nextStaff;

    Pass(ScoreXmlReader reader, ReadContext context, ScoreParserListener listener) {
      this.reader = reader;
      this.context = context;
      this.cursor = context.cursor();
      this.document = context.document();
      this.listener = listener;
    }

    void readMuseScore() throws ScoreIOException {
      while (reader.readNextStartElement()) {
        if ("Score".equals(reader.name())) {
          readScore();
        } else {
          reader.unknown();
        }
      }
    }

    private void readScore() throws ScoreIOException {
      while (reader.readNextStartElement()) {
        switch (reader.name()) {
          case "Style" -> readStyle();
          case "Staff" -> readStaff();
          default -> reader.unknown();
        }
      }
    }

    private void readStyle() throws ScoreIOException {
      while (reader.readNextStartElement()) {
        if ("TextStyle".equals(reader.name())) {
          readTextStyle();
        } else {
          // engraving settings are not modelled
          reader.skipCurrentElement();
        }
      }
    }

    private void readTextStyle() throws ScoreIOException {
      String name = null;
      while (reader.readNextStartElement()) {
        if ("name".equals(reader.name())) {
          name = reader.readElementText().trim();
        } else {
          reader.skipCurrentElement();
        }
      }
      if (name == null || name.isEmpty()) {
        log.warn("Text style without a name at {}", reader.position());
        return;
      }
      if (TextStyleType.builtIn(name).isPresent() || context.textStyles().lookup(name).isPresent()) {
        return;
      }
      context.textStyles().add(name);
    }

    private void readStaff() throws ScoreIOException {
      int staff;
      try {
        staff = reader.intAttribute("id") - 1;
      } catch (MissingAttributeException e) {
        reader.report(e);
        staff = nextStaff;
      }
      nextStaff = staff + 1;
      int index = 0;
      while (reader.readNextStartElement()) {
        if ("Measure".equals(reader.name())) {
          readMeasure(staff, index++);
        } else {
          reader.unknown();
        }
      }
      context.tables().clearBeams();
    }

    private void readMeasure(int staff, int index) throws ScoreIOException {
      Fraction len = DEFAULT_MEASURE_LENGTH;
      String lenText = reader.attribute("len", null);
      if (lenText != null) {
        try {
          len = Fraction.parse(lenText);
        } catch (NumberFormatException | ArithmeticException e) {
          log.warn("Bad measure length '{}' at {}", lenText, reader.position());
        }
      }
      Measure measure = document.measure(index).orElse(null);
      if (measure == null) {
        measure = document.appendMeasure(len);
      } else if (!measure.ticks().equals(len)) {
        log.debug("Staff {} measure {}: length {} differs from {}", staff, index, len, measure.ticks());
      }
      cursor.setCurrentMeasure(measure);
      cursor.setTick(measure.tick());
      cursor.setTrack(staff * VOICES);

      if (!listener.onMeasureStart(context, staff, measure)) {
        log.debug("'onMeasureStart' returned false. Skipping staff {} measure {}", staff, index);
        reader.skipCurrentElement();
        listener.onMeasureEnd(context, staff, measure, true);
        return;
      }
      int voice = 0;
      while (reader.readNextStartElement()) {
        if ("voice".equals(reader.name())) {
          if (voice >= VOICES) {
            log.warn("Too many voices in staff {} measure {}", staff, index);
            reader.skipCurrentElement();
            continue;
          }
          // a location in the previous voice may have moved the cursor to another measure
          cursor.setCurrentMeasure(measure);
          readVoice(staff * VOICES + voice++, measure.tick());
        } else {
          reader.unknown();
        }
      }
      int dropped = context.tables().checkTuplets(document);
      if (dropped > 0) {
        log.debug("Staff {} measure {}: {} empty tuplets dropped", staff, index, dropped);
      }
      context.tables().clearTuplets();
      listener.onMeasureEnd(context, staff, measure, false);
    }

    void readPastedStaff(int fileStaff, Fraction srcTick) throws ScoreIOException {
      Fraction start = srcTick.minus(cursor.tickOffset()).reduced();
      int voice = 0;
      while (reader.readNextStartElement()) {
        if ("voice".equals(reader.name()) && voice < VOICES) {
          readVoice(fileStaff * VOICES + voice++, start);
        } else {
          reader.unknown();
        }
      }
    }

    /**
     * @param fileTrack the voice's track as written in the input
     * @param start document tick the voice starts at
     */
    private void readVoice(int fileTrack, Fraction start) throws ScoreIOException {
      cursor.setTrack(fileTrack - cursor.trackOffset());
      cursor.setTick(start);
      while (reader.readNextStartElement()) {
        switch (reader.name()) {
          case "location" -> cursor.setLocation(readLocation());
          case "tick" -> cursor.setTick(
              Fraction.fromTicks(reader.readInt()).minus(cursor.tickOffset()));
          case "Beam" -> readBeam();
          case "Tuplet" -> readTuplet();
          case "Chord" -> readChordRest(ChordRest.chord());
          case "Rest" -> readChordRest(ChordRest.rest());
          case "Spanner" -> readSpanner(false);
          case "StaffText" -> readStaffText();
          default -> reader.unknown();
        }
      }
    }

    /** Reads a relative location: staff, voice and measure deltas plus a time delta. */
    private Location readLocation() throws ScoreIOException {
      int staves = 0;
      int voices = 0;
      int measures = 0;
      Fraction frac = Fraction.ZERO;
      while (reader.readNextStartElement()) {
        switch (reader.name()) {
          case "staves" -> staves = reader.readInt();
          case "voices" -> voices = reader.readInt();
          case "measures" -> measures = reader.readInt();
          case "fractions" -> frac = reader.readFraction();
          default -> reader.unknown();
        }
      }
      return Location.delta(staves * VOICES + voices, measures, frac);
    }

    private void readBeam() throws ScoreIOException {
      int id;
      try {
        id = reader.intAttribute("id");
      } catch (MissingAttributeException e) {
        reader.report(e);
        reader.skipCurrentElement();
        return;
      }
      Beam beam = new Beam(id);
      beam.setTrack(cursor.track());
      reader.skipCurrentElement();
      context.tables().addBeam(beam);
    }

    private void readTuplet() throws ScoreIOException {
      int id;
      try {
        id = reader.intAttribute("id");
      } catch (MissingAttributeException e) {
        reader.report(e);
        reader.skipCurrentElement();
        return;
      }
      Tuplet tuplet = new Tuplet(id);
      tuplet.setTrack(cursor.track());
      tuplet.setTick(cursor.tick());
      int normal = 1;
      int actual = 1;
      DurationType base = DurationType.EIGHTH;
      Tuplet parent = null;
      while (reader.readNextStartElement()) {
        switch (reader.name()) {
          case "normalNotes" -> normal = reader.readInt();
          case "actualNotes" -> actual = reader.readInt();
          case "baseNote" -> {
            String name = reader.readElementText().trim();
            Optional<DurationType> type = DurationType.fromXmlName(name);
            if (type.isPresent()) {
              base = type.get();
            } else {
              log.warn("Tuplet {}: unknown base note '{}'", id, name);
            }
          }
          case "Tuplet" -> {
            int parentId = reader.readInt();
            parent = context.tables().findTuplet(parentId).orElse(null);
            if (parent == null) {
              log.warn("Tuplet {}: parent tuplet {} not found", id, parentId);
            }
          }
          default -> reader.unknown();
        }
      }
      if (normal <= 0 || actual <= 0) {
        log.warn("Tuplet {}: bad ratio {}/{}, using 1/1", id, actual, normal);
        normal = 1;
        actual = 1;
      }
      tuplet.setShape(actual, normal, base.fraction());
      if (parent != null) {
        parent.add(tuplet);
      }
      context.tables().addTuplet(tuplet);
      document.addTuplet(tuplet);
    }

    private void readChordRest(ChordRest cr) throws ScoreIOException {
      cr.setTrack(cursor.track());
      cr.setTick(cursor.tick());
      DurationType type = cr.isRest() ? DurationType.MEASURE : DurationType.QUARTER;
      boolean typeRead = false;
      int dots = 0;
      Fraction duration = null;
      Tuplet tuplet = null;
      Beam beam = null;
      while (reader.readNextStartElement()) {
        switch (reader.name()) {
          case "durationType" -> {
            String name = reader.readElementText().trim();
            Optional<DurationType> t = DurationType.fromXmlName(name);
            if (t.isPresent()) {
              type = t.get();
              typeRead = true;
            } else {
              log.warn("Unknown duration type '{}' at {}", name, reader.position());
            }
          }
          case "dots" -> dots = reader.readInt();
          case "duration" -> duration = reader.readFraction();
          case "Tuplet" -> {
            int id = reader.readInt();
            tuplet = context.tables().findTuplet(id).orElse(null);
            if (tuplet == null) {
              log.warn("Tuplet {} not found at {}", id, reader.position());
            }
          }
          case "Beam" -> {
            int id = reader.readInt();
            beam = context.tables().findBeam(id).orElse(null);
            if (beam == null) {
              log.warn("Beam {} not found at {}", id, reader.position());
            }
          }
          case "offset" -> cr.setOffset(reader.readPoint());
          case "color" -> cr.setColor(reader.readColor());
          case "visible" -> cr.setVisible(reader.readBool());
          case "Spanner" -> readSpanner(true);
          default -> reader.unknown();
        }
      }
      if (!typeRead && !cr.isRest()) {
        log.debug("Chord without duration type at {}, using quarter", reader.position());
      }
      cr.setDurationType(type);
      if (duration != null) {
        cr.setDuration(duration);
      } else if (type == DurationType.MEASURE) {
        Measure m = cursor.currentMeasure();
        if (m == null) {
          // pasted content is not tied to a measure
          m = document.measureAt(cursor.tick()).orElse(null);
        }
        cr.setDuration(m != null ? m.ticks() : Fraction.ZERO);
      } else {
        cr.setDuration(type.withDots(dots));
      }
      if (tuplet != null) {
        tuplet.add(cr);
      }
      if (beam != null) {
        beam.add(cr);
      }
      document.add(cr);
      cursor.incTick(cr.actualTicks());
      context.connectors().checkConnectors();
    }

    /**
     * Reads one connector fragment. Fragments nested in a chord or rest are queued until the
     * chord or rest has been added to the document.
     */
    private void readSpanner(boolean deferred) throws ScoreIOException {
      String typeName;
      try {
        typeName = reader.attribute("type");
      } catch (MissingAttributeException e) {
        reader.report(e);
        reader.skipCurrentElement();
        return;
      }
      Optional<ConnectorType> type = ConnectorType.fromXmlName(typeName);
      if (type.isEmpty()) {
        log.warn("Unknown spanner type '{}' at {}", typeName, reader.position());
        reader.skipCurrentElement();
        return;
      }
      int id = reader.intAttribute("id", -1);
      Location prev = null;
      Location next = null;
      boolean hasPrev = false;
      boolean hasNext = false;
      while (reader.readNextStartElement()) {
        switch (reader.name()) {
          case "prev" -> {
            hasPrev = true;
            prev = readNeighbour();
          }
          case "next" -> {
            hasNext = true;
            next = readNeighbour();
          }
          default -> {
            if (type.get().xmlName().equalsIgnoreCase(reader.name())) {
              // element properties are not modelled
              reader.skipCurrentElement();
            } else {
              reader.unknown();
            }
          }
        }
      }
      ConnectorInfo.Role role;
      if (hasPrev && hasNext) {
        role = ConnectorInfo.Role.MIDDLE;
      } else if (hasNext) {
        role = ConnectorInfo.Role.START;
      } else if (hasPrev) {
        role = ConnectorInfo.Role.END;
      } else {
        log.warn("{} {} at {} has neither start nor end", typeName, id, reader.position());
        return;
      }
      ConnectorInfo info =
          ConnectorInfo.of(type.get(), id, role, Location.absolute(), element(type.get(), id, role))
              .withPrevLocation(prev)
              .withNextLocation(next);
      if (role == ConnectorInfo.Role.END && id >= 0 && !type.get().isTuplet()) {
        context.spanners().addValues(id, cursor.tick(), cursor.track());
      }
      if (deferred) {
        context.connectors().addConnectorInfoLater(info);
      } else {
        context.connectors().addConnectorInfo(info);
      }
    }

    private ConnectorElement element(ConnectorType type, int id, ConnectorInfo.Role role) {
      if (type.isTuplet()) {
        return context.tables().findTuplet(id).orElse(null);
      }
      if (role == ConnectorInfo.Role.START) {
        Spanner spanner = new Spanner(type);
        context.spanners().add(id, spanner);
        return spanner;
      }
      return context.spanners().find(id).filter(s -> s.connectorType() == type).orElse(null);
    }

    /** Reads a {@code prev} or {@code next} element, {@code null} if it gives no location. */
    private Location readNeighbour() throws ScoreIOException {
      Location l = null;
      while (reader.readNextStartElement()) {
        if ("location".equals(reader.name())) {
          l = readLocation();
        } else {
          reader.unknown();
        }
      }
      return l;
    }

    private void readStaffText() throws ScoreIOException {
      TextStyleType style = TextStyleType.STAFF;
      String text = "";
      while (reader.readNextStartElement()) {
        switch (reader.name()) {
          case "style" -> style = resolveStyle(reader.readElementText().trim());
          case "text" -> text = reader.readXml();
          default -> reader.unknown();
        }
      }
      document.addText(new TextElement(cursor.track(), cursor.tick(), style, text));
    }

    private TextStyleType resolveStyle(String name) {
      Optional<TextStyleType> style = context.textStyles().lookup(name);
      if (style.isEmpty()) {
        style = TextStyleType.builtIn(name);
      }
      if (style.isEmpty()) {
        log.warn("Unknown text style '{}', using staff text style", name);
        return TextStyleType.STAFF;
      }
      return style.get();
    }
  }
}
