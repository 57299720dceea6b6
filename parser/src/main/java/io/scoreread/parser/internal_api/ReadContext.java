package io.scoreread.parser.internal_api;

import io.scoreread.parser.api.Fraction;
import io.scoreread.parser.api.ReaderOptions;
import io.scoreread.parser.score.ScoreDocument;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one reader session: cursor, reference tables, spanner and text style registries and the
 * connector resolver, all scoped to a single pass over one document or pasted fragment.
 *
 * <p>Not thread-safe. Closing the context releases the connectors that never resolved and clears
 * every registry; the document keeps everything already committed to it.
 */
public final class ReadContext {
  private static final Logger log = LoggerFactory.getLogger(ReadContext.class);

  private final ScoreDocument document;
  private final ReaderOptions options;
  private final ReaderCursor cursor;
  private final ReferenceTables tables = new ReferenceTables();
  private final SpannerRegistry spanners = new SpannerRegistry();
  private final UserTextStyles textStyles = new UserTextStyles();
  private final ConnectorResolver connectors;

  private TeardownReport teardown;

  public ReadContext(ScoreDocument document, ReaderOptions options) {
    this.document = Objects.requireNonNull(document, "document must not be null");
    this.options = options != null ? options : ReaderOptions.DEFAULT;
    this.cursor = new ReaderCursor(document);
    this.connectors = new ConnectorResolver(cursor, document);
  }

  /**
   * Creates a session that reads pasted content into {@code document}.
   *
   * @param document the paste target
   * @param options reader options
   * @param srcTick tick the content was copied from
   * @param dstTick tick the content is pasted at
   * @param srcTrack first track of the copied content
   * @param dstTrack track the content is pasted at
   * @return the session, in paste mode with its offsets set
   */
  public static ReadContext forPaste(
      ScoreDocument document,
      ReaderOptions options,
      Fraction srcTick,
      Fraction dstTick,
      int srcTrack,
      int dstTrack) {
    ReadContext context = new ReadContext(document, options);
    ReaderCursor cursor = context.cursor;
    cursor.setPasteMode(true);
    cursor.setTickOffset(srcTick.minus(dstTick).reduced());
    cursor.setTrackOffset(srcTrack - dstTrack);
    log.debug(
        "Paste session: tick offset {}, track offset {}",
        cursor.tickOffset(),
        cursor.trackOffset());
    return context;
  }

  public ScoreDocument document() {
    return document;
  }

  public ReaderOptions options() {
    return options;
  }

  public ReaderCursor cursor() {
    return cursor;
  }

  public ReferenceTables tables() {
    return tables;
  }

  public SpannerRegistry spanners() {
    return spanners;
  }

  public UserTextStyles textStyles() {
    return textStyles;
  }

  public ConnectorResolver connectors() {
    return connectors;
  }

  public boolean isClosed() {
    return teardown != null;
  }

  /**
   * Runs the end of input steps: queued connectors are merged and, unless disabled by the options,
   * the chains still open are repaired.
   *
   * @return the number of connectors committed by the repair
   */
  public int finishDocument() {
    connectors.checkConnectors();
    if (!options.repairBrokenConnectors()) {
      return 0;
    }
    return connectors.reconnectBrokenConnectors();
  }

  /**
   * Ends the session. Calling it again returns the first report.
   *
   * @return what happened to the connectors left unresolved
   */
  public TeardownReport close() {
    if (teardown != null) {
      return teardown;
    }
    teardown = connectors.release();
    if (!teardown.isEmpty()) {
      log.warn(
          "Unresolved connectors: {} fragments discarded, {} tuplets kept",
          teardown.discarded(),
          teardown.preserved());
    }
    tables.clear();
    spanners.clear();
    textStyles.clear();
    return teardown;
  }
}
