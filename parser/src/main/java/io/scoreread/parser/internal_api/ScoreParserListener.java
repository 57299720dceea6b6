package io.scoreread.parser.internal_api;

import io.scoreread.parser.score.Measure;

/**
 * A callback to be provided to {@linkplain StreamingScoreParser#parse(ScoreXmlReader,
 * io.scoreread.parser.score.ScoreDocument, ScoreParserListener)}
 */
public interface ScoreParserListener {
  /** A no-operation implementation that does nothing for all callbacks. */
  ScoreParserListener NOOP = new ScoreParserListener() {};

  /**
   * Called before the first element of the document is read
   *
   * @param context the session the document is read with
   */
  default void onDocumentStart(ReadContext context) {}

  /**
   * Called when a measure of a staff is entered
   *
   * @param context the current session
   * @param staff   the staff index (0-based)
   * @param measure the measure about to be filled
   * @return {@literal false} if the content of this measure should be skipped
   */
  default boolean onMeasureStart(ReadContext context, int staff, Measure measure) {
    return true;
  }

  /**
   * Called when a measure of a staff is fully read or skipped
   *
   * @param context the current session
   * @param staff   the staff index (0-based)
   * @param measure the measure
   * @param skipped {@literal true} if the measure content was skipped
   */
  default void onMeasureEnd(ReadContext context, int staff, Measure measure, boolean skipped) {}

  /**
   * Called once the session has been closed
   *
   * @param context the closed session
   * @param report  what happened to connectors left unresolved
   */
  default void onDocumentEnd(ReadContext context, TeardownReport report) {}
}
