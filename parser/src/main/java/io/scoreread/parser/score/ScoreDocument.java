package io.scoreread.parser.score;

import io.scoreread.parser.api.Fraction;
import java.util.Optional;

/**
 * The document a reader session builds into. Registries of the session only hold references into
 * it; ownership of everything added here passes to the document.
 */
public interface ScoreDocument {
  /** Voices per staff. Track {@code t} is voice {@code t % VOICES} of staff {@code t / VOICES}. */
  int VOICES = 4;

  /**
   * @param index structural measure index, 0-based
   * @return the measure, or empty if the document has no such measure yet
   */
  Optional<Measure> measure(int index);

  /**
   * @param tick a document position
   * @return the measure structurally containing {@code tick}, or empty if none does
   */
  Optional<Measure> measureAt(Fraction tick);

  /**
   * Appends a measure after the last one.
   *
   * @param length the measure length
   * @return the new measure
   */
  Measure appendMeasure(Fraction length);

  /**
   * Adds a chord, rest or tuplet member at its tick.
   *
   * @return {@code false} if no measure contains the element's tick
   */
  boolean add(DurationElement element);

  void addTuplet(Tuplet tuplet);

  void removeTuplet(Tuplet tuplet);

  void addText(TextElement text);

  /**
   * Attaches a finished connector.
   *
   * @param connector the resolved connector
   * @param pasteMode whether it was read from pasted content
   */
  void commitConnector(Connector connector, boolean pasteMode);

  /**
   * Keeps the element of a connector left unfinished at the end of a session. Only tuplet
   * elements are handed over; everything else is discarded by the reader.
   */
  default void retainUnfinished(ConnectorElement element) {}
}
