package io.scoreread.parser.score;

import io.scoreread.parser.api.Fraction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A group of duration elements played in a modified ratio (actual notes over normal notes).
 *
 * <p>Elements may be streamed out of order (nested tuplets in particular), so the reader sorts and
 * repairs tuplets once all of their content has been seen.
 */
public class Tuplet extends DurationElement implements ConnectorElement {
  private static final Logger log = LoggerFactory.getLogger(Tuplet.class);

  private final int id;
  private Fraction ratio = Fraction.of(1, 1);
  private Fraction baseLen = DurationType.EIGHTH.fraction();
  private final List<DurationElement> elements = new ArrayList<>();

  public Tuplet(int id) {
    this.id = id;
  }

  public int id() {
    return id;
  }

  @Override
  public ConnectorType connectorType() {
    return ConnectorType.TUPLET;
  }

  /** Actual notes over normal notes, e.g. {@code 3/2} for a triplet. Not reduced. */
  public Fraction ratio() {
    return ratio;
  }

  public void setRatio(Fraction ratio) {
    this.ratio = ratio;
  }

  public Fraction baseLen() {
    return baseLen;
  }

  public void setBaseLen(Fraction baseLen) {
    this.baseLen = baseLen;
  }

  /** Sets ratio and base length and derives the written duration from them. */
  public void setShape(int actualNotes, int normalNotes, Fraction baseLen) {
    this.ratio = Fraction.of(actualNotes, normalNotes);
    this.baseLen = baseLen;
    setDuration(baseLen.multiply(Fraction.of(normalNotes, 1)));
  }

  public List<DurationElement> elements() {
    return Collections.unmodifiableList(elements);
  }

  public void add(DurationElement e) {
    elements.add(e);
    e.setTuplet(this);
  }

  public void remove(DurationElement e) {
    if (elements.remove(e)) {
      e.setTuplet(null);
    }
  }

  /** Sum of the written durations of the elements, in this tuplet's own time. */
  public Fraction elementsDuration() {
    Fraction f = Fraction.ZERO;
    for (DurationElement e : elements) {
      f = f.plus(e.duration());
    }
    return f.reduced();
  }

  /** Puts the elements in document order. */
  public void sortElements() {
    elements.sort(Comparator.comparing(DurationElement::tick));
  }

  /**
   * Recomputes duration and base length of a tuplet whose ratio is reducible and whose stored
   * length disagrees with its elements. Older writers could leave such tuplets behind.
   */
  public void sanitizeTuplet() {
    if (ratio.numerator() == ratio.reduced().numerator()) {
      return;
    }
    Fraction baseLenDuration = Fraction.of(ratio.denominator(), 1).multiply(baseLen).reduced();
    Fraction testDuration = elementsDuration().divide(ratio).reduced();
    if (!elements.isEmpty()) {
      DurationElement first = elements.get(0);
      DurationElement last = elements.get(elements.size() - 1);
      if (last.endTick().minus(first.tick()).isAfter(testDuration)) {
        // missing elements, addMissingElements() deals with those
        return;
      }
    }
    if (testDuration.equals(baseLenDuration) && baseLenDuration.equals(duration())) {
      return;
    }
    Fraction f = testDuration.multiply(Fraction.of(1, ratio.denominator())).reduced();
    Fraction fbl = Fraction.of(1, f.denominator());
    if (DurationType.isValid(fbl)) {
      setDuration(testDuration);
      setBaseLen(fbl);
      log.debug(
          "Tuplet {} sanitized: duration {}, base length {}", id, testDuration, fbl);
    } else {
      log.debug("Tuplet {} not sanitized: base length {} is not a note value", id, fbl);
    }
  }

  /**
   * Fills holes in a top-level tuplet with rests, first in the middle, then at the start and the
   * end. Tuplets in the first voice of a staff and nested tuplets are left alone.
   *
   * @param document receives the created rests
   */
  public void addMissingElements(ScoreDocument document) {
    if (tuplet() != null || track() % ScoreDocument.VOICES == 0 || elements.isEmpty()) {
      return;
    }
    Fraction missing = duration().multiply(ratio).minus(elementsDuration()).reduced();
    if (missing.isZero()) {
      return;
    }
    Fraction expectedTick = elements.get(0).tick();
    for (DurationElement e : new ArrayList<>(elements)) {
      if (!e.tick().equals(expectedTick)) {
        missing = missing.minus(addMissingElement(document, expectedTick, e.tick()));
        if (missing.isZero()) {
          return;
        }
      }
      expectedTick = e.endTick();
    }
    Fraction startTick = elements.get(0).tick();
    if (startTick.isAfter(tick())) {
      missing = missing.minus(addMissingElement(document, tick(), startTick));
      if (missing.isZero()) {
        return;
      }
    }
    Fraction endTick = elements.get(elements.size() - 1).endTick();
    Fraction tupletEnd = tick().plus(actualTicks());
    if (endTick.isBefore(tupletEnd)) {
      missing = missing.minus(addMissingElement(document, endTick, tupletEnd));
    }
    if (!missing.isZero()) {
      log.debug("Tuplet {}: could not fill {} of missing duration", id, missing);
    }
  }

  private Fraction addMissingElement(ScoreDocument document, Fraction from, Fraction to) {
    Fraction written = to.minus(from).multiply(ratio).reduced();
    ChordRest rest = ChordRest.rest();
    rest.setDurationType(DurationType.MEASURE);
    rest.setDuration(written);
    rest.setTrack(track());
    rest.setTick(from);
    add(rest);
    sortElements();
    document.add(rest);
    return written;
  }

  @Override
  public String toString() {
    return "Tuplet{id=" + id + ", ratio=" + ratio + ", elements=" + elements.size() + '}';
  }
}
