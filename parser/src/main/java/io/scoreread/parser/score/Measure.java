package io.scoreread.parser.score;

import io.scoreread.parser.api.Fraction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A measure of the document: its structural index, start tick and length. */
public final class Measure {
  private final int index;
  private final Fraction tick;
  private final Fraction ticks;
  private final List<DurationElement> elements = new ArrayList<>();

  public Measure(int index, Fraction tick, Fraction ticks) {
    this.index = index;
    this.tick = tick.reduced();
    this.ticks = ticks.reduced();
  }

  public int index() {
    return index;
  }

  public Fraction tick() {
    return tick;
  }

  public Fraction ticks() {
    return ticks;
  }

  public Fraction endTick() {
    return tick.plus(ticks).reduced();
  }

  /** Whether {@code t} falls inside this measure (start inclusive, end exclusive). */
  public boolean contains(Fraction t) {
    return t.compareTo(tick) >= 0 && t.isBefore(endTick());
  }

  void add(DurationElement e) {
    elements.add(e);
  }

  public List<DurationElement> elements() {
    return Collections.unmodifiableList(elements);
  }

  @Override
  public String toString() {
    return "Measure{index=" + index + ", tick=" + tick + ", ticks=" + ticks + '}';
  }
}
