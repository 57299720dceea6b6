package io.scoreread.parser.score;

import io.scoreread.parser.api.Fraction;

/** Anything that occupies time in a voice: chords, rests and tuplets. */
public abstract class DurationElement {
  private Fraction tick = Fraction.ZERO;
  private int track;
  private Fraction duration = Fraction.ZERO;
  private Tuplet tuplet;

  public Fraction tick() {
    return tick;
  }

  public void setTick(Fraction tick) {
    this.tick = tick.reduced();
  }

  public int track() {
    return track;
  }

  public void setTrack(int track) {
    this.track = track;
  }

  /** Written length, before any tuplet scaling. */
  public Fraction duration() {
    return duration;
  }

  public void setDuration(Fraction duration) {
    this.duration = duration;
  }

  public Tuplet tuplet() {
    return tuplet;
  }

  public void setTuplet(Tuplet tuplet) {
    this.tuplet = tuplet;
  }

  /** Length the element actually occupies, scaled by every enclosing tuplet. */
  public Fraction actualTicks() {
    Fraction f = duration;
    for (Tuplet t = tuplet; t != null; t = t.tuplet()) {
      f = f.divide(t.ratio());
    }
    return f.reduced();
  }

  public Fraction endTick() {
    return tick.plus(actualTicks()).reduced();
  }
}
