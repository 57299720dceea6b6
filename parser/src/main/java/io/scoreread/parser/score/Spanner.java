package io.scoreread.parser.score;

import io.scoreread.parser.api.Fraction;

/** A line-like element (slur, hairpin, ...) spanning from one score position to another. */
public class Spanner implements ConnectorElement {
  private final ConnectorType type;
  private Fraction tick = Fraction.INVALID;
  private Fraction tick2 = Fraction.INVALID;
  private int track = -1;
  private int track2 = -1;

  public Spanner(ConnectorType type) {
    this.type = type;
  }

  @Override
  public ConnectorType connectorType() {
    return type;
  }

  public Fraction tick() {
    return tick;
  }

  public void setTick(Fraction tick) {
    this.tick = tick;
  }

  public Fraction tick2() {
    return tick2;
  }

  public void setTick2(Fraction tick2) {
    this.tick2 = tick2;
  }

  public int track() {
    return track;
  }

  public void setTrack(int track) {
    this.track = track;
  }

  public int track2() {
    return track2;
  }

  public void setTrack2(int track2) {
    this.track2 = track2;
  }

  @Override
  public String toString() {
    return type.xmlName() + "{" + tick + "@" + track + " -> " + tick2 + "@" + track2 + '}';
  }
}
