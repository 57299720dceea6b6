package io.scoreread.parser.score;

import io.scoreread.parser.api.Color;
import io.scoreread.parser.api.PointF;

/** A chord or a rest. Notes and their properties are outside the scope of this model. */
public final class ChordRest extends DurationElement {
  public enum Kind {
    CHORD,
    REST
  }

  private final Kind kind;
  private DurationType durationType = DurationType.QUARTER;
  private Beam beam;
  private PointF offset = PointF.ORIGIN;
  private Color color = Color.BLACK;
  private boolean visible = true;

  public ChordRest(Kind kind) {
    this.kind = kind;
  }

  public static ChordRest chord() {
    return new ChordRest(Kind.CHORD);
  }

  public static ChordRest rest() {
    return new ChordRest(Kind.REST);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isRest() {
    return kind == Kind.REST;
  }

  public DurationType durationType() {
    return durationType;
  }

  public void setDurationType(DurationType durationType) {
    this.durationType = durationType;
  }

  public Beam beam() {
    return beam;
  }

  public void setBeam(Beam beam) {
    this.beam = beam;
  }

  public PointF offset() {
    return offset;
  }

  public void setOffset(PointF offset) {
    this.offset = offset;
  }

  public Color color() {
    return color;
  }

  public void setColor(Color color) {
    this.color = color;
  }

  public boolean isVisible() {
    return visible;
  }

  public void setVisible(boolean visible) {
    this.visible = visible;
  }

  @Override
  public String toString() {
    return kind + "{tick=" + tick() + ", track=" + track() + ", duration=" + duration() + '}';
  }
}
