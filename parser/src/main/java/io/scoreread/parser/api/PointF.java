package io.scoreread.parser.api;

/** A point in spatium units. */
public record PointF(double x, double y) {
  public static final PointF ORIGIN = new PointF(0.0, 0.0);
}
