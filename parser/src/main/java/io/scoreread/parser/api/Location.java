package io.scoreread.parser.api;

import java.util.Objects;

/**
 * An addressable point in the document's time/track space.
 *
 * <p>A location is either absolute (track, measure index and fraction counted from the document
 * or paste origin) or relative (deltas against some absolute reference). Absolute locations start
 * out with every field {@linkplain #UNSET unset}; the reader fills in whatever the file did not
 * specify. Relative locations start out as zero deltas.
 */
public final class Location {
  /** Marker for an integer field that has not been assigned yet. */
  public static final int UNSET = Integer.MIN_VALUE;

  private static final Location ABSOLUTE = new Location(UNSET, UNSET, Fraction.UNSET, false);
  private static final Location RELATIVE = new Location(0, 0, Fraction.ZERO, true);

  private final int track;
  private final int measure;
  private final Fraction frac;
  private final boolean relative;

  private Location(int track, int measure, Fraction frac, boolean relative) {
    this.track = track;
    this.measure = measure;
    this.frac = Objects.requireNonNull(frac, "frac");
    this.relative = relative;
  }

  /** An absolute location with every field unset. */
  public static Location absolute() {
    return ABSOLUTE;
  }

  /** A relative location with zero deltas. */
  public static Location relative() {
    return RELATIVE;
  }

  /** A fully specified absolute location. */
  public static Location at(int track, int measure, Fraction frac) {
    return new Location(track, measure, frac, false);
  }

  /** A fully specified relative location. */
  public static Location delta(int track, int measure, Fraction frac) {
    return new Location(track, measure, frac, true);
  }

  public int track() {
    return track;
  }

  public int measure() {
    return measure;
  }

  public Fraction frac() {
    return frac;
  }

  public boolean isRelative() {
    return relative;
  }

  public boolean isAbsolute() {
    return !relative;
  }

  public boolean hasTrack() {
    return track != UNSET;
  }

  public boolean hasMeasure() {
    return measure != UNSET;
  }

  public boolean hasFrac() {
    return !Fraction.UNSET.equals(frac);
  }

  public Location withTrack(int track) {
    return new Location(track, measure, frac, relative);
  }

  public Location withMeasure(int measure) {
    return new Location(track, measure, frac, relative);
  }

  public Location withFrac(Fraction frac) {
    return new Location(track, measure, frac, relative);
  }

  /**
   * Resolves this location against an absolute reference.
   *
   * @param ref absolute reference location
   * @return this location if already absolute, otherwise {@code ref} shifted by the deltas
   * @throws IllegalArgumentException if {@code ref} is relative
   */
  public Location toAbsolute(Location ref) {
    if (!relative) {
      return this;
    }
    if (ref.relative) {
      throw new IllegalArgumentException("Reference location must be absolute: " + ref);
    }
    return new Location(track + ref.track, measure + ref.measure, frac.plus(ref.frac), false);
  }

  /**
   * Expresses this location as deltas against an absolute reference.
   *
   * @param ref absolute reference location
   * @return this location if already relative, otherwise the deltas from {@code ref}
   * @throws IllegalArgumentException if {@code ref} is relative
   */
  public Location toRelative(Location ref) {
    if (relative) {
      return this;
    }
    if (ref.relative) {
      throw new IllegalArgumentException("Reference location must be absolute: " + ref);
    }
    return new Location(track - ref.track, measure - ref.measure, frac.minus(ref.frac), true);
  }

  /**
   * Orders two absolute locations of the same reading mode by measure, then fraction.
   *
   * @return negative, zero or positive as {@code this} is before, at or after {@code other}
   */
  public int compareTime(Location other) {
    int c = Integer.compare(measure, other.measure);
    return c != 0 ? c : frac.compareTo(other.frac);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Location that = (Location) o;
    return track == that.track
        && measure == that.measure
        && relative == that.relative
        && frac.equals(that.frac);
  }

  @Override
  public int hashCode() {
    return Objects.hash(track, measure, frac, relative);
  }

  @Override
  public String toString() {
    return (relative ? "Location{rel" : "Location{abs")
        + ", track="
        + (hasTrack() ? String.valueOf(track) : "?")
        + ", measure="
        + (hasMeasure() ? String.valueOf(measure) : "?")
        + ", frac="
        + (hasFrac() ? frac.toString() : "?")
        + '}';
  }
}
