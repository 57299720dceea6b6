package io.scoreread.parser.internal_api;

import io.scoreread.parser.api.Fraction;
import io.scoreread.parser.api.Location;
import io.scoreread.parser.score.Measure;
import io.scoreread.parser.score.ScoreDocument;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running position of a reader session: current tick, track and measure, plus the offsets that
 * translate file coordinates into document coordinates when content is pasted.
 *
 * <p>File coordinates are document coordinates plus the offsets. {@link #location()} reports file
 * coordinates and {@link #setLocation(Location)} takes them, so feeding one into the other leaves
 * the cursor where it was.
 */
public final class ReaderCursor {
  private static final Logger log = LoggerFactory.getLogger(ReaderCursor.class);

  private final ScoreDocument document;

  private Fraction tick = Fraction.ZERO;
  // integer mirror of tick, kept for cheap equality checks
  private int intTick;
  private int track;
  private int trackOffset;
  private Fraction tickOffset = Fraction.ZERO;
  private Measure currentMeasure;
  private boolean pasteMode;

  public ReaderCursor(ScoreDocument document) {
    this.document = Objects.requireNonNull(document, "document must not be null");
  }

  public Fraction tick() {
    return tick;
  }

  public int intTick() {
    return intTick;
  }

  public void setTick(Fraction f) {
    tick = f.reduced();
    intTick = tick.ticks();
  }

  public void incTick(Fraction f) {
    tick = tick.plus(f).reduced();
    intTick += f.ticks();
  }

  /** Position relative to the start of the current measure. */
  public Fraction rtick() {
    return currentMeasure != null ? tick.minus(currentMeasure.tick()).reduced() : tick;
  }

  public int track() {
    return track;
  }

  public void setTrack(int track) {
    this.track = track;
  }

  public int trackOffset() {
    return trackOffset;
  }

  public void setTrackOffset(int trackOffset) {
    this.trackOffset = trackOffset;
  }

  public Fraction tickOffset() {
    return tickOffset;
  }

  public void setTickOffset(Fraction tickOffset) {
    this.tickOffset = tickOffset;
  }

  public Measure currentMeasure() {
    return currentMeasure;
  }

  public void setCurrentMeasure(Measure measure) {
    this.currentMeasure = measure;
  }

  public int currentMeasureIndex() {
    return currentMeasure != null ? currentMeasure.index() : 0;
  }

  public boolean pasteMode() {
    return pasteMode;
  }

  public void setPasteMode(boolean pasteMode) {
    this.pasteMode = pasteMode;
  }

  /** Location of the current reader position, measure-relative unless in paste mode. */
  public Location location() {
    return location(false);
  }

  /**
   * Location of the current reader position.
   *
   * @param forceAbsFrac report the fraction from the document start even outside paste mode
   */
  public Location location(boolean forceAbsFrac) {
    return fillLocation(Location.absolute(), forceAbsFrac);
  }

  /**
   * Fills in the fields of {@code l} that are still unset with the current reader position. In
   * paste mode, or when {@code forceAbsFrac} is set, the fraction is counted from the document
   * start and the measure is reported as 0, since pasted content is not anchored to measures yet.
   *
   * @param l a location with some fields possibly unset
   * @param forceAbsFrac report the fraction from the document start
   * @return the completed location
   */
  public Location fillLocation(Location l, boolean forceAbsFrac) {
    boolean absFrac = pasteMode || forceAbsFrac;
    Location filled = l;
    if (!filled.hasTrack()) {
      filled = filled.withTrack(track + trackOffset);
    }
    if (!filled.hasFrac()) {
      filled = filled.withFrac((absFrac ? tick : rtick()).plus(tickOffset).reduced());
    }
    if (!filled.hasMeasure()) {
      filled = filled.withMeasure(absFrac ? 0 : currentMeasureIndex());
    }
    return filled;
  }

  /**
   * Moves the cursor to {@code l}, which may be absolute or relative to the current position.
   *
   * @param l the new location in file coordinates
   */
  public void setLocation(Location l) {
    if (l.isRelative()) {
      moveRelative(l);
    } else {
      moveAbsolute(l);
    }
  }

  private void moveRelative(Location delta) {
    Location target = delta.toAbsolute(location());
    Fraction step = delta.frac();
    Optional<Fraction> targetTick = documentTick(target);
    if (targetTick.isPresent() && targetTick.get().equals(tick.plus(step))) {
      // still inside the measure we started from
      incTick(step);
      setTrack(target.track() - trackOffset);
      return;
    }
    moveAbsolute(target);
  }

  private void moveAbsolute(Location l) {
    setTrack(l.track() - trackOffset);
    setTick(l.frac().minus(tickOffset));
    if (pasteMode) {
      return;
    }
    Measure base = currentMeasure;
    if (l.measure() != currentMeasureIndex()) {
      Optional<Measure> m = document.measure(l.measure());
      if (m.isPresent()) {
        log.debug(
            "Location measure {} differs from current measure {}",
            l.measure(),
            currentMeasureIndex());
        base = m.get();
        currentMeasure = base;
      } else {
        log.warn(
            "Location refers to unknown measure {}, staying in measure {}",
            l.measure(),
            currentMeasureIndex());
      }
    }
    if (base != null) {
      incTick(base.tick());
    }
  }

  /**
   * Converts a completed absolute reader location into a document tick.
   *
   * @param l absolute location in file coordinates
   * @return the document tick, or empty if the location's measure is not known
   */
  public Optional<Fraction> documentTick(Location l) {
    Fraction frac = l.frac().minus(tickOffset);
    if (pasteMode) {
      return Optional.of(frac.reduced());
    }
    if (currentMeasure != null && l.measure() == currentMeasure.index()) {
      return Optional.of(currentMeasure.tick().plus(frac).reduced());
    }
    if (currentMeasure == null && l.measure() == 0 && document.measure(0).isEmpty()) {
      return Optional.of(frac.reduced());
    }
    return document.measure(l.measure()).map(m -> m.tick().plus(frac).reduced());
  }

  /** Document track for a track in file coordinates. */
  public int documentTrack(int fileTrack) {
    return fileTrack - trackOffset;
  }

  @Override
  public String toString() {
    return "ReaderCursor{tick="
        + tick
        + ", track="
        + track
        + ", measure="
        + currentMeasureIndex()
        + (pasteMode ? ", paste" : "")
        + '}';
  }
}
