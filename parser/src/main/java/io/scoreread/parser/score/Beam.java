package io.scoreread.parser.score;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Beam {
  private final int id;
  private int track;
  private final List<ChordRest> elements = new ArrayList<>();

  public Beam(int id) {
    this.id = id;
  }

  public int id() {
    return id;
  }

  public int track() {
    return track;
  }

  public void setTrack(int track) {
    this.track = track;
  }

  public void add(ChordRest cr) {
    elements.add(cr);
    cr.setBeam(this);
  }

  public List<ChordRest> elements() {
    return Collections.unmodifiableList(elements);
  }
}
