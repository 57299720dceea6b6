package io.scoreread.parser.internal_api;

import io.scoreread.parser.score.Beam;
import io.scoreread.parser.score.ScoreDocument;
import io.scoreread.parser.score.Tuplet;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Id-keyed lookup tables for the beams and tuplets read so far.
 *
 * <p>The tables do not own their entries, the document being built does. A lookup miss means the
 * file referenced an element that has not been read (or never will be); callers decide whether to
 * defer, substitute or drop.
 */
public final class ReferenceTables {
  private static final Logger log = LoggerFactory.getLogger(ReferenceTables.class);

  private final Int2ObjectMap<Beam> beams = new Int2ObjectOpenHashMap<>();

  /** Insertion ordered so that tuplet finalization runs in reading order. */
  private final Int2ObjectMap<Tuplet> tuplets = new Int2ObjectLinkedOpenHashMap<>();

  public void addBeam(Beam beam) {
    beams.put(beam.id(), beam);
  }

  public Optional<Beam> findBeam(int id) {
    return Optional.ofNullable(beams.get(id));
  }

  public void addTuplet(Tuplet tuplet) {
    tuplets.put(tuplet.id(), tuplet);
  }

  public Optional<Tuplet> findTuplet(int id) {
    return Optional.ofNullable(tuplets.get(id));
  }

  public Collection<Tuplet> tuplets() {
    return Collections.unmodifiableCollection(tuplets.values());
  }

  public int beamCount() {
    return beams.size();
  }

  /**
   * Finalizes every registered tuplet once its content has been streamed.
   *
   * <p>Empty tuplets are corrupt input: they are dropped from the table and the document. The
   * others get their elements sorted into document order and are sanitized. Missing elements are
   * filled in a second pass, after all sanitizing, because repairing a nested tuplet changes what
   * counts as missing in its parent.
   *
   * @param document the document the tuplets live in
   * @return the number of tuplets dropped as empty
   */
  public int checkTuplets(ScoreDocument document) {
    List<Tuplet> empty = new ArrayList<>();
    for (Tuplet tuplet : tuplets.values()) {
      if (tuplet.elements().isEmpty()) {
        log.warn("Empty tuplet id {} ({}), input file corrupted?", tuplet.id(), tuplet);
        empty.add(tuplet);
      } else {
        tuplet.sortElements();
        tuplet.sanitizeTuplet();
      }
    }
    for (Tuplet tuplet : empty) {
      tuplets.remove(tuplet.id());
      if (tuplet.tuplet() != null) {
        tuplet.tuplet().remove(tuplet);
      }
      document.removeTuplet(tuplet);
    }
    for (Tuplet tuplet : tuplets.values()) {
      tuplet.addMissingElements(document);
    }
    return empty.size();
  }

  public void clearTuplets() {
    tuplets.clear();
  }

  public void clearBeams() {
    beams.clear();
  }

  public void clear() {
    beams.clear();
    tuplets.clear();
  }
}
