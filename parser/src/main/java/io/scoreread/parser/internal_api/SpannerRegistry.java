package io.scoreread.parser.internal_api;

import io.scoreread.parser.api.Fraction;
import io.scoreread.parser.score.Spanner;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spanners registered by their file id, and the end positions recorded for those ids.
 *
 * <p>Kept as an ordered list rather than a map: ids are not guaranteed to be unique across nested
 * contexts, and the first registration wins lookups.
 */
public final class SpannerRegistry {
  private static final Logger log = LoggerFactory.getLogger(SpannerRegistry.class);

  private record Entry(int id, Spanner spanner) {}

  /**
   * Where the end fragment of a spanner was read.
   *
   * @param spannerId the file id
   * @param tick2 document tick of the end fragment
   * @param track2 document track of the end fragment
   */
  public record SpannerValues(int spannerId, Fraction tick2, int track2) {}

  private final List<Entry> entries = new ArrayList<>();
  private final List<SpannerValues> values = new ArrayList<>();

  public void add(int id, Spanner spanner) {
    entries.add(new Entry(id, spanner));
  }

  /** Removes the first registration of {@code spanner}. */
  public void remove(Spanner spanner) {
    for (int i = 0; i < entries.size(); i++) {
      if (entries.get(i).spanner() == spanner) {
        entries.remove(i);
        return;
      }
    }
  }

  public Optional<Spanner> find(int id) {
    for (Entry e : entries) {
      if (e.id() == id) {
        return Optional.of(e.spanner());
      }
    }
    return Optional.empty();
  }

  /**
   * @return the id {@code spanner} was first registered under, or empty if it is not registered
   */
  public OptionalInt idOf(Spanner spanner) {
    for (Entry e : entries) {
      if (e.spanner() == spanner) {
        return OptionalInt.of(e.id());
      }
    }
    log.debug("Spanner id not found for {}", spanner);
    return OptionalInt.empty();
  }

  public void addValues(int id, Fraction tick2, int track2) {
    values.add(new SpannerValues(id, tick2, track2));
  }

  /** End position recorded first for {@code id}. */
  public Optional<SpannerValues> spannerValues(int id) {
    for (SpannerValues v : values) {
      if (v.spannerId() == id) {
        return Optional.of(v);
      }
    }
    return Optional.empty();
  }

  public int size() {
    return entries.size();
  }

  public void clear() {
    entries.clear();
    values.clear();
  }
}
