package io.scoreread.parser.internal_api;

import io.scoreread.parser.api.Fraction;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores and force-joins connector chains that incremental matching left open.
 *
 * <p>Each pair of chains is scored in both directions and the cheaper direction becomes a
 * candidate. Candidates are joined greedily from the cheapest; a join is skipped when either side
 * is already linked or when it would close a cycle.
 */
final class ConnectorRepair {
  private static final Logger log = LoggerFactory.getLogger(ConnectorRepair.class);

  static final int INFINITE = Integer.MAX_VALUE;

  static final int TRACK_WEIGHT = 64;
  static final int ID_MISMATCH_PENALTY = 4 * Fraction.DIVISION;

  /** A prospective link from the tail of one chain to the head of another. */
  record Candidate(int distance, ConnectorInfo from, ConnectorInfo to) {}

  private final ConnectorPool pool;
  private final ReaderCursor cursor;

  ConnectorRepair(ConnectorPool pool, ReaderCursor cursor) {
    this.pool = pool;
    this.cursor = cursor;
  }

  /**
   * Cost of continuing from {@code from} into {@code to}: 0 for a link one of them explicitly
   * declares, growing with the time gap, track distance and id mismatch, {@link #INFINITE} when
   * the link is not possible.
   */
  int orderedConnectionDistance(ConnectorInfo from, ConnectorInfo to) {
    if (!from.hasNext() || !to.hasPrevious() || from.type() != to.type()) {
      return INFINITE;
    }
    if (to.anchor().equals(from.nextLocation()) || from.anchor().equals(to.prevLocation())) {
      return 0;
    }
    Optional<Fraction> fromTick = cursor.documentTick(from.anchor());
    Optional<Fraction> toTick = cursor.documentTick(to.anchor());
    if (fromTick.isEmpty() || toTick.isEmpty()) {
      return INFINITE;
    }
    long gap = (long) toTick.get().ticks() - fromTick.get().ticks();
    if (gap < 0) {
      return INFINITE;
    }
    long distance =
        1
            + gap
            + (long) TRACK_WEIGHT * Math.abs((long) to.anchor().track() - from.anchor().track())
            + (from.id() != to.id() ? ID_MISMATCH_PENALTY : 0);
    return (int) Math.min(distance, INFINITE - 1L);
  }

  /** Candidate links between distinct chains, cheapest first. Impossible links are left out. */
  List<Candidate> candidates() {
    List<ConnectorInfo> heads = new ArrayList<>();
    for (ConnectorInfo c : pool.fragments()) {
      if (pool.head(c) == c) {
        heads.add(c);
      }
    }
    List<Candidate> result = new ArrayList<>();
    for (int i = 0; i < heads.size(); i++) {
      ConnectorInfo head1 = heads.get(i);
      ConnectorInfo tail1 = pool.tail(head1);
      for (int j = i + 1; j < heads.size(); j++) {
        ConnectorInfo head2 = heads.get(j);
        ConnectorInfo tail2 = pool.tail(head2);
        int d1 = orderedConnectionDistance(tail1, head2);
        int d2 = orderedConnectionDistance(tail2, head1);
        if (d1 == INFINITE && d2 == INFINITE) {
          continue;
        }
        if (d1 <= d2) {
          result.add(new Candidate(d1, tail1, head2));
        } else {
          result.add(new Candidate(d2, tail2, head1));
        }
      }
    }
    result.sort(Comparator.comparingInt(Candidate::distance));
    return result;
  }

  /**
   * Force-joins candidates greedily.
   *
   * @return the number of joins made
   */
  int join(List<Candidate> candidates) {
    int joined = 0;
    for (Candidate candidate : candidates) {
      ConnectorInfo from = candidate.from();
      ConnectorInfo to = candidate.to();
      if (from.isLinkedForward() || to.isLinkedBackward()) {
        continue;
      }
      if (pool.head(from) == pool.head(to)) {
        continue;
      }
      log.debug("Joining {} -> {} at distance {}", from, to, candidate.distance());
      from.forceConnect(to);
      joined++;
    }
    return joined;
  }
}
