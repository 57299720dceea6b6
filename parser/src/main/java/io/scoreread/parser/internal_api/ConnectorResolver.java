package io.scoreread.parser.internal_api;

import io.scoreread.parser.api.Fraction;
import io.scoreread.parser.api.Location;
import io.scoreread.parser.score.Connector;
import io.scoreread.parser.score.ConnectorElement;
import io.scoreread.parser.score.ScoreDocument;
import io.scoreread.parser.score.Spanner;
import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;
import it.unimi.dsi.fastutil.objects.ReferenceSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incrementally links streamed connector fragments into chains and commits every chain that
 * becomes finished.
 *
 * <p>Matching is first-match: a new fragment links to the first pooled fragment it is compatible
 * with, in reading order. Chains that stay open until the end of the document are left to {@link
 * #reconnectBrokenConnectors()}.
 */
public final class ConnectorResolver {
  private static final Logger log = LoggerFactory.getLogger(ConnectorResolver.class);

  private final ReaderCursor cursor;
  private final ScoreDocument document;
  private final ConnectorPool active = new ConnectorPool();
  private final List<ConnectorInfo> pending = new ArrayList<>();
  private int committed;

  public ConnectorResolver(ReaderCursor cursor, ScoreDocument document) {
    this.cursor = Objects.requireNonNull(cursor, "cursor");
    this.document = Objects.requireNonNull(document, "document");
  }

  /**
   * Adds a fragment to the active pool and links it to the first compatible fragment already
   * there. If that completes a chain, the chain is committed to the document and leaves the pool.
   *
   * @param info the fragment, its anchor resolved against the current cursor position
   */
  public void addConnectorInfo(ConnectorInfo info) {
    info.update(cursor);
    active.add(info);
    for (ConnectorInfo existing : active.snapshot()) {
      if (existing == info) {
        continue;
      }
      if (existing.connect(info)) {
        if (active.finished(info)) {
          commit(info, false);
        }
        break;
      }
    }
  }

  /**
   * Queues a fragment read inside a nested element whose owner is not in the document yet. The
   * anchor is resolved now, the matching happens on the next {@link #checkConnectors()}.
   */
  public void addConnectorInfoLater(ConnectorInfo info) {
    info.update(cursor);
    pending.add(info);
  }

  /** Feeds every queued fragment through {@link #addConnectorInfo(ConnectorInfo)}. */
  public void checkConnectors() {
    if (pending.isEmpty()) {
      return;
    }
    List<ConnectorInfo> queued = new ArrayList<>(pending);
    pending.clear();
    for (ConnectorInfo info : queued) {
      addConnectorInfo(info);
    }
  }

  /**
   * Force-joins the chains still open, cheapest continuation first, and commits the chains that
   * end up finished. Does nothing when no chain is open.
   *
   * @return the number of chains committed by the repair
   */
  public int reconnectBrokenConnectors() {
    if (active.isEmpty()) {
      return 0;
    }
    ConnectorRepair repair = new ConnectorRepair(active, cursor);
    List<ConnectorRepair.Candidate> candidates = repair.candidates();
    int joined = repair.join(candidates);

    int repaired = 0;
    for (ConnectorInfo c : active.snapshot()) {
      if (active.get(c.handle()) != c) {
        // removed with an earlier chain
        continue;
      }
      if (active.head(c) == c && active.finished(c)) {
        commit(c, true);
        repaired++;
      }
    }
    log.debug(
        "Connector repair: {} candidates, {} joins, {} connectors repaired, {} fragments left",
        candidates.size(),
        joined,
        repaired,
        active.size());
    return repaired;
  }

  /**
   * Detaches every fragment still held, active or pending. Elements of tuplet connectors are handed
   * to the document once each, however many fragments carry them; everything else is dropped.
   *
   * @return fragments discarded and distinct tuplets kept
   */
  public TeardownReport release() {
    List<ConnectorInfo> leftovers = active.snapshot();
    leftovers.addAll(pending);
    if (leftovers.isEmpty()) {
      return TeardownReport.EMPTY;
    }
    int discarded = 0;
    ReferenceSet<ConnectorElement> kept = new ReferenceOpenHashSet<>();
    for (ConnectorInfo info : leftovers) {
      ConnectorElement element = info.release();
      if (element != null && info.type().isTuplet()) {
        if (kept.add(element)) {
          document.retainUnfinished(element);
        }
      } else {
        discarded++;
      }
    }
    active.clear();
    pending.clear();
    log.debug("Unpaired connectors: {} discarded, {} tuplets kept", discarded, kept.size());
    return new TeardownReport(discarded, kept.size());
  }

  public int activeCount() {
    return active.size();
  }

  public int pendingCount() {
    return pending.size();
  }

  /** Number of connectors committed to the document so far. */
  public int committedCount() {
    return committed;
  }

  List<ConnectorInfo> activeFragments() {
    return active.snapshot();
  }

  private void commit(ConnectorInfo any, boolean repaired) {
    List<ConnectorInfo> chain = active.removeChain(any);
    ConnectorInfo head = chain.get(0);
    ConnectorInfo tail = chain.get(chain.size() - 1);

    List<Location> anchors = new ArrayList<>(chain.size());
    ConnectorElement element = null;
    for (ConnectorInfo c : chain) {
      anchors.add(c.anchor());
      if (element == null) {
        element = c.element();
      }
    }
    Fraction tick = cursor.documentTick(head.anchor()).orElse(Fraction.INVALID);
    Fraction tick2 = cursor.documentTick(tail.anchor()).orElse(Fraction.INVALID);
    int track = cursor.documentTrack(head.anchor().track());
    int track2 = cursor.documentTrack(tail.anchor().track());

    if (element instanceof Spanner spanner) {
      spanner.setTick(tick);
      spanner.setTick2(tick2);
      spanner.setTrack(track);
      spanner.setTrack2(track2);
    }
    Connector connector =
        new Connector(head.type(), head.id(), tick, track, tick2, track2, anchors, element, repaired);
    document.commitConnector(connector, cursor.pasteMode());
    committed++;
  }
}
