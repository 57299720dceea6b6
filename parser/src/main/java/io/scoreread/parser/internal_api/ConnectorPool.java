package io.scoreread.parser.internal_api;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Arena owning the connector fragments of a reader session, keyed by stable handle.
 *
 * <p>Iteration follows insertion order. Chains are walked through the handles stored in the
 * fragments; a walk never visits more fragments than the pool holds, so a malformed link cycle
 * cannot loop forever.
 */
final class ConnectorPool {
  private final Int2ObjectLinkedOpenHashMap<ConnectorInfo> fragments =
      new Int2ObjectLinkedOpenHashMap<>();
  private int nextHandle = 0;

  /** Takes ownership of {@code info} and assigns its handle. */
  int add(ConnectorInfo info) {
    if (info.handle != ConnectorInfo.NO_HANDLE) {
      throw new IllegalStateException("Fragment already pooled: " + info);
    }
    int handle = nextHandle++;
    info.handle = handle;
    fragments.put(handle, info);
    return handle;
  }

  ConnectorInfo get(int handle) {
    return handle == ConnectorInfo.NO_HANDLE ? null : fragments.get(handle);
  }

  Collection<ConnectorInfo> fragments() {
    return Collections.unmodifiableCollection(fragments.values());
  }

  /** Snapshot of the fragments in insertion order, safe to iterate while the pool changes. */
  List<ConnectorInfo> snapshot() {
    return new ArrayList<>(fragments.values());
  }

  int size() {
    return fragments.size();
  }

  boolean isEmpty() {
    return fragments.isEmpty();
  }

  ConnectorInfo head(ConnectorInfo info) {
    ConnectorInfo c = info;
    for (int steps = 0; steps < fragments.size(); steps++) {
      ConnectorInfo p = get(c.prev);
      if (p == null || p == info) {
        break;
      }
      c = p;
    }
    return c;
  }

  ConnectorInfo tail(ConnectorInfo info) {
    ConnectorInfo c = info;
    for (int steps = 0; steps < fragments.size(); steps++) {
      ConnectorInfo n = get(c.next);
      if (n == null || n == info) {
        break;
      }
      c = n;
    }
    return c;
  }

  /** Fragments of the chain containing {@code info}, start to end. */
  List<ConnectorInfo> chain(ConnectorInfo info) {
    List<ConnectorInfo> result = new ArrayList<>();
    ConnectorInfo head = head(info);
    ConnectorInfo c = head;
    while (c != null && result.size() < fragments.size()) {
      result.add(c);
      c = get(c.next);
      if (c == head) {
        break;
      }
    }
    return result;
  }

  /**
   * A chain is finished when its first fragment opens nothing backwards, its last opens nothing
   * forwards, and it is not a cycle.
   */
  boolean finished(ConnectorInfo info) {
    ConnectorInfo head = head(info);
    ConnectorInfo tail = tail(info);
    return !head.hasPrevious()
        && !tail.hasNext()
        && !head.isLinkedBackward()
        && !tail.isLinkedForward();
  }

  /** Removes every fragment of the chain containing {@code info}. */
  List<ConnectorInfo> removeChain(ConnectorInfo info) {
    List<ConnectorInfo> chain = chain(info);
    for (ConnectorInfo c : chain) {
      fragments.remove(c.handle);
    }
    return chain;
  }

  void clear() {
    fragments.clear();
  }
}
