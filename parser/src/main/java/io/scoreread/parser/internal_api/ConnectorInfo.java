package io.scoreread.parser.internal_api;

import io.scoreread.parser.api.Location;
import io.scoreread.parser.score.ConnectorElement;
import io.scoreread.parser.score.ConnectorType;
import java.util.Objects;

/**
 * One streamed fragment of a connector.
 *
 * <p>Neighbours in a chain are referenced by pool handle, never by object reference; the owning
 * {@link ConnectorPool} is the only place fragments are looked up or removed.
 */
public final class ConnectorInfo {
  static final int NO_HANDLE = -1;

  /** Which sides of a fragment continue into other fragments. */
  public enum Role {
    START,
    MIDDLE,
    END
  }

  private final ConnectorType type;
  private final int id;
  private final Role role;
  private final ConnectorElement element;

  private Location anchor;
  private Location prevLocation;
  private Location nextLocation;
  private boolean updated;

  int handle = NO_HANDLE;
  int prev = NO_HANDLE;
  int next = NO_HANDLE;

  private ConnectorInfo(
      ConnectorType type, int id, Role role, Location anchor, ConnectorElement element) {
    this.type = Objects.requireNonNull(type, "type");
    this.id = id;
    this.role = Objects.requireNonNull(role, "role");
    this.anchor = Objects.requireNonNull(anchor, "anchor");
    this.element = element;
  }

  /**
   * Creates a fragment.
   *
   * @param type connector kind
   * @param id grouping id from the file, {@code -1} if none
   * @param role which sides stay open
   * @param anchor where the fragment sits; unset fields are filled from the cursor by {@link
   *     #update(ReaderCursor)}
   * @param element the element this fragment carries, may be {@code null}
   */
  public static ConnectorInfo of(
      ConnectorType type, int id, Role role, Location anchor, ConnectorElement element) {
    return new ConnectorInfo(type, id, role, anchor, element);
  }

  public static ConnectorInfo start(ConnectorType type, int id, Location anchor) {
    return new ConnectorInfo(type, id, Role.START, anchor, null);
  }

  public static ConnectorInfo end(ConnectorType type, int id, Location anchor) {
    return new ConnectorInfo(type, id, Role.END, anchor, null);
  }

  /**
   * Declares where the previous fragment is, relative to this one's anchor (or absolute).
   *
   * @return this fragment
   */
  public ConnectorInfo withPrevLocation(Location location) {
    this.prevLocation = location;
    return this;
  }

  /**
   * Declares where the next fragment is, relative to this one's anchor (or absolute).
   *
   * @return this fragment
   */
  public ConnectorInfo withNextLocation(Location location) {
    this.nextLocation = location;
    return this;
  }

  /**
   * Completes the anchor from the cursor and resolves the neighbour hints against it. Runs once;
   * later calls are no-ops, so fragments deferred to a later merge keep the position they were
   * read at.
   */
  public void update(ReaderCursor cursor) {
    if (updated) {
      return;
    }
    anchor = cursor.fillLocation(anchor.isRelative() ? anchor.toAbsolute(cursor.location()) : anchor, false);
    if (prevLocation != null) {
      prevLocation = prevLocation.toAbsolute(anchor);
    }
    if (nextLocation != null) {
      nextLocation = nextLocation.toAbsolute(anchor);
    }
    updated = true;
  }

  public ConnectorType type() {
    return type;
  }

  public int id() {
    return id;
  }

  public Role role() {
    return role;
  }

  public ConnectorElement element() {
    return element;
  }

  public Location anchor() {
    return anchor;
  }

  public Location prevLocation() {
    return prevLocation;
  }

  public Location nextLocation() {
    return nextLocation;
  }

  public boolean hasPrevious() {
    return role != Role.START;
  }

  public boolean hasNext() {
    return role != Role.END;
  }

  public int handle() {
    return handle;
  }

  public boolean isLinkedBackward() {
    return prev != NO_HANDLE;
  }

  public boolean isLinkedForward() {
    return next != NO_HANDLE;
  }

  /**
   * Links this fragment to {@code other} if they are two open, facing ends of the same connector:
   * same type and id, the earlier one not after the later one, and any declared neighbour hint
   * pointing exactly at the partner.
   *
   * @return {@code true} if a link was made
   */
  boolean connect(ConnectorInfo other) {
    if (other == null || other == this) {
      return false;
    }
    if (type != other.type || id != other.id) {
      return false;
    }
    if (hasPrevious() && prev == NO_HANDLE && other.hasNext() && other.next == NO_HANDLE) {
      if (canFollow(other, this)) {
        link(other, this);
        return true;
      }
    }
    if (hasNext() && next == NO_HANDLE && other.hasPrevious() && other.prev == NO_HANDLE) {
      if (canFollow(this, other)) {
        link(this, other);
        return true;
      }
    }
    return false;
  }

  /** Links regardless of ids and hints. Used by the repair pass only. */
  void forceConnect(ConnectorInfo other) {
    link(this, other);
  }

  /** Drops both neighbour links, returning the fragment to an unattached state. */
  ConnectorElement release() {
    prev = NO_HANDLE;
    next = NO_HANDLE;
    return element;
  }

  private static boolean canFollow(ConnectorInfo from, ConnectorInfo to) {
    if (from.anchor.compareTime(to.anchor) > 0) {
      return false;
    }
    if (from.nextLocation != null && !from.nextLocation.equals(to.anchor)) {
      return false;
    }
    return to.prevLocation == null || to.prevLocation.equals(from.anchor);
  }

  private static void link(ConnectorInfo from, ConnectorInfo to) {
    from.next = to.handle;
    to.prev = from.handle;
  }

  @Override
  public String toString() {
    return "ConnectorInfo{"
        + type
        + ", id="
        + id
        + ", "
        + role
        + ", anchor="
        + anchor
        + ", handle="
        + handle
        + '}';
  }
}
