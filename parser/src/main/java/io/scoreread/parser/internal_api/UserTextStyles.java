package io.scoreread.parser.internal_api;

import io.scoreread.parser.score.TextStyleType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps user defined text style names onto the fixed set of user style slots. */
public final class UserTextStyles {
  private static final Logger log = LoggerFactory.getLogger(UserTextStyles.class);

  private record Entry(String name, TextStyleType slot) {}

  private final List<Entry> styles = new ArrayList<>();

  /**
   * Assigns the next free user slot to {@code name}.
   *
   * @param name the style name
   * @return the assigned slot, or empty once all slots are taken
   */
  public Optional<TextStyleType> add(String name) {
    log.debug("User text style '{}'", name);
    List<TextStyleType> slots = TextStyleType.userSlots();
    if (styles.size() >= slots.size()) {
      log.warn("Too many user defined text styles, '{}' ignored", name);
      return Optional.empty();
    }
    TextStyleType slot = slots.get(styles.size());
    styles.add(new Entry(name, slot));
    return Optional.of(slot);
  }

  public Optional<TextStyleType> lookup(String name) {
    for (Entry e : styles) {
      if (e.name().equals(name)) {
        return Optional.of(e.slot());
      }
    }
    return Optional.empty();
  }

  public int size() {
    return styles.size();
  }

  public void clear() {
    styles.clear();
  }
}
