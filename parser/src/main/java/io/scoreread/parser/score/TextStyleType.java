package io.scoreread.parser.score;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Text styles: the built-in ones followed by twelve slots for user defined styles. */
public enum TextStyleType {
  DEFAULT,
  TITLE,
  SUBTITLE,
  COMPOSER,
  LYRICIST,
  STAFF,
  SYSTEM,
  TEMPO,
  EXPRESSION,
  USER1,
  USER2,
  USER3,
  USER4,
  USER5,
  USER6,
  USER7,
  USER8,
  USER9,
  USER10,
  USER11,
  USER12;

  private static final List<TextStyleType> USER_SLOTS = List.copyOf(EnumSet.range(USER1, USER12));

  /** User style slots in allocation order. */
  public static List<TextStyleType> userSlots() {
    return USER_SLOTS;
  }

  public boolean isUserStyle() {
    return compareTo(USER1) >= 0;
  }

  /** Built-in style by its file name, ignoring case. User slots are not addressable by name. */
  public static Optional<TextStyleType> builtIn(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String key = name.trim().toUpperCase(Locale.ROOT);
    for (TextStyleType t : values()) {
      if (!t.isUserStyle() && t.name().equals(key)) {
        return Optional.of(t);
      }
    }
    return Optional.empty();
  }
}
