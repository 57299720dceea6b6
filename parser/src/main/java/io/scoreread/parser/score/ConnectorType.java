package io.scoreread.parser.score;

import java.util.Locale;
import java.util.Optional;

/** Kinds of multi-point constructs that are streamed as separate start/end fragments. */
public enum ConnectorType {
  SLUR("Slur"),
  TIE("Tie"),
  HAIRPIN("HairPin"),
  OTTAVA("Ottava"),
  PEDAL("Pedal"),
  TRILL("Trill"),
  TEXTLINE("TextLine"),
  VOLTA("Volta"),
  TUPLET("Tuplet");

  private final String xmlName;

  ConnectorType(String xmlName) {
    this.xmlName = xmlName;
  }

  /** Element/type name used by the file format. */
  public String xmlName() {
    return xmlName;
  }

  public boolean isTuplet() {
    return this == TUPLET;
  }

  /**
   * Looks up a type by its file name, ignoring case.
   *
   * @param name the name as written in the file
   * @return the type, or empty if the name is not a connector type
   */
  public static Optional<ConnectorType> fromXmlName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String key = name.toLowerCase(Locale.ROOT);
    for (ConnectorType t : values()) {
      if (t.xmlName.toLowerCase(Locale.ROOT).equals(key)) {
        return Optional.of(t);
      }
    }
    return Optional.empty();
  }
}
