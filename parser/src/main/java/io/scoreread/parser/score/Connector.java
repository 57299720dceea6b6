package io.scoreread.parser.score;

import io.scoreread.parser.api.Fraction;
import io.scoreread.parser.api.Location;
import java.util.List;

/**
 * A fully resolved connector, handed to the document when its chain is finished.
 *
 * @param type the connector kind
 * @param id the grouping id from the file, {@code -1} if the file gave none
 * @param tick document position of the start fragment
 * @param track track of the start fragment
 * @param tick2 document position of the end fragment
 * @param track2 track of the end fragment
 * @param anchors reader locations of every fragment, start to end
 * @param element the element carried by the chain, or {@code null} if no fragment had one
 * @param repaired whether the chain was closed by the broken-connector repair pass
 */
public record Connector(
    ConnectorType type,
    int id,
    Fraction tick,
    int track,
    Fraction tick2,
    int track2,
    List<Location> anchors,
    ConnectorElement element,
    boolean repaired) {

  public Connector {
    anchors = List.copyOf(anchors);
  }
}
