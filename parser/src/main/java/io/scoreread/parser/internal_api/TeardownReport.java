package io.scoreread.parser.internal_api;

/**
 * What happened to the connector fragments still unresolved when a reader session ended.
 *
 * @param discarded fragments dropped as corrupt
 * @param preserved distinct tuplets handed to the document
 */
public record TeardownReport(int discarded, int preserved) {
  public static final TeardownReport EMPTY = new TeardownReport(0, 0);

  public int total() {
    return discarded + preserved;
  }

  public boolean isEmpty() {
    return total() == 0;
  }
}
