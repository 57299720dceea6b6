package io.scoreread.parser.api;

/**
 * Position of an element in a document, used for diagnostics.
 *
 * @param line line number, already shifted by the session line offset
 * @param column column number
 * @param docName external document name, empty when the document is not named
 */
public record ElementPosition(long line, long column, String docName) {

  public ElementPosition {
    docName = docName == null ? "" : docName;
  }

  @Override
  public String toString() {
    if (docName.isEmpty()) {
      return "line " + line + " col " + column;
    }
    return "<" + docName + "> line " + line + " col " + column;
  }
}
