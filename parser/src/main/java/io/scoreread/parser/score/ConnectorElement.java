package io.scoreread.parser.score;

/** A score element that is carried by connector fragments until its chain is resolved. */
public interface ConnectorElement {
  ConnectorType connectorType();
}
