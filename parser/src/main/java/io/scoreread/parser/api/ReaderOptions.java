package io.scoreread.parser.api;

import java.util.Objects;

/**
 * Reader configuration options.
 *
 * @param docName external document name reported in diagnostics, empty if none
 * @param offsetLines added to reported line numbers, for documents embedded in another file
 * @param repairBrokenConnectors whether unfinished connectors are force-joined at document end
 * @param errorHandler receives unknown elements and recoverable errors
 */
public record ReaderOptions(
    String docName, int offsetLines, boolean repairBrokenConnectors, ErrorHandler errorHandler) {

  /** Default options: unnamed document, no line offset, repair enabled, logging error handler. */
  public static final ReaderOptions DEFAULT = new ReaderOptions("", 0, true, ErrorHandler.DEFAULT);

  /** Same as {@link #DEFAULT} but leaves broken connectors unrepaired. */
  public static final ReaderOptions NO_REPAIR =
      new ReaderOptions("", 0, false, ErrorHandler.DEFAULT);

  public ReaderOptions {
    docName = docName == null ? "" : docName;
    Objects.requireNonNull(errorHandler, "errorHandler must not be null");
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .docName(docName)
        .offsetLines(offsetLines)
        .repairBrokenConnectors(repairBrokenConnectors)
        .errorHandler(errorHandler);
  }

  public static class Builder {
    private String docName = "";
    private int offsetLines = 0;
    private boolean repairBrokenConnectors = true;
    private ErrorHandler errorHandler = ErrorHandler.DEFAULT;

    public Builder docName(String value) {
      this.docName = value;
      return this;
    }

    public Builder offsetLines(int value) {
      this.offsetLines = value;
      return this;
    }

    public Builder repairBrokenConnectors(boolean value) {
      this.repairBrokenConnectors = value;
      return this;
    }

    public Builder errorHandler(ErrorHandler handler) {
      this.errorHandler = Objects.requireNonNull(handler, "errorHandler must not be null");
      return this;
    }

    public ReaderOptions build() {
      return new ReaderOptions(docName, offsetLines, repairBrokenConnectors, errorHandler);
    }
  }
}
