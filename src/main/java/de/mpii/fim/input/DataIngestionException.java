package de.mpii.fim.input;

import java.io.IOException;

/**
 * Signals an input file that cannot be turned into transactions, e.g. because the items column
 * is missing.
 */
public class DataIngestionException extends IOException {

  private static final long serialVersionUID = 1L;

  private final int lineNumber;

  public DataIngestionException(String message, int lineNumber) {
    super(lineNumber > 0 ? "Line " + lineNumber + ": " + message : message);
    this.lineNumber = lineNumber;
  }

  /** 1-based line number of the offending line, or 0 if not line-specific. */
  public int getLineNumber() {
    return lineNumber;
  }
}
