package de.mpii.fim.index;

/**
 * Thrown when a non-empty transaction collection is required but none was given.
 */
public class EmptyInputException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public EmptyInputException(String message) {
    super(message);
  }
}
