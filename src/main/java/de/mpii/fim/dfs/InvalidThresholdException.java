package de.mpii.fim.dfs;

/**
 * Thrown for a minimum support threshold that is negative.
 */
public class InvalidThresholdException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final int threshold;

  public InvalidThresholdException(int threshold) {
    super("Minimum support must be greater than or equal to 0, got " + threshold);
    this.threshold = threshold;
  }

  public int getThreshold() {
    return threshold;
  }
}
