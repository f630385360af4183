package de.mpii.fim.input;

import java.util.Set;

/**
 * Turns the raw value of a transaction into its set of item labels.
 */
public interface ItemExtractor {

  /**
   * @param value raw value of the transaction (never null)
   * @return the distinct item labels of the transaction
   */
  Set<String> extract(String value);
}
