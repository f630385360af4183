package de.mpii.fim.output;

import java.io.IOException;

import de.mpii.fim.model.Itemset;

/**
 * A writer interface that receives itemsets and their supports and outputs them to a predefined
 * output.
 */
public interface ItemsetWriter {

  /** Starts a new group of itemsets, e.g. a level of the frequent itemset table. */
  void beginSection(String title) throws IOException;

  void write(Itemset itemset, int support) throws IOException;
}
