package de.mpii.fim.dfs;

import de.mpii.fim.index.TransactionDatabase;
import de.mpii.fim.model.FrequentItemsetTable;

/**
 * Enumerates all itemsets of a transaction database whose support reaches a minimum threshold.
 */
public interface FrequentItemsetMiner {

  /**
   * @param database the transactions to mine; not modified
   * @return the complete table of frequent itemsets
   */
  FrequentItemsetTable mine(TransactionDatabase database);

  /** Minimum support (absolute number of transactions). */
  int getMinSupport();
}
