package de.mpii.fim.index;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSet;

import de.mpii.fim.model.Itemset;

/**
 * Computes the support of itemsets by intersecting posting sets.
 *
 * Every item of the itemset is looked up. An item that is absent from the index contributes an
 * empty posting set, so that any itemset containing it has support 0.
 */
public final class SupportCounter {

  private SupportCounter() {
  }

  /**
   * @param itemset the itemset; the empty itemset has support equal to the number of transactions
   * @param index the inverted index
   * @return number of transactions containing all items of the itemset
   */
  public static int support(Itemset itemset, InvertedIndex index) {
    int size = itemset.size();
    if (size == 0) {
      return index.numTransactions();
    }

    // look up all posting sets and find the smallest one
    IntSet[] postingSets = new IntSet[size];
    int smallest = 0;
    for (int i = 0; i < size; i++) {
      postingSets[i] = index.postings(itemset.get(i));
      if (postingSets[i].size() < postingSets[smallest].size()) {
        smallest = i;
      }
    }
    if (postingSets[smallest].isEmpty()) {
      return 0;
    }
    if (size == 1) {
      return postingSets[0].size();
    }

    // probe every transaction of the smallest posting set against all others
    int support = 0;
    for (IntIterator it = postingSets[smallest].iterator(); it.hasNext(); ) {
      int transactionId = it.nextInt();
      boolean inAll = true;
      for (int i = 0; i < size; i++) {
        if (i != smallest && !postingSets[i].contains(transactionId)) {
          inAll = false;
          break;
        }
      }
      if (inAll) {
        support++;
      }
    }
    return support;
  }
}
