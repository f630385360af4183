package de.mpii.fim.index;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

/**
 * Maps every item to its posting set, i.e., the identifiers of the transactions that contain
 * the item. Transaction identifiers are the zero-based positions in the transaction collection.
 *
 * The index is built once and read-only afterwards. Items that occur in no transaction have no
 * entry; {@link #postings(int)} returns the empty set for them.
 */
public final class InvertedIndex {

  private final Int2ObjectMap<IntSet> postings;

  private final int numTransactions;

  private InvertedIndex(Int2ObjectMap<IntSet> postings, int numTransactions) {
    this.postings = postings;
    this.numTransactions = numTransactions;
  }

  /** Builds the index; an empty collection yields an empty index. */
  public static InvertedIndex build(int[][] transactions) {
    return build(transactions, false);
  }

  /**
   * Builds the index over the given transactions (each given as an array of item ids).
   *
   * @param transactions the transaction collection
   * @param requireNonEmpty whether an empty collection is an error
   * @throws EmptyInputException if requireNonEmpty is set and there are no transactions
   */
  public static InvertedIndex build(int[][] transactions, boolean requireNonEmpty) {
    if (requireNonEmpty && transactions.length == 0) {
      throw new EmptyInputException("Cannot index an empty transaction collection");
    }
    Int2ObjectOpenHashMap<IntSet> postings = new Int2ObjectOpenHashMap<IntSet>();
    for (int transactionId = 0; transactionId < transactions.length; transactionId++) {
      for (int item : transactions[transactionId]) {
        IntSet postingSet = postings.get(item);
        if (postingSet == null) {
          postingSet = new IntOpenHashSet();
          postings.put(item, postingSet);
        }
        postingSet.add(transactionId);
      }
    }

    // freeze
    for (Int2ObjectMap.Entry<IntSet> entry : postings.int2ObjectEntrySet()) {
      entry.setValue(IntSets.unmodifiable(entry.getValue()));
    }
    postings.trim();
    return new InvertedIndex(postings, transactions.length);
  }

  /** The posting set of the given item; empty if the item does not occur. */
  public IntSet postings(int item) {
    IntSet postingSet = postings.get(item);
    return postingSet == null ? IntSets.EMPTY_SET : postingSet;
  }

  public boolean containsItem(int item) {
    return postings.containsKey(item);
  }

  /** Number of distinct items with a non-empty posting set. */
  public int numItems() {
    return postings.size();
  }

  public int numTransactions() {
    return numTransactions;
  }
}
