package de.mpii.fim.model;

import java.util.Arrays;

/**
 * An immutable set of item identifiers.
 *
 * Items are stored as a sorted, duplicate-free int array; two itemsets are equal iff they
 * contain the same items. The sort order is the natural order of the ids, which is the total
 * order on items (see {@link de.mpii.fim.util.ItemDictionary}).
 */
public final class Itemset {

  public static final Itemset EMPTY = new Itemset(new int[0]);

  private final int[] items;

  private final int hash;

  private Itemset(int[] sortedItems) {
    this.items = sortedItems;
    this.hash = Arrays.hashCode(sortedItems);
  }

  /**
   * Creates an itemset from the given ids. The ids may be given in any order and may contain
   * duplicates; the argument is not modified.
   */
  public static Itemset of(int... ids) {
    if (ids.length == 0) {
      return EMPTY;
    }
    int[] sorted = ids.clone();
    Arrays.sort(sorted);
    int n = 1;
    for (int i = 1; i < sorted.length; i++) {
      if (sorted[i] != sorted[n - 1]) {
        sorted[n++] = sorted[i];
      }
    }
    return new Itemset(n == sorted.length ? sorted : Arrays.copyOf(sorted, n));
  }

  public int size() {
    return items.length;
  }

  public boolean isEmpty() {
    return items.length == 0;
  }

  /** Returns the i-th smallest item. */
  public int get(int i) {
    return items[i];
  }

  /** Returns the largest item, or -1 for the empty itemset. */
  public int last() {
    return items.length == 0 ? -1 : items[items.length - 1];
  }

  /** Returns a copy of the (sorted) items. */
  public int[] toArray() {
    return items.clone();
  }

  public boolean contains(int item) {
    return Arrays.binarySearch(items, item) >= 0;
  }

  /** Returns this itemset extended by the given item. */
  public Itemset union(int item) {
    int pos = Arrays.binarySearch(items, item);
    if (pos >= 0) {
      return this;
    }
    int insertAt = -pos - 1;
    int[] result = new int[items.length + 1];
    System.arraycopy(items, 0, result, 0, insertAt);
    result[insertAt] = item;
    System.arraycopy(items, insertAt, result, insertAt + 1, items.length - insertAt);
    return new Itemset(result);
  }

  /** Returns the union of both itemsets. */
  public Itemset union(Itemset other) {
    int[] result = new int[items.length + other.items.length];
    int i = 0, j = 0, n = 0;
    while (i < items.length && j < other.items.length) {
      if (items[i] < other.items[j]) {
        result[n++] = items[i++];
      } else if (items[i] > other.items[j]) {
        result[n++] = other.items[j++];
      } else {
        result[n++] = items[i++];
        j++;
      }
    }
    while (i < items.length) result[n++] = items[i++];
    while (j < other.items.length) result[n++] = other.items[j++];
    return new Itemset(n == result.length ? result : Arrays.copyOf(result, n));
  }

  /** Returns this itemset without the item at the given position. */
  public Itemset without(int position) {
    int[] result = new int[items.length - 1];
    System.arraycopy(items, 0, result, 0, position);
    System.arraycopy(items, position + 1, result, position, items.length - position - 1);
    return new Itemset(result);
  }

  /** Returns the first k items of this itemset. */
  public Itemset prefix(int k) {
    return k == items.length ? this : new Itemset(Arrays.copyOf(items, k));
  }

  /** Is every item of other also an item of this itemset? */
  public boolean containsAll(Itemset other) {
    if (other.items.length > items.length) return false;
    int i = 0;
    for (int item : other.items) {
      // merge; both arrays are sorted
      while (i < items.length && items[i] < item) i++;
      if (i == items.length || items[i] != item) return false;
      i++;
    }
    return true;
  }

  /** Is every item of this itemset also an item of the given sorted transaction? */
  public boolean isContainedIn(int[] sortedTransaction) {
    if (items.length > sortedTransaction.length) return false;
    int i = 0;
    for (int item : items) {
      while (i < sortedTransaction.length && sortedTransaction[i] < item) i++;
      if (i == sortedTransaction.length || sortedTransaction[i] != item) return false;
      i++;
    }
    return true;
  }

  public boolean isProperSubsetOf(Itemset other) {
    return items.length < other.items.length && other.containsAll(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Itemset)) return false;
    Itemset other = (Itemset) o;
    return hash == other.hash && Arrays.equals(items, other.items);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return Arrays.toString(items);
  }
}
