package de.mpii.fim.model;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The frequent itemsets of a mining run, organized by size.
 *
 * Level k maps every frequent itemset with exactly k items to its support. Levels without any
 * itemset are absent. Instances are immutable; use {@link Builder} to construct them.
 */
public final class FrequentItemsetTable {

  public static final FrequentItemsetTable EMPTY = new Builder().build();

  private final SortedMap<Integer, Object2IntMap<Itemset>> levels;

  private final int size;

  private FrequentItemsetTable(SortedMap<Integer, Object2IntMap<Itemset>> levels) {
    SortedMap<Integer, Object2IntMap<Itemset>> copy = new TreeMap<Integer, Object2IntMap<Itemset>>();
    int n = 0;
    for (Map.Entry<Integer, Object2IntMap<Itemset>> entry : levels.entrySet()) {
      Object2IntOpenHashMap<Itemset> level = new Object2IntOpenHashMap<Itemset>(entry.getValue());
      level.defaultReturnValue(-1);
      copy.put(entry.getKey(), Object2IntMaps.unmodifiable(level));
      n += level.size();
    }
    this.levels = Collections.unmodifiableSortedMap(copy);
    this.size = n;
  }

  /** All non-empty levels, keyed by itemset size. */
  public SortedMap<Integer, Object2IntMap<Itemset>> levels() {
    return levels;
  }

  /** The itemsets of size k with their support; empty if there are none. */
  public Object2IntMap<Itemset> level(int k) {
    Object2IntMap<Itemset> level = levels.get(k);
    return level == null ? Object2IntMaps.<Itemset>emptyMap() : level;
  }

  /** Size of the largest frequent itemset, 0 if the table is empty. */
  public int maxLevel() {
    return levels.isEmpty() ? 0 : levels.lastKey();
  }

  /** Total number of frequent itemsets over all levels. */
  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /** Support of the given itemset, or -1 if it is not frequent. */
  public int supportOf(Itemset itemset) {
    Object2IntMap<Itemset> level = levels.get(itemset.size());
    return level == null ? -1 : level.getInt(itemset);
  }

  /** All levels merged into a single (unmodifiable) map. */
  public Object2IntMap<Itemset> flatten() {
    Object2IntOpenHashMap<Itemset> result = new Object2IntOpenHashMap<Itemset>(size);
    result.defaultReturnValue(-1);
    for (Object2IntMap<Itemset> level : levels.values()) {
      result.putAll(level);
    }
    return Object2IntMaps.unmodifiable(result);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FrequentItemsetTable)) return false;
    return levels.equals(((FrequentItemsetTable) o).levels);
  }

  @Override
  public int hashCode() {
    return levels.hashCode();
  }

  @Override
  public String toString() {
    return "FrequentItemsetTable" + levels;
  }

  /**
   * Collects frequent itemsets. Not thread-safe; every itemset may be added only once.
   */
  public static final class Builder {

    private final SortedMap<Integer, Object2IntMap<Itemset>> levels =
        new TreeMap<Integer, Object2IntMap<Itemset>>();

    /**
     * Records a frequent itemset at the level given by its size.
     *
     * @throws IllegalArgumentException if the itemset is empty or the support is negative
     * @throws IllegalStateException if the itemset has been added before
     */
    public Builder add(Itemset itemset, int support) {
      if (itemset.isEmpty()) {
        throw new IllegalArgumentException("The empty itemset has no level");
      }
      if (support < 0) {
        throw new IllegalArgumentException("Negative support " + support + " for " + itemset);
      }
      Object2IntMap<Itemset> level = levels.get(itemset.size());
      if (level == null) {
        level = new Object2IntOpenHashMap<Itemset>();
        level.defaultReturnValue(-1);
        levels.put(itemset.size(), level);
      }
      if (level.containsKey(itemset)) {
        throw new IllegalStateException("Itemset " + itemset + " recorded twice");
      }
      level.put(itemset, support);
      return this;
    }

    /** Adds all itemsets collected by another builder. */
    public Builder merge(Builder other) {
      for (Object2IntMap<Itemset> level : other.levels.values()) {
        for (Object2IntMap.Entry<Itemset> entry : level.object2IntEntrySet()) {
          add(entry.getKey(), entry.getIntValue());
        }
      }
      return this;
    }

    public boolean isEmpty() {
      return levels.isEmpty();
    }

    public FrequentItemsetTable build() {
      return new FrequentItemsetTable(levels);
    }
  }
}
