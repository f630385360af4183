package de.mpii.fim.summary;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;

import java.util.Map;
import java.util.Set;

import de.mpii.fim.model.FrequentItemsetTable;
import de.mpii.fim.model.Itemset;

/**
 * Derives the maximal and the closed frequent itemsets from a complete frequent itemset table.
 *
 * An itemset is maximal if it has no frequent proper superset, and closed if it has no proper
 * superset with the same support. Both conditions only need to be checked against the next
 * level: every subset of a frequent itemset is frequent and support does not increase along a
 * chain of supersets, so a violating superset at level k+2 or above implies one at level k+1.
 *
 * Each itemset of level k+1 marks its k-subsets (obtained by removing a single item). This
 * finds all subset relations between adjacent levels without comparing every pair of itemsets.
 *
 * The table must be complete; the extraction does not modify it and always yields the same result
 * for the same table.
 */
public final class SummaryExtractor {

  private SummaryExtractor() {
  }

  /** Maximal frequent itemsets with their supports. */
  public static Object2IntMap<Itemset> maximal(FrequentItemsetTable table) {
    return extract(table, SummaryType.MAXIMAL);
  }

  /** Closed frequent itemsets with their supports. */
  public static Object2IntMap<Itemset> closed(FrequentItemsetTable table) {
    return extract(table, SummaryType.CLOSED);
  }

  /**
   * @param table complete table of frequent itemsets
   * @param type which itemsets to retain; {@link SummaryType#ALL} returns the flattened table
   * @return the retained itemsets with their supports (unmodifiable)
   */
  public static Object2IntMap<Itemset> extract(FrequentItemsetTable table, SummaryType type) {
    if (type == SummaryType.ALL) {
      return table.flatten();
    }

    Object2IntOpenHashMap<Itemset> result = new Object2IntOpenHashMap<Itemset>();
    result.defaultReturnValue(-1);
    for (Map.Entry<Integer, Object2IntMap<Itemset>> entry : table.levels().entrySet()) {
      int k = entry.getKey();
      Set<Itemset> covered = coveredBy(entry.getValue(), table.level(k + 1), type);
      for (Object2IntMap.Entry<Itemset> itemset : entry.getValue().object2IntEntrySet()) {
        if (!covered.contains(itemset.getKey())) {
          result.put(itemset.getKey(), itemset.getIntValue());
        }
      }
    }
    return Object2IntMaps.unmodifiable(result);
  }

  /**
   * Returns the itemsets of level k that have a superset in the given level k+1 which rules them out:
   * any superset for MAXIMAL, a superset of the same support for CLOSED.
   */
  private static Set<Itemset> coveredBy(Object2IntMap<Itemset> level,
      Object2IntMap<Itemset> nextLevel, SummaryType type) {
    Set<Itemset> covered = new ObjectOpenHashSet<Itemset>();
    for (Object2IntMap.Entry<Itemset> entry : nextLevel.object2IntEntrySet()) {
      Itemset superset = entry.getKey();
      int support = entry.getIntValue();
      for (int position = 0; position < superset.size(); position++) {
        Itemset subset = superset.without(position);
        switch (type) {
        case MAXIMAL:
          covered.add(subset);
          break;
        case CLOSED:
          if (level.containsKey(subset) && level.getInt(subset) == support) {
            covered.add(subset);
          }
          break;
        default:
          break;
        }
      }
    }
    return covered;
  }
}
