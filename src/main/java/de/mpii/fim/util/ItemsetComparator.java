package de.mpii.fim.util;

import java.util.Comparator;

import de.mpii.fim.model.Itemset;

/**
 * Orders itemsets by size first and then lexicographically by item id.
 */
public final class ItemsetComparator implements Comparator<Itemset> {

  public static final ItemsetComparator INSTANCE = new ItemsetComparator();

  @Override
  public int compare(Itemset a, Itemset b) {
    int len1 = a.size();
    int len2 = b.size();

    if (len1 > len2) return 1;
    if (len1 < len2) return -1;

    // same size: check elements one by one
    for (int i = 0; i < len1; i++) {
      if (a.get(i) != b.get(i)) {
        return Integer.compare(a.get(i), b.get(i));
      }
    }
    return 0;
  }
}
