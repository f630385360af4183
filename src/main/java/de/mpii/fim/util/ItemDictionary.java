package de.mpii.fim.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.mahout.math.map.OpenObjectIntHashMap;

/**
 * Maps item labels to dense integer identifiers and back.
 *
 * Identifiers are assigned in lexicographic order of the labels, i.e., the label with the
 * smallest {@link String#compareTo(String)} value receives id 0. The natural order of the ids
 * is therefore the total order on items used during mining (canonical itemset representation
 * and search pruning both rely on it).
 *
 * Besides the id mapping, the dictionary stores the document frequency of every item (the
 * number of transactions it occurs in).
 */
public final class ItemDictionary {

  /** Identifier returned for labels that do not occur in any transaction. */
  public static final int UNKNOWN = -1;

  private final OpenObjectIntHashMap<String> labelToId;

  private final String[] idToLabel;

  private final int[] docFreqs;

  private ItemDictionary(String[] idToLabel, int[] docFreqs) {
    this.idToLabel = idToLabel;
    this.docFreqs = docFreqs;
    this.labelToId = new OpenObjectIntHashMap<String>(Math.max(idToLabel.length, 1));
    for (int id = 0; id < idToLabel.length; id++) {
      labelToId.put(idToLabel[id], id);
    }
  }

  /**
   * Constructs the dictionary of all labels occurring in the given transactions.
   *
   * @param transactions transactions given as sets of item labels
   * @return the dictionary
   */
  public static ItemDictionary build(List<? extends Set<String>> transactions) {
    TreeSet<String> labels = new TreeSet<String>();
    for (Set<String> transaction : transactions) {
      labels.addAll(transaction);
    }
    String[] idToLabel = labels.toArray(new String[labels.size()]);
    ItemDictionary dictionary = new ItemDictionary(idToLabel, new int[idToLabel.length]);
    for (Set<String> transaction : transactions) {
      for (String label : transaction) {
        dictionary.docFreqs[dictionary.labelToId.get(label)]++;
      }
    }
    return dictionary;
  }

  /** Number of distinct items. */
  public int size() {
    return idToLabel.length;
  }

  /**
   * @param label item label
   * @return id of the label or {@link #UNKNOWN} if the label does not occur in the data
   */
  public int encode(String label) {
    return labelToId.containsKey(label) ? labelToId.get(label) : UNKNOWN;
  }

  /**
   * Encodes a set of labels into a sorted, duplicate-free array of ids. Unknown labels are
   * encoded as {@link #UNKNOWN} and kept, so that callers can detect them.
   */
  public int[] encode(Collection<String> labels) {
    int[] ids = new int[labels.size()];
    int i = 0;
    for (String label : labels) {
      ids[i++] = encode(label);
    }
    Arrays.sort(ids);
    int n = 0;
    for (int j = 0; j < ids.length; j++) {
      if (n == 0 || ids[n - 1] != ids[j]) {
        ids[n++] = ids[j];
      }
    }
    return n == ids.length ? ids : Arrays.copyOf(ids, n);
  }

  /**
   * @param id item id
   * @return label of the item
   * @throws IndexOutOfBoundsException if the id is not known to this dictionary
   */
  public String decode(int id) {
    if (id < 0 || id >= idToLabel.length) {
      throw new IndexOutOfBoundsException("Unknown item id " + id);
    }
    return idToLabel[id];
  }

  /** Decodes ids into labels (in the order given). */
  public List<String> decode(int[] ids) {
    List<String> labels = new ArrayList<String>(ids.length);
    for (int id : ids) {
      labels.add(decode(id));
    }
    return labels;
  }

  /** Number of transactions containing the given item. */
  public int getDocFreq(int id) {
    return docFreqs[id];
  }
}
