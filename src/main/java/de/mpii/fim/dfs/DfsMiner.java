package de.mpii.fim.dfs;

import java.util.Arrays;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.mahout.math.list.IntArrayList;
import org.apache.mahout.math.map.OpenIntIntHashMap;

import de.mpii.fim.index.InvertedIndex;
import de.mpii.fim.index.SupportCounter;
import de.mpii.fim.index.TransactionDatabase;
import de.mpii.fim.model.FrequentItemsetTable;
import de.mpii.fim.model.Itemset;

/**
 * Computation of frequent itemsets using a depth-first search over the inverted index.
 *
 * Mining proceeds in two phases. In the first phase, the support of every item is counted with
 * a single pass over the transactions; items with support at least sigma form level 1. In the
 * second phase, every frequent itemset is extended by items that are strictly larger (in the
 * item order) than its largest item. The support of an extension is computed by intersecting
 * posting sets (see {@link SupportCounter}); infrequent extensions are discarded together with
 * their whole subtree, since no superset of an infrequent itemset can be frequent. Restricting
 * extensions to larger items generates every itemset exactly once.
 *
 * Unlike level-wise candidate generation, an extension is counted without first checking that
 * all of its other subsets are frequent. Every recorded itemset is verified individually, so
 * the result is exact.
 *
 * Each recursive call returns the itemsets of its own subtree, which the caller merges into its
 * result; there is no state shared between branches. Instances are immutable and may be reused.
 */
public class DfsMiner implements FrequentItemsetMiner {

  private static final Log LOG = LogFactory.getLog(DfsMiner.class);

  /** Value of lambda when the length of itemsets is not bounded. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  // -- parameters --------------------------------------------------------------------------------

  /** Minimum support */
  protected final int sigma;

  /** Maximum length */
  protected final int lambda;

  // -- initialization ----------------------------------------------------------------------------

  /**
   * @param sigma minimum support
   */
  public DfsMiner(int sigma) {
    this(sigma, UNBOUNDED);
  }

  /**
   * @param sigma minimum support
   * @param lambda maximum length of an itemset
   * @throws InvalidThresholdException if sigma is negative
   * @throws IllegalArgumentException if lambda is smaller than 1
   */
  public DfsMiner(int sigma, int lambda) {
    if (sigma < 0) {
      throw new InvalidThresholdException(sigma);
    }
    if (lambda < 1) {
      throw new IllegalArgumentException("Maximum length must be at least 1, got " + lambda);
    }
    if (sigma == 0) {
      LOG.warn("Minimum support 0: every combination of items is frequent");
    }
    this.sigma = sigma;
    this.lambda = lambda;
  }

  @Override
  public int getMinSupport() {
    return sigma;
  }

  public int getMaxLength() {
    return lambda;
  }

  // -- mining ------------------------------------------------------------------------------------

  @Override
  public FrequentItemsetTable mine(TransactionDatabase database) {
    LOG.info("Mining " + database.size() + " transactions with minimum support " + sigma);
    long start = System.currentTimeMillis();

    // phase 1: count items and retain the frequent ones
    OpenIntIntHashMap itemSupports = countItems(database);
    int[] frequentItems = frequentItems(itemSupports);
    if (frequentItems.length == 0) {
      LOG.info("No frequent items");
      return FrequentItemsetTable.EMPTY;
    }

    FrequentItemsetTable.Builder result = new FrequentItemsetTable.Builder();
    for (int item : frequentItems) {
      result.add(Itemset.of(item), itemSupports.get(item));
    }

    // phase 2: extend every frequent item with larger frequent items
    InvertedIndex index = database.getIndex();
    Statistics stats = new Statistics();
    for (int i = 0; i < frequentItems.length - 1; i++) {
      result.merge(extend(Itemset.of(frequentItems[i]), frequentItems, i + 1, index, stats));
    }

    FrequentItemsetTable table = result.build();
    if (LOG.isInfoEnabled()) {
      LOG.info("Found " + table.size() + " frequent itemsets (max. length " + table.maxLevel()
          + ") in " + (System.currentTimeMillis() - start) + " ms; counted "
          + stats.candidates + " extensions, pruned " + stats.pruned);
    }
    return table;
  }

  /** Counts the number of transactions each item occurs in. */
  static OpenIntIntHashMap countItems(TransactionDatabase database) {
    OpenIntIntHashMap itemSupports = new OpenIntIntHashMap();
    for (int transactionId = 0; transactionId < database.size(); transactionId++) {
      for (int item : database.getTransaction(transactionId)) {
        itemSupports.adjustOrPutValue(item, 1, 1);
      }
    }
    return itemSupports;
  }

  /** Returns the items with support at least sigma, sorted in item order. */
  private int[] frequentItems(OpenIntIntHashMap itemSupports) {
    IntArrayList items = new IntArrayList();
    IntArrayList keys = itemSupports.keys();
    for (int i = 0; i < keys.size(); i++) {
      if (itemSupports.get(keys.get(i)) >= sigma) {
        items.add(keys.get(i));
      }
    }
    int[] result = Arrays.copyOf(items.elements(), items.size());
    Arrays.sort(result);
    return result;
  }

  /**
   * Extends the given frequent itemset by each of the candidate items candidates[from..] (all of
   * which are larger than the largest item of the itemset) and recurses into the frequent
   * extensions.
   *
   * @param current a frequent itemset
   * @param candidates frequent items in item order
   * @param from index of the first candidate that may extend current
   * @return the frequent itemsets of the subtree rooted at current (current excluded)
   */
  private FrequentItemsetTable.Builder extend(Itemset current, int[] candidates, int from,
      InvertedIndex index, Statistics stats) {
    FrequentItemsetTable.Builder result = new FrequentItemsetTable.Builder();
    if (current.size() >= lambda) {
      return result;
    }

    for (int i = from; i < candidates.length; i++) {
      Itemset extension = current.union(candidates[i]);
      int support = SupportCounter.support(extension, index);
      stats.candidates++;

      if (support >= sigma) {
        result.add(extension, support);
        // only larger items remain eligible
        if (i + 1 < candidates.length) {
          result.merge(extend(extension, candidates, i + 1, index, stats));
        }
      } else {
        stats.pruned++;
        if (LOG.isDebugEnabled()) {
          LOG.debug("Pruned " + extension + " (support " + support + ")");
        }
      }
    }
    return result;
  }

  /** Counters of a single mining run. */
  private static final class Statistics {
    long candidates;
    long pruned;
  }
}
