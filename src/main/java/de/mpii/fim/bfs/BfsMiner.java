package de.mpii.fim.bfs;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.mahout.math.function.IntIntProcedure;
import org.apache.mahout.math.map.OpenIntIntHashMap;

import de.mpii.fim.dfs.DfsMiner;
import de.mpii.fim.dfs.FrequentItemsetMiner;
import de.mpii.fim.dfs.InvalidThresholdException;
import de.mpii.fim.index.TransactionDatabase;
import de.mpii.fim.model.FrequentItemsetTable;
import de.mpii.fim.model.Itemset;
import de.mpii.fim.util.ItemsetComparator;

/**
 * Computation of frequent itemsets using a breadth-first search.
 *
 * This miner computes the same table as {@link DfsMiner} with a different algorithm and can be
 * used to cross-check it. The frequent (k+1)-itemsets are computed from the frequent
 * k-itemsets: two k-itemsets that share their first k-1 items are joined into a candidate
 * (k+1)-itemset (pairwise union), candidates with an infrequent k-subset are dropped, and the
 * support of the remaining candidates is counted by scanning the transactions. The inverted
 * index is not used.
 *
 * Instances are immutable and may be reused.
 */
public class BfsMiner implements FrequentItemsetMiner {

  private static final Log LOG = LogFactory.getLog(BfsMiner.class);

  // -- parameters --------------------------------------------------------------------------------

  /** Minimum support */
  protected final int sigma;

  /** Maximum length */
  protected final int lambda;

  // -- initialization ----------------------------------------------------------------------------

  /**
   * @param sigma minimum support
   */
  public BfsMiner(int sigma) {
    this(sigma, DfsMiner.UNBOUNDED);
  }

  /**
   * @param sigma minimum support
   * @param lambda maximum length of an itemset
   */
  public BfsMiner(int sigma, int lambda) {
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

  // -- mining phase ------------------------------------------------------------------------------

  @Override
  public FrequentItemsetTable mine(TransactionDatabase database) {
    LOG.info("Mining " + database.size() + " transactions with minimum support " + sigma
        + " (breadth-first)");
    FrequentItemsetTable.Builder result = new FrequentItemsetTable.Builder();

    // k = 1: count items
    OpenIntIntHashMap itemSupports = new OpenIntIntHashMap();
    for (int transactionId = 0; transactionId < database.size(); transactionId++) {
      for (int item : database.getTransaction(transactionId)) {
        itemSupports.adjustOrPutValue(item, 1, 1);
      }
    }
    final FrequentItemsetTable.Builder level1 = new FrequentItemsetTable.Builder();
    final List<Itemset> items = new ArrayList<Itemset>();
    itemSupports.forEachPair(new IntIntProcedure() {
      public boolean apply(int item, int support) {
        if (support >= sigma) {
          Itemset itemset = Itemset.of(item);
          level1.add(itemset, support);
          items.add(itemset);
        }
        return true;
      }
    });
    result.merge(level1);

    FrequentItemsetTable.Builder level = level1;
    List<Itemset> kItemsets = items;

    int k = 1;
    while (k < lambda && kItemsets.size() > 1) {
      Collections.sort(kItemsets, ItemsetComparator.INSTANCE);
      FrequentItemsetTable kTable = level.build();
      level = new FrequentItemsetTable.Builder();
      List<Itemset> k1Itemsets = new ArrayList<Itemset>();

      for (Itemset candidate : generateCandidates(kItemsets, kTable.level(k))) {
        int support = database.scanSupport(candidate);
        if (support >= sigma) {
          level.add(candidate, support);
          k1Itemsets.add(candidate);
        }
      }

      if (LOG.isDebugEnabled()) {
        LOG.debug("Level " + (k + 1) + ": " + k1Itemsets.size() + " frequent itemsets");
      }
      result.merge(level);
      kItemsets = k1Itemsets;
      k++;
    }

    FrequentItemsetTable table = result.build();
    LOG.info("Found " + table.size() + " frequent itemsets (max. length " + table.maxLevel() + ")");
    return table;
  }

  /**
   * Joins all pairs of k-itemsets with a common (k-1)-prefix. A candidate is returned only if
   * all of its k-subsets are frequent.
   *
   * @param kItemsets the frequent k-itemsets in {@link ItemsetComparator} order
   * @param kSupports the frequent k-itemsets with their supports
   */
  List<Itemset> generateCandidates(List<Itemset> kItemsets, Object2IntMap<Itemset> kSupports) {
    // build prefix index (maps prefix to indexes of the itemsets with this prefix)
    Map<IntArrayList, IntArrayList> itemsetsWithPrefix =
        new Object2ObjectOpenHashMap<IntArrayList, IntArrayList>();
    List<IntArrayList> prefixes = new ArrayList<IntArrayList>();
    for (int index = 0; index < kItemsets.size(); index++) {
      Itemset itemset = kItemsets.get(index);
      IntArrayList prefix = new IntArrayList(itemset.size() - 1);
      for (int j = 0; j < itemset.size() - 1; j++) {
        prefix.add(itemset.get(j));
      }
      IntArrayList indexes = itemsetsWithPrefix.get(prefix);
      if (indexes == null) {
        indexes = new IntArrayList();
        itemsetsWithPrefix.put(prefix, indexes);
        prefixes.add(prefix);
      }
      indexes.add(index);
    }

    // join; itemsets with the same prefix differ only in their last item
    List<Itemset> candidates = new ArrayList<Itemset>();
    for (IntArrayList prefix : prefixes) {
      IntArrayList indexes = itemsetsWithPrefix.get(prefix);
      for (int i = 0; i < indexes.size(); i++) {
        Itemset left = kItemsets.get(indexes.getInt(i));
        for (int j = i + 1; j < indexes.size(); j++) {
          Itemset candidate = left.union(kItemsets.get(indexes.getInt(j)));
          if (allSubsetsFrequent(candidate, kSupports)) {
            candidates.add(candidate);
          }
        }
      }
    }
    return candidates;
  }

  private static boolean allSubsetsFrequent(Itemset candidate, Object2IntMap<Itemset> kSupports) {
    // the two subsets that formed the candidate are frequent by construction
    for (int position = 0; position < candidate.size() - 2; position++) {
      if (!kSupports.containsKey(candidate.without(position))) {
        return false;
      }
    }
    return true;
  }
}
