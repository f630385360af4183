package de.mpii.fim.bfs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import de.mpii.fim.Transactions;
import de.mpii.fim.dfs.DfsMiner;
import de.mpii.fim.dfs.InvalidThresholdException;
import de.mpii.fim.index.TransactionDatabase;
import de.mpii.fim.model.FrequentItemsetTable;
import de.mpii.fim.model.Itemset;

public class BfsMinerTest {

  @Test
  public void agreesWithDepthFirstSearch() {
    for (long seed = 0; seed < 8; seed++) {
      TransactionDatabase database = TransactionDatabase.build(
          Transactions.random(seed, 120, 12, 0.35));
      for (int sigma : new int[] { 1, 5, 10, 20, 40 }) {
        assertEquals(new DfsMiner(sigma).mine(database), new BfsMiner(sigma).mine(database),
            "seed=" + seed + " sigma=" + sigma);
      }
    }
  }

  @Test
  public void zeroThresholdReportsEveryCombination() {
    TransactionDatabase database = TransactionDatabase.build(Transactions.of("AB", "C"));
    FrequentItemsetTable table = new BfsMiner(0).mine(database);

    assertEquals(7, table.size());
    assertEquals(0, table.supportOf(database.itemset("A", "B", "C")));
    assertEquals(new DfsMiner(0).mine(database), table);
  }

  @Test
  public void agreesOnEdgeCases() {
    List<List<Set<String>>> databases = Arrays.asList(
        Collections.<Set<String>>emptyList(),
        Transactions.of("AB", "AB", "A"),
        Transactions.of("", "", "A"),
        Transactions.of("ABCDE"),
        Transactions.of("ABC", "ABD", "ACD", "BCD"));
    for (List<Set<String>> transactions : databases) {
      TransactionDatabase database = TransactionDatabase.build(transactions);
      for (int sigma = 0; sigma <= 3; sigma++) {
        assertEquals(new DfsMiner(sigma).mine(database), new BfsMiner(sigma).mine(database),
            transactions + " sigma=" + sigma);
      }
    }
  }

  @Test
  public void agreesUnderMaximumLength() {
    TransactionDatabase database = TransactionDatabase.build(Transactions.random(5, 80, 9, 0.5));
    for (int lambda = 1; lambda <= 4; lambda++) {
      FrequentItemsetTable table = new BfsMiner(5, lambda).mine(database);
      assertEquals(new DfsMiner(5, lambda).mine(database), table);
      assertTrue(table.maxLevel() <= lambda);
    }
  }

  @Test
  public void joinsItemsetsWithCommonPrefix() {
    BfsMiner miner = new BfsMiner(1);
    // {0,1}, {0,2}, {0,3}, {1,2}: only {1,3} and {2,3} are missing
    FrequentItemsetTable level2 = new FrequentItemsetTable.Builder()
        .add(Itemset.of(0, 1), 1).add(Itemset.of(0, 2), 1)
        .add(Itemset.of(0, 3), 1).add(Itemset.of(1, 2), 1).build();
    Object2IntMap<Itemset> supports = level2.level(2);
    List<Itemset> sorted = Arrays.asList(Itemset.of(0, 1), Itemset.of(0, 2), Itemset.of(0, 3),
        Itemset.of(1, 2));

    List<Itemset> candidates = miner.generateCandidates(sorted, supports);

    // {0,1,3} and {0,2,3} have an infrequent subset
    assertEquals(Arrays.asList(Itemset.of(0, 1, 2)), candidates);
  }

  @Test
  public void rejectsNegativeThreshold() {
    assertThrows(InvalidThresholdException.class, () -> new BfsMiner(-3));
  }
}
