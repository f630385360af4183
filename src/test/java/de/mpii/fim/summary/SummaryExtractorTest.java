package de.mpii.fim.summary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.Collections;
import java.util.Locale;
import java.util.Set;

import org.junit.jupiter.api.Test;

import de.mpii.fim.Transactions;
import de.mpii.fim.dfs.DfsMiner;
import de.mpii.fim.index.TransactionDatabase;
import de.mpii.fim.model.FrequentItemsetTable;
import de.mpii.fim.model.Itemset;

public class SummaryExtractorTest {

  @Test
  public void summarizesSmallDatabase() {
    TransactionDatabase database = TransactionDatabase.build(Transactions.of("AB", "AB", "A"));
    FrequentItemsetTable table = new DfsMiner(2).mine(database);
    Itemset a = database.itemset("A");
    Itemset ab = database.itemset("A", "B");

    Object2IntMap<Itemset> maximal = SummaryExtractor.maximal(table);
    assertEquals(1, maximal.size());
    assertEquals(2, maximal.getInt(ab));

    // {B} has the superset {A, B} with the same support; {A} does not
    Object2IntMap<Itemset> closed = SummaryExtractor.closed(table);
    assertEquals(2, closed.size());
    assertEquals(3, closed.getInt(a));
    assertEquals(2, closed.getInt(ab));
    assertFalse(closed.containsKey(database.itemset("B")));
  }

  @Test
  public void summarizesLargerDatabase() {
    TransactionDatabase database = TransactionDatabase.build(
        Transactions.of("ABC", "AB", "AC", "BD", "AAB"));
    FrequentItemsetTable table = new DfsMiner(2).mine(database);

    Object2IntMap<Itemset> maximal = SummaryExtractor.maximal(table);
    assertEquals(2, maximal.size());
    assertEquals(3, maximal.getInt(database.itemset("A", "B")));
    assertEquals(2, maximal.getInt(database.itemset("A", "C")));

    Object2IntMap<Itemset> closed = SummaryExtractor.closed(table);
    assertEquals(4, closed.size());
    assertEquals(4, closed.getInt(database.itemset("A")));
    assertEquals(4, closed.getInt(database.itemset("B")));
    assertFalse(closed.containsKey(database.itemset("C")));
  }

  @Test
  public void emptyTableHasEmptySummaries() {
    FrequentItemsetTable table = new DfsMiner(1).mine(
        TransactionDatabase.build(Collections.<Set<String>>emptyList()));

    assertTrue(SummaryExtractor.maximal(table).isEmpty());
    assertTrue(SummaryExtractor.closed(table).isEmpty());
    assertTrue(SummaryExtractor.extract(table, SummaryType.ALL).isEmpty());
  }

  @Test
  public void matchesDefinitionsOnRandomData() {
    for (long seed = 0; seed < 6; seed++) {
      TransactionDatabase database = TransactionDatabase.build(
          Transactions.random(seed, 60, 9, 0.45));
      FrequentItemsetTable table = new DfsMiner(6).mine(database);
      Object2IntMap<Itemset> frequent = table.flatten();
      Object2IntMap<Itemset> maximal = SummaryExtractor.maximal(table);
      Object2IntMap<Itemset> closed = SummaryExtractor.closed(table);

      for (Object2IntMap.Entry<Itemset> entry : frequent.object2IntEntrySet()) {
        boolean hasSuperset = false;
        boolean hasEqualSupportSuperset = false;
        // compare against supersets on all levels, not only the next one
        for (Object2IntMap.Entry<Itemset> other : frequent.object2IntEntrySet()) {
          if (entry.getKey().isProperSubsetOf(other.getKey())) {
            hasSuperset = true;
            if (other.getIntValue() == entry.getIntValue()) {
              hasEqualSupportSuperset = true;
            }
          }
        }
        assertEquals(!hasSuperset, maximal.containsKey(entry.getKey()), entry.getKey() + " maximal");
        assertEquals(!hasEqualSupportSuperset, closed.containsKey(entry.getKey()),
            entry.getKey() + " closed");
      }
    }
  }

  @Test
  public void maximalItemsetsAreClosedAndFrequent() {
    TransactionDatabase database = TransactionDatabase.build(Transactions.random(9, 90, 10, 0.4));
    FrequentItemsetTable table = new DfsMiner(7).mine(database);
    Object2IntMap<Itemset> maximal = SummaryExtractor.maximal(table);
    Object2IntMap<Itemset> closed = SummaryExtractor.closed(table);

    assertFalse(maximal.isEmpty());
    for (Object2IntMap.Entry<Itemset> entry : maximal.object2IntEntrySet()) {
      assertEquals(table.supportOf(entry.getKey()), entry.getIntValue());
      assertEquals(entry.getIntValue(), closed.getInt(entry.getKey()));
    }
    assertTrue(closed.size() >= maximal.size());
    assertTrue(table.size() >= closed.size());
  }

  @Test
  public void extractionIsIdempotent() {
    FrequentItemsetTable table = new DfsMiner(5).mine(
        TransactionDatabase.build(Transactions.random(4, 70, 8, 0.5)));

    assertEquals(SummaryExtractor.maximal(table), SummaryExtractor.maximal(table));
    assertEquals(SummaryExtractor.closed(table), SummaryExtractor.closed(table));
    assertEquals(table.flatten(), SummaryExtractor.extract(table, SummaryType.ALL));
  }

  @Test
  public void resultsAreReadOnly() {
    FrequentItemsetTable table = new DfsMiner(1).mine(
        TransactionDatabase.build(Transactions.of("AB")));

    assertThrows(UnsupportedOperationException.class,
        () -> SummaryExtractor.maximal(table).put(Itemset.of(0), 1));
  }

  @Test
  public void parsesSummaryTypes() {
    assertEquals(SummaryType.ALL, SummaryType.parse("a"));
    assertEquals(SummaryType.MAXIMAL, SummaryType.parse("Maximal"));
    assertEquals(SummaryType.CLOSED, SummaryType.parse(" c "));
    assertThrows(IllegalArgumentException.class, () -> SummaryType.parse("x"));
  }

  @Test
  public void parsesSummaryTypesIndependentOfLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertEquals(SummaryType.MAXIMAL, SummaryType.parse("maximal"));
      assertEquals(SummaryType.ALL, SummaryType.parse("all"));
    } finally {
      Locale.setDefault(previous);
    }
  }
}
