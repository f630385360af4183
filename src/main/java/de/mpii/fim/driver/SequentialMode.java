package de.mpii.fim.driver;

import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import de.mpii.fim.bfs.BfsMiner;
import de.mpii.fim.dfs.DfsMiner;
import de.mpii.fim.dfs.FrequentItemsetMiner;
import de.mpii.fim.index.TransactionDatabase;
import de.mpii.fim.input.CsvTransactionReader;
import de.mpii.fim.model.FrequentItemsetTable;
import de.mpii.fim.model.Itemset;
import de.mpii.fim.output.ItemsetWriter;
import de.mpii.fim.summary.SummaryExtractor;
import de.mpii.fim.summary.SummaryType;
import de.mpii.fim.util.ItemsetComparator;

/**
 * Runs a complete mining job in memory:
 *
 * Step 1. Read the transactions from the input file, extracting the items of every row.
 *
 * Step 2. Encode the items and build the inverted index ({@link TransactionDatabase}).
 *
 * Step 3. Mine the frequent itemsets with the configured algorithm.
 *
 * Step 4. Derive the maximal and closed itemsets from the complete table.
 *
 * Step 5. Translate the itemsets back to item labels and write them out.
 */
public class SequentialMode {

  private static final Log LOG = LogFactory.getLog(SequentialMode.class);

  /** Outcome of a mining run. All parts are immutable. */
  public static final class Result {

    private final TransactionDatabase database;
    private final FrequentItemsetTable table;
    private final Object2IntMap<Itemset> maximal;
    private final Object2IntMap<Itemset> closed;

    Result(TransactionDatabase database, FrequentItemsetTable table,
        Object2IntMap<Itemset> maximal, Object2IntMap<Itemset> closed) {
      this.database = database;
      this.table = table;
      this.maximal = maximal;
      this.closed = closed;
    }

    public TransactionDatabase getDatabase() {
      return database;
    }

    public FrequentItemsetTable getTable() {
      return table;
    }

    public Object2IntMap<Itemset> getMaximal() {
      return maximal;
    }

    public Object2IntMap<Itemset> getClosed() {
      return closed;
    }
  }

  private final FimConfig commonConfig;

  public SequentialMode(FimConfig commonConfig) {
    this.commonConfig = new FimConfig(commonConfig);
  }

  public FimConfig getCommonConfig() {
    return new FimConfig(commonConfig);
  }

  /** Creates the miner selected by the configuration. */
  public FrequentItemsetMiner createMiner() {
    switch (commonConfig.getAlgorithm()) {
    case BFS:
      return new BfsMiner(commonConfig.getSigma(), commonConfig.getLambda());
    case DFS:
    default:
      return new DfsMiner(commonConfig.getSigma(), commonConfig.getLambda());
    }
  }

  /**
   * Reads the configured input file and mines it.
   *
   * @throws IOException if the input cannot be read or is malformed
   */
  public Result run() throws IOException {
    LOG.info("Running " + commonConfig);
    CsvTransactionReader reader = new CsvTransactionReader(commonConfig.createItemExtractor());
    return mine(reader.read(Paths.get(commonConfig.getInputPath())));
  }

  /** Mines the given transactions. */
  public Result mine(List<? extends Set<String>> transactions) {
    TransactionDatabase database = TransactionDatabase.build(transactions);
    FrequentItemsetTable table = createMiner().mine(database);
    Object2IntMap<Itemset> maximal = SummaryExtractor.maximal(table);
    Object2IntMap<Itemset> closed = SummaryExtractor.closed(table);
    LOG.info(table.size() + " frequent, " + maximal.size() + " maximal, " + closed.size()
        + " closed itemsets");
    return new Result(database, table, maximal, closed);
  }

  /**
   * Writes the result according to the configured type: for {@link SummaryType#ALL}, every
   * level of the frequent itemset table followed by the maximal and the closed itemsets;
   * otherwise only the maximal or the closed itemsets.
   */
  public void write(Result result, ItemsetWriter writer) throws IOException {
    SummaryType type = commonConfig.getType();
    if (type == SummaryType.ALL) {
      for (Map.Entry<Integer, Object2IntMap<Itemset>> level : result.getTable().levels().entrySet()) {
        writer.beginSection("frequent k=" + level.getKey());
        writeSorted(level.getValue(), writer);
      }
    }
    if (type == SummaryType.ALL || type == SummaryType.MAXIMAL) {
      writer.beginSection("maximal");
      writeSorted(result.getMaximal(), writer);
    }
    if (type == SummaryType.ALL || type == SummaryType.CLOSED) {
      writer.beginSection("closed");
      writeSorted(result.getClosed(), writer);
    }
  }

  private static void writeSorted(Object2IntMap<Itemset> itemsets, ItemsetWriter writer)
      throws IOException {
    List<Itemset> sorted = new ArrayList<Itemset>(itemsets.keySet());
    Collections.sort(sorted, ItemsetComparator.INSTANCE);
    for (Itemset itemset : sorted) {
      writer.write(itemset, itemsets.getInt(itemset));
    }
  }
}
