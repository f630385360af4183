package de.mpii.fim.index;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import de.mpii.fim.model.Itemset;
import de.mpii.fim.util.ItemDictionary;

/**
 * Holds the transaction collection of a mining run together with its item dictionary and
 * inverted index.
 *
 * Transactions are stored as sorted arrays of item ids; the position of a transaction in the
 * collection is its identifier. The database is never modified after construction.
 */
public final class TransactionDatabase {

  private static final Log LOG = LogFactory.getLog(TransactionDatabase.class);

  private final ItemDictionary dictionary;

  private final int[][] transactions;

  private final InvertedIndex index;

  private TransactionDatabase(ItemDictionary dictionary, int[][] transactions,
      InvertedIndex index) {
    this.dictionary = dictionary;
    this.transactions = transactions;
    this.index = index;
  }

  /** Builds the database; an empty collection is allowed. */
  public static TransactionDatabase build(List<? extends Set<String>> transactions) {
    return build(transactions, false);
  }

  /**
   * Encodes the given transactions and builds the inverted index over them.
   *
   * @param transactions transactions given as sets of item labels
   * @param requireNonEmpty whether an empty collection is an error
   * @throws EmptyInputException if requireNonEmpty is set and there are no transactions
   */
  public static TransactionDatabase build(List<? extends Set<String>> transactions,
      boolean requireNonEmpty) {
    Objects.requireNonNull(transactions, "transactions");
    ItemDictionary dictionary = ItemDictionary.build(transactions);
    int[][] encoded = new int[transactions.size()][];
    for (int i = 0; i < encoded.length; i++) {
      encoded[i] = dictionary.encode(transactions.get(i));
    }
    InvertedIndex index = InvertedIndex.build(encoded, requireNonEmpty);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Indexed " + encoded.length + " transactions over " + dictionary.size()
          + " distinct items");
    }
    return new TransactionDatabase(dictionary, encoded, index);
  }

  public ItemDictionary getDictionary() {
    return dictionary;
  }

  public InvertedIndex getIndex() {
    return index;
  }

  public int size() {
    return transactions.length;
  }

  public boolean isEmpty() {
    return transactions.length == 0;
  }

  /** Returns a copy of the sorted item ids of the given transaction. */
  public int[] getTransaction(int transactionId) {
    return transactions[transactionId].clone();
  }

  /** Support of the given itemset of item ids. */
  public int support(Itemset itemset) {
    return SupportCounter.support(itemset, index);
  }

  /**
   * Support of the itemset with the given labels. Labels that do not occur in any transaction
   * are kept in the query, so the support of such an itemset is 0.
   */
  public int support(Collection<String> labels) {
    return SupportCounter.support(Itemset.of(dictionary.encode(labels)), index);
  }

  /**
   * Encodes labels into an itemset of ids.
   *
   * @throws IllegalArgumentException if a label does not occur in any transaction
   */
  public Itemset itemset(String... labels) {
    int[] ids = new int[labels.length];
    for (int i = 0; i < labels.length; i++) {
      ids[i] = dictionary.encode(labels[i]);
      if (ids[i] == ItemDictionary.UNKNOWN) {
        throw new IllegalArgumentException("Unknown item '" + labels[i] + "'");
      }
    }
    return Itemset.of(ids);
  }

  /** Decodes an itemset into its labels, in item order. */
  public List<String> labels(Itemset itemset) {
    return dictionary.decode(itemset.toArray());
  }

  /**
   * Support of the given itemset computed by scanning all transactions. Does not use the
   * inverted index.
   */
  public int scanSupport(Itemset itemset) {
    int support = 0;
    for (int[] transaction : transactions) {
      if (itemset.isContainedIn(transaction)) {
        support++;
      }
    }
    return support;
  }
}
