package de.mpii.fim.input;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Reads transactions from a comma-separated file with a header line. Each row is one
 * transaction; its items are extracted from the column named {@value #ITEMS_COLUMN} by an
 * {@link ItemExtractor}. Other columns are ignored.
 *
 * Fields may be enclosed in double quotes; a double quote inside a quoted field is written as
 * two double quotes. Quoted fields must not span lines. Blank lines are skipped.
 */
public class CsvTransactionReader {

  private static final Log LOG = LogFactory.getLog(CsvTransactionReader.class);

  public static final String ITEMS_COLUMN = "items";

  private static final char SEPARATOR = ',';

  private static final char QUOTE = '"';

  private final ItemExtractor itemExtractor;

  public CsvTransactionReader() {
    this(new CharacterItemExtractor());
  }

  public CsvTransactionReader(ItemExtractor itemExtractor) {
    this.itemExtractor = itemExtractor;
  }

  /**
   * Reads all transactions of a UTF-8 encoded file.
   *
   * @throws DataIngestionException if the file is malformed
   */
  public List<Set<String>> read(Path file) throws IOException {
    LOG.info("Reading transactions from " + file + " using " + itemExtractor);
    BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8);
    try {
      return read(br);
    } finally {
      br.close();
    }
  }

  /**
   * Reads all transactions; the reader is not closed.
   *
   * @throws DataIngestionException if the header has no items column or a row has no value for it
   */
  public List<Set<String>> read(Reader in) throws IOException {
    BufferedReader br = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
    List<Set<String>> transactions = new ArrayList<Set<String>>();

    String header = br.readLine();
    if (header == null) {
      throw new DataIngestionException("Missing header line", 0);
    }
    // skip byte order mark
    if (!header.isEmpty() && header.charAt(0) == '\uFEFF') {
      header = header.substring(1);
    }
    int lineNumber = 1;
    List<String> columns = splitLine(header, lineNumber);
    int itemsColumn = columns.indexOf(ITEMS_COLUMN);
    if (itemsColumn < 0) {
      throw new DataIngestionException("No column named '" + ITEMS_COLUMN + "' in header "
          + columns, lineNumber);
    }

    String line;
    while ((line = br.readLine()) != null) {
      lineNumber++;
      if (line.trim().isEmpty()) {
        continue;
      }
      List<String> fields = splitLine(line, lineNumber);
      if (fields.size() <= itemsColumn) {
        throw new DataIngestionException("Missing value for column '" + ITEMS_COLUMN + "'",
            lineNumber);
      }
      transactions.add(itemExtractor.extract(fields.get(itemsColumn)));
    }

    if (LOG.isDebugEnabled()) {
      LOG.debug("Read " + transactions.size() + " transactions (" + lineNumber + " lines)");
    }
    return transactions;
  }

  /** Splits a line into its fields, removing quotes. */
  static List<String> splitLine(String line, int lineNumber) throws DataIngestionException {
    List<String> fields = new ArrayList<String>();
    StringBuilder field = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quoted) {
        if (c == QUOTE) {
          if (i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
            field.append(QUOTE); // escaped quote
            i++;
          } else {
            quoted = false;
          }
        } else {
          field.append(c);
        }
      } else if (c == QUOTE && field.length() == 0) {
        // quotes only open a field; elsewhere they are literal
        quoted = true;
      } else if (c == SEPARATOR) {
        fields.add(field.toString());
        field.setLength(0);
      } else {
        field.append(c);
      }
    }
    if (quoted) {
      throw new DataIngestionException("Unterminated quoted field", lineNumber);
    }
    fields.add(field.toString());
    return fields;
  }
}
