package de.mpii.fim.output;

import java.io.Flushable;
import java.io.IOException;
import java.io.Writer;

import de.mpii.fim.model.Itemset;
import de.mpii.fim.util.ItemDictionary;

/**
 * Translates itemsets back to their item labels and writes one itemset per line:
 *
 * <pre>
 * # frequent k=2
 * {A, B}	2
 * </pre>
 *
 * The label and the support are separated by a tab. The underlying writer is flushed but never
 * closed.
 */
public class TextItemsetWriter implements ItemsetWriter, Flushable {

  private final Writer out;

  private final ItemDictionary dictionary;

  public TextItemsetWriter(Writer out, ItemDictionary dictionary) {
    this.out = out;
    this.dictionary = dictionary;
  }

  @Override
  public void beginSection(String title) throws IOException {
    out.write("# " + title + "\n");
  }

  @Override
  public void write(Itemset itemset, int support) throws IOException {
    out.write(format(itemset));
    out.write("\t" + support + "\n");
  }

  /** Renders the itemset with its labels, e.g. "{A, B}". */
  public String format(Itemset itemset) {
    StringBuilder sb = new StringBuilder("{");
    for (int i = 0; i < itemset.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(dictionary.decode(itemset.get(i)));
    }
    return sb.append('}').toString();
  }

  @Override
  public void flush() throws IOException {
    out.flush();
  }
}
