package de.mpii.fim.input;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits the value at a separator; every distinct non-empty token is an item.
 */
public final class TokenItemExtractor implements ItemExtractor {

  public static final String DEFAULT_ITEM_SEPARATOR = "\\s+";

  private final Pattern separator;

  public TokenItemExtractor() {
    this(DEFAULT_ITEM_SEPARATOR);
  }

  /**
   * @param separatorRegex regular expression matching the separator between items
   */
  public TokenItemExtractor(String separatorRegex) {
    this.separator = Pattern.compile(separatorRegex);
  }

  @Override
  public Set<String> extract(String value) {
    Set<String> items = new LinkedHashSet<String>();
    for (String token : separator.split(value)) {
      if (!token.isEmpty()) {
        items.add(token);
      }
    }
    return items;
  }

  @Override
  public String toString() {
    return "TokenItemExtractor[" + separator.pattern() + "]";
  }
}
