package de.mpii.fim.input;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Every distinct character of the value is an item; e.g. "AAB" yields {A, B}.
 *
 * Characters outside the basic multilingual plane count as a single item.
 */
public final class CharacterItemExtractor implements ItemExtractor {

  @Override
  public Set<String> extract(String value) {
    Set<String> items = new LinkedHashSet<String>();
    for (int i = 0; i < value.length(); ) {
      int codePoint = value.codePointAt(i);
      items.add(new String(Character.toChars(codePoint)));
      i += Character.charCount(codePoint);
    }
    return items;
  }

  @Override
  public String toString() {
    return "CharacterItemExtractor";
  }
}
