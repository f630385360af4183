package de.mpii.fim.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;

import org.junit.jupiter.api.Test;

import de.mpii.fim.Transactions;

public class ItemDictionaryTest {

  @Test
  public void idsFollowLexicographicOrder() {
    ItemDictionary dictionary = ItemDictionary.build(Transactions.of("CB", "AC", "bA"));

    assertEquals(4, dictionary.size());
    assertEquals(0, dictionary.encode("A"));
    assertEquals(1, dictionary.encode("B"));
    assertEquals(2, dictionary.encode("C"));
    assertEquals(3, dictionary.encode("b"));
    assertEquals("C", dictionary.decode(2));
    assertEquals(Arrays.asList("A", "b"), dictionary.decode(new int[] { 0, 3 }));
  }

  @Test
  public void countsDocumentFrequencies() {
    ItemDictionary dictionary = ItemDictionary.build(Transactions.of("AB", "AAB", "A", "C"));

    assertEquals(3, dictionary.getDocFreq(dictionary.encode("A")));
    assertEquals(2, dictionary.getDocFreq(dictionary.encode("B")));
    assertEquals(1, dictionary.getDocFreq(dictionary.encode("C")));
  }

  @Test
  public void unknownLabelsAreKeptAsUnknown() {
    ItemDictionary dictionary = ItemDictionary.build(Transactions.of("AB"));

    assertEquals(ItemDictionary.UNKNOWN, dictionary.encode("Z"));
    assertArrayEquals(new int[] { ItemDictionary.UNKNOWN, 1 },
        dictionary.encode(Arrays.asList("B", "Z", "Y")));
    assertThrows(IndexOutOfBoundsException.class, () -> dictionary.decode(5));
  }

  @Test
  public void emptyCollectionGivesEmptyDictionary() {
    ItemDictionary dictionary = ItemDictionary.build(Collections.<Set<String>>emptyList());

    assertEquals(0, dictionary.size());
    assertEquals(ItemDictionary.UNKNOWN, dictionary.encode("A"));
  }
}
