package de.mpii.fim.driver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import de.mpii.fim.dfs.DfsMiner;
import de.mpii.fim.dfs.InvalidThresholdException;
import de.mpii.fim.input.CharacterItemExtractor;
import de.mpii.fim.input.TokenItemExtractor;
import de.mpii.fim.summary.SummaryType;

public class FimConfigTest {

  @Test
  public void defaultsWhenNothingIsSet() {
    FimConfig config = FimConfig.fromEnvironment(Collections.<String, String>emptyMap());

    assertEquals("data/test.csv", config.getInputPath());
    assertEquals(1, config.getSigma());
    assertEquals(DfsMiner.UNBOUNDED, config.getLambda());
    assertEquals(SummaryType.ALL, config.getType());
    assertEquals(FimConfig.Algorithm.DFS, config.getAlgorithm());
    assertEquals(FimConfig.ItemMode.CHARACTER, config.getItemMode());
    assertNull(config.getOutputPath());
    assertTrue(config.createItemExtractor() instanceof CharacterItemExtractor);
  }

  @Test
  public void readsEnvironment() {
    Map<String, String> env = new HashMap<String, String>();
    env.put(FimConfig.ENV_DATA_FILE, "in.csv");
    env.put(FimConfig.ENV_MIN_SUPPORT, " 3 ");
    env.put(FimConfig.ENV_MAX_LENGTH, "4");
    env.put(FimConfig.ENV_OUTPUT_TYPE, "m");
    env.put(FimConfig.ENV_ALGORITHM, "bfs");
    env.put(FimConfig.ENV_ITEM_MODE, "token");
    env.put(FimConfig.ENV_ITEM_SEPARATOR, ";");
    env.put(FimConfig.ENV_OUTPUT_FILE, "out.txt");

    FimConfig config = FimConfig.fromEnvironment(env);

    assertEquals("in.csv", config.getInputPath());
    assertEquals(3, config.getSigma());
    assertEquals(4, config.getLambda());
    assertEquals(SummaryType.MAXIMAL, config.getType());
    assertEquals(FimConfig.Algorithm.BFS, config.getAlgorithm());
    assertEquals(FimConfig.ItemMode.TOKEN, config.getItemMode());
    assertEquals("out.txt", config.getOutputPath());
    assertTrue(config.createItemExtractor() instanceof TokenItemExtractor);
    assertEquals(config.toString(), new FimConfig(config).toString());
  }

  @Test
  public void emptyValuesKeepDefaults() {
    FimConfig config = FimConfig.fromEnvironment(
        Collections.singletonMap(FimConfig.ENV_MIN_SUPPORT, " "));

    assertEquals(FimConfig.SIGMA_DEFAULT_INT, config.getSigma());
  }

  @Test
  public void rejectsInvalidValues() {
    assertThrows(InvalidThresholdException.class, () -> FimConfig.fromEnvironment(
        Collections.singletonMap(FimConfig.ENV_MIN_SUPPORT, "-2")));
    assertThrows(IllegalArgumentException.class, () -> FimConfig.fromEnvironment(
        Collections.singletonMap(FimConfig.ENV_MIN_SUPPORT, "two")));
    assertThrows(IllegalArgumentException.class, () -> FimConfig.fromEnvironment(
        Collections.singletonMap(FimConfig.ENV_MAX_LENGTH, "0")));
    assertThrows(IllegalArgumentException.class, () -> FimConfig.fromEnvironment(
        Collections.singletonMap(FimConfig.ENV_OUTPUT_TYPE, "z")));
    assertThrows(IllegalArgumentException.class, () -> FimConfig.fromEnvironment(
        Collections.singletonMap(FimConfig.ENV_ALGORITHM, "x")));
    assertThrows(IllegalArgumentException.class, () -> FimConfig.fromEnvironment(
        Collections.singletonMap(FimConfig.ENV_ITEM_MODE, "words")));
    assertThrows(IllegalArgumentException.class, () -> FimConfig.fromEnvironment(
        Collections.singletonMap(FimConfig.ENV_ITEM_MODE, "turtle")));
    assertThrows(IllegalArgumentException.class, () -> FimConfig.fromEnvironment(
        Collections.singletonMap(FimConfig.ENV_ALGORITHM, "bogus")));
    assertThrows(IllegalArgumentException.class, () -> FimConfig.fromEnvironment(
        Collections.singletonMap(FimConfig.ENV_ITEM_SEPARATOR, "[")));
  }

  @Test
  public void acceptsLetterOrFullName() {
    Map<String, String> env = new HashMap<String, String>();
    env.put(FimConfig.ENV_ALGORITHM, "B");
    env.put(FimConfig.ENV_ITEM_MODE, " Character ");
    FimConfig config = FimConfig.fromEnvironment(env);

    assertEquals(FimConfig.Algorithm.BFS, config.getAlgorithm());
    assertEquals(FimConfig.ItemMode.CHARACTER, config.getItemMode());
  }
}
