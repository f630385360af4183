package de.mpii.fim.driver;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import de.mpii.fim.dfs.DfsMiner;
import de.mpii.fim.dfs.InvalidThresholdException;
import de.mpii.fim.input.CharacterItemExtractor;
import de.mpii.fim.input.ItemExtractor;
import de.mpii.fim.input.TokenItemExtractor;
import de.mpii.fim.summary.SummaryType;

/**
 * FimConfig holds all parameters required for a mining run: where the transactions come from,
 * how items are extracted from them, the minimum support, and what is written where.
 *
 * The configuration is read from environment variables by {@link #fromEnvironment(Map)}; the
 * mining classes themselves never consult the environment.
 */
public class FimConfig {

  /*
   * Ways to mine frequent itemsets :
   * 1. DFS - depth-first search over the inverted index
   * 2. BFS - breadth-first, join-based search (slower, used for cross-checking)
   */
  public static enum Algorithm {
    DFS, BFS
  };

  /*
   * Ways to turn the items column into items :
   * 1. CHARACTER - every distinct character is an item
   * 2. TOKEN     - every distinct token (split at itemSeparator) is an item
   */
  public static enum ItemMode {
    CHARACTER, TOKEN
  };

  // names of the environment variables
  public static final String ENV_DATA_FILE      = "DATA_FILE";
  public static final String ENV_MIN_SUPPORT    = "MIN_SUPPORT";
  public static final String ENV_MAX_LENGTH     = "MAX_LENGTH";
  public static final String ENV_OUTPUT_TYPE    = "OUTPUT_TYPE";
  public static final String ENV_ALGORITHM      = "ALGORITHM";
  public static final String ENV_ITEM_MODE      = "ITEM_MODE";
  public static final String ENV_ITEM_SEPARATOR = "ITEM_SEPARATOR";
  public static final String ENV_OUTPUT_FILE    = "OUTPUT_FILE";

  // defaults
  public static final String DEFAULT_DATA_FILE   = "data/test.csv";
  public static final int    SIGMA_DEFAULT_INT   = 1;
  public static final int    LAMBDA_DEFAULT_INT  = DfsMiner.UNBOUNDED;

  // parameters of the mining algorithm
  private int sigma;
  private int lambda;
  private Algorithm algorithm;

  // input
  private String inputPath;
  private ItemMode itemMode;
  private String itemSeparator;

  // output; outputPath null means standard output
  private SummaryType type;
  private String outputPath;

  //CONSTRUCTORS

  //Default options values are set here
  public FimConfig() {
    this.sigma         = SIGMA_DEFAULT_INT;
    this.lambda        = LAMBDA_DEFAULT_INT;
    this.algorithm     = Algorithm.DFS;
    this.inputPath     = DEFAULT_DATA_FILE;
    this.itemMode      = ItemMode.CHARACTER;
    this.itemSeparator = TokenItemExtractor.DEFAULT_ITEM_SEPARATOR;
    this.type          = SummaryType.ALL;
    this.outputPath    = null;
  }

  //Copy Constructor
  public FimConfig(FimConfig other) {
    this.sigma         = other.getSigma();
    this.lambda        = other.getLambda();
    this.algorithm     = other.getAlgorithm();
    this.inputPath     = other.getInputPath();
    this.itemMode      = other.getItemMode();
    this.itemSeparator = other.getItemSeparator();
    this.type          = other.getType();
    this.outputPath    = other.getOutputPath();
  }

  /**
   * Creates a configuration from environment variables; variables that are not set (or empty)
   * keep their default value.
   *
   * @param env the environment, usually {@link System#getenv()}
   * @throws InvalidThresholdException if the minimum support is negative
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static FimConfig fromEnvironment(Map<String, String> env) {
    FimConfig config = new FimConfig();

    String value = get(env, ENV_DATA_FILE);
    if (value != null) {
      config.setInputPath(value);
    }
    value = get(env, ENV_MIN_SUPPORT);
    if (value != null) {
      int sigma = parseInt(ENV_MIN_SUPPORT, value);
      if (sigma < 0) {
        throw new InvalidThresholdException(sigma);
      }
      config.setSigma(sigma);
    }
    value = get(env, ENV_MAX_LENGTH);
    if (value != null) {
      int lambda = parseInt(ENV_MAX_LENGTH, value);
      if (lambda < 1) {
        throw new IllegalArgumentException(ENV_MAX_LENGTH + " must be at least 1, got " + lambda);
      }
      config.setLambda(lambda);
    }
    value = get(env, ENV_OUTPUT_TYPE);
    if (value != null) {
      config.setType(SummaryType.parse(value));
    }
    value = get(env, ENV_ALGORITHM);
    if (value != null) {
      config.setAlgorithm(parseOption(ENV_ALGORITHM, value, Algorithm.values()));
    }
    value = get(env, ENV_ITEM_MODE);
    if (value != null) {
      config.setItemMode(parseOption(ENV_ITEM_MODE, value, ItemMode.values()));
    }
    value = get(env, ENV_ITEM_SEPARATOR);
    if (value != null) {
      try {
        Pattern.compile(value);
      } catch (PatternSyntaxException e) {
        throw new IllegalArgumentException(ENV_ITEM_SEPARATOR
            + " is not a valid regular expression: '" + value + "'", e);
      }
      config.setItemSeparator(value);
    }
    value = get(env, ENV_OUTPUT_FILE);
    if (value != null) {
      config.setOutputPath(value);
    }
    return config;
  }

  private static String get(Map<String, String> env, String name) {
    String value = env.get(name);
    return value == null || value.trim().isEmpty() ? null : value;
  }

  /** Matches the value against the full (case-insensitive) name or the first letter of an option. */
  private static <E extends Enum<E>> E parseOption(String name, String value, E[] options) {
    String v = value.trim().toUpperCase(Locale.ROOT);
    for (E option : options) {
      if (option.name().equals(v) || (v.length() == 1 && option.name().charAt(0) == v.charAt(0))) {
        return option;
      }
    }
    StringBuilder expected = new StringBuilder();
    for (E option : options) {
      String lower = option.name().toLowerCase(Locale.ROOT);
      if (expected.length() > 0) {
        expected.append(" or ");
      }
      expected.append('(').append(lower.charAt(0)).append(')').append(lower.substring(1));
    }
    throw new IllegalArgumentException("Unknown " + name + " '" + value + "'; expected " + expected);
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
    }
  }

  /** Creates the item extractor selected by {@link #getItemMode()}. */
  public ItemExtractor createItemExtractor() {
    switch (itemMode) {
    case TOKEN:
      return new TokenItemExtractor(itemSeparator);
    case CHARACTER:
    default:
      return new CharacterItemExtractor();
    }
  }

  //GETTER & SETTER METHODS

  /**
   * @return int minimum support
   */
  public int getSigma() {
    return sigma;
  }

  public void setSigma(int sigma) {
    this.sigma = sigma;
  }

  /**
   * @return int maximum itemset length
   */
  public int getLambda() {
    return lambda;
  }

  public void setLambda(int lambda) {
    this.lambda = lambda;
  }

  public Algorithm getAlgorithm() {
    return algorithm;
  }

  public void setAlgorithm(Algorithm algorithm) {
    this.algorithm = algorithm;
  }

  public String getInputPath() {
    return inputPath;
  }

  public void setInputPath(String inputPath) {
    this.inputPath = inputPath;
  }

  public ItemMode getItemMode() {
    return itemMode;
  }

  public void setItemMode(ItemMode itemMode) {
    this.itemMode = itemMode;
  }

  public String getItemSeparator() {
    return itemSeparator;
  }

  public void setItemSeparator(String itemSeparator) {
    this.itemSeparator = itemSeparator;
  }

  public SummaryType getType() {
    return type;
  }

  public void setType(SummaryType type) {
    this.type = type;
  }

  /**
   * @return String path of the output file, null for standard output
   */
  public String getOutputPath() {
    return outputPath;
  }

  public void setOutputPath(String outputPath) {
    this.outputPath = outputPath;
  }

  //END OF GETTER & SETTER METHODS

  @Override
  public String toString() {
    return "FimConfig[input=" + inputPath + ", itemMode=" + itemMode + ", sigma=" + sigma
        + ", lambda=" + (lambda == DfsMiner.UNBOUNDED ? "unbounded" : String.valueOf(lambda))
        + ", algorithm=" + algorithm + ", type=" + type
        + ", output=" + (outputPath == null ? "stdout" : outputPath) + "]";
  }
}
