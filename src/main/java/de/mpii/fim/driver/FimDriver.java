/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package de.mpii.fim.driver;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import de.mpii.fim.output.TextItemsetWriter;

/**
 * Entry point for mining frequent itemsets from a CSV file.
 *
 * All parameters are taken from environment variables:
 *
 *   1. DATA_FILE      (Optional) Path of the input CSV file; one transaction per row,
 *                     items in the column "items".
 *                     Default Value: data/test.csv
 *
 *   2. MIN_SUPPORT    (Optional) Minimum number of transactions an itemset must occur in.
 *                     Default Value: 1
 *
 *   3. MAX_LENGTH     (Optional) Maximum number of items of a reported itemset.
 *                     Default Value: unbounded
 *
 *   4. OUTPUT_TYPE    (Optional) (a)ll, (m)aximal or (c)losed.
 *                     Default Value: (a)ll
 *
 *   5. ALGORITHM      (Optional) (d)fs or (b)fs.
 *                     Default Value: (d)fs
 *
 *   6. ITEM_MODE      (Optional) (c)haracter: every character of "items" is an item,
 *                     (t)oken: items are separated by ITEM_SEPARATOR (default: whitespace).
 *                     Default Value: (c)haracter
 *
 *   7. OUTPUT_FILE    (Optional) Where to write the itemsets.
 *                     Default Value: standard output
 *
 * The exit status is 0 on success and 1 if the configuration or the input is invalid.
 */
public final class FimDriver {

  private static final Log LOG = LogFactory.getLog(FimDriver.class);

  private FimDriver() {
  }

  /**
   * Configures, runs and writes a mining job.
   *
   * @param env environment variables
   * @param stdout where to write when no output file is configured; flushed, not closed
   * @return exit status
   */
  public static int run(Map<String, String> env, Writer stdout) {
    FimConfig config;
    try {
      config = FimConfig.fromEnvironment(env);
    } catch (IllegalArgumentException e) {
      LOG.error("Invalid configuration: " + e.getMessage());
      return 1;
    }

    try {
      SequentialMode miner = new SequentialMode(config);
      SequentialMode.Result result = miner.run();

      if (config.getOutputPath() == null) {
        TextItemsetWriter writer = new TextItemsetWriter(stdout,
            result.getDatabase().getDictionary());
        miner.write(result, writer);
        writer.flush();
      } else {
        Writer out = Files.newBufferedWriter(Paths.get(config.getOutputPath()),
            StandardCharsets.UTF_8);
        try {
          miner.write(result, new TextItemsetWriter(out, result.getDatabase().getDictionary()));
        } finally {
          out.close();
        }
        LOG.info("Itemsets written to " + config.getOutputPath());
      }
    } catch (IOException e) {
      LOG.error("Mining failed: " + e.getMessage(), e);
      return 1;
    }
    return 0;
  }

  public static void main(String[] args) {
    Writer stdout = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
    System.exit(run(System.getenv(), stdout));
  }
}
