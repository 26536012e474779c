/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.jseries.example;

import io.github.jbellis.jseries.numeric.NumericSeries;
import io.github.jbellis.jseries.numeric.NumericTypes;
import io.github.jbellis.jseries.series.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Builds a small series of ages labeled by person and prints it, its head and its tail.
 */
@CommandLine.Command(name = "series-demo", mixinStandardHelpOptions = true,
    description = "Print a labeled series of ages with its head and tail")
public class SeriesDemo implements Callable<Integer> {
  private static final Logger logger = LoggerFactory.getLogger(SeriesDemo.class);

  @CommandLine.Spec
  CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(names = {"-n", "--rows"},
      description = "Number of entries in the head and tail (default: ${DEFAULT-VALUE})",
      defaultValue = "2")
  private int rows = 2;

  @CommandLine.Option(names = {"--stats"}, description = "Also print summary statistics")
  private boolean stats;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new SeriesDemo()).execute(args);
    System.exit(exitCode);
  }

  static NumericSeries<Integer, String> ages() {
    return NumericSeries.create(NumericTypes.INT32, "Age", List.of(25, 30, 35), List.of("Alice", "Bob", "Charlie"));
  }

  @Override
  public Integer call() {
    if (rows <= 0) {
      throw new CommandLine.ParameterException(spec.commandLine(), "--rows must be positive, got " + rows);
    }

    PrintWriter out = spec.commandLine().getOut();
    var series = ages();
    logger.debug("Built series [{}] with {} entries", series.name(), series.length());

    out.println("Series:");
    out.print(series);
    out.println();
    out.println("Head:");
    out.print(series.head(rows));
    out.println();
    out.println("Tail:");
    out.print(series.tail(rows));

    if (stats) {
      out.println();
      out.println("Stats:");
      out.printf(Locale.ROOT, "sum: %d%n", series.sum());
      out.printf(Locale.ROOT, "mean: %.2f%n", series.mean());
      out.printf(Locale.ROOT, "min: %d (%s)%n", series.min(), series.idxMin());
      out.printf(Locale.ROOT, "max: %d (%s)%n", series.max(), series.argMax());
      out.printf(Locale.ROOT, "stddev: %.4f%n", series.stdDev(1));
      Series<Integer, String> sorted = series.sortByValue(false);
      out.println("oldest first: " + sorted.index());
    }
    out.flush();
    return 0;
  }
}
