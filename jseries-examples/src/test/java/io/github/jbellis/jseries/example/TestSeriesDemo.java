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

import org.junit.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class TestSeriesDemo {

  private static int execute(StringWriter out, StringWriter err, String... args) {
    var commandLine = new CommandLine(new SeriesDemo());
    commandLine.setOut(new PrintWriter(out));
    commandLine.setErr(new PrintWriter(err));
    return commandLine.execute(args);
  }

  @Test
  public void testDefaultRun() {
    var out = new StringWriter();
    int exitCode = execute(out, new StringWriter());
    assertEquals(0, exitCode);

    String text = out.toString().replace(System.lineSeparator(), "\n");
    assertTrue(text, text.contains("Series:\nAge\nAlice: 25\nBob: 30\nCharlie: 35\n"));
    assertTrue(text, text.contains("Head:\nAge\nAlice: 25\nBob: 30\n\n"));
    assertTrue(text, text.endsWith("Tail:\nAge\nBob: 30\nCharlie: 35\n"));
    assertFalse(text.contains("Stats:"));
  }

  @Test
  public void testRowsOption() {
    var out = new StringWriter();
    assertEquals(0, execute(out, new StringWriter(), "--rows", "1"));
    String text = out.toString().replace(System.lineSeparator(), "\n");
    assertTrue(text, text.contains("Head:\nAge\nAlice: 25\n\n"));
    assertTrue(text, text.endsWith("Tail:\nAge\nCharlie: 35\n"));
  }

  @Test
  public void testStats() {
    var out = new StringWriter();
    assertEquals(0, execute(out, new StringWriter(), "--stats"));
    String text = out.toString().replace(System.lineSeparator(), "\n");
    assertTrue(text, text.contains("sum: 90\n"));
    assertTrue(text, text.contains("mean: 30.00\n"));
    assertTrue(text, text.contains("min: 25 (Alice)\n"));
    assertTrue(text, text.contains("max: 35 (Charlie)\n"));
    assertTrue(text, text.contains("stddev: 5.0000\n"));
    assertTrue(text, text.contains("oldest first: [Charlie, Bob, Alice]\n"));
  }

  @Test
  public void testNonPositiveRowsRejected() {
    var err = new StringWriter();
    int exitCode = execute(new StringWriter(), err, "-n", "0");
    assertNotEquals(0, exitCode);
    assertTrue(err.toString(), err.toString().contains("--rows must be positive"));
  }
}
