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

/**
 * Provides the labeled one-dimensional container at the heart of JSeries.
 * <p>
 * A {@link io.github.jbellis.jseries.series.Series} pairs an ordered sequence of values with an
 * ordered sequence of labels of the same length, and is never empty. Labels are looked up by
 * equality and need not be unique.
 * <p>
 * <b>Key Operations:</b>
 * <ul>
 *   <li><b>Construction</b> - {@code create(name, values, index)} with explicit labels, or
 *       {@code withDefaultIndex(name, values)} to label by position.</li>
 *   <li><b>Lookup</b> - {@code get(label)} by label, {@code at(i)} and {@code entryAt(i)} by
 *       position.</li>
 *   <li><b>Reshaping</b> - {@code head}, {@code tail}, {@code resetIndex}, {@code withIndex} and
 *       {@code copy} return new series; {@code append} and {@code prepend} grow the receiver.</li>
 *   <li><b>Ordering</b> - stable sorts by label or by value, in either direction.</li>
 * </ul>
 * <p>
 * <b>Usage Example:</b>
 * <pre>{@code
 * Series<Integer, String> ages = Series.create("Age", List.of(25, 30, 35), List.of("Alice", "Bob", "Charlie"));
 * int bob = ages.get("Bob");                        // 30
 * Series<Integer, String> youngest = Series.sortByValue(ages, true).head(2);
 * System.out.print(ages);
 * // Age
 * // Alice: 25
 * // Bob: 30
 * // Charlie: 35
 * }</pre>
 * <p>
 * {@code toString} renders at most ten entries; the limit can be changed with the
 * {@code jseries.display.max_rows} system property.
 *
 * @see io.github.jbellis.jseries.numeric.NumericSeries
 */
package io.github.jbellis.jseries.series;
