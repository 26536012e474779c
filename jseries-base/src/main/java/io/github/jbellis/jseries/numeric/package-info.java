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
 * Numeric series: arithmetic, reductions and statistics over a
 * {@link io.github.jbellis.jseries.series.Series} of numbers.
 * <p>
 * Each {@link io.github.jbellis.jseries.numeric.NumericSeries} carries a
 * {@link io.github.jbellis.jseries.numeric.NumericType} chosen from
 * {@link io.github.jbellis.jseries.numeric.NumericTypes}: signed and unsigned integers of 8, 16,
 * 32 and 64 bits, and 32 and 64 bit floating point. The type decides overflow, division,
 * remainder and NaN behavior, so an {@code INT8} series wraps at 127 and a {@code FLOAT64}
 * series rejects {@code mod}.
 * <p>
 * <b>Usage Example:</b>
 * <pre>{@code
 * NumericSeries<Double, Integer> x = NumericSeries.ofDoubles("x", 1, 2, 3, 4, 5);
 * NumericSeries<Double, Integer> y = NumericSeries.ofDoubles("y", 5, 4, 3, 2, 1);
 * double r = x.correlation(y);                      // -1.0
 * NumericSeries<Double, Integer> total = x.add(y, ""); // named "x_add_y"
 * }</pre>
 */
package io.github.jbellis.jseries.numeric;
