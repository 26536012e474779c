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
 * Provides custom exception types used throughout JSeries.
 * <p>
 * Every failure in JSeries is a precondition violation by the calling code, reported with an
 * unchecked exception at the point of detection and never recovered inside the library. Where a
 * standard type describes the failure exactly it is used directly ({@link IllegalArgumentException},
 * {@link IndexOutOfBoundsException}, {@link UnsupportedOperationException},
 * {@link IllegalStateException}); the types in this package refine the standard ones so that
 * callers can catch the specific condition.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.jbellis.jseries.exceptions.LabelNotFoundException} - a
 *       {@link java.util.NoSuchElementException} raised when a label lookup finds no match.</li>
 *   <li>{@link io.github.jbellis.jseries.exceptions.ShapeMismatchException} - an
 *       {@link IllegalArgumentException} raised when two sequences that must be the same length
 *       are not.</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     double price = prices.get("ACME");
 * } catch (LabelNotFoundException e) {
 *     logger.warn("No price for {}", e.getLabel());
 * }
 * }</pre>
 */
package io.github.jbellis.jseries.exceptions;
