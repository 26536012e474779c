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

package io.github.jbellis.jseries.exceptions;

/**
 * Thrown when two sequences that must line up position by position differ in length: the values
 * and labels of a new Series, the operands of an elementwise operation, or a replacement index.
 */
public class ShapeMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int actual;

    /**
     * @param message what was being lined up
     * @param expected the required length
     * @param actual the length supplied
     */
    public ShapeMismatchException(String message, int expected, int actual) {
        super(message + ": " + expected + "!=" + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
