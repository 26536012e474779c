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

package io.github.jbellis.jseries.util;

/**
 * Utility methods for mathematical operations.
 */
public class MathUtil {
    private static final double TWO_POW_63 = 0x1.0p63;

    /** Private constructor to prevent instantiation. */
    private MathUtil() {
    }

    /**
     * Squares the given double value.
     * While this may look silly at first, it really does make code more readable.
     *
     * @param a the value to square
     * @return the square of a
     */
    public static double square(double a) {
        return a * a;
    }

    /**
     * Converts a long holding an unsigned 64-bit quantity to the nearest double.
     *
     * @param bits the unsigned value
     * @return its value as a double, always non-negative
     */
    public static double unsignedToDouble(long bits) {
        double d = (double) (bits & Long.MAX_VALUE);
        if (bits < 0) {
            d += TWO_POW_63;
        }
        return d;
    }

    /**
     * Converts a double to an unsigned 64-bit quantity, truncating toward zero. Values of
     * 2^63 and above are carried into the sign bit.
     *
     * @param d the value to convert
     * @return the unsigned bits
     */
    public static long doubleToUnsigned(double d) {
        if (d < TWO_POW_63) {
            return (long) d;
        }
        return (long) (d - TWO_POW_63) ^ Long.MIN_VALUE;
    }
}
