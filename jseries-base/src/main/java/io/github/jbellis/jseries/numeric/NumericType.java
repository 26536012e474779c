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

package io.github.jbellis.jseries.numeric;

import java.util.Comparator;

/**
 * Arithmetic, comparison and conversion for one numeric kind: a signed or unsigned integer of a
 * given width, or a floating-point number of a given width. A {@link NumericSeries} delegates
 * every operation on its values to its NumericType, so each kind applies its own overflow,
 * division, remainder and NaN rules.
 * <p>
 * The set of kinds is closed: the constructor is package-private and the only instances are the
 * constants of {@link NumericTypes}. Unsigned kinds share the Java box of the same width
 * ({@code Byte}, {@code Short}, {@code Integer}, {@code Long}) and read its bits as unsigned.
 *
 * @param <T> the boxed Java type holding values of this kind
 */
public abstract class NumericType<T extends Number> {
    private final String name;
    private final boolean integral;

    NumericType(String name, boolean integral) {
        this.name = name;
        this.integral = integral;
    }

    /** @return the additive identity */
    public abstract T zero();

    public abstract T add(T a, T b);

    public abstract T subtract(T a, T b);

    public abstract T multiply(T a, T b);

    /**
     * Divides a by b. Integer kinds truncate toward zero and throw {@link ArithmeticException}
     * when b is zero; floating kinds follow IEEE 754.
     */
    public abstract T divide(T a, T b);

    /**
     * Computes the integer remainder of a divided by b, with the sign rules of this kind.
     *
     * @throws UnsupportedOperationException if this is a floating kind
     */
    public abstract T remainder(T a, T b);

    /** @return the additive inverse of a, wrapping for integer kinds */
    public abstract T negate(T a);

    /**
     * The primitive {@code <} of this kind: unsigned for unsigned kinds, and false whenever either
     * operand is NaN.
     */
    public abstract boolean lessThan(T a, T b);

    /**
     * The primitive {@code >} of this kind.
     * @see #lessThan
     */
    public boolean greaterThan(T a, T b) {
        return lessThan(b, a);
    }

    /**
     * A total order over the values of this kind, for sorting. Floating kinds order as
     * {@link Double#compare} does, with NaN after positive infinity.
     */
    public abstract int compare(T a, T b);

    /** @return a converted to double; unsigned kinds convert as unsigned */
    public abstract double toDouble(T a);

    /**
     * Converts a double to this kind. Integer kinds truncate toward zero.
     */
    public abstract T fromDouble(double d);

    /** @return true if a is a floating-point NaN; always false for integer kinds */
    public boolean isNaN(T a) {
        return false;
    }

    /**
     * Returns the absolute value of a by comparing it with zero and negating, without going
     * through a floating-point routine.
     */
    public T abs(T a) {
        return lessThan(a, zero()) ? negate(a) : a;
    }

    /** @return a as text; unsigned kinds print unsigned */
    public String format(T a) {
        return String.valueOf(a);
    }

    /** @return {@link #compare} as a Comparator */
    public Comparator<T> comparator() {
        return this::compare;
    }

    /** @return true for integer kinds, false for floating-point kinds */
    public boolean isIntegral() {
        return integral;
    }

    /** @return the short name of this kind, such as {@code int32} or {@code float64} */
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
