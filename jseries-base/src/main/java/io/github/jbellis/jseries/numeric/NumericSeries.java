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

import io.github.jbellis.jseries.exceptions.ShapeMismatchException;
import io.github.jbellis.jseries.series.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BinaryOperator;

import static io.github.jbellis.jseries.util.MathUtil.square;

/**
 * A {@link Series} of numbers, adding elementwise arithmetic, reductions and statistics. All
 * arithmetic is carried out by the series' {@link NumericType}, so integer kinds wrap on overflow
 * and truncate on division exactly as their primitive counterparts do, and unsigned kinds behave
 * as unsigned throughout.
 * <p>
 * Statistics ({@link #mean}, {@link #stdDev}, {@link #coVariance}, {@link #correlation}) are
 * computed in double precision.
 * <p>
 * Elementwise operations name their result {@code <this>_<op>_<other>} unless a name is given,
 * where op is {@code add}, {@code sub}, {@code mul}, {@code div}, {@code mod}, or {@code op} for a
 * caller-supplied {@link #operation}.
 *
 * @param <T> the boxed value type
 * @param <R> the label type
 */
public class NumericSeries<T extends Number, R> extends Series<T, R> {
    private static final Logger logger = LoggerFactory.getLogger(NumericSeries.class);

    private final NumericType<T> type;

    private NumericSeries(NumericType<T> type, String name, ArrayList<T> values, ArrayList<R> index) {
        super(name, values, index);
        this.type = type;
    }

    /**
     * Creates a NumericSeries from copies of the given values and labels.
     *
     * @param type the numeric kind of the values
     * @param name the display name, may be empty
     * @param values the values, at least one and none null
     * @param index the labels, one per value
     * @return the new series
     * @throws IllegalArgumentException if values is null, empty or holds a null, or index is null
     * @throws ShapeMismatchException if the two sequences differ in length
     */
    public static <T extends Number, R> NumericSeries<T, R> create(NumericType<T> type, String name, List<T> values, List<R> index) {
        Objects.requireNonNull(type, "type");
        checkShape(values, index);
        checkNoNulls(values);
        return new NumericSeries<>(type, name, new ArrayList<>(values), new ArrayList<>(index));
    }

    /**
     * Creates a NumericSeries labeled 0..n-1.
     */
    public static <T extends Number> NumericSeries<T, Integer> withDefaultIndex(NumericType<T> type, String name, List<T> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("cannot create Series with no data");
        }
        return create(type, name, values, defaultIndex(values.size()));
    }

    public static NumericSeries<Double, Integer> ofDoubles(String name, double... values) {
        var boxed = new ArrayList<Double>(values.length);
        for (double v : values) {
            boxed.add(v);
        }
        return withDefaultIndex(NumericTypes.FLOAT64, name, boxed);
    }

    public static NumericSeries<Long, Integer> ofLongs(String name, long... values) {
        var boxed = new ArrayList<Long>(values.length);
        for (long v : values) {
            boxed.add(v);
        }
        return withDefaultIndex(NumericTypes.INT64, name, boxed);
    }

    public static NumericSeries<Integer, Integer> ofInts(String name, int... values) {
        var boxed = new ArrayList<Integer>(values.length);
        for (int v : values) {
            boxed.add(v);
        }
        return withDefaultIndex(NumericTypes.INT32, name, boxed);
    }

    /** @return the numeric kind of the values */
    public NumericType<T> type() {
        return type;
    }

    // structural transforms keep the numeric capabilities

    @Override
    protected NumericSeries<T, R> derive(String name, ArrayList<T> values, ArrayList<R> index) {
        return new NumericSeries<>(type, name, values, index);
    }

    @Override
    protected <S> NumericSeries<T, S> relabel(ArrayList<S> index) {
        return new NumericSeries<>(type, name(), new ArrayList<>(values), index);
    }

    @Override
    public NumericSeries<T, R> head(int n) {
        return (NumericSeries<T, R>) super.head(n);
    }

    @Override
    public NumericSeries<T, R> tail(int n) {
        return (NumericSeries<T, R>) super.tail(n);
    }

    @Override
    public NumericSeries<T, R> copy() {
        return (NumericSeries<T, R>) super.copy();
    }

    @Override
    public NumericSeries<T, Integer> resetIndex() {
        return (NumericSeries<T, Integer>) super.resetIndex();
    }

    @Override
    public <S> NumericSeries<T, S> withIndex(List<S> newIndex) {
        return (NumericSeries<T, S>) super.<S>withIndex(newIndex);
    }

    @Override
    public NumericSeries<T, R> sortByIndex(Comparator<? super R> comparator, boolean ascending) {
        return (NumericSeries<T, R>) super.sortByIndex(comparator, ascending);
    }

    @Override
    public NumericSeries<T, R> sortByValue(Comparator<? super T> comparator, boolean ascending) {
        return (NumericSeries<T, R>) super.sortByValue(comparator, ascending);
    }

    @Override
    protected Comparator<? super T> valueOrder(Comparator<? super T> natural) {
        return type.comparator();
    }

    /**
     * Appends the entries of another series in place. A NumericSeries must be of the same kind.
     *
     * @throws IllegalArgumentException if other holds a null value or is a NumericSeries of
     * another kind
     */
    @Override
    public void append(Series<? extends T, ? extends R> other) {
        checkAppendable(other);
        super.append(other);
    }

    /**
     * Inserts the entries of another series before this one's, in place.
     * @see #append
     */
    @Override
    public void prepend(Series<? extends T, ? extends R> other) {
        checkAppendable(other);
        super.prepend(other);
    }

    private void checkAppendable(Series<? extends T, ? extends R> other) {
        if (other instanceof NumericSeries && ((NumericSeries<?, ?>) other).type != type) {
            throw new IllegalArgumentException("cannot combine " + ((NumericSeries<?, ?>) other).type + " series with " + type + " series");
        }
        checkNoNulls(other.values());
    }

    /**
     * Sorts by value in the total order of this series' numeric kind. NaN sorts after every
     * other value.
     */
    public NumericSeries<T, R> sortByValue(boolean ascending) {
        return sortByValue(type.comparator(), ascending);
    }

    @Override
    protected String format(T value) {
        return type.format(value);
    }

    // reductions

    /**
     * @return the sum of the values, accumulated left to right from zero
     */
    public T sum() {
        T sum = type.zero();
        for (T v : values) {
            sum = type.add(sum, v);
        }
        return sum;
    }

    /**
     * @return the sum converted to double, divided by the length
     */
    public double mean() {
        return type.toDouble(sum()) / length();
    }

    /**
     * @return the smallest value; the first one if several are equal
     * @throws NoSuchElementException if the series holds no values
     */
    public T min() {
        return values.get(argMin());
    }

    /**
     * @return the largest value; the first one if several are equal
     * @throws NoSuchElementException if the series holds no values
     */
    public T max() {
        return values.get(maxPosition("max"));
    }

    /**
     * Computes the standard deviation, {@code sqrt(sum((x - mean)^2) / (n - dof))}.
     * dof is 0 for a population standard deviation and 1 for a sample standard deviation.
     * A dof equal to the length is not rejected and yields infinity or NaN.
     *
     * @param dof degrees of freedom
     * @throws IllegalArgumentException if dof is negative
     * @throws NoSuchElementException if the series holds no values
     */
    public double stdDev(int dof) {
        checkNotEmpty("standard deviation");
        checkDegreesOfFreedom(dof);

        double mean = mean();
        double sumSquaredDiff = 0;
        for (T v : values) {
            sumSquaredDiff += square(type.toDouble(v) - mean);
        }
        return Math.sqrt(sumSquaredDiff / (length() - dof));
    }

    /**
     * @return the label of the first largest value
     * @throws NoSuchElementException if the series holds no values
     */
    public R argMax() {
        return index.get(maxPosition("argmax"));
    }

    /**
     * Unlike {@link #argMax()}, which returns a label, this returns a position.
     *
     * @return the position of the first smallest value
     * @throws NoSuchElementException if the series holds no values
     */
    public int argMin() {
        checkNotEmpty("argmin");
        int minIndex = 0;
        T minValue = values.get(0);
        for (int i = 1; i < length(); i++) {
            if (type.lessThan(values.get(i), minValue)) {
                minValue = values.get(i);
                minIndex = i;
            }
        }
        return minIndex;
    }

    /**
     * @return the label of the first smallest value
     * @throws NoSuchElementException if the series holds no values
     */
    public R idxMin() {
        return index.get(argMin());
    }

    private int maxPosition(String operation) {
        checkNotEmpty(operation);
        int maxIndex = 0;
        T maxValue = values.get(0);
        for (int i = 1; i < length(); i++) {
            if (type.greaterThan(values.get(i), maxValue)) {
                maxValue = values.get(i);
                maxIndex = i;
            }
        }
        return maxIndex;
    }

    /**
     * @return a new series of running sums, named {@code <name>_cumsum}, with the same labels
     */
    public NumericSeries<T, R> cumSum() {
        var sums = new ArrayList<T>(length());
        T sum = type.zero();
        for (T v : values) {
            sum = type.add(sum, v);
            sums.add(sum);
        }
        return new NumericSeries<>(type, name() + "_cumsum", sums, new ArrayList<>(index));
    }

    /**
     * Returns a new series without the NaN values and their labels. Integer kinds never hold NaN
     * and come back unchanged.
     *
     * @throws IllegalStateException if every value is NaN
     */
    public NumericSeries<T, R> dropNa() {
        var validValues = new ArrayList<T>(length());
        var validIndex = new ArrayList<R>(length());
        for (int i = 0; i < length(); i++) {
            T v = values.get(i);
            if (!type.isNaN(v)) {
                validValues.add(v);
                validIndex.add(index.get(i));
            }
        }

        if (validValues.isEmpty()) {
            throw new IllegalStateException("cannot create series with no data after dropping NaN values");
        }
        if (validValues.size() < length()) {
            logger.debug("Dropped {} NaN values from series [{}]", length() - validValues.size(), name());
        }
        return new NumericSeries<>(type, name(), validValues, validIndex);
    }

    // elementwise operations

    /**
     * Applies fn position by position to this series and another of the same length. The result
     * carries this series' labels.
     *
     * @param other the right-hand operand
     * @param fn the operation, called as {@code fn.apply(this[i], other[i])}
     * @param name the result name; null or empty for {@code <this>_op_<other>}
     * @throws ShapeMismatchException if the lengths differ
     */
    public NumericSeries<T, R> operation(NumericSeries<T, ?> other, BinaryOperator<T> fn, String name) {
        return elementwise(other, fn, name, "op");
    }

    public NumericSeries<T, R> add(NumericSeries<T, ?> other, String name) {
        return elementwise(other, type::add, name, "add");
    }

    public NumericSeries<T, R> subtract(NumericSeries<T, ?> other, String name) {
        return elementwise(other, type::subtract, name, "sub");
    }

    public NumericSeries<T, R> multiply(NumericSeries<T, ?> other, String name) {
        return elementwise(other, type::multiply, name, "mul");
    }

    /**
     * Integer kinds truncate toward zero and throw {@link ArithmeticException} on a zero divisor.
     */
    public NumericSeries<T, R> divide(NumericSeries<T, ?> other, String name) {
        return elementwise(other, type::divide, name, "div");
    }

    /**
     * Integer remainder, with the sign rules of this series' kind.
     *
     * @throws UnsupportedOperationException if this series holds floating-point values
     */
    public NumericSeries<T, R> mod(NumericSeries<T, ?> other, String name) {
        if (!type.isIntegral()) {
            throw new UnsupportedOperationException("modulus is only defined for integer series, not " + type);
        }
        return elementwise(other, type::remainder, name, "mod");
    }

    /**
     * Raises each value to the given power in double precision and converts back, so integer
     * kinds truncate toward zero.
     *
     * @param name the result name; null or empty for {@code <this>_pow_<power>}
     */
    public NumericSeries<T, R> pow(double power, String name) {
        var result = new ArrayList<T>(length());
        for (T v : values) {
            result.add(type.fromDouble(Math.pow(type.toDouble(v), power)));
        }
        return new NumericSeries<>(type, isEmpty(name) ? name() + "_pow_" + power : name, result, new ArrayList<>(index));
    }

    /**
     * @return a new series of absolute values, with the same name and labels
     */
    public NumericSeries<T, R> abs() {
        var result = new ArrayList<T>(length());
        for (T v : values) {
            result.add(type.abs(v));
        }
        return new NumericSeries<>(type, name(), result, new ArrayList<>(index));
    }

    private NumericSeries<T, R> elementwise(NumericSeries<T, ?> other, BinaryOperator<T> fn, String name, String operation) {
        checkSameLength(other);
        var result = new ArrayList<T>(length());
        for (int i = 0; i < length(); i++) {
            result.add(fn.apply(values.get(i), other.values.get(i)));
        }
        String resultName = isEmpty(name) ? name() + "_" + operation + "_" + other.name() : name;
        return new NumericSeries<>(type, resultName, result, new ArrayList<>(index));
    }

    // bivariate statistics

    /**
     * Computes {@code sum((x - mean(x)) * (y - mean(y))) / (n - dof)}. The other series may hold
     * any numeric kind.
     *
     * @param dof degrees of freedom, 0 for population and 1 for sample covariance
     * @throws ShapeMismatchException if the lengths differ
     * @throws IllegalArgumentException if dof is negative
     */
    public double coVariance(NumericSeries<?, ?> other, int dof) {
        checkSameLength(other);
        checkDegreesOfFreedom(dof);

        double meanX = mean();
        double meanY = other.mean();
        double[] y = other.toDoubles();
        double sum = 0;
        for (int i = 0; i < length(); i++) {
            sum += (type.toDouble(values.get(i)) - meanX) * (y[i] - meanY);
        }
        return sum / (length() - dof);
    }

    /**
     * Pearson correlation, from population statistics. Returns exactly 0 when either series is
     * constant, where the coefficient is undefined.
     *
     * @throws ShapeMismatchException if the lengths differ
     */
    public double correlation(NumericSeries<?, ?> other) {
        checkSameLength(other);
        double stdProduct = stdDev(0) * other.stdDev(0);
        if (stdProduct == 0) {
            logger.debug("Correlation of [{}] and [{}] is undefined for a constant series, returning 0", name(), other.name());
            return 0.0;
        }
        return coVariance(other, 0) / stdProduct;
    }

    private double[] toDoubles() {
        double[] result = new double[length()];
        for (int i = 0; i < result.length; i++) {
            result[i] = type.toDouble(values.get(i));
        }
        return result;
    }

    private void checkSameLength(NumericSeries<?, ?> other) {
        if (length() != other.length()) {
            throw new ShapeMismatchException("series must be of the same length", length(), other.length());
        }
    }

    private static void checkNoNulls(List<?> values) {
        // List.contains(null) throws on immutable lists
        for (Object v : values) {
            if (v == null) {
                throw new IllegalArgumentException("numeric series cannot hold null values");
            }
        }
    }

    private void checkNotEmpty(String operation) {
        if (values.isEmpty()) {
            throw new NoSuchElementException("cannot get " + operation + " of empty series");
        }
    }

    private static void checkDegreesOfFreedom(int dof) {
        if (dof < 0) {
            throw new IllegalArgumentException("degrees of freedom must be non-negative, got " + dof);
        }
    }

    private static boolean isEmpty(String name) {
        return name == null || name.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && type == ((NumericSeries<?, ?>) o).type;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + type.hashCode();
    }
}
