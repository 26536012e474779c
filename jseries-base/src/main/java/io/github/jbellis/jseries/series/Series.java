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

package io.github.jbellis.jseries.series;

import io.github.jbellis.jseries.exceptions.LabelNotFoundException;
import io.github.jbellis.jseries.exceptions.ShapeMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of values paired positionally with an ordered sequence of labels, much like
 * a single column of a table. The label at position i names the value at position i.
 * <p>
 * A Series always holds at least one entry. Labels do not have to be unique; lookups by label
 * resolve to the first matching position.
 * <p>
 * {@link #append}, {@link #prepend} and {@link #setName} modify the receiver. Every other
 * transform returns a new Series that shares no storage with this one, and {@link #values()} and
 * {@link #index()} return copies.
 * <p>
 * Not thread-safe.
 *
 * @param <T> the value type
 * @param <R> the label type, compared with {@link Objects#equals}
 */
public class Series<T, R> {
    /** Maximum number of entries rendered by {@link #toString()}; negative settings count as 0. */
    static final int DISPLAY_ROWS = Math.max(0, Integer.getInteger("jseries.display.max_rows", 10));

    private String name;
    protected final ArrayList<T> values;
    protected final ArrayList<R> index;

    /**
     * Takes ownership of the given lists; callers must not retain them.
     */
    protected Series(String name, ArrayList<T> values, ArrayList<R> index) {
        this.name = name == null ? "" : name;
        this.values = values;
        this.index = index;
    }

    /**
     * Creates a Series from copies of the given values and labels.
     *
     * @param name the display name, may be empty
     * @param values the values, at least one
     * @param index the labels, one per value
     * @return the new Series
     * @throws IllegalArgumentException if values is null or empty, or index is null
     * @throws ShapeMismatchException if the two sequences differ in length
     */
    public static <T, R> Series<T, R> create(String name, List<T> values, List<R> index) {
        checkShape(values, index);
        return new Series<>(name, new ArrayList<>(values), new ArrayList<>(index));
    }

    /**
     * Creates a Series labeled 0..n-1.
     */
    public static <T> Series<T, Integer> withDefaultIndex(String name, List<T> values) {
        checkValues(values);
        return create(name, values, defaultIndex(values.size()));
    }

    protected static void checkShape(List<?> values, List<?> index) {
        checkValues(values);
        if (index == null) {
            throw new IllegalArgumentException("an index is required; use withDefaultIndex to label by position");
        }
        if (index.size() != values.size()) {
            throw new ShapeMismatchException("index length must match values length", values.size(), index.size());
        }
    }

    private static void checkValues(List<?> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("cannot create Series with no data");
        }
    }

    protected static ArrayList<Integer> defaultIndex(int n) {
        var labels = new ArrayList<Integer>(n);
        for (int i = 0; i < n; i++) {
            labels.add(i);
        }
        return labels;
    }

    /**
     * Builds a Series of this Series' own kind around freshly allocated storage. Subclasses
     * override this so that structural transforms keep their capabilities.
     */
    protected Series<T, R> derive(String name, ArrayList<T> values, ArrayList<R> index) {
        return new Series<>(name, values, index);
    }

    /**
     * As {@link #derive}, for transforms that replace the label type.
     */
    protected <S> Series<T, S> relabel(ArrayList<S> index) {
        return new Series<>(name, new ArrayList<>(values), index);
    }

    /** @return the number of entries */
    public int length() {
        return values.size();
    }

    /** @return the display name, possibly empty */
    public String name() {
        return name;
    }

    /**
     * Renames this Series in place.
     * @param name the new name; null is stored as the empty string
     */
    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    /**
     * @return a copy of the values, in order
     */
    public List<T> values() {
        return new ArrayList<>(values);
    }

    /**
     * @return a copy of the labels, in order
     */
    public List<R> index() {
        return new ArrayList<>(index);
    }

    /**
     * Returns the value of the first entry whose label equals the given one.
     *
     * @param label the label to look up
     * @return the value paired with the first matching label
     * @throws LabelNotFoundException if no label matches
     */
    public T get(R label) {
        for (int i = 0; i < index.size(); i++) {
            if (Objects.equals(index.get(i), label)) {
                return values.get(i);
            }
        }
        throw new LabelNotFoundException(label);
    }

    /**
     * @param i a position, 0-based
     * @return the value at that position
     * @throws IndexOutOfBoundsException if i is negative or not less than {@link #length()}
     */
    public T at(int i) {
        checkPosition(i);
        return values.get(i);
    }

    /**
     * @param i a position, 0-based
     * @return the label and value at that position
     * @throws IndexOutOfBoundsException if i is negative or not less than {@link #length()}
     */
    public Entry<R, T> entryAt(int i) {
        checkPosition(i);
        return new Entry<>(index.get(i), values.get(i));
    }

    private void checkPosition(int i) {
        if (i < 0 || i >= length()) {
            throw new IndexOutOfBoundsException("index " + i + " out of bounds for length " + length());
        }
    }

    /**
     * @return true if some value equals the given one
     */
    public boolean contains(T value) {
        return values.contains(value);
    }

    /**
     * Returns the first n entries. n larger than the length is clamped.
     *
     * @throws IllegalArgumentException if n is not positive
     */
    public Series<T, R> head(int n) {
        checkCount(n);
        int count = Math.min(n, length());
        return derive(name, new ArrayList<>(values.subList(0, count)), new ArrayList<>(index.subList(0, count)));
    }

    /**
     * Returns the last n entries. n larger than the length is clamped.
     *
     * @throws IllegalArgumentException if n is not positive
     */
    public Series<T, R> tail(int n) {
        checkCount(n);
        int start = length() - Math.min(n, length());
        return derive(name, new ArrayList<>(values.subList(start, length())), new ArrayList<>(index.subList(start, length())));
    }

    private static void checkCount(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("entry count must be positive, got " + n);
        }
    }

    /**
     * Appends the entries of another Series to the end of this one, in place.
     */
    public void append(Series<? extends T, ? extends R> other) {
        // copy first so that appending a Series to itself is well defined
        var otherValues = new ArrayList<T>(other.values);
        var otherIndex = new ArrayList<R>(other.index);
        values.addAll(otherValues);
        index.addAll(otherIndex);
    }

    /**
     * Inserts the entries of another Series before the entries of this one, in place.
     */
    public void prepend(Series<? extends T, ? extends R> other) {
        var otherValues = new ArrayList<T>(other.values);
        var otherIndex = new ArrayList<R>(other.index);
        values.addAll(0, otherValues);
        index.addAll(0, otherIndex);
    }

    /**
     * @return a new Series with the same name and values, labeled 0..n-1
     */
    public Series<T, Integer> resetIndex() {
        return relabel(defaultIndex(length()));
    }

    /**
     * Returns a new Series with the same name and values and the given labels.
     *
     * @param newIndex the labels, one per value
     * @throws ShapeMismatchException if newIndex differs in length from this Series
     */
    public <S> Series<T, S> withIndex(List<S> newIndex) {
        checkShape(values, newIndex);
        return relabel(new ArrayList<>(newIndex));
    }

    /**
     * @return an independent copy of this Series
     */
    public Series<T, R> copy() {
        return derive(name, new ArrayList<>(values), new ArrayList<>(index));
    }

    /**
     * Returns a new Series with entries reordered by label. The sort is stable in both directions,
     * and each label keeps its value.
     */
    public Series<T, R> sortByIndex(Comparator<? super R> comparator, boolean ascending) {
        return reorder((a, b) -> comparator.compare(index.get(a), index.get(b)), ascending);
    }

    /**
     * Returns a new Series with entries reordered by value. The sort is stable in both directions,
     * and each value keeps its label.
     */
    public Series<T, R> sortByValue(Comparator<? super T> comparator, boolean ascending) {
        return reorder((a, b) -> comparator.compare(values.get(a), values.get(b)), ascending);
    }

    /**
     * Sorts by the natural order of the labels.
     * @see #sortByIndex(Comparator, boolean)
     */
    public static <T, R extends Comparable<? super R>> Series<T, R> sortByIndex(Series<T, R> series, boolean ascending) {
        return series.sortByIndex(Comparator.naturalOrder(), ascending);
    }

    /**
     * Sorts by the natural order of the values, or by the order the Series defines for its own
     * values if it overrides {@link #valueOrder}.
     * @see #sortByValue(Comparator, boolean)
     */
    public static <T extends Comparable<? super T>, R> Series<T, R> sortByValue(Series<T, R> series, boolean ascending) {
        return series.sortByValue(series.valueOrder(Comparator.naturalOrder()), ascending);
    }

    /**
     * The order used to sort values when no comparator is given.
     *
     * @param natural the natural order of the values
     */
    protected Comparator<? super T> valueOrder(Comparator<? super T> natural) {
        return natural;
    }

    private Series<T, R> reorder(Comparator<Integer> byPosition, boolean ascending) {
        var order = new Integer[length()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        // Arrays.sort on objects is stable; reversing the comparator keeps ties in input order
        Arrays.sort(order, ascending ? byPosition : byPosition.reversed());

        var sortedValues = new ArrayList<T>(order.length);
        var sortedIndex = new ArrayList<R>(order.length);
        for (int position : order) {
            sortedValues.add(values.get(position));
            sortedIndex.add(index.get(position));
        }
        return derive(name, sortedValues, sortedIndex);
    }

    /**
     * Renders a value for {@link #toString()}.
     */
    protected String format(T value) {
        return String.valueOf(value);
    }

    /**
     * Renders the name on its own line, if any, then up to ten {@code label: value} lines (see
     * {@code jseries.display.max_rows}), then
     * {@code ... (k more)} if entries were left out.
     */
    @Override
    public String toString() {
        return render(DISPLAY_ROWS);
    }

    String render(int maxRows) {
        var sb = new StringBuilder();
        if (!name.isEmpty()) {
            sb.append(name).append('\n');
        }

        int rows = Math.min(length(), Math.max(0, maxRows));
        for (int i = 0; i < rows; i++) {
            sb.append(index.get(i)).append(": ").append(format(values.get(i))).append('\n');
        }

        if (length() > rows) {
            sb.append("... (").append(length() - rows).append(" more)\n");
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Series<?, ?> that = (Series<?, ?>) o;
        return name.equals(that.name) && values.equals(that.values) && index.equals(that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, values, index);
    }

    /**
     * A label paired with its value.
     */
    public static final class Entry<R, T> {
        /** The label */
        public final R label;
        /** The value */
        public final T value;

        public Entry(R label, T value) {
            this.label = label;
            this.value = value;
        }

        @Override
        public String toString() {
            return String.format("Entry(%s, %s)", label, value);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            Entry<?, ?> entry = (Entry<?, ?>) o;
            return Objects.equals(label, entry.label) && Objects.equals(value, entry.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(label, value);
        }
    }
}
