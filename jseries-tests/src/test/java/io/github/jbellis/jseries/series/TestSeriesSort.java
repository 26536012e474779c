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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.jbellis.jseries.TestUtil;
import org.junit.Test;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestSeriesSort extends RandomizedTest {

    private static Series<Integer, String> unsorted() {
        return Series.create("scores", List.of(30, 10, 20), List.of("c", "a", "b"));
    }

    @Test
    public void testSortByIndex() {
        var sorted = Series.sortByIndex(unsorted(), true);
        assertEquals(List.of("a", "b", "c"), sorted.index());
        assertEquals(List.of(10, 20, 30), sorted.values());
        assertEquals("scores", sorted.name());

        var descending = Series.sortByIndex(unsorted(), false);
        assertEquals(List.of("c", "b", "a"), descending.index());
        assertEquals(List.of(30, 20, 10), descending.values());
    }

    @Test
    public void testSortByValue() {
        var sorted = Series.sortByValue(unsorted(), true);
        assertEquals(List.of(10, 20, 30), sorted.values());
        assertEquals(List.of("a", "b", "c"), sorted.index());

        var descending = Series.sortByValue(unsorted(), false);
        assertEquals(List.of(30, 20, 10), descending.values());
        assertEquals(List.of("c", "b", "a"), descending.index());
    }

    @Test
    public void testSortLeavesSourceUnmodified() {
        var source = unsorted();
        Series.sortByValue(source, true);
        Series.sortByIndex(source, false);
        assertEquals(unsorted(), source);
    }

    @Test
    public void testSortIsStableInBothDirections() {
        var series = Series.create("ties", List.of(2, 1, 2, 1, 2), List.of("p", "q", "r", "s", "t"));

        var ascending = Series.sortByValue(series, true);
        assertEquals(List.of(1, 1, 2, 2, 2), ascending.values());
        assertEquals(List.of("q", "s", "p", "r", "t"), ascending.index());

        var descending = Series.sortByValue(series, false);
        assertEquals(List.of(2, 2, 2, 1, 1), descending.values());
        assertEquals(List.of("p", "r", "t", "q", "s"), descending.index());

        var byLabel = Series.sortByIndex(Series.create("dups", List.of(1, 2, 3), List.of("b", "a", "b")), false);
        assertEquals(List.of("b", "b", "a"), byLabel.index());
        assertEquals(List.of(1, 3, 2), byLabel.values());
    }

    @Test
    public void testSortWithComparator() {
        var series = Series.create("words", List.of("pear", "fig", "banana"), List.of(1, 2, 3));
        var byLength = series.sortByValue(Comparator.comparingInt(String::length), true);
        assertEquals(List.of("fig", "pear", "banana"), byLength.values());
        assertEquals(List.of(2, 1, 3), byLength.index());

        var byLabelReversed = series.sortByIndex(Comparator.reverseOrder(), true);
        assertEquals(List.of(3, 2, 1), byLabelReversed.index());
    }

    @Test
    public void testRandomSortsAreOrderedAndKeepPairs() {
        for (int trial = 0; trial < 100; trial++) {
            var series = TestUtil.randomSeries(getRandom(), randomIntBetween(1, 40));
            boolean ascending = randomBoolean();

            var byValue = Series.sortByValue(series, ascending);
            assertOrdered(byValue.values(), ascending);
            assertSamePairs(series, byValue);

            var byLabel = Series.sortByIndex(series, ascending);
            assertOrdered(byLabel.index(), ascending);
            assertSamePairs(series, byLabel);
        }
    }

    private static <E extends Comparable<E>> void assertOrdered(List<E> items, boolean ascending) {
        for (int i = 1; i < items.size(); i++) {
            int cmp = items.get(i - 1).compareTo(items.get(i));
            assertTrue(items + " is not sorted", ascending ? cmp <= 0 : cmp >= 0);
        }
    }

    /**
     * Labels repeat, so compare the multiset of (label, value) pairs.
     */
    private static void assertSamePairs(Series<Integer, String> expected, Series<Integer, String> actual) {
        assertEquals(expected.length(), actual.length());
        Map<Series.Entry<String, Integer>, Integer> counts = new HashMap<>();
        for (int i = 0; i < expected.length(); i++) {
            counts.merge(expected.entryAt(i), 1, Integer::sum);
        }
        for (int i = 0; i < actual.length(); i++) {
            counts.merge(actual.entryAt(i), -1, Integer::sum);
        }
        for (int count : counts.values()) {
            assertEquals(0, count);
        }
    }
}
