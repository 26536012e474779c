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

import io.github.jbellis.jseries.series.Series;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TestNumericTypes {

    @Test
    public void testAllKinds() {
        assertEquals(10, NumericTypes.all().size());
        long integral = NumericTypes.all().stream().filter(NumericType::isIntegral).count();
        assertEquals(8, integral);
        assertEquals("uint16", NumericTypes.UINT16.name());
        assertEquals("float32", NumericTypes.FLOAT32.toString());
    }

    @Test
    public void testSignedOverflowWraps() {
        var bytes = NumericSeries.withDefaultIndex(NumericTypes.INT8, "b", List.of((byte) 100, (byte) 100));
        assertEquals(Byte.valueOf((byte) -56), bytes.sum());
        assertEquals(-28.0, bytes.mean(), 0);

        var shorts = NumericSeries.withDefaultIndex(NumericTypes.INT16, "s", List.of(Short.MAX_VALUE, (short) 1));
        assertEquals(Short.valueOf(Short.MIN_VALUE), shorts.sum());

        var ints = NumericSeries.ofInts("i", Integer.MAX_VALUE, 1);
        assertEquals(Integer.valueOf(Integer.MIN_VALUE), ints.sum());
    }

    @Test
    public void testUnsignedComparison() {
        // (byte) 200 is negative as a signed byte
        var series = NumericSeries.withDefaultIndex(NumericTypes.UINT8, "u", List.of((byte) 100, (byte) 200, (byte) 50));
        assertEquals(Byte.valueOf((byte) 200), series.max());
        assertEquals(Integer.valueOf(1), series.argMax());
        assertEquals(2, series.argMin());
        // the sum wraps to 350 - 256
        assertEquals(94.0 / 3, series.mean(), 1e-9);

        var sorted = series.sortByValue(false);
        assertEquals(List.of(1, 0, 2), sorted.index());
    }

    @Test
    public void testNaturalOrderSortUsesKindOrder() {
        var series = NumericSeries.withDefaultIndex(NumericTypes.UINT8, "u", List.of((byte) 100, (byte) 200, (byte) 50));
        Series<Byte, Integer> ascending = Series.sortByValue(series, true);
        assertEquals(List.of(2, 0, 1), ascending.index());
        assertTrue(ascending instanceof NumericSeries);

        var descending = Series.sortByValue(NumericSeries.withDefaultIndex(NumericTypes.UINT32, "w", List.of(-1, 1)), false);
        assertEquals(List.of(0, 1), descending.index());
    }

    @Test
    public void testUnsignedSumWraps() {
        var series = NumericSeries.withDefaultIndex(NumericTypes.UINT8, "u", List.of((byte) 200, (byte) 100));
        assertEquals("44", NumericTypes.UINT8.format(series.sum()));
        assertEquals(44.0, series.mean() * 2, 1e-9);
    }

    @Test
    public void testUnsignedDivisionAndRemainder() {
        var a = NumericSeries.withDefaultIndex(NumericTypes.UINT32, "a", List.of(-1, 7));
        var b = NumericSeries.withDefaultIndex(NumericTypes.UINT32, "b", List.of(2, 4));
        var quotient = a.divide(b, "");
        assertEquals("2147483647", NumericTypes.UINT32.format(quotient.at(0)));
        assertEquals(Integer.valueOf(1), quotient.at(1));
        var remainder = a.mod(b, "");
        assertEquals(List.of(1, 3), remainder.values());

        var big = NumericSeries.withDefaultIndex(NumericTypes.UINT64, "big", List.of(-1L));
        assertEquals("18446744073709551615", NumericTypes.UINT64.format(big.at(0)));
        assertEquals(0x1.0p64, big.mean(), 0);
        assertEquals("9223372036854775807",
                     NumericTypes.UINT64.format(big.divide(NumericSeries.withDefaultIndex(NumericTypes.UINT64, "two", List.of(2L)), "").at(0)));
    }

    @Test
    public void testUnsignedFormatting() {
        assertEquals("4294967295", NumericTypes.UINT32.format(-1));
        assertEquals("65535", NumericTypes.UINT16.format((short) -1));
        assertEquals("-1", NumericTypes.INT32.format(-1));
    }

    @Test
    public void testUnsignedAbsIsIdentity() {
        var series = NumericSeries.withDefaultIndex(NumericTypes.UINT16, "u", List.of((short) -5, (short) 5));
        assertEquals(series.values(), series.abs().values());
    }

    @Test
    public void testUnsignedConversionFromDouble() {
        assertEquals(Long.valueOf(-2048L), NumericTypes.UINT64.fromDouble(0x1.0p64 - 2048));
        assertEquals(Long.valueOf(Long.MIN_VALUE), NumericTypes.UINT64.fromDouble(0x1.0p63));
        assertEquals(Integer.valueOf(-1), NumericTypes.UINT32.fromDouble(4294967295.0));
        assertEquals(Byte.valueOf((byte) -1), NumericTypes.UINT8.fromDouble(255.9));
    }

    @Test
    public void testPowOnUnsigned() {
        var series = NumericSeries.withDefaultIndex(NumericTypes.UINT8, "u", List.of((byte) 15));
        assertEquals("225", NumericTypes.UINT8.format(series.pow(2, "").at(0)));
    }

    @Test
    public void testModOnEveryIntegerKind() {
        for (NumericType<?> type : NumericTypes.all()) {
            if (type.isIntegral()) {
                assertRemainder(type);
            }
        }
    }

    private static <T extends Number> void assertRemainder(NumericType<T> type) {
        T seven = type.fromDouble(7);
        T three = type.fromDouble(3);
        assertEquals(type.name(), 1.0, type.toDouble(type.remainder(seven, three)), 0);
    }

    @Test
    public void testRemainderRejectedForFloatKinds() {
        assertThrows(UnsupportedOperationException.class, () -> NumericTypes.FLOAT32.remainder(1f, 2f));
        assertThrows(UnsupportedOperationException.class, () -> NumericTypes.FLOAT64.remainder(1.0, 2.0));
    }

    @Test
    public void testNaN() {
        assertTrue(NumericTypes.FLOAT64.isNaN(Double.NaN));
        assertTrue(NumericTypes.FLOAT32.isNaN(Float.NaN));
        assertFalse(NumericTypes.FLOAT64.isNaN(1.0));
        assertFalse(NumericTypes.INT32.isNaN(0));
    }

    @Test
    public void testNaNNeverWinsAnExtremumScanUnlessFirst() {
        var later = NumericSeries.ofDoubles("x", 1.0, Double.NaN, 3.0);
        assertEquals(3.0, later.max(), 0);
        assertEquals(1.0, later.min(), 0);

        var first = NumericSeries.ofDoubles("x", Double.NaN, 1.0, 3.0);
        assertTrue(Double.isNaN(first.max()));
        assertEquals(0, first.argMin());
    }

    @Test
    public void testNaNSortsLast() {
        var series = NumericSeries.ofDoubles("x", Double.NaN, 2.0, 1.0);
        var sorted = series.sortByValue(true);
        assertEquals(List.of(2, 1, 0), sorted.index());
    }

    @Test
    public void testFloat32Arithmetic() {
        var series = NumericSeries.withDefaultIndex(NumericTypes.FLOAT32, "f", List.of(0.1f, 0.2f));
        assertEquals(Float.valueOf(0.1f + 0.2f), series.sum());
        assertEquals(List.of(0.1f, 0.2f), series.abs().values());
    }
}
