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

import io.github.jbellis.jseries.util.MathUtil;

import java.util.List;

/**
 * The numeric kinds a {@link NumericSeries} may hold.
 */
public final class NumericTypes {
    public static final NumericType<Byte> INT8 = new Int8();
    public static final NumericType<Short> INT16 = new Int16();
    public static final NumericType<Integer> INT32 = new Int32();
    public static final NumericType<Long> INT64 = new Int64();
    public static final NumericType<Byte> UINT8 = new UInt8();
    public static final NumericType<Short> UINT16 = new UInt16();
    public static final NumericType<Integer> UINT32 = new UInt32();
    public static final NumericType<Long> UINT64 = new UInt64();
    public static final NumericType<Float> FLOAT32 = new Float32();
    public static final NumericType<Double> FLOAT64 = new Float64();

    private static final List<NumericType<?>> ALL = List.of(INT8, INT16, INT32, INT64,
                                                             UINT8, UINT16, UINT32, UINT64,
                                                             FLOAT32, FLOAT64);

    private NumericTypes() {
    }

    /** @return every numeric kind, signed integers first, then unsigned, then floating point */
    public static List<NumericType<?>> all() {
        return ALL;
    }

    private static final class Int8 extends NumericType<Byte> {
        private static final Byte ZERO = 0;

        Int8() {
            super("int8", true);
        }

        @Override
        public Byte zero() {
            return ZERO;
        }

        @Override
        public Byte add(Byte a, Byte b) {
            return (byte) (a + b);
        }

        @Override
        public Byte subtract(Byte a, Byte b) {
            return (byte) (a - b);
        }

        @Override
        public Byte multiply(Byte a, Byte b) {
            return (byte) (a * b);
        }

        @Override
        public Byte divide(Byte a, Byte b) {
            return (byte) (a / b);
        }

        @Override
        public Byte remainder(Byte a, Byte b) {
            return (byte) (a % b);
        }

        @Override
        public Byte negate(Byte a) {
            return (byte) -a;
        }

        @Override
        public boolean lessThan(Byte a, Byte b) {
            return a < b;
        }

        @Override
        public int compare(Byte a, Byte b) {
            return Byte.compare(a, b);
        }

        @Override
        public double toDouble(Byte a) {
            return a;
        }

        @Override
        public Byte fromDouble(double d) {
            return (byte) d;
        }
    }

    private static final class Int16 extends NumericType<Short> {
        private static final Short ZERO = 0;

        Int16() {
            super("int16", true);
        }

        @Override
        public Short zero() {
            return ZERO;
        }

        @Override
        public Short add(Short a, Short b) {
            return (short) (a + b);
        }

        @Override
        public Short subtract(Short a, Short b) {
            return (short) (a - b);
        }

        @Override
        public Short multiply(Short a, Short b) {
            return (short) (a * b);
        }

        @Override
        public Short divide(Short a, Short b) {
            return (short) (a / b);
        }

        @Override
        public Short remainder(Short a, Short b) {
            return (short) (a % b);
        }

        @Override
        public Short negate(Short a) {
            return (short) -a;
        }

        @Override
        public boolean lessThan(Short a, Short b) {
            return a < b;
        }

        @Override
        public int compare(Short a, Short b) {
            return Short.compare(a, b);
        }

        @Override
        public double toDouble(Short a) {
            return a;
        }

        @Override
        public Short fromDouble(double d) {
            return (short) d;
        }
    }

    private static final class Int32 extends NumericType<Integer> {
        private static final Integer ZERO = 0;

        Int32() {
            super("int32", true);
        }

        @Override
        public Integer zero() {
            return ZERO;
        }

        @Override
        public Integer add(Integer a, Integer b) {
            return a + b;
        }

        @Override
        public Integer subtract(Integer a, Integer b) {
            return a - b;
        }

        @Override
        public Integer multiply(Integer a, Integer b) {
            return a * b;
        }

        @Override
        public Integer divide(Integer a, Integer b) {
            return a / b;
        }

        @Override
        public Integer remainder(Integer a, Integer b) {
            return a % b;
        }

        @Override
        public Integer negate(Integer a) {
            return -a;
        }

        @Override
        public boolean lessThan(Integer a, Integer b) {
            return a < b;
        }

        @Override
        public int compare(Integer a, Integer b) {
            return Integer.compare(a, b);
        }

        @Override
        public double toDouble(Integer a) {
            return a;
        }

        @Override
        public Integer fromDouble(double d) {
            return (int) d;
        }
    }

    private static final class Int64 extends NumericType<Long> {
        private static final Long ZERO = 0L;

        Int64() {
            super("int64", true);
        }

        @Override
        public Long zero() {
            return ZERO;
        }

        @Override
        public Long add(Long a, Long b) {
            return a + b;
        }

        @Override
        public Long subtract(Long a, Long b) {
            return a - b;
        }

        @Override
        public Long multiply(Long a, Long b) {
            return a * b;
        }

        @Override
        public Long divide(Long a, Long b) {
            return a / b;
        }

        @Override
        public Long remainder(Long a, Long b) {
            return a % b;
        }

        @Override
        public Long negate(Long a) {
            return -a;
        }

        @Override
        public boolean lessThan(Long a, Long b) {
            return a < b;
        }

        @Override
        public int compare(Long a, Long b) {
            return Long.compare(a, b);
        }

        @Override
        public double toDouble(Long a) {
            return a;
        }

        @Override
        public Long fromDouble(double d) {
            return (long) d;
        }
    }

    private static final class UInt8 extends NumericType<Byte> {
        private static final Byte ZERO = 0;

        UInt8() {
            super("uint8", true);
        }

        @Override
        public Byte zero() {
            return ZERO;
        }

        @Override
        public Byte add(Byte a, Byte b) {
            return (byte) (a + b);
        }

        @Override
        public Byte subtract(Byte a, Byte b) {
            return (byte) (a - b);
        }

        @Override
        public Byte multiply(Byte a, Byte b) {
            return (byte) (a * b);
        }

        @Override
        public Byte divide(Byte a, Byte b) {
            return (byte) (Byte.toUnsignedInt(a) / Byte.toUnsignedInt(b));
        }

        @Override
        public Byte remainder(Byte a, Byte b) {
            return (byte) (Byte.toUnsignedInt(a) % Byte.toUnsignedInt(b));
        }

        @Override
        public Byte negate(Byte a) {
            return (byte) -a;
        }

        @Override
        public boolean lessThan(Byte a, Byte b) {
            return Byte.toUnsignedInt(a) < Byte.toUnsignedInt(b);
        }

        @Override
        public int compare(Byte a, Byte b) {
            return Integer.compare(Byte.toUnsignedInt(a), Byte.toUnsignedInt(b));
        }

        @Override
        public double toDouble(Byte a) {
            return Byte.toUnsignedInt(a);
        }

        @Override
        public Byte fromDouble(double d) {
            return (byte) (long) d;
        }

        @Override
        public Byte abs(Byte a) {
            return a;
        }

        @Override
        public String format(Byte a) {
            return Integer.toString(Byte.toUnsignedInt(a));
        }
    }

    private static final class UInt16 extends NumericType<Short> {
        private static final Short ZERO = 0;

        UInt16() {
            super("uint16", true);
        }

        @Override
        public Short zero() {
            return ZERO;
        }

        @Override
        public Short add(Short a, Short b) {
            return (short) (a + b);
        }

        @Override
        public Short subtract(Short a, Short b) {
            return (short) (a - b);
        }

        @Override
        public Short multiply(Short a, Short b) {
            return (short) (a * b);
        }

        @Override
        public Short divide(Short a, Short b) {
            return (short) (Short.toUnsignedInt(a) / Short.toUnsignedInt(b));
        }

        @Override
        public Short remainder(Short a, Short b) {
            return (short) (Short.toUnsignedInt(a) % Short.toUnsignedInt(b));
        }

        @Override
        public Short negate(Short a) {
            return (short) -a;
        }

        @Override
        public boolean lessThan(Short a, Short b) {
            return Short.toUnsignedInt(a) < Short.toUnsignedInt(b);
        }

        @Override
        public int compare(Short a, Short b) {
            return Integer.compare(Short.toUnsignedInt(a), Short.toUnsignedInt(b));
        }

        @Override
        public double toDouble(Short a) {
            return Short.toUnsignedInt(a);
        }

        @Override
        public Short fromDouble(double d) {
            return (short) (long) d;
        }

        @Override
        public Short abs(Short a) {
            return a;
        }

        @Override
        public String format(Short a) {
            return Integer.toString(Short.toUnsignedInt(a));
        }
    }

    private static final class UInt32 extends NumericType<Integer> {
        private static final Integer ZERO = 0;

        UInt32() {
            super("uint32", true);
        }

        @Override
        public Integer zero() {
            return ZERO;
        }

        @Override
        public Integer add(Integer a, Integer b) {
            return a + b;
        }

        @Override
        public Integer subtract(Integer a, Integer b) {
            return a - b;
        }

        @Override
        public Integer multiply(Integer a, Integer b) {
            return a * b;
        }

        @Override
        public Integer divide(Integer a, Integer b) {
            return Integer.divideUnsigned(a, b);
        }

        @Override
        public Integer remainder(Integer a, Integer b) {
            return Integer.remainderUnsigned(a, b);
        }

        @Override
        public Integer negate(Integer a) {
            return -a;
        }

        @Override
        public boolean lessThan(Integer a, Integer b) {
            return Integer.compareUnsigned(a, b) < 0;
        }

        @Override
        public int compare(Integer a, Integer b) {
            return Integer.compareUnsigned(a, b);
        }

        @Override
        public double toDouble(Integer a) {
            return Integer.toUnsignedLong(a);
        }

        @Override
        public Integer fromDouble(double d) {
            return (int) (long) d;
        }

        @Override
        public Integer abs(Integer a) {
            return a;
        }

        @Override
        public String format(Integer a) {
            return Integer.toUnsignedString(a);
        }
    }

    private static final class UInt64 extends NumericType<Long> {
        private static final Long ZERO = 0L;

        UInt64() {
            super("uint64", true);
        }

        @Override
        public Long zero() {
            return ZERO;
        }

        @Override
        public Long add(Long a, Long b) {
            return a + b;
        }

        @Override
        public Long subtract(Long a, Long b) {
            return a - b;
        }

        @Override
        public Long multiply(Long a, Long b) {
            return a * b;
        }

        @Override
        public Long divide(Long a, Long b) {
            return Long.divideUnsigned(a, b);
        }

        @Override
        public Long remainder(Long a, Long b) {
            return Long.remainderUnsigned(a, b);
        }

        @Override
        public Long negate(Long a) {
            return -a;
        }

        @Override
        public boolean lessThan(Long a, Long b) {
            return Long.compareUnsigned(a, b) < 0;
        }

        @Override
        public int compare(Long a, Long b) {
            return Long.compareUnsigned(a, b);
        }

        @Override
        public double toDouble(Long a) {
            return MathUtil.unsignedToDouble(a);
        }

        @Override
        public Long fromDouble(double d) {
            return MathUtil.doubleToUnsigned(d);
        }

        @Override
        public Long abs(Long a) {
            return a;
        }

        @Override
        public String format(Long a) {
            return Long.toUnsignedString(a);
        }
    }

    /**
     * Floating kinds have no integer remainder.
     */
    private abstract static class FloatingType<T extends Number> extends NumericType<T> {
        FloatingType(String name) {
            super(name, false);
        }

        @Override
        public T remainder(T a, T b) {
            throw new UnsupportedOperationException("modulus is not defined for " + name());
        }
    }

    private static final class Float32 extends FloatingType<Float> {
        private static final Float ZERO = 0.0f;

        Float32() {
            super("float32");
        }

        @Override
        public Float zero() {
            return ZERO;
        }

        @Override
        public Float add(Float a, Float b) {
            return a + b;
        }

        @Override
        public Float subtract(Float a, Float b) {
            return a - b;
        }

        @Override
        public Float multiply(Float a, Float b) {
            return a * b;
        }

        @Override
        public Float divide(Float a, Float b) {
            return a / b;
        }

        @Override
        public Float negate(Float a) {
            return -a;
        }

        @Override
        public boolean lessThan(Float a, Float b) {
            return a < b;
        }

        @Override
        public int compare(Float a, Float b) {
            return Float.compare(a, b);
        }

        @Override
        public double toDouble(Float a) {
            return a;
        }

        @Override
        public Float fromDouble(double d) {
            return (float) d;
        }

        @Override
        public boolean isNaN(Float a) {
            return Float.isNaN(a);
        }
    }

    private static final class Float64 extends FloatingType<Double> {
        private static final Double ZERO = 0.0;

        Float64() {
            super("float64");
        }

        @Override
        public Double zero() {
            return ZERO;
        }

        @Override
        public Double add(Double a, Double b) {
            return a + b;
        }

        @Override
        public Double subtract(Double a, Double b) {
            return a - b;
        }

        @Override
        public Double multiply(Double a, Double b) {
            return a * b;
        }

        @Override
        public Double divide(Double a, Double b) {
            return a / b;
        }

        @Override
        public Double negate(Double a) {
            return -a;
        }

        @Override
        public boolean lessThan(Double a, Double b) {
            return a < b;
        }

        @Override
        public int compare(Double a, Double b) {
            return Double.compare(a, b);
        }

        @Override
        public double toDouble(Double a) {
            return a;
        }

        @Override
        public Double fromDouble(double d) {
            return d;
        }

        @Override
        public boolean isNaN(Double a) {
            return Double.isNaN(a);
        }
    }
}
