/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tsingest.table;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A single column value: one case per {@link ColumnDataType} plus the null case. Immutable.
 *
 * <p>Numeric payloads are kept as raw 64 bits, other payloads as a reference. The case fixes the semantic type of the value exactly;
 * no numeric coercion happens between cases. Decimal precision and scale are not part of the value, they belong to the column.
 *
 * <p>Binary payloads are not copied by {@link #binary(byte[])}: the caller hands the array over and must not modify it afterwards.
 */
public final class Value {
    /** The null value. */
    private static final Value NULL = new Value(null, 0L, null);

    /** Largest unsigned 32-bit value. */
    private static final long UINT32_MAX = 0xFFFF_FFFFL;

    /** Bits of a 128-bit two's complement number, sign included. */
    private static final int DECIMAL128_BITS = 127;

    /** Value case, {@code null} for the null case. */
    private final @Nullable ColumnDataType type;

    /** Numeric payload. */
    private final long bits;

    /** Reference payload: {@code byte[]}, {@link String} or {@link BigInteger}. */
    private final @Nullable Object ref;

    private Value(@Nullable ColumnDataType type, long bits, @Nullable Object ref) {
        this.type = type;
        this.bits = bits;
        this.ref = ref;
    }

    /** Returns the null value. */
    public static Value nullValue() {
        return NULL;
    }

    /** Creates a boolean value. */
    public static Value bool(boolean v) {
        return new Value(ColumnDataType.BOOLEAN, v ? 1L : 0L, null);
    }

    /** Creates an 8-bit signed value. */
    public static Value int8(byte v) {
        return new Value(ColumnDataType.INT8, v, null);
    }

    /** Creates a 16-bit signed value. */
    public static Value int16(short v) {
        return new Value(ColumnDataType.INT16, v, null);
    }

    /** Creates a 32-bit signed value. */
    public static Value int32(int v) {
        return new Value(ColumnDataType.INT32, v, null);
    }

    /** Creates a 64-bit signed value. */
    public static Value int64(long v) {
        return new Value(ColumnDataType.INT64, v, null);
    }

    /**
     * Creates an 8-bit unsigned value.
     *
     * @param v Value in range {@code [0, 255]}.
     * @return Value.
     */
    public static Value uint8(int v) {
        checkUnsigned(v, 0xFF, ColumnDataType.UINT8);

        return new Value(ColumnDataType.UINT8, v, null);
    }

    /**
     * Creates a 16-bit unsigned value.
     *
     * @param v Value in range {@code [0, 65535]}.
     * @return Value.
     */
    public static Value uint16(int v) {
        checkUnsigned(v, 0xFFFF, ColumnDataType.UINT16);

        return new Value(ColumnDataType.UINT16, v, null);
    }

    /**
     * Creates a 32-bit unsigned value.
     *
     * @param v Value in range {@code [0, 2^32 - 1]}.
     * @return Value.
     */
    public static Value uint32(long v) {
        checkUnsigned(v, UINT32_MAX, ColumnDataType.UINT32);

        return new Value(ColumnDataType.UINT32, v, null);
    }

    /**
     * Creates a 64-bit unsigned value.
     *
     * @param v Raw 64 bits, interpreted as unsigned.
     * @return Value.
     */
    public static Value uint64(long v) {
        return new Value(ColumnDataType.UINT64, v, null);
    }

    /** Creates a single precision value. */
    public static Value float32(float v) {
        return new Value(ColumnDataType.FLOAT32, Float.floatToRawIntBits(v), null);
    }

    /** Creates a double precision value. */
    public static Value float64(double v) {
        return new Value(ColumnDataType.FLOAT64, Double.doubleToRawLongBits(v), null);
    }

    /**
     * Creates a binary value. The array is not copied.
     *
     * @param v Bytes or {@code null} for the null value.
     * @return Value.
     */
    public static Value binary(byte @Nullable [] v) {
        return v == null ? NULL : new Value(ColumnDataType.BINARY, 0L, v);
    }

    /**
     * Creates a text value.
     *
     * @param v Text or {@code null} for the null value.
     * @return Value.
     */
    public static Value string(@Nullable String v) {
        return v == null ? NULL : new Value(ColumnDataType.STRING, 0L, v);
    }

    /**
     * Creates a JSON value kept as text.
     *
     * @param v JSON text or {@code null} for the null value.
     * @return Value.
     */
    public static Value json(@Nullable String v) {
        return v == null ? NULL : new Value(ColumnDataType.JSON, 0L, v);
    }

    /** Creates a date value: days since the Unix epoch. */
    public static Value date(int days) {
        return new Value(ColumnDataType.DATE, days, null);
    }

    /** Creates a datetime value: milliseconds since the Unix epoch. */
    public static Value datetime(long millis) {
        return new Value(ColumnDataType.DATETIME, millis, null);
    }

    /** Creates a timestamp in seconds since the Unix epoch. */
    public static Value timestampSecond(long v) {
        return new Value(ColumnDataType.TIMESTAMP_SECOND, v, null);
    }

    /** Creates a timestamp in milliseconds since the Unix epoch. */
    public static Value timestampMillisecond(long v) {
        return new Value(ColumnDataType.TIMESTAMP_MILLISECOND, v, null);
    }

    /** Creates a timestamp in microseconds since the Unix epoch. */
    public static Value timestampMicrosecond(long v) {
        return new Value(ColumnDataType.TIMESTAMP_MICROSECOND, v, null);
    }

    /** Creates a timestamp in nanoseconds since the Unix epoch. */
    public static Value timestampNanosecond(long v) {
        return new Value(ColumnDataType.TIMESTAMP_NANOSECOND, v, null);
    }

    /** Creates a time of day in seconds. */
    public static Value timeSecond(int v) {
        return new Value(ColumnDataType.TIME_SECOND, v, null);
    }

    /** Creates a time of day in milliseconds. */
    public static Value timeMillisecond(int v) {
        return new Value(ColumnDataType.TIME_MILLISECOND, v, null);
    }

    /** Creates a time of day in microseconds. */
    public static Value timeMicrosecond(long v) {
        return new Value(ColumnDataType.TIME_MICROSECOND, v, null);
    }

    /** Creates a time of day in nanoseconds. */
    public static Value timeNanosecond(long v) {
        return new Value(ColumnDataType.TIME_NANOSECOND, v, null);
    }

    /**
     * Creates a decimal value from its unscaled representation. The scale comes from the column.
     *
     * @param unscaled Unscaled value that fits into 128 bits, or {@code null} for the null value.
     * @return Value.
     */
    public static Value decimal128(@Nullable BigInteger unscaled) {
        if (unscaled == null) {
            return NULL;
        }

        if (unscaled.bitLength() > DECIMAL128_BITS) {
            throw new IllegalArgumentException("Value does not fit into 128 bits: " + unscaled);
        }

        return new Value(ColumnDataType.DECIMAL128, 0L, unscaled);
    }

    /**
     * Returns the value case.
     *
     * @return Type of the value or {@code null} for the null value.
     */
    public @Nullable ColumnDataType type() {
        return type;
    }

    /** Returns {@code true} for the null value. */
    public boolean isNull() {
        return type == null;
    }

    /**
     * Rough payload size in bytes, used to size outgoing requests.
     *
     * @return Estimated size.
     */
    public int estimatedSize() {
        if (type == null) {
            return 1;
        }

        switch (type) {
            case BINARY:
                return ((byte[]) ref).length;

            case STRING:
            case JSON:
                return ((String) ref).length();

            case DECIMAL128:
                return 16;

            default:
                return Long.BYTES;
        }
    }

    /** Raw numeric payload. */
    long bits() {
        return bits;
    }

    /** Reference payload. */
    @Nullable Object ref() {
        return ref;
    }

    /** Text payload of a {@code STRING} or {@code JSON} value as UTF-8 bytes. */
    byte[] utf8() {
        return ((String) ref).getBytes(StandardCharsets.UTF_8);
    }

    /** {@inheritDoc} */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        Value value = (Value) o;

        return type == value.type && bits == value.bits && Objects.deepEquals(ref, value.ref);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        int res = Objects.hashCode(type);

        res = 31 * res + Long.hashCode(bits);
        res = 31 * res + (ref instanceof byte[] ? Arrays.hashCode((byte[]) ref) : Objects.hashCode(ref));

        return res;
    }

    /**
     * Renders the value as {@code Case(payload)}, for example {@code Int32(42)} or {@code String("test")}; the null value is
     * rendered as {@code Null}.
     */
    @Override
    public String toString() {
        if (type == null) {
            return "Null";
        }

        return type.caseName() + '(' + payloadToString(type) + ')';
    }

    private String payloadToString(ColumnDataType type) {
        switch (type) {
            case BOOLEAN:
                return Boolean.toString(bits != 0);

            case UINT64:
                return Long.toUnsignedString(bits);

            case FLOAT32:
                return Float.toString(Float.intBitsToFloat((int) bits));

            case FLOAT64:
                return Double.toString(Double.longBitsToDouble(bits));

            case BINARY:
                return Arrays.toString((byte[]) ref);

            case STRING:
            case JSON:
                return '"' + (String) ref + '"';

            case DECIMAL128:
                return ref.toString();

            default:
                return Long.toString(bits);
        }
    }

    private static void checkUnsigned(long v, long max, ColumnDataType type) {
        if (v < 0 || v > max) {
            throw new IllegalArgumentException("Value is out of range of " + type.caseName() + ": " + v);
        }
    }
}
