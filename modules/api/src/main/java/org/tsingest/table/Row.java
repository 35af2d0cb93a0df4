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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Ordered sequence of {@link Value}s aligned with the columns of a {@link TableSchema}. The alignment is a contract of the producer;
 * the row itself does not know its schema.
 *
 * <p>Every type has two accessors. {@code getXxx(index)} returns {@code null} when the index is out of range or the value is null.
 * {@code getXxxUnchecked(index)} skips the range check: the caller guarantees {@code 0 <= index < size()}, typically after validating
 * a whole batch once; a violated guarantee surfaces as {@link IndexOutOfBoundsException}. A stored value of another type is handled by
 * the row's {@link TypeMismatchPolicy}.
 *
 * <p>{@code takeXxx} accessors hand the stored array or text over without copying and leave the null value in the slot. They are
 * meant for draining a row into another representation exactly once. A take on a slot holding another type moves nothing: under
 * {@link TypeMismatchPolicy#LENIENT} it returns {@code null} and the stored value stays in place.
 *
 * <p>Rows are not thread safe.
 */
public final class Row {
    private final ArrayList<Value> values;

    private TypeMismatchPolicy policy = TypeMismatchPolicy.defaultPolicy();

    private Row(ArrayList<Value> values) {
        this.values = values;
    }

    /**
     * Creates an empty row.
     *
     * @param capacity Expected number of values.
     * @return Row.
     */
    public static Row withCapacity(int capacity) {
        return new Row(new ArrayList<>(capacity));
    }

    /**
     * Creates a row of the given values.
     *
     * @param values Values in schema order.
     * @return Row.
     * @throws NullPointerException If any value is {@code null}; use {@link Value#nullValue()} for an absent value.
     */
    public static Row of(Value... values) {
        return new Row(new ArrayList<>(requireNoNulls(Arrays.asList(values))));
    }

    /**
     * Creates a row of the given values.
     *
     * @param values Values in schema order.
     * @return Row.
     * @throws NullPointerException If any value is {@code null}; use {@link Value#nullValue()} for an absent value.
     */
    public static Row fromValues(Collection<? extends Value> values) {
        return new Row(new ArrayList<>(requireNoNulls(values)));
    }

    /**
     * Appends a value.
     *
     * @param value Value.
     * @return This row.
     */
    public Row addValue(Value value) {
        values.add(Objects.requireNonNull(value, "value"));

        return this;
    }

    /**
     * Appends values. Nothing is appended if any of them is {@code null}.
     *
     * @param values Values.
     * @return This row.
     * @throws NullPointerException If any value is {@code null}.
     */
    public Row addValues(Collection<? extends Value> values) {
        this.values.addAll(requireNoNulls(values));

        return this;
    }

    /**
     * Appends values.
     *
     * @param values Values.
     * @return This row.
     * @throws NullPointerException If any value is {@code null}; the values before it stay appended.
     */
    public Row addValues(Iterable<? extends Value> values) {
        for (Value v : values) {
            addValue(v);
        }

        return this;
    }

    /**
     * Sets the mismatch policy of this row.
     *
     * @param policy Policy.
     * @return This row.
     */
    public Row withPolicy(TypeMismatchPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");

        return this;
    }

    /** Returns the mismatch policy of this row. */
    public TypeMismatchPolicy policy() {
        return policy;
    }

    /** Returns number of values. */
    public int size() {
        return values.size();
    }

    /** Returns {@code true} if the row has no values. */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Returns the raw value at the given index.
     *
     * @param index Value index.
     * @return Value.
     * @throws IndexOutOfBoundsException If the index is out of range.
     */
    public Value value(int index) {
        return values.get(index);
    }

    /** Returns unmodifiable view of the values. */
    public List<Value> values() {
        return Collections.unmodifiableList(values);
    }

    /** Boolean value or {@code null}. */
    public @Nullable Boolean getBool(int index) {
        return inRange(index) ? matchBool(index, values.get(index)) : null;
    }

    /** Boolean value or {@code null}; the index must be in range. */
    public @Nullable Boolean getBoolUnchecked(int index) {
        return matchBool(index, values.get(index));
    }

    /** 8-bit signed value or {@code null}. */
    public @Nullable Byte getInt8(int index) {
        return inRange(index) ? matchInt8(index, values.get(index)) : null;
    }

    /** 8-bit signed value or {@code null}; the index must be in range. */
    public @Nullable Byte getInt8Unchecked(int index) {
        return matchInt8(index, values.get(index));
    }

    /** 16-bit signed value or {@code null}. */
    public @Nullable Short getInt16(int index) {
        return inRange(index) ? matchInt16(index, values.get(index)) : null;
    }

    /** 16-bit signed value or {@code null}; the index must be in range. */
    public @Nullable Short getInt16Unchecked(int index) {
        return matchInt16(index, values.get(index));
    }

    /** 32-bit signed value or {@code null}. */
    public @Nullable Integer getInt32(int index) {
        return inRange(index) ? matchInt32(index, values.get(index)) : null;
    }

    /** 32-bit signed value or {@code null}; the index must be in range. */
    public @Nullable Integer getInt32Unchecked(int index) {
        return matchInt32(index, values.get(index));
    }

    /** 64-bit signed value or {@code null}. */
    public @Nullable Long getInt64(int index) {
        return inRange(index) ? matchInt64(index, values.get(index)) : null;
    }

    /** 64-bit signed value or {@code null}; the index must be in range. */
    public @Nullable Long getInt64Unchecked(int index) {
        return matchInt64(index, values.get(index));
    }

    /** 8-bit unsigned value widened to {@code short}, or {@code null}. */
    public @Nullable Short getUint8(int index) {
        return inRange(index) ? matchUint8(index, values.get(index)) : null;
    }

    /** 8-bit unsigned value widened to {@code short}, or {@code null}; the index must be in range. */
    public @Nullable Short getUint8Unchecked(int index) {
        return matchUint8(index, values.get(index));
    }

    /** 16-bit unsigned value widened to {@code int}, or {@code null}. */
    public @Nullable Integer getUint16(int index) {
        return inRange(index) ? matchUint16(index, values.get(index)) : null;
    }

    /** 16-bit unsigned value widened to {@code int}, or {@code null}; the index must be in range. */
    public @Nullable Integer getUint16Unchecked(int index) {
        return matchUint16(index, values.get(index));
    }

    /** 32-bit unsigned value widened to {@code long}, or {@code null}. */
    public @Nullable Long getUint32(int index) {
        return inRange(index) ? matchUint32(index, values.get(index)) : null;
    }

    /** 32-bit unsigned value widened to {@code long}, or {@code null}; the index must be in range. */
    public @Nullable Long getUint32Unchecked(int index) {
        return matchUint32(index, values.get(index));
    }

    /**
     * 64-bit unsigned value as raw bits, or {@code null}. Use {@link Long#toUnsignedString(long)} and friends to interpret it.
     */
    public @Nullable Long getUint64(int index) {
        return inRange(index) ? matchUint64(index, values.get(index)) : null;
    }

    /** 64-bit unsigned value as raw bits, or {@code null}; the index must be in range. */
    public @Nullable Long getUint64Unchecked(int index) {
        return matchUint64(index, values.get(index));
    }

    /** Single precision value or {@code null}. */
    public @Nullable Float getFloat32(int index) {
        return inRange(index) ? matchFloat32(index, values.get(index)) : null;
    }

    /** Single precision value or {@code null}; the index must be in range. */
    public @Nullable Float getFloat32Unchecked(int index) {
        return matchFloat32(index, values.get(index));
    }

    /** Double precision value or {@code null}. */
    public @Nullable Double getFloat64(int index) {
        return inRange(index) ? matchFloat64(index, values.get(index)) : null;
    }

    /** Double precision value or {@code null}; the index must be in range. */
    public @Nullable Double getFloat64Unchecked(int index) {
        return matchFloat64(index, values.get(index));
    }

    /**
     * Copy of a binary value, or {@code null}. A stored text value (a JSON column kept as text) is returned as its UTF-8 bytes.
     */
    public byte @Nullable [] getBinary(int index) {
        return inRange(index) ? matchBinary(index, values.get(index), false) : null;
    }

    /** Copy of a binary value, or {@code null}; the index must be in range. */
    public byte @Nullable [] getBinaryUnchecked(int index) {
        return matchBinary(index, values.get(index), false);
    }

    /** Moves a binary value out of the row without copying, leaving null in the slot. A mismatched value is left in place. */
    public byte @Nullable [] takeBinary(int index) {
        return inRange(index) ? takeBinaryUnchecked(index) : null;
    }

    /**
     * Moves a binary value out of the row without copying, leaving null in the slot; the index must be in range. A mismatched value
     * is left in place.
     */
    public byte @Nullable [] takeBinaryUnchecked(int index) {
        byte[] res = matchBinary(index, values.get(index), true);

        if (res != null) {
            values.set(index, Value.nullValue());
        }

        return res;
    }

    /** Text value or {@code null}. */
    public @Nullable String getString(int index) {
        return inRange(index) ? matchString(index, values.get(index)) : null;
    }

    /** Text value or {@code null}; the index must be in range. */
    public @Nullable String getStringUnchecked(int index) {
        return matchString(index, values.get(index));
    }

    /** Moves a text value out of the row, leaving null in the slot. A mismatched value is left in place. */
    public @Nullable String takeString(int index) {
        return inRange(index) ? takeStringUnchecked(index) : null;
    }

    /** Moves a text value out of the row, leaving null in the slot; the index must be in range. A mismatched value is left in place. */
    public @Nullable String takeStringUnchecked(int index) {
        String res = matchString(index, values.get(index));

        if (res != null) {
            values.set(index, Value.nullValue());
        }

        return res;
    }

    /** JSON text or {@code null}. */
    public @Nullable String getJson(int index) {
        return inRange(index) ? matchJson(index, values.get(index)) : null;
    }

    /** JSON text or {@code null}; the index must be in range. */
    public @Nullable String getJsonUnchecked(int index) {
        return matchJson(index, values.get(index));
    }

    /** Moves a JSON text out of the row, leaving null in the slot. A mismatched value is left in place. */
    public @Nullable String takeJson(int index) {
        return inRange(index) ? takeJsonUnchecked(index) : null;
    }

    /** Moves a JSON text out of the row, leaving null in the slot; the index must be in range. A mismatched value is left in place. */
    public @Nullable String takeJsonUnchecked(int index) {
        String res = matchJson(index, values.get(index));

        if (res != null) {
            values.set(index, Value.nullValue());
        }

        return res;
    }

    /** Date as days since the Unix epoch, or {@code null}. */
    public @Nullable Integer getDate(int index) {
        return inRange(index) ? matchDate(index, values.get(index)) : null;
    }

    /** Date as days since the Unix epoch, or {@code null}; the index must be in range. */
    public @Nullable Integer getDateUnchecked(int index) {
        return matchDate(index, values.get(index));
    }

    /** Datetime as milliseconds since the Unix epoch, or {@code null}. */
    public @Nullable Long getDatetime(int index) {
        return inRange(index) ? matchDatetime(index, values.get(index)) : null;
    }

    /** Datetime as milliseconds since the Unix epoch, or {@code null}; the index must be in range. */
    public @Nullable Long getDatetimeUnchecked(int index) {
        return matchDatetime(index, values.get(index));
    }

    /**
     * Timestamp of any resolution as the raw stored number, or {@code null}. The resolution is defined by the column type.
     */
    public @Nullable Long getTimestamp(int index) {
        return inRange(index) ? matchTimestamp(index, values.get(index)) : null;
    }

    /** Timestamp of any resolution, or {@code null}; the index must be in range. */
    public @Nullable Long getTimestampUnchecked(int index) {
        return matchTimestamp(index, values.get(index));
    }

    /** Time of day in seconds or milliseconds, or {@code null}. */
    public @Nullable Integer getTime32(int index) {
        return inRange(index) ? matchTime32(index, values.get(index)) : null;
    }

    /** Time of day in seconds or milliseconds, or {@code null}; the index must be in range. */
    public @Nullable Integer getTime32Unchecked(int index) {
        return matchTime32(index, values.get(index));
    }

    /** Time of day in microseconds or nanoseconds, or {@code null}. */
    public @Nullable Long getTime64(int index) {
        return inRange(index) ? matchTime64(index, values.get(index)) : null;
    }

    /** Time of day in microseconds or nanoseconds, or {@code null}; the index must be in range. */
    public @Nullable Long getTime64Unchecked(int index) {
        return matchTime64(index, values.get(index));
    }

    /** Unscaled decimal value, or {@code null}. The scale is defined by the column. */
    public @Nullable BigInteger getDecimal128(int index) {
        return inRange(index) ? matchDecimal128(index, values.get(index)) : null;
    }

    /** Unscaled decimal value, or {@code null}; the index must be in range. */
    public @Nullable BigInteger getDecimal128Unchecked(int index) {
        return matchDecimal128(index, values.get(index));
    }

    private static <T extends Collection<? extends Value>> T requireNoNulls(T values) {
        for (Value v : values) {
            Objects.requireNonNull(v, "Row values must not be null, use Value.nullValue()");
        }

        return values;
    }

    private boolean inRange(int index) {
        return index >= 0 && index < values.size();
    }

    private @Nullable Boolean matchBool(int index, Value v) {
        if (v.type() == ColumnDataType.BOOLEAN) {
            return v.bits() != 0;
        }

        return v.isNull() ? null : policy.onMismatch(index, "boolean", v);
    }

    private @Nullable Byte matchInt8(int index, Value v) {
        if (v.type() == ColumnDataType.INT8) {
            return (byte) v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "i8", v);
    }

    private @Nullable Short matchInt16(int index, Value v) {
        if (v.type() == ColumnDataType.INT16) {
            return (short) v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "i16", v);
    }

    private @Nullable Integer matchInt32(int index, Value v) {
        if (v.type() == ColumnDataType.INT32) {
            return (int) v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "i32", v);
    }

    private @Nullable Long matchInt64(int index, Value v) {
        if (v.type() == ColumnDataType.INT64) {
            return v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "i64", v);
    }

    private @Nullable Short matchUint8(int index, Value v) {
        if (v.type() == ColumnDataType.UINT8) {
            return (short) v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "u8", v);
    }

    private @Nullable Integer matchUint16(int index, Value v) {
        if (v.type() == ColumnDataType.UINT16) {
            return (int) v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "u16", v);
    }

    private @Nullable Long matchUint32(int index, Value v) {
        if (v.type() == ColumnDataType.UINT32) {
            return v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "u32", v);
    }

    private @Nullable Long matchUint64(int index, Value v) {
        if (v.type() == ColumnDataType.UINT64) {
            return v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "u64", v);
    }

    private @Nullable Float matchFloat32(int index, Value v) {
        if (v.type() == ColumnDataType.FLOAT32) {
            return Float.intBitsToFloat((int) v.bits());
        }

        return v.isNull() ? null : policy.onMismatch(index, "f32", v);
    }

    private @Nullable Double matchFloat64(int index, Value v) {
        if (v.type() == ColumnDataType.FLOAT64) {
            return Double.longBitsToDouble(v.bits());
        }

        return v.isNull() ? null : policy.onMismatch(index, "f64", v);
    }

    private byte @Nullable [] matchBinary(int index, Value v, boolean take) {
        if (v.type() == ColumnDataType.BINARY) {
            byte[] bytes = (byte[]) v.ref();

            return take ? bytes : bytes.clone();
        }

        if (v.type() == ColumnDataType.STRING || v.type() == ColumnDataType.JSON) {
            return v.utf8();
        }

        return v.isNull() ? null : policy.onMismatch(index, "binary", v);
    }

    private @Nullable String matchString(int index, Value v) {
        if (v.type() == ColumnDataType.STRING) {
            return (String) v.ref();
        }

        return v.isNull() ? null : policy.onMismatch(index, "string", v);
    }

    private @Nullable String matchJson(int index, Value v) {
        if (v.type() == ColumnDataType.JSON) {
            return (String) v.ref();
        }

        return v.isNull() ? null : policy.onMismatch(index, "json", v);
    }

    private @Nullable Integer matchDate(int index, Value v) {
        if (v.type() == ColumnDataType.DATE) {
            return (int) v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "date", v);
    }

    private @Nullable Long matchDatetime(int index, Value v) {
        if (v.type() == ColumnDataType.DATETIME) {
            return v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "datetime", v);
    }

    private @Nullable Long matchTimestamp(int index, Value v) {
        if (v.type() != null && v.type().isTimestamp()) {
            return v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "timestamp", v);
    }

    private @Nullable Integer matchTime32(int index, Value v) {
        if (v.type() != null && v.type().isTime32()) {
            return (int) v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "time32", v);
    }

    private @Nullable Long matchTime64(int index, Value v) {
        if (v.type() != null && v.type().isTime64()) {
            return v.bits();
        }

        return v.isNull() ? null : policy.onMismatch(index, "time64", v);
    }

    private @Nullable BigInteger matchDecimal128(int index, Value v) {
        if (v.type() == ColumnDataType.DECIMAL128) {
            return (BigInteger) v.ref();
        }

        return v.isNull() ? null : policy.onMismatch(index, "decimal128", v);
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

        return values.equals(((Row) o).values);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return values.hashCode();
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "Row " + values;
    }
}
