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

/**
 * Column value types supported by the store. A {@link Value} of a given case always reports exactly one of these types.
 */
public enum ColumnDataType {
    /** Boolean. */
    BOOLEAN("Boolean"),

    /** 8-bit signed integer. */
    INT8("Int8"),

    /** 16-bit signed integer. */
    INT16("Int16"),

    /** 32-bit signed integer. */
    INT32("Int32"),

    /** 64-bit signed integer. */
    INT64("Int64"),

    /** 8-bit unsigned integer. */
    UINT8("Uint8"),

    /** 16-bit unsigned integer. */
    UINT16("Uint16"),

    /** 32-bit unsigned integer. */
    UINT32("Uint32"),

    /** 64-bit unsigned integer. */
    UINT64("Uint64"),

    /** Single precision floating point number. */
    FLOAT32("Float32"),

    /** Double precision floating point number. */
    FLOAT64("Float64"),

    /** Arbitrary byte sequence. */
    BINARY("Binary"),

    /** UTF-8 text. */
    STRING("String"),

    /** Days since the Unix epoch. */
    DATE("Date"),

    /** Milliseconds since the Unix epoch. */
    DATETIME("Datetime"),

    /** Seconds since the Unix epoch. */
    TIMESTAMP_SECOND("TimestampSecond"),

    /** Milliseconds since the Unix epoch. */
    TIMESTAMP_MILLISECOND("TimestampMillisecond"),

    /** Microseconds since the Unix epoch. */
    TIMESTAMP_MICROSECOND("TimestampMicrosecond"),

    /** Nanoseconds since the Unix epoch. */
    TIMESTAMP_NANOSECOND("TimestampNanosecond"),

    /** Seconds since midnight. */
    TIME_SECOND("TimeSecond"),

    /** Milliseconds since midnight. */
    TIME_MILLISECOND("TimeMillisecond"),

    /** Microseconds since midnight. */
    TIME_MICROSECOND("TimeMicrosecond"),

    /** Nanoseconds since midnight. */
    TIME_NANOSECOND("TimeNanosecond"),

    /** 128-bit fixed-point decimal. Precision and scale are defined by the column. */
    DECIMAL128("Decimal128"),

    /** JSON document kept as text. */
    JSON("Json");

    /** Name of the value case, as printed by {@link Value#toString()}. */
    private final String caseName;

    ColumnDataType(String caseName) {
        this.caseName = caseName;
    }

    /**
     * Returns the name of the value case.
     *
     * @return Case name.
     */
    public String caseName() {
        return caseName;
    }

    /**
     * Checks whether the type is one of the four timestamp resolutions.
     *
     * @return {@code true} for a timestamp type.
     */
    public boolean isTimestamp() {
        switch (this) {
            case TIMESTAMP_SECOND:
            case TIMESTAMP_MILLISECOND:
            case TIMESTAMP_MICROSECOND:
            case TIMESTAMP_NANOSECOND:
                return true;

            default:
                return false;
        }
    }

    /**
     * Checks whether the type is a time of day kept in 32 bits (second or millisecond resolution).
     *
     * @return {@code true} for a 32-bit time type.
     */
    public boolean isTime32() {
        return this == TIME_SECOND || this == TIME_MILLISECOND;
    }

    /**
     * Checks whether the type is a time of day kept in 64 bits (microsecond or nanosecond resolution).
     *
     * @return {@code true} for a 64-bit time type.
     */
    public boolean isTime64() {
        return this == TIME_MICROSECOND || this == TIME_NANOSECOND;
    }

    /**
     * Checks whether the payload of the type is a reference (array, text or big integer) rather than a number.
     *
     * @return {@code true} for a reference payload.
     */
    public boolean isVarlen() {
        return this == BINARY || this == STRING || this == JSON || this == DECIMAL128;
    }
}
