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
 * Extended type parameters of a column. The only parametrized type is {@link ColumnDataType#DECIMAL128}, which needs a precision and
 * a scale.
 */
public final class DataTypeExtension {
    /** Maximum decimal precision. */
    public static final int MAX_DECIMAL_PRECISION = 38;

    private final int precision;

    private final int scale;

    private DataTypeExtension(int precision, int scale) {
        this.precision = precision;
        this.scale = scale;
    }

    /**
     * Creates decimal parameters.
     *
     * @param precision Total number of digits, {@code 1..38}.
     * @param scale Number of digits after the decimal point; a byte-sized value.
     * @return Extension.
     */
    public static DataTypeExtension decimal128(int precision, int scale) {
        if (precision < 1 || precision > MAX_DECIMAL_PRECISION) {
            throw new IllegalArgumentException("Decimal precision must be in range [1, " + MAX_DECIMAL_PRECISION + "]: " + precision);
        }

        if (scale < Byte.MIN_VALUE || scale > Byte.MAX_VALUE) {
            throw new IllegalArgumentException("Decimal scale must fit into a byte: " + scale);
        }

        return new DataTypeExtension(precision, scale);
    }

    /** Returns decimal precision. */
    public int precision() {
        return precision;
    }

    /** Returns decimal scale. */
    public int scale() {
        return scale;
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

        DataTypeExtension that = (DataTypeExtension) o;

        return precision == that.precision && scale == that.scale;
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return 31 * precision + scale;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "Decimal128 [precision=" + precision + ", scale=" + scale + ']';
    }
}
