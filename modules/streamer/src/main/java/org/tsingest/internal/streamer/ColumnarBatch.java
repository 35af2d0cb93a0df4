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

package org.tsingest.internal.streamer;

import java.math.BigInteger;
import java.util.BitSet;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.tsingest.table.Column;
import org.tsingest.table.ColumnDataType;
import org.tsingest.table.Row;
import org.tsingest.table.RowsBuffer;
import org.tsingest.table.TableSchema;

/**
 * Column-oriented copy of a sealed {@link RowsBuffer}, the form batches take on the wire.
 *
 * <p>Integer, date and time columns are stored as {@code long[]}, floating point columns as {@code double[]}, text columns as
 * {@code String[]}, binary columns as {@code byte[][]} and decimal columns as {@code BigInteger[]}. Nulls are tracked by a bit set
 * per column.
 */
public final class ColumnarBatch {
    private final TableSchema schema;

    private final int rowCount;

    private final Object[] columns;

    private final BitSet[] nulls;

    private final long estimatedSize;

    private ColumnarBatch(TableSchema schema, int rowCount, Object[] columns, BitSet[] nulls, long estimatedSize) {
        this.schema = schema;
        this.rowCount = rowCount;
        this.columns = columns;
        this.nulls = nulls;
        this.estimatedSize = estimatedSize;
    }

    /**
     * Drains a sealed buffer. Text and binary payloads are moved out of the rows, so the rows must not be used afterwards.
     *
     * @param buffer Sealed buffer.
     * @return Batch.
     */
    public static ColumnarBatch drain(RowsBuffer buffer) {
        if (!buffer.isSealed()) {
            throw new IllegalStateException("Buffer must be sealed before it is drained.");
        }

        TableSchema schema = buffer.schema();
        List<Row> rows = buffer.rows();
        int rowCount = rows.size();
        int colCount = schema.columnCount();

        // Every row has been checked against the column count when it was buffered.
        for (Row row : rows) {
            assert row.size() == colCount : "Row size mismatch [expected=" + colCount + ", actual=" + row.size() + ']';
        }

        Object[] columns = new Object[colCount];
        BitSet[] nulls = new BitSet[colCount];

        for (int c = 0; c < colCount; c++) {
            nulls[c] = new BitSet(rowCount);
            columns[c] = drainColumn(schema.column(c), c, rows, nulls[c]);
        }

        return new ColumnarBatch(schema, rowCount, columns, nulls, buffer.estimatedSizeInBytes());
    }

    private static Object drainColumn(Column col, int c, List<Row> rows, BitSet nulls) {
        int n = rows.size();

        switch (col.dataType()) {
            case BOOLEAN: {
                boolean[] res = new boolean[n];

                for (int r = 0; r < n; r++) {
                    Boolean v = rows.get(r).getBoolUnchecked(c);

                    if (v == null) {
                        nulls.set(r);
                    } else {
                        res[r] = v;
                    }
                }

                return res;
            }

            case INT8:
            case INT16:
            case INT32:
            case INT64:
            case UINT8:
            case UINT16:
            case UINT32:
            case UINT64:
            case DATE:
            case DATETIME:
            case TIMESTAMP_SECOND:
            case TIMESTAMP_MILLISECOND:
            case TIMESTAMP_MICROSECOND:
            case TIMESTAMP_NANOSECOND:
            case TIME_SECOND:
            case TIME_MILLISECOND:
            case TIME_MICROSECOND:
            case TIME_NANOSECOND: {
                long[] res = new long[n];

                for (int r = 0; r < n; r++) {
                    Number v = integral(col, rows.get(r), c);

                    if (v == null) {
                        nulls.set(r);
                    } else {
                        res[r] = v.longValue();
                    }
                }

                return res;
            }

            case FLOAT32:
            case FLOAT64: {
                double[] res = new double[n];

                for (int r = 0; r < n; r++) {
                    Row row = rows.get(r);
                    Number v;

                    if (col.dataType() == ColumnDataType.FLOAT32) {
                        v = row.getFloat32Unchecked(c);
                    } else {
                        v = row.getFloat64Unchecked(c);
                    }

                    if (v == null) {
                        nulls.set(r);
                    } else {
                        res[r] = v.doubleValue();
                    }
                }

                return res;
            }

            case BINARY: {
                byte[][] res = new byte[n][];

                for (int r = 0; r < n; r++) {
                    res[r] = rows.get(r).takeBinaryUnchecked(c);

                    if (res[r] == null) {
                        nulls.set(r);
                    }
                }

                return res;
            }

            case STRING:
            case JSON: {
                String[] res = new String[n];
                boolean json = col.dataType() == ColumnDataType.JSON;

                for (int r = 0; r < n; r++) {
                    res[r] = json ? rows.get(r).takeJsonUnchecked(c) : rows.get(r).takeStringUnchecked(c);

                    if (res[r] == null) {
                        nulls.set(r);
                    }
                }

                return res;
            }

            case DECIMAL128: {
                BigInteger[] res = new BigInteger[n];

                for (int r = 0; r < n; r++) {
                    res[r] = rows.get(r).getDecimal128Unchecked(c);

                    if (res[r] == null) {
                        nulls.set(r);
                    }
                }

                return res;
            }

            default:
                throw new IllegalArgumentException("Unsupported column type: " + col.dataType());
        }
    }

    private static @Nullable Number integral(Column col, Row row, int c) {
        switch (col.dataType()) {
            case INT8:
                return row.getInt8Unchecked(c);

            case INT16:
                return row.getInt16Unchecked(c);

            case INT32:
                return row.getInt32Unchecked(c);

            case INT64:
                return row.getInt64Unchecked(c);

            case UINT8:
                return row.getUint8Unchecked(c);

            case UINT16:
                return row.getUint16Unchecked(c);

            case UINT32:
                return row.getUint32Unchecked(c);

            case UINT64:
                return row.getUint64Unchecked(c);

            case DATE:
                return row.getDateUnchecked(c);

            case DATETIME:
                return row.getDatetimeUnchecked(c);

            case TIME_SECOND:
            case TIME_MILLISECOND:
                return row.getTime32Unchecked(c);

            case TIME_MICROSECOND:
            case TIME_NANOSECOND:
                return row.getTime64Unchecked(c);

            default:
                return row.getTimestampUnchecked(c);
        }
    }

    /** Returns schema of the rows. */
    public TableSchema schema() {
        return schema;
    }

    /** Returns number of rows. */
    public int rowCount() {
        return rowCount;
    }

    /** Returns number of columns. */
    public int columnCount() {
        return columns.length;
    }

    /** Returns estimated payload size in bytes. */
    public long estimatedSizeInBytes() {
        return estimatedSize;
    }

    /**
     * Checks whether a cell is null.
     *
     * @param col Column index.
     * @param row Row index.
     * @return {@code true} if null.
     */
    public boolean isNull(int col, int row) {
        return nulls[col].get(row);
    }

    /**
     * Gets a cell of a boolean column.
     *
     * @param col Column index.
     * @param row Row index.
     * @return Value, {@code false} for null.
     */
    public boolean booleanValue(int col, int row) {
        return ((boolean[]) columns[col])[row];
    }

    /**
     * Gets a cell of an integer, date or time column. Unsigned 64-bit values are returned as raw bits.
     *
     * @param col Column index.
     * @param row Row index.
     * @return Value, {@code 0} for null.
     */
    public long longValue(int col, int row) {
        return ((long[]) columns[col])[row];
    }

    /**
     * Gets a cell of a floating point column.
     *
     * @param col Column index.
     * @param row Row index.
     * @return Value, {@code 0} for null.
     */
    public double doubleValue(int col, int row) {
        return ((double[]) columns[col])[row];
    }

    /**
     * Gets a cell of a string or JSON column.
     *
     * @param col Column index.
     * @param row Row index.
     * @return Value or {@code null}.
     */
    public @Nullable String stringValue(int col, int row) {
        return ((String[]) columns[col])[row];
    }

    /**
     * Gets a cell of a binary column.
     *
     * @param col Column index.
     * @param row Row index.
     * @return Value or {@code null}.
     */
    public byte @Nullable [] bytesValue(int col, int row) {
        return ((byte[][]) columns[col])[row];
    }

    /**
     * Gets a cell of a decimal column.
     *
     * @param col Column index.
     * @param row Row index.
     * @return Unscaled value or {@code null}.
     */
    public @Nullable BigInteger decimalValue(int col, int row) {
        return ((BigInteger[]) columns[col])[row];
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "ColumnarBatch [table=" + schema.name() + ", rows=" + rowCount + ", columns=" + columns.length + ']';
    }
}
