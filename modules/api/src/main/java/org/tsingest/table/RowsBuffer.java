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

import static org.tsingest.lang.ErrorGroups.Table.ROW_SHAPE_ERR;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.tsingest.lang.IngestException;

/**
 * Accumulator of rows that form one write request. Storage is reserved for the expected number of rows up front; the capacity is a
 * hint, not a limit, so adding more rows only grows the storage.
 *
 * <p>A buffer is filled by one owner and then {@link #seal() sealed}, which hands the rows over to the transport. A sealed buffer
 * accepts no more rows, and the former owner must not touch the rows it added.
 */
public final class RowsBuffer {
    /** Upper bound of the storage reserved up front for a batch, whatever its requested capacity. */
    public static final int MAX_RESERVED_ROWS = 1 << 20;

    private final TableSchema schema;

    private final int rowCapacity;

    private final int avgValueSizeHint;

    private final ArrayList<Row> rows;

    private long estimatedSize;

    private boolean sealed;

    private RowsBuffer(TableSchema schema, int rowCapacity, int avgValueSizeHint) {
        this.schema = schema;
        this.rowCapacity = rowCapacity;
        this.avgValueSizeHint = avgValueSizeHint;
        this.rows = new ArrayList<>(Math.min(rowCapacity, MAX_RESERVED_ROWS));
    }

    /**
     * Allocates a buffer.
     *
     * @param schema Schema of the rows.
     * @param rowCapacity Expected number of rows.
     * @param avgValueSizeHint Expected average size of a value in bytes.
     * @return Empty buffer.
     */
    public static RowsBuffer allocate(TableSchema schema, int rowCapacity, int avgValueSizeHint) {
        Objects.requireNonNull(schema, "schema");

        if (rowCapacity < 0) {
            throw new IllegalArgumentException("Row capacity must not be negative: " + rowCapacity);
        }

        if (avgValueSizeHint < 0) {
            throw new IllegalArgumentException("Value size hint must not be negative: " + avgValueSizeHint);
        }

        return new RowsBuffer(schema, rowCapacity, avgValueSizeHint);
    }

    /**
     * Appends a row. The buffer takes ownership of the row.
     *
     * @param row Row whose values follow the schema column order.
     * @throws IllegalStateException If the buffer is sealed.
     * @throws IngestException With {@code ROW_SHAPE_ERR} if the number of values differs from the number of columns.
     */
    public void addRow(Row row) {
        if (sealed) {
            throw new IllegalStateException("Buffer is sealed, can't add rows.");
        }

        if (row.size() != schema.columnCount()) {
            throw new IngestException(ROW_SHAPE_ERR, "Row does not match the table schema [table=" + schema.name()
                    + ", expectedColumns=" + schema.columnCount() + ", actualValues=" + row.size() + ']');
        }

        rows.add(row);

        for (int i = 0; i < row.size(); i++) {
            estimatedSize += row.value(i).estimatedSize();
        }
    }

    /**
     * Seals the buffer.
     *
     * @return This buffer.
     */
    public RowsBuffer seal() {
        sealed = true;

        return this;
    }

    /** Returns {@code true} if the buffer has been sealed. */
    public boolean isSealed() {
        return sealed;
    }

    /** Returns schema of the rows. */
    public TableSchema schema() {
        return schema;
    }

    /** Returns unmodifiable view of the rows in insertion order. */
    public List<Row> rows() {
        return Collections.unmodifiableList(rows);
    }

    /** Returns number of rows. */
    public int size() {
        return rows.size();
    }

    /** Returns {@code true} if the buffer has no rows. */
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Returns expected number of rows given on allocation. */
    public int rowCapacity() {
        return rowCapacity;
    }

    /** Returns size of the buffer in bytes expected on allocation. */
    public long reservedSizeInBytes() {
        return (long) rowCapacity * schema.columnCount() * avgValueSizeHint;
    }

    /** Returns estimated payload size of the added rows in bytes. */
    public long estimatedSizeInBytes() {
        return estimatedSize;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "RowsBuffer [table=" + schema.name() + ", rows=" + rows.size() + ", capacity=" + rowCapacity + ", sealed=" + sealed + ']';
    }
}
