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

import static org.tsingest.lang.ErrorGroups.Table.TABLE_DEFINITION_ERR;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.tsingest.lang.IngestException;

/**
 * Name and ordered column list of a target table. Built once through {@link #builder()} and then shared, read-only, by every row
 * produced for the table.
 *
 * <p>The builder does not validate the column set: duplicate names or a missing time index are left for the store to reject.
 * {@link #validate()} performs these checks on demand.
 */
public final class TableSchema {
    private final String name;

    private final List<Column> columns;

    private TableSchema(String name, List<Column> columns) {
        this.name = name;
        this.columns = Collections.unmodifiableList(columns);
    }

    /**
     * Starts an empty schema accumulator.
     *
     * @return Builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns table name. */
    public String name() {
        return name;
    }

    /** Returns unmodifiable list of columns in schema order. */
    public List<Column> columns() {
        return columns;
    }

    /** Returns number of columns. */
    public int columnCount() {
        return columns.size();
    }

    /**
     * Returns column at the given position.
     *
     * @param idx Column index.
     * @return Column.
     */
    public Column column(int idx) {
        return columns.get(idx);
    }

    /**
     * Returns the time index column.
     *
     * @return First column with the {@link SemanticType#TIMESTAMP} role or {@code null} if there is none.
     */
    public @Nullable Column timestampColumn() {
        for (Column col : columns) {
            if (col.semanticType() == SemanticType.TIMESTAMP) {
                return col;
            }
        }

        return null;
    }

    /**
     * Checks that column names are unique, that there is at most one time index column, and that the time index has a timestamp
     * type and is not nullable.
     *
     * @return This schema.
     * @throws IngestException With {@code TABLE_DEFINITION_ERR} if a check fails.
     */
    public TableSchema validate() {
        Set<String> names = new HashSet<>();
        int timestamps = 0;

        for (Column col : columns) {
            if (!names.add(col.name())) {
                throw new IngestException(TABLE_DEFINITION_ERR, "Duplicate column name [table=" + name + ", column=" + col.name() + ']');
            }

            if (col.semanticType() == SemanticType.TIMESTAMP) {
                timestamps++;

                if (!col.dataType().isTimestamp()) {
                    throw new IngestException(TABLE_DEFINITION_ERR,
                            "Time index column must have a timestamp type [table=" + name + ", column=" + col.name()
                                    + ", type=" + col.dataType() + ']');
                }

                if (col.nullable()) {
                    throw new IngestException(TABLE_DEFINITION_ERR,
                            "Time index column must not be nullable [table=" + name + ", column=" + col.name() + ']');
                }
            }
        }

        if (timestamps > 1) {
            throw new IngestException(TABLE_DEFINITION_ERR,
                    "Table must have at most one time index column [table=" + name + ", count=" + timestamps + ']');
        }

        return this;
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

        TableSchema that = (TableSchema) o;

        return name.equals(that.name) && columns.equals(that.columns);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return Objects.hash(name, columns);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "TableSchema [name=" + name + ", columns=" + columns + ']';
    }

    /**
     * Fluent accumulator of columns.
     */
    public static final class Builder {
        private @Nullable String name;

        private final List<Column> columns = new ArrayList<>();

        private Builder() {
        }

        /**
         * Sets table name.
         *
         * @param name Table name.
         * @return This builder.
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");

            return this;
        }

        /**
         * Appends a tag column.
         *
         * @param name Column name.
         * @param dataType Value type.
         * @param nullable Whether the column accepts nulls.
         * @return This builder.
         */
        public Builder addTag(String name, ColumnDataType dataType, boolean nullable) {
            columns.add(new Column(name, dataType, SemanticType.TAG, nullable, null));

            return this;
        }

        /**
         * Appends the time index column. The column is never nullable.
         *
         * @param name Column name.
         * @param dataType Value type, normally one of the timestamp types.
         * @return This builder.
         */
        public Builder addTimestamp(String name, ColumnDataType dataType) {
            columns.add(new Column(name, dataType, SemanticType.TIMESTAMP, false, null));

            return this;
        }

        /**
         * Appends a field column.
         *
         * @param name Column name.
         * @param dataType Value type.
         * @param nullable Whether the column accepts nulls.
         * @return This builder.
         */
        public Builder addField(String name, ColumnDataType dataType, boolean nullable) {
            columns.add(new Column(name, dataType, SemanticType.FIELD, nullable, null));

            return this;
        }

        /**
         * Appends a decimal field column.
         *
         * @param name Column name.
         * @param precision Total number of digits.
         * @param scale Number of digits after the decimal point.
         * @param nullable Whether the column accepts nulls.
         * @return This builder.
         */
        public Builder addDecimal128Field(String name, int precision, int scale, boolean nullable) {
            columns.add(new Column(name, ColumnDataType.DECIMAL128, SemanticType.FIELD, nullable,
                    DataTypeExtension.decimal128(precision, scale)));

            return this;
        }

        /**
         * Builds an immutable schema.
         *
         * @return Table schema.
         * @throws IllegalStateException If the table name has not been set.
         */
        public TableSchema build() {
            if (name == null) {
                throw new IllegalStateException("Table name is not set");
            }

            return new TableSchema(name, new ArrayList<>(columns));
        }
    }
}
