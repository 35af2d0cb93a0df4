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

package org.tsingest.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import org.tsingest.table.Column;
import org.tsingest.table.ColumnDataType;
import org.tsingest.table.DataTypeExtension;
import org.tsingest.table.SemanticType;
import org.tsingest.table.TableSchema;

/**
 * Column description sent along with row insert requests.
 */
public final class WireColumnSchema {
    private final String name;

    private final ColumnDataType dataType;

    private final SemanticType semanticType;

    private final @Nullable DataTypeExtension extension;

    /**
     * Constructor.
     *
     * @param name Column name.
     * @param dataType Value type.
     * @param semanticType Role of the column.
     * @param extension Extended type parameters or {@code null}.
     */
    public WireColumnSchema(String name, ColumnDataType dataType, SemanticType semanticType, @Nullable DataTypeExtension extension) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        this.semanticType = Objects.requireNonNull(semanticType, "semanticType");
        this.extension = extension;
    }

    /**
     * Converts a table schema into the wire column list.
     *
     * @param schema Table schema.
     * @return Column descriptions in schema order.
     */
    public static List<WireColumnSchema> fromTableSchema(TableSchema schema) {
        List<WireColumnSchema> res = new ArrayList<>(schema.columnCount());

        for (Column col : schema.columns()) {
            res.add(new WireColumnSchema(col.name(), col.dataType(), col.semanticType(), col.extension()));
        }

        return res;
    }

    /** Returns column name. */
    public String name() {
        return name;
    }

    /** Returns value type. */
    public ColumnDataType dataType() {
        return dataType;
    }

    /** Returns role of the column. */
    public SemanticType semanticType() {
        return semanticType;
    }

    /** Returns extended type parameters or {@code null}. */
    public @Nullable DataTypeExtension extension() {
        return extension;
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

        WireColumnSchema that = (WireColumnSchema) o;

        return name.equals(that.name) && dataType == that.dataType && semanticType == that.semanticType
                && Objects.equals(extension, that.extension);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return Objects.hash(name, dataType, semanticType, extension);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "WireColumnSchema [name=" + name + ", type=" + dataType + ", semanticType=" + semanticType + ']';
    }
}
