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

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Column of a {@link TableSchema}. Immutable.
 */
public final class Column {
    private final String name;

    private final ColumnDataType dataType;

    private final SemanticType semanticType;

    private final boolean nullable;

    private final @Nullable DataTypeExtension extension;

    /**
     * Constructor.
     *
     * @param name Column name.
     * @param dataType Value type.
     * @param semanticType Role of the column.
     * @param nullable Whether the column accepts nulls.
     * @param extension Extended type parameters, {@code null} if the type has none.
     */
    public Column(
            String name,
            ColumnDataType dataType,
            SemanticType semanticType,
            boolean nullable,
            @Nullable DataTypeExtension extension
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        this.semanticType = Objects.requireNonNull(semanticType, "semanticType");
        this.nullable = nullable;
        this.extension = extension;
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

    /** Returns {@code true} if the column accepts nulls. */
    public boolean nullable() {
        return nullable;
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

        Column column = (Column) o;

        return nullable == column.nullable
                && name.equals(column.name)
                && dataType == column.dataType
                && semanticType == column.semanticType
                && Objects.equals(extension, column.extension);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return Objects.hash(name, dataType, semanticType, nullable, extension);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "Column [name=" + name + ", type=" + dataType + ", semanticType=" + semanticType + ", nullable=" + nullable
                + (extension != null ? ", extension=" + extension : "") + ']';
    }
}
