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

import java.util.List;
import java.util.Objects;

/**
 * Rows of one table inserted by one {@link Database#insert(List)} call.
 */
public final class RowInsertRequest {
    private final String tableName;

    private final List<WireColumnSchema> schema;

    private final List<WireRow> rows;

    /**
     * Constructor.
     *
     * @param tableName Table name.
     * @param schema Column descriptions.
     * @param rows Rows.
     */
    public RowInsertRequest(String tableName, List<WireColumnSchema> schema, List<WireRow> rows) {
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.schema = List.copyOf(schema);
        this.rows = List.copyOf(rows);
    }

    /** Returns table name. */
    public String tableName() {
        return tableName;
    }

    /** Returns column descriptions. */
    public List<WireColumnSchema> schema() {
        return schema;
    }

    /** Returns rows. */
    public List<WireRow> rows() {
        return rows;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "RowInsertRequest [table=" + tableName + ", columns=" + schema.size() + ", rows=" + rows.size() + ']';
    }
}
