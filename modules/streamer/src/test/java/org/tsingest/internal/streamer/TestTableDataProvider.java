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

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.Nullable;
import org.tsingest.provider.TableDataProvider;
import org.tsingest.table.ColumnDataType;
import org.tsingest.table.Row;
import org.tsingest.table.TableSchema;
import org.tsingest.table.Value;

/**
 * Provider of {@code cpu} rows: time index, host tag and usage field.
 */
class TestTableDataProvider implements TableDataProvider {
    static final TableSchema SCHEMA = TableSchema.builder()
            .name("cpu")
            .addTimestamp("ts", ColumnDataType.TIMESTAMP_MILLISECOND)
            .addTag("host", ColumnDataType.STRING, false)
            .addField("usage", ColumnDataType.FLOAT64, true)
            .build();

    private final long rowCount;

    private @Nullable RuntimeException initError;

    private @Nullable RuntimeException closeError;

    int initCalls;

    int closeCalls;

    long pulled;

    TestTableDataProvider(long rowCount) {
        this.rowCount = rowCount;
    }

    TestTableDataProvider failOnInit(RuntimeException e) {
        initError = e;

        return this;
    }

    TestTableDataProvider failOnClose(RuntimeException e) {
        closeError = e;

        return this;
    }

    static Row row(long i) {
        return Row.of(
                Value.timestampMillisecond(1_700_000_000_000L + i),
                Value.string("host-" + (i % 3)),
                i % 10 == 0 ? Value.nullValue() : Value.float64(i / 10.0)
        );
    }

    @Override
    public void init() {
        initCalls++;

        if (initError != null) {
            throw initError;
        }
    }

    @Override
    public long rowCount() {
        return rowCount;
    }

    @Override
    public TableSchema tableSchema() {
        return SCHEMA;
    }

    @Override
    public Iterator<Row> rows() {
        return new Iterator<>() {
            private long next;

            @Override
            public boolean hasNext() {
                return next < rowCount;
            }

            @Override
            public Row next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }

                pulled++;

                return row(next++);
            }
        };
    }

    @Override
    public void close() {
        closeCalls++;

        if (closeError != null) {
            throw closeError;
        }
    }
}
