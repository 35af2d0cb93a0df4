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

package org.tsingest.benchmark;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.oneOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;
import org.tsingest.client.WireRow;
import org.tsingest.internal.testframework.BaseIngestTest;
import org.tsingest.table.ColumnDataType;
import org.tsingest.table.Row;
import org.tsingest.table.SemanticType;
import org.tsingest.table.TableSchema;
import org.tsingest.table.Value;

class LogTableDataProviderTest extends BaseIngestTest {
    private static final long BASE_TIME = 1_700_000_000_000L;

    private static LogTableDataProvider provider(long rows) {
        var provider = new LogTableDataProvider("logs", rows, BASE_TIME, 42L);

        provider.init();

        return provider;
    }

    @Test
    void schemaHasTimeIndexAndTwentyOneFields() {
        TableSchema schema = provider(0).tableSchema();

        assertEquals("logs", schema.name());
        assertEquals(22, schema.columnCount());
        assertEquals("ts", schema.timestampColumn().name());
        assertEquals(ColumnDataType.TIMESTAMP_MILLISECOND, schema.column(0).dataType());
        assertEquals(ColumnDataType.INT64, schema.column(19).dataType());
        assertEquals("response_time_ms", schema.column(19).name());

        for (int i = 1; i < schema.columnCount(); i++) {
            assertEquals(SemanticType.FIELD, schema.column(i).semanticType());
            assertFalse(schema.column(i).nullable());
        }

        schema.validate();
    }

    @Test
    void yieldsExactlyRowCountRows() {
        Iterator<Row> it = provider(7).rows();

        int n = 0;

        while (it.hasNext()) {
            assertEquals(22, it.next().size());

            n++;
        }

        assertEquals(7, n);
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void emptyProviderYieldsNothing() {
        LogTableDataProvider provider = provider(0);

        assertFalse(provider.rows().hasNext());
        assertFalse(provider.wireRows().hasNext());
    }

    @Test
    void alternatingPullsYieldSameContent() {
        LogTableDataProvider provider = provider(20);

        Iterator<Row> rows = provider.rows();
        Iterator<WireRow> wireRows = provider.wireRows();

        List<List<Value>> fromRows = new ArrayList<>();
        List<List<Value>> fromWire = new ArrayList<>();

        // Pull 3 rows from one sequence for every 2 from the other.
        while (rows.hasNext() || wireRows.hasNext()) {
            for (int i = 0; i < 3 && rows.hasNext(); i++) {
                fromRows.add(rows.next().values());
            }

            for (int i = 0; i < 2 && wireRows.hasNext(); i++) {
                fromWire.add(wireRows.next().values());
            }
        }

        assertEquals(20, fromRows.size());
        assertEquals(fromRows, fromWire);
    }

    @Test
    void sameSeedGivesSameRows() {
        Iterator<Row> a = provider(5).rows();
        Iterator<Row> b = provider(5).rows();

        while (a.hasNext()) {
            assertEquals(a.next(), b.next());
        }

        assertFalse(b.hasNext());
    }

    @Test
    void rowValuesFollowGenerationRules() {
        Row row = provider(3).rows().next();

        long ts = row.getTimestamp(0);

        assertTrue(ts >= BASE_TIME - 1000 && ts < BASE_TIME + 1000, "ts=" + ts);
        assertEquals(LogTableDataProvider.MESSAGE_LEN, row.getString(2).length());
        assertThat(row.getString(3), is(oneOf("DEBUG", "INFO", "WARN", "ERROR")));
        assertEquals(1L, row.getInt64(19));
        assertThat(List.of(row.getString(20), row.getString(21)), contains("application", "v1.0.0"));
    }

    @Test
    void pullingBeforeInitFails() {
        var provider = new LogTableDataProvider("logs", 1, BASE_TIME, 1L);

        assertThrows(IllegalStateException.class, () -> provider.rows().next());
    }

    @Test
    void negativeRowCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LogTableDataProvider("logs", -1));
    }
}
