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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.tsingest.internal.streamer.StreamingState.ERRORED;
import static org.tsingest.internal.streamer.StreamingState.FILLING;
import static org.tsingest.internal.streamer.StreamingState.FINISHED;
import static org.tsingest.internal.streamer.StreamingState.SUBMITTING;
import static org.tsingest.lang.ErrorGroups.Streamer.INSERT_ERR;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.tsingest.client.Database;
import org.tsingest.client.RowInsertRequest;
import org.tsingest.client.WireColumnSchema;
import org.tsingest.client.WireRow;
import org.tsingest.internal.testframework.BaseIngestTest;
import org.tsingest.provider.WireDataProvider;
import org.tsingest.table.Row;

class WireRowInserterTest extends BaseIngestTest {
    private static WireDataProvider provider(long rowCount) {
        var rows = new TestTableDataProvider(rowCount);

        return new WireDataProvider() {
            @Override
            public long rowCount() {
                return rowCount;
            }

            @Override
            public String tableName() {
                return rows.tableSchema().name();
            }

            @Override
            public List<WireColumnSchema> wireSchema() {
                return WireColumnSchema.fromTableSchema(rows.tableSchema());
            }

            @Override
            public Iterator<WireRow> wireRows() {
                Iterator<Row> it = rows.rows();

                return new Iterator<>() {
                    @Override
                    public boolean hasNext() {
                        return it.hasNext();
                    }

                    @Override
                    public WireRow next() {
                        return WireRow.of(it.next().values());
                    }
                };
            }
        };
    }

    @Test
    void insertsOneRequestPerBatch() {
        Database db = mock(Database.class);
        List<Integer> sizes = new ArrayList<>();

        when(db.insert(anyList())).thenAnswer(inv -> {
            List<RowInsertRequest> reqs = inv.getArgument(0);

            assertThat(reqs.get(0).tableName(), is("cpu"));
            assertThat(reqs.get(0).schema().size(), is(3));

            sizes.add(reqs.get(0).rows().size());

            return (long) reqs.get(0).rows().size();
        });

        StreamingResult res = new WireRowInserter(100).run(provider(250), db);

        assertThat(res.state(), is(FINISHED));
        assertThat(sizes, contains(100, 100, 50));
        assertThat(res.batches(), is(3L));
        assertThat(res.affectedRows(), is(250L));
        assertThat(res.states(), contains(FILLING, SUBMITTING, FILLING, SUBMITTING, FILLING, SUBMITTING, FINISHED));
        verify(db, times(3)).insert(anyList());
    }

    @Test
    void firstFailedInsertStopsRun() {
        Database db = mock(Database.class);

        when(db.insert(anyList()))
                .thenReturn(100L)
                .thenThrow(new IllegalStateException("Table is read only"));

        StreamingResult res = new WireRowInserter(100).run(provider(250), db);

        assertThat(res.state(), is(ERRORED));
        assertThat(res.error().code(), is(INSERT_ERR));
        assertThat(res.error().getMessage(), containsString("Failed to insert batch 2"));
        assertThat(res.affectedRows(), is(100L));
        verify(db, times(2)).insert(anyList());
    }

    @Test
    void unboundedBatchSizeInsertsEverythingAtOnce() {
        Database db = mock(Database.class);
        List<Integer> sizes = new ArrayList<>();

        when(db.insert(anyList())).thenAnswer(inv -> {
            List<RowInsertRequest> reqs = inv.getArgument(0);

            sizes.add(reqs.get(0).rows().size());

            return (long) reqs.get(0).rows().size();
        });

        StreamingResult res = new WireRowInserter(Integer.MAX_VALUE).run(provider(250), db);

        assertThat(res.state(), is(FINISHED));
        assertThat(sizes, contains(250));
        assertThat(res.affectedRows(), is(250L));
    }

    @Test
    void zeroBatchSizeInsertsNothing() {
        Database db = mock(Database.class);

        StreamingResult res = new WireRowInserter(0).run(provider(250), db);

        assertThat(res.states(), contains(FILLING, FINISHED));
        assertThat(res.responses(), is(empty()));
        verify(db, never()).insert(anyList());
    }
}
