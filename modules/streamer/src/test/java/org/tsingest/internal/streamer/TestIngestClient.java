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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.tsingest.client.BulkStreamWriter;
import org.tsingest.client.BulkWriteOptions;
import org.tsingest.client.Database;
import org.tsingest.client.IngestClient;
import org.tsingest.internal.logger.Loggers;
import org.tsingest.table.TableSchema;

/**
 * Client whose writers send through a {@link RecordingBatchSender}.
 */
class TestIngestClient implements IngestClient {
    final RecordingBatchSender sender;

    final List<DefaultBulkStreamWriter> writers = new CopyOnWriteArrayList<>();

    TestIngestClient(RecordingBatchSender sender) {
        this.sender = sender;
    }

    @Override
    public String endpoint() {
        return "test:0";
    }

    @Override
    public BulkStreamWriter createBulkStreamWriter(String database, TableSchema schema, BulkWriteOptions options) {
        var writer = new DefaultBulkStreamWriter(schema, options, sender, Loggers.forClass(DefaultBulkStreamWriter.class), null);

        writers.add(writer);

        return writer;
    }

    @Override
    public Database database(String name) {
        throw new UnsupportedOperationException();
    }

    @Override
    public void close() {
        // No-op.
    }
}
