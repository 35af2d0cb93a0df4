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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.tsingest.client.BulkStreamWriter;
import org.tsingest.client.BulkWriteOptions;
import org.tsingest.client.Database;
import org.tsingest.client.IngestClient;
import org.tsingest.client.RowInsertRequest;
import org.tsingest.internal.logger.IngestLogger;
import org.tsingest.internal.logger.Loggers;
import org.tsingest.internal.streamer.BulkBatchSender;
import org.tsingest.internal.streamer.DefaultBulkStreamWriter;
import org.tsingest.internal.thread.NamedThreadFactory;
import org.tsingest.table.TableSchema;

/**
 * In-process client that acknowledges every write without a store. Bulk writes are acknowledged asynchronously by a small pool, so
 * the benchmarks measure the client side of the pipeline: row generation, buffering, columnar conversion and flow control.
 */
class LoopbackIngestClient implements IngestClient {
    private static final IngestLogger LOG = Loggers.forClass(LoopbackIngestClient.class);

    private final String endpoint;

    private final ExecutorService ackExecutor;

    /** Rows acknowledged by bulk writers. */
    private final AtomicLong bulkRows = new AtomicLong();

    /** Rows accepted by regular inserts. */
    private final AtomicLong insertedRows = new AtomicLong();

    LoopbackIngestClient(String endpoint) {
        this.endpoint = endpoint;
        this.ackExecutor = Executors.newFixedThreadPool(
                2,
                new NamedThreadFactory(NamedThreadFactory.threadPrefix("loopback", "ack"), true, LOG)
        );
    }

    /** {@inheritDoc} */
    @Override
    public String endpoint() {
        return endpoint;
    }

    /** {@inheritDoc} */
    @Override
    public BulkStreamWriter createBulkStreamWriter(String database, TableSchema schema, BulkWriteOptions options) {
        LOG.info("Creating loopback bulk writer [database={}, table={}, options={}]", database, schema.name(), options);

        BulkBatchSender sender = (requestId, batch, compression) -> CompletableFuture.supplyAsync(() -> {
            long rows = batch.rowCount();

            bulkRows.addAndGet(rows);

            return rows;
        }, ackExecutor);

        return new DefaultBulkStreamWriter(schema, options, sender, Loggers.forClass(DefaultBulkStreamWriter.class), null);
    }

    /** {@inheritDoc} */
    @Override
    public Database database(String name) {
        return new Database() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public long insert(List<RowInsertRequest> requests) {
                long rows = 0;

                for (RowInsertRequest req : requests) {
                    rows += req.rows().size();
                }

                insertedRows.addAndGet(rows);

                return rows;
            }
        };
    }

    long bulkRows() {
        return bulkRows.get();
    }

    long insertedRows() {
        return insertedRows.get();
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
        ackExecutor.shutdown();

        try {
            if (!ackExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Acknowledgement pool did not stop in time, interrupting [endpoint={}]", endpoint);

                ackExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();

            ackExecutor.shutdownNow();
        }

        LOG.info("Loopback client closed [endpoint={}, bulkRows={}, insertedRows={}]", endpoint, bulkRows.get(), insertedRows.get());
    }
}
