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

import static org.tsingest.lang.ErrorGroups.Common.INTERNAL_ERR;
import static org.tsingest.lang.ErrorGroups.Provider.PROVIDER_CLOSE_ERR;
import static org.tsingest.lang.ErrorGroups.Provider.PROVIDER_INIT_ERR;
import static org.tsingest.lang.ErrorGroups.Streamer.INSERT_ERR;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.tsingest.client.Database;
import org.tsingest.client.RowInsertRequest;
import org.tsingest.client.WireColumnSchema;
import org.tsingest.client.WireRow;
import org.tsingest.client.WriteResponse;
import org.tsingest.internal.logger.IngestLogger;
import org.tsingest.internal.logger.Loggers;
import org.tsingest.internal.util.ExceptionUtils;
import org.tsingest.internal.util.MonotonicClock;
import org.tsingest.lang.IngestException;
import org.tsingest.provider.WireDataProvider;
import org.tsingest.table.RowsBuffer;

/**
 * Inserts the rows of a {@link WireDataProvider} with one synchronous {@link Database#insert(List)} call per batch.
 * Stops at the first failed insert.
 */
public class WireRowInserter {
    private final int batchSize;

    private final IngestLogger log;

    /**
     * Constructor.
     *
     * @param batchSize Number of rows per insert, zero to insert nothing.
     */
    public WireRowInserter(int batchSize) {
        this(batchSize, Loggers.forClass(WireRowInserter.class));
    }

    /**
     * Constructor.
     *
     * @param batchSize Number of rows per insert, zero to insert nothing.
     * @param log Logger.
     */
    public WireRowInserter(int batchSize, IngestLogger log) {
        if (batchSize < 0) {
            throw new IllegalArgumentException("Batch size must not be negative: " + batchSize);
        }

        this.batchSize = batchSize;
        this.log = log;
    }

    /**
     * Inserts every row of the provider. The provider is initialized and closed by this call.
     *
     * @param provider Wire row source.
     * @param database Target database.
     * @return Result; acknowledgements carry the batch number as request id.
     */
    public StreamingResult run(WireDataProvider provider, Database database) {
        long startTs = MonotonicClock.millis();
        List<StreamingState> states = new ArrayList<>();
        List<WriteResponse> responses = new ArrayList<>();
        LongList latencies = new LongArrayList();
        long rows = 0;
        long affected = 0;

        try {
            try {
                provider.init();
            } catch (Exception e) {
                throw ExceptionUtils.withCauseAndCode(PROVIDER_INIT_ERR, "Failed to initialize data provider.", e);
            }

            List<WireColumnSchema> schema = provider.wireSchema();
            Iterator<WireRow> it = provider.wireRows();

            while (true) {
                states.add(StreamingState.FILLING);

                if (batchSize == 0) {
                    break;
                }

                List<WireRow> batch = new ArrayList<>(Math.min(batchSize, RowsBuffer.MAX_RESERVED_ROWS));

                while (batch.size() < batchSize && it.hasNext()) {
                    batch.add(it.next());
                }

                if (batch.isEmpty()) {
                    break;
                }

                states.add(StreamingState.SUBMITTING);

                long batchNo = responses.size() + 1;
                long batchStart = MonotonicClock.millis();
                long res;

                try {
                    res = database.insert(List.of(new RowInsertRequest(provider.tableName(), schema, batch)));
                } catch (Exception e) {
                    throw ExceptionUtils.withCauseAndCode(INSERT_ERR, "Failed to insert batch " + batchNo, e);
                }

                long latency = MonotonicClock.millis() - batchStart;

                latencies.add(latency);
                responses.add(new WriteResponse(batchNo, res));
                rows += batch.size();
                affected += res;

                log.debug("Batch {} inserted [rows={}, affectedRows={}, latencyMs={}]", batchNo, batch.size(), res, latency);

                if (batch.size() < batchSize) {
                    break;
                }
            }

            try {
                provider.close();
            } catch (Exception e) {
                throw ExceptionUtils.withCauseAndCode(PROVIDER_CLOSE_ERR, "Failed to close data provider.", e);
            }
        } catch (RuntimeException e) {
            IngestException err = e instanceof IngestException
                    ? (IngestException) e
                    : new IngestException(INTERNAL_ERR, "Unexpected insertion failure.", e);

            states.add(StreamingState.ERRORED);

            log.error("Insertion failed [table={}, rows={}, batches={}]", err, provider.tableName(), rows, responses.size());

            if (err.code() != PROVIDER_CLOSE_ERR) {
                try {
                    provider.close();
                } catch (Exception closeErr) {
                    err.addSuppressed(closeErr);
                }
            }

            return new StreamingResult(states, rows, responses.size(), responses, affected, MonotonicClock.millis() - startTs,
                    average(latencies), err);
        }

        states.add(StreamingState.FINISHED);

        StreamingResult res = new StreamingResult(states, rows, responses.size(), responses, affected,
                MonotonicClock.millis() - startTs, average(latencies), null);

        log.info("Insertion finished [table={}, rows={}, batches={}, avgLatencyMs={}]", provider.tableName(), rows, responses.size(),
                res.avgBatchLatencyMs());

        return res;
    }

    private static double average(LongList latencies) {
        return latencies.longStream().average().orElse(0);
    }
}
