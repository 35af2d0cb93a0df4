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

import static org.tsingest.lang.ErrorGroups.Client.WRITER_SETUP_ERR;
import static org.tsingest.lang.ErrorGroups.Common.INTERNAL_ERR;
import static org.tsingest.lang.ErrorGroups.Provider.PROVIDER_CLOSE_ERR;
import static org.tsingest.lang.ErrorGroups.Provider.PROVIDER_INIT_ERR;
import static org.tsingest.lang.ErrorGroups.Streamer.DRAIN_ERR;
import static org.tsingest.lang.ErrorGroups.Streamer.SUBMIT_ERR;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.jetbrains.annotations.Nullable;
import org.tsingest.client.BulkStreamWriter;
import org.tsingest.client.BulkWriteException;
import org.tsingest.client.IngestClient;
import org.tsingest.client.WriteResponse;
import org.tsingest.internal.logger.IngestLogger;
import org.tsingest.internal.logger.Loggers;
import org.tsingest.internal.util.ExceptionUtils;
import org.tsingest.internal.util.MonotonicClock;
import org.tsingest.lang.IngestException;
import org.tsingest.provider.TableDataProvider;
import org.tsingest.table.Row;
import org.tsingest.table.RowsBuffer;

/**
 * Streams the rows of a {@link TableDataProvider} to the store in batches.
 *
 * <p>A run goes through {@link StreamingState#FILLING} and {@link StreamingState#SUBMITTING} for every batch, then
 * {@link StreamingState#DRAINING} and {@link StreamingState#FINISHED}. Any failure ends the run in {@link StreamingState#ERRORED}:
 * there are no retries and failures are reported in the {@link StreamingResult} instead of being thrown.
 *
 * <p>Submissions never wait for acknowledgements, only for a free write slot of the writer. Completed acknowledgements are collected
 * every {@link StreamerOptions#reconcileEvery()} batches and the rest when draining. A failed write halts the run before the next
 * batch is filled.
 *
 * <p>Not thread-safe: one engine drives one run at a time.
 */
public class BulkStreamingEngine {
    private final StreamerOptions options;

    private final IngestLogger log;

    private final StreamerMetricSink metrics;

    /**
     * Constructor.
     *
     * @param options Options.
     */
    public BulkStreamingEngine(StreamerOptions options) {
        this(options, Loggers.forClass(BulkStreamingEngine.class), null);
    }

    /**
     * Constructor.
     *
     * @param options Options.
     * @param log Logger.
     * @param metrics Metrics or {@code null}.
     */
    public BulkStreamingEngine(StreamerOptions options, IngestLogger log, @Nullable StreamerMetricSink metrics) {
        assert options != null;
        assert log != null;

        this.options = options;
        this.log = log;
        this.metrics = metrics != null ? metrics : StreamerMetricSink.NO_OP;
    }

    /** Returns engine options. */
    public StreamerOptions options() {
        return options;
    }

    /**
     * Runs the pipeline to completion or to the first error. The provider is closed in both cases.
     *
     * @param provider Row source, not initialized yet.
     * @param client Client.
     * @param database Database name.
     * @return Result.
     */
    public StreamingResult run(TableDataProvider provider, IngestClient client, String database) {
        return new Run(provider, client, database).execute();
    }

    /** State of one run. */
    private class Run {
        private final TableDataProvider provider;

        private final IngestClient client;

        private final String database;

        private final List<StreamingState> states = new ArrayList<>();

        private final List<WriteResponse> responses = new ArrayList<>();

        private final LongList latencies = LongLists.synchronize(new LongArrayList());

        /** First failed write, observed asynchronously. */
        private final AtomicReference<IngestException> writeFailure = new AtomicReference<>();

        /** Completion callbacks of submitted writes that may still be running. */
        private final List<CompletableFuture<?>> callbacks = new ArrayList<>();

        private final long startTs = MonotonicClock.millis();

        private @Nullable BulkStreamWriter writer;

        private long rowsWritten;

        private long batches;

        Run(TableDataProvider provider, IngestClient client, String database) {
            this.provider = provider;
            this.client = client;
            this.database = database;
        }

        StreamingResult execute() {
            try {
                init();

                stream();

                drain();

                closeProvider();
            } catch (IngestException e) {
                return fail(e);
            } catch (RuntimeException e) {
                return fail(new IngestException(INTERNAL_ERR, "Unexpected streaming failure.", e));
            }

            transition(StreamingState.FINISHED);

            StreamingResult res = result(null);

            log.info("Streaming finished [table={}, rows={}, batches={}, affectedRows={}, elapsedMs={}]",
                    provider.tableSchema().name(), res.rowsWritten(), res.batches(), res.affectedRows(), res.elapsedMs());

            return res;
        }

        private void init() {
            try {
                provider.init();
            } catch (Exception e) {
                throw ExceptionUtils.withCauseAndCode(PROVIDER_INIT_ERR, "Failed to initialize data provider.", e);
            }

            try {
                writer = client.createBulkStreamWriter(database, provider.tableSchema(), options.writeOptions());
            } catch (Exception e) {
                throw ExceptionUtils.withCauseAndCode(WRITER_SETUP_ERR, "Failed to create bulk stream writer [database=" + database
                        + ", table=" + provider.tableSchema().name() + ']', e);
            }

            log.info("Bulk stream writer created [database={}, table={}, rowCount={}, options={}]",
                    database, provider.tableSchema().name(), provider.rowCount(), options);
        }

        private void stream() {
            BulkStreamWriter writer = this.writer;
            int batchSize = options.batchSize();
            Iterator<Row> rows = provider.rows();

            while (true) {
                transition(StreamingState.FILLING);

                IngestException failure = writeFailure.get();

                if (failure != null) {
                    throw failure;
                }

                if (batchSize == 0) {
                    return;
                }

                RowsBuffer buf = writer.allocateRowsBuffer(batchSize, options.avgValueSizeHint());
                boolean exhausted = false;

                while (buf.size() < batchSize) {
                    if (!rows.hasNext()) {
                        exhausted = true;

                        break;
                    }

                    buf.addRow(rows.next());
                }

                if (buf.isEmpty()) {
                    return;
                }

                transition(StreamingState.SUBMITTING);

                submit(writer, buf);

                if (batches % options.reconcileEvery() == 0) {
                    reconcile(writer);
                }

                if (exhausted) {
                    return;
                }
            }
        }

        private void submit(BulkStreamWriter writer, RowsBuffer buf) {
            long batchNo = batches + 1;
            int size = buf.size();
            long submitTs = MonotonicClock.millis();

            CompletableFuture<WriteResponse> fut;

            try {
                fut = writer.writeRowsAsync(buf);
            } catch (Exception e) {
                throw ExceptionUtils.withCauseAndCode(SUBMIT_ERR, "Failed to submit batch " + batchNo, e);
            }

            batches = batchNo;
            rowsWritten += size;

            callbacks.add(fut.whenComplete((res, err) -> {
                if (err != null) {
                    writeFailure.compareAndSet(null, new IngestException(SUBMIT_ERR, "Failed to write batch " + batchNo,
                            ExceptionUtils.unwrapCause(err)));
                } else {
                    latencies.add(MonotonicClock.millis() - submitTs);
                }
            }));

            log.debug("Batch {} submitted [rows={}, totalRows={}]", batchNo, size, rowsWritten);
        }

        private void reconcile(BulkStreamWriter writer) {
            List<WriteResponse> done;

            try {
                done = writer.flushCompletedResponses();
            } catch (BulkWriteException e) {
                collect(e.acknowledged());

                throw batchFailureOr(e);
            }

            collect(done);

            callbacks.removeIf(CompletableFuture::isDone);

            log.debug("Reconciled [batches={}, collected={}, pending={}]", batches, done.size(), writer.pendingWrites());
        }

        private void drain() {
            transition(StreamingState.DRAINING);

            try {
                collect(writer.finishWithResponses());
            } catch (BulkWriteException e) {
                collect(e.acknowledged());

                // Report the failed batch rather than the drain that observed it.
                throw batchFailureOr(ExceptionUtils.withCauseAndCode(DRAIN_ERR, "Failed to drain outstanding writes.", e));
            } catch (Exception e) {
                throw ExceptionUtils.withCauseAndCode(DRAIN_ERR, "Failed to drain outstanding writes.", e);
            }

            writer.close();
            writer = null;
        }

        /**
         * Returns the failure of the first failed batch, or the given error if no batch has failed. Must be called only after the
         * writer has reported a failed write, so every write the writer has seen fail is already complete.
         */
        private IngestException batchFailureOr(IngestException err) {
            // Callbacks of completed writes finish promptly; wait for them so that the failure is recorded.
            CompletableFuture.allOf(callbacks.toArray(new CompletableFuture[0])).handle((r, e) -> null).join();

            IngestException failure = writeFailure.get();

            if (failure == null) {
                return err;
            }

            if (failure != err) {
                failure.addSuppressed(err);
            }

            return failure;
        }

        private void collect(List<WriteResponse> done) {
            for (WriteResponse resp : done) {
                responses.add(resp);
                metrics.streamerRowsAffectedAdd(resp.affectedRows());
            }
        }

        private void closeProvider() {
            try {
                provider.close();
            } catch (Exception e) {
                throw ExceptionUtils.withCauseAndCode(PROVIDER_CLOSE_ERR, "Failed to close data provider.", e);
            }

            log.info("Data provider closed [table={}]", provider.tableSchema().name());
        }

        private StreamingResult fail(IngestException err) {
            transition(StreamingState.ERRORED);

            Object failedIn = states.size() > 1 ? states.get(states.size() - 2) : "INIT";

            log.error("Streaming failed [state={}, rows={}, batches={}]", err, failedIn, rowsWritten, batches);

            if (writer != null) {
                // Acknowledgements that have already arrived still count.
                try {
                    collect(writer.flushCompletedResponses());
                } catch (BulkWriteException e) {
                    collect(e.acknowledged());

                    if (e.getCause() != err.getCause()) {
                        err.addSuppressed(e);
                    }
                } catch (Exception e) {
                    err.addSuppressed(e);
                }

                try {
                    writer.close();
                } catch (Exception e) {
                    err.addSuppressed(e);
                }
            }

            if (err.code() != PROVIDER_CLOSE_ERR) {
                try {
                    provider.close();
                } catch (Exception e) {
                    err.addSuppressed(e);
                }
            }

            return result(err);
        }

        private StreamingResult result(@Nullable IngestException err) {
            long affected = 0;

            for (WriteResponse resp : responses) {
                affected += resp.affectedRows();
            }

            double avgLatency;

            synchronized (latencies) {
                avgLatency = latencies.longStream().average().orElse(0);
            }

            return new StreamingResult(states, rowsWritten, batches, responses, affected, MonotonicClock.millis() - startTs,
                    avgLatency, err);
        }

        private void transition(StreamingState state) {
            states.add(state);
        }
    }
}
