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

import static org.tsingest.lang.ErrorGroups.Streamer.DRAIN_ERR;
import static org.tsingest.lang.ErrorGroups.Streamer.SUBMIT_ERR;
import static org.tsingest.lang.ErrorGroups.Streamer.WRITE_TIMEOUT_ERR;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.jetbrains.annotations.Nullable;
import org.tsingest.client.BulkStreamWriter;
import org.tsingest.client.BulkWriteException;
import org.tsingest.client.BulkWriteOptions;
import org.tsingest.client.WriteResponse;
import org.tsingest.internal.logger.IngestLogger;
import org.tsingest.internal.util.CompletableFutures;
import org.tsingest.internal.util.ExceptionUtils;
import org.tsingest.lang.IngestException;
import org.tsingest.table.RowsBuffer;
import org.tsingest.table.TableSchema;

/**
 * {@link BulkStreamWriter} over a {@link BulkBatchSender}.
 *
 * <p>At most {@link BulkWriteOptions#parallelism()} writes are in flight; a submission waits for a free slot. Every write is tracked
 * by its request id until its acknowledgement is collected. Writes complete in any order and are collected in completion order.
 */
public class DefaultBulkStreamWriter implements BulkStreamWriter {
    private final TableSchema schema;

    private final BulkWriteOptions options;

    private final BulkBatchSender sender;

    private final IngestLogger log;

    private final StreamerMetricSink metrics;

    private final Semaphore slots;

    private final AtomicLong requestIds = new AtomicLong();

    private final ConcurrentMap<Long, CompletableFuture<WriteResponse>> pendingRequests = new ConcurrentHashMap<>();

    /** Ids of completed requests in completion order. */
    private final ConcurrentLinkedQueue<Long> completed = new ConcurrentLinkedQueue<>();

    private volatile boolean closed;

    /**
     * Constructor.
     *
     * @param schema Schema of the target table.
     * @param options Writer options.
     * @param sender Batch sender.
     * @param log Logger.
     * @param metrics Metrics or {@code null}.
     */
    public DefaultBulkStreamWriter(
            TableSchema schema,
            BulkWriteOptions options,
            BulkBatchSender sender,
            IngestLogger log,
            @Nullable StreamerMetricSink metrics
    ) {
        assert schema != null;
        assert options != null;
        assert sender != null;
        assert log != null;

        this.schema = schema;
        this.options = options;
        this.sender = sender;
        this.log = log;
        this.metrics = metrics != null ? metrics : StreamerMetricSink.NO_OP;
        this.slots = new Semaphore(options.parallelism());
    }

    /** {@inheritDoc} */
    @Override
    public TableSchema schema() {
        return schema;
    }

    /** {@inheritDoc} */
    @Override
    public RowsBuffer allocateRowsBuffer(int rowCapacity, int avgValueSizeHint) {
        return RowsBuffer.allocate(schema, rowCapacity, avgValueSizeHint);
    }

    /** {@inheritDoc} */
    @Override
    public CompletableFuture<WriteResponse> writeRowsAsync(RowsBuffer buffer) {
        if (closed) {
            throw new IngestException(SUBMIT_ERR, "Writer is closed, can't submit writes.");
        }

        if (buffer.schema() != schema && !buffer.schema().equals(schema)) {
            throw new IllegalArgumentException("Buffer belongs to another table: " + buffer.schema().name());
        }

        ColumnarBatch batch = ColumnarBatch.drain(buffer.seal());

        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();

            throw new IngestException(SUBMIT_ERR, "Interrupted while waiting for a write slot.", e);
        }

        long requestId = requestIds.incrementAndGet();
        CompletableFuture<WriteResponse> res = new CompletableFuture<>();

        pendingRequests.put(requestId, res);
        metrics.streamerBatchesActiveAdd(1);

        CompletableFuture<Long> sent;

        try {
            sent = sender.sendAsync(requestId, batch, options.compression());
        } catch (Throwable e) {
            sent = CompletableFuture.failedFuture(e);
        }

        if (log.isDebugEnabled()) {
            log.debug("Batch submitted [requestId={}, rows={}, bytes={}]", requestId, batch.rowCount(), batch.estimatedSizeInBytes());
        }

        sent.orTimeout(options.timeout().toMillis(), TimeUnit.MILLISECONDS).whenComplete((affected, err) -> {
            slots.release();
            metrics.streamerBatchesActiveAdd(-1);

            // Published before completion, so every completed future is already queued.
            completed.add(requestId);

            if (err != null) {
                res.completeExceptionally(writeError(requestId, err));
            } else {
                metrics.streamerBatchesSentAdd(1);
                metrics.streamerRowsSentAdd(batch.rowCount());
                metrics.streamerRowsAffectedAdd(affected);

                res.complete(new WriteResponse(requestId, affected));
            }
        });

        return res;
    }

    private IngestException writeError(long requestId, Throwable err) {
        Throwable cause = ExceptionUtils.unwrapCause(err);

        if (cause instanceof TimeoutException) {
            return new IngestException(WRITE_TIMEOUT_ERR, "Write was not acknowledged in time [requestId=" + requestId
                    + ", timeout=" + options.timeout().toMillis() + "ms]", cause);
        }

        return ExceptionUtils.withCauseAndCode(SUBMIT_ERR, "Write failed [requestId=" + requestId + ']', cause);
    }

    /** {@inheritDoc} */
    @Override
    public List<WriteResponse> flushCompletedResponses() {
        return collect(SUBMIT_ERR);
    }

    /** {@inheritDoc} */
    @Override
    public List<WriteResponse> finishWithResponses() {
        closed = true;

        var futs = pendingRequests.values().toArray(new CompletableFuture[0]);

        try {
            // Failures are reported by collect().
            CompletableFuture.allOf(futs).handle((r, e) -> null).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();

            throw new IngestException(DRAIN_ERR, "Interrupted while waiting for outstanding writes.", e);
        } catch (Exception e) {
            throw new IngestException(DRAIN_ERR, "Failed to wait for outstanding writes.", e);
        }

        return collect(DRAIN_ERR);
    }

    private List<WriteResponse> collect(int errCode) {
        List<WriteResponse> res = new ArrayList<>();
        List<Throwable> failures = new ArrayList<>();
        long failedId = 0;

        Long id;

        while ((id = completed.poll()) != null) {
            CompletableFuture<WriteResponse> fut = pendingRequests.remove(id);

            if (fut == null) {
                continue;
            }

            // The id is queued right before the future completes.
            fut.handle((r, e) -> null).join();

            Throwable failure = CompletableFutures.failureOf(fut);

            if (failure == null) {
                res.add(fut.join());
            } else {
                if (failures.isEmpty()) {
                    failedId = id;
                }

                failures.add(failure);
            }
        }

        if (!failures.isEmpty()) {
            var err = new BulkWriteException(errCode, "Write failed [requestId=" + failedId + ']', failures.get(0), res);

            for (int i = 1; i < failures.size(); i++) {
                err.addSuppressed(failures.get(i));
            }

            throw err;
        }

        return res;
    }

    /** {@inheritDoc} */
    @Override
    public int pendingWrites() {
        return pendingRequests.size();
    }

    /**
     * Returns number of writes whose acknowledgement has not arrived yet.
     *
     * @return Number of writes in flight.
     */
    public int inFlightWrites() {
        return options.parallelism() - slots.availablePermits();
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
        if (closed && pendingRequests.isEmpty()) {
            return;
        }

        closed = true;

        int failed = 0;

        for (CompletableFuture<WriteResponse> fut : pendingRequests.values()) {
            if (fut.completeExceptionally(new IngestException(SUBMIT_ERR, "Writer was closed before the write was acknowledged."))) {
                failed++;
            }
        }

        pendingRequests.clear();
        completed.clear();

        log.info("Writer closed [table={}, abandonedWrites={}]", schema.name(), failed);
    }
}
