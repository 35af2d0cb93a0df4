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
import org.jetbrains.annotations.Nullable;
import org.tsingest.client.WriteResponse;
import org.tsingest.lang.IngestException;

/**
 * Outcome of a streaming run. Counters and timings are observability only.
 */
public final class StreamingResult {
    private final StreamingState state;

    private final List<StreamingState> states;

    private final long rowsWritten;

    private final long batches;

    private final List<WriteResponse> responses;

    private final long affectedRows;

    private final long elapsedMs;

    private final double avgBatchLatencyMs;

    private final @Nullable IngestException error;

    /**
     * Constructor.
     *
     * @param states Visited states, the last one is terminal.
     * @param rowsWritten Number of rows handed to the transport.
     * @param batches Number of submitted batches.
     * @param responses Collected acknowledgements.
     * @param affectedRows Number of rows the store accepted.
     * @param elapsedMs Duration of the run.
     * @param avgBatchLatencyMs Average time between submission and acknowledgement of a batch.
     * @param error Error of a failed run.
     */
    public StreamingResult(
            List<StreamingState> states,
            long rowsWritten,
            long batches,
            List<WriteResponse> responses,
            long affectedRows,
            long elapsedMs,
            double avgBatchLatencyMs,
            @Nullable IngestException error
    ) {
        assert !states.isEmpty() && states.get(states.size() - 1).terminal() : states;

        this.state = states.get(states.size() - 1);
        this.states = List.copyOf(states);
        this.rowsWritten = rowsWritten;
        this.batches = batches;
        this.responses = List.copyOf(responses);
        this.affectedRows = affectedRows;
        this.elapsedMs = elapsedMs;
        this.avgBatchLatencyMs = avgBatchLatencyMs;
        this.error = error;
    }

    /** Returns terminal state. */
    public StreamingState state() {
        return state;
    }

    /** Returns visited states in order. */
    public List<StreamingState> states() {
        return states;
    }

    /** Returns {@code true} if the run finished without errors. */
    public boolean success() {
        return state == StreamingState.FINISHED;
    }

    /** Returns number of rows handed to the transport. */
    public long rowsWritten() {
        return rowsWritten;
    }

    /** Returns number of submitted batches. */
    public long batches() {
        return batches;
    }

    /** Returns collected acknowledgements. */
    public List<WriteResponse> responses() {
        return responses;
    }

    /** Returns number of rows the store accepted. */
    public long affectedRows() {
        return affectedRows;
    }

    /** Returns duration of the run in milliseconds. */
    public long elapsedMs() {
        return elapsedMs;
    }

    /** Returns average batch latency in milliseconds. */
    public double avgBatchLatencyMs() {
        return avgBatchLatencyMs;
    }

    /**
     * Returns throughput of the run.
     *
     * @return Rows written per second, {@code 0} for an instant run.
     */
    public double rowsPerSecond() {
        return elapsedMs == 0 ? 0 : rowsWritten * 1000.0 / elapsedMs;
    }

    /** Returns error of a failed run. */
    public @Nullable IngestException error() {
        return error;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "StreamingResult [state=" + state + ", rows=" + rowsWritten + ", batches=" + batches + ", affectedRows=" + affectedRows
                + ", elapsedMs=" + elapsedMs + (error == null ? "" : ", error=" + error) + ']';
    }
}
