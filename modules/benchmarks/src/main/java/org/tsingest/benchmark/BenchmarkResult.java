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

import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of one benchmark run.
 */
public final class BenchmarkResult {
    private final String providerName;

    private final String tableName;

    private final long totalRows;

    private final long durationMs;

    private final boolean success;

    private final @Nullable String errorMessage;

    private BenchmarkResult(
            String providerName,
            String tableName,
            long totalRows,
            long durationMs,
            boolean success,
            @Nullable String errorMessage
    ) {
        this.providerName = providerName;
        this.tableName = tableName;
        this.totalRows = totalRows;
        this.durationMs = durationMs;
        this.success = success;
        this.errorMessage = errorMessage;
    }

    /**
     * Creates a successful result.
     *
     * @param providerName Provider name.
     * @param tableName Table name.
     * @param totalRows Number of written rows.
     * @param durationMs Duration of the run.
     * @return Result.
     */
    public static BenchmarkResult success(String providerName, String tableName, long totalRows, long durationMs) {
        return new BenchmarkResult(providerName, tableName, totalRows, durationMs, true, null);
    }

    /**
     * Creates a failed result.
     *
     * @param providerName Provider name.
     * @param tableName Table name.
     * @param totalRows Number of rows the run targeted.
     * @param errorMessage Failure description.
     * @return Result.
     */
    public static BenchmarkResult failure(String providerName, String tableName, long totalRows, String errorMessage) {
        return new BenchmarkResult(providerName, tableName, totalRows, 0, false, errorMessage);
    }

    public String providerName() {
        return providerName;
    }

    public String tableName() {
        return tableName;
    }

    public long totalRows() {
        return totalRows;
    }

    public long durationMs() {
        return durationMs;
    }

    public boolean success() {
        return success;
    }

    public @Nullable String errorMessage() {
        return errorMessage;
    }

    /**
     * Returns throughput of a successful run.
     *
     * @return Rows per second, {@code 0} for a failed run or a run shorter than a millisecond.
     */
    public double rowsPerSecond() {
        return success && durationMs > 0 ? totalRows / (durationMs / 1000.0) : 0.0;
    }

    /**
     * Renders the result as a text block.
     *
     * @return Text.
     */
    public String display() {
        var sb = new StringBuilder()
                .append("=== ").append(providerName).append(" Benchmark Result ===").append(System.lineSeparator())
                .append("Table: ").append(tableName).append(System.lineSeparator());

        if (success) {
            sb.append("SUCCESS").append(System.lineSeparator())
                    .append("Total rows: ").append(totalRows).append(System.lineSeparator())
                    .append("Duration: ").append(durationMs).append("ms").append(System.lineSeparator())
                    .append(String.format(Locale.ROOT, "Throughput: %.0f rows/sec", rowsPerSecond())).append(System.lineSeparator());
        } else {
            sb.append("FAILED").append(System.lineSeparator());

            if (errorMessage != null) {
                sb.append("Error: ").append(errorMessage).append(System.lineSeparator());
            }
        }

        return sb.toString();
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "BenchmarkResult [providerName=" + providerName + ", tableName=" + tableName + ", totalRows=" + totalRows
                + ", durationMs=" + durationMs + ", success=" + success + ", errorMessage=" + errorMessage + ']';
    }
}
