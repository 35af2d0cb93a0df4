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

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Summary of several benchmark results: the fastest provider, a table of all runs and the throughput of each successful run
 * relative to the fastest one.
 */
public final class BenchmarkReport {
    private static final String NL = System.lineSeparator();

    private BenchmarkReport() {
        // No-op.
    }

    /**
     * Returns the successful result with the highest throughput.
     *
     * @param results Results.
     * @return Fastest result, empty if no run succeeded.
     */
    public static Optional<BenchmarkResult> fastest(Collection<BenchmarkResult> results) {
        return results.stream()
                .filter(BenchmarkResult::success)
                .max(Comparator.comparingDouble(BenchmarkResult::rowsPerSecond));
    }

    /**
     * Renders the summary.
     *
     * @param results Results.
     * @return Text, empty if there are no results.
     */
    public static String render(Collection<BenchmarkResult> results) {
        if (results.isEmpty()) {
            return "";
        }

        var sb = new StringBuilder("=== Benchmark Result ===").append(NL);

        Optional<BenchmarkResult> fastest = fastest(results);

        if (fastest.isEmpty()) {
            return sb.append("No successful benchmarks to display").append(NL).toString();
        }

        BenchmarkResult best = fastest.get();

        sb.append(String.format(Locale.ROOT, "Fastest provider: %s (%.0f rows/sec)", best.providerName(), best.rowsPerSecond()))
                .append(NL).append(NL);

        sb.append(String.format(Locale.ROOT, "%-25s %12s %12s %15s %10s", "Provider", "Rows", "Duration(ms)", "Throughput", "Status"))
                .append(NL)
                .append("-".repeat(74)).append(NL);

        for (BenchmarkResult res : results) {
            if (res.success()) {
                sb.append(String.format(Locale.ROOT, "%-25s %12d %12d %10.0f r/s %10s",
                        res.providerName(), res.totalRows(), res.durationMs(), res.rowsPerSecond(), "SUCCESS"));
            } else {
                sb.append(String.format(Locale.ROOT, "%-25s %12d %12s %15s %10s", res.providerName(), res.totalRows(), "N/A", "N/A",
                        "FAILED"));
            }

            sb.append(NL);
        }

        List<BenchmarkResult> successful = results.stream().filter(BenchmarkResult::success).collect(Collectors.toList());

        if (successful.size() > 1) {
            sb.append(NL).append("Relative Performance:").append(NL);

            for (BenchmarkResult res : successful) {
                if (res == best) {
                    sb.append("[FASTEST] ").append(res.providerName()).append(": Baseline (fastest)");
                } else {
                    sb.append(String.format(Locale.ROOT, "%s: %.1f%% of fastest", res.providerName(),
                            relativePercent(res, best)));
                }

                sb.append(NL);
            }
        }

        return sb.toString();
    }

    /**
     * Returns throughput of a result as a percentage of the baseline throughput.
     *
     * @param res Result.
     * @param baseline Baseline result.
     * @return Percentage, {@code 0} if the baseline throughput is zero.
     */
    static double relativePercent(BenchmarkResult res, BenchmarkResult baseline) {
        double base = baseline.rowsPerSecond();

        return base > 0 ? res.rowsPerSecond() / base * 100.0 : 0.0;
    }
}
