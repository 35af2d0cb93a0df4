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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;
import org.junit.jupiter.api.Test;

class BenchmarkReportTest {
    private static final BenchmarkResult FAST = BenchmarkResult.success("fast", "logs", 10_000, 1000);

    private static final BenchmarkResult SLOW = BenchmarkResult.success("slow", "logs", 10_000, 4000);

    private static final BenchmarkResult FAILED = BenchmarkResult.failure("broken", "logs", 10_000, "connection refused");

    @Test
    void throughputOfResults() {
        assertEquals(10_000.0, FAST.rowsPerSecond(), 0.001);
        assertEquals(2_500.0, SLOW.rowsPerSecond(), 0.001);
        assertEquals(0.0, FAILED.rowsPerSecond(), 0.001);
        assertEquals(0.0, BenchmarkResult.success("instant", "logs", 10, 0).rowsPerSecond(), 0.001);
    }

    @Test
    void picksFastestSuccessfulResult() {
        assertSame(FAST, BenchmarkReport.fastest(List.of(SLOW, FAILED, FAST)).orElseThrow());
        assertFalse(BenchmarkReport.fastest(List.of(FAILED)).isPresent());
    }

    @Test
    void rendersTableAndRelativePerformance() {
        String report = BenchmarkReport.render(List.of(SLOW, FAILED, FAST));

        assertThat(report, containsString("Fastest provider: fast (10000 rows/sec)"));
        assertThat(report, containsString("FAILED"));
        assertThat(report, containsString("[FASTEST] fast: Baseline (fastest)"));
        assertThat(report, containsString("slow: 25.0% of fastest"));
    }

    @Test
    void singleResultHasNoRelativePerformance() {
        assertThat(BenchmarkReport.render(List.of(FAST)), not(containsString("Relative Performance")));
    }

    @Test
    void reportWithoutSuccessfulRuns() {
        assertThat(BenchmarkReport.render(List.of(FAILED)), containsString("No successful benchmarks to display"));
        assertEquals("", BenchmarkReport.render(List.of()));
    }

    @Test
    void displaysFailure() {
        String text = FAILED.display();

        assertThat(text, containsString("FAILED"));
        assertThat(text, containsString("Error: connection refused"));
    }
}
