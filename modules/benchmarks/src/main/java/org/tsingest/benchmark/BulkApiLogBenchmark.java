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

/**
 * Streams synthetic log rows through the bulk API.
 *
 * <p>The bulk API does not create tables, so the target table must exist before the run:
 * <pre>
 * CREATE TABLE IF NOT EXISTS benchmark_logs (
 *   ts TIMESTAMP(3) NOT NULL,
 *   log_uid STRING NULL, log_message STRING NULL, log_level STRING NULL,
 *   host_id STRING NULL, host_name STRING NULL, service_id STRING NULL, service_name STRING NULL,
 *   container_id STRING NULL, container_name STRING NULL, pod_id STRING NULL, pod_name STRING NULL,
 *   cluster_id STRING NULL, cluster_name STRING NULL, trace_id STRING NULL, span_id STRING NULL,
 *   user_id STRING NULL, session_id STRING NULL, request_id STRING NULL,
 *   response_time_ms BIGINT NULL, log_source STRING NULL, version STRING NULL,
 *   TIME INDEX (ts)
 * ) WITH (append_mode = 'true', skip_wal = 'true');
 * </pre>
 *
 * <p>See {@link BenchmarkConfig} for the settings. Use an endpoint starting with {@code loopback} to run without a store.
 */
public class BulkApiLogBenchmark {
    /** Target table. */
    static final String TABLE_NAME = "benchmark_logs";

    /**
     * Entry point.
     *
     * @param args Ignored.
     */
    public static void main(String[] args) {
        BenchmarkConfig config = BenchmarkConfig.fromEnv();
        var runner = new BulkApiBenchmarkRunner(config);

        System.out.println(runner.systemInfo());

        BenchmarkResult res = runner.runBenchmark(new LogTableDataProvider(TABLE_NAME, config.tableRowCount()), "LogTableDataProvider");

        System.out.println(res.display());
        System.out.println(BenchmarkReport.render(List.of(res)));

        if (!res.success()) {
            System.exit(1);
        }
    }
}
