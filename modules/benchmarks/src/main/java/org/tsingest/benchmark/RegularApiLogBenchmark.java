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
 * Inserts synthetic log rows through the regular insert API. The store creates the table on first insert.
 *
 * <p>See {@link BenchmarkConfig} for the settings. Use an endpoint starting with {@code loopback} to run without a store.
 */
public class RegularApiLogBenchmark {
    /**
     * Entry point.
     *
     * @param args Ignored.
     */
    public static void main(String[] args) {
        BenchmarkConfig config = BenchmarkConfig.fromEnv();
        var runner = new RegularApiBenchmarkRunner(config);

        System.out.println(runner.systemInfo());

        BenchmarkResult res = runner.runBenchmark(
                new LogTableDataProvider(BulkApiLogBenchmark.TABLE_NAME, config.tableRowCount()),
                "LogTableDataProvider"
        );

        System.out.println(res.display());
        System.out.println(BenchmarkReport.render(List.of(res)));

        if (!res.success()) {
            System.exit(1);
        }
    }
}
