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
import org.tsingest.client.IngestClient;
import org.tsingest.client.IngestClients;
import org.tsingest.internal.logger.IngestLogger;
import org.tsingest.internal.logger.Loggers;
import org.tsingest.internal.streamer.StreamingResult;
import org.tsingest.internal.streamer.WireRowInserter;
import org.tsingest.lang.IngestException;
import org.tsingest.provider.WireDataProvider;

/**
 * Runs a wire provider through blocking batched inserts and measures throughput.
 */
public class RegularApiBenchmarkRunner {
    private static final IngestLogger LOG = Loggers.forClass(RegularApiBenchmarkRunner.class);

    private final BenchmarkConfig config;

    /**
     * Constructor.
     *
     * @param config Benchmark configuration.
     */
    public RegularApiBenchmarkRunner(BenchmarkConfig config) {
        this.config = config;
    }

    /**
     * Describes the configuration and the host.
     *
     * @return Text block.
     */
    public String systemInfo() {
        return BulkApiBenchmarkRunner.systemInfo("Regular API", config);
    }

    /**
     * Inserts all rows of the provider into the configured database. The provider is closed when the run ends.
     *
     * @param provider Provider.
     * @param providerName Name of the provider in the report.
     * @return Result, failed if the connection or any insert fails.
     */
    public BenchmarkResult runBenchmark(WireDataProvider provider, String providerName) {
        String table = provider.tableName();

        LOG.info("Starting regular API benchmark [provider={}, table={}, rows={}, batchSize={}]",
                providerName, table, provider.rowCount(), config.batchSize());

        try (IngestClient client = IngestClients.create(config.endpoint())) {
            StreamingResult res = new WireRowInserter(config.batchSize()).run(provider, client.database(config.dbName()));

            if (!res.success()) {
                LOG.error("Regular API benchmark failed [provider={}, state={}]", res.error(), providerName, res.states());

                return BenchmarkResult.failure(providerName, table, provider.rowCount(), String.valueOf(res.error()));
            }

            LOG.info("Regular API benchmark completed [provider={}, rows={}, batches={}, durationMs={}, throughput={}, avgLatency={}]",
                    providerName, res.rowsWritten(), res.batches(), res.elapsedMs(),
                    String.format(Locale.ROOT, "%.0f rows/s", res.rowsPerSecond()),
                    String.format(Locale.ROOT, "%.2fms", res.avgBatchLatencyMs()));

            return BenchmarkResult.success(providerName, table, res.rowsWritten(), res.elapsedMs());
        } catch (IngestException e) {
            LOG.error("Regular API benchmark failed [provider={}]", e, providerName);

            provider.close();

            return BenchmarkResult.failure(providerName, table, provider.rowCount(), e.getMessage());
        }
    }
}
