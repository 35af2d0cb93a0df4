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
import org.tsingest.internal.streamer.BulkStreamingEngine;
import org.tsingest.internal.streamer.StreamingResult;
import org.tsingest.lang.IngestException;
import org.tsingest.provider.TableDataProvider;

/**
 * Runs a table provider through the bulk streaming engine and measures throughput.
 */
public class BulkApiBenchmarkRunner {
    private static final IngestLogger LOG = Loggers.forClass(BulkApiBenchmarkRunner.class);

    private final BenchmarkConfig config;

    /**
     * Constructor.
     *
     * @param config Benchmark configuration.
     */
    public BulkApiBenchmarkRunner(BenchmarkConfig config) {
        this.config = config;
    }

    /**
     * Describes the configuration and the host.
     *
     * @return Text block.
     */
    public String systemInfo() {
        return systemInfo("Bulk API", config);
    }

    static String systemInfo(String api, BenchmarkConfig config) {
        Runtime rt = Runtime.getRuntime();

        return "=== " + api + " Benchmark Configuration ===" + System.lineSeparator()
                + "Endpoint: " + config.endpoint() + System.lineSeparator()
                + "Database: " + config.dbName() + System.lineSeparator()
                + "Max rows per provider: " + config.tableRowCount() + System.lineSeparator()
                + "Batch size: " + config.batchSize() + System.lineSeparator()
                + "Parallelism: " + config.parallelism() + System.lineSeparator()
                + "Compression: " + config.compression() + System.lineSeparator()
                + "CPU cores: " + rt.availableProcessors() + System.lineSeparator()
                + "Max heap: " + (rt.maxMemory() >> 20) + "MB" + System.lineSeparator();
    }

    /**
     * Streams all rows of the provider to the configured endpoint. The provider is closed when the run ends.
     *
     * @param provider Provider.
     * @param providerName Name of the provider in the report.
     * @return Result, failed if the connection or any step of the run fails.
     */
    public BenchmarkResult runBenchmark(TableDataProvider provider, String providerName) {
        String table = provider.tableSchema().name();

        LOG.info("Starting bulk API benchmark [provider={}, table={}, rows={}, batchSize={}, parallelism={}]",
                providerName, table, provider.rowCount(), config.batchSize(), config.parallelism());

        try (IngestClient client = IngestClients.create(config.endpoint())) {
            StreamingResult res = new BulkStreamingEngine(config.streamerOptions()).run(provider, client, config.dbName());

            if (!res.success()) {
                LOG.error("Bulk API benchmark failed [provider={}, state={}]", res.error(), providerName, res.states());

                return BenchmarkResult.failure(providerName, table, provider.rowCount(), String.valueOf(res.error()));
            }

            LOG.info("Bulk API benchmark completed [provider={}, rows={}, batches={}, durationMs={}, throughput={}]",
                    providerName, res.rowsWritten(), res.batches(), res.elapsedMs(),
                    String.format(Locale.ROOT, "%.0f rows/s", res.rowsPerSecond()));

            return BenchmarkResult.success(providerName, table, res.rowsWritten(), res.elapsedMs());
        } catch (IngestException e) {
            LOG.error("Bulk API benchmark failed [provider={}]", e, providerName);

            provider.close();

            return BenchmarkResult.failure(providerName, table, provider.rowCount(), e.getMessage());
        }
    }
}
