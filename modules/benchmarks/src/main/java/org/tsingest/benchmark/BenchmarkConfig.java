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

import java.time.Duration;
import java.util.Objects;
import org.tsingest.client.BulkWriteOptions;
import org.tsingest.client.CompressionType;
import org.tsingest.internal.lang.IngestSystemProperties;
import org.tsingest.internal.logger.IngestLogger;
import org.tsingest.internal.logger.Loggers;
import org.tsingest.internal.streamer.StreamerOptions;

/**
 * Benchmark configuration. Every value can be set by a system property or an environment variable of the same name.
 */
public final class BenchmarkConfig {
    /** Endpoint of the store. */
    public static final String INGEST_ENDPOINT = "INGEST_ENDPOINT";

    /** Database name. */
    public static final String INGEST_DBNAME = "INGEST_DBNAME";

    /** Number of rows to generate. */
    public static final String TABLE_ROW_COUNT = "TABLE_ROW_COUNT";

    /** Number of rows per batch. */
    public static final String BATCH_SIZE = "BATCH_SIZE";

    /** Number of writes in flight. */
    public static final String PARALLELISM = "PARALLELISM";

    /** Compression name: {@code none}, {@code lz4} or {@code zstd}. */
    public static final String COMPRESSION = "COMPRESSION";

    static final String DFLT_ENDPOINT = "localhost:4001";

    static final String DFLT_DBNAME = "public";

    static final long DFLT_ROW_COUNT = 2_000_000;

    static final int DFLT_BATCH_SIZE = 100_000;

    static final int DFLT_PARALLELISM = 8;

    static final String DFLT_COMPRESSION = "lz4";

    /** Timeout of a single write. */
    static final Duration WRITE_TIMEOUT = Duration.ofSeconds(60);

    private static final IngestLogger LOG = Loggers.forClass(BenchmarkConfig.class);

    private final String endpoint;

    private final String dbName;

    private final long tableRowCount;

    private final int batchSize;

    private final int parallelism;

    private final String compression;

    /**
     * Constructor.
     *
     * @param endpoint Endpoint of the store.
     * @param dbName Database name.
     * @param tableRowCount Number of rows to generate.
     * @param batchSize Number of rows per batch.
     * @param parallelism Number of writes in flight.
     * @param compression Compression name.
     */
    public BenchmarkConfig(String endpoint, String dbName, long tableRowCount, int batchSize, int parallelism, String compression) {
        if (tableRowCount < 0) {
            throw new IllegalArgumentException("Row count must not be negative: " + tableRowCount);
        }

        if (batchSize < 0) {
            throw new IllegalArgumentException("Batch size must not be negative: " + batchSize);
        }

        if (parallelism <= 0) {
            throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
        }

        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.dbName = Objects.requireNonNull(dbName, "dbName");
        this.tableRowCount = tableRowCount;
        this.batchSize = batchSize;
        this.parallelism = parallelism;
        this.compression = Objects.requireNonNull(compression, "compression");
    }

    /**
     * Reads the configuration from system properties and the environment. Missing or unparsable values fall back to defaults.
     *
     * @return Configuration.
     */
    public static BenchmarkConfig fromEnv() {
        long rows = IngestSystemProperties.getLong(TABLE_ROW_COUNT, DFLT_ROW_COUNT);
        int batchSize = IngestSystemProperties.getInteger(BATCH_SIZE, DFLT_BATCH_SIZE);
        int parallelism = IngestSystemProperties.getInteger(PARALLELISM, DFLT_PARALLELISM);

        if (rows < 0) {
            LOG.warn("Negative row count, using default [value={}, default={}]", rows, DFLT_ROW_COUNT);

            rows = DFLT_ROW_COUNT;
        }

        if (batchSize < 0) {
            LOG.warn("Negative batch size, using default [value={}, default={}]", batchSize, DFLT_BATCH_SIZE);

            batchSize = DFLT_BATCH_SIZE;
        }

        if (parallelism <= 0) {
            LOG.warn("Parallelism must be positive, using default [value={}, default={}]", parallelism, DFLT_PARALLELISM);

            parallelism = DFLT_PARALLELISM;
        }

        return new BenchmarkConfig(
                IngestSystemProperties.getString(INGEST_ENDPOINT, DFLT_ENDPOINT),
                IngestSystemProperties.getString(INGEST_DBNAME, DFLT_DBNAME),
                rows,
                batchSize,
                parallelism,
                IngestSystemProperties.getString(COMPRESSION, DFLT_COMPRESSION)
        );
    }

    /** Returns endpoint of the store. */
    public String endpoint() {
        return endpoint;
    }

    /** Returns database name. */
    public String dbName() {
        return dbName;
    }

    /** Returns number of rows to generate. */
    public long tableRowCount() {
        return tableRowCount;
    }

    /** Returns number of rows per batch. */
    public int batchSize() {
        return batchSize;
    }

    /** Returns number of writes in flight. */
    public int parallelism() {
        return parallelism;
    }

    /** Returns compression name as configured. */
    public String compression() {
        return compression;
    }

    /**
     * Resolves the compression name. An unknown name is not an error: it is logged and {@link CompressionType#LZ4} is used.
     *
     * @return Compression type.
     */
    public CompressionType compressionType() {
        CompressionType type = CompressionType.fromName(compression);

        if (type == null) {
            LOG.warn("Unknown compression type, defaulting to lz4 [compression={}]", compression);

            return CompressionType.LZ4;
        }

        return type;
    }

    /**
     * Creates writer options: resolved compression, configured parallelism and a 60 second write timeout.
     *
     * @return Writer options.
     */
    public BulkWriteOptions writeOptions() {
        return BulkWriteOptions.builder()
                .compression(compressionType())
                .parallelism(parallelism)
                .timeout(WRITE_TIMEOUT)
                .build();
    }

    /**
     * Creates streaming engine options.
     *
     * @return Streamer options.
     */
    public StreamerOptions streamerOptions() {
        return StreamerOptions.builder()
                .batchSize(batchSize)
                .writeOptions(writeOptions())
                .build();
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "BenchmarkConfig [endpoint=" + endpoint + ", dbName=" + dbName + ", tableRowCount=" + tableRowCount + ", batchSize="
                + batchSize + ", parallelism=" + parallelism + ", compression=" + compression + ']';
    }
}
