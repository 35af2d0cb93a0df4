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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.tsingest.client.BulkWriteOptions;
import org.tsingest.client.CompressionType;
import org.tsingest.internal.streamer.StreamerOptions;
import org.tsingest.internal.testframework.BaseIngestTest;
import org.tsingest.internal.testframework.log4j2.LogInspector;

class BenchmarkConfigTest extends BaseIngestTest {
    @AfterEach
    void clearProperties() {
        System.clearProperty(BenchmarkConfig.INGEST_ENDPOINT);
        System.clearProperty(BenchmarkConfig.INGEST_DBNAME);
        System.clearProperty(BenchmarkConfig.TABLE_ROW_COUNT);
        System.clearProperty(BenchmarkConfig.BATCH_SIZE);
        System.clearProperty(BenchmarkConfig.PARALLELISM);
        System.clearProperty(BenchmarkConfig.COMPRESSION);
    }

    @Test
    void propertiesOverrideDefaults() {
        System.setProperty(BenchmarkConfig.INGEST_ENDPOINT, "db.example:4001");
        System.setProperty(BenchmarkConfig.INGEST_DBNAME, "metrics");
        System.setProperty(BenchmarkConfig.TABLE_ROW_COUNT, "5000");
        System.setProperty(BenchmarkConfig.BATCH_SIZE, "250");
        System.setProperty(BenchmarkConfig.PARALLELISM, "3");
        System.setProperty(BenchmarkConfig.COMPRESSION, "zstd");

        BenchmarkConfig cfg = BenchmarkConfig.fromEnv();

        assertEquals("db.example:4001", cfg.endpoint());
        assertEquals("metrics", cfg.dbName());
        assertEquals(5000, cfg.tableRowCount());
        assertEquals(250, cfg.batchSize());
        assertEquals(3, cfg.parallelism());
        assertEquals(CompressionType.ZSTD, cfg.compressionType());
    }

    @Test
    void invalidNumbersFallBackToDefaults() {
        System.setProperty(BenchmarkConfig.TABLE_ROW_COUNT, "-5");
        System.setProperty(BenchmarkConfig.PARALLELISM, "0");

        BenchmarkConfig cfg = BenchmarkConfig.fromEnv();

        assertEquals(BenchmarkConfig.DFLT_ROW_COUNT, cfg.tableRowCount());
        assertEquals(BenchmarkConfig.DFLT_PARALLELISM, cfg.parallelism());
    }

    @ParameterizedTest
    @CsvSource({"none, NONE", "false, NONE", "0, NONE", "LZ4, LZ4", "' zstd ', ZSTD"})
    void knownCompressionNamesResolve(String name, CompressionType expected) {
        assertEquals(expected, config(name).compressionType());
    }

    @Test
    void unknownCompressionWarnsAndUsesLz4() {
        LogInspector inspector = LogInspector.create(BenchmarkConfig.class);

        try {
            assertEquals(CompressionType.LZ4, config("brotli").compressionType());
        } finally {
            inspector.stop();
        }

        assertThat(inspector.messages(Level.WARN), contains("Unknown compression type, defaulting to lz4 [compression=brotli]"));
    }

    @Test
    void knownCompressionDoesNotWarn() {
        LogInspector inspector = LogInspector.create(BenchmarkConfig.class);

        try {
            config("lz4").compressionType();
        } finally {
            inspector.stop();
        }

        assertThat(inspector.messages(Level.WARN), empty());
    }

    @Test
    void derivesWriterAndStreamerOptions() {
        BenchmarkConfig cfg = new BenchmarkConfig("loopback", "public", 10, 128, 6, "none");

        BulkWriteOptions writeOptions = cfg.writeOptions();

        assertEquals(CompressionType.NONE, writeOptions.compression());
        assertEquals(6, writeOptions.parallelism());
        assertEquals(Duration.ofSeconds(60), writeOptions.timeout());

        StreamerOptions streamerOptions = cfg.streamerOptions();

        assertEquals(128, streamerOptions.batchSize());
        assertEquals(writeOptions.parallelism(), streamerOptions.writeOptions().parallelism());
    }

    @Test
    void constructorRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new BenchmarkConfig("e", "db", -1, 1, 1, "lz4"));
        assertThrows(IllegalArgumentException.class, () -> new BenchmarkConfig("e", "db", 1, -1, 1, "lz4"));
        assertThrows(IllegalArgumentException.class, () -> new BenchmarkConfig("e", "db", 1, 1, 0, "lz4"));
    }

    private static BenchmarkConfig config(String compression) {
        return new BenchmarkConfig("loopback", "public", 10, 10, 1, compression);
    }
}
