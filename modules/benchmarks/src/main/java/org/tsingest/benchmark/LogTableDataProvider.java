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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.function.IntFunction;
import org.tsingest.benchmark.LogTextHelper.LogEntry;
import org.tsingest.client.WireColumnSchema;
import org.tsingest.client.WireRow;
import org.tsingest.internal.logger.IngestLogger;
import org.tsingest.internal.logger.Loggers;
import org.tsingest.internal.util.MonotonicClock;
import org.tsingest.provider.TableDataProvider;
import org.tsingest.provider.WireDataProvider;
import org.tsingest.table.ColumnDataType;
import org.tsingest.table.Row;
import org.tsingest.table.TableSchema;
import org.tsingest.table.Value;

/**
 * Synthetic application log table with 22 columns: a millisecond time index, 20 string fields and a response time.
 *
 * <p>Values come from pools generated by {@link #init()}, so generating a row is cheap and depends only on its index. The provider
 * exposes both row capabilities over one cursor. Every sequence keeps its own position and swaps it with the shared cursor around
 * each pull, so the sequences can be driven alternately from one thread. Pulling from two sequences concurrently is not supported.
 */
public class LogTableDataProvider implements TableDataProvider, WireDataProvider {
    /** Maximum size of a value pool. */
    static final int MAX_POOL_SIZE = 10_000;

    /** Length of a generated log message. */
    static final int MESSAGE_LEN = 1500;

    private static final String[] NAME_SUFFIXES = {
            "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta", "iota", "kappa", "lambda", "mu", "nu", "xi",
            "omicron", "pi", "rho", "sigma", "tau", "upsilon", "phi", "chi", "psi", "omega", "prime", "secondary", "tertiary", "main",
            "backup", "standby", "primary", "replica", "master", "worker", "node", "edge"
    };

    private static final IngestLogger LOG = Loggers.forClass(LogTableDataProvider.class);

    private final String tableName;

    private final long rowCount;

    private final long baseTime;

    private final long seed;

    private final TableSchema schema;

    /** Shared generator position. */
    private long cursor;

    private boolean initialized;

    private String[] hostIds;

    private String[] hostNames;

    private String[] serviceIds;

    private String[] serviceNames;

    private String[] containerIds;

    private String[] containerNames;

    private String[] podIds;

    private String[] podNames;

    private String[] clusterIds;

    private String[] clusterNames;

    private String[] traceIds;

    private String[] spanIds;

    private String[] userIds;

    private String[] sessionIds;

    private String[] requestIds;

    private String[] logUids;

    private LogEntry[] logEntries;

    /**
     * Constructor.
     *
     * @param tableName Table name.
     * @param rowCount Number of rows to generate.
     */
    public LogTableDataProvider(String tableName, long rowCount) {
        this(tableName, rowCount, System.currentTimeMillis(), System.nanoTime());
    }

    /**
     * Constructor.
     *
     * @param tableName Table name.
     * @param rowCount Number of rows to generate.
     * @param baseTime Time of the first row in epoch milliseconds.
     * @param seed Seed of the value pools.
     */
    public LogTableDataProvider(String tableName, long rowCount, long baseTime, long seed) {
        if (rowCount < 0) {
            throw new IllegalArgumentException("Row count must not be negative: " + rowCount);
        }

        this.tableName = tableName;
        this.rowCount = rowCount;
        this.baseTime = baseTime;
        this.seed = seed;
        this.schema = buildSchema(tableName);
    }

    private static TableSchema buildSchema(String tableName) {
        TableSchema.Builder b = TableSchema.builder()
                .name(tableName)
                .addTimestamp("ts", ColumnDataType.TIMESTAMP_MILLISECOND);

        for (String col : List.of("log_uid", "log_message", "log_level", "host_id", "host_name", "service_id", "service_name",
                "container_id", "container_name", "pod_id", "pod_name", "cluster_id", "cluster_name", "trace_id", "span_id", "user_id",
                "session_id", "request_id")) {
            b.addField(col, ColumnDataType.STRING, false);
        }

        return b.addField("response_time_ms", ColumnDataType.INT64, false)
                .addField("log_source", ColumnDataType.STRING, false)
                .addField("version", ColumnDataType.STRING, false)
                .build();
    }

    /**
     * Generates the value pools.
     */
    @Override
    public void init() {
        if (initialized) {
            return;
        }

        int poolSize = (int) Math.min(MAX_POOL_SIZE, 2 * rowCount);
        long start = MonotonicClock.millis();

        LOG.info("Generating value pools [table={}, poolSize={}]", tableName, poolSize);

        Random rnd = new Random(seed);

        hostIds = pool(poolSize, i -> "host-" + (Math.floorMod(rnd.nextLong(), 100_000L) + i));
        hostNames = pool(poolSize, LogTableDataProvider::nameSuffix);
        serviceIds = pool(poolSize, i -> "service-" + (Math.floorMod(rnd.nextLong(), 100_000L) + i));
        serviceNames = pool(poolSize, i -> nameSuffix(i + 1000));
        containerIds = pool(poolSize, i -> "container-" + (Math.floorMod(rnd.nextLong(), 100_000L) + i));
        containerNames = pool(poolSize, i -> nameSuffix(i + 2000));
        podIds = pool(poolSize, i -> "pod-" + (Math.floorMod(rnd.nextLong(), 100_000L) + i));
        podNames = pool(poolSize, i -> nameSuffix(i + 3000));
        clusterIds = pool(poolSize, i -> "cluster-" + (Math.floorMod(rnd.nextLong(), 100_000L) + i));
        clusterNames = pool(poolSize, i -> nameSuffix(i + 4000));
        traceIds = pool(poolSize, i -> "trace_" + Long.toUnsignedString(rnd.nextLong()));
        spanIds = pool(poolSize, i -> "span_" + Long.toUnsignedString(rnd.nextLong()));
        userIds = pool(poolSize, i -> "user_" + (rnd.nextInt(9999) + 1));
        sessionIds = pool(poolSize, i -> "session_" + Long.toUnsignedString(rnd.nextLong()));
        requestIds = pool(poolSize, i -> "req_" + Long.toUnsignedString(rnd.nextLong()));
        logUids = pool(poolSize, i -> "log_" + (baseTime + i) + '_' + i);

        LogTextHelper text = new LogTextHelper(rnd.nextLong());

        logEntries = new LogEntry[poolSize];

        for (int i = 0; i < poolSize; i++) {
            logEntries[i] = text.generateTextWithLen(MESSAGE_LEN);
        }

        initialized = true;

        LOG.info("Value pools generated [table={}, elapsedMs={}]", tableName, MonotonicClock.millis() - start);
    }

    private static String[] pool(int size, IntFunction<String> gen) {
        String[] res = new String[size];

        for (int i = 0; i < size; i++) {
            res[i] = gen.apply(i);
        }

        return res;
    }

    private static String nameSuffix(int i) {
        return NAME_SUFFIXES[i % NAME_SUFFIXES.length] + (i % 1000);
    }

    /** {@inheritDoc} */
    @Override
    public long rowCount() {
        return rowCount;
    }

    /** {@inheritDoc} */
    @Override
    public TableSchema tableSchema() {
        return schema;
    }

    /** {@inheritDoc} */
    @Override
    public String tableName() {
        return tableName;
    }

    /** {@inheritDoc} */
    @Override
    public List<WireColumnSchema> wireSchema() {
        return WireColumnSchema.fromTableSchema(schema);
    }

    /** {@inheritDoc} */
    @Override
    public Iterator<Row> rows() {
        return new CursorIterator<>() {
            @Override
            Row convert(List<Value> values) {
                return Row.fromValues(values);
            }
        };
    }

    /** {@inheritDoc} */
    @Override
    public Iterator<WireRow> wireRows() {
        return new CursorIterator<>() {
            @Override
            WireRow convert(List<Value> values) {
                return WireRow.of(values);
            }
        };
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
        LOG.debug("Provider closed [table={}, cursor={}]", tableName, cursor);
    }

    /**
     * Generates the values of the row at the shared cursor and advances the cursor.
     *
     * @return Values or {@code null} once {@link #rowCount()} rows have been generated.
     */
    private List<Value> nextValues() {
        if (cursor >= rowCount) {
            return null;
        }

        if (!initialized) {
            throw new IllegalStateException("Provider is not initialized: " + tableName);
        }

        long row = cursor;
        int poolLen = hostIds.length;
        int baseIdx = (int) (row % poolLen);
        long randomOffset = (row * 7 + 13) % poolLen;
        long ts = baseTime + row + (randomOffset % 2000) - 1000;

        LogEntry entry = logEntries[(int) (row % logEntries.length)];

        int idx1 = baseIdx;
        int idx2 = (baseIdx + 1) % poolLen;
        int idx3 = (baseIdx + 2) % poolLen;
        int idx4 = (baseIdx + 3) % poolLen;
        int idx5 = (baseIdx + 4) % poolLen;

        List<Value> values = new ArrayList<>(schema.columnCount());

        values.add(Value.timestampMillisecond(ts));
        values.add(Value.string(logUids[baseIdx]));
        values.add(Value.string(entry.message()));
        values.add(Value.string(entry.level()));
        values.add(Value.string(hostIds[idx1]));
        values.add(Value.string(hostNames[idx1]));
        values.add(Value.string(serviceIds[idx2]));
        values.add(Value.string(serviceNames[idx2]));
        values.add(Value.string(containerIds[idx3]));
        values.add(Value.string(containerNames[idx3]));
        values.add(Value.string(podIds[idx4]));
        values.add(Value.string(podNames[idx4]));
        values.add(Value.string(clusterIds[idx5]));
        values.add(Value.string(clusterNames[idx5]));
        values.add(Value.string(traceIds[idx1]));
        values.add(Value.string(spanIds[idx2]));
        values.add(Value.string(userIds[idx3]));
        values.add(Value.string(sessionIds[idx4]));
        values.add(Value.string(requestIds[idx5]));
        values.add(Value.int64(baseIdx % 999 + 1));
        values.add(Value.string("application"));
        values.add(Value.string("v1.0.0"));

        cursor++;

        return values;
    }

    /**
     * Sequence with its own position over the shared cursor.
     *
     * @param <T> Row representation.
     */
    private abstract class CursorIterator<T> implements Iterator<T> {
        private long position;

        abstract T convert(List<Value> values);

        /** {@inheritDoc} */
        @Override
        public boolean hasNext() {
            return position < rowCount;
        }

        /** {@inheritDoc} */
        @Override
        public T next() {
            long saved = cursor;

            cursor = position;

            List<Value> values;

            try {
                values = nextValues();
            } finally {
                position = cursor;
                cursor = saved;
            }

            if (values == null) {
                throw new NoSuchElementException();
            }

            return convert(values);
        }
    }
}
