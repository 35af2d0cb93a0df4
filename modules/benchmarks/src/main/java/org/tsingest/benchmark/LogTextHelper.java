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

import java.util.Random;

/**
 * Generates log levels and messages of a requested length.
 */
public class LogTextHelper {
    private static final String[] LEVELS = {"DEBUG", "INFO", "WARN", "ERROR"};

    /** Cumulative weights of {@link #LEVELS} out of 100. */
    private static final int[] LEVEL_WEIGHTS = {15, 85, 95, 100};

    private static final String[] FRAGMENTS = {
            "Request processed successfully",
            "Connection established to upstream",
            "Cache miss for key",
            "Retrying operation after transient failure",
            "User session refreshed",
            "Query executed in",
            "Payload validated against schema",
            "Scheduled job started",
            "Resource usage above threshold",
            "Received heartbeat from peer",
            "Configuration reloaded",
            "Authentication token verified",
            "Slow response detected from",
            "Batch committed with",
            "Circuit breaker state changed"
    };

    private static final String[] WORDS = {
            "id", "node", "shard", "region", "tenant", "bytes", "ms", "rows", "attempt", "status", "path", "method", "code"
    };

    private final Random rnd;

    /**
     * Constructor.
     *
     * @param seed Random seed.
     */
    public LogTextHelper(long seed) {
        rnd = new Random(seed);
    }

    /**
     * Generates a log level and a message of exactly {@code len} characters.
     *
     * @param len Message length.
     * @return Level and message.
     */
    public LogEntry generateTextWithLen(int len) {
        if (len < 0) {
            throw new IllegalArgumentException("Length must not be negative: " + len);
        }

        var sb = new StringBuilder(len + 32);

        sb.append(FRAGMENTS[rnd.nextInt(FRAGMENTS.length)]);

        while (sb.length() < len) {
            sb.append(' ').append(WORDS[rnd.nextInt(WORDS.length)]).append('=').append(rnd.nextInt(100_000));

            if (rnd.nextInt(8) == 0) {
                sb.append("; ").append(FRAGMENTS[rnd.nextInt(FRAGMENTS.length)]);
            }
        }

        sb.setLength(len);

        return new LogEntry(level(), sb.toString());
    }

    private String level() {
        int w = rnd.nextInt(100);

        for (int i = 0; i < LEVELS.length; i++) {
            if (w < LEVEL_WEIGHTS[i]) {
                return LEVELS[i];
            }
        }

        return LEVELS[LEVELS.length - 1];
    }

    /** Log level and message. */
    public static final class LogEntry {
        private final String level;

        private final String message;

        LogEntry(String level, String message) {
            this.level = level;
            this.message = message;
        }

        /** Returns log level. */
        public String level() {
            return level;
        }

        /** Returns message. */
        public String message() {
            return message;
        }
    }
}
