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

package org.tsingest.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Options of a {@link BulkStreamWriter}.
 */
public class BulkWriteOptions {
    /** Default options. */
    public static final BulkWriteOptions DEFAULT = builder().build();

    private final CompressionType compression;

    private final int parallelism;

    private final Duration timeout;

    private BulkWriteOptions(CompressionType compression, int parallelism, Duration timeout) {
        this.compression = compression;
        this.parallelism = parallelism;
        this.timeout = timeout;
    }

    /**
     * Creates a new builder.
     *
     * @return Builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gets the compression of write requests.
     *
     * @return Compression.
     */
    public CompressionType compression() {
        return compression;
    }

    /**
     * Gets the maximum number of writes in flight. Submitting a write while this many are outstanding blocks until one completes.
     *
     * @return Parallelism.
     */
    public int parallelism() {
        return parallelism;
    }

    /**
     * Gets the time a write may stay unacknowledged before it fails.
     *
     * @return Timeout.
     */
    public Duration timeout() {
        return timeout;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "BulkWriteOptions [compression=" + compression + ", parallelism=" + parallelism + ", timeout=" + timeout + ']';
    }

    /**
     * Builder.
     */
    public static class Builder {
        private CompressionType compression = CompressionType.LZ4;

        private int parallelism = 4;

        private Duration timeout = Duration.ofSeconds(60);

        /**
         * Sets the compression of write requests.
         *
         * @param compression Compression.
         * @return This builder instance.
         */
        public Builder compression(CompressionType compression) {
            this.compression = Objects.requireNonNull(compression, "compression");

            return this;
        }

        /**
         * Sets the maximum number of writes in flight.
         *
         * @param parallelism Parallelism.
         * @return This builder instance.
         */
        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
            }

            this.parallelism = parallelism;

            return this;
        }

        /**
         * Sets the time a write may stay unacknowledged before it fails.
         *
         * @param timeout Timeout.
         * @return This builder instance.
         */
        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");

            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Timeout must be positive: " + timeout);
            }

            this.timeout = timeout;

            return this;
        }

        /**
         * Builds the options.
         *
         * @return Bulk write options.
         */
        public BulkWriteOptions build() {
            return new BulkWriteOptions(compression, parallelism, timeout);
        }
    }
}
