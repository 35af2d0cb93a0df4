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

package org.tsingest.internal.streamer;

import java.util.Objects;
import org.tsingest.client.BulkWriteOptions;

/**
 * Streaming engine options.
 */
public class StreamerOptions {
    /** Default options. */
    public static final StreamerOptions DEFAULT = builder().build();

    private final int batchSize;

    private final int reconcileEvery;

    private final int avgValueSizeHint;

    private final BulkWriteOptions writeOptions;

    private StreamerOptions(int batchSize, int reconcileEvery, int avgValueSizeHint, BulkWriteOptions writeOptions) {
        this.batchSize = batchSize;
        this.reconcileEvery = reconcileEvery;
        this.avgValueSizeHint = avgValueSizeHint;
        this.writeOptions = writeOptions;
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
     * Gets the batch size (the number of rows sent in one write). Zero disables submission entirely.
     *
     * @return Batch size.
     */
    public int batchSize() {
        return batchSize;
    }

    /**
     * Gets the number of submitted batches between two collections of completed acknowledgements.
     *
     * @return Reconciliation period in batches.
     */
    public int reconcileEvery() {
        return reconcileEvery;
    }

    /**
     * Gets the expected average size of a value in bytes, used to size batch buffers.
     *
     * @return Average value size hint.
     */
    public int avgValueSizeHint() {
        return avgValueSizeHint;
    }

    /**
     * Gets the options of the writer created for the run.
     *
     * @return Writer options.
     */
    public BulkWriteOptions writeOptions() {
        return writeOptions;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "StreamerOptions [batchSize=" + batchSize + ", reconcileEvery=" + reconcileEvery + ", avgValueSizeHint="
                + avgValueSizeHint + ", writeOptions=" + writeOptions + ']';
    }

    /**
     * Builder.
     */
    public static class Builder {
        private int batchSize = 65536;

        private int reconcileEvery = 10;

        private int avgValueSizeHint = 1024;

        private BulkWriteOptions writeOptions = BulkWriteOptions.DEFAULT;

        /**
         * Sets the batch size.
         *
         * @param batchSize Batch size, zero to submit nothing.
         * @return This builder instance.
         */
        public Builder batchSize(int batchSize) {
            if (batchSize < 0) {
                throw new IllegalArgumentException("Batch size must not be negative: " + batchSize);
            }

            this.batchSize = batchSize;

            return this;
        }

        /**
         * Sets the number of submitted batches between two collections of completed acknowledgements.
         *
         * @param reconcileEvery Reconciliation period in batches.
         * @return This builder instance.
         */
        public Builder reconcileEvery(int reconcileEvery) {
            if (reconcileEvery <= 0) {
                throw new IllegalArgumentException("Reconciliation period must be positive: " + reconcileEvery);
            }

            this.reconcileEvery = reconcileEvery;

            return this;
        }

        /**
         * Sets the expected average size of a value in bytes.
         *
         * @param avgValueSizeHint Average value size hint.
         * @return This builder instance.
         */
        public Builder avgValueSizeHint(int avgValueSizeHint) {
            if (avgValueSizeHint < 0) {
                throw new IllegalArgumentException("Value size hint must not be negative: " + avgValueSizeHint);
            }

            this.avgValueSizeHint = avgValueSizeHint;

            return this;
        }

        /**
         * Sets the writer options.
         *
         * @param writeOptions Writer options.
         * @return This builder instance.
         */
        public Builder writeOptions(BulkWriteOptions writeOptions) {
            this.writeOptions = Objects.requireNonNull(writeOptions, "writeOptions");

            return this;
        }

        /**
         * Builds the options.
         *
         * @return Streamer options.
         */
        public StreamerOptions build() {
            return new StreamerOptions(batchSize, reconcileEvery, avgValueSizeHint, writeOptions);
        }
    }
}
