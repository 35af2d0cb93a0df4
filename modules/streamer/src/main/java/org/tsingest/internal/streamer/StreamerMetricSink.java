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

/**
 * Streamer metric sink. Metrics are observability only and never affect the run.
 */
public interface StreamerMetricSink {
    /** No-op sink. */
    StreamerMetricSink NO_OP = new StreamerMetricSink() {
        @Override
        public void streamerBatchesSentAdd(long batches) {
            // No-op.
        }

        @Override
        public void streamerRowsSentAdd(long rows) {
            // No-op.
        }

        @Override
        public void streamerBatchesActiveAdd(long batches) {
            // No-op.
        }

        @Override
        public void streamerRowsAffectedAdd(long rows) {
            // No-op.
        }
    };

    /**
     * Adds batches to the total sent batches metric.
     *
     * @param batches Number of batches.
     */
    void streamerBatchesSentAdd(long batches);

    /**
     * Adds rows to the total sent rows metric.
     *
     * @param rows Number of rows.
     */
    void streamerRowsSentAdd(long rows);

    /**
     * Adds batches to the in-flight batches metric.
     *
     * @param batches Number of batches, negative when writes complete.
     */
    void streamerBatchesActiveAdd(long batches);

    /**
     * Adds rows to the acknowledged rows metric.
     *
     * @param rows Number of rows.
     */
    void streamerRowsAffectedAdd(long rows);
}
