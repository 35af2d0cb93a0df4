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

import java.util.concurrent.CompletableFuture;
import org.tsingest.client.CompressionType;

/**
 * Transport of columnar batches.
 */
@FunctionalInterface
public interface BulkBatchSender {
    /**
     * Sends a batch asynchronously.
     *
     * @param requestId Request id, unique within a writer.
     * @param batch Batch.
     * @param compression Compression of the request.
     * @return Future of the number of rows the store accepted.
     */
    CompletableFuture<Long> sendAsync(long requestId, ColumnarBatch batch, CompressionType compression);
}
