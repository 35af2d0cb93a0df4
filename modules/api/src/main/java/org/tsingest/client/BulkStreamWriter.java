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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.tsingest.lang.IngestException;
import org.tsingest.table.RowsBuffer;
import org.tsingest.table.TableSchema;

/**
 * Writer that streams batches of rows of one table to the store, keeping a bounded number of writes in flight.
 *
 * <p>Every submitted write stays tracked until its acknowledgement is collected, either by {@link #flushCompletedResponses()} or by
 * {@link #finishWithResponses()}. Writes may complete in any order.
 */
public interface BulkStreamWriter extends AutoCloseable {
    /**
     * Returns schema of the target table.
     *
     * @return Table schema.
     */
    TableSchema schema();

    /**
     * Allocates a buffer for the rows of the next write.
     *
     * @param rowCapacity Expected number of rows.
     * @param avgValueSizeHint Expected average size of a value in bytes.
     * @return Empty buffer.
     */
    RowsBuffer allocateRowsBuffer(int rowCapacity, int avgValueSizeHint);

    /**
     * Submits the rows of the buffer as one write. The buffer is sealed and owned by the writer afterwards. The call blocks while the
     * maximum number of writes is in flight but never waits for the acknowledgement of this write.
     *
     * @param buffer Rows to write.
     * @return Future of the acknowledgement.
     * @throws IngestException If the write cannot be submitted.
     */
    CompletableFuture<WriteResponse> writeRowsAsync(RowsBuffer buffer);

    /**
     * Collects acknowledgements of writes that have already completed, without blocking.
     *
     * @return Collected acknowledgements in completion order, possibly empty.
     * @throws BulkWriteException If one of the completed writes has failed. The acknowledgements collected in the same call are
     *      carried by the exception.
     */
    List<WriteResponse> flushCompletedResponses();

    /**
     * Stops accepting writes and waits for every outstanding one.
     *
     * @return Acknowledgements that have not been collected before.
     * @throws BulkWriteException If one of the outstanding writes has failed. The acknowledgements collected in the same call are
     *      carried by the exception.
     * @throws IngestException With {@code DRAIN_ERR} if waiting is interrupted.
     */
    List<WriteResponse> finishWithResponses();

    /**
     * Returns number of submitted writes whose acknowledgements have not been collected yet.
     *
     * @return Number of pending writes.
     */
    int pendingWrites();

    /**
     * Closes the writer. Outstanding writes fail.
     */
    @Override
    void close();
}
