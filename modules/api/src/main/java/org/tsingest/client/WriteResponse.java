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

/**
 * Acknowledgement of one write request.
 */
public final class WriteResponse {
    private final long requestId;

    private final long affectedRows;

    /**
     * Constructor.
     *
     * @param requestId Id of the acknowledged request, unique within a writer.
     * @param affectedRows Number of rows the store accepted.
     */
    public WriteResponse(long requestId, long affectedRows) {
        this.requestId = requestId;
        this.affectedRows = affectedRows;
    }

    /** Returns id of the acknowledged request. */
    public long requestId() {
        return requestId;
    }

    /** Returns number of rows the store accepted. */
    public long affectedRows() {
        return affectedRows;
    }

    /** {@inheritDoc} */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        WriteResponse that = (WriteResponse) o;

        return requestId == that.requestId && affectedRows == that.affectedRows;
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return 31 * Long.hashCode(requestId) + Long.hashCode(affectedRows);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "WriteResponse [requestId=" + requestId + ", affectedRows=" + affectedRows + ']';
    }
}
