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
import org.jetbrains.annotations.Nullable;
import org.tsingest.lang.IngestException;

/**
 * Failure of one or more bulk writes. Carries the acknowledgements that were collected together with the failure, so that a caller
 * still accounts for the rows the store accepted.
 */
public final class BulkWriteException extends IngestException {
    private static final long serialVersionUID = 0L;

    private final List<WriteResponse> acknowledged;

    /**
     * Constructor.
     *
     * @param code Full error code.
     * @param message Error message.
     * @param cause Failure of the first failed write.
     * @param acknowledged Acknowledgements collected together with the failure.
     */
    public BulkWriteException(int code, String message, @Nullable Throwable cause, List<WriteResponse> acknowledged) {
        super(code, message, cause);

        this.acknowledged = List.copyOf(acknowledged);
    }

    /**
     * Gets acknowledgements of the writes that succeeded.
     *
     * @return Acknowledgements in completion order.
     */
    public List<WriteResponse> acknowledged() {
        return acknowledged;
    }
}
