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

package org.tsingest.lang;

import static org.tsingest.lang.ErrorGroup.ERR_PREFIX;
import static org.tsingest.lang.ErrorGroup.errorMessage;
import static org.tsingest.lang.ErrorGroup.extractErrorCode;
import static org.tsingest.lang.ErrorGroup.extractGroupCode;

import java.util.UUID;
import org.jetbrains.annotations.Nullable;

/**
 * General ingestion exception. Every failure surfaced by the pipeline is an instance of this class or a subclass.
 */
public class IngestException extends RuntimeException implements TraceableException {
    /** Serial version UID. */
    private static final long serialVersionUID = 0L;

    /** Name of the error group. */
    private final String groupName;

    /**
     * Error code that contains information about the error group and code,
     * where the code is unique within the group. The code structure is as follows:
     * +------------+--------------+
     * |  16 bits   |    16 bits   |
     * +------------+--------------+
     * | Group Code |  Error Code  |
     * +------------+--------------+
     */
    private final int code;

    /** Unique identifier of the exception that helps locate the error message in a log file. */
    private final UUID traceId;

    /**
     * Creates an exception with the given error code and detailed message.
     *
     * @param code Full error code.
     * @param message Detailed message.
     */
    public IngestException(int code, String message) {
        this(traceIdOf(null), code, message, null);
    }

    /**
     * Creates an exception with the given error code, detailed message, and cause.
     *
     * @param code Full error code.
     * @param message Detailed message.
     * @param cause Optional nested exception (can be {@code null}).
     */
    public IngestException(int code, String message, @Nullable Throwable cause) {
        this(traceIdOf(cause), code, message, cause);
    }

    /**
     * Creates an exception with the given trace ID, error code, detailed message, and cause.
     *
     * @param traceId Unique identifier of the exception.
     * @param code Full error code.
     * @param message Detailed message.
     * @param cause Optional nested exception (can be {@code null}).
     */
    public IngestException(UUID traceId, int code, @Nullable String message, @Nullable Throwable cause) {
        super(message, cause);

        ErrorGroup group = ErrorGroup.errorGroupByCode(code);

        assert group != null : "group not found, code=" + code;

        this.traceId = traceId;
        this.groupName = group.name();
        this.code = code;
    }

    /**
     * Returns a group name of the error.
     *
     * @return Group name.
     */
    public String groupName() {
        return groupName;
    }

    /** {@inheritDoc} */
    @Override
    public int code() {
        return code;
    }

    /**
     * Returns a human-readable string that represents a full error code, in format {@code TSI-GROUP-nnn}.
     *
     * @return Full error code in a human-readable format.
     */
    public String codeAsString() {
        return ERR_PREFIX + groupName() + '-' + errorCode();
    }

    /** {@inheritDoc} */
    @Override
    public int groupCode() {
        return extractGroupCode(code);
    }

    /** {@inheritDoc} */
    @Override
    public int errorCode() {
        return extractErrorCode(code);
    }

    /** {@inheritDoc} */
    @Override
    public UUID traceId() {
        return traceId;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return getClass().getName() + ": " + errorMessage(traceId, groupName, code, getLocalizedMessage());
    }

    /** Reuses the trace id of a traceable cause so that a wrapped error keeps its identity in logs. */
    private static UUID traceIdOf(@Nullable Throwable cause) {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof TraceableException) {
                return ((TraceableException) t).traceId();
            }
        }

        return UUID.randomUUID();
    }
}
