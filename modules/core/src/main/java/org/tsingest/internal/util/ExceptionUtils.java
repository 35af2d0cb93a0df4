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

package org.tsingest.internal.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.tsingest.lang.IngestException;

/**
 * Exception utils.
 */
public final class ExceptionUtils {
    private ExceptionUtils() {
        // No-op.
    }

    /**
     * Unwraps exception cause from wrappers like CompletionException and ExecutionException.
     *
     * @param e Throwable.
     * @return Unwrapped throwable.
     */
    public static Throwable unwrapCause(Throwable e) {
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }

        return e;
    }

    /**
     * Wraps the (unwrapped) cause into an {@link IngestException} with the given code and message. A cause that already is an
     * {@link IngestException} with the same code is returned as is.
     *
     * @param code Full error code of the new exception.
     * @param msg Detailed message.
     * @param t Cause.
     * @return Exception with the given code.
     */
    public static IngestException withCauseAndCode(int code, String msg, Throwable t) {
        Throwable cause = unwrapCause(t);

        if (cause instanceof IngestException && ((IngestException) cause).code() == code) {
            return (IngestException) cause;
        }

        return new IngestException(code, msg, cause);
    }
}
