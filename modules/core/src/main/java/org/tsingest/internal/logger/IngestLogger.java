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
package org.tsingest.internal.logger;

import org.jetbrains.annotations.Nullable;

/**
 * Pipeline logger. Message patterns use {@code {}} anchors, filled from the trailing arguments in order.
 *
 * @see Loggers
 */
public interface IngestLogger {
    /**
     * Logs a lifecycle event: a writer created or closed, a run finished.
     *
     * @param msg Message pattern.
     * @param params Anchor values.
     */
    void info(String msg, Object... params);

    /**
     * Logs a per-batch event. Callers on hot paths check {@link #isDebugEnabled()} first when the arguments are costly.
     *
     * @param msg Message pattern.
     * @param params Anchor values.
     */
    void debug(String msg, Object... params);

    /**
     * Logs a recoverable problem, such as a setting replaced by its default.
     *
     * @param msg Message pattern.
     * @param params Anchor values.
     */
    void warn(String msg, Object... params);

    /**
     * Logs a failure together with its exception.
     *
     * @param msg Message pattern.
     * @param th Failure, may be {@code null}.
     * @param params Anchor values.
     */
    void error(String msg, @Nullable Throwable th, Object... params);

    /** Returns {@code true} if per-batch events are logged. */
    boolean isDebugEnabled();
}
