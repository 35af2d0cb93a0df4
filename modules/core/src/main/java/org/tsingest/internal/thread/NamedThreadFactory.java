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

package org.tsingest.internal.thread;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.tsingest.internal.logger.IngestLogger;

/**
 * Named thread factory with prefix.
 */
public class NamedThreadFactory implements ThreadFactory {
    /** Thread prefix. */
    private final String prefix;

    /** Thread counter. */
    private final AtomicInteger counter = new AtomicInteger(0);

    /** Thread daemon flag. */
    private final boolean daemon;

    /** Exception handler. */
    private final Thread.UncaughtExceptionHandler exHnd;

    /**
     * Constructor.
     *
     * @param prefix Thread name prefix.
     * @param daemon Daemon flag.
     * @param log Logger of uncaught exceptions.
     */
    public NamedThreadFactory(String prefix, boolean daemon, IngestLogger log) {
        this(prefix, daemon, new LogUncaughtExceptionHandler(log));
    }

    /**
     * Constructor.
     *
     * @param prefix Thread name prefix.
     * @param daemon Daemon flag.
     * @param exHnd Uncaught exception handler.
     */
    public NamedThreadFactory(String prefix, boolean daemon, Thread.UncaughtExceptionHandler exHnd) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.daemon = daemon;
        this.exHnd = Objects.requireNonNull(exHnd, "exHnd");
    }

    /** {@inheritDoc} */
    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r);

        t.setDaemon(daemon);
        t.setUncaughtExceptionHandler(exHnd);
        t.setName(prefix + counter.getAndIncrement());

        return t;
    }

    /**
     * Creates a thread name prefix of the form {@code %owner%-%pool%-}.
     *
     * @param owner Name of the component that owns the pool.
     * @param poolName Pool name.
     * @return Thread name prefix.
     */
    public static String threadPrefix(String owner, String poolName) {
        return owner + '-' + poolName + '-';
    }
}
