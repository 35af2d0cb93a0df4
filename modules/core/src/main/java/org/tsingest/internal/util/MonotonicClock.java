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

import java.util.concurrent.TimeUnit;

/**
 * Millisecond clock for measuring elapsed time. Readings are only meaningful relative to each other.
 */
public final class MonotonicClock {
    /** Reading of {@link System#nanoTime()} taken when the class was loaded. */
    private static final long ORIGIN_NANOS = System.nanoTime();

    private MonotonicClock() {
        // No-op.
    }

    /** Returns milliseconds elapsed since the class was loaded. */
    public static long millis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - ORIGIN_NANOS);
    }
}
