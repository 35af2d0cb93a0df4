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

import java.util.Objects;

/**
 * Creates {@link IngestLogger} instances. Output goes through the JDK platform logging, so the backend is whatever
 * {@link System.LoggerFinder} is on the class path.
 */
public final class Loggers {
    private Loggers() {
        // No-op.
    }

    /**
     * Returns a logger named after the given class.
     *
     * @param cls Class.
     * @return Logger.
     */
    public static IngestLogger forClass(Class<?> cls) {
        return new IngestLoggerImpl(System.getLogger(Objects.requireNonNull(cls, "cls").getName()));
    }

    /** Returns a logger that drops everything. */
    public static IngestLogger voidLogger() {
        return VoidLogger.INSTANCE;
    }
}
