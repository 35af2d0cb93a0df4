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

import java.lang.System.Logger.Level;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import org.tsingest.internal.lang.IngestStringFormatter;

/** {@link IngestLogger} that formats the message and hands it to a {@link System.Logger}. */
class IngestLoggerImpl implements IngestLogger {
    private final System.Logger delegate;

    IngestLoggerImpl(System.Logger delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /** {@inheritDoc} */
    @Override
    public void info(String msg, Object... params) {
        log(Level.INFO, msg, null, params);
    }

    /** {@inheritDoc} */
    @Override
    public void debug(String msg, Object... params) {
        log(Level.DEBUG, msg, null, params);
    }

    /** {@inheritDoc} */
    @Override
    public void warn(String msg, Object... params) {
        log(Level.WARNING, msg, null, params);
    }

    /** {@inheritDoc} */
    @Override
    public void error(String msg, @Nullable Throwable th, Object... params) {
        log(Level.ERROR, msg, th, params);
    }

    /** {@inheritDoc} */
    @Override
    public boolean isDebugEnabled() {
        return delegate.isLoggable(Level.DEBUG);
    }

    private void log(Level level, String msg, @Nullable Throwable th, Object[] params) {
        if (!delegate.isLoggable(level)) {
            return;
        }

        String text = IngestStringFormatter.format(msg, params);

        if (th == null) {
            delegate.log(level, text);
        } else {
            delegate.log(level, text, th);
        }
    }
}
