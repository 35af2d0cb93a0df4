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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import java.util.List;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tsingest.internal.testframework.log4j2.LogInspector;

class LoggersTest {
    private LogInspector inspector;

    @BeforeEach
    void startInspector() {
        inspector = LogInspector.create(LoggersTest.class);
    }

    @AfterEach
    void stopInspector() {
        inspector.stop();
    }

    @Test
    void fillsAnchorsInOrder() {
        IngestLogger log = Loggers.forClass(LoggersTest.class);

        log.info("Writer created [table={}, parallelism={}]", "cpu", 8);
        log.warn("Unknown compression [value={}]", "brotli");

        assertThat(inspector.messages(Level.INFO), contains("Writer created [table=cpu, parallelism=8]"));
        assertThat(inspector.messages(Level.WARN), contains("Unknown compression [value=brotli]"));
    }

    @Test
    void passesFailureToBackend() {
        IngestLogger log = Loggers.forClass(LoggersTest.class);
        var failure = new IllegalStateException("Connection reset");

        log.error("Batch failed [batch={}]", failure, 3);

        List<LogEvent> events = inspector.events();

        assertThat(events, hasSize(1));
        assertThat(events.get(0).getLevel(), is(Level.ERROR));
        assertThat(events.get(0).getMessage().getFormattedMessage(), is("Batch failed [batch=3]"));
        assertThat(events.get(0).getThrown(), sameInstance(failure));
    }

    @Test
    void debugFollowsConfiguredLevel() {
        IngestLogger log = Loggers.forClass(LoggersTest.class);

        assertThat(log.isDebugEnabled(), is(true));

        log.debug("Batch {} submitted", 1);

        assertThat(inspector.messages(Level.DEBUG), contains("Batch 1 submitted"));
    }

    @Test
    void voidLoggerDropsEverything() {
        IngestLogger log = Loggers.voidLogger();

        log.info("Writer created [table={}]", "cpu");
        log.error("Batch failed", new IllegalStateException());

        assertThat(log.isDebugEnabled(), is(false));
        assertThat(inspector.events(), hasSize(0));
    }
}
