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

package org.tsingest.internal.lang;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.tsingest.internal.testframework.BaseIngestTest;

class IngestSystemPropertiesTest extends BaseIngestTest {
    private static final String KEY = "TSINGEST_TEST_PROPERTY_" + IngestSystemPropertiesTest.class.getSimpleName();

    @AfterEach
    void clearProperty() {
        System.clearProperty(KEY);
    }

    @Test
    void returnsDefaultsWhenAbsent() {
        assertThat(IngestSystemProperties.getString(KEY), is(nullValue()));
        assertThat(IngestSystemProperties.getString(KEY, "dflt"), is("dflt"));
        assertThat(IngestSystemProperties.getInteger(KEY, 7), is(7));
        assertThat(IngestSystemProperties.getLong(KEY, 8L), is(8L));
        assertThat(IngestSystemProperties.getBooleanOrNull(KEY), is(nullValue()));
    }

    @Test
    void readsSystemProperty() {
        System.setProperty(KEY, " 42 ");

        assertThat(IngestSystemProperties.getInteger(KEY, 7), is(42));
        assertThat(IngestSystemProperties.getLong(KEY, 8L), is(42L));
    }

    @Test
    void fallsBackToDefaultOnUnparseableNumber() {
        System.setProperty(KEY, "lots");

        assertThat(IngestSystemProperties.getInteger(KEY, 7), is(7));
        assertThat(IngestSystemProperties.getLong(KEY, 8L), is(8L));
    }

    @Test
    void parsesBooleansIgnoringCase() {
        System.setProperty(KEY, "TRUE");

        assertThat(IngestSystemProperties.getBooleanOrNull(KEY), is(true));

        System.setProperty(KEY, "no");

        assertThat(IngestSystemProperties.getBooleanOrNull(KEY), is(false));
    }
}
