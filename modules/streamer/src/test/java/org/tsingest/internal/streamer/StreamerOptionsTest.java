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

package org.tsingest.internal.streamer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.tsingest.client.BulkWriteOptions;

class StreamerOptionsTest {
    @Test
    void defaults() {
        StreamerOptions opts = StreamerOptions.DEFAULT;

        assertThat(opts.batchSize(), is(65536));
        assertThat(opts.reconcileEvery(), is(10));
        assertThat(opts.avgValueSizeHint(), is(1024));
        assertThat(opts.writeOptions(), is(BulkWriteOptions.DEFAULT));
    }

    @Test
    void zeroBatchSizeIsAllowed() {
        assertThat(StreamerOptions.builder().batchSize(0).build().batchSize(), is(0));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> StreamerOptions.builder().batchSize(-1));
        assertThrows(IllegalArgumentException.class, () -> StreamerOptions.builder().reconcileEvery(0));
        assertThrows(IllegalArgumentException.class, () -> StreamerOptions.builder().avgValueSizeHint(-1));
    }
}
