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

package org.tsingest.client;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BulkWriteOptionsTest {
    @Test
    void defaults() {
        BulkWriteOptions opts = BulkWriteOptions.DEFAULT;

        assertThat(opts.compression(), is(CompressionType.LZ4));
        assertThat(opts.parallelism(), is(4));
        assertThat(opts.timeout(), is(Duration.ofSeconds(60)));
    }

    @Test
    void overridesValues() {
        BulkWriteOptions opts = BulkWriteOptions.builder()
                .compression(CompressionType.ZSTD)
                .parallelism(8)
                .timeout(Duration.ofMillis(500))
                .build();

        assertThat(opts.compression(), is(CompressionType.ZSTD));
        assertThat(opts.parallelism(), is(8));
        assertThat(opts.timeout(), is(Duration.ofMillis(500)));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> BulkWriteOptions.builder().parallelism(0));
        assertThrows(IllegalArgumentException.class, () -> BulkWriteOptions.builder().timeout(Duration.ZERO));
        assertThrows(NullPointerException.class, () -> BulkWriteOptions.builder().compression(null));
    }
}
