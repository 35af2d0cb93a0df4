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
import static org.hamcrest.Matchers.nullValue;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class CompressionTypeTest {
    @ParameterizedTest
    @CsvSource({
            "none, NONE",
            "FALSE, NONE",
            "0, NONE",
            "lz4, LZ4",
            "LZ4, LZ4",
            "Zstd, ZSTD"
    })
    void parsesKnownNames(String name, CompressionType expected) {
        assertThat(CompressionType.fromName(name), is(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"gzip", "", "1", "snappy"})
    void unknownNamesAreNotRecognized(String name) {
        assertThat(CompressionType.fromName(name), nullValue());
    }
}
