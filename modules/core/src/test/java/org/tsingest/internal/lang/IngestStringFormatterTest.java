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

import org.junit.jupiter.api.Test;

class IngestStringFormatterTest {
    @Test
    void substitutesArgumentsInOrder() {
        assertThat(IngestStringFormatter.format("Batch {} of {} rows", 3, 100), is("Batch 3 of 100 rows"));
    }

    @Test
    void keepsAnchorsWithoutArguments() {
        assertThat(IngestStringFormatter.format("{} and {}", "a"), is("a and {}"));
        assertThat(IngestStringFormatter.format("no args {}"), is("no args {}"));
    }

    @Test
    void printsEscapedAnchorLiterally() {
        assertThat(IngestStringFormatter.format("literal \\{} then {}", "x"), is("literal {} then x"));
    }

    @Test
    void rendersNullsAndArrays() {
        assertThat(IngestStringFormatter.format("{} {} {}", null, new Object[] {1, "b"}, new byte[] {1, 2}), is("null [1, b] [1, 2]"));
    }
}
