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

package org.tsingest.lang;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.tsingest.lang.ErrorGroups.Client;
import org.tsingest.lang.ErrorGroups.Streamer;

class IngestExceptionTest {
    @Test
    void rendersCodeAndTraceId() {
        UUID traceId = UUID.fromString("24103638-d079-4a19-a8f6-ca9c23662908");

        var e = new IngestException(traceId, Client.CONNECTION_ERR, "Connection refused", null);

        assertThat(e.groupName(), is("CLIENT"));
        assertThat(e.codeAsString(), is("TSI-CLIENT-1"));
        assertThat(e.getMessage(), is("Connection refused"));
        assertThat(e.toString(), equalTo(
                IngestException.class.getName() + ": TSI-CLIENT-1 TraceId:24103638-d079-4a19-a8f6-ca9c23662908 Connection refused"));
    }

    @Test
    void keepsTraceIdOfWrappedCause() {
        var cause = new IngestException(Client.CONNECTION_ERR, "Connection refused");

        var e = new IngestException(Streamer.SUBMIT_ERR, "Failed to submit batch 2", cause);

        assertThat(e.traceId(), is(cause.traceId()));
        assertThat(e.getCause(), sameInstance(cause));
        assertThat(e.errorCode(), is(1));
        assertThat(e.groupCode(), is(Streamer.STREAMER_ERR_GROUP.code()));
    }
}
