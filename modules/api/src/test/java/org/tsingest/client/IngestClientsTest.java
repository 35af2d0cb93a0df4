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
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.tsingest.internal.testframework.IngestTestUtils.assertThrowsWithCode;
import static org.tsingest.lang.ErrorGroups.Client.CONNECTION_ERR;

import java.net.ConnectException;
import org.junit.jupiter.api.Test;
import org.tsingest.internal.testframework.BaseIngestTest;
import org.tsingest.lang.IngestException;

class IngestClientsTest extends BaseIngestTest {
    @Test
    void usesProviderSupportingEndpoint() {
        try (IngestClient client = IngestClients.create("test:4001")) {
            assertThat(client.endpoint(), is("test:4001"));
        }
    }

    @Test
    void failsWithoutProvider() {
        assertThrowsWithCode(IngestException.class, CONNECTION_ERR, () -> IngestClients.create("nowhere:4001"),
                "No client provider supports the endpoint");
    }

    @Test
    void wrapsConnectionFailure() {
        IngestException e = assertThrowsWithCode(IngestException.class, CONNECTION_ERR,
                () -> IngestClients.create(TestIngestClientProvider.REFUSED), "Failed to connect");

        assertThat(e.getCause(), instanceOf(ConnectException.class));
    }
}
