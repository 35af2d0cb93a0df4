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

package org.tsingest.benchmark;

import org.tsingest.client.IngestClient;
import org.tsingest.client.IngestClientProvider;

/**
 * Provider of {@link LoopbackIngestClient}, used for endpoints starting with {@code loopback}.
 */
public class LoopbackIngestClientProvider implements IngestClientProvider {
    /** Endpoint prefix. */
    public static final String SCHEME = "loopback";

    /** {@inheritDoc} */
    @Override
    public boolean supports(String endpoint) {
        return endpoint.startsWith(SCHEME);
    }

    /** {@inheritDoc} */
    @Override
    public IngestClient connect(String endpoint) {
        return new LoopbackIngestClient(endpoint);
    }
}
