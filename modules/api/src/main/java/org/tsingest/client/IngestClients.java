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

import static org.tsingest.lang.ErrorGroups.Client.CONNECTION_ERR;

import java.util.Objects;
import java.util.ServiceLoader;
import org.tsingest.internal.logger.IngestLogger;
import org.tsingest.internal.logger.Loggers;
import org.tsingest.internal.util.ExceptionUtils;
import org.tsingest.lang.IngestException;

/**
 * Entry point for creating clients.
 */
public final class IngestClients {
    private static final IngestLogger LOG = Loggers.forClass(IngestClients.class);

    private IngestClients() {
        // No-op.
    }

    /**
     * Connects to the endpoint with the first registered {@link IngestClientProvider} that supports it.
     *
     * @param endpoint Endpoint.
     * @return Client.
     * @throws IngestException With {@code CONNECTION_ERR} if no provider supports the endpoint or the connection fails.
     */
    public static IngestClient create(String endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");

        for (IngestClientProvider provider : ServiceLoader.load(IngestClientProvider.class)) {
            if (!provider.supports(endpoint)) {
                continue;
            }

            LOG.info("Connecting [endpoint={}, provider={}]", endpoint, provider.getClass().getName());

            try {
                return provider.connect(endpoint);
            } catch (Exception e) {
                throw ExceptionUtils.withCauseAndCode(CONNECTION_ERR, "Failed to connect [endpoint=" + endpoint + ']', e);
            }
        }

        throw new IngestException(CONNECTION_ERR, "No client provider supports the endpoint [endpoint=" + endpoint + ']');
    }
}
