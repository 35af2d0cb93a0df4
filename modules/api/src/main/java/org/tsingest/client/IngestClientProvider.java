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

/**
 * Service provider of {@link IngestClient}s, looked up by {@link IngestClients#create(String)} through {@link java.util.ServiceLoader}.
 */
public interface IngestClientProvider {
    /**
     * Checks whether the provider can connect to the endpoint.
     *
     * @param endpoint Endpoint, for example {@code host:port}.
     * @return {@code true} if supported.
     */
    boolean supports(String endpoint);

    /**
     * Connects to the endpoint.
     *
     * @param endpoint Endpoint.
     * @return Client.
     * @throws Exception If the connection cannot be established.
     */
    IngestClient connect(String endpoint) throws Exception;
}
