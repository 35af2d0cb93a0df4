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

import java.util.List;
import org.tsingest.lang.IngestException;

/**
 * Regular, request-per-call insertion into one database.
 */
public interface Database {
    /**
     * Returns database name.
     *
     * @return Database name.
     */
    String name();

    /**
     * Inserts rows and waits for the acknowledgement.
     *
     * @param requests Insert requests.
     * @return Number of rows the store accepted.
     * @throws IngestException If the insert fails.
     */
    long insert(List<RowInsertRequest> requests);
}
