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

import org.tsingest.lang.IngestException;
import org.tsingest.table.TableSchema;

/**
 * Connection to the store.
 */
public interface IngestClient extends AutoCloseable {
    /**
     * Returns the endpoint the client is connected to.
     *
     * @return Endpoint.
     */
    String endpoint();

    /**
     * Creates a streaming writer for one table.
     *
     * @param database Database name.
     * @param schema Schema of the target table.
     * @param options Writer options.
     * @return Writer.
     * @throws IngestException With {@code WRITER_SETUP_ERR} if the writer cannot be created.
     */
    BulkStreamWriter createBulkStreamWriter(String database, TableSchema schema, BulkWriteOptions options);

    /**
     * Returns the regular insertion handle of a database.
     *
     * @param name Database name.
     * @return Database.
     */
    Database database(String name);

    /** Closes the connection. */
    @Override
    void close();
}
