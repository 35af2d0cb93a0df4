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

package org.tsingest.provider;

import java.util.Iterator;
import java.util.List;
import org.tsingest.client.WireColumnSchema;
import org.tsingest.client.WireRow;

/**
 * Source of wire rows for the regular insertion path.
 */
public interface WireDataProvider extends DataProvider {
    /**
     * Returns name of the target table.
     *
     * @return Table name.
     */
    String tableName();

    /**
     * Returns column descriptions the rows are aligned to.
     *
     * @return Column descriptions.
     */
    List<WireColumnSchema> wireSchema();

    /**
     * Returns a lazy sequence of wire rows that ends after {@link #rowCount()} rows. Not thread-safe.
     *
     * @return Wire row iterator.
     */
    Iterator<WireRow> wireRows();
}
