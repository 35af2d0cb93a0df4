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
import org.tsingest.table.Row;
import org.tsingest.table.TableSchema;

/**
 * Source of structured rows of one table.
 */
public interface TableDataProvider extends DataProvider {
    /**
     * Returns schema of the target table. Rows are aligned to its columns.
     *
     * @return Table schema.
     */
    TableSchema tableSchema();

    /**
     * Returns a lazy sequence of rows. The sequence is consumed once: yielded rows are owned by the caller and the sequence ends after
     * {@link #rowCount()} rows. Not thread-safe.
     *
     * @return Row iterator.
     */
    Iterator<Row> rows();
}
