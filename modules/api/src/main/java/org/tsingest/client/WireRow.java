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

import java.util.Arrays;
import java.util.List;
import org.tsingest.table.Row;
import org.tsingest.table.Value;

/**
 * Row of a {@link RowInsertRequest}. Immutable.
 */
public final class WireRow {
    private final List<Value> values;

    private WireRow(List<Value> values) {
        this.values = values;
    }

    /**
     * Creates a row of the given values.
     *
     * @param values Values in column order.
     * @return Row.
     */
    public static WireRow of(Value... values) {
        return new WireRow(List.of(values));
    }

    /**
     * Creates a row of the given values.
     *
     * @param values Values in column order.
     * @return Row.
     */
    public static WireRow of(List<Value> values) {
        return new WireRow(List.copyOf(values));
    }

    /** Returns values in column order. */
    public List<Value> values() {
        return values;
    }

    /** Returns number of values. */
    public int size() {
        return values.size();
    }

    /**
     * Copies the values into a {@link Row} for typed access.
     *
     * @return New row.
     */
    public Row toRow() {
        return Row.fromValues(values);
    }

    /** {@inheritDoc} */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        return o != null && getClass() == o.getClass() && values.equals(((WireRow) o).values);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return values.hashCode();
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "WireRow " + Arrays.toString(values.toArray());
    }
}
