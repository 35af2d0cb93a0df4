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

package org.tsingest.table;

import static org.tsingest.lang.ErrorGroups.Table.TYPE_MISMATCH_ERR;

import org.tsingest.lang.IngestException;

/**
 * Thrown by a {@link Row} accessor under {@link TypeMismatchPolicy#STRICT} when the stored value case differs from the requested one.
 */
public class RowTypeMismatchException extends IngestException {
    /** Serial version UID. */
    private static final long serialVersionUID = 0L;

    /** Index of the offending value. */
    private final int index;

    /** Name of the requested type. */
    private final String expectedType;

    /**
     * Constructor.
     *
     * @param index Index of the offending value.
     * @param expectedType Name of the requested type.
     * @param actual Stored value.
     */
    public RowTypeMismatchException(int index, String expectedType, Value actual) {
        super(TYPE_MISMATCH_ERR, "Expected `" + expectedType + "` value at index " + index + ", got " + actual);

        this.index = index;
        this.expectedType = expectedType;
    }

    /** Returns index of the offending value. */
    public int index() {
        return index;
    }

    /** Returns name of the requested type. */
    public String expectedType() {
        return expectedType;
    }
}
