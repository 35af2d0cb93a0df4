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

import static org.tsingest.internal.lang.IngestSystemProperties.TSINGEST_STRICT_TYPE_CHECKS;

import org.jetbrains.annotations.Nullable;
import org.tsingest.internal.lang.IngestSystemProperties;

/**
 * What a {@link Row} accessor does when the stored value is neither the requested type nor null.
 *
 * <p>A mismatch is a bug of the code that produces rows, not a property of the data. Development runs make it fatal so that such bugs
 * surface in tests; production runs must keep ingesting and read the value as absent.
 */
public enum TypeMismatchPolicy {
    /** Throws {@link RowTypeMismatchException}. */
    STRICT {
        @Override
        <T> @Nullable T onMismatch(int index, String expectedType, Value actual) {
            throw new RowTypeMismatchException(index, expectedType, actual);
        }
    },

    /** Reads the value as absent. */
    LENIENT {
        @Override
        <T> @Nullable T onMismatch(int index, String expectedType, Value actual) {
            return null;
        }
    };

    /** Policy of rows created without an explicit one. */
    private static final TypeMismatchPolicy DEFAULT = resolveDefault();

    /**
     * Handles a mismatch.
     *
     * @param index Index of the value.
     * @param expectedType Name of the requested type.
     * @param actual Stored value.
     * @param <T> Accessor result type.
     * @return Result of the accessor.
     */
    abstract <T> @Nullable T onMismatch(int index, String expectedType, Value actual);

    /**
     * Returns the policy of rows created without an explicit one. It is taken from the {@code TSINGEST_STRICT_TYPE_CHECKS} setting;
     * when the setting is absent, the policy is {@link #STRICT} if assertions are enabled for this package and {@link #LENIENT}
     * otherwise.
     *
     * @return Default policy.
     */
    public static TypeMismatchPolicy defaultPolicy() {
        return DEFAULT;
    }

    private static TypeMismatchPolicy resolveDefault() {
        Boolean strict = IngestSystemProperties.getBooleanOrNull(TSINGEST_STRICT_TYPE_CHECKS);

        if (strict == null) {
            strict = TypeMismatchPolicy.class.desiredAssertionStatus();
        }

        return strict ? STRICT : LENIENT;
    }
}
