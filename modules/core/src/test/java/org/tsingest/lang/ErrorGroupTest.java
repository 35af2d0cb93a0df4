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

package org.tsingest.lang;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.tsingest.lang.ErrorGroups.Common;
import org.tsingest.lang.ErrorGroups.Table;

class ErrorGroupTest {
    @Test
    void createsErrorMessage() {
        UUID traceId = UUID.fromString("24103638-d079-4a19-a8f6-ca9c23662908");

        String errorMessage = ErrorGroup.errorMessage(traceId, "TBL", Table.TYPE_MISMATCH_ERR, "I'm the reason");

        assertThat(errorMessage, equalTo("TSI-TBL-2 TraceId:24103638-d079-4a19-a8f6-ca9c23662908 I'm the reason"));
    }

    @Test
    void fullCodeCombinesGroupAndErrorCode() {
        int code = Table.ROW_SHAPE_ERR;

        assertThat(ErrorGroup.extractGroupCode(code), is(Table.TABLE_ERR_GROUP.code()));
        assertThat(ErrorGroup.extractErrorCode(code), is(3));
        assertThat(ErrorGroup.errorGroupByCode(code), sameInstance(Table.TABLE_ERR_GROUP));
    }

    @Test
    void rejectsDuplicateCodesAndGroups() {
        assertThrows(IllegalArgumentException.class, () -> Common.COMMON_ERR_GROUP.registerErrorCode(1));
        assertThrows(IllegalArgumentException.class, () -> Common.COMMON_ERR_GROUP.registerErrorCode(0x10000));
        assertThrows(IllegalArgumentException.class, () -> ErrorGroup.newGroup("CMN", 0xFFF0));
        assertThrows(IllegalArgumentException.class, () -> ErrorGroup.newGroup("ANOTHER", Common.COMMON_ERR_GROUP.code()));
    }

    @SuppressWarnings({"rawtypes", "OptionalGetWithoutIsPresent"})
    @Test
    void groupIdsAreUnique() throws IllegalAccessException {
        Map<Integer, ErrorGroup> errGroups = new HashMap<>();

        for (Class cls : ErrorGroups.class.getDeclaredClasses()) {
            var errGroupField = Arrays.stream(cls.getFields()).filter(f -> f.getName().endsWith("_ERR_GROUP")).findFirst().get();
            var errGroup = (ErrorGroup) errGroupField.get(null);

            var existing = errGroups.putIfAbsent(errGroup.code(), errGroup);

            if (existing != null) {
                fail("Duplicate error group id: " + errGroup.code() + " (" + existing.name() + ", " + errGroup.name() + ")");
            }
        }
    }
}
