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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class ValueTest {
    @Test
    void caseDeterminesType() {
        assertThat(Value.int32(42).type(), is(ColumnDataType.INT32));
        assertThat(Value.int64(42).type(), is(ColumnDataType.INT64));
        assertThat(Value.timestampMillisecond(1L).type(), is(ColumnDataType.TIMESTAMP_MILLISECOND));
        assertThat(Value.nullValue().type(), nullValue());
        assertThat(Value.nullValue().isNull(), is(true));
    }

    @Test
    void valuesOfDifferentCasesAreNotEqual() {
        assertThat(Value.int32(42), not(Value.int64(42)));
        assertThat(Value.timestampSecond(5), not(Value.timestampMillisecond(5)));
        assertThat(Value.binary(new byte[] {1, 2}), is(Value.binary(new byte[] {1, 2})));
    }

    @Test
    void nullPayloadsBecomeNullValue() {
        assertThat(Value.string(null).isNull(), is(true));
        assertThat(Value.json(null).isNull(), is(true));
        assertThat(Value.binary(null).isNull(), is(true));
        assertThat(Value.decimal128(null).isNull(), is(true));
    }

    @Test
    void unsignedRangesAreChecked() {
        assertThat(Value.uint8(255).type(), is(ColumnDataType.UINT8));
        assertThat(Value.uint16(65535).type(), is(ColumnDataType.UINT16));
        assertThat(Value.uint32(0xFFFFFFFFL).type(), is(ColumnDataType.UINT32));

        assertThrows(IllegalArgumentException.class, () -> Value.uint8(256));
        assertThrows(IllegalArgumentException.class, () -> Value.uint8(-1));
        assertThrows(IllegalArgumentException.class, () -> Value.uint16(65536));
        assertThrows(IllegalArgumentException.class, () -> Value.uint32(0x1_0000_0000L));
    }

    @Test
    void decimalMustFitIn128Bits() {
        BigInteger max = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);

        assertThat(Value.decimal128(max).type(), is(ColumnDataType.DECIMAL128));
        assertThrows(IllegalArgumentException.class, () -> Value.decimal128(max.add(BigInteger.ONE)));
    }

    @Test
    void rendersCaseAndPayload() {
        assertThat(Value.int32(42).toString(), is("Int32(42)"));
        assertThat(Value.string("test").toString(), is("String(\"test\")"));
        assertThat(Value.bool(true).toString(), is("Boolean(true)"));
        assertThat(Value.uint64(-1L).toString(), is("Uint64(18446744073709551615)"));
        assertThat(Value.nullValue().toString(), is("Null"));
    }
}
