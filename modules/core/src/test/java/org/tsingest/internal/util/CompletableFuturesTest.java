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
package org.tsingest.internal.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;
import org.tsingest.internal.testframework.BaseIngestTest;

class CompletableFuturesTest extends BaseIngestTest {
    @Test
    void failureOfFailedFuture() {
        var failure = new IllegalStateException("Disk full");

        assertThat(CompletableFutures.failureOf(CompletableFuture.failedFuture(failure)), sameInstance(failure));
    }

    @Test
    void failureIsUnwrappedFromCompletionException() {
        var failure = new IllegalStateException("Disk full");
        var fut = new CompletableFuture<Void>();

        fut.completeExceptionally(new CompletionException(failure));

        assertThat(CompletableFutures.failureOf(fut), sameInstance(failure));
    }

    @Test
    void noFailureOfSuccessfulOrPendingFuture() {
        assertThat(CompletableFutures.failureOf(CompletableFuture.completedFuture(1)), is(nullValue()));
        assertThat(CompletableFutures.failureOf(new CompletableFuture<>()), is(nullValue()));
    }
}
