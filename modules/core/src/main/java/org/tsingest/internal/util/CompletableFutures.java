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

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.jetbrains.annotations.Nullable;

/**
 * Helper methods for {@link CompletableFuture}.
 */
public final class CompletableFutures {
    private CompletableFutures() {
        // No-op.
    }

    /**
     * Returns the failure of a completed future, unwrapped from {@link CompletionException} and {@link ExecutionException}.
     *
     * @param future Completed future.
     * @return Failure cause or {@code null} if the future is not done or completed successfully.
     */
    public static @Nullable Throwable failureOf(CompletableFuture<?> future) {
        if (!future.isCompletedExceptionally()) {
            return null;
        }

        try {
            future.join();

            return null;
        } catch (CompletionException | CancellationException e) {
            return ExceptionUtils.unwrapCause(e);
        }
    }
}
