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

import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * Compression of write requests.
 */
public enum CompressionType {
    /** No compression. */
    NONE,

    /** LZ4. */
    LZ4,

    /** Zstandard. */
    ZSTD;

    /**
     * Parses a compression name, ignoring case: {@code none}, {@code false} and {@code 0} mean {@link #NONE}, {@code lz4} means
     * {@link #LZ4}, {@code zstd} means {@link #ZSTD}.
     *
     * @param name Compression name.
     * @return Compression type or {@code null} if the name is not recognized.
     */
    public static @Nullable CompressionType fromName(@Nullable String name) {
        if (name == null) {
            return null;
        }

        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "none":
            case "false":
            case "0":
                return NONE;

            case "lz4":
                return LZ4;

            case "zstd":
                return ZSTD;

            default:
                return null;
        }
    }
}
