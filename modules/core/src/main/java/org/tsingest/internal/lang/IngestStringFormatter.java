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

package org.tsingest.internal.lang;

import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

/**
 * Formats log messages with {@code {}} anchors. Each anchor is replaced by the next argument; an anchor preceded by a backslash is
 * printed literally. Anchors without a matching argument stay in the output as is.
 */
public final class IngestStringFormatter {
    /** Anchor. */
    private static final String ANCHOR = "{}";

    /** Escape char. */
    private static final char ESCAPE = '\\';

    private IngestStringFormatter() {
        // No-op.
    }

    /**
     * Substitutes arguments into the message pattern.
     *
     * @param pattern Message pattern.
     * @param params Arguments.
     * @return Formatted message.
     */
    public static String format(@Nullable String pattern, @Nullable Object... params) {
        if (pattern == null || params == null || params.length == 0) {
            return String.valueOf(pattern);
        }

        var sb = new StringBuilder(pattern.length() + 16 * params.length);

        int from = 0;
        int paramIdx = 0;

        while (paramIdx < params.length) {
            int anchor = pattern.indexOf(ANCHOR, from);

            if (anchor < 0) {
                break;
            }

            if (anchor > 0 && pattern.charAt(anchor - 1) == ESCAPE) {
                sb.append(pattern, from, anchor - 1).append(ANCHOR);
            } else {
                sb.append(pattern, from, anchor);

                appendParameter(sb, params[paramIdx++]);
            }

            from = anchor + ANCHOR.length();
        }

        return sb.append(pattern, from, pattern.length()).toString();
    }

    private static void appendParameter(StringBuilder sb, @Nullable Object param) {
        if (param == null) {
            sb.append("null");
        } else if (param instanceof Object[]) {
            sb.append(Arrays.deepToString((Object[]) param));
        } else if (param instanceof byte[]) {
            sb.append(Arrays.toString((byte[]) param));
        } else if (param instanceof int[]) {
            sb.append(Arrays.toString((int[]) param));
        } else if (param instanceof long[]) {
            sb.append(Arrays.toString((long[]) param));
        } else {
            try {
                sb.append(param);
            } catch (RuntimeException e) {
                sb.append("[FAILED toString() of ").append(param.getClass().getName()).append(": ").append(e).append(']');
            }
        }
    }
}
