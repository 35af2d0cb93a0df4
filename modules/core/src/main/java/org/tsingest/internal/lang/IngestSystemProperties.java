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

import org.jetbrains.annotations.Nullable;

/**
 * Access to settings given either as a system property or as an environment variable. A system property wins over an environment
 * variable with the same name.
 */
public final class IngestSystemProperties {
    /** Forces the strict ({@code true}) or lenient ({@code false}) handling of value type mismatches in rows. */
    public static final String TSINGEST_STRICT_TYPE_CHECKS = "TSINGEST_STRICT_TYPE_CHECKS";

    /**
     * Enforces singleton.
     */
    private IngestSystemProperties() {
        // No-op.
    }

    /**
     * Gets either system property or environment variable with given name.
     *
     * @param name Name of the system property or environment variable.
     * @return Value or {@code null} if neither can be found for given name.
     */
    public static @Nullable String getString(String name) {
        assert name != null;

        String v = System.getProperty(name);

        if (v == null) {
            v = System.getenv(name);
        }

        return v;
    }

    /**
     * Gets either system property or environment variable with given name.
     *
     * @param name Name of the system property or environment variable.
     * @param dflt Default value.
     * @return Value or {@code dflt} if neither can be found for given name.
     */
    public static String getString(String name, String dflt) {
        String val = getString(name);

        return val == null ? dflt : val;
    }

    /**
     * Gets either system property or environment variable with given name as a boolean.
     *
     * @param name Name of the system property or environment variable.
     * @return Boolean value or {@code null} if the setting is absent.
     */
    public static @Nullable Boolean getBooleanOrNull(String name) {
        String val = getString(name);

        return val == null ? null : Boolean.valueOf(val.trim());
    }

    /**
     * Gets either system property or environment variable with given name as an integer.
     *
     * @param name Name of the system property or environment variable.
     * @param dflt Default value.
     * @return Integer value or {@code dflt} if the setting is absent or cannot be parsed.
     */
    public static int getInteger(String name, int dflt) {
        String s = getString(name);

        if (s == null) {
            return dflt;
        }

        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException ignore) {
            return dflt;
        }
    }

    /**
     * Gets either system property or environment variable with given name as a long.
     *
     * @param name Name of the system property or environment variable.
     * @param dflt Default value.
     * @return Long value or {@code dflt} if the setting is absent or cannot be parsed.
     */
    public static long getLong(String name, long dflt) {
        String s = getString(name);

        if (s == null) {
            return dflt;
        }

        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException ignore) {
            return dflt;
        }
    }
}
