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

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.Locale;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;

/**
 * A named, numbered collection of error codes that belong to one component of the ingestion pipeline.
 * Both the name and the number must be unique across all groups.
 */
public class ErrorGroup {
    /** Prefix of the human-readable form of an error code. */
    public static final String ERR_PREFIX = "TSI-";

    /** Registered groups by group code. */
    private static final Int2ObjectMap<ErrorGroup> registeredGroups = new Int2ObjectOpenHashMap<>();

    /** Group name. */
    private final String groupName;

    /** Group code. */
    private final int groupCode;

    /** Error codes registered within this group. */
    private final IntSet codes = new IntOpenHashSet();

    private ErrorGroup(String groupName, int groupCode) {
        this.groupName = groupName;
        this.groupCode = groupCode;
    }

    /**
     * Returns a name of this group.
     *
     * @return Group name.
     */
    public String name() {
        return groupName;
    }

    /**
     * Returns a code of this group.
     *
     * @return Group code.
     */
    public int code() {
        return groupCode;
    }

    /**
     * Registers a new error code within this group.
     *
     * @param errorCode Error code, unique within the group, in range {@code (0, 0xFFFF]}.
     * @return Full error code: the group code in the upper 16 bits and the error code in the lower 16 bits.
     * @throws IllegalArgumentException If the code is out of range or already registered.
     */
    public synchronized int registerErrorCode(int errorCode) {
        if (errorCode <= 0 || errorCode > 0xFFFF) {
            throw new IllegalArgumentException("Error code should be greater than 0 and less than or equal to 0xFFFF");
        }

        if (!codes.add(errorCode)) {
            throw new IllegalArgumentException("Error code already registered [errorCode=" + errorCode + ", group=" + name() + ']');
        }

        return (code() << 16) | (errorCode & 0xFFFF);
    }

    /**
     * Creates a new error group.
     *
     * @param groupName Group name, converted to upper case.
     * @param groupCode Group code in range {@code (0, 0xFFFF]}.
     * @return New error group.
     * @throws IllegalArgumentException If the name is empty or the name or code is already taken.
     */
    public static synchronized ErrorGroup newGroup(String groupName, int groupCode) {
        if (groupName == null || groupName.isEmpty()) {
            throw new IllegalArgumentException("Group name is null or empty");
        }

        if (groupCode <= 0 || groupCode > 0xFFFF) {
            throw new IllegalArgumentException("Group code should be greater than 0 and less than or equal to 0xFFFF");
        }

        String grpName = groupName.toUpperCase(Locale.ENGLISH);

        if (registeredGroups.containsKey(groupCode)) {
            throw new IllegalArgumentException("Error group already registered [groupName=" + groupName + ", groupCode=" + groupCode
                    + ", registeredGroup=" + registeredGroups.get(groupCode) + ']');
        }

        for (ErrorGroup group : registeredGroups.values()) {
            if (group.name().equals(grpName)) {
                throw new IllegalArgumentException("Error group already registered [groupName=" + groupName + ", groupCode=" + groupCode
                        + ", registeredGroup=" + group + ']');
            }
        }

        ErrorGroup newGroup = new ErrorGroup(grpName, groupCode);

        registeredGroups.put(groupCode, newGroup);

        return newGroup;
    }

    /**
     * Returns group code extracted from the given full error code.
     *
     * @param code Full error code.
     * @return Group code.
     */
    public static int extractGroupCode(int code) {
        return code >>> 16;
    }

    /**
     * Returns error code extracted from the given full error code.
     *
     * @param code Full error code.
     * @return Error code.
     */
    public static int extractErrorCode(int code) {
        return code & 0xFFFF;
    }

    /**
     * Returns error group the given full error code belongs to.
     *
     * @param code Full error code.
     * @return Error group or {@code null} if no group is registered under the code's group part.
     */
    public static synchronized @Nullable ErrorGroup errorGroupByCode(int code) {
        return registeredGroups.get(extractGroupCode(code));
    }

    /**
     * Creates an error message with the error code prefix and the trace id.
     *
     * @param traceId Unique identifier of the error.
     * @param groupName Group name.
     * @param code Full error code.
     * @param message Original message.
     * @return Message in format {@code TSI-GROUP-code TraceId:uuid message}.
     */
    public static String errorMessage(UUID traceId, String groupName, int code, @Nullable String message) {
        return ERR_PREFIX + groupName + '-' + extractErrorCode(code) + " TraceId:" + traceId + ((message != null) ? ' ' + message : "");
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "ErrorGroup [name=" + name() + ", code=" + code() + ']';
    }
}
