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

import static org.tsingest.lang.ErrorGroup.newGroup;

/**
 * Error groups of the ingestion pipeline and their codes.
 */
@SuppressWarnings("PublicInnerClass")
public class ErrorGroups {
    /** Common error group. */
    public static class Common {
        /** Common error group. */
        public static final ErrorGroup COMMON_ERR_GROUP = newGroup("CMN", 1);

        /** Unexpected internal error. */
        public static final int INTERNAL_ERR = COMMON_ERR_GROUP.registerErrorCode(1);
    }

    /** Table model error group. */
    public static class Table {
        /** Table error group. */
        public static final ErrorGroup TABLE_ERR_GROUP = newGroup("TBL", 2);

        /** Table schema definition is inconsistent. */
        public static final int TABLE_DEFINITION_ERR = TABLE_ERR_GROUP.registerErrorCode(1);

        /** Stored value case differs from the requested one. */
        public static final int TYPE_MISMATCH_ERR = TABLE_ERR_GROUP.registerErrorCode(2);

        /** Row length differs from the column count of the target schema. */
        public static final int ROW_SHAPE_ERR = TABLE_ERR_GROUP.registerErrorCode(3);
    }

    /** Client error group. */
    public static class Client {
        /** Client error group. */
        public static final ErrorGroup CLIENT_ERR_GROUP = newGroup("CLIENT", 3);

        /** Connection to the store could not be established. */
        public static final int CONNECTION_ERR = CLIENT_ERR_GROUP.registerErrorCode(1);

        /** Bulk stream writer could not be created. */
        public static final int WRITER_SETUP_ERR = CLIENT_ERR_GROUP.registerErrorCode(2);
    }

    /** Row provider error group. */
    public static class Provider {
        /** Provider error group. */
        public static final ErrorGroup PROVIDER_ERR_GROUP = newGroup("PROVIDER", 4);

        /** Provider initialization failed. */
        public static final int PROVIDER_INIT_ERR = PROVIDER_ERR_GROUP.registerErrorCode(1);

        /** Provider close failed. */
        public static final int PROVIDER_CLOSE_ERR = PROVIDER_ERR_GROUP.registerErrorCode(2);
    }

    /** Streamer error group. */
    public static class Streamer {
        /** Streamer error group. */
        public static final ErrorGroup STREAMER_ERR_GROUP = newGroup("STREAMER", 5);

        /** Batch submission failed. */
        public static final int SUBMIT_ERR = STREAMER_ERR_GROUP.registerErrorCode(1);

        /** Waiting for outstanding writes failed. */
        public static final int DRAIN_ERR = STREAMER_ERR_GROUP.registerErrorCode(2);

        /** Write was not acknowledged in time. */
        public static final int WRITE_TIMEOUT_ERR = STREAMER_ERR_GROUP.registerErrorCode(3);

        /** Row insertion through the regular path failed. */
        public static final int INSERT_ERR = STREAMER_ERR_GROUP.registerErrorCode(4);
    }
}
