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

import java.util.UUID;

/**
 * Exception that carries a trace identifier and a full error code.
 */
public interface TraceableException {
    /**
     * Returns a unique identifier of the exception.
     *
     * @return Unique identifier of the exception.
     */
    UUID traceId();

    /**
     * Returns a full error code: the group code in the upper 16 bits and the error code in the lower 16 bits.
     *
     * @return Full error code.
     */
    int code();

    /**
     * Returns the group part of the code.
     *
     * @return Group code.
     */
    int groupCode();

    /**
     * Returns the code that identifies the problem within its group.
     *
     * @return Error code.
     */
    int errorCode();
}
