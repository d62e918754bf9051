/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.railgun.protocol;

import java.util.Objects;

/**
 * The fixed-width header preceding every chunk: the payload length as an unsigned
 * 32-bit integer and the message kind.
 *
 * @param kind the message kind
 * @param length the payload length in bytes, between 0 and {@link #MAX_LENGTH}
 */
public record ChunkHeader(MessageKind kind, long length) {

    public static final long MAX_LENGTH = 0xFFFF_FFFFL;

    public ChunkHeader {
        Objects.requireNonNull(kind, "kind");
        if (length < 0 || length > MAX_LENGTH) {
            throw new IllegalArgumentException("Chunk length out of range: " + length);
        }
    }
}
