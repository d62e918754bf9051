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

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.Objects;

/**
 * One framed unit of the protocol: a header and its payload.
 */
public final class Chunk {

    private static final byte[] EMPTY = new byte[0];

    private final ChunkHeader header;
    private final byte[] payload;

    public Chunk(ChunkHeader header, byte[] payload) {
        this.header = Objects.requireNonNull(header, "header");
        this.payload = payload == null ? EMPTY : payload.clone();
        if (this.payload.length != header.length()) {
            throw new IllegalArgumentException(
                    "Header length " + header.length() + " does not match payload length " + this.payload.length);
        }
    }

    public static Chunk of(MessageKind kind, byte[] payload) {
        byte[] bytes = payload == null ? EMPTY : payload;
        return new Chunk(new ChunkHeader(kind, bytes.length), bytes);
    }

    public static Chunk empty(MessageKind kind) {
        return of(kind, EMPTY);
    }

    public ChunkHeader header() {
        return header;
    }

    public MessageKind kind() {
        return header.kind();
    }

    /**
     * Returns a copy of the payload.
     */
    public byte[] payload() {
        return payload.clone();
    }

    public String payloadAsString(Charset charset) {
        return new String(payload, charset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Chunk)) {
            return false;
        }
        Chunk other = (Chunk) o;
        return header.equals(other.header) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * header.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Chunk[kind=" + header.kind() + ", length=" + header.length() + "]";
    }
}
