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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.railgun.exception.RailgunProtocolDecodeException;

import java.nio.charset.Charset;

/**
 * Encodes and decodes chunk frames.
 *
 * <p>Frame layout, all integers big-endian:
 * <pre>
 * [4 bytes: payload length][1 byte: type tag][payload]
 * </pre>
 */
public final class ChunkCodec {

    public static final int HEADER_LENGTH = 5;

    private ChunkCodec() {}

    public static ByteBuf encode(MessageKind kind, String payload, Charset charset) {
        return encode(kind, payload.getBytes(charset));
    }

    /**
     * Encodes a complete frame, header followed by the payload bytes verbatim.
     *
     * @param kind the message kind
     * @param payload the payload, possibly empty
     * @return a buffer holding exactly {@code HEADER_LENGTH + payload.length} readable bytes
     */
    public static ByteBuf encode(MessageKind kind, byte[] payload) {
        ByteBuf buffer = Unpooled.buffer(HEADER_LENGTH + payload.length);
        writeHeader(buffer, new ChunkHeader(kind, payload.length));
        buffer.writeBytes(payload);
        return buffer;
    }

    public static void writeHeader(ByteBuf buffer, ChunkHeader header) {
        buffer.writeInt((int) header.length());
        buffer.writeByte(MessageTypes.tagFor(header.kind()));
    }

    public static ChunkHeader decodeHeader(byte[] header) {
        return decodeHeader(Unpooled.wrappedBuffer(header));
    }

    /**
     * Reads a header from the buffer, advancing its reader index by {@link #HEADER_LENGTH}.
     *
     * @param buffer the buffer positioned at the start of a header
     * @return the decoded header
     * @throws RailgunProtocolDecodeException if fewer than five bytes are readable
     * @throws org.railgun.exception.RailgunUnknownMessageTypeException if the tag is unknown
     */
    public static ChunkHeader decodeHeader(ByteBuf buffer) {
        if (buffer.readableBytes() < HEADER_LENGTH) {
            throw new RailgunProtocolDecodeException("Truncated chunk header: expected " + HEADER_LENGTH
                    + " bytes but got " + buffer.readableBytes());
        }
        long length = buffer.readUnsignedInt();
        MessageKind kind = MessageTypes.kindFor(buffer.readByte());
        return new ChunkHeader(kind, length);
    }

    /**
     * Decodes a whole frame from the buffer.
     *
     * @throws RailgunProtocolDecodeException if the header or the payload is truncated
     */
    public static Chunk decode(ByteBuf buffer) {
        ChunkHeader header = decodeHeader(buffer);
        if (buffer.readableBytes() < header.length()) {
            throw new RailgunProtocolDecodeException("Truncated " + header.kind() + " payload: expected "
                    + header.length() + " bytes but got " + buffer.readableBytes());
        }
        byte[] payload = new byte[(int) header.length()];
        buffer.readBytes(payload);
        return new Chunk(header, payload);
    }
}
