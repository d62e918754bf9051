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
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.TooLongFrameException;
import org.railgun.exception.RailgunProtocolDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Netty decoder turning an inbound byte stream into {@link Chunk} objects.
 *
 * <p>Frames are emitted only once complete. The tag is validated as soon as the header is
 * available, so an unknown tag fails the pipeline without waiting for its payload. Bytes
 * left over when the channel goes inactive are reported downstream as a
 * {@link RailgunProtocolDecodeException} before the inactive event.
 */
public class ChunkFrameDecoder extends ByteToMessageDecoder {
    private static final Logger log = LoggerFactory.getLogger(ChunkFrameDecoder.class);

    private final int maxPayloadLength;

    public ChunkFrameDecoder() {
        this(Integer.MAX_VALUE - ChunkCodec.HEADER_LENGTH);
    }

    public ChunkFrameDecoder(int maxPayloadLength) {
        this.maxPayloadLength = maxPayloadLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (in.readableBytes() < ChunkCodec.HEADER_LENGTH) {
            return;
        }

        in.markReaderIndex();
        ChunkHeader header = ChunkCodec.decodeHeader(in);
        if (header.length() > maxPayloadLength) {
            in.skipBytes(in.readableBytes());
            throw new TooLongFrameException(
                    header.kind() + " payload of " + header.length() + " bytes exceeds " + maxPayloadLength);
        }

        if (in.readableBytes() < header.length()) {
            in.resetReaderIndex();
            return;
        }

        byte[] payload = new byte[(int) header.length()];
        in.readBytes(payload);
        log.trace("Decoded {} chunk with {} payload bytes", header.kind(), payload.length);
        out.add(new Chunk(header, payload));
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (in.isReadable()) {
            decode(ctx, in, out);
        }
        if (in.isReadable()) {
            RailgunProtocolDecodeException truncated = truncation(in);
            in.skipBytes(in.readableBytes());
            ctx.fireExceptionCaught(truncated);
        }
    }

    private static RailgunProtocolDecodeException truncation(ByteBuf in) {
        int available = in.readableBytes();
        if (available < ChunkCodec.HEADER_LENGTH) {
            return new RailgunProtocolDecodeException("Truncated chunk header: stream closed after " + available
                    + " of " + ChunkCodec.HEADER_LENGTH + " bytes");
        }
        long length = in.getUnsignedInt(in.readerIndex());
        MessageKind kind = MessageTypes.kindFor(in.getByte(in.readerIndex() + 4));
        return new RailgunProtocolDecodeException("Truncated " + kind + " payload: stream closed after "
                + (available - ChunkCodec.HEADER_LENGTH) + " of " + length + " bytes");
    }
}
