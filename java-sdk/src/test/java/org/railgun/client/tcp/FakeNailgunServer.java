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

package org.railgun.client.tcp;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.railgun.protocol.Chunk;
import org.railgun.protocol.ChunkCodec;
import org.railgun.protocol.ChunkFrameDecoder;
import org.railgun.protocol.MessageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-process stand-in for a Nailgun server. Records every chunk it receives and answers
 * each command chunk with a scripted response.
 */
final class FakeNailgunServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FakeNailgunServer.class);

    private final EventLoopGroup group = new NioEventLoopGroup(2);
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final Channel serverChannel;
    private final List<Chunk> received = new CopyOnWriteArrayList<>();
    private final BlockingQueue<Chunk> arrivals = new LinkedBlockingQueue<>();
    private final AtomicInteger connections = new AtomicInteger();
    private volatile byte[] response;
    private volatile boolean closeAfterResponse;

    FakeNailgunServer() {
        serverChannel = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        channels.add(ch);
                        connections.incrementAndGet();
                        ch.pipeline().addLast("frameDecoder", new ChunkFrameDecoder());
                        ch.pipeline().addLast("script", new ScriptedHandler());
                    }
                })
                .bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0))
                .syncUninterruptibly()
                .channel();
    }

    static byte[] frame(MessageKind kind, String payload) {
        return frame(kind, payload.getBytes(StandardCharsets.UTF_8));
    }

    static byte[] frame(MessageKind kind, byte[] payload) {
        ByteBuf buffer = ChunkCodec.encode(kind, payload);
        try {
            return ByteBufUtil.getBytes(buffer);
        } finally {
            buffer.release();
        }
    }

    static byte[] rawFrame(int length, char tag, byte[] payload) {
        ByteBuf buffer = Unpooled.buffer(ChunkCodec.HEADER_LENGTH + payload.length);
        try {
            buffer.writeInt(length);
            buffer.writeByte(tag);
            buffer.writeBytes(payload);
            return ByteBufUtil.getBytes(buffer);
        } finally {
            buffer.release();
        }
    }

    int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /**
     * Sets the bytes written back after each command chunk. {@code null} means never answer.
     */
    void respondWith(byte[]... frames) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] frame : frames) {
            out.writeBytes(frame);
        }
        response = out.toByteArray();
    }

    void neverRespond() {
        response = null;
    }

    void closeAfterResponse() {
        closeAfterResponse = true;
    }

    int connectionCount() {
        return connections.get();
    }

    List<Chunk> received() {
        return List.copyOf(received);
    }

    /**
     * Returns the received chunks other than heartbeats, in arrival order.
     */
    List<Chunk> requestChunks() {
        return received.stream().filter(c -> c.kind() != MessageKind.HEARTBEAT).collect(Collectors.toList());
    }

    long count(MessageKind kind) {
        return received.stream().filter(c -> c.kind() == kind).count();
    }

    boolean awaitChunk(MessageKind kind, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            Chunk chunk = arrivals.poll(remaining, TimeUnit.NANOSECONDS);
            if (chunk != null && chunk.kind() == kind) {
                return true;
            }
        }
    }

    boolean awaitConnections(int expected, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (connections.get() < expected) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    @Override
    public void close() {
        serverChannel.close().awaitUninterruptibly();
        channels.close().awaitUninterruptibly();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    private final class ScriptedHandler extends SimpleChannelInboundHandler<Chunk> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Chunk chunk) {
            received.add(chunk);
            arrivals.add(chunk);

            byte[] reply = response;
            if (chunk.kind() == MessageKind.COMMAND && reply != null) {
                var written = ctx.writeAndFlush(Unpooled.wrappedBuffer(reply));
                if (closeAfterResponse) {
                    written.addListener(ChannelFutureListener.CLOSE);
                }
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("Connection ended: {}", cause.toString());
            ctx.close();
        }
    }
}
