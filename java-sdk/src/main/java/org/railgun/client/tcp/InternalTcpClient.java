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

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.railgun.exception.RailgunConnectionException;
import org.railgun.exception.RailgunException;
import org.railgun.exception.RailgunNotConnectedException;
import org.railgun.exception.RailgunProtocolDecodeException;
import org.railgun.exception.RailgunTransportException;
import org.railgun.exception.RailgunUnknownMessageTypeException;
import org.railgun.protocol.Chunk;
import org.railgun.protocol.ChunkCodec;
import org.railgun.protocol.ChunkFrameDecoder;
import org.railgun.protocol.MessageKind;
import org.railgun.protocol.MessageTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the Netty channel of one session and serializes every write and state transition.
 *
 * <p>Inbound bytes are framed by {@link ChunkFrameDecoder} on the event loop and queued per
 * session. A caller waiting in {@link #readLocked()} blocks on that queue, not on the lock, so
 * heartbeats keep flowing while a command is silent and {@link #close()} never waits for a
 * reader. Closing queues a failure that wakes the reader of the closed session.
 */
final class InternalTcpClient {
    private static final Logger log = LoggerFactory.getLogger(InternalTcpClient.class);

    private static final byte[] EMPTY_PAYLOAD = new byte[0];
    private static final long SHUTDOWN_TIMEOUT_MILLIS = 2000;

    enum State {
        DISCONNECTED,
        CONNECTED
    }

    private final String host;
    private final int port;
    private final Duration connectionTimeout;
    private final Duration heartbeatInterval;
    private final ReentrantLock channelLock = new ReentrantLock(true);

    private Session session;

    InternalTcpClient(String host, int port, Duration connectionTimeout, Duration heartbeatInterval) {
        this.host = host;
        this.port = port;
        this.connectionTimeout = connectionTimeout;
        this.heartbeatInterval = heartbeatInterval;
    }

    void connect() {
        channelLock.lock();
        try {
            if (session != null) {
                return;
            }
            BlockingDeque<Object> inbound = new LinkedBlockingDeque<>();
            EventLoopGroup group = new NioEventLoopGroup(1, new DefaultThreadFactory("railgun-io", true));
            Bootstrap bootstrap = new Bootstrap()
                    .group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .option(ChannelOption.SO_KEEPALIVE, true)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, toMillis(connectionTimeout))
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast("frameDecoder", new ChunkFrameDecoder());
                            ch.pipeline().addLast("chunkQueue", new InboundChunkHandler(inbound, host, port));
                        }
                    });

            ChannelFuture connected = bootstrap.connect(host, port).awaitUninterruptibly();
            if (!connected.isSuccess()) {
                group.shutdownGracefully(0, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
                throw new RailgunConnectionException(host, port, connected.cause());
            }

            HeartbeatTask heartbeat = new HeartbeatTask(heartbeatInterval, this::emitHeartbeat);
            session = new Session(connected.channel(), group, inbound, heartbeat);
            heartbeat.start("railgun-heartbeat-" + host + ":" + port);
            log.debug("Connected to {}:{}", host, port);
        } finally {
            channelLock.unlock();
        }
    }

    void close() {
        Session closing;
        channelLock.lock();
        try {
            closing = session;
            session = null;
            if (closing == null) {
                return;
            }
            closing.inbound.offerFirst(
                    new RailgunNotConnectedException("Connection to " + host + ":" + port + " was closed"));
            ChannelFuture closed = closing.channel.close().awaitUninterruptibly();
            if (!closed.isSuccess()) {
                log.debug("Ignoring error while closing channel to {}:{}", host, port, closed.cause());
            }
            closing.heartbeat.stop();
            log.debug("Closed connection to {}:{}", host, port);
        } finally {
            channelLock.unlock();
        }
        closing.heartbeat.awaitTermination();
        closing.group
                .shutdownGracefully(0, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
                .awaitUninterruptibly(SHUTDOWN_TIMEOUT_MILLIS * 2);
    }

    void writeLocked(MessageKind kind, byte[] payload) {
        channelLock.lock();
        try {
            if (session == null) {
                throw new RailgunNotConnectedException();
            }
            ChannelFuture written = write(session.channel, kind, payload);
            if (!written.isSuccess()) {
                throw new RailgunTransportException(
                        "Failed to write " + kind + " chunk to " + host + ":" + port, written.cause());
            }
        } finally {
            channelLock.unlock();
        }
    }

    /**
     * Waits for the next chunk sent by the server on the current session.
     *
     * @return the chunk, whose kind is one of {@link MessageTypes#serverMessages()}
     * @throws RailgunUnknownMessageTypeException if the tag is unknown or not a server kind
     * @throws RailgunProtocolDecodeException if the server closes the stream before or inside a chunk
     * @throws RailgunTransportException if the channel fails, or the client is closed meanwhile
     */
    Chunk readLocked() {
        BlockingDeque<Object> inbound;
        channelLock.lock();
        try {
            if (session == null) {
                throw new RailgunNotConnectedException();
            }
            inbound = session.inbound;
        } finally {
            channelLock.unlock();
        }

        Object next;
        try {
            next = inbound.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RailgunTransportException("Interrupted while waiting for a chunk from " + host + ":" + port, e);
        }
        if (next instanceof RailgunException) {
            // later reads on this session fail the same way
            inbound.offerFirst(next);
            throw (RailgunException) next;
        }

        Chunk chunk = (Chunk) next;
        if (!MessageTypes.isServerMessage(chunk.kind())) {
            throw new RailgunUnknownMessageTypeException(
                    chunk.kind().getTag(), "Unexpected message type from server: " + chunk.kind());
        }
        log.trace("Received {} chunk with {} bytes", chunk.kind(), chunk.header().length());
        return chunk;
    }

    /**
     * Sends one heartbeat unless the connection is gone.
     *
     * @return {@code false} if the connection is torn down or the write failed
     */
    boolean emitHeartbeat() {
        channelLock.lock();
        try {
            if (session == null || !session.channel.isActive()) {
                return false;
            }
            ChannelFuture written = write(session.channel, MessageKind.HEARTBEAT, EMPTY_PAYLOAD);
            if (!written.isSuccess()) {
                log.warn("Heartbeat to {}:{} failed: {}", host, port, String.valueOf(written.cause()));
                return false;
            }
            return true;
        } finally {
            channelLock.unlock();
        }
    }

    boolean isConnected() {
        channelLock.lock();
        try {
            return session != null;
        } finally {
            channelLock.unlock();
        }
    }

    State state() {
        return isConnected() ? State.CONNECTED : State.DISCONNECTED;
    }

    String host() {
        return host;
    }

    int port() {
        return port;
    }

    private ChannelFuture write(Channel channel, MessageKind kind, byte[] payload) {
        ByteBuf frame = ChunkCodec.encode(kind, payload);
        ChannelFuture written = channel.writeAndFlush(frame);
        if (!written.awaitUninterruptibly(toMillis(connectionTimeout))) {
            written.cancel(false);
            throw new RailgunTransportException("Timed out writing " + kind + " chunk to " + host + ":" + port);
        }
        log.trace("Sent {} chunk with {} bytes", kind, payload.length);
        return written;
    }

    private static int toMillis(Duration duration) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, duration.toMillis()));
    }

    private static final class Session {
        private final Channel channel;
        private final EventLoopGroup group;
        private final BlockingDeque<Object> inbound;
        private final HeartbeatTask heartbeat;

        private Session(Channel channel, EventLoopGroup group, BlockingDeque<Object> inbound, HeartbeatTask heartbeat) {
            this.channel = channel;
            this.group = group;
            this.inbound = inbound;
            this.heartbeat = heartbeat;
        }
    }

    /**
     * Queues decoded chunks, and the failure that ends the session, for the reading caller.
     */
    private static final class InboundChunkHandler extends SimpleChannelInboundHandler<Chunk> {
        private final BlockingDeque<Object> inbound;
        private final String host;
        private final int port;

        private InboundChunkHandler(BlockingDeque<Object> inbound, String host, int port) {
            this.inbound = inbound;
            this.host = host;
            this.port = port;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Chunk chunk) {
            inbound.offer(chunk);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            inbound.offer(new RailgunProtocolDecodeException(
                    "Connection closed by server at " + host + ":" + port + " before EXIT"));
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            inbound.offer(toRailgunException(cause));
            ctx.close();
        }

        private RailgunException toRailgunException(Throwable cause) {
            Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
            if (root instanceof RailgunException) {
                return (RailgunException) root;
            }
            if (cause instanceof DecoderException) {
                return new RailgunProtocolDecodeException(
                        "Failed to decode chunk from " + host + ":" + port + ": " + cause.getMessage(), cause);
            }
            return new RailgunTransportException("Failed to read from " + host + ":" + port, cause);
        }
    }
}
