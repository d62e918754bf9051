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

import org.apache.commons.lang3.StringUtils;
import org.railgun.client.ExecutionContext;
import org.railgun.client.SystemExecutionContext;
import org.railgun.exception.RailgunInvalidArgumentException;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Builder for creating configured RailgunTcpClient instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Explicit connect
 * var client = RailgunTcpClient.builder()
 *     .host("localhost")
 *     .port(2113)
 *     .build();
 * client.connect();
 *
 * // Connected on build, with a custom environment
 * var client = RailgunTcpClient.builder()
 *     .host("build-server.example.com")
 *     .heartbeatInterval(Duration.ofMillis(250))
 *     .executionContext(FixedExecutionContext.of(Map.of("CI", "true"), Path.of(".")))
 *     .buildAndConnect();
 * }</pre>
 *
 * @see RailgunTcpClient#builder()
 */
public final class RailgunTcpClientBuilder {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 2113;
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofMillis(500);

    private String host = DEFAULT_HOST;
    private Integer port = DEFAULT_PORT;
    private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
    private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
    private Charset charset = StandardCharsets.UTF_8;
    private ExecutionContext executionContext = SystemExecutionContext.getInstance();

    RailgunTcpClientBuilder() {}

    /**
     * Sets the host address for the Nailgun server.
     *
     * @param host the host address
     * @return this builder
     */
    public RailgunTcpClientBuilder host(String host) {
        this.host = host;
        return this;
    }

    /**
     * Sets the port for the Nailgun server.
     *
     * @param port the port number
     * @return this builder
     */
    public RailgunTcpClientBuilder port(Integer port) {
        this.port = port;
        return this;
    }

    /**
     * Sets the connection timeout.
     *
     * @param connectionTimeout the connection timeout duration
     * @return this builder
     */
    public RailgunTcpClientBuilder connectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    /**
     * Sets how often a heartbeat is sent while connected.
     *
     * @param heartbeatInterval the heartbeat period
     * @return this builder
     */
    public RailgunTcpClientBuilder heartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
        return this;
    }

    /**
     * Sets the charset used for arguments, environment entries and command output.
     *
     * @param charset the charset, UTF-8 by default
     * @return this builder
     */
    public RailgunTcpClientBuilder charset(Charset charset) {
        this.charset = charset;
        return this;
    }

    /**
     * Sets where the environment and working directory sent with each command come from.
     *
     * @param executionContext the context, the running JVM by default
     * @return this builder
     */
    public RailgunTcpClientBuilder executionContext(ExecutionContext executionContext) {
        this.executionContext = executionContext;
        return this;
    }

    /**
     * Builds and returns a configured RailgunTcpClient instance. The client connects lazily
     * on its first {@code execute}, or explicitly through {@code connect()}.
     *
     * @return a new RailgunTcpClient instance
     * @throws RailgunInvalidArgumentException if a setting is missing or out of range
     */
    public RailgunTcpClient build() {
        if (StringUtils.isBlank(host)) {
            throw new RailgunInvalidArgumentException("Host cannot be null or empty");
        }
        if (port == null || port <= 0 || port > 65535) {
            throw new RailgunInvalidArgumentException("Port must be between 1 and 65535");
        }
        requirePositive(connectionTimeout, "Connection timeout");
        requirePositive(heartbeatInterval, "Heartbeat interval");
        if (charset == null) {
            throw new RailgunInvalidArgumentException("Charset cannot be null");
        }
        if (executionContext == null) {
            throw new RailgunInvalidArgumentException("Execution context cannot be null");
        }
        return new RailgunTcpClient(
                host, port, connectionTimeout, heartbeatInterval, charset, executionContext);
    }

    /**
     * Builds the client and connects it.
     *
     * @return a connected RailgunTcpClient instance
     * @throws org.railgun.exception.RailgunConnectionException if the server cannot be reached
     */
    public RailgunTcpClient buildAndConnect() {
        RailgunTcpClient client = build();
        client.connect();
        return client;
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new RailgunInvalidArgumentException(name + " must be a positive duration");
        }
    }
}
