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

package org.railgun;

import org.railgun.client.tcp.RailgunTcpClient;
import org.railgun.client.tcp.RailgunTcpClientBuilder;

/**
 * Main entry point for creating Railgun clients.
 *
 * <pre>{@code
 * // Client for the default endpoint, localhost:2113
 * try (var client = Railgun.tcpClient()) {
 *     var result = client.execute("com.example.HelloWorld");
 *     System.out.print(result.out());
 * }
 *
 * // Configured client
 * var client = Railgun.tcpClientBuilder()
 *     .host("build-server")
 *     .port(2114)
 *     .buildAndConnect();
 *
 * String version = Railgun.version();
 * }</pre>
 *
 * @see RailgunTcpClientBuilder
 * @see RailgunVersion
 */
public final class Railgun {

    private Railgun() {}

    /**
     * Creates a builder for TCP clients.
     *
     * @return a TCP client builder
     */
    public static RailgunTcpClientBuilder tcpClientBuilder() {
        return RailgunTcpClient.builder();
    }

    /**
     * Creates a client for the default endpoint. The client is not connected yet.
     *
     * @return a client for {@code localhost:2113}
     */
    public static RailgunTcpClient tcpClient() {
        return tcpClientBuilder().build();
    }

    /**
     * Returns the SDK version string.
     *
     * @return the version string (e.g., "0.3.0")
     */
    public static String version() {
        return RailgunVersion.current().version();
    }

    /**
     * Returns detailed version information.
     *
     * @return the version information object
     */
    public static RailgunVersion versionInfo() {
        return RailgunVersion.current();
    }
}
