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

package org.railgun.exception;

/**
 * Exception thrown when a TCP session with the server cannot be established,
 * e.g. the connection is refused, the host is unreachable or the connect timeout expires.
 */
public class RailgunConnectionException extends RailgunClientException {

    private final String host;
    private final int port;

    /**
     * Constructs a new RailgunConnectionException.
     *
     * @param host the host the client tried to reach
     * @param port the port the client tried to reach
     * @param cause the underlying socket failure
     */
    public RailgunConnectionException(String host, int port, Throwable cause) {
        super("Failed to connect to " + host + ":" + port + ": " + cause.getMessage(), cause);
        this.host = host;
        this.port = port;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }
}
