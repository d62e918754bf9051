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

package org.railgun.client;

import java.util.Arrays;
import java.util.List;

/**
 * A client session with a Nailgun server.
 *
 * <p>One session runs one command lifecycle: connect, execute, close. Implementations are
 * not meant to be driven by several threads at once; use one client per concurrent session.
 */
public interface RailgunClient extends AutoCloseable {

    /**
     * Connects to the server. Does nothing if the client is already connected.
     *
     * @throws org.railgun.exception.RailgunConnectionException if the TCP session cannot be established
     */
    void connect();

    /**
     * Runs a command on the server and waits for it to exit, connecting first if needed.
     *
     * @param command the command to execute, typically a fully qualified main class or an alias
     * @param args the positional arguments, forwarded in order
     * @return the collected output and the exit code
     */
    ExecutionResult execute(String command, List<String> args);

    default ExecutionResult execute(String command) {
        return execute(command, List.of());
    }

    default ExecutionResult execute(String command, String... args) {
        return execute(command, Arrays.asList(args));
    }

    boolean isConnected();

    /**
     * Closes the connection and stops background heartbeats. Safe to call more than once.
     */
    @Override
    void close();
}
