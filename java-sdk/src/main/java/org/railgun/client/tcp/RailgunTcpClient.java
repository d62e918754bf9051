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
import org.railgun.client.ExecutionResult;
import org.railgun.client.RailgunClient;
import org.railgun.exception.RailgunInvalidArgumentException;
import org.railgun.exception.RailgunProtocolDecodeException;
import org.railgun.protocol.Chunk;
import org.railgun.protocol.MessageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Blocking TCP client for a Nailgun server.
 *
 * <p>A command is sent as its arguments, the local environment, the working directory and
 * finally the command itself; the client then collects stdout and stderr until the server
 * reports the exit code. A background thread sends heartbeats for as long as the client is
 * connected.
 *
 * <pre>{@code
 * try (var client = RailgunTcpClient.builder().port(2113).build()) {
 *     ExecutionResult result = client.execute("com.example.HelloWorld", "--verbose");
 *     System.out.print(result.out());
 * }
 * }</pre>
 */
public class RailgunTcpClient implements RailgunClient {
    private static final Logger log = LoggerFactory.getLogger(RailgunTcpClient.class);

    static final String FILE_SEPARATOR_VARIABLE = "NAILGUN_FILESEPARATOR";
    static final String PATH_SEPARATOR_VARIABLE = "NAILGUN_PATHSEPARATOR";

    private final InternalTcpClient connection;
    private final ExecutionContext executionContext;
    private final Charset charset;

    RailgunTcpClient(
            String host,
            int port,
            Duration connectionTimeout,
            Duration heartbeatInterval,
            Charset charset,
            ExecutionContext executionContext) {
        this.connection = new InternalTcpClient(host, port, connectionTimeout, heartbeatInterval);
        this.charset = charset;
        this.executionContext = executionContext;
    }

    /**
     * Creates a new builder for configuring RailgunTcpClient.
     *
     * @return a new builder with default settings
     */
    public static RailgunTcpClientBuilder builder() {
        return new RailgunTcpClientBuilder();
    }

    @Override
    public void connect() {
        connection.connect();
    }

    @Override
    public ExecutionResult execute(String command, List<String> args) {
        if (StringUtils.isBlank(command)) {
            throw new RailgunInvalidArgumentException("Command cannot be null or blank");
        }
        if (args == null) {
            throw new RailgunInvalidArgumentException("Arguments cannot be null");
        }
        for (String arg : args) {
            if (arg == null) {
                throw new RailgunInvalidArgumentException("Arguments cannot contain null");
            }
        }

        connection.connect();
        log.debug("Executing {} with {} arguments on {}:{}", command, args.size(), connection.host(), connection.port());

        for (String arg : args) {
            send(MessageKind.ARGUMENT, arg);
        }
        sendEnvironment();
        send(MessageKind.CURRENT_DIR, executionContext.workingDirectory());
        send(MessageKind.COMMAND, command);

        return awaitExit();
    }

    @Override
    public boolean isConnected() {
        return connection.isConnected();
    }

    @Override
    public void close() {
        connection.close();
    }

    private void sendEnvironment() {
        send(MessageKind.ENVIRONMENT, FILE_SEPARATOR_VARIABLE + "=" + executionContext.fileSeparator());
        send(MessageKind.ENVIRONMENT, PATH_SEPARATOR_VARIABLE + "=" + executionContext.pathSeparator());
        for (Map.Entry<String, String> variable : executionContext.environment().entrySet()) {
            send(MessageKind.ENVIRONMENT, variable.getKey() + "=" + Objects.toString(variable.getValue(), ""));
        }
    }

    private ExecutionResult awaitExit() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        while (true) {
            Chunk chunk = connection.readLocked();
            switch (chunk.kind()) {
                case STDOUT:
                    out.writeBytes(chunk.payload());
                    break;
                case STDERR:
                    err.writeBytes(chunk.payload());
                    break;
                case EXIT:
                    int exitCode = parseExitCode(chunk);
                    log.debug("Command exited with code {}", exitCode);
                    return new ExecutionResult(out.toString(charset), err.toString(charset), exitCode);
                default:
                    // sendinput: the remote command wants stdin, which this client does not forward
                    log.debug("Ignoring {} chunk from server", chunk.kind());
                    break;
            }
        }
    }

    private int parseExitCode(Chunk chunk) {
        String text = chunk.payloadAsString(charset).trim();
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new RailgunProtocolDecodeException("Malformed exit code from server: '" + text + "'", e);
        }
    }

    private void send(MessageKind kind, String payload) {
        connection.writeLocked(kind, payload.getBytes(charset));
    }

    InternalTcpClient connection() {
        return connection;
    }
}
