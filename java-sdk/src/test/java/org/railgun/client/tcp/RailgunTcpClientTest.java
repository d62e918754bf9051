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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.railgun.client.ExecutionResult;
import org.railgun.client.FixedExecutionContext;
import org.railgun.exception.RailgunInvalidArgumentException;
import org.railgun.exception.RailgunProtocolDecodeException;
import org.railgun.exception.RailgunTransportException;
import org.railgun.exception.RailgunUnknownMessageTypeException;
import org.railgun.protocol.Chunk;
import org.railgun.protocol.MessageKind;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class RailgunTcpClientTest {

    private FakeNailgunServer server;
    private RailgunTcpClient client;

    @BeforeEach
    void setUp() {
        server = new FakeNailgunServer();
        Map<String, String> environment = new LinkedHashMap<>();
        environment.put("HOME", "/home/railgun");
        environment.put("LANG", "C.UTF-8");
        client = RailgunTcpClient.builder()
                .host("127.0.0.1")
                .port(server.port())
                .heartbeatInterval(Duration.ofMillis(100))
                .executionContext(new FixedExecutionContext(environment, "/work/project", "/", ":"))
                .build();
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    @Nested
    class Results {

        @Test
        void shouldCollectStdoutAndExitCode() {
            // given
            server.respondWith(
                    FakeNailgunServer.frame(MessageKind.STDOUT, "Hello World\n"),
                    FakeNailgunServer.frame(MessageKind.EXIT, "0"));

            // when
            ExecutionResult result = client.execute("com.example.HelloWorld.Main");

            // then
            assertThat(result).isEqualTo(new ExecutionResult("Hello World\n", "", 0));
            assertThat(result.isSuccess()).isTrue();
        }

        @Test
        void shouldCollectStderrAndNonZeroExitCode() {
            // given
            server.respondWith(
                    FakeNailgunServer.frame(MessageKind.STDERR, "boom"),
                    FakeNailgunServer.frame(MessageKind.EXIT, "1"));

            // when
            ExecutionResult result = client.execute("com.example.Failing");

            // then
            assertThat(result).isEqualTo(new ExecutionResult("", "boom", 1));
            assertThat(result.isSuccess()).isFalse();
        }

        @Test
        void shouldKeepStreamsIndependentWhenInterleaved() {
            // given
            server.respondWith(
                    FakeNailgunServer.frame(MessageKind.STDOUT, "A"),
                    FakeNailgunServer.frame(MessageKind.STDERR, "E"),
                    FakeNailgunServer.frame(MessageKind.STDOUT, "B"),
                    FakeNailgunServer.frame(MessageKind.EXIT, "0"));

            // when
            ExecutionResult result = client.execute("com.example.Mixed");

            // then
            assertThat(result.out()).isEqualTo("AB");
            assertThat(result.err()).isEqualTo("E");
        }

        @Test
        void shouldDecodeCharacterSplitAcrossChunks() {
            // given
            byte[] accented = "é".getBytes(StandardCharsets.UTF_8);
            server.respondWith(
                    FakeNailgunServer.frame(MessageKind.STDOUT, new byte[] {accented[0]}),
                    FakeNailgunServer.frame(MessageKind.STDOUT, new byte[] {accented[1]}),
                    FakeNailgunServer.frame(MessageKind.EXIT, "0"));

            // when
            ExecutionResult result = client.execute("com.example.Accents");

            // then
            assertThat(result.out()).isEqualTo("é");
        }

        @Test
        void shouldIgnoreInputRequests() {
            // given
            server.respondWith(
                    FakeNailgunServer.frame(MessageKind.SENDINPUT, ""),
                    FakeNailgunServer.frame(MessageKind.STDOUT, "done"),
                    FakeNailgunServer.frame(MessageKind.EXIT, "0"));

            // when
            ExecutionResult result = client.execute("com.example.Prompt");

            // then
            assertThat(result).isEqualTo(new ExecutionResult("done", "", 0));
        }

        @Test
        void shouldParseExitCodeWithSurroundingWhitespace() {
            // given
            server.respondWith(FakeNailgunServer.frame(MessageKind.EXIT, "-3\n"));

            // when
            ExecutionResult result = client.execute("com.example.Exit");

            // then
            assertThat(result.exitCode()).isEqualTo(-3);
        }

        @Test
        void shouldFailOnMalformedExitCode() {
            // given
            server.respondWith(FakeNailgunServer.frame(MessageKind.EXIT, "oops"));

            // when / then
            assertThatThrownBy(() -> client.execute("com.example.Exit"))
                    .isInstanceOf(RailgunProtocolDecodeException.class)
                    .hasMessageContaining("oops");
        }

        @Test
        void shouldAbortOnDisallowedMessageType() {
            // given
            server.respondWith(
                    FakeNailgunServer.frame(MessageKind.STDOUT, "partial"),
                    FakeNailgunServer.frame(MessageKind.COMMAND, "bogus"),
                    FakeNailgunServer.frame(MessageKind.EXIT, "0"));

            // when / then
            assertThatThrownBy(() -> client.execute("com.example.Bogus"))
                    .isInstanceOf(RailgunUnknownMessageTypeException.class);
        }

        @Test
        void shouldFailWhenServerDisconnectsBeforeExit() {
            // given
            server.respondWith(FakeNailgunServer.frame(MessageKind.STDOUT, "partial"));
            server.closeAfterResponse();

            // when / then
            assertThatThrownBy(() -> client.execute("com.example.Crash"))
                    .isInstanceOf(RailgunProtocolDecodeException.class)
                    .hasMessageContaining("closed by server");
        }
    }

    @Nested
    class Requests {

        @Test
        void shouldSendArgumentsEnvironmentDirectoryThenCommand() {
            // given
            server.respondWith(FakeNailgunServer.frame(MessageKind.EXIT, "0"));

            // when
            client.execute("com.example.Tool", List.of("--verbose", "input.txt", ""));

            // then
            assertThat(describe(server.requestChunks()))
                    .containsExactly(
                            "ARGUMENT:--verbose",
                            "ARGUMENT:input.txt",
                            "ARGUMENT:",
                            "ENVIRONMENT:NAILGUN_FILESEPARATOR=/",
                            "ENVIRONMENT:NAILGUN_PATHSEPARATOR=:",
                            "ENVIRONMENT:HOME=/home/railgun",
                            "ENVIRONMENT:LANG=C.UTF-8",
                            "CURRENT_DIR:/work/project",
                            "COMMAND:com.example.Tool");
        }

        @Test
        void shouldAcceptVarargsArguments() {
            // given
            server.respondWith(FakeNailgunServer.frame(MessageKind.EXIT, "0"));

            // when
            client.execute("com.example.Tool", "b", "a");

            // then
            assertThat(describe(server.requestChunks()))
                    .startsWith("ARGUMENT:b", "ARGUMENT:a");
        }

        @Test
        void shouldConnectOnFirstExecute() {
            // given
            server.respondWith(FakeNailgunServer.frame(MessageKind.EXIT, "0"));
            assertThat(client.isConnected()).isFalse();

            // when
            client.execute("com.example.Tool");

            // then
            assertThat(client.isConnected()).isTrue();
            assertThat(server.connectionCount()).isEqualTo(1);
        }

        @Test
        void shouldReuseExplicitConnection() throws InterruptedException {
            // given
            server.respondWith(FakeNailgunServer.frame(MessageKind.EXIT, "0"));
            client.connect();

            // when
            client.execute("com.example.Tool");

            // then
            Thread.sleep(100);
            assertThat(server.connectionCount()).isEqualTo(1);
        }

        @Test
        void shouldRejectBlankCommandWithoutConnecting() {
            assertThatThrownBy(() -> client.execute("  "))
                    .isInstanceOf(RailgunInvalidArgumentException.class);
            assertThat(client.isConnected()).isFalse();
        }

        @Test
        void shouldRejectNullArgument() {
            assertThatThrownBy(() -> client.execute("com.example.Tool", Arrays.asList("a", null)))
                    .isInstanceOf(RailgunInvalidArgumentException.class);
        }
    }

    @Nested
    class Shutdown {

        @Test
        void shouldFailPendingExecutionWhenClosed() throws InterruptedException {
            // given
            server.neverRespond();
            CompletableFuture<ExecutionResult> execution =
                    CompletableFuture.supplyAsync(() -> client.execute("com.example.Forever"));
            assertThat(server.awaitChunk(MessageKind.COMMAND, Duration.ofSeconds(5))).isTrue();

            // when
            assertTimeoutPreemptively(Duration.ofSeconds(5), client::close);

            // then
            assertThat(execution)
                    .failsWithin(Duration.ofSeconds(5))
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(RailgunTransportException.class);
            assertThat(client.isConnected()).isFalse();
        }

        @Test
        void shouldSendHeartbeatsWhileCommandRuns() throws InterruptedException {
            // given
            server.neverRespond();
            CompletableFuture.runAsync(() -> client.execute("com.example.LongRunning"));
            assertThat(server.awaitChunk(MessageKind.COMMAND, Duration.ofSeconds(5))).isTrue();

            // when / then
            assertThat(server.awaitChunk(MessageKind.HEARTBEAT, Duration.ofSeconds(1))).isTrue();
        }

        @Test
        void shouldCloseRepeatedly() {
            // given
            client.connect();

            // when / then
            assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
                client.close();
                client.close();
            });
            assertThat(client.isConnected()).isFalse();
        }
    }

    private static List<String> describe(List<Chunk> chunks) {
        return chunks.stream()
                .map(chunk -> chunk.kind() + ":" + chunk.payloadAsString(StandardCharsets.UTF_8))
                .collect(Collectors.toList());
    }
}
