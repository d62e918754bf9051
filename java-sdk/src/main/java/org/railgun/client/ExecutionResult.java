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

import java.util.Objects;

/**
 * The outcome of one command execution.
 *
 * @param out everything the command wrote to stdout, in arrival order
 * @param err everything the command wrote to stderr, in arrival order
 * @param exitCode the exit code reported by the server
 */
public record ExecutionResult(String out, String err, int exitCode) {

    public ExecutionResult {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
