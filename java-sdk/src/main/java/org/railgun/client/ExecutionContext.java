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

import java.util.Map;

/**
 * The local process context forwarded to the server with every command.
 */
public interface ExecutionContext {

    /**
     * Returns the environment variables to forward. Iteration order is the order in which
     * they are sent and must be stable for a given context.
     */
    Map<String, String> environment();

    /**
     * Returns the absolute path of the working directory the command should run in.
     */
    String workingDirectory();

    String fileSeparator();

    String pathSeparator();
}
