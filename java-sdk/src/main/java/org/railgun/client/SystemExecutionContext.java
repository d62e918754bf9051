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

import java.io.File;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link ExecutionContext} backed by the running JVM.
 *
 * <p>Values are read on every call, so a long-lived client always forwards the current
 * environment. Environment entries are sorted by name.
 */
public final class SystemExecutionContext implements ExecutionContext {

    private static final SystemExecutionContext INSTANCE = new SystemExecutionContext();

    private SystemExecutionContext() {}

    public static SystemExecutionContext getInstance() {
        return INSTANCE;
    }

    @Override
    public Map<String, String> environment() {
        return Collections.unmodifiableMap(new TreeMap<>(System.getenv()));
    }

    @Override
    public String workingDirectory() {
        return Path.of(System.getProperty("user.dir")).toAbsolutePath().toString();
    }

    @Override
    public String fileSeparator() {
        return File.separator;
    }

    @Override
    public String pathSeparator() {
        return File.pathSeparator;
    }
}
