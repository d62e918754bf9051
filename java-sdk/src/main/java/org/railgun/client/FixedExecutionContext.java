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

import org.apache.commons.lang3.StringUtils;
import org.railgun.exception.RailgunInvalidArgumentException;

import java.io.File;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable {@link ExecutionContext} with caller-supplied values.
 *
 * <p>Environment entries are sent in the iteration order of the map passed in.
 */
public final class FixedExecutionContext implements ExecutionContext {

    private final Map<String, String> environment;
    private final String workingDirectory;
    private final String fileSeparator;
    private final String pathSeparator;

    public FixedExecutionContext(
            Map<String, String> environment, String workingDirectory, String fileSeparator, String pathSeparator) {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        for (String name : environment.keySet()) {
            if (StringUtils.isEmpty(name) || StringUtils.contains(name, '=')) {
                throw new RailgunInvalidArgumentException("Invalid environment variable name: " + name);
            }
        }
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        this.workingDirectory = workingDirectory;
        this.fileSeparator = Objects.requireNonNull(fileSeparator, "fileSeparator");
        this.pathSeparator = Objects.requireNonNull(pathSeparator, "pathSeparator");
    }

    /**
     * Creates a context with the platform separators.
     *
     * @param environment the variables to forward
     * @param workingDirectory the working directory, resolved to an absolute path
     * @return the context
     */
    public static FixedExecutionContext of(Map<String, String> environment, Path workingDirectory) {
        return new FixedExecutionContext(
                environment, workingDirectory.toAbsolutePath().toString(), File.separator, File.pathSeparator);
    }

    @Override
    public Map<String, String> environment() {
        return environment;
    }

    @Override
    public String workingDirectory() {
        return workingDirectory;
    }

    @Override
    public String fileSeparator() {
        return fileSeparator;
    }

    @Override
    public String pathSeparator() {
        return pathSeparator;
    }
}
