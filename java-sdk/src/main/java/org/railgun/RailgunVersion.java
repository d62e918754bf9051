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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Version of the SDK on the classpath, read from {@code railgun-version.properties}, which is
 * filtered at build time.
 */
public final class RailgunVersion {
    private static final Logger log = LoggerFactory.getLogger(RailgunVersion.class);

    static final String PROPERTIES_FILE = "/railgun-version.properties";
    static final String UNKNOWN = "unknown";

    private static final RailgunVersion CURRENT = load();

    private final String version;
    private final Instant buildTime;

    RailgunVersion(String version, Instant buildTime) {
        this.version = Objects.requireNonNull(version, "version");
        this.buildTime = buildTime;
    }

    public static RailgunVersion current() {
        return CURRENT;
    }

    /**
     * Reads the version from properties. A missing or unfiltered version becomes
     * {@code "unknown"}; a missing or malformed build time is left out.
     */
    static RailgunVersion fromProperties(Properties properties) {
        String version = properties.getProperty("version");
        if (version == null || version.isBlank() || version.contains("${")) {
            version = UNKNOWN;
        }
        return new RailgunVersion(version, parseBuildTime(properties.getProperty("buildTime")));
    }

    public String version() {
        return version;
    }

    public Optional<Instant> buildTime() {
        return Optional.ofNullable(buildTime);
    }

    @Override
    public String toString() {
        return "Railgun Java SDK " + version + buildTime().map(time -> " (built: " + time + ")").orElse("");
    }

    private static RailgunVersion load() {
        Properties properties = new Properties();
        try (InputStream is = RailgunVersion.class.getResourceAsStream(PROPERTIES_FILE)) {
            if (is != null) {
                properties.load(is);
            } else {
                log.warn("{} not found on the classpath", PROPERTIES_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read version information from {}", PROPERTIES_FILE, e);
        }
        return fromProperties(properties);
    }

    private static Instant parseBuildTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring malformed build time '{}'", value);
            return null;
        }
    }
}
