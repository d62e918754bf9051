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
 * Exception thrown when a chunk carries a type tag the client does not accept.
 *
 * <p>This covers both bytes outside the protocol's twelve tags and known tags that a
 * server is not allowed to send (for instance {@code 'A'}, an argument chunk).
 * It is fatal to the read loop in progress.
 */
public class RailgunUnknownMessageTypeException extends RailgunProtocolDecodeException {

    private final byte tag;

    /**
     * Constructs a new RailgunUnknownMessageTypeException.
     *
     * @param tag the offending tag byte
     * @param message the detail message
     */
    public RailgunUnknownMessageTypeException(byte tag, String message) {
        super(message);
        this.tag = tag;
    }

    /**
     * Returns the tag byte that was rejected.
     *
     * @return the raw tag
     */
    public byte getTag() {
        return tag;
    }
}
