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

package org.railgun.protocol;

import org.railgun.exception.RailgunUnknownMessageTypeException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Registry mapping {@link MessageKind} values to and from their wire tags.
 *
 * <p>Encoding is total over the enumeration. Decoding is partial: any byte that is not one
 * of the twelve protocol tags is rejected instead of being mapped to a default.
 */
public final class MessageTypes {

    private static final MessageKind[] KINDS_BY_TAG = new MessageKind[256];

    private static final Set<MessageKind> SERVER_MESSAGES = Collections.unmodifiableSet(
            EnumSet.of(MessageKind.STDOUT, MessageKind.STDERR, MessageKind.EXIT, MessageKind.SENDINPUT));

    static {
        for (MessageKind kind : MessageKind.values()) {
            int index = Byte.toUnsignedInt(kind.getTag());
            if (KINDS_BY_TAG[index] != null) {
                throw new IllegalStateException("Duplicate tag '" + (char) index + "' for " + kind);
            }
            KINDS_BY_TAG[index] = kind;
        }
    }

    private MessageTypes() {}

    public static byte tagFor(MessageKind kind) {
        return kind.getTag();
    }

    /**
     * Resolves a wire tag to its message kind.
     *
     * @param tag the tag byte read from a chunk header
     * @return the matching kind
     * @throws RailgunUnknownMessageTypeException if the tag is not a protocol tag
     */
    public static MessageKind kindFor(byte tag) {
        MessageKind kind = KINDS_BY_TAG[Byte.toUnsignedInt(tag)];
        if (kind == null) {
            throw new RailgunUnknownMessageTypeException(tag, "Unknown message type: " + describe(tag));
        }
        return kind;
    }

    /**
     * Returns whether a server may send chunks of the given kind to a client.
     * Only stdout, stderr, exit and sendinput qualify.
     */
    public static boolean isServerMessage(MessageKind kind) {
        return SERVER_MESSAGES.contains(kind);
    }

    public static Set<MessageKind> serverMessages() {
        return SERVER_MESSAGES;
    }

    static String describe(byte tag) {
        int value = Byte.toUnsignedInt(tag);
        if (value >= 0x20 && value < 0x7f) {
            return String.format("'%c' (0x%02x)", (char) value, value);
        }
        return String.format("0x%02x", value);
    }
}
