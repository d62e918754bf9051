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

/**
 * The semantic type of a chunk, carried on the wire as a single ASCII tag byte.
 */
public enum MessageKind {
    ARGUMENT('A'),
    COMMAND('C'),
    CURRENT_DIR('D'),
    ENVIRONMENT('E'),
    EOF('.'),
    EXIT('X'),
    HEARTBEAT('H'),
    LONGARG('L'),
    SENDINPUT('S'),
    STDERR('2'),
    STDIN('0'),
    STDOUT('1');

    private final byte tag;

    MessageKind(char tag) {
        this.tag = (byte) tag;
    }

    public byte getTag() {
        return tag;
    }
}
