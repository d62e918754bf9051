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
 * Exception thrown when socket I/O is attempted on a client that is not connected,
 * including a client closed while a read was in progress.
 */
public class RailgunNotConnectedException extends RailgunTransportException {

    /**
     * Constructs a new RailgunNotConnectedException with a default message.
     */
    public RailgunNotConnectedException() {
        super("Client not connected. Call connect() first.");
    }

    /**
     * Constructs a new RailgunNotConnectedException with the specified message.
     *
     * @param message the detail message
     */
    public RailgunNotConnectedException(String message) {
        super(message);
    }
}
