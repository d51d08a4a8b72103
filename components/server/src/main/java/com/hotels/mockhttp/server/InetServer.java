/*
  Copyright (C) 2013-2024 Expedia Inc.

  Licensed under the Apache License, Version 2.0 (the "License");
  you may not use this file except in compliance with the License.
  You may obtain a copy of the License at

  http://www.apache.org/licenses/LICENSE-2.0

  Unless required by applicable law or agreed to in writing, software
  distributed under the License is distributed on an "AS IS" BASIS,
  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
  See the License for the specific language governing permissions and
  limitations under the License.
 */
package com.hotels.mockhttp.server;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * A server bound to an internet socket address.
 */
public interface InetServer {
    /**
     * Binds the listening socket and starts accepting connections.
     *
     * @return the address the server is bound to
     * @throws IOException if the socket cannot be bound
     */
    InetSocketAddress start() throws IOException;

    /**
     * Closes the listening socket and all accepted connections. Does nothing if
     * the server is not running.
     */
    void stop();

    boolean isRunning();

    /**
     * The bound address, or null when the server is not running.
     */
    InetSocketAddress inetAddress();
}
