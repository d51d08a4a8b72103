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

import com.hotels.mockhttp.server.netty.NettyServerBuilder;
import com.hotels.mockhttp.server.netty.WebServerConnectorFactory;

/**
 * Static utility methods for creating {@link InetServer} instances.
 */
public final class HttpServers {
    private HttpServers() {
    }

    /**
     * Returns a new {@link InetServer} object, which runs on the provided port.
     *
     * @param port    port to bind, zero for an ephemeral port
     * @param handler request handler
     * @return {@link InetServer} object
     */
    public static InetServer createHttpServer(int port, HttpHandler handler) {
        return createHttpServer("NettyServer", new HttpConnectorConfig(port), 1, handler);
    }

    /**
     * Returns a new {@link InetServer} object.
     *
     * @param name                - Name of the server and associated IO threads.
     * @param httpConnectorConfig - HTTP connector configuration.
     * @param workerThreads       - Number of IO threads serving accepted connections.
     * @param handler             - Request handler.
     * @return {@link InetServer} object
     */
    public static InetServer createHttpServer(String name, HttpConnectorConfig httpConnectorConfig, int workerThreads, HttpHandler handler) {
        return NettyServerBuilder.newBuilder()
                .name(name)
                .host(httpConnectorConfig.host())
                .setProtocolConnector(new WebServerConnectorFactory().create(httpConnectorConfig))
                .handler(handler)
                .workerThreads(workerThreads)
                .build();
    }
}
