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
package com.hotels.mockhttp.server.netty;

import com.hotels.mockhttp.server.HttpHandler;
import com.hotels.mockhttp.server.InetServer;
import io.netty.handler.codec.http.DefaultFullHttpResponse;

import static com.google.common.base.Preconditions.checkArgument;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;
import static java.util.Objects.requireNonNull;

/**
 * A builder of {@link NettyServer} instances.
 */
public final class NettyServerBuilder {
    private String name = "NettyServer";
    private String host;
    private ServerConnector httpConnector;
    private HttpHandler handler = request -> new DefaultFullHttpResponse(HTTP_1_1, NOT_FOUND);
    private int workerThreads = 1;

    public static NettyServerBuilder newBuilder() {
        return new NettyServerBuilder();
    }

    String name() {
        return name;
    }

    String host() {
        return host != null ? host : "localhost";
    }

    int workerThreads() {
        return workerThreads;
    }

    HttpHandler handler() {
        return this.handler;
    }

    ServerConnector protocolConnector() {
        return httpConnector;
    }

    public NettyServerBuilder name(String name) {
        this.name = requireNonNull(name, "name");
        return this;
    }

    public NettyServerBuilder host(String host) {
        this.host = host;
        return this;
    }

    public NettyServerBuilder workerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
        return this;
    }

    public NettyServerBuilder handler(HttpHandler handler) {
        this.handler = requireNonNull(handler, "handler");
        return this;
    }

    public NettyServerBuilder setProtocolConnector(ServerConnector connector) {
        this.httpConnector = connector;
        return this;
    }

    public InetServer build() {
        checkArgument(httpConnector != null, "Must configure a protocol connector");
        checkArgument(workerThreads > 0, "Must configure at least one worker thread");
        return new NettyServer(this);
    }
}
