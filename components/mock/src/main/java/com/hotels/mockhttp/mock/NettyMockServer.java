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
package com.hotels.mockhttp.mock;

import com.google.common.net.HostAndPort;
import com.hotels.mockhttp.mock.MockServerState.Keyspace;
import com.hotels.mockhttp.server.HttpServers;
import com.hotels.mockhttp.server.InetServer;
import org.slf4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * {@link MockServer} backed by a netty listener.
 */
final class NettyMockServer implements MockServer {
    private static final Logger LOGGER = getLogger(NettyMockServer.class);

    private final MockServerConfig config;
    private final MockServerState state = new MockServerState();
    private final InetServer server;

    NettyMockServer(MockServerConfig config) {
        this.config = requireNonNull(config);
        this.server = HttpServers.createHttpServer(
                "MockServer",
                config.connectorConfig(),
                config.workerThreads(),
                new MockRequestHandler(state));
    }

    @Override
    public synchronized void open() throws IOException {
        checkState(!server.isRunning(), "Mock server is already open at %s", server.inetAddress());
        InetSocketAddress address = server.start();
        LOGGER.info("Mock server open at {}", address);
    }

    @Override
    public synchronized void close() {
        if (!server.isRunning()) {
            return;
        }
        try {
            server.stop();
        } catch (RuntimeException e) {
            LOGGER.warn("Error while closing mock server", e);
        }
    }

    @Override
    public boolean isOpen() {
        return server.isRunning();
    }

    @Override
    public void reset() {
        state.reset();
        LOGGER.debug("Mock server reset");
    }

    @Override
    public void setGETResponseBody(String key, String body) {
        state.register(Keyspace.GET, key, CannedResponse.ok(body));
        LOGGER.debug("Registered GET response for '{}'", key);
    }

    @Override
    public void setPOSTResponseBody(String key, String body) {
        state.register(Keyspace.POST, key, CannedResponse.ok(body));
        LOGGER.debug("Registered POST response for '{}'", key);
    }

    @Override
    public List<RecordedRequest> getGETRequests(String key) {
        return state.requests(Keyspace.GET, key);
    }

    @Override
    public List<RecordedRequest> getPOSTRequests(String key) {
        return state.requests(Keyspace.POST, key);
    }

    @Override
    public URI url() {
        InetSocketAddress address = server.inetAddress();
        checkState(address != null, "Mock server is not open");
        return URI.create("http://" + HostAndPort.fromParts(config.host(), address.getPort()));
    }
}
