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

import com.google.common.net.HostAndPort;
import com.hotels.mockhttp.server.HttpConnectorConfig;
import com.hotels.mockhttp.server.HttpServers;
import com.hotels.mockhttp.server.InetServer;
import com.hotels.mockhttp.support.client.HttpTestClient;
import io.netty.handler.codec.http.FullHttpResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.BindException;
import java.net.InetSocketAddress;

import static com.hotels.mockhttp.server.HttpResponses.textResponse;
import static com.hotels.mockhttp.support.matchers.HttpResponseMatchers.hasBody;
import static com.hotels.mockhttp.support.matchers.HttpResponseMatchers.hasStatus;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.OK;
import static io.netty.handler.codec.http.HttpResponseStatus.REQUEST_ENTITY_TOO_LARGE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class NettyServerTest {
    private HttpTestClient client;
    private InetServer server;

    @BeforeEach
    public void setUp() {
        client = new HttpTestClient();
        server = HttpServers.createHttpServer(0, request -> textResponse(OK, "uri=" + request.uri()));
    }

    @AfterEach
    public void tearDown() {
        server.stop();
        client.close();
    }

    @Test
    public void bindsEphemeralPortAndServesRequests() throws Exception {
        InetSocketAddress address = server.start();

        assertThat(address.getPort(), is(greaterThan(0)));
        assertThat(server.isRunning(), is(true));

        FullHttpResponse response = client.get(HostAndPort.fromParts("localhost", address.getPort()), "/hello?x=1");
        assertThat(response, allOf(hasStatus(OK), hasBody("uri=/hello?x=1")));
    }

    @Test
    public void stopIsIdempotent() throws Exception {
        server.stop();

        server.start();
        server.stop();
        server.stop();

        assertThat(server.isRunning(), is(false));
        assertThat(server.inetAddress(), is(nullValue()));
    }

    @Test
    public void canBeRestartedAfterStop() throws Exception {
        server.start();
        server.stop();

        InetSocketAddress address = server.start();

        FullHttpResponse response = client.get(HostAndPort.fromParts("localhost", address.getPort()), "/again");
        assertThat(response, hasBody("uri=/again"));
    }

    @Test
    public void refusesToStartTwice() throws Exception {
        server.start();

        assertThrows(IllegalStateException.class, () -> server.start());
    }

    @Test
    public void reportsPortAlreadyInUse() throws Exception {
        int port = server.start().getPort();

        InetServer other = HttpServers.createHttpServer(port, request -> textResponse(OK, ""));
        try {
            BindException e = assertThrows(BindException.class, other::start);
            assertThat(e.getMessage(), is("Address [localhost:" + port + "] already in use."));
            assertThat(other.isRunning(), is(false));
        } finally {
            other.stop();
        }
    }

    @Test
    public void answersDefaultHandlerWithNotFound() throws Exception {
        InetServer defaultServer = NettyServerBuilder.newBuilder()
                .setProtocolConnector(new WebServerConnectorFactory().create(new HttpConnectorConfig(0)))
                .build();
        try {
            int port = defaultServer.start().getPort();

            assertThat(client.get(HostAndPort.fromParts("localhost", port), "/"), hasStatus(NOT_FOUND));
        } finally {
            defaultServer.stop();
        }
    }

    @Test
    public void rejectsBodiesAboveMaxContentLength() throws Exception {
        InetServer small = HttpServers.createHttpServer("small", new HttpConnectorConfig("localhost", 0, 16), 1,
                request -> textResponse(OK, "accepted"));
        try {
            int port = small.start().getPort();

            FullHttpResponse response = client.postFile(HostAndPort.fromParts("localhost", port), "/upload", "file", "this body is too long");
            assertThat(response, hasStatus(REQUEST_ENTITY_TOO_LARGE));
            assertThat(response, not(hasBody("accepted")));
        } finally {
            small.stop();
        }
    }
}
