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

import com.hotels.mockhttp.server.HttpConnectorConfig;
import com.hotels.mockhttp.server.HttpHandler;
import com.hotels.mockhttp.server.netty.connectors.HttpPipelineHandler;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;

/**
 * Creates connectors for web servers.
 */
public class WebServerConnectorFactory {

    public ServerConnector create(HttpConnectorConfig config) {
        return new WebServerConnector(config.port(), config.maxContentLength());
    }

    private static final class WebServerConnector implements ServerConnector {
        private final int port;
        private final int maxContentLength;

        private WebServerConnector(int port, int maxContentLength) {
            this.port = port;
            this.maxContentLength = maxContentLength;
        }

        @Override
        public String type() {
            return "http";
        }

        @Override
        public int port() {
            return this.port;
        }

        @Override
        public void configure(Channel channel, HttpHandler httpHandler) {
            channel.pipeline()
                    .addLast(new HttpServerCodec())
                    .addLast(new HttpObjectAggregator(maxContentLength))
                    .addLast(new HttpPipelineHandler(httpHandler));
        }
    }
}
