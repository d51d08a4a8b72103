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
import io.netty.channel.Channel;

/**
 * Configures the channel pipeline of each accepted connection.
 */
public interface ServerConnector {
    String type();

    int port();

    void configure(Channel channel, HttpHandler httpHandler);
}
