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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.Future;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * A netty based executor for the server.
 */
public final class NettyExecutor {
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Class<? extends ServerChannel> serverEventLoopClass;
    private final EventLoopGroup eventLoopGroup;

    /**
     * Constructs an netty/io event executor.
     *
     * @param name thread group name.
     * @param count thread count.
     * @return a new executor
     */
    public static NettyExecutor create(String name, int count) {
        checkArgument(count > 0, "thread count must be positive, was %s", count);
        return new NettyExecutor(
                new NioEventLoopGroup(count, new ThreadFactoryBuilder()
                        .setNameFormat(name + "-%d-Thread")
                        .setDaemon(true)
                        .build()),
                NioServerSocketChannel.class);
    }

    private NettyExecutor(EventLoopGroup eventLoopGroup, Class<? extends ServerChannel> serverEventLoopClass) {
        this.serverEventLoopClass = serverEventLoopClass;
        this.eventLoopGroup = eventLoopGroup;
    }

    public Future<?> shut() {
        return eventLoopGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, SECONDS);
    }

    public Class<? extends ServerChannel> serverEventLoopClass() {
        return serverEventLoopClass;
    }

    public EventLoopGroup eventLoopGroup() {
        return eventLoopGroup;
    }
}
