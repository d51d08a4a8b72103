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

import com.google.common.base.Throwables;
import com.hotels.mockhttp.server.HttpHandler;
import com.hotels.mockhttp.server.InetServer;
import com.hotels.mockhttp.server.NettyExecutor;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.ChannelGroupFuture;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.slf4j.Logger;

import java.io.IOException;
import java.net.BindException;
import java.net.InetSocketAddress;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkState;
import static io.netty.channel.ChannelOption.ALLOCATOR;
import static io.netty.channel.ChannelOption.SO_BACKLOG;
import static io.netty.channel.ChannelOption.SO_KEEPALIVE;
import static io.netty.channel.ChannelOption.SO_REUSEADDR;
import static io.netty.channel.ChannelOption.TCP_NODELAY;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * NettyServer.
 * <p>
 * Event loops are created on every start and released on stop, so a stopped
 * server can be started again.
 */
final class NettyServer implements InetServer {
    private static final Logger LOGGER = getLogger(NettyServer.class);

    private final ChannelGroup channelGroup = new DefaultChannelGroup(ImmediateEventExecutor.INSTANCE);

    private final String name;
    private final String host;
    private final HttpHandler handler;
    private final ServerConnector serverConnector;
    private final int workerThreads;

    private NettyExecutor bossExecutor;
    private NettyExecutor workerExecutor;
    private volatile InetSocketAddress address;

    NettyServer(NettyServerBuilder nettyServerBuilder) {
        this.name = nettyServerBuilder.name();
        this.host = nettyServerBuilder.host();
        this.handler = requireNonNull(nettyServerBuilder.handler());
        this.serverConnector = requireNonNull(nettyServerBuilder.protocolConnector());
        this.workerThreads = nettyServerBuilder.workerThreads();
    }

    @Override
    public synchronized InetSocketAddress start() throws IOException {
        checkState(address == null, "%s is already running on %s", name, address);
        LOGGER.debug("starting {}", name);

        bossExecutor = NettyExecutor.create(name + "-Boss", 1);
        workerExecutor = NettyExecutor.create(name + "-Worker", workerThreads);

        ServerBootstrap b = new ServerBootstrap();

        b.group(bossExecutor.eventLoopGroup(), workerExecutor.eventLoopGroup())
                .channel(bossExecutor.serverEventLoopClass())
                .option(SO_BACKLOG, 1024)
                .option(SO_REUSEADDR, true)
                .childOption(SO_REUSEADDR, true)
                .childOption(SO_KEEPALIVE, true)
                .childOption(TCP_NODELAY, true)
                .childOption(ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .childHandler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        channelGroup.add(ch);
                        serverConnector.configure(ch, handler);
                    }
                });

        int port = serverConnector.port();
        ChannelFuture future = b.bind(new InetSocketAddress(host, port)).awaitUninterruptibly();

        if (!future.isSuccess()) {
            LOGGER.warn("Failed to start service={} cause={}", this, future.cause());
            shutdownExecutors();
            throw mapToBetterException(future.cause(), port);
        }

        Channel channel = future.channel();
        channelGroup.add(channel);
        address = (InetSocketAddress) channel.localAddress();
        LOGGER.info("{} {} connector bound on {}", name, serverConnector.type(), address);
        return address;
    }

    @Override
    public synchronized void stop() {
        if (address == null) {
            return;
        }
        try {
            ChannelGroupFuture closed = channelGroup.close().awaitUninterruptibly();
            if (!closed.isSuccess()) {
                LOGGER.warn("{} did not close all channels cleanly", name, closed.cause());
            }
        } finally {
            shutdownExecutors();
            LOGGER.info("{} stopped listening on {}", name, address);
            address = null;
        }
    }

    @Override
    public boolean isRunning() {
        return address != null;
    }

    @Override
    public InetSocketAddress inetAddress() {
        return address;
    }

    private void shutdownExecutors() {
        if (workerExecutor != null) {
            workerExecutor.shut().awaitUninterruptibly();
            workerExecutor = null;
        }
        if (bossExecutor != null) {
            bossExecutor.shut().awaitUninterruptibly();
            bossExecutor = null;
        }
    }

    private IOException mapToBetterException(Throwable cause, int port) {
        if (cause instanceof BindException) {
            BindException better = new BindException(format("Address [%s:%s] already in use.", host, port));
            better.initCause(cause);
            return better;
        }
        if (cause instanceof IOException) {
            return (IOException) cause;
        }
        Throwables.throwIfUnchecked(cause);
        return new IOException(cause);
    }

    @Override
    public String toString() {
        return toStringHelper(this)
                .add("name", name)
                .add("host", host)
                .add("port", serverConnector.port())
                .toString();
    }
}
