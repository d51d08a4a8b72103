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
package com.hotels.mockhttp.support.client;

import com.google.common.net.HostAndPort;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.DefaultHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.multipart.DefaultHttpDataFactory;
import io.netty.handler.codec.http.multipart.HttpDataFactory;
import io.netty.handler.codec.http.multipart.HttpPostRequestEncoder;
import io.netty.handler.codec.http.multipart.MemoryFileUpload;
import io.netty.handler.stream.ChunkedInput;
import io.netty.handler.stream.ChunkedWriteHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS;
import static io.netty.channel.ChannelOption.TCP_NODELAY;
import static io.netty.handler.codec.http.HttpHeaderNames.HOST;
import static io.netty.handler.codec.http.HttpMethod.GET;
import static io.netty.handler.codec.http.HttpMethod.POST;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * A blocking HTTP/1.1 client for tests. Each exchange uses a fresh connection
 * that is closed once the response has arrived.
 */
public final class HttpTestClient implements AutoCloseable {
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;
    private static final long RESPONSE_TIMEOUT_SECONDS = 5;
    private static final HttpDataFactory DATA_FACTORY = new DefaultHttpDataFactory(false);

    private final EventLoopGroup eventLoopGroup = new NioEventLoopGroup(1,
            new ThreadFactoryBuilder().setNameFormat("Test-Client-%d").setDaemon(true).build());

    public FullHttpResponse get(HostAndPort destination, String uri) {
        return send(destination, new DefaultFullHttpRequest(HTTP_1_1, GET, uri));
    }

    public FullHttpResponse request(HostAndPort destination, HttpMethod method, String uri) {
        return send(destination, new DefaultFullHttpRequest(HTTP_1_1, method, uri));
    }

    public FullHttpResponse send(HostAndPort destination, FullHttpRequest request) {
        HttpUtil.setContentLength(request, request.content().readableBytes());
        return exchange(destination, request, null);
    }

    /**
     * Posts a multipart/form-data body with a single file field.
     */
    public FullHttpResponse postFile(HostAndPort destination, String uri, String fieldName, String content) {
        return postMultipart(destination, uri, Map.of(), Map.of(fieldName, content));
    }

    /**
     * Posts a multipart/form-data body made of plain attributes and in-memory text files.
     */
    public FullHttpResponse postMultipart(HostAndPort destination, String uri, Map<String, String> attributes, Map<String, String> files) {
        HttpRequest request = new DefaultHttpRequest(HTTP_1_1, POST, uri);
        HttpPostRequestEncoder encoder = null;
        try {
            encoder = new HttpPostRequestEncoder(DATA_FACTORY, request, true);
            for (Map.Entry<String, String> attribute : attributes.entrySet()) {
                encoder.addBodyAttribute(attribute.getKey(), attribute.getValue());
            }
            for (Map.Entry<String, String> file : files.entrySet()) {
                byte[] bytes = file.getValue().getBytes(UTF_8);
                MemoryFileUpload upload = new MemoryFileUpload(file.getKey(), file.getKey() + ".txt", "text/plain", null, UTF_8, bytes.length);
                upload.setContent(Unpooled.wrappedBuffer(bytes));
                encoder.addBodyHttpData(upload);
            }
            HttpRequest finalized = encoder.finalizeRequest();
            return exchange(destination, finalized, encoder.isChunked() ? encoder : null);
        } catch (IOException | HttpPostRequestEncoder.ErrorDataEncoderException e) {
            throw new IllegalStateException("Cannot encode multipart body", e);
        } finally {
            if (encoder != null) {
                encoder.cleanFiles();
            }
        }
    }

    private FullHttpResponse exchange(HostAndPort destination, HttpRequest request, ChunkedInput<HttpContent> chunkedBody) {
        requireNonNull(destination);
        request.headers().set(HOST, destination.toString());
        HttpUtil.setKeepAlive(request, false);

        CompletableFuture<FullHttpResponse> response = new CompletableFuture<>();

        Bootstrap bootstrap = new Bootstrap()
                .group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(TCP_NODELAY, true)
                .option(CONNECT_TIMEOUT_MILLIS, 1000)
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ch.pipeline()
                                .addLast(new HttpClientCodec())
                                .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
                                .addLast(new ChunkedWriteHandler())
                                .addLast(new ResponseCollector(response));
                    }
                });

        Channel channel = bootstrap.connect(destination.getHost(), destination.getPort()).syncUninterruptibly().channel();
        try {
            channel.write(request);
            if (chunkedBody != null) {
                channel.write(chunkedBody);
            }
            channel.flush();
            return response.get(RESPONSE_TIMEOUT_SECONDS, SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("No response from " + destination + " for " + request.method() + " " + request.uri(), e);
        } finally {
            channel.close().awaitUninterruptibly();
        }
    }

    @Override
    public void close() {
        eventLoopGroup.shutdownGracefully(0, 1, SECONDS).awaitUninterruptibly();
    }

    private static final class ResponseCollector extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<FullHttpResponse> response;

        private ResponseCollector(CompletableFuture<FullHttpResponse> response) {
            this.response = response;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
            response.complete(msg.replace(Unpooled.copiedBuffer(msg.content())));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            response.completeExceptionally(new IOException("Connection closed before a response was received"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            response.completeExceptionally(cause);
            ctx.close();
        }
    }
}
