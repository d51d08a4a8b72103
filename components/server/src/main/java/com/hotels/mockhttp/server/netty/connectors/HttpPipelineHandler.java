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
package com.hotels.mockhttp.server.netty.connectors;

import com.hotels.mockhttp.server.HttpHandler;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;

import java.io.IOException;
import java.net.SocketAddress;

import static com.hotels.mockhttp.server.HttpResponses.textResponse;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Passes each aggregated request to an {@link HttpHandler} and writes the
 * response back, keeping the connection open only when the client asked for it.
 * <p>
 * Handler failures become 500 responses. Requests that could not be decoded are
 * answered with 400 and the connection is closed.
 */
public class HttpPipelineHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger LOGGER = getLogger(HttpPipelineHandler.class);

    private final HttpHandler httpHandler;

    public HttpPipelineHandler(HttpHandler httpHandler) {
        this.httpHandler = requireNonNull(httpHandler);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        if (request.decoderResult().isFailure()) {
            Throwable cause = request.decoderResult().cause();
            LOGGER.warn(warningMessage(ctx, "message='Bad request', cause=" + cause));
            respondAndClose(ctx, textResponse(BAD_REQUEST, String.valueOf(cause.getMessage())));
            return;
        }

        boolean keepAlive = HttpUtil.isKeepAlive(request);
        FullHttpResponse response = handle(ctx, request);

        HttpUtil.setContentLength(response, response.content().readableBytes());
        HttpUtil.setKeepAlive(response, keepAlive);

        ChannelFuture future = ctx.writeAndFlush(response);
        if (!keepAlive) {
            future.addListener(ChannelFutureListener.CLOSE);
        }
    }

    private FullHttpResponse handle(ChannelHandlerContext ctx, FullHttpRequest request) {
        try {
            FullHttpResponse response = httpHandler.handle(request);
            if (response == null) {
                throw new IllegalStateException(format("No response for %s %s", request.method(), request.uri()));
            }
            return response;
        } catch (Exception e) {
            LOGGER.error(warningMessage(ctx, format("message='Error handling request', method=%s, uri=%s", request.method(), request.uri())), e);
            return textResponse(INTERNAL_SERVER_ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IOException) {
            LOGGER.debug(warningMessage(ctx, "message='Connection error', cause=" + cause));
        } else {
            LOGGER.warn(warningMessage(ctx, "message='Unexpected channel exception'"), cause);
        }
        ctx.close();
    }

    private static void respondAndClose(ChannelHandlerContext ctx, FullHttpResponse response) {
        HttpUtil.setKeepAlive(response, false);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    private static String warningMessage(ChannelHandlerContext ctx, String msg) {
        SocketAddress remote = ctx.channel().remoteAddress();
        return format("%s, clientAddress=%s", msg, remote);
    }
}
