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

import com.hotels.mockhttp.mock.MockServerState.Keyspace;
import com.hotels.mockhttp.mock.multipart.MultipartFileException;
import com.hotels.mockhttp.server.HttpHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;

import java.util.Optional;

import static com.hotels.mockhttp.mock.multipart.MultipartFiles.fileContent;
import static com.hotels.mockhttp.server.HttpResponses.response;
import static com.hotels.mockhttp.server.HttpResponses.textResponse;
import static io.netty.handler.codec.http.HttpHeaderNames.ALLOW;
import static io.netty.handler.codec.http.HttpHeaderValues.APPLICATION_JSON;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.METHOD_NOT_ALLOWED;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Records each GET and POST under its key and answers with the canned response
 * registered for that key.
 */
final class MockRequestHandler implements HttpHandler {
    static final String FILE_FIELD = "file";

    private static final Logger LOGGER = getLogger(MockRequestHandler.class);

    private final MockServerState state;

    MockRequestHandler(MockServerState state) {
        this.state = requireNonNull(state);
    }

    @Override
    public FullHttpResponse handle(FullHttpRequest request) {
        HttpMethod method = request.method();
        try {
            if (HttpMethod.GET.equals(method)) {
                return handleGet(request);
            }
            if (HttpMethod.POST.equals(method)) {
                return handlePost(request);
            }
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Cannot compute key for {} {}: {}", method, request.uri(), e.getMessage());
            return textResponse(BAD_REQUEST, String.valueOf(e.getMessage()));
        }

        LOGGER.debug("Rejecting {} {}", method, request.uri());
        FullHttpResponse response = textResponse(METHOD_NOT_ALLOWED, format("Method %s not allowed", method));
        response.headers().set(ALLOW, "GET, POST");
        return response;
    }

    private FullHttpResponse handleGet(FullHttpRequest request) {
        String key = RequestKeys.getKey(request.uri());
        return recordAndRespond(Keyspace.GET, key, request, "httpGETResponse");
    }

    private FullHttpResponse handlePost(FullHttpRequest request) {
        String content;
        try {
            content = new String(fileContent(request, FILE_FIELD), UTF_8);
        } catch (MultipartFileException e) {
            LOGGER.debug("No '{}' field in POST {}: {}", FILE_FIELD, request.uri(), e.getMessage());
            return textResponse(INTERNAL_SERVER_ERROR, e.getMessage());
        }

        String key = RequestKeys.postKey(request.uri(), content);
        return recordAndRespond(Keyspace.POST, key, request, "httpPOSTResponse");
    }

    private FullHttpResponse recordAndRespond(Keyspace keyspace, String key, FullHttpRequest request, String responseKind) {
        state.record(keyspace, key, RecordedRequest.from(request));

        Optional<CannedResponse> canned = state.response(keyspace, key);
        if (canned.isEmpty()) {
            LOGGER.debug("Recorded {} '{}', no response registered", keyspace, key);
            return textResponse(NOT_FOUND, format("No %s for '%s'", responseKind, key));
        }

        LOGGER.debug("Recorded {} '{}', responding with {}", keyspace, key, canned.get().status());
        return response(canned.get().status(), APPLICATION_JSON, canned.get().body());
    }
}
