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

import com.google.common.collect.ImmutableListMultimap;
import io.netty.buffer.ByteBufUtil;
import io.netty.handler.codec.http.FullHttpRequest;

import java.nio.charset.Charset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Locale.ROOT;
import static java.util.Objects.requireNonNull;

/**
 * An immutable copy of a request received by the mock server.
 * Header names are stored in lower case.
 */
public final class RecordedRequest {
    private final String method;
    private final String uri;
    private final String path;
    private final String rawQuery;
    private final ImmutableListMultimap<String, String> headers;
    private final byte[] body;

    RecordedRequest(String method, String uri, String path, String rawQuery,
                    ImmutableListMultimap<String, String> headers, byte[] body) {
        this.method = requireNonNull(method);
        this.uri = requireNonNull(uri);
        this.path = requireNonNull(path);
        this.rawQuery = requireNonNull(rawQuery);
        this.headers = requireNonNull(headers);
        this.body = body.clone();
    }

    static RecordedRequest from(FullHttpRequest request) {
        String uri = request.uri();
        ImmutableListMultimap.Builder<String, String> headers = ImmutableListMultimap.builder();
        for (Map.Entry<String, String> header : request.headers()) {
            headers.put(header.getKey().toLowerCase(ROOT), header.getValue());
        }
        return new RecordedRequest(
                request.method().name(),
                uri,
                RequestKeys.path(uri),
                RequestKeys.rawQuery(uri),
                headers.build(),
                ByteBufUtil.getBytes(request.content()));
    }

    public String method() {
        return method;
    }

    /**
     * The request target exactly as sent on the request line.
     */
    public String uri() {
        return uri;
    }

    /**
     * The percent-decoded path.
     */
    public String path() {
        return path;
    }

    public String rawQuery() {
        return rawQuery;
    }

    public ImmutableListMultimap<String, String> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name.toLowerCase(ROOT));
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAs(Charset charset) {
        return new String(body, charset);
    }

    @Override
    public String toString() {
        return toStringHelper(this)
                .add("method", method)
                .add("uri", uri)
                .add("headers", headers)
                .add("bodyLength", body.length)
                .toString();
    }
}
