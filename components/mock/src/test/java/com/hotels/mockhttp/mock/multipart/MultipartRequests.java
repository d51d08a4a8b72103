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
package com.hotels.mockhttp.mock.multipart;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_LENGTH;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpMethod.POST;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Hand written multipart/form-data requests.
 */
public final class MultipartRequests {
    public static final String BOUNDARY = "----mockhttp-boundary-7MA4YWxkTrZu0gW";

    private MultipartRequests() {
    }

    public static FullHttpRequest postFile(String uri, String fieldName, String content) {
        return post(uri, "multipart/form-data; boundary=" + BOUNDARY, filePart(fieldName, content) + closingBoundary());
    }

    public static FullHttpRequest postAttribute(String uri, String fieldName, String value) {
        return post(uri, "multipart/form-data; boundary=" + BOUNDARY, attributePart(fieldName, value) + closingBoundary());
    }

    public static FullHttpRequest post(String uri, String contentType, String body) {
        FullHttpRequest request = new DefaultFullHttpRequest(HTTP_1_1, POST, uri, Unpooled.copiedBuffer(body, UTF_8));
        request.headers()
                .set(CONTENT_TYPE, contentType)
                .setInt(CONTENT_LENGTH, request.content().readableBytes());
        return request;
    }

    public static String filePart(String fieldName, String content) {
        return "--" + BOUNDARY + "\r\n"
                + "Content-Disposition: form-data; name=\"" + fieldName + "\"; filename=\"" + fieldName + ".txt\"\r\n"
                + "Content-Type: text/plain\r\n"
                + "\r\n"
                + content + "\r\n";
    }

    public static String attributePart(String fieldName, String value) {
        return "--" + BOUNDARY + "\r\n"
                + "Content-Disposition: form-data; name=\"" + fieldName + "\"\r\n"
                + "\r\n"
                + value + "\r\n";
    }

    public static String closingBoundary() {
        return "--" + BOUNDARY + "--\r\n";
    }
}
