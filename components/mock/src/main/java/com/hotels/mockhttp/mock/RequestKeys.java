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

import io.netty.handler.codec.http.QueryStringDecoder;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Computes the keys that captured requests and canned responses are stored under.
 * <p>
 * A GET key is the decoded path, a question mark and the raw query string. A POST
 * key appends a space and the uploaded file content to that. The question mark
 * is always present, even when the query is empty.
 */
public final class RequestKeys {
    private RequestKeys() {
    }

    /**
     * The GET key for a request target, e.g. {@code "/users?id=1"}.
     */
    public static String getKey(String uri) {
        return path(uri) + "?" + rawQuery(uri);
    }

    /**
     * The POST key for a request target and uploaded file content, e.g. {@code "/upload? hello"}.
     */
    public static String postKey(String uri, String content) {
        return getKey(uri) + " " + content;
    }

    /**
     * The percent-decoded path of a request target. Absolute-form targets are
     * reduced to their path.
     *
     * @throws IllegalArgumentException if the path contains a malformed escape
     */
    static String path(String uri) {
        return new QueryStringDecoder(originForm(uri), UTF_8).path();
    }

    static String rawQuery(String uri) {
        String target = withoutFragment(uri);
        int queryStart = target.indexOf('?');
        return queryStart < 0 ? "" : target.substring(queryStart + 1);
    }

    private static String originForm(String uri) {
        String target = withoutFragment(uri);
        int schemeEnd = target.indexOf("://");
        if (schemeEnd < 0 || target.startsWith("/")) {
            return target;
        }
        int pathStart = target.indexOf('/', schemeEnd + 3);
        int queryStart = target.indexOf('?', schemeEnd + 3);
        if (pathStart < 0 || (queryStart >= 0 && queryStart < pathStart)) {
            return queryStart < 0 ? "/" : "/" + target.substring(queryStart);
        }
        return target.substring(pathStart);
    }

    private static String withoutFragment(String uri) {
        int fragmentStart = uri.indexOf('#');
        return fragmentStart < 0 ? uri : uri.substring(0, fragmentStart);
    }
}
