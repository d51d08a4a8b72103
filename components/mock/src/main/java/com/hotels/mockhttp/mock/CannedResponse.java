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

import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * A status and body to answer a matching request with.
 */
public final class CannedResponse {
    private final HttpResponseStatus status;
    private final String body;

    private CannedResponse(HttpResponseStatus status, String body) {
        this.status = requireNonNull(status);
        this.body = requireNonNull(body);
    }

    public static CannedResponse ok(String body) {
        return new CannedResponse(HttpResponseStatus.OK, body);
    }

    public HttpResponseStatus status() {
        return status;
    }

    public String body() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CannedResponse that = (CannedResponse) o;
        return status.code() == that.status.code() && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status.code(), body);
    }

    @Override
    public String toString() {
        return toStringHelper(this)
                .add("status", status)
                .add("body", body)
                .toString();
    }
}
