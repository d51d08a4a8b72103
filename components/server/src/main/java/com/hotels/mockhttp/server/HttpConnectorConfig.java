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

import com.google.common.base.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Http Connector config.
 */
public final class HttpConnectorConfig {
    public static final int DEFAULT_MAX_CONTENT_LENGTH = 1024 * 1024;

    private final String host;
    private final int port;
    private final int maxContentLength;

    public HttpConnectorConfig(int port) {
        this("localhost", port, DEFAULT_MAX_CONTENT_LENGTH);
    }

    public HttpConnectorConfig(String host, int port, int maxContentLength) {
        checkArgument(port >= 0 && port <= 65535, "port %s out of range", port);
        checkArgument(maxContentLength > 0, "maxContentLength must be positive, was %s", maxContentLength);
        this.host = requireNonNull(host, "host");
        this.port = port;
        this.maxContentLength = maxContentLength;
    }

    public String host() {
        return host;
    }

    /**
     * Port to bind to. Zero binds an ephemeral port.
     */
    public int port() {
        return port;
    }

    public int maxContentLength() {
        return maxContentLength;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(host, port, maxContentLength);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        HttpConnectorConfig other = (HttpConnectorConfig) obj;
        return Objects.equal(this.host, other.host)
                && this.port == other.port
                && this.maxContentLength == other.maxContentLength;
    }

    @Override
    public String toString() {
        return toStringHelper(this)
                .add("host", host)
                .add("port", port)
                .add("maxContentLength", maxContentLength)
                .toString();
    }
}
