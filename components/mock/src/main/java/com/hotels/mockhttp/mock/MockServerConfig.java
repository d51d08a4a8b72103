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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hotels.mockhttp.server.HttpConnectorConfig;

import static com.google.common.base.MoreObjects.firstNonNull;
import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.hotels.mockhttp.server.HttpConnectorConfig.DEFAULT_MAX_CONTENT_LENGTH;

/**
 * Configuration values for the mock server listener.
 * <p>
 * Can be built in code or read from YAML:
 * <pre>
 * host: localhost
 * port: 0
 * workerThreads: 2
 * maxContentLength: 1048576
 * </pre>
 */
@JsonDeserialize(builder = MockServerConfig.Builder.class)
public final class MockServerConfig {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final String host;
    private final int port;
    private final int workerThreads;
    private final int maxContentLength;

    private MockServerConfig(Builder builder) {
        this.host = firstNonNull(builder.host, "localhost");
        this.port = firstNonNull(builder.port, 0);
        this.workerThreads = firstNonNull(builder.workerThreads, 1);
        this.maxContentLength = firstNonNull(builder.maxContentLength, DEFAULT_MAX_CONTENT_LENGTH);

        checkArgument(port >= 0 && port <= 65535, "port %s out of range", port);
        checkArgument(workerThreads > 0, "workerThreads must be positive, was %s", workerThreads);
        checkArgument(maxContentLength > 0, "maxContentLength must be positive, was %s", maxContentLength);
    }

    public static MockServerConfig defaultConfig() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Reads a configuration from a YAML document. Missing values take their defaults.
     *
     * @param yaml YAML document
     * @return configuration
     * @throws IllegalArgumentException if the document cannot be parsed or holds invalid values
     */
    public static MockServerConfig fromYaml(String yaml) {
        try {
            MockServerConfig config = YAML_MAPPER.readValue(yaml, MockServerConfig.class);
            return config != null ? config : defaultConfig();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid mock server configuration: " + e.getOriginalMessage(), e);
        }
    }

    public String host() {
        return host;
    }

    /**
     * Port to listen on. Zero picks an ephemeral port on every open.
     */
    public int port() {
        return port;
    }

    /**
     * Number of IO threads serving connections.
     */
    public int workerThreads() {
        return workerThreads;
    }

    /**
     * Largest request body accepted, in bytes. Bigger bodies are answered with 413.
     */
    public int maxContentLength() {
        return maxContentLength;
    }

    HttpConnectorConfig connectorConfig() {
        return new HttpConnectorConfig(host, port, maxContentLength);
    }

    @Override
    public String toString() {
        return toStringHelper(this)
                .add("host", host)
                .add("port", port)
                .add("workerThreads", workerThreads)
                .add("maxContentLength", maxContentLength)
                .toString();
    }

    /**
     * Builder.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder {
        private String host;
        private Integer port;
        private Integer workerThreads;
        private Integer maxContentLength;

        private Builder() {
        }

        @JsonProperty("host")
        public Builder setHost(String host) {
            this.host = host;
            return this;
        }

        @JsonProperty("port")
        public Builder setPort(Integer port) {
            this.port = port;
            return this;
        }

        @JsonProperty("workerThreads")
        public Builder setWorkerThreads(Integer workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        @JsonProperty("maxContentLength")
        public Builder setMaxContentLength(Integer maxContentLength) {
            this.maxContentLength = maxContentLength;
            return this;
        }

        public MockServerConfig build() {
            return new MockServerConfig(this);
        }
    }
}
