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

/**
 * Static factory methods for {@link MockServer} instances.
 */
public final class MockServers {
    private MockServers() {
    }

    /**
     * A mock server listening on an ephemeral localhost port once opened.
     */
    public static MockServer newMockServer() {
        return newMockServer(MockServerConfig.defaultConfig());
    }

    public static MockServer newMockServer(MockServerConfig config) {
        return new NettyMockServer(config);
    }
}
