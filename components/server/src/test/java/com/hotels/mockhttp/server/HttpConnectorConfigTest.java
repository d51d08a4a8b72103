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

import org.junit.jupiter.api.Test;

import static com.hotels.mockhttp.server.HttpConnectorConfig.DEFAULT_MAX_CONTENT_LENGTH;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class HttpConnectorConfigTest {
    @Test
    public void defaultsToLocalhostAndOneMegabyteBodies() {
        HttpConnectorConfig config = new HttpConnectorConfig(8080);

        assertThat(config.host(), is("localhost"));
        assertThat(config.port(), is(8080));
        assertThat(config.maxContentLength(), is(DEFAULT_MAX_CONTENT_LENGTH));
    }

    @Test
    public void rejectsPortsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> new HttpConnectorConfig(-1));
        assertThrows(IllegalArgumentException.class, () -> new HttpConnectorConfig(65536));
    }

    @Test
    public void rejectsNonPositiveContentLength() {
        assertThrows(IllegalArgumentException.class, () -> new HttpConnectorConfig("localhost", 0, 0));
    }

    @Test
    public void isComparedByValue() {
        assertThat(new HttpConnectorConfig("localhost", 80, 10), is(new HttpConnectorConfig("localhost", 80, 10)));
        assertThat(new HttpConnectorConfig("localhost", 80, 10).equals(new HttpConnectorConfig("localhost", 81, 10)), is(false));
    }
}
