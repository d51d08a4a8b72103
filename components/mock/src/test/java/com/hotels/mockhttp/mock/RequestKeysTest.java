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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RequestKeysTest {

    @ParameterizedTest
    @MethodSource("getKeysByUri")
    public void computesGetKeys(String uri, String key) {
        assertThat(RequestKeys.getKey(uri), is(key));
    }

    private static Stream<Arguments> getKeysByUri() {
        return Stream.of(
                Arguments.of("/upload", "/upload?"),
                Arguments.of("/", "/?"),
                Arguments.of("/?", "/?"),
                Arguments.of("/users?id=1&sort=desc", "/users?id=1&sort=desc"),
                Arguments.of("/search?q=a%20b+c", "/search?q=a%20b+c"),
                Arguments.of("/caf%C3%A9/a%20b?x=%41", "/café/a b?x=%41"),
                Arguments.of("/a+b", "/a+b?"),
                Arguments.of("/page?x=1#section", "/page?x=1"),
                Arguments.of("/page#section", "/page?"),
                Arguments.of("http://example.com:8080/abs?y=2", "/abs?y=2"),
                Arguments.of("http://example.com?y=2", "/?y=2")
        );
    }

    @Test
    public void appendsFileContentToPostKey() {
        assertThat(RequestKeys.postKey("/upload", "hello"), is("/upload? hello"));
        assertThat(RequestKeys.postKey("/upload?v=2", ""), is("/upload?v=2 "));
    }

    @Test
    public void splitsPathAndRawQuery() {
        assertThat(RequestKeys.path("/a%2Fb?c=%2F"), is("/a/b"));
        assertThat(RequestKeys.rawQuery("/a%2Fb?c=%2F"), is("c=%2F"));
        assertThat(RequestKeys.rawQuery("/a?b?c"), is("b?c"));
    }

    @Test
    public void rejectsMalformedPathEscapes() {
        assertThrows(IllegalArgumentException.class, () -> RequestKeys.getKey("/bad%zz"));
    }
}
