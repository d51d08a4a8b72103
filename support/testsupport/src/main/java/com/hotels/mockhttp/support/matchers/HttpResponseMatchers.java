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
package com.hotels.mockhttp.support.matchers;

import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static org.hamcrest.Matchers.equalTo;

/**
 * Hamcrest matchers for netty responses received by the test client.
 */
public final class HttpResponseMatchers {
    private HttpResponseMatchers() {
    }

    public static Matcher<FullHttpResponse> hasStatus(HttpResponseStatus status) {
        requireNonNull(status);
        return new TypeSafeMatcher<FullHttpResponse>() {
            @Override
            protected boolean matchesSafely(FullHttpResponse response) {
                return response.status().code() == status.code();
            }

            @Override
            protected void describeMismatchSafely(FullHttpResponse response, Description description) {
                description.appendText("status was ").appendValue(response.status());
            }

            @Override
            public void describeTo(Description description) {
                description.appendText("status ").appendValue(status);
            }
        };
    }

    public static Matcher<FullHttpResponse> hasBody(String body) {
        return hasBody(equalTo(body));
    }

    public static Matcher<FullHttpResponse> hasBody(Matcher<String> body) {
        return new TypeSafeMatcher<FullHttpResponse>() {
            @Override
            protected boolean matchesSafely(FullHttpResponse response) {
                return body.matches(bodyAsString(response));
            }

            @Override
            protected void describeMismatchSafely(FullHttpResponse response, Description description) {
                description.appendText("content was '" + bodyAsString(response) + "'");
            }

            @Override
            public void describeTo(Description description) {
                description.appendText("content with ");
                body.describeTo(description);
            }
        };
    }

    public static Matcher<FullHttpResponse> hasHeader(CharSequence name, String value) {
        return new TypeSafeMatcher<FullHttpResponse>() {
            @Override
            protected boolean matchesSafely(FullHttpResponse response) {
                return value.equals(response.headers().get(name));
            }

            @Override
            protected void describeMismatchSafely(FullHttpResponse response, Description description) {
                description.appendText(name + " was ").appendValue(response.headers().get(name));
            }

            @Override
            public void describeTo(Description description) {
                description.appendText("header " + name + "=").appendValue(value);
            }
        };
    }

    public static String bodyAsString(FullHttpResponse response) {
        return response.content().toString(UTF_8);
    }
}
