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

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * An HTTP server that records the GET and POST requests it receives and answers
 * them with canned responses registered by the test.
 * <p>
 * Requests are identified by a key. For GET the key is {@code path + "?" + rawQuery}.
 * For POST it is {@code path + "?" + rawQuery + " " + content}, where content is the
 * text of the multipart/form-data file field named {@code file}. Registered
 * responses are served with status 200 and {@code Content-Type: application/json};
 * unknown keys get a 404.
 * <p>
 * Captured requests and registered responses survive closing and reopening the
 * listener. Call {@link #reset()} between tests to stop them affecting each other.
 */
public interface MockServer extends AutoCloseable {

    /**
     * Starts listening.
     *
     * @throws IOException           if the listening socket cannot be bound
     * @throws IllegalStateException if the server is already open
     */
    void open() throws IOException;

    /**
     * Stops listening. Does nothing if the server was never opened or is already closed.
     */
    @Override
    void close();

    boolean isOpen();

    /**
     * Clears all recorded requests and registered responses.
     */
    void reset();

    /**
     * Sets the body served for GET requests whose key is {@code "path?query"}.
     * Replaces any body registered earlier for the same key.
     */
    void setGETResponseBody(String key, String body);

    /**
     * Sets the body served for POST requests whose key is {@code "path?query content"}.
     * Replaces any body registered earlier for the same key.
     */
    void setPOSTResponseBody(String key, String body);

    /**
     * GET requests received for the key, in arrival order. Empty if there were none.
     */
    List<RecordedRequest> getGETRequests(String key);

    /**
     * POST requests received for the key, in arrival order. Empty if there were none.
     */
    List<RecordedRequest> getPOSTRequests(String key);

    /**
     * The base URL of the listener, e.g. {@code http://localhost:54321}.
     *
     * @throws IllegalStateException if the server is not open
     */
    URI url();
}
