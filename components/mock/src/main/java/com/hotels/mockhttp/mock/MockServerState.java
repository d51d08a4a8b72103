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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Requests seen and responses configured, for GET and for POST.
 * <p>
 * All four mappings are guarded by the monitor of this object and are swapped
 * out together on {@link #reset()}.
 */
final class MockServerState {

    enum Keyspace {
        GET,
        POST
    }

    private Map<Keyspace, ListMultimap<String, RecordedRequest>> requests;
    private Map<Keyspace, Map<String, CannedResponse>> responses;

    MockServerState() {
        reset();
    }

    synchronized void reset() {
        Map<Keyspace, ListMultimap<String, RecordedRequest>> newRequests = new HashMap<>();
        Map<Keyspace, Map<String, CannedResponse>> newResponses = new HashMap<>();
        for (Keyspace keyspace : Keyspace.values()) {
            newRequests.put(keyspace, ArrayListMultimap.create());
            newResponses.put(keyspace, new HashMap<>());
        }
        this.requests = newRequests;
        this.responses = newResponses;
    }

    synchronized void record(Keyspace keyspace, String key, RecordedRequest request) {
        requests.get(keyspace).put(requireNonNull(key), requireNonNull(request));
    }

    synchronized List<RecordedRequest> requests(Keyspace keyspace, String key) {
        return ImmutableList.copyOf(requests.get(keyspace).get(key));
    }

    synchronized void register(Keyspace keyspace, String key, CannedResponse response) {
        responses.get(keyspace).put(requireNonNull(key), requireNonNull(response));
    }

    synchronized Optional<CannedResponse> response(Keyspace keyspace, String key) {
        return Optional.ofNullable(responses.get(keyspace).get(key));
    }
}
