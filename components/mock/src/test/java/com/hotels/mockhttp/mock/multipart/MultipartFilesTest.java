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
package com.hotels.mockhttp.mock.multipart;

import io.netty.handler.codec.http.FullHttpRequest;
import org.junit.jupiter.api.Test;

import static com.hotels.mockhttp.mock.multipart.MultipartFiles.NOT_MULTIPART;
import static com.hotels.mockhttp.mock.multipart.MultipartFiles.NO_SUCH_FILE;
import static com.hotels.mockhttp.mock.multipart.MultipartFiles.fileContent;
import static com.hotels.mockhttp.mock.multipart.MultipartRequests.BOUNDARY;
import static com.hotels.mockhttp.mock.multipart.MultipartRequests.attributePart;
import static com.hotels.mockhttp.mock.multipart.MultipartRequests.closingBoundary;
import static com.hotels.mockhttp.mock.multipart.MultipartRequests.filePart;
import static com.hotels.mockhttp.mock.multipart.MultipartRequests.post;
import static com.hotels.mockhttp.mock.multipart.MultipartRequests.postAttribute;
import static com.hotels.mockhttp.mock.multipart.MultipartRequests.postFile;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class MultipartFilesTest {

    @Test
    public void extractsNamedFileContent() throws Exception {
        FullHttpRequest request = postFile("/upload", "file", "hello");
        try {
            assertThat(new String(fileContent(request, "file"), UTF_8), is("hello"));
        } finally {
            request.release();
        }
    }

    @Test
    public void picksTheRequestedFieldAmongSeveral() throws Exception {
        String body = attributePart("comment", "ignored")
                + filePart("other", "not this one")
                + filePart("file", "{\"id\": 7}\nsecond line")
                + closingBoundary();
        FullHttpRequest request = post("/upload", "multipart/form-data; boundary=" + BOUNDARY, body);
        try {
            assertThat(new String(fileContent(request, "file"), UTF_8), is("{\"id\": 7}\nsecond line"));
        } finally {
            request.release();
        }
    }

    @Test
    public void leavesRequestContentUnread() throws Exception {
        FullHttpRequest request = postFile("/upload", "file", "hello");
        int readable = request.content().readableBytes();
        try {
            fileContent(request, "file");

            assertThat(request.content().readableBytes(), is(readable));
            assertThat(request.refCnt(), is(1));
        } finally {
            request.release();
        }
    }

    @Test
    public void rejectsBodiesThatAreNotMultipart() {
        FullHttpRequest request = post("/upload", "application/json", "{}");
        try {
            MultipartFileException e = assertThrows(MultipartFileException.class, () -> fileContent(request, "file"));
            assertThat(e.getMessage(), is(NOT_MULTIPART));
        } finally {
            request.release();
        }
    }

    @Test
    public void rejectsMultipartWithoutBoundary() {
        FullHttpRequest request = post("/upload", "multipart/form-data", "whatever");
        try {
            MultipartFileException e = assertThrows(MultipartFileException.class, () -> fileContent(request, "file"));
            assertThat(e.getMessage(), is(NOT_MULTIPART));
        } finally {
            request.release();
        }
    }

    @Test
    public void reportsMissingFileField() {
        FullHttpRequest request = postFile("/upload", "document", "hello");
        try {
            MultipartFileException e = assertThrows(MultipartFileException.class, () -> fileContent(request, "file"));
            assertThat(e.getMessage(), is(NO_SUCH_FILE));
        } finally {
            request.release();
        }
    }

    @Test
    public void doesNotAcceptPlainAttributeAsFile() {
        FullHttpRequest request = postAttribute("/upload", "file", "hello");
        try {
            MultipartFileException e = assertThrows(MultipartFileException.class, () -> fileContent(request, "file"));
            assertThat(e.getMessage(), is(NO_SUCH_FILE));
        } finally {
            request.release();
        }
    }
}
