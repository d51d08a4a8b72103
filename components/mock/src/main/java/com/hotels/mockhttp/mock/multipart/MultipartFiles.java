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
import io.netty.handler.codec.http.multipart.DefaultHttpDataFactory;
import io.netty.handler.codec.http.multipart.FileUpload;
import io.netty.handler.codec.http.multipart.HttpPostRequestDecoder;
import io.netty.handler.codec.http.multipart.InterfaceHttpData;

import java.io.IOException;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Reads file fields out of multipart/form-data request bodies.
 */
public final class MultipartFiles {
    public static final String NOT_MULTIPART = "request Content-Type isn't multipart/form-data";
    public static final String NO_SUCH_FILE = "http: no such file";

    private MultipartFiles() {
    }

    /**
     * Returns the full content of the file field with the given name.
     * The request content is not consumed.
     *
     * @param request   aggregated request
     * @param fieldName form field name
     * @return file content
     * @throws MultipartFileException if the body is not multipart/form-data, is malformed,
     *                                or has no file field with that name
     */
    public static byte[] fileContent(FullHttpRequest request, String fieldName) throws MultipartFileException {
        requireNonNull(fieldName);
        if (!HttpPostRequestDecoder.isMultipart(request)) {
            throw new MultipartFileException(NOT_MULTIPART);
        }

        HttpPostRequestDecoder decoder = newDecoder(request.retainedDuplicate());
        try {
            List<InterfaceHttpData> datas = decoder.getBodyHttpDatas(fieldName);
            if (datas != null) {
                for (InterfaceHttpData data : datas) {
                    if (data.getHttpDataType() == InterfaceHttpData.HttpDataType.FileUpload) {
                        return ((FileUpload) data).get();
                    }
                }
            }
            throw new MultipartFileException(NO_SUCH_FILE);
        } catch (HttpPostRequestDecoder.NotEnoughDataDecoderException e) {
            throw new MultipartFileException(NO_SUCH_FILE, e);
        } catch (HttpPostRequestDecoder.ErrorDataDecoderException e) {
            throw new MultipartFileException(String.valueOf(e.getMessage()), e);
        } catch (IOException e) {
            throw new MultipartFileException(e.getMessage(), e);
        } finally {
            decoder.destroy();
        }
    }

    private static HttpPostRequestDecoder newDecoder(FullHttpRequest request) throws MultipartFileException {
        try {
            return new HttpPostRequestDecoder(new DefaultHttpDataFactory(false), request);
        } catch (HttpPostRequestDecoder.ErrorDataDecoderException e) {
            throw new MultipartFileException(String.valueOf(e.getMessage()), e);
        } finally {
            request.release();
        }
    }
}
