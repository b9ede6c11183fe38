/*
 * Copyright (c) 2025. The CRDTKit Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *    http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and limitations under the License.
 */
package io.crdtkit.core.codec;

import com.google.protobuf.ByteString;

public interface Compressor {
    static Compressor newInstance(CompressAlgorithm algorithm) {
        return switch (algorithm) {
            case GZIP -> new GzipCompressor();
            case NONE -> new NoopCompressor();
        };
    }

    ByteString compress(ByteString src);

    /**
     * Restore compressed bytes, giving up as soon as the output grows past {@code maxBytes}.
     *
     * @param src the compressed bytes
     * @param maxBytes the largest acceptable output
     * @return the original bytes
     * @throws DecodeException if the input is not valid compressed data or inflates past the limit
     */
    ByteString decompress(ByteString src, int maxBytes);
}
