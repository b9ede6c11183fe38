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

/**
 * Built-in element codecs.
 */
public final class ElementCodecs {
    public static final ElementCodec<String> UTF8 = new ElementCodec<>() {
        @Override
        public ByteString encode(String element) {
            return ByteString.copyFromUtf8(element);
        }

        @Override
        public String decode(ByteString bytes) {
            if (!bytes.isValidUtf8()) {
                throw DecodeException.malformed("Invalid UTF-8 element");
            }
            return bytes.toStringUtf8();
        }
    };

    public static final ElementCodec<Long> LONG = new ElementCodec<>() {
        @Override
        public ByteString encode(Long element) {
            return VarLong.encode(element);
        }

        @Override
        public Long decode(ByteString bytes) {
            return VarLong.decode(bytes);
        }
    };

    public static final ElementCodec<Integer> CODE_POINT = new ElementCodec<>() {
        @Override
        public ByteString encode(Integer element) {
            return VarLong.encode(element);
        }

        @Override
        public Integer decode(ByteString bytes) {
            long codePoint = VarLong.decode(bytes);
            if (codePoint < 0 || codePoint > Character.MAX_CODE_POINT) {
                throw DecodeException.malformed("Invalid code point: " + codePoint);
            }
            return (int) codePoint;
        }
    };

    public static final ElementCodec<ByteString> BYTES = new ElementCodec<>() {
        @Override
        public ByteString encode(ByteString element) {
            return element;
        }

        @Override
        public ByteString decode(ByteString bytes) {
            return bytes;
        }
    };

    private ElementCodecs() {
    }
}
