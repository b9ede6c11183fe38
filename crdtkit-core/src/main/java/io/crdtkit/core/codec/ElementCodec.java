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
 * Converts the payload of a collection CRDT (set elements, register values, sequence items) to bytes and back.
 *
 * @param <T> the payload type
 */
public interface ElementCodec<T> {
    ByteString encode(T element);

    /**
     * Decode one payload.
     *
     * @param bytes the encoded payload
     * @return the payload
     * @throws DecodeException if the bytes are not a valid payload
     */
    T decode(ByteString bytes);
}
