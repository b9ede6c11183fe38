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

import static com.google.protobuf.UnsafeByteOperations.unsafeWrap;

import com.google.protobuf.ByteString;
import java.nio.ByteBuffer;

/**
 * Variable-length Long.
 */
public class VarLong {
    private static final int MAX_BYTES = 10;

    /**
     * Decode bytes to long. The bytes must hold exactly one encoded value.
     *
     * @param bytes the var long bytes
     * @return long value
     */
    public static long decode(ByteString bytes) {
        ByteBuffer buffer = bytes.asReadOnlyByteBuffer();
        long result = 0;
        for (int i = 0; i < MAX_BYTES; i++) {
            if (!buffer.hasRemaining()) {
                throw DecodeException.truncated(bytes.size());
            }
            long temp = buffer.get();
            result |= (temp & 0x7F) << (7 * i);
            if (temp >= 0) {
                if (buffer.hasRemaining()) {
                    throw DecodeException.malformed("Trailing bytes after var long");
                }
                return result;
            }
        }
        throw DecodeException.malformed("Var long longer than " + MAX_BYTES + " bytes");
    }

    /**
     * Encode long to var bytes.
     *
     * @param value the long value
     * @return encoded bytes
     */
    public static ByteString encode(long value) {
        int size = sizing(value);
        ByteBuffer buffer = ByteBuffer.allocate(size);
        encode(value, buffer);
        return unsafeWrap(buffer.array());
    }

    private static int sizing(long value) {
        int size = 0;
        do {
            size++;
            value >>>= 7;
        } while (value != 0);
        return size;
    }

    private static void encode(long value, ByteBuffer buffer) {
        while (true) {
            int currentBits = (int) value & 0x7F;
            value >>>= 7;
            if (value == 0) {
                buffer.put((byte) currentBits);
                return;
            } else {
                buffer.put((byte) (currentBits | 0x80));
            }
        }
    }
}
