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

import com.google.common.base.Preconditions;
import com.google.protobuf.ByteString;
import io.crdtkit.core.api.CRDTType;

/**
 * Versioned frame around every encoded payload.
 *
 * <pre>
 * [MAGIC 0xCF][FORMAT VERSION][CRDT TYPE][KIND][FLAGS][PAYLOAD...]
 * </pre>
 *
 * <p>Bit 0 of the flags marks a compressed payload. The kind byte distinguishes full states from deltas and
 * summaries of the same type.
 */
public final class Envelope {
    public static final int MAGIC = 0xCF;
    public static final int FORMAT_VERSION = 1;
    public static final int HEADER_SIZE = 5;
    public static final int FLAG_COMPRESSED = 0x01;

    /**
     * What the payload holds.
     */
    public enum Kind {
        State(0), Delta(1), Summary(2);

        public final int id;

        Kind(int id) {
            this.id = id;
        }
    }

    public final CRDTType type;
    public final Kind kind;
    public final int flags;
    public final ByteString payload;

    public Envelope(CRDTType type, Kind kind, int flags, ByteString payload) {
        this.type = Preconditions.checkNotNull(type);
        this.kind = Preconditions.checkNotNull(kind);
        this.flags = flags;
        this.payload = Preconditions.checkNotNull(payload);
    }

    public boolean compressed() {
        return (flags & FLAG_COMPRESSED) != 0;
    }

    public ByteString toByteString() {
        byte[] header = new byte[] {(byte) MAGIC, (byte) FORMAT_VERSION, (byte) type.id, (byte) kind.id,
            (byte) flags};
        return ByteString.copyFrom(header).concat(payload);
    }

    /**
     * Parse a frame.
     *
     * @param bytes the encoded frame
     * @param maxBytes the largest frame accepted
     * @return the envelope
     * @throws DecodeException if the header is missing, corrupted or names an unknown type
     */
    public static Envelope parse(ByteString bytes, int maxBytes) {
        if (bytes.size() > maxBytes) {
            throw DecodeException.tooLarge(bytes.size(), maxBytes);
        }
        if (bytes.size() < HEADER_SIZE) {
            throw DecodeException.truncated(bytes.size());
        }
        int magic = Byte.toUnsignedInt(bytes.byteAt(0));
        if (magic != MAGIC) {
            throw DecodeException.badMagic(magic);
        }
        int version = Byte.toUnsignedInt(bytes.byteAt(1));
        if (version != FORMAT_VERSION) {
            throw DecodeException.unsupportedVersion(version);
        }
        int typeId = Byte.toUnsignedInt(bytes.byteAt(2));
        CRDTType type = CRDTType.fromId(typeId).orElseThrow(() -> DecodeException.unknownType(typeId));
        int kindId = Byte.toUnsignedInt(bytes.byteAt(3));
        Kind kind = switch (kindId) {
            case 0 -> Kind.State;
            case 1 -> Kind.Delta;
            case 2 -> Kind.Summary;
            default -> throw DecodeException.malformed("Unknown payload kind: " + kindId);
        };
        int flags = Byte.toUnsignedInt(bytes.byteAt(4));
        if ((flags & ~FLAG_COMPRESSED) != 0) {
            throw DecodeException.malformed(String.format("Unknown flags: 0x%02X", flags));
        }
        return new Envelope(type, kind, flags, bytes.substring(HEADER_SIZE));
    }
}
