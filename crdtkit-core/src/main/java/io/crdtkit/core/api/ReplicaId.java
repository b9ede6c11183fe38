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
package io.crdtkit.core.api;

import static com.google.protobuf.UnsafeByteOperations.unsafeWrap;

import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;
import com.google.protobuf.ByteString;
import java.nio.ByteBuffer;
import java.util.Comparator;
import java.util.UUID;

/**
 * Opaque replica identity. Uniqueness is the caller's responsibility: two logically distinct replicas sharing an id
 * make their tags look like they came from one source.
 *
 * <p>Ids are totally ordered by unsigned lexicographic comparison of their bytes, a proper prefix sorting first. This
 * order breaks every timestamp tie in the library.
 */
public final class ReplicaId implements Comparable<ReplicaId> {
    private static final Comparator<ByteString> ORDER = ByteString.unsignedLexicographicalComparator();

    private final ByteString id;

    private ReplicaId(ByteString id) {
        this.id = id;
    }

    public static ReplicaId of(ByteString id) {
        Preconditions.checkNotNull(id, "Replica id must not be null");
        return new ReplicaId(id);
    }

    public static ReplicaId of(String id) {
        Preconditions.checkNotNull(id, "Replica id must not be null");
        return new ReplicaId(ByteString.copyFromUtf8(id));
    }

    public static ReplicaId random() {
        UUID uuid = UUID.randomUUID();
        return new ReplicaId(unsafeWrap(ByteBuffer.allocate(2 * Long.BYTES)
            .putLong(uuid.getMostSignificantBits())
            .putLong(uuid.getLeastSignificantBits())
            .array()));
    }

    public ByteString id() {
        return id;
    }

    @Override
    public int compareTo(ReplicaId other) {
        return ORDER.compare(id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReplicaId)) {
            return false;
        }
        return id.equals(((ReplicaId) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id.isValidUtf8() ? id.toStringUtf8() : "0x" + BaseEncoding.base16().encode(id.toByteArray());
    }
}
