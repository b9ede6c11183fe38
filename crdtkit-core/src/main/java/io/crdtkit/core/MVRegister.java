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
package io.crdtkit.core;

import static io.crdtkit.core.ProtoUtils.replica;
import static io.crdtkit.core.ProtoUtils.vectorClock;
import static io.crdtkit.core.ProtoUtils.versionVector;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.crdtkit.core.api.CRDTType;
import io.crdtkit.core.api.ICRDT;
import io.crdtkit.core.api.ReplicaId;
import io.crdtkit.core.api.VersionVector;
import io.crdtkit.core.codec.DecodeException;
import io.crdtkit.core.codec.ElementCodec;
import io.crdtkit.core.proto.MVEntry;
import io.crdtkit.core.proto.MVRegisterState;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

/**
 * Multi-value register. Concurrent writes are all kept until a later write that has seen them replaces them.
 *
 * @param <T> the value type
 */
@Slf4j
@EqualsAndHashCode
public final class MVRegister<T> implements ICRDT<List<T>, MVRegister<T>> {
    @EqualsAndHashCode.Exclude
    private final ReplicaId replica;
    private VersionVector version;
    // sorted by writer, concurrent entries never share one
    private List<Entry<T>> entries;

    public MVRegister(ReplicaId replica) {
        this(replica, VersionVector.EMPTY, ImmutableList.of());
    }

    private MVRegister(ReplicaId replica, VersionVector version, List<Entry<T>> entries) {
        this.replica = Preconditions.checkNotNull(replica);
        this.version = version;
        this.entries = entries;
    }

    public ReplicaId id() {
        return replica;
    }

    @Override
    public CRDTType type() {
        return CRDTType.mvreg;
    }

    /**
     * Overwrite every value seen so far.
     *
     * @param value the value
     */
    public void set(T value) {
        Preconditions.checkNotNull(value);
        version = version.increment(replica);
        entries = ImmutableList.of(new Entry<>(value, version, replica));
    }

    /**
     * All concurrent values, ordered by the id of the replica that wrote them.
     *
     * @return the values, empty if never written
     */
    @Override
    public List<T> value() {
        return Lists.transform(entries, Entry::value);
    }

    public List<T> values() {
        return value();
    }

    public boolean isConflicted() {
        return entries.size() > 1;
    }

    public Optional<T> single() {
        return entries.size() == 1 ? Optional.of(entries.get(0).value()) : Optional.empty();
    }

    public VersionVector version() {
        return version;
    }

    @Override
    public void merge(MVRegister<T> other) {
        List<Entry<T>> candidates = Lists.newArrayList(entries);
        for (Entry<T> entry : other.entries) {
            if (candidates.stream().noneMatch(e -> e.stamp().equals(entry.stamp()))) {
                candidates.add(entry);
            }
        }
        List<Entry<T>> survivors = Lists.newArrayList();
        for (Entry<T> entry : candidates) {
            if (candidates.stream().noneMatch(e -> e.stamp().dominates(entry.stamp()))) {
                survivors.add(entry);
            }
        }
        survivors.sort(Comparator.comparing(Entry::writer));
        entries = ImmutableList.copyOf(survivors);
        version = version.join(other.version);
        if (entries.size() > 1) {
            log.debug("Register has {} concurrent values after merge", entries.size());
        }
    }

    @Override
    public MVRegister<T> copy() {
        return new MVRegister<>(replica, version, entries);
    }

    MVRegisterState toProto(ElementCodec<T> codec) {
        MVRegisterState.Builder builder = MVRegisterState.newBuilder()
            .setReplicaId(replica.id())
            .setVersion(vectorClock(version));
        for (Entry<T> entry : entries) {
            builder.addEntries(MVEntry.newBuilder()
                .setValue(codec.encode(entry.value()))
                .setStamp(vectorClock(entry.stamp()))
                .setWriter(entry.writer().id())
                .build());
        }
        return builder.build();
    }

    static <T> MVRegister<T> fromProto(MVRegisterState state, ElementCodec<T> codec) {
        VersionVector version = versionVector(state.getVersion());
        List<Entry<T>> entries = Lists.newArrayList();
        for (MVEntry e : state.getEntriesList()) {
            T value = codec.decode(e.getValue());
            if (value == null) {
                throw DecodeException.malformed("Null register value");
            }
            VersionVector stamp = versionVector(e.getStamp());
            if (!version.descends(stamp)) {
                throw DecodeException.malformed("Entry stamp ahead of register version");
            }
            entries.add(new Entry<>(value, stamp, replica(e.getWriter())));
        }
        entries.sort(Comparator.comparing(Entry::writer));
        return new MVRegister<>(replica(state.getReplicaId()), version, ImmutableList.copyOf(entries));
    }

    @Override
    public String toString() {
        return "MVRegister{version=" + version + ", entries=" + entries + '}';
    }

    record Entry<T>(T value, VersionVector stamp, ReplicaId writer) {
    }
}
