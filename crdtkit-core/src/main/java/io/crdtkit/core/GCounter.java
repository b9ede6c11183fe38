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

import static io.crdtkit.core.ProtoUtils.addCounts;
import static io.crdtkit.core.ProtoUtils.counts;
import static io.crdtkit.core.ProtoUtils.replica;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import io.crdtkit.core.api.CRDTType;
import io.crdtkit.core.api.IDeltaCRDT;
import io.crdtkit.core.api.ReplicaId;
import io.crdtkit.core.api.VersionVector;
import io.crdtkit.core.proto.GCounterDelta;
import io.crdtkit.core.proto.GCounterState;
import java.util.Map;
import java.util.NavigableMap;
import lombok.EqualsAndHashCode;

/**
 * Grow-only counter. Every replica increments its own slot; the value is the sum of all slots and merge keeps the
 * per-replica maximum.
 */
@EqualsAndHashCode
public final class GCounter implements IDeltaCRDT<Long, GCounter, GCounter.Delta, VersionVector> {
    @EqualsAndHashCode.Exclude
    private final ReplicaId replica;
    private final NavigableMap<ReplicaId, Long> counts;

    public GCounter(ReplicaId replica) {
        this(replica, Maps.newTreeMap());
    }

    private GCounter(ReplicaId replica, NavigableMap<ReplicaId, Long> counts) {
        this.replica = Preconditions.checkNotNull(replica);
        this.counts = counts;
    }

    public ReplicaId id() {
        return replica;
    }

    @Override
    public CRDTType type() {
        return CRDTType.gcounter;
    }

    public void increment() {
        increment(1);
    }

    public void increment(long n) {
        Preconditions.checkArgument(n >= 0, "GCounter can only grow");
        if (n > 0) {
            counts.merge(replica, n, Math::addExact);
        }
    }

    public long countOf(ReplicaId replica) {
        return counts.getOrDefault(replica, 0L);
    }

    /**
     * Sum of every replica's count.
     *
     * @return the total
     * @throws ArithmeticException if the total does not fit in a long
     */
    @Override
    public Long value() {
        long total = 0;
        for (long count : counts.values()) {
            total = Math.addExact(total, count);
        }
        return total;
    }

    @Override
    public void merge(GCounter other) {
        join(other.counts);
    }

    @Override
    public GCounter copy() {
        return new GCounter(replica, Maps.newTreeMap(counts));
    }

    @Override
    public VersionVector summarize() {
        return VersionVector.of(counts);
    }

    @Override
    public Delta delta(VersionVector since) {
        ImmutableSortedMap.Builder<ReplicaId, Long> ahead = ImmutableSortedMap.naturalOrder();
        counts.forEach((r, count) -> {
            if (count > since.get(r)) {
                ahead.put(r, count);
            }
        });
        return new Delta(ahead.build());
    }

    @Override
    public void applyDelta(Delta delta) {
        join(delta.counts);
    }

    private void join(Map<ReplicaId, Long> other) {
        other.forEach((r, count) -> counts.merge(r, count, Math::max));
    }

    GCounterState toProto() {
        GCounterState.Builder builder = GCounterState.newBuilder().setReplicaId(replica.id());
        addCounts(counts, builder::addCounts);
        return builder.build();
    }

    static GCounter fromProto(GCounterState state) {
        return new GCounter(replica(state.getReplicaId()), counts(state.getCountsList()));
    }

    @Override
    public String toString() {
        return "GCounter{replica=" + replica + ", counts=" + counts + '}';
    }

    /**
     * The slots in which the sender is ahead of the receiver, carrying the sender's absolute counts.
     */
    @EqualsAndHashCode
    public static final class Delta {
        private final ImmutableSortedMap<ReplicaId, Long> counts;

        Delta(ImmutableSortedMap<ReplicaId, Long> counts) {
            this.counts = counts;
        }

        public Map<ReplicaId, Long> counts() {
            return counts;
        }

        public boolean isEmpty() {
            return counts.isEmpty();
        }

        GCounterDelta toProto() {
            GCounterDelta.Builder builder = GCounterDelta.newBuilder();
            addCounts(counts, builder::addCounts);
            return builder.build();
        }

        static Delta fromProto(GCounterDelta delta) {
            return new Delta(ImmutableSortedMap.copyOfSorted(ProtoUtils.counts(delta.getCountsList())));
        }

        @Override
        public String toString() {
            return "GCounter.Delta" + counts;
        }
    }
}
