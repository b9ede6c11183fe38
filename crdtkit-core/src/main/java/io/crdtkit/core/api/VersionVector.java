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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Immutable version vector: replica id to the number of events seen from that replica. Absent entries count as zero
 * and zero entries are never stored, so two vectors describing the same history are equal.
 */
public final class VersionVector {
    public static final VersionVector EMPTY = new VersionVector(ImmutableSortedMap.of());

    /**
     * Causal relation of two vectors.
     */
    public enum Order {
        Before, After, Equal, Concurrent
    }

    private final ImmutableSortedMap<ReplicaId, Long> counters;

    private VersionVector(ImmutableSortedMap<ReplicaId, Long> counters) {
        this.counters = counters;
    }

    public static VersionVector of(Map<ReplicaId, Long> counters) {
        NavigableMap<ReplicaId, Long> nonZero = Maps.newTreeMap();
        counters.forEach((replica, count) -> {
            Preconditions.checkArgument(count >= 0, "Negative counter for replica %s", replica);
            if (count > 0) {
                nonZero.put(replica, count);
            }
        });
        return new VersionVector(ImmutableSortedMap.copyOfSorted(nonZero));
    }

    public long get(ReplicaId replica) {
        return counters.getOrDefault(replica, 0L);
    }

    public Map<ReplicaId, Long> counters() {
        return counters;
    }

    public boolean isEmpty() {
        return counters.isEmpty();
    }

    public VersionVector increment(ReplicaId replica) {
        return with(replica, get(replica) + 1);
    }

    public VersionVector with(ReplicaId replica, long count) {
        NavigableMap<ReplicaId, Long> next = Maps.newTreeMap(counters);
        if (count > 0) {
            next.put(replica, count);
        } else {
            next.remove(replica);
        }
        return new VersionVector(ImmutableSortedMap.copyOfSorted(next));
    }

    /**
     * Entry-wise maximum of both vectors.
     *
     * @param other the other vector
     * @return the joined vector
     */
    public VersionVector join(VersionVector other) {
        NavigableMap<ReplicaId, Long> joined = Maps.newTreeMap(counters);
        other.counters.forEach((replica, count) -> joined.merge(replica, count, Math::max));
        return new VersionVector(ImmutableSortedMap.copyOfSorted(joined));
    }

    /**
     * Whether this vector has seen at least everything the other has seen.
     *
     * @param other the other vector
     * @return true if every entry is greater or equal
     */
    public boolean descends(VersionVector other) {
        for (Map.Entry<ReplicaId, Long> entry : other.counters.entrySet()) {
            if (get(entry.getKey()) < entry.getValue()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Strict dominance: greater or equal everywhere and greater somewhere.
     *
     * @param other the other vector
     * @return true if this vector causally supersedes the other
     */
    public boolean dominates(VersionVector other) {
        return order(other) == Order.After;
    }

    public Order order(VersionVector other) {
        boolean less = false;
        boolean more = false;
        for (ReplicaId replica : Sets.union(counters.keySet(), other.counters.keySet())) {
            long a = get(replica);
            long b = other.get(replica);
            less |= a < b;
            more |= a > b;
            if (less && more) {
                return Order.Concurrent;
            }
        }
        if (more) {
            return Order.After;
        }
        if (less) {
            return Order.Before;
        }
        return Order.Equal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof VersionVector && counters.equals(((VersionVector) o).counters);
    }

    @Override
    public int hashCode() {
        return counters.hashCode();
    }

    @Override
    public String toString() {
        return counters.toString();
    }
}
