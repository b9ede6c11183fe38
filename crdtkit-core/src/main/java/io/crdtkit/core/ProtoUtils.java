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

import com.google.common.collect.Maps;
import com.google.protobuf.ByteString;
import io.crdtkit.core.api.Dot;
import io.crdtkit.core.api.ReplicaId;
import io.crdtkit.core.api.VersionVector;
import io.crdtkit.core.codec.DecodeException;
import io.crdtkit.core.proto.Counter;
import io.crdtkit.core.proto.Tag;
import io.crdtkit.core.proto.VectorClock;
import java.util.Map;
import java.util.NavigableMap;
import java.util.function.Consumer;

class ProtoUtils {
    static Tag tag(Dot dot) {
        return Tag.newBuilder().setReplicaId(dot.replica().id()).setVer(dot.ver()).build();
    }

    static Dot dot(Tag tag) {
        return Dot.of(replica(tag.getReplicaId()), unsigned(tag.getVer(), "tag version"));
    }

    static ReplicaId replica(ByteString id) {
        return ReplicaId.of(id);
    }

    static Counter counter(ReplicaId replica, long count) {
        return Counter.newBuilder().setReplicaId(replica.id()).setCount(count).build();
    }

    static VectorClock vectorClock(VersionVector vector) {
        VectorClock.Builder builder = VectorClock.newBuilder();
        vector.counters().forEach((replica, count) -> builder.addCounters(counter(replica, count)));
        return builder.build();
    }

    static VersionVector versionVector(VectorClock clock) {
        return VersionVector.of(counts(clock.getCountersList()));
    }

    static NavigableMap<ReplicaId, Long> counts(Iterable<Counter> counters) {
        NavigableMap<ReplicaId, Long> counts = Maps.newTreeMap();
        for (Counter counter : counters) {
            ReplicaId replica = replica(counter.getReplicaId());
            long count = unsigned(counter.getCount(), "count");
            if (counts.put(replica, count) != null) {
                throw DecodeException.malformed("Duplicated counter for replica " + replica);
            }
        }
        return counts;
    }

    static void addCounts(Map<ReplicaId, Long> counts, Consumer<Counter> sink) {
        counts.forEach((replica, count) -> sink.accept(counter(replica, count)));
    }

    static long unsigned(long value, String field) {
        if (value < 0) {
            throw DecodeException.malformed("Negative " + field + ": " + Long.toUnsignedString(value));
        }
        return value;
    }
}
