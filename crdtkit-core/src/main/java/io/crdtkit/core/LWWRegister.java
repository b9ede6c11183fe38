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
import static io.crdtkit.core.ProtoUtils.unsigned;

import com.google.common.base.Preconditions;
import io.crdtkit.core.api.CRDTType;
import io.crdtkit.core.api.ICRDT;
import io.crdtkit.core.api.ReplicaId;
import io.crdtkit.core.codec.DecodeException;
import io.crdtkit.core.codec.ElementCodec;
import io.crdtkit.core.proto.LWWRegisterState;
import io.crdtkit.core.util.Log;
import io.crdtkit.hlc.HLC;
import io.crdtkit.hlc.IPhysicalClock;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

/**
 * Last-writer-wins register. Every write is stamped with a hybrid logical timestamp; the write with the greatest
 * (timestamp, writer id) pair survives a merge.
 *
 * @param <T> the value type
 */
@Slf4j
@EqualsAndHashCode
public final class LWWRegister<T> implements ICRDT<Optional<T>, LWWRegister<T>> {
    @EqualsAndHashCode.Exclude
    private final ReplicaId replica;
    @EqualsAndHashCode.Exclude
    private final HLC hlc;
    private T value;
    private long timestamp;
    private ReplicaId writer;

    public LWWRegister(ReplicaId replica) {
        this(replica, new HLC());
    }

    public LWWRegister(ReplicaId replica, HLC hlc) {
        this.replica = Preconditions.checkNotNull(replica);
        this.hlc = Preconditions.checkNotNull(hlc);
    }

    /**
     * Register holding a value written at an explicit timestamp.
     *
     * @param replica the local replica
     * @param value the initial value
     * @param timestamp the timestamp of the initial write
     */
    public LWWRegister(ReplicaId replica, T value, long timestamp) {
        this(replica, new HLC(IPhysicalClock.SYSTEM, timestamp));
        this.value = Preconditions.checkNotNull(value);
        this.timestamp = timestamp;
        this.writer = replica;
    }

    private LWWRegister(ReplicaId replica, HLC hlc, T value, long timestamp, ReplicaId writer) {
        this.replica = replica;
        this.hlc = hlc;
        this.value = value;
        this.timestamp = timestamp;
        this.writer = writer;
    }

    public ReplicaId id() {
        return replica;
    }

    @Override
    public CRDTType type() {
        return CRDTType.lwwreg;
    }

    /**
     * Write a value stamped by the register's clock. Once the clock has saturated, the write only takes effect if it
     * still wins the (timestamp, writer id) comparison.
     *
     * @param value the value
     * @return the timestamp of the write
     */
    public long set(T value) {
        Preconditions.checkNotNull(value);
        long ts = hlc.get();
        if (newer(ts, replica)) {
            write(value, ts, replica);
        }
        return ts;
    }

    /**
     * Write a value at an explicit timestamp. Ignored unless (timestamp, local id) is greater than the current pair.
     *
     * @param value the value
     * @param timestamp the timestamp
     * @return true if the write took effect
     */
    public boolean set(T value, long timestamp) {
        Preconditions.checkNotNull(value);
        Preconditions.checkArgument(timestamp >= 0, "Negative timestamp");
        hlc.update(timestamp);
        if (!newer(timestamp, replica)) {
            return false;
        }
        write(value, timestamp, replica);
        return true;
    }

    public long timestamp() {
        return timestamp;
    }

    public Optional<ReplicaId> writer() {
        return Optional.ofNullable(writer);
    }

    @Override
    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    @Override
    public void merge(LWWRegister<T> other) {
        if (other.writer == null) {
            return;
        }
        hlc.update(other.timestamp);
        if (newer(other.timestamp, other.writer)) {
            write(other.value, other.timestamp, other.writer);
        } else if (other.timestamp == timestamp && other.writer.equals(writer) && !other.value.equals(value)) {
            Log.warn(log, "Conflicting values written by the same replica at the same timestamp: writer={}, ts={}",
                writer, timestamp);
        }
    }

    @Override
    public LWWRegister<T> copy() {
        return new LWWRegister<>(replica, new HLC(hlc.physicalClock(), hlc.last()), value, timestamp, writer);
    }

    private boolean newer(long ts, ReplicaId by) {
        if (writer == null) {
            return true;
        }
        if (ts != timestamp) {
            return ts > timestamp;
        }
        return by.compareTo(writer) > 0;
    }

    private void write(T value, long ts, ReplicaId by) {
        this.value = value;
        this.timestamp = ts;
        this.writer = by;
    }

    LWWRegisterState toProto(ElementCodec<T> codec) {
        LWWRegisterState.Builder builder = LWWRegisterState.newBuilder()
            .setReplicaId(replica.id())
            .setClock(hlc.last());
        if (writer != null) {
            builder.setValue(codec.encode(value))
                .setTimestamp(timestamp)
                .setWriter(writer.id());
        }
        return builder.build();
    }

    static <T> LWWRegister<T> fromProto(LWWRegisterState state, ElementCodec<T> codec, IPhysicalClock clock) {
        long last = unsigned(state.getClock(), "clock");
        if (!state.hasValue()) {
            return new LWWRegister<>(replica(state.getReplicaId()), new HLC(clock, last), null, 0, null);
        }
        T value = codec.decode(state.getValue());
        if (value == null) {
            throw DecodeException.malformed("Null register value");
        }
        long timestamp = unsigned(state.getTimestamp(), "timestamp");
        return new LWWRegister<>(replica(state.getReplicaId()), new HLC(clock, Math.max(last, timestamp)), value,
            timestamp, replica(state.getWriter()));
    }

    @Override
    public String toString() {
        return "LWWRegister{value=" + value + ", timestamp=" + timestamp + ", writer=" + writer + '}';
    }
}
