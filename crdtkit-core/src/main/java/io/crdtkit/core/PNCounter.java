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

import com.google.common.base.Preconditions;
import io.crdtkit.core.api.CRDTType;
import io.crdtkit.core.api.IDeltaCRDT;
import io.crdtkit.core.api.ReplicaId;
import io.crdtkit.core.api.VersionVector;
import io.crdtkit.core.codec.DecodeException;
import io.crdtkit.core.proto.PNCounterDelta;
import io.crdtkit.core.proto.PNCounterState;
import io.crdtkit.core.proto.PNCounterSummary;
import lombok.EqualsAndHashCode;

/**
 * Counter supporting increments and decrements, built from two grow-only counters.
 */
@EqualsAndHashCode
public final class PNCounter implements IDeltaCRDT<Long, PNCounter, PNCounter.Delta, PNCounter.Summary> {
    private final GCounter pos;
    private final GCounter neg;

    public PNCounter(ReplicaId replica) {
        this(new GCounter(replica), new GCounter(replica));
    }

    private PNCounter(GCounter pos, GCounter neg) {
        this.pos = pos;
        this.neg = neg;
    }

    public ReplicaId id() {
        return pos.id();
    }

    @Override
    public CRDTType type() {
        return CRDTType.pncounter;
    }

    public void increment() {
        pos.increment();
    }

    public void increment(long n) {
        pos.increment(n);
    }

    public void decrement() {
        neg.increment();
    }

    public void decrement(long n) {
        neg.increment(n);
    }

    /**
     * Increments minus decrements.
     *
     * @return the difference
     * @throws ArithmeticException if either total or the difference does not fit in a long
     */
    @Override
    public Long value() {
        return Math.subtractExact(pos.value(), neg.value());
    }

    @Override
    public void merge(PNCounter other) {
        pos.merge(other.pos);
        neg.merge(other.neg);
    }

    @Override
    public PNCounter copy() {
        return new PNCounter(pos.copy(), neg.copy());
    }

    @Override
    public Summary summarize() {
        return new Summary(pos.summarize(), neg.summarize());
    }

    @Override
    public Delta delta(Summary since) {
        return new Delta(pos.delta(since.pos), neg.delta(since.neg));
    }

    @Override
    public void applyDelta(Delta delta) {
        pos.applyDelta(delta.pos);
        neg.applyDelta(delta.neg);
    }

    PNCounterState toProto() {
        return PNCounterState.newBuilder().setPos(pos.toProto()).setNeg(neg.toProto()).build();
    }

    static PNCounter fromProto(PNCounterState state) {
        GCounter pos = GCounter.fromProto(state.getPos());
        GCounter neg = GCounter.fromProto(state.getNeg());
        if (!pos.id().equals(neg.id())) {
            throw DecodeException.malformed("Counter halves belong to different replicas");
        }
        return new PNCounter(pos, neg);
    }

    @Override
    public String toString() {
        return "PNCounter{pos=" + pos + ", neg=" + neg + '}';
    }

    @EqualsAndHashCode
    public static final class Delta {
        private final GCounter.Delta pos;
        private final GCounter.Delta neg;

        Delta(GCounter.Delta pos, GCounter.Delta neg) {
            this.pos = pos;
            this.neg = neg;
        }

        public GCounter.Delta increments() {
            return pos;
        }

        public GCounter.Delta decrements() {
            return neg;
        }

        public boolean isEmpty() {
            return pos.isEmpty() && neg.isEmpty();
        }

        PNCounterDelta toProto() {
            return PNCounterDelta.newBuilder().setPos(pos.toProto()).setNeg(neg.toProto()).build();
        }

        static Delta fromProto(PNCounterDelta delta) {
            return new Delta(GCounter.Delta.fromProto(delta.getPos()), GCounter.Delta.fromProto(delta.getNeg()));
        }
    }

    @EqualsAndHashCode
    public static final class Summary {
        private final VersionVector pos;
        private final VersionVector neg;

        public Summary(VersionVector pos, VersionVector neg) {
            this.pos = Preconditions.checkNotNull(pos);
            this.neg = Preconditions.checkNotNull(neg);
        }

        public VersionVector increments() {
            return pos;
        }

        public VersionVector decrements() {
            return neg;
        }

        PNCounterSummary toProto() {
            return PNCounterSummary.newBuilder()
                .setPos(ProtoUtils.vectorClock(pos))
                .setNeg(ProtoUtils.vectorClock(neg))
                .build();
        }

        static Summary fromProto(PNCounterSummary summary) {
            return new Summary(ProtoUtils.versionVector(summary.getPos()), ProtoUtils.versionVector(summary.getNeg()));
        }
    }
}
