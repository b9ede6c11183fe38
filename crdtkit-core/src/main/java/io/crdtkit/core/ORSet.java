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

import static io.crdtkit.core.ProtoUtils.dot;
import static io.crdtkit.core.ProtoUtils.replica;
import static io.crdtkit.core.ProtoUtils.tag;
import static io.crdtkit.core.ProtoUtils.unsigned;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.collect.SetMultimap;
import io.crdtkit.core.api.CRDTType;
import io.crdtkit.core.api.Dot;
import io.crdtkit.core.api.IDeltaCRDT;
import io.crdtkit.core.api.ReplicaId;
import io.crdtkit.core.codec.DecodeException;
import io.crdtkit.core.codec.ElementCodec;
import io.crdtkit.core.proto.ORSetDelta;
import io.crdtkit.core.proto.ORSetEntry;
import io.crdtkit.core.proto.ORSetState;
import io.crdtkit.core.proto.ORSetSummary;
import io.crdtkit.core.proto.Tag;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

/**
 * Observed-remove set with add-wins semantics. Every add mints a unique tag; a remove tombstones only the tags of the
 * element that the remover has observed, so an add concurrent with a remove survives the merge.
 *
 * @param <T> the element type
 */
@Slf4j
@EqualsAndHashCode
public final class ORSet<T> implements IDeltaCRDT<Set<T>, ORSet<T>, ORSet.Delta<T>, ORSet.Summary> {
    @EqualsAndHashCode.Exclude
    private final ReplicaId replica;
    @EqualsAndHashCode.Exclude
    private long counter;
    private final Map<Dot, T> entries;
    private final Set<Dot> tombstones;
    // element to its live tags, derived from entries
    @EqualsAndHashCode.Exclude
    private final SetMultimap<T, Dot> index = HashMultimap.create();

    public ORSet(ReplicaId replica) {
        this(replica, 0, Maps.newHashMap(), Sets.newHashSet());
    }

    private ORSet(ReplicaId replica, long counter, Map<Dot, T> entries, Set<Dot> tombstones) {
        this.replica = Preconditions.checkNotNull(replica);
        this.counter = counter;
        this.entries = entries;
        this.tombstones = tombstones;
        entries.forEach((dot, element) -> index.put(element, dot));
    }

    public ReplicaId id() {
        return replica;
    }

    @Override
    public CRDTType type() {
        return CRDTType.orset;
    }

    /**
     * Add an element under a fresh tag. Re-adding a removed element is allowed.
     *
     * @param element the element
     * @return the tag of this add
     */
    public Dot add(T element) {
        Preconditions.checkNotNull(element);
        Dot dot = Dot.of(replica, ++counter);
        entries.put(dot, element);
        index.put(element, dot);
        return dot;
    }

    /**
     * Remove an element by tombstoning the tags observed here.
     *
     * @param element the element
     * @return true if the element was present
     */
    public boolean remove(T element) {
        Set<Dot> dots = index.removeAll(element);
        if (dots.isEmpty()) {
            return false;
        }
        for (Dot dot : dots) {
            entries.remove(dot);
            tombstones.add(dot);
        }
        return true;
    }

    /**
     * Remove every element observed here.
     */
    public void clear() {
        tombstones.addAll(entries.keySet());
        entries.clear();
        index.clear();
    }

    public boolean contains(T element) {
        return index.containsKey(element);
    }

    public int size() {
        return index.keySet().size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Set<T> elements() {
        return ImmutableSet.copyOf(index.keySet());
    }

    @Override
    public Set<T> value() {
        return elements();
    }

    @Override
    public void merge(ORSet<T> other) {
        join(other.entries, other.tombstones);
    }

    @Override
    public ORSet<T> copy() {
        return new ORSet<>(replica, counter, Maps.newHashMap(entries), Sets.newHashSet(tombstones));
    }

    @Override
    public Summary summarize() {
        return new Summary(Sets.union(entries.keySet(), tombstones), tombstones);
    }

    @Override
    public Delta<T> delta(Summary since) {
        ImmutableMap.Builder<Dot, T> additions = ImmutableMap.builder();
        entries.forEach((dot, element) -> {
            if (!since.observed.contains(dot)) {
                additions.put(dot, element);
            }
        });
        return new Delta<>(additions.build(), Sets.difference(tombstones, since.tombstones));
    }

    @Override
    public void applyDelta(Delta<T> delta) {
        join(delta.additions, delta.tombstones);
    }

    private void join(Map<Dot, T> otherEntries, Set<Dot> otherTombstones) {
        for (Dot dot : otherTombstones) {
            observe(dot);
            if (tombstones.add(dot)) {
                T element = entries.remove(dot);
                if (element != null) {
                    index.remove(element, dot);
                }
            }
        }
        otherEntries.forEach((dot, element) -> {
            observe(dot);
            if (!tombstones.contains(dot) && entries.putIfAbsent(dot, element) == null) {
                index.put(element, dot);
            }
        });
        log.trace("Merged set: replica={}, entries={}, tombstones={}", replica, entries.size(), tombstones.size());
    }

    // never mint a tag this replica has already issued, e.g. after being restored from an older state
    private void observe(Dot dot) {
        if (dot.replica().equals(replica) && dot.ver() > counter) {
            counter = dot.ver();
        }
    }

    ORSetState toProto(ElementCodec<T> codec) {
        ORSetState.Builder builder = ORSetState.newBuilder()
            .setReplicaId(replica.id())
            .setCounter(counter);
        entries.forEach((dot, element) -> builder.addEntries(entry(dot, element, codec)));
        tombstones.forEach(dot -> builder.addTombstones(tag(dot)));
        return builder.build();
    }

    static <T> ORSet<T> fromProto(ORSetState state, ElementCodec<T> codec) {
        Set<Dot> tombstones = dots(state.getTombstonesList());
        Map<Dot, T> entries = entries(state.getEntriesList(), tombstones, codec);
        ORSet<T> set = new ORSet<>(replica(state.getReplicaId()), unsigned(state.getCounter(), "counter"),
            entries, tombstones);
        entries.keySet().forEach(set::observe);
        tombstones.forEach(set::observe);
        return set;
    }

    private static <T> ORSetEntry entry(Dot dot, T element, ElementCodec<T> codec) {
        return ORSetEntry.newBuilder().setTag(tag(dot)).setElement(codec.encode(element)).build();
    }

    private static Set<Dot> dots(List<Tag> tags) {
        Set<Dot> dots = Sets.newHashSet();
        for (Tag tag : tags) {
            dots.add(dot(tag));
        }
        return dots;
    }

    private static <T> Map<Dot, T> entries(List<ORSetEntry> encoded, Set<Dot> tombstones, ElementCodec<T> codec) {
        Map<Dot, T> entries = Maps.newHashMap();
        for (ORSetEntry e : encoded) {
            Dot dot = dot(e.getTag());
            if (tombstones.contains(dot)) {
                throw DecodeException.malformed("Live tag is also tombstoned: " + dot);
            }
            T element = codec.decode(e.getElement());
            if (element == null) {
                throw DecodeException.malformed("Null element");
            }
            if (entries.put(dot, element) != null) {
                throw DecodeException.malformed("Duplicated tag: " + dot);
            }
        }
        return entries;
    }

    @Override
    public String toString() {
        return "ORSet{replica=" + replica + ", elements=" + index.keySet() + ", tombstones=" + tombstones.size() + '}';
    }

    /**
     * Tags a replica has seen, live or removed, and the subset it has removed.
     */
    @EqualsAndHashCode
    public static final class Summary {
        private final ImmutableSet<Dot> observed;
        private final ImmutableSet<Dot> tombstones;

        Summary(Set<Dot> observed, Set<Dot> tombstones) {
            this.observed = ImmutableSet.copyOf(observed);
            this.tombstones = ImmutableSet.copyOf(tombstones);
        }

        public Set<Dot> observed() {
            return observed;
        }

        public Set<Dot> tombstones() {
            return tombstones;
        }

        ORSetSummary toProto() {
            ORSetSummary.Builder builder = ORSetSummary.newBuilder();
            observed.forEach(dot -> builder.addObserved(tag(dot)));
            tombstones.forEach(dot -> builder.addTombstones(tag(dot)));
            return builder.build();
        }

        static Summary fromProto(ORSetSummary summary) {
            Set<Dot> observed = dots(summary.getObservedList());
            Set<Dot> tombstones = dots(summary.getTombstonesList());
            if (!observed.containsAll(tombstones)) {
                throw DecodeException.malformed("Tombstone missing from observed tags");
            }
            return new Summary(observed, tombstones);
        }
    }

    /**
     * Adds the peer has not observed and removals it has not applied.
     *
     * @param <T> the element type
     */
    @EqualsAndHashCode
    public static final class Delta<T> {
        private final ImmutableMap<Dot, T> additions;
        private final ImmutableSet<Dot> tombstones;

        Delta(Map<Dot, T> additions, Set<Dot> tombstones) {
            this.additions = ImmutableMap.copyOf(additions);
            this.tombstones = ImmutableSet.copyOf(tombstones);
        }

        public Map<Dot, T> additions() {
            return additions;
        }

        public Set<Dot> tombstones() {
            return tombstones;
        }

        public boolean isEmpty() {
            return additions.isEmpty() && tombstones.isEmpty();
        }

        ORSetDelta toProto(ElementCodec<T> codec) {
            ORSetDelta.Builder builder = ORSetDelta.newBuilder();
            additions.forEach((dot, element) -> builder.addAdditions(entry(dot, element, codec)));
            tombstones.forEach(dot -> builder.addTombstones(tag(dot)));
            return builder.build();
        }

        static <T> Delta<T> fromProto(ORSetDelta delta, ElementCodec<T> codec) {
            Set<Dot> tombstones = dots(delta.getTombstonesList());
            return new Delta<>(entries(delta.getAdditionsList(), tombstones, codec), tombstones);
        }
    }
}
