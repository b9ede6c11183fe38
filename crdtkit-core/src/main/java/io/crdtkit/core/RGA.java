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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import io.crdtkit.core.api.CRDTType;
import io.crdtkit.core.api.Dot;
import io.crdtkit.core.api.ICRDT;
import io.crdtkit.core.api.ReplicaId;
import io.crdtkit.core.codec.DecodeException;
import io.crdtkit.core.codec.ElementCodec;
import io.crdtkit.core.proto.RGANode;
import io.crdtkit.core.proto.RGAState;
import io.crdtkit.hlc.HLC;
import io.crdtkit.hlc.IPhysicalClock;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

/**
 * Replicated growable array. Every element is a node anchored after a predecessor node (or the head); siblings are
 * ordered by descending id and the sequence is the depth-first walk from the head. Removed nodes stay as tombstones so
 * that concurrent inserts anchored on them still find their place.
 *
 * <p>Node ids are minted from the replica's {@link HLC}, which witnesses every id received in a merge. A new node
 * therefore outranks every node its replica has seen and is placed right after its predecessor.
 *
 * @param <T> the element type
 */
@Slf4j
@EqualsAndHashCode
public final class RGA<T> implements ICRDT<List<T>, RGA<T>> {
    @EqualsAndHashCode.Exclude
    private final ReplicaId replica;
    @EqualsAndHashCode.Exclude
    private final HLC hlc;
    private final Map<Dot, Node<T>> nodes;
    // every node, tombstones included, in sequence order
    @EqualsAndHashCode.Exclude
    private final List<Node<T>> sequence;

    public RGA(ReplicaId replica) {
        this(replica, new HLC());
    }

    public RGA(ReplicaId replica, HLC hlc) {
        this(replica, hlc, Maps.newHashMap(), Lists.newArrayList());
    }

    private RGA(ReplicaId replica, HLC hlc, Map<Dot, Node<T>> nodes, List<Node<T>> sequence) {
        this.replica = Preconditions.checkNotNull(replica);
        this.hlc = Preconditions.checkNotNull(hlc);
        this.nodes = nodes;
        this.sequence = sequence;
    }

    public ReplicaId id() {
        return replica;
    }

    @Override
    public CRDTType type() {
        return CRDTType.rga;
    }

    /**
     * Insert an element so that it becomes visible at the given index.
     *
     * @param index the visible index, between 0 and {@link #size()} inclusive
     * @param value the element
     * @return the id of the new node
     * @throws IllegalStateException if the clock has saturated and can no longer mint an id above every seen one
     */
    public Dot insert(int index, T value) {
        Preconditions.checkNotNull(value);
        Preconditions.checkPositionIndex(index, size());
        int raw = 0;
        Dot parent = null;
        if (index > 0) {
            int parentRaw = rawIndex(index - 1);
            parent = sequence.get(parentRaw).id;
            raw = parentRaw + 1;
        }
        long ver = hlc.get();
        Preconditions.checkState(ver < HLC.MAX_TIMESTAMP, "Clock exhausted");
        Node<T> node = new Node<>(Dot.of(replica, ver), parent, value, false);
        nodes.put(node.id, node);
        sequence.add(raw, node);
        return node.id;
    }

    /**
     * Remove the element visible at the given index. The node stays as a tombstone.
     *
     * @param index the visible index
     * @return the removed element
     */
    public T remove(int index) {
        Preconditions.checkElementIndex(index, size());
        Node<T> node = sequence.get(rawIndex(index));
        node.tombstone = true;
        return node.value;
    }

    public T get(int index) {
        Preconditions.checkElementIndex(index, size());
        return sequence.get(rawIndex(index)).value;
    }

    public int size() {
        int size = 0;
        for (Node<T> node : sequence) {
            if (!node.tombstone) {
                size++;
            }
        }
        return size;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public List<T> value() {
        ImmutableList.Builder<T> values = ImmutableList.builder();
        for (Node<T> node : sequence) {
            if (!node.tombstone) {
                values.add(node.value);
            }
        }
        return values.build();
    }

    @Override
    public void merge(RGA<T> other) {
        boolean changed = false;
        long maxVer = -1;
        for (Node<T> node : other.sequence) {
            maxVer = Math.max(maxVer, node.id.ver());
            Node<T> local = nodes.get(node.id);
            if (local == null) {
                nodes.put(node.id, node.copy());
                changed = true;
            } else if (node.tombstone && !local.tombstone) {
                local.tombstone = true;
            }
        }
        if (maxVer >= 0) {
            hlc.update(maxVer);
        }
        if (changed) {
            rebuild();
        }
        log.trace("Merged sequence: replica={}, nodes={}", replica, nodes.size());
    }

    @Override
    public RGA<T> copy() {
        return fork(replica);
    }

    /**
     * A replica with the same history under a new identity.
     *
     * @param newReplica the identity of the new replica
     * @return the fork
     */
    public RGA<T> fork(ReplicaId newReplica) {
        Map<Dot, Node<T>> forkedNodes = Maps.newHashMapWithExpectedSize(nodes.size());
        List<Node<T>> forkedSequence = Lists.newArrayListWithCapacity(sequence.size());
        for (Node<T> node : sequence) {
            Node<T> copy = node.copy();
            forkedNodes.put(copy.id, copy);
            forkedSequence.add(copy);
        }
        return new RGA<>(newReplica, new HLC(hlc.physicalClock(), hlc.last()), forkedNodes, forkedSequence);
    }

    private int rawIndex(int index) {
        int visible = 0;
        for (int i = 0; i < sequence.size(); i++) {
            if (!sequence.get(i).tombstone) {
                if (visible == index) {
                    return i;
                }
                visible++;
            }
        }
        throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + visible);
    }

    private void rebuild() {
        Map<Dot, List<Node<T>>> children = Maps.newHashMap();
        List<Node<T>> roots = Lists.newArrayList();
        for (Node<T> node : nodes.values()) {
            if (node.parent == null) {
                roots.add(node);
            } else {
                children.computeIfAbsent(node.parent, k -> Lists.newArrayList()).add(node);
            }
        }
        sequence.clear();
        // siblings pushed in ascending order so the greatest id is visited first
        Deque<Node<T>> stack = new ArrayDeque<>();
        pushAll(stack, roots);
        while (!stack.isEmpty()) {
            Node<T> node = stack.pop();
            sequence.add(node);
            pushAll(stack, children.getOrDefault(node.id, Collections.emptyList()));
        }
    }

    private static <T> void pushAll(Deque<Node<T>> stack, List<Node<T>> siblings) {
        siblings.sort(Comparator.comparing(n -> n.id));
        for (Node<T> sibling : siblings) {
            stack.push(sibling);
        }
    }

    RGAState toProto(ElementCodec<T> codec) {
        RGAState.Builder builder = RGAState.newBuilder()
            .setReplicaId(replica.id())
            .setClock(hlc.last());
        for (Node<T> node : sequence) {
            RGANode.Builder nb = RGANode.newBuilder()
                .setId(tag(node.id))
                .setValue(codec.encode(node.value))
                .setTombstone(node.tombstone);
            if (node.parent != null) {
                nb.setParent(tag(node.parent));
            }
            builder.addNodes(nb.build());
        }
        return builder.build();
    }

    static <T> RGA<T> fromProto(RGAState state, ElementCodec<T> codec, IPhysicalClock clock) {
        Map<Dot, Node<T>> nodes = Maps.newHashMap();
        long last = unsigned(state.getClock(), "clock");
        for (RGANode n : state.getNodesList()) {
            Dot id = dot(n.getId());
            Dot parent = n.hasParent() ? dot(n.getParent()) : null;
            if (parent != null && parent.compareTo(id) >= 0) {
                throw DecodeException.malformed("Node " + id + " does not outrank its predecessor " + parent);
            }
            T value = codec.decode(n.getValue());
            if (value == null) {
                throw DecodeException.malformed("Null element");
            }
            if (nodes.put(id, new Node<>(id, parent, value, n.getTombstone())) != null) {
                throw DecodeException.malformed("Duplicated node: " + id);
            }
            last = Math.max(last, id.ver());
        }
        for (Node<T> node : nodes.values()) {
            if (node.parent != null && !nodes.containsKey(node.parent)) {
                throw DecodeException.malformed("Dangling predecessor: " + node.parent);
            }
        }
        RGA<T> rga = new RGA<>(replica(state.getReplicaId()), new HLC(clock, last), nodes, Lists.newArrayList());
        rga.rebuild();
        return rga;
    }

    @Override
    public String toString() {
        return "RGA{replica=" + replica + ", value=" + value() + ", nodes=" + nodes.size() + '}';
    }

    @EqualsAndHashCode
    private static final class Node<T> {
        private final Dot id;
        private final Dot parent;
        private final T value;
        private boolean tombstone;

        Node(Dot id, Dot parent, T value, boolean tombstone) {
            this.id = id;
            this.parent = parent;
            this.value = value;
            this.tombstone = tombstone;
        }

        Node<T> copy() {
            return new Node<>(id, parent, value, tombstone);
        }

        @Override
        public String toString() {
            return id + (tombstone ? "(x)" : "") + "<-" + Objects.toString(parent, "head");
        }
    }
}
