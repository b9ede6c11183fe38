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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import io.crdtkit.core.api.CRDTType;
import io.crdtkit.core.api.ICRDT;
import io.crdtkit.core.codec.ElementCodec;
import io.crdtkit.core.proto.GSetState;
import io.crdtkit.core.proto.TwoPSetState;
import java.util.Set;
import lombok.EqualsAndHashCode;

/**
 * Two-phase set: an added set and a removed set, both grow-only. Once removed an element can never come back.
 *
 * @param <T> the element type
 */
@EqualsAndHashCode
public final class TwoPSet<T> implements ICRDT<Set<T>, TwoPSet<T>> {
    private final GSet<T> added;
    private final GSet<T> removed;

    public TwoPSet() {
        this(new GSet<>(), new GSet<>());
    }

    private TwoPSet(GSet<T> added, GSet<T> removed) {
        this.added = added;
        this.removed = removed;
    }

    @Override
    public CRDTType type() {
        return CRDTType.twopset;
    }

    /**
     * Add an element unless it has been removed before.
     *
     * @param element the element
     * @return true if the element became visible
     */
    public boolean add(T element) {
        Preconditions.checkNotNull(element);
        if (removed.contains(element)) {
            return false;
        }
        return added.add(element);
    }

    /**
     * Remove a visible element permanently.
     *
     * @param element the element
     * @return true if the element was visible
     */
    public boolean remove(T element) {
        Preconditions.checkNotNull(element);
        if (!added.contains(element) || removed.contains(element)) {
            return false;
        }
        return removed.add(element);
    }

    public boolean contains(T element) {
        return added.contains(element) && !removed.contains(element);
    }

    public boolean isRemoved(T element) {
        return removed.contains(element);
    }

    public int size() {
        return Sets.difference(added.value(), removed.value()).size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public Set<T> value() {
        return ImmutableSet.copyOf(Sets.difference(added.value(), removed.value()));
    }

    @Override
    public void merge(TwoPSet<T> other) {
        added.merge(other.added);
        removed.merge(other.removed);
    }

    @Override
    public TwoPSet<T> copy() {
        return new TwoPSet<>(added.copy(), removed.copy());
    }

    TwoPSetState toProto(ElementCodec<T> codec) {
        GSetState a = added.toProto(codec);
        GSetState r = removed.toProto(codec);
        return TwoPSetState.newBuilder()
            .addAllAdded(a.getElementsList())
            .addAllRemoved(r.getElementsList())
            .build();
    }

    static <T> TwoPSet<T> fromProto(TwoPSetState state, ElementCodec<T> codec) {
        GSet<T> added = GSet.fromProto(GSetState.newBuilder().addAllElements(state.getAddedList()).build(), codec);
        GSet<T> removed = GSet.fromProto(GSetState.newBuilder().addAllElements(state.getRemovedList()).build(), codec);
        return new TwoPSet<>(added, removed);
    }

    @Override
    public String toString() {
        return "TwoPSet{added=" + added + ", removed=" + removed + '}';
    }
}
