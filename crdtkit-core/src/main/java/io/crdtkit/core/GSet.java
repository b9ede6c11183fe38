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
import com.google.protobuf.ByteString;
import io.crdtkit.core.api.CRDTType;
import io.crdtkit.core.api.ICRDT;
import io.crdtkit.core.codec.DecodeException;
import io.crdtkit.core.codec.ElementCodec;
import io.crdtkit.core.proto.GSetState;
import java.util.Set;
import lombok.EqualsAndHashCode;

/**
 * Grow-only set, merge is union.
 *
 * @param <T> the element type
 */
@EqualsAndHashCode
public final class GSet<T> implements ICRDT<Set<T>, GSet<T>> {
    private final Set<T> elements;

    public GSet() {
        this(Sets.newHashSet());
    }

    private GSet(Set<T> elements) {
        this.elements = elements;
    }

    @Override
    public CRDTType type() {
        return CRDTType.gset;
    }

    /**
     * Add an element.
     *
     * @param element the element
     * @return true if the element was not present before
     */
    public boolean add(T element) {
        return elements.add(Preconditions.checkNotNull(element));
    }

    public boolean contains(T element) {
        return elements.contains(element);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public Set<T> value() {
        return ImmutableSet.copyOf(elements);
    }

    @Override
    public void merge(GSet<T> other) {
        elements.addAll(other.elements);
    }

    @Override
    public GSet<T> copy() {
        return new GSet<>(Sets.newHashSet(elements));
    }

    GSetState toProto(ElementCodec<T> codec) {
        GSetState.Builder builder = GSetState.newBuilder();
        elements.forEach(e -> builder.addElements(codec.encode(e)));
        return builder.build();
    }

    static <T> GSet<T> fromProto(GSetState state, ElementCodec<T> codec) {
        return new GSet<>(decodeElements(state.getElementsList(), codec));
    }

    static <T> Set<T> decodeElements(Iterable<ByteString> encoded, ElementCodec<T> codec) {
        Set<T> elements = Sets.newHashSet();
        for (ByteString bytes : encoded) {
            T element = codec.decode(bytes);
            if (element == null) {
                throw DecodeException.malformed("Null element");
            }
            elements.add(element);
        }
        return elements;
    }

    @Override
    public String toString() {
        return "GSet" + elements;
    }
}
