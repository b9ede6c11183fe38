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
import io.crdtkit.core.api.ICRDT;
import io.crdtkit.core.api.ReplicaId;
import io.crdtkit.core.codec.ElementCodecs;
import io.crdtkit.core.proto.RGAState;
import io.crdtkit.hlc.HLC;
import io.crdtkit.hlc.IPhysicalClock;
import lombok.EqualsAndHashCode;

/**
 * Collaborative plain text: an {@link RGA} of Unicode code points. Indexes count code points, not UTF-16 chars.
 */
@EqualsAndHashCode
public final class TextCRDT implements ICRDT<String, TextCRDT> {
    private final RGA<Integer> chars;

    public TextCRDT(ReplicaId replica) {
        this(new RGA<>(replica));
    }

    public TextCRDT(ReplicaId replica, HLC hlc) {
        this(new RGA<>(replica, hlc));
    }

    private TextCRDT(RGA<Integer> chars) {
        this.chars = chars;
    }

    public ReplicaId id() {
        return chars.id();
    }

    @Override
    public CRDTType type() {
        return CRDTType.text;
    }

    public void insert(int index, int codePoint) {
        Preconditions.checkArgument(Character.isValidCodePoint(codePoint), "Invalid code point: %s", codePoint);
        chars.insert(index, codePoint);
    }

    public void insert(int index, char c) {
        insert(index, (int) c);
    }

    /**
     * Insert a string, one node per code point, so that it starts at the given index.
     *
     * @param index the index of the first inserted code point
     * @param text the text
     */
    public void insertStr(int index, String text) {
        Preconditions.checkNotNull(text);
        Preconditions.checkPositionIndex(index, length());
        int offset = index;
        for (int cp : text.codePoints().toArray()) {
            chars.insert(offset++, cp);
        }
    }

    /**
     * Remove one code point.
     *
     * @param index the index
     * @return the removed code point
     */
    public int remove(int index) {
        return chars.remove(index);
    }

    public void removeRange(int start, int len) {
        Preconditions.checkArgument(len >= 0, "Negative length");
        Preconditions.checkPositionIndexes(start, start + len, length());
        for (int i = start + len - 1; i >= start; i--) {
            chars.remove(i);
        }
    }

    public int charAt(int index) {
        return chars.get(index);
    }

    public int length() {
        return chars.size();
    }

    public boolean isEmpty() {
        return chars.isEmpty();
    }

    public TextCRDT fork(ReplicaId newReplica) {
        return new TextCRDT(chars.fork(newReplica));
    }

    @Override
    public String value() {
        StringBuilder sb = new StringBuilder();
        for (int cp : chars.value()) {
            sb.appendCodePoint(cp);
        }
        return sb.toString();
    }

    @Override
    public void merge(TextCRDT other) {
        chars.merge(other.chars);
    }

    @Override
    public TextCRDT copy() {
        return new TextCRDT(chars.copy());
    }

    RGAState toProto() {
        return chars.toProto(ElementCodecs.CODE_POINT);
    }

    static TextCRDT fromProto(RGAState state, IPhysicalClock clock) {
        return new TextCRDT(RGA.fromProto(state, ElementCodecs.CODE_POINT, clock));
    }

    @Override
    public String toString() {
        return value();
    }
}
