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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import com.google.common.collect.ImmutableList;
import io.crdtkit.core.api.CRDTType;
import io.crdtkit.core.api.Dot;
import io.crdtkit.core.api.ReplicaId;
import io.crdtkit.hlc.HLC;
import org.testng.annotations.Test;

public class RGATest {
    private final ReplicaId a = ReplicaId.of("A");
    private final ReplicaId b = ReplicaId.of("B");

    @Test
    public void testOperation() {
        RGA<String> rga = new RGA<>(a, new HLC(() -> 100L));
        assertEquals(rga.type(), CRDTType.rga);
        assertTrue(rga.isEmpty());
        rga.insert(0, "b");
        rga.insert(0, "a");
        rga.insert(2, "d");
        rga.insert(2, "c");
        assertEquals(rga.value(), ImmutableList.of("a", "b", "c", "d"));
        assertEquals(rga.size(), 4);
        assertEquals(rga.get(2), "c");

        assertEquals(rga.remove(0), "a");
        assertEquals(rga.remove(2), "d");
        assertEquals(rga.value(), ImmutableList.of("b", "c"));
        rga.insert(1, "x");
        assertEquals(rga.value(), ImmutableList.of("b", "x", "c"));
    }

    @Test
    public void testIdsFromClock() {
        RGA<String> rga = new RGA<>(a, new HLC(() -> 100L));
        Dot first = rga.insert(0, "a");
        Dot second = rga.insert(1, "b");
        assertEquals(first.replica(), a);
        assertEquals(HLC.physical(first.ver()), 100L);
        assertTrue(second.compareTo(first) > 0);
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testInsertOutOfBounds() {
        new RGA<String>(a).insert(1, "x");
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testRemoveOutOfBounds() {
        RGA<String> rga = new RGA<>(a);
        rga.insert(0, "x");
        rga.remove(0);
        rga.remove(0);
    }

    @Test
    public void testConcurrentInsertsAtSamePosition() {
        RGA<String> left = new RGA<>(a, new HLC(() -> 100L));
        left.insert(0, "base");
        RGA<String> right = left.fork(b);

        left.insert(1, "L");
        right.insert(1, "R");

        RGA<String> leftCopy = left.copy();
        left.merge(right);
        right.merge(leftCopy);
        assertEquals(left.value(), right.value());
        assertEquals(left, right);
        // equal clocks, so the greater replica id goes first
        assertEquals(left.value(), ImmutableList.of("base", "R", "L"));
    }

    @Test
    public void testConcurrentRemoveAndInsert() {
        RGA<String> left = new RGA<>(a);
        left.insert(0, "x");
        left.insert(1, "y");
        RGA<String> right = left.fork(b);

        left.remove(0);
        right.insert(1, "z");

        left.merge(right);
        right.merge(left);
        assertEquals(left.value(), ImmutableList.of("z", "y"));
        assertEquals(right.value(), ImmutableList.of("z", "y"));
    }

    @Test
    public void testInsertAfterMergeOutranksRemoteNodes() {
        RGA<String> left = new RGA<>(a, new HLC(() -> 1L));
        RGA<String> right = new RGA<>(b, new HLC(() -> 5000L));
        right.insert(0, "remote");
        left.merge(right);
        left.insert(0, "local");
        assertEquals(left.value(), ImmutableList.of("local", "remote"));

        right.merge(left);
        assertEquals(right.value(), ImmutableList.of("local", "remote"));
    }

    @Test
    public void testMergeIdempotent() {
        RGA<String> left = new RGA<>(a);
        left.insert(0, "a");
        left.insert(1, "b");
        RGA<String> before = left.copy();
        left.merge(before);
        left.merge(left.copy());
        assertEquals(left, before);
        assertEquals(left.value(), ImmutableList.of("a", "b"));
    }

    @Test
    public void testForkHasNewIdentity() {
        RGA<String> left = new RGA<>(a);
        left.insert(0, "a");
        RGA<String> fork = left.fork(b);
        assertEquals(fork.id(), b);
        assertEquals(fork, left);
        assertEquals(fork.insert(1, "b").replica(), b);
        assertEquals(left.size(), 1);
    }

    @Test
    public void testLongSequence() {
        RGA<Integer> rga = new RGA<>(a);
        for (int i = 0; i < 5000; i++) {
            rga.insert(i, i);
        }
        RGA<Integer> other = new RGA<>(b);
        other.merge(rga);
        assertEquals(other.size(), 5000);
        assertEquals(other.get(4999).intValue(), 4999);
    }

    @Test
    public void testMergeWithSaturatedClock() {
        RGA<String> remote = new RGA<>(b, new HLC(() -> 100L, HLC.MAX_TIMESTAMP - 2));
        Dot last = remote.insert(0, "z");
        assertEquals(last.ver(), HLC.MAX_TIMESTAMP - 1);

        RGA<String> local = new RGA<>(a, new HLC(() -> 100L));
        local.insert(0, "a");
        local.merge(remote);
        assertEquals(local.value(), ImmutableList.of("z", "a"));
        expectThrows(IllegalStateException.class, () -> local.insert(0, "b"));
        expectThrows(IllegalStateException.class, () -> remote.insert(1, "y"));
        assertEquals(local.value(), ImmutableList.of("z", "a"));
    }
}
