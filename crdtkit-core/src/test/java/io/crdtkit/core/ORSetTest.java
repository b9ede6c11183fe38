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
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertTrue;

import com.google.common.collect.ImmutableSet;
import io.crdtkit.core.api.Dot;
import io.crdtkit.core.api.ReplicaId;
import org.testng.annotations.Test;

public class ORSetTest {
    private final ReplicaId a = ReplicaId.of("A");
    private final ReplicaId b = ReplicaId.of("B");

    @Test
    public void testOperation() {
        ORSet<String> set = new ORSet<>(a);
        assertEquals(set.id(), a);
        assertTrue(set.isEmpty());

        Dot d1 = set.add("e1");
        assertEquals(d1, Dot.of(a, 1));
        assertTrue(set.contains("e1"));
        assertTrue(set.remove("e1"));
        assertFalse(set.contains("e1"));
        assertTrue(set.isEmpty());
        assertFalse(set.remove("e1"));

        set.add("e1");
        set.add("e2");
        set.add("e3");
        set.add("e3");
        assertEquals(set.size(), 3);
        assertEquals(set.elements(), ImmutableSet.of("e1", "e2", "e3"));

        set.clear();
        assertTrue(set.isEmpty());
        Dot d = set.add("e1");
        assertEquals(d.ver(), 6);
        assertEquals(set.elements(), ImmutableSet.of("e1"));
    }

    @Test
    public void testAddWins() {
        ORSet<String> left = new ORSet<>(a);
        left.add("milk");
        ORSet<String> right = new ORSet<>(b);
        right.merge(left);

        right.remove("milk");
        left.add("milk");

        ORSet<String> leftCopy = left.copy();
        left.merge(right);
        right.merge(leftCopy);
        assertTrue(left.contains("milk"));
        assertTrue(right.contains("milk"));
        assertEquals(left, right);
    }

    @Test
    public void testObservedRemovePropagates() {
        ORSet<String> left = new ORSet<>(a);
        left.add("x");
        left.add("y");
        ORSet<String> right = new ORSet<>(b);
        right.merge(left);
        right.remove("x");

        left.merge(right);
        assertEquals(left.elements(), ImmutableSet.of("y"));
    }

    @Test
    public void testTombstonedTagNeverRevived() {
        ORSet<String> left = new ORSet<>(a);
        left.add("x");
        ORSet<String> stale = left.copy();
        left.remove("x");

        left.merge(stale);
        assertFalse(left.contains("x"));
    }

    @Test
    public void testClearKeepsConcurrentAdds() {
        ORSet<String> left = new ORSet<>(a);
        left.add("x");
        ORSet<String> right = new ORSet<>(b);
        right.merge(left);

        left.clear();
        right.add("z");
        left.merge(right);
        assertEquals(left.elements(), ImmutableSet.of("z"));
    }

    @Test
    public void testCounterAdvancesPastOwnTags() {
        ORSet<String> original = new ORSet<>(a);
        original.add("x");
        original.add("y");
        ORSet<String> restored = new ORSet<>(a);
        restored.merge(original);
        assertEquals(restored.add("z"), Dot.of(a, 3));
    }

    @Test
    public void testEqualityIgnoresLocalCounter() {
        ORSet<String> left = new ORSet<>(a);
        left.add("x");
        ORSet<String> right = new ORSet<>(b);
        right.merge(left);
        assertEquals(left, right);
        right.add("y");
        assertNotEquals(left, right);
    }

    @Test
    public void testDelta() {
        ORSet<String> left = new ORSet<>(a);
        left.add("x");
        left.add("y");
        ORSet<String> right = new ORSet<>(b);
        right.merge(left);
        right.add("z");
        left.remove("x");
        left.add("w");

        ORSet.Delta<String> delta = left.delta(right.summarize());
        assertEquals(delta.additions().size(), 1);
        assertEquals(delta.tombstones(), ImmutableSet.of(Dot.of(a, 1)));

        ORSet<String> expected = right.copy();
        expected.merge(left);
        right.applyDelta(delta);
        assertEquals(right, expected);
        assertEquals(right.elements(), ImmutableSet.of("y", "z", "w"));

        right.applyDelta(delta);
        assertEquals(right, expected);
        assertTrue(right.delta(right.summarize()).isEmpty());
    }
}
