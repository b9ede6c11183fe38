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
package io.crdtkit.core.api;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import com.google.common.collect.ImmutableMap;
import org.testng.annotations.Test;

public class VersionVectorTest {
    private final ReplicaId a = ReplicaId.of("A");
    private final ReplicaId b = ReplicaId.of("B");

    @Test
    public void zeroEntriesDropped() {
        VersionVector vv = VersionVector.of(ImmutableMap.of(a, 0L, b, 2L));
        assertEquals(vv.counters().size(), 1);
        assertEquals(vv, VersionVector.EMPTY.with(b, 2));
        assertEquals(vv.get(a), 0);
        assertTrue(VersionVector.of(ImmutableMap.of(a, 0L)).isEmpty());
    }

    @Test
    public void increment() {
        VersionVector vv = VersionVector.EMPTY.increment(a).increment(a).increment(b);
        assertEquals(vv.get(a), 2);
        assertEquals(vv.get(b), 1);
        assertTrue(VersionVector.EMPTY.isEmpty());
    }

    @Test
    public void join() {
        VersionVector left = VersionVector.of(ImmutableMap.of(a, 3L, b, 1L));
        VersionVector right = VersionVector.of(ImmutableMap.of(a, 1L, b, 4L));
        VersionVector joined = left.join(right);
        assertEquals(joined, VersionVector.of(ImmutableMap.of(a, 3L, b, 4L)));
        assertEquals(joined, right.join(left));
        assertTrue(joined.descends(left));
        assertTrue(joined.descends(right));
    }

    @Test
    public void order() {
        VersionVector v1 = VersionVector.of(ImmutableMap.of(a, 1L));
        VersionVector v2 = VersionVector.of(ImmutableMap.of(a, 1L, b, 1L));
        VersionVector v3 = VersionVector.of(ImmutableMap.of(a, 2L));
        assertEquals(v1.order(v2), VersionVector.Order.Before);
        assertEquals(v2.order(v1), VersionVector.Order.After);
        assertEquals(v1.order(v1), VersionVector.Order.Equal);
        assertEquals(v2.order(v3), VersionVector.Order.Concurrent);
        assertTrue(v2.dominates(v1));
        assertFalse(v1.dominates(v1));
        assertFalse(v2.dominates(v3));
        assertTrue(v1.descends(VersionVector.EMPTY));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void negativeCounter() {
        VersionVector.of(ImmutableMap.of(a, -1L));
    }
}
