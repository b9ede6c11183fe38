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
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertTrue;

import org.testng.annotations.Test;

public class DotTest {
    private final ReplicaId a = ReplicaId.of("A");
    private final ReplicaId b = ReplicaId.of("B");

    @Test
    public void orderByVersionFirst() {
        assertTrue(Dot.of(b, 1).compareTo(Dot.of(a, 2)) < 0);
        assertTrue(Dot.of(a, 3).compareTo(Dot.of(b, 2)) > 0);
    }

    @Test
    public void replicaBreaksTie() {
        assertTrue(Dot.of(a, 5).compareTo(Dot.of(b, 5)) < 0);
        assertEquals(Dot.of(a, 5).compareTo(Dot.of(a, 5)), 0);
    }

    @Test
    public void equality() {
        assertEquals(Dot.of(a, 1), Dot.of(ReplicaId.of("A"), 1));
        assertEquals(Dot.of(a, 1).hashCode(), Dot.of(ReplicaId.of("A"), 1).hashCode());
        assertNotEquals(Dot.of(a, 1), Dot.of(b, 1));
        assertNotEquals(Dot.of(a, 1), Dot.of(a, 2));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void negativeVersion() {
        Dot.of(a, -1);
    }
}
