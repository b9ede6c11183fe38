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
import static org.testng.Assert.assertTrue;

import com.google.common.collect.ImmutableSet;
import io.crdtkit.core.api.CRDTType;
import java.util.Set;
import org.testng.annotations.Test;

public class GSetTest {
    @Test
    public void testOperation() {
        GSet<String> set = new GSet<>();
        assertEquals(set.type(), CRDTType.gset);
        assertTrue(set.isEmpty());
        assertTrue(set.add("a"));
        assertFalse(set.add("a"));
        assertTrue(set.contains("a"));
        assertFalse(set.contains("b"));
        assertEquals(set.size(), 1);
        assertEquals(set.value(), ImmutableSet.of("a"));
    }

    @Test
    public void testMergeIsUnion() {
        GSet<String> left = new GSet<>();
        left.add("a");
        left.add("b");
        GSet<String> right = new GSet<>();
        right.add("b");
        right.add("c");
        left.merge(right);
        assertEquals(left.value(), ImmutableSet.of("a", "b", "c"));
        assertEquals(right.value(), ImmutableSet.of("b", "c"));
    }

    @Test
    public void testValueIsSnapshot() {
        GSet<String> set = new GSet<>();
        set.add("a");
        Set<String> snapshot = set.value();
        set.add("b");
        assertEquals(snapshot, ImmutableSet.of("a"));
    }

    @Test(expectedExceptions = NullPointerException.class)
    public void testNullElement() {
        new GSet<String>().add(null);
    }
}
