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
package io.crdtkit.hlc;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class HLCTest {
    private AtomicLong time;
    private HLC clock;

    @BeforeMethod
    public void setup() {
        time = new AtomicLong(5000);
        clock = new HLC(time::get);
    }

    @Test
    public void get() {
        long now = System.currentTimeMillis();
        HLC systemClock = new HLC();
        long t1 = systemClock.get();
        assertTrue(t1 > 0 && HLC.physical(t1) >= now);
        for (int i = 0; i < 1000; i++) {
            long t = systemClock.get();
            assertTrue(t > t1);
            t1 = t;
        }
    }

    @Test
    public void update() {
        long now = System.currentTimeMillis();
        HLC systemClock = new HLC();
        long t1 = systemClock.update(systemClock.get());
        assertTrue(t1 > 0 && HLC.physical(t1) >= now);
        for (int i = 0; i < 1000; i++) {
            long t = systemClock.update(t1);
            assertTrue(t > t1);
            t1 = t;
        }
    }

    @Test
    public void monotonicWithinSameMillis() {
        long ts1 = clock.get();
        long ts2 = clock.get();
        long ts3 = clock.get();
        assertTrue(ts1 < ts2 && ts2 < ts3);
        assertEquals(HLC.physical(ts1), 5000);
        assertEquals(HLC.logical(ts1), 0);
        assertEquals(HLC.logical(ts2), 1);
        assertEquals(HLC.logical(ts3), 2);
    }

    @Test
    public void physicalAdvanceResetsLogical() {
        clock.get();
        clock.get();
        time.set(6000);
        long ts = clock.get();
        assertEquals(HLC.physical(ts), 6000);
        assertEquals(HLC.logical(ts), 0);
    }

    @Test
    public void physicalClockGoingBackward() {
        long ts1 = clock.get();
        time.set(1000);
        long ts2 = clock.get();
        assertTrue(ts2 > ts1);
        assertEquals(HLC.physical(ts2), 5000);
        assertEquals(HLC.logical(ts2), 1);
    }

    @Test
    public void updateWithRemoteAhead() {
        time.set(1000);
        long remote = HLC.toTimestamp(5000, 3);
        long ts = clock.update(remote);
        assertTrue(ts > remote);
        assertEquals(HLC.physical(ts), 5000);
        assertEquals(HLC.logical(ts), 4);
        assertEquals(clock.last(), ts);
    }

    @Test
    public void updateWithSamePhysical() {
        clock.get();
        long remote = HLC.toTimestamp(5000, 5);
        long ts = clock.update(remote);
        assertEquals(HLC.physical(ts), 5000);
        assertEquals(HLC.logical(ts), 6);
    }

    @Test
    public void updateWithRemoteBehind() {
        long local = clock.get();
        long ts = clock.update(HLC.toTimestamp(10, 7));
        assertTrue(ts > local);
        assertEquals(HLC.logical(ts), 1);
    }

    @Test
    public void updateWithPhysicalAhead() {
        clock.update(HLC.toTimestamp(4000, 9));
        time.set(7000);
        long ts = clock.update(HLC.toTimestamp(4000, 12));
        assertEquals(HLC.physical(ts), 7000);
        assertEquals(HLC.logical(ts), 0);
    }

    @Test
    public void logicalOverflowBorrowsNextMillis() {
        HLC restored = new HLC(time::get, HLC.toTimestamp(5000, HLC.MAX_LOGICAL));
        long ts = restored.get();
        assertEquals(HLC.physical(ts), 5001);
        assertEquals(HLC.logical(ts), 0);
    }

    @Test
    public void scriptedPhysicalClock() {
        IPhysicalClock physicalClock = mock(IPhysicalClock.class);
        when(physicalClock.millis()).thenReturn(100L, 100L, 250L);
        HLC scripted = new HLC(physicalClock);
        assertEquals(scripted.get(), HLC.toTimestamp(100, 0));
        assertEquals(scripted.get(), HLC.toTimestamp(100, 1));
        assertEquals(scripted.get(), HLC.toTimestamp(250, 0));
    }

    @Test
    public void timestampOrderingFollowsPhysicalThenLogical() {
        assertTrue(HLC.toTimestamp(1000, 5) < HLC.toTimestamp(1000, 6));
        assertTrue(HLC.toTimestamp(1000, 6) < HLC.toTimestamp(1001, 0));
        assertEquals(HLC.physical(HLC.toTimestamp(HLC.MAX_PHYSICAL, 1)), HLC.MAX_PHYSICAL);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void logicalOutOfRange() {
        HLC.toTimestamp(1, HLC.MAX_LOGICAL + 1);
    }

    @Test
    public void updateWithMaxTimestampSaturates() {
        long ts = clock.update(Long.MAX_VALUE);
        assertEquals(ts, HLC.MAX_TIMESTAMP);
        assertEquals(clock.get(), HLC.MAX_TIMESTAMP);
        assertEquals(clock.update(HLC.toTimestamp(HLC.MAX_PHYSICAL, 3)), HLC.MAX_TIMESTAMP);
        assertEquals(clock.last(), HLC.MAX_TIMESTAMP);
    }

    @Test
    public void logicalOverflowAtMaxPhysicalSaturates() {
        HLC restored = new HLC(time::get, HLC.toTimestamp(HLC.MAX_PHYSICAL, HLC.MAX_LOGICAL - 1));
        assertEquals(restored.get(), HLC.MAX_TIMESTAMP);
        assertEquals(restored.get(), HLC.MAX_TIMESTAMP);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void updateWithNegativeTimestamp() {
        clock.update(-1);
    }

    @Test
    public void concurrentGetIssuesDistinctTimestamps() throws Exception {
        int threads = 8;
        int perThread = 5000;
        Set<Long> issued = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<Void>> tasks = IntStream.range(0, threads)
                .mapToObj(i -> (Callable<Void>) () -> {
                    for (int j = 0; j < perThread; j++) {
                        assertTrue(issued.add(clock.get()));
                    }
                    return null;
                })
                .collect(Collectors.toList());
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(issued.size(), threads * perThread);
        assertFalse(issued.contains(0L));
    }
}
