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

import com.google.common.base.Preconditions;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;

/**
 * Hybrid logical clock. A timestamp is packed into a long: the high 48 bits hold physical milliseconds and the low
 * 16 bits hold the logical counter, so comparing two timestamps as longs compares (physical, logical).
 *
 * <p>Every replica owns its clock. The physical source is injectable so merge scenarios can be replayed
 * deterministically.
 */
public class HLC {
    public static final long MAX_PHYSICAL = 0x00_00_7F_FF_FF_FF_FF_FFL;
    public static final long MAX_LOGICAL = 0xFFFFL;
    public static final long MAX_TIMESTAMP = (MAX_PHYSICAL << 16) | MAX_LOGICAL;
    private static final long CAUSAL_MASK = 0x00_00_00_00_00_00_FF_FFL;
    private static final VarHandle CAE;

    static {
        try {
            MethodHandles.Lookup l = MethodHandles.privateLookupIn(HLC.class, MethodHandles.lookup());
            CAE = l.findVarHandle(HLC.class, "hlc", long.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final IPhysicalClock physicalClock;
    private volatile long hlc;

    public HLC() {
        this(IPhysicalClock.SYSTEM);
    }

    public HLC(IPhysicalClock physicalClock) {
        this(physicalClock, 0L);
    }

    /**
     * Restore a clock that has already issued timestamps up to {@code last}.
     *
     * @param physicalClock the physical time source
     * @param last the last timestamp issued or observed
     */
    public HLC(IPhysicalClock physicalClock, long last) {
        Preconditions.checkArgument(last >= 0, "Negative timestamp");
        this.physicalClock = physicalClock;
        this.hlc = last;
    }

    /**
     * Timestamp for a local event, strictly greater than every timestamp issued or observed before, unless the clock
     * has saturated at {@link #MAX_TIMESTAMP}.
     *
     * @return the new timestamp
     */
    public long get() {
        long now;
        long newHLC;
        do {
            now = hlc;
            long l = physical(now);
            long c = logical(now);
            long updateL = Math.max(l, physicalNow());
            if (updateL == l) {
                c++;
            } else {
                c = 0;
            }
            newHLC = normalize(updateL, c);
        } while (!CAE.compareAndSet(this, now, newHLC));
        return newHLC;
    }

    /**
     * Witness a remote timestamp, typically the one attached to a received state.
     *
     * @param otherHLC the remote timestamp, any non-negative long
     * @return a timestamp strictly greater than both the local clock and the remote one, unless the clock has
     *     saturated at {@link #MAX_TIMESTAMP}
     */
    public long update(long otherHLC) {
        Preconditions.checkArgument(otherHLC >= 0, "Negative timestamp");
        long now;
        long newHLC;
        do {
            now = hlc;
            long l = physical(now);
            long c = logical(now);
            long otherL = physical(otherHLC);
            long otherC = logical(otherHLC);
            long updateL = Math.max(l, Math.max(otherL, physicalNow()));
            if (updateL == l && otherL == l) {
                c = Math.max(c, otherC) + 1;
            } else if (updateL == l) {
                c++;
            } else if (updateL == otherL) {
                c = otherC + 1;
            } else {
                c = 0;
            }
            newHLC = normalize(updateL, c);
        } while (!CAE.compareAndSet(this, now, newHLC));
        return newHLC;
    }

    /**
     * The last timestamp issued or observed, without advancing the clock.
     *
     * @return the timestamp
     */
    public long last() {
        return hlc;
    }

    public IPhysicalClock physicalClock() {
        return physicalClock;
    }

    public static long toTimestamp(long physical, long logical) {
        Preconditions.checkArgument(physical >= 0 && physical <= MAX_PHYSICAL, "Physical time out of range");
        Preconditions.checkArgument(logical >= 0 && logical <= MAX_LOGICAL, "Logical counter out of range");
        return (physical << 16) + logical;
    }

    public static long physical(long hlc) {
        return hlc >>> 16;
    }

    public static long logical(long hlc) {
        return hlc & CAUSAL_MASK;
    }

    private long physicalNow() {
        return Math.min(Math.max(physicalClock.millis(), 0), MAX_PHYSICAL);
    }

    // logical counter overflow borrows the next millisecond, the last one saturates
    private static long normalize(long l, long c) {
        if (c > MAX_LOGICAL) {
            if (l >= MAX_PHYSICAL) {
                return MAX_TIMESTAMP;
            }
            return toTimestamp(l + 1, 0);
        }
        return toTimestamp(l, c);
    }

    @Override
    public String toString() {
        long now = hlc;
        return "HLC{physical=" + physical(now) + ", logical=" + logical(now) + '}';
    }
}
