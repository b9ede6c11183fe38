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

import com.google.common.base.Preconditions;
import java.util.Comparator;

/**
 * A unique tag minted by one replica: the replica id plus a counter local to that replica. Tags are ordered by
 * counter first and replica id second.
 */
public final class Dot implements Comparable<Dot> {
    private static final Comparator<Dot> ORDER = Comparator.comparingLong(Dot::ver).thenComparing(Dot::replica);

    private final ReplicaId replica;
    private final long ver;

    private Dot(ReplicaId replica, long ver) {
        this.replica = replica;
        this.ver = ver;
    }

    public static Dot of(ReplicaId replica, long ver) {
        Preconditions.checkNotNull(replica);
        Preconditions.checkArgument(ver >= 0, "Negative dot version");
        return new Dot(replica, ver);
    }

    public ReplicaId replica() {
        return replica;
    }

    public long ver() {
        return ver;
    }

    @Override
    public int compareTo(Dot other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dot)) {
            return false;
        }
        Dot dot = (Dot) o;
        return ver == dot.ver && replica.equals(dot.replica);
    }

    @Override
    public int hashCode() {
        return 31 * replica.hashCode() + Long.hashCode(ver);
    }

    @Override
    public String toString() {
        return replica + ":" + ver;
    }
}
