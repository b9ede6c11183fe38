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

/**
 * The interface of a state-based CRDT replica.
 *
 * <p>Merge is commutative, associative and idempotent, so replicas that have merged the same set of states hold
 * equal state whatever order the merges happened in. {@code equals} compares that replicated state only: the
 * replica's own identity and its local counters are not part of it.
 *
 * @param <V> the type of the observable value
 * @param <C> the concrete CRDT type
 */
public interface ICRDT<V, C extends ICRDT<V, C>> {
    /**
     * The type of the replica.
     *
     * @return the CRDT type
     */
    CRDTType type();

    /**
     * Project the current state to its observable value. Pure, never changes the state.
     *
     * @return the value
     */
    V value();

    /**
     * Join the other replica's state into this one. The other replica is not modified.
     *
     * @param other the state received from another replica
     */
    void merge(C other);

    /**
     * An independent copy with the same identity and state.
     *
     * @return the copy
     */
    C copy();
}
