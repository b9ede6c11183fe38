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
 * A CRDT able to sync by exchanging only the part of its state a peer has not seen.
 *
 * <p>For replicas {@code a} and {@code b}, applying {@code a.delta(b.summarize())} to {@code b} leaves {@code b} equal
 * to {@code b} merged with {@code a}. Applying the same delta again changes nothing.
 *
 * @param <V> the type of the observable value
 * @param <C> the concrete CRDT type
 * @param <D> the delta type
 * @param <S> the type summarizing what a replica has seen
 */
public interface IDeltaCRDT<V, C extends IDeltaCRDT<V, C, D, S>, D, S> extends ICRDT<V, C> {
    /**
     * Summary of the state seen by this replica, sent to a peer that will compute a delta for it.
     *
     * @return the summary
     */
    S summarize();

    /**
     * The changes held here that a peer with the given summary has not seen.
     *
     * @param since the peer's summary
     * @return the delta
     */
    D delta(S since);

    /**
     * Apply a delta computed by a peer.
     *
     * @param delta the delta
     */
    void applyDelta(D delta);
}
