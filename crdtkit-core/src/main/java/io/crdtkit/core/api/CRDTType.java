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

import java.util.Optional;

/**
 * Kinds of replicated types. The id is the type byte written into every encoded envelope and must never be reused.
 */
public enum CRDTType {
    gcounter(1),
    pncounter(2),
    gset(3),
    twopset(4),
    lwwreg(5),
    mvreg(6),
    orset(7),
    rga(8),
    text(9);

    public final int id;

    CRDTType(int id) {
        this.id = id;
    }

    public static Optional<CRDTType> fromId(int id) {
        for (CRDTType type : values()) {
            if (type.id == id) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
