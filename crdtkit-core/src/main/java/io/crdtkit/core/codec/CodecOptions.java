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
package io.crdtkit.core.codec;

import io.crdtkit.hlc.IPhysicalClock;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.Accessors;

@Builder(toBuilder = true)
@Accessors(chain = true, fluent = true)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CodecOptions {
    @Builder.Default
    private CompressAlgorithm compressAlgorithm = CompressAlgorithm.NONE;
    // payloads at or below this size are written uncompressed
    @Builder.Default
    private int compressThreshold = 1024;
    @Builder.Default
    private int maxDecodeBytes = 64 * 1024 * 1024;
    // time source of the clocks restored with decoded registers and sequences
    @Builder.Default
    private IPhysicalClock physicalClock = IPhysicalClock.SYSTEM;
}
