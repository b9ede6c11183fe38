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

import com.google.common.base.Preconditions;
import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageLite;
import com.google.protobuf.Parser;
import io.crdtkit.core.api.CRDTType;
import io.crdtkit.core.api.VersionVector;
import io.crdtkit.core.codec.CodecOptions;
import io.crdtkit.core.codec.CompressAlgorithm;
import io.crdtkit.core.codec.Compressor;
import io.crdtkit.core.codec.DecodeException;
import io.crdtkit.core.codec.ElementCodec;
import io.crdtkit.core.codec.Envelope;
import io.crdtkit.core.proto.GCounterDelta;
import io.crdtkit.core.proto.GCounterState;
import io.crdtkit.core.proto.GSetState;
import io.crdtkit.core.proto.LWWRegisterState;
import io.crdtkit.core.proto.MVRegisterState;
import io.crdtkit.core.proto.ORSetDelta;
import io.crdtkit.core.proto.ORSetState;
import io.crdtkit.core.proto.ORSetSummary;
import io.crdtkit.core.proto.PNCounterDelta;
import io.crdtkit.core.proto.PNCounterState;
import io.crdtkit.core.proto.PNCounterSummary;
import io.crdtkit.core.proto.RGAState;
import io.crdtkit.core.proto.TwoPSetState;
import io.crdtkit.core.proto.VectorClock;
import io.crdtkit.core.util.Log;
import io.crdtkit.hlc.IPhysicalClock;
import lombok.extern.slf4j.Slf4j;

/**
 * Binary encoding of every replicated type, delta and summary. Each record is a protobuf message framed by an
 * {@link Envelope} naming its type and kind, so a record of the wrong type is rejected instead of misread.
 *
 * <p>Decoding never trusts its input: every failure surfaces as a {@link DecodeException}.
 */
@Slf4j
public final class CRDTCodec {
    // copied from the options, later changes to the options do not affect the codec
    private final CompressAlgorithm compressAlgorithm;
    private final int compressThreshold;
    private final int maxDecodeBytes;
    private final IPhysicalClock physicalClock;
    private final Compressor compressor;

    public CRDTCodec() {
        this(CodecOptions.builder().build());
    }

    public CRDTCodec(CodecOptions options) {
        Preconditions.checkNotNull(options);
        Preconditions.checkArgument(options.compressThreshold() >= 0, "Negative compress threshold");
        Preconditions.checkArgument(options.maxDecodeBytes() > 0, "Decode limit must be positive");
        this.compressAlgorithm = Preconditions.checkNotNull(options.compressAlgorithm());
        this.compressThreshold = options.compressThreshold();
        this.maxDecodeBytes = options.maxDecodeBytes();
        this.physicalClock = Preconditions.checkNotNull(options.physicalClock());
        this.compressor = Compressor.newInstance(compressAlgorithm);
    }

    /**
     * The type of an encoded record, read from its header only.
     *
     * @param bytes the encoded record
     * @return the type
     */
    public CRDTType peekType(ByteString bytes) {
        return Envelope.parse(bytes, maxDecodeBytes).type;
    }

    public ByteString encode(GCounter counter) {
        return wrap(CRDTType.gcounter, Envelope.Kind.State, counter.toProto());
    }

    public GCounter decodeGCounter(ByteString bytes) {
        return GCounter.fromProto(unwrap(bytes, CRDTType.gcounter, Envelope.Kind.State, GCounterState.parser()));
    }

    public ByteString encode(PNCounter counter) {
        return wrap(CRDTType.pncounter, Envelope.Kind.State, counter.toProto());
    }

    public PNCounter decodePNCounter(ByteString bytes) {
        return PNCounter.fromProto(unwrap(bytes, CRDTType.pncounter, Envelope.Kind.State, PNCounterState.parser()));
    }

    public <T> ByteString encode(GSet<T> set, ElementCodec<T> codec) {
        return wrap(CRDTType.gset, Envelope.Kind.State, set.toProto(codec));
    }

    public <T> GSet<T> decodeGSet(ByteString bytes, ElementCodec<T> codec) {
        return GSet.fromProto(unwrap(bytes, CRDTType.gset, Envelope.Kind.State, GSetState.parser()), codec);
    }

    public <T> ByteString encode(TwoPSet<T> set, ElementCodec<T> codec) {
        return wrap(CRDTType.twopset, Envelope.Kind.State, set.toProto(codec));
    }

    public <T> TwoPSet<T> decodeTwoPSet(ByteString bytes, ElementCodec<T> codec) {
        return TwoPSet.fromProto(unwrap(bytes, CRDTType.twopset, Envelope.Kind.State, TwoPSetState.parser()), codec);
    }

    public <T> ByteString encode(LWWRegister<T> register, ElementCodec<T> codec) {
        return wrap(CRDTType.lwwreg, Envelope.Kind.State, register.toProto(codec));
    }

    public <T> LWWRegister<T> decodeLWWRegister(ByteString bytes, ElementCodec<T> codec) {
        return LWWRegister.fromProto(unwrap(bytes, CRDTType.lwwreg, Envelope.Kind.State, LWWRegisterState.parser()),
            codec, physicalClock);
    }

    public <T> ByteString encode(MVRegister<T> register, ElementCodec<T> codec) {
        return wrap(CRDTType.mvreg, Envelope.Kind.State, register.toProto(codec));
    }

    public <T> MVRegister<T> decodeMVRegister(ByteString bytes, ElementCodec<T> codec) {
        return MVRegister.fromProto(unwrap(bytes, CRDTType.mvreg, Envelope.Kind.State, MVRegisterState.parser()),
            codec);
    }

    public <T> ByteString encode(ORSet<T> set, ElementCodec<T> codec) {
        return wrap(CRDTType.orset, Envelope.Kind.State, set.toProto(codec));
    }

    public <T> ORSet<T> decodeORSet(ByteString bytes, ElementCodec<T> codec) {
        return ORSet.fromProto(unwrap(bytes, CRDTType.orset, Envelope.Kind.State, ORSetState.parser()), codec);
    }

    public <T> ByteString encode(RGA<T> rga, ElementCodec<T> codec) {
        return wrap(CRDTType.rga, Envelope.Kind.State, rga.toProto(codec));
    }

    public <T> RGA<T> decodeRGA(ByteString bytes, ElementCodec<T> codec) {
        return RGA.fromProto(unwrap(bytes, CRDTType.rga, Envelope.Kind.State, RGAState.parser()), codec,
            physicalClock);
    }

    public ByteString encode(TextCRDT text) {
        return wrap(CRDTType.text, Envelope.Kind.State, text.toProto());
    }

    public TextCRDT decodeText(ByteString bytes) {
        return TextCRDT.fromProto(unwrap(bytes, CRDTType.text, Envelope.Kind.State, RGAState.parser()),
            physicalClock);
    }

    public ByteString encodeDelta(GCounter.Delta delta) {
        return wrap(CRDTType.gcounter, Envelope.Kind.Delta, delta.toProto());
    }

    public GCounter.Delta decodeGCounterDelta(ByteString bytes) {
        return GCounter.Delta.fromProto(unwrap(bytes, CRDTType.gcounter, Envelope.Kind.Delta,
            GCounterDelta.parser()));
    }

    public ByteString encodeDelta(PNCounter.Delta delta) {
        return wrap(CRDTType.pncounter, Envelope.Kind.Delta, delta.toProto());
    }

    public PNCounter.Delta decodePNCounterDelta(ByteString bytes) {
        return PNCounter.Delta.fromProto(unwrap(bytes, CRDTType.pncounter, Envelope.Kind.Delta,
            PNCounterDelta.parser()));
    }

    public <T> ByteString encodeDelta(ORSet.Delta<T> delta, ElementCodec<T> codec) {
        return wrap(CRDTType.orset, Envelope.Kind.Delta, delta.toProto(codec));
    }

    public <T> ORSet.Delta<T> decodeORSetDelta(ByteString bytes, ElementCodec<T> codec) {
        return ORSet.Delta.fromProto(unwrap(bytes, CRDTType.orset, Envelope.Kind.Delta, ORSetDelta.parser()), codec);
    }

    public ByteString encodeGCounterSummary(VersionVector summary) {
        return wrap(CRDTType.gcounter, Envelope.Kind.Summary, ProtoUtils.vectorClock(summary));
    }

    public VersionVector decodeGCounterSummary(ByteString bytes) {
        return ProtoUtils.versionVector(unwrap(bytes, CRDTType.gcounter, Envelope.Kind.Summary,
            VectorClock.parser()));
    }

    public ByteString encodeSummary(PNCounter.Summary summary) {
        return wrap(CRDTType.pncounter, Envelope.Kind.Summary, summary.toProto());
    }

    public PNCounter.Summary decodePNCounterSummary(ByteString bytes) {
        return PNCounter.Summary.fromProto(unwrap(bytes, CRDTType.pncounter, Envelope.Kind.Summary,
            PNCounterSummary.parser()));
    }

    public ByteString encodeSummary(ORSet.Summary summary) {
        return wrap(CRDTType.orset, Envelope.Kind.Summary, summary.toProto());
    }

    public ORSet.Summary decodeORSetSummary(ByteString bytes) {
        return ORSet.Summary.fromProto(unwrap(bytes, CRDTType.orset, Envelope.Kind.Summary,
            ORSetSummary.parser()));
    }

    private ByteString wrap(CRDTType type, Envelope.Kind kind, MessageLite message) {
        ByteString payload = message.toByteString();
        int flags = 0;
        if (compressAlgorithm != CompressAlgorithm.NONE && payload.size() > compressThreshold) {
            payload = compressor.compress(payload);
            flags |= Envelope.FLAG_COMPRESSED;
        }
        ByteString encoded = new Envelope(type, kind, flags, payload).toByteString();
        Log.trace(log, "Encoded {} {}: size={}, flags={}", type, kind, encoded.size(), flags);
        return encoded;
    }

    private <M> M unwrap(ByteString bytes, CRDTType type, Envelope.Kind kind, Parser<M> parser) {
        Preconditions.checkNotNull(bytes);
        Envelope envelope = Envelope.parse(bytes, maxDecodeBytes);
        if (envelope.type != type) {
            throw DecodeException.typeMismatch(type, envelope.type);
        }
        if (envelope.kind != kind) {
            throw DecodeException.malformed("Expected " + kind + " record but found " + envelope.kind);
        }
        ByteString payload = envelope.payload;
        if (envelope.compressed()) {
            // a compressed record decodes regardless of the local compression setting
            payload = Compressor.newInstance(CompressAlgorithm.GZIP).decompress(payload, maxDecodeBytes);
        }
        try {
            return parser.parseFrom(payload);
        } catch (InvalidProtocolBufferException e) {
            Log.debug(log, "Failed to parse {} {} payload of {} bytes", type, kind, payload.size());
            throw DecodeException.malformed("Invalid " + type + " " + kind + " payload", e);
        }
    }
}
