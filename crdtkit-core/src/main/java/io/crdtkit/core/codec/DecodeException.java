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

import io.crdtkit.core.api.CRDTType;

/**
 * Raised when bytes handed to a decoder do not hold a well-formed encoded state. The caller is expected to reject the
 * record and keep the replica running.
 */
public abstract class DecodeException extends RuntimeException {
    public final Code code;

    protected DecodeException(Code code, String message) {
        super(message);
        this.code = code;
    }

    protected DecodeException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static DecodeException truncated(int length) {
        return new TruncatedException(length);
    }

    public static DecodeException badMagic(int magic) {
        return new BadMagicException(magic);
    }

    public static DecodeException unsupportedVersion(int version) {
        return new UnsupportedVersionException(version);
    }

    public static DecodeException unknownType(int typeId) {
        return new UnknownTypeException(typeId);
    }

    public static DecodeException typeMismatch(CRDTType expected, CRDTType actual) {
        return new TypeMismatchException(expected, actual);
    }

    public static DecodeException tooLarge(long size, long limit) {
        return new TooLargeException(size, limit);
    }

    public static DecodeException malformed(String reason) {
        return new MalformedException(reason, null);
    }

    public static DecodeException malformed(String reason, Throwable cause) {
        return new MalformedException(reason, cause);
    }

    public enum Code {
        Truncated,
        BadMagic,
        UnsupportedVersion,
        UnknownType,
        TypeMismatch,
        TooLarge,
        Malformed
    }

    public static class TruncatedException extends DecodeException {
        private TruncatedException(int length) {
            super(Code.Truncated, "Input too short: " + length + " bytes");
        }
    }

    public static class BadMagicException extends DecodeException {
        private BadMagicException(int magic) {
            super(Code.BadMagic, String.format("Invalid magic byte: 0x%02X", magic));
        }
    }

    public static class UnsupportedVersionException extends DecodeException {
        private UnsupportedVersionException(int version) {
            super(Code.UnsupportedVersion, "Unsupported format version: " + version);
        }
    }

    public static class UnknownTypeException extends DecodeException {
        private UnknownTypeException(int typeId) {
            super(Code.UnknownType, "Unknown CRDT type: " + typeId);
        }
    }

    public static class TypeMismatchException extends DecodeException {
        private TypeMismatchException(CRDTType expected, CRDTType actual) {
            super(Code.TypeMismatch, "Expected " + expected + " but found " + actual);
        }
    }

    public static class TooLargeException extends DecodeException {
        private TooLargeException(long size, long limit) {
            super(Code.TooLarge, "Input of " + size + " bytes exceeds limit " + limit);
        }
    }

    public static class MalformedException extends DecodeException {
        private MalformedException(String reason, Throwable cause) {
            super(Code.Malformed, reason, cause);
        }
    }
}
