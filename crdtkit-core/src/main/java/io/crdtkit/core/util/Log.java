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
package io.crdtkit.core.util;

import com.google.protobuf.ByteString;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.util.JsonFormat;
import io.crdtkit.core.api.ReplicaId;
import java.util.Base64;
import org.slf4j.Logger;

/**
 * Level-guarded logging that renders replica ids, raw bytes and protobuf messages only when the level is enabled.
 */
public class Log {
    public interface Stringify {
        String stringify();
    }

    public static void warn(Logger log, String format, Object... args) {
        if (log.isWarnEnabled()) {
            log.warn(format, stringify(args));
        }
    }

    public static void debug(Logger log, String format, Object... args) {
        if (log.isDebugEnabled()) {
            log.debug(format, stringify(args));
        }
    }

    public static void trace(Logger log, String format, Object... args) {
        if (log.isTraceEnabled()) {
            log.trace(format, stringify(args));
        }
    }

    static Object[] stringify(Object... args) {
        for (int i = 0; i < args.length; i++) {
            args[i] = toString(args[i]);
        }
        return args;
    }

    private static Object toString(Object object) {
        if (object == null) {
            return "null";
        }
        if (object instanceof ByteString) {
            return toBase64((ByteString) object);
        }
        if (object instanceof ReplicaId) {
            return "id=" + toBase64(((ReplicaId) object).id());
        }
        if (object instanceof Stringify) {
            return ((Stringify) object).stringify();
        }
        if (object instanceof MessageOrBuilder) {
            try {
                return JsonFormat.printer().print((MessageOrBuilder) object);
            } catch (Exception e) {
                return object.toString();
            }
        }
        if (object instanceof Throwable) {
            return object;
        }
        return object.toString();
    }

    private static String toBase64(ByteString bs) {
        return Base64.getEncoder().encodeToString(bs.toByteArray());
    }
}
