package io.contractdb.core.codec;

import io.contractdb.core.value.Value;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic binary encoding of values: a one-byte tag followed by the
 * payload; strings and byte arrays are length-prefixed. Tuple fields are written
 * in name order, so equal values always encode to equal bytes (usable as storage keys).
 */
public final class ValueCodec {
    private ValueCodec() {}

    static final byte TAG_VOID = 0;
    static final byte TAG_BOOL = 1;
    static final byte TAG_INT = 2;
    static final byte TAG_PRINCIPAL = 3;
    static final byte TAG_BUFFER = 4;
    static final byte TAG_TUPLE = 5;

    /** Guards against absurd lengths from corrupt input. */
    private static final int MAX_LENGTH = 16_000_000;

    public static byte[] toBytes(Value value) {
        ByteBuffer buf = ByteBuffer.allocate(sizeOf(value));
        write(buf, value);
        return buf.array();
    }

    public static Value fromBytes(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            Value v = read(buf);
            if (buf.hasRemaining()) {
                throw new IllegalArgumentException("Trailing bytes: " + buf.remaining());
            }
            return v;
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Value bytes", ex);
        }
    }

    /** Decode one value starting at the buffer's position. */
    public static Value read(ByteBuffer buf) {
        byte tag = buf.get();
        switch (tag) {
            case TAG_VOID:
                return Value.voidValue();
            case TAG_BOOL:
                return Value.bool(buf.get() != 0);
            case TAG_INT:
                return Value.integer(new BigInteger(readBytes(buf)));
            case TAG_PRINCIPAL:
                return Value.principal(new String(readBytes(buf), StandardCharsets.UTF_8));
            case TAG_BUFFER:
                return Value.buffer(readBytes(buf));
            case TAG_TUPLE: {
                int count = buf.getInt();
                if (count <= 0 || count > buf.remaining()) {
                    throw new IllegalArgumentException("Bad field count: " + count);
                }
                Map<String, Value> fields = new LinkedHashMap<>();
                for (int i = 0; i < count; i++) {
                    String name = new String(readBytes(buf), StandardCharsets.UTF_8);
                    fields.put(name, read(buf));
                }
                return Value.tuple(fields);
            }
            default:
                throw new IllegalArgumentException("Unknown value tag: " + tag);
        }
    }

    public static void write(ByteBuffer buf, Value value) {
        switch (value.kind()) {
            case VOID:
                buf.put(TAG_VOID);
                break;
            case BOOL:
                buf.put(TAG_BOOL);
                buf.put((byte) (value.asBool() ? 1 : 0));
                break;
            case INT:
                buf.put(TAG_INT);
                writeBytes(buf, value.asInt().toByteArray());
                break;
            case PRINCIPAL:
                buf.put(TAG_PRINCIPAL);
                writeBytes(buf, value.asPrincipal().getBytes(StandardCharsets.UTF_8));
                break;
            case BUFFER:
                buf.put(TAG_BUFFER);
                writeBytes(buf, value.asBuffer());
                break;
            case TUPLE:
                buf.put(TAG_TUPLE);
                buf.putInt(value.asTuple().size());
                for (Map.Entry<String, Value> e : value.asTuple().entrySet()) {
                    writeBytes(buf, e.getKey().getBytes(StandardCharsets.UTF_8));
                    write(buf, e.getValue());
                }
                break;
            default:
                throw new IllegalStateException("Unhandled kind " + value.kind());
        }
    }

    public static int sizeOf(Value value) {
        switch (value.kind()) {
            case VOID:
                return 1;
            case BOOL:
                return 2;
            case INT:
                return 1 + 4 + value.asInt().toByteArray().length;
            case PRINCIPAL:
                return 1 + 4 + value.asPrincipal().getBytes(StandardCharsets.UTF_8).length;
            case BUFFER:
                return 1 + 4 + value.asBuffer().length;
            case TUPLE: {
                int size = 1 + 4;
                for (Map.Entry<String, Value> e : value.asTuple().entrySet()) {
                    size += 4 + e.getKey().getBytes(StandardCharsets.UTF_8).length;
                    size += sizeOf(e.getValue());
                }
                return size;
            }
            default:
                throw new IllegalStateException("Unhandled kind " + value.kind());
        }
    }

    private static void writeBytes(ByteBuffer buf, byte[] b) {
        buf.putInt(b.length);
        buf.put(b);
    }

    private static byte[] readBytes(ByteBuffer buf) {
        int len = buf.getInt();
        if (len < 0 || len > MAX_LENGTH || len > buf.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + buf.remaining() + ")");
        }
        byte[] out = new byte[len];
        buf.get(out);
        return out;
    }
}
