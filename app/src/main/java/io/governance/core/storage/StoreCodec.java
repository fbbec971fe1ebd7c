package io.governance.core.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Value and key encoding for persistent stores. Values are JSON; poll ids are 8-byte
 * big-endian so lexicographic key order equals numeric order.
 */
final class StoreCodec {
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private StoreCodec() {}

    static byte[] encode(Object value) {
        try {
            return JSON.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    static <T> T decode(byte[] bytes, Class<T> type) {
        try {
            return JSON.readValue(bytes, type);
        } catch (IOException e) {
            throw new IllegalStateException("Malformed " + type.getSimpleName() + " record", e);
        }
    }

    static byte[] longKey(long id) {
        return ByteBuffer.allocate(Long.BYTES).putLong(id).array();
    }

    static long bytesToLong(byte[] key) {
        return ByteBuffer.wrap(key, 0, Long.BYTES).getLong();
    }

    static byte[] stringKey(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    /** pollId(8) || voter(utf-8) */
    static byte[] voterKey(long pollId, String voter) {
        byte[] addr = stringKey(voter);
        return ByteBuffer.allocate(Long.BYTES + addr.length).putLong(pollId).put(addr).array();
    }

    static String voterFromKey(byte[] key) {
        return new String(key, Long.BYTES, key.length - Long.BYTES, StandardCharsets.UTF_8);
    }
}
