package com.sbus.util;

import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * Conversion between delivery tags and lock tokens. The broker writes the lock
 * token into the 16-byte delivery tag in .NET GUID byte order: the first three
 * groups little-endian, the last eight bytes as they are.
 */
public final class LockTokens {

    private LockTokens() {
    }

    public static UUID fromDeliveryTag(byte[] tag) {
        if (tag == null || tag.length != 16) {
            return null;
        }
        byte[] ordered = reorder(tag);
        ByteBuffer buffer = ByteBuffer.wrap(ordered);
        return new UUID(buffer.getLong(), buffer.getLong());
    }

    public static byte[] toDeliveryTag(UUID lockToken) {
        ByteBuffer buffer = ByteBuffer.allocate(16);
        buffer.putLong(lockToken.getMostSignificantBits());
        buffer.putLong(lockToken.getLeastSignificantBits());
        return reorder(buffer.array());
    }

    // The swap is its own inverse.
    private static byte[] reorder(byte[] source) {
        byte[] result = source.clone();
        swap(result, 0, 3);
        swap(result, 1, 2);
        swap(result, 4, 5);
        swap(result, 6, 7);
        return result;
    }

    private static void swap(byte[] bytes, int i, int j) {
        byte tmp = bytes[i];
        bytes[i] = bytes[j];
        bytes[j] = tmp;
    }
}
