package com.monsterworkshop.core.database;

import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * UUID columns are stored as BINARY(16), most significant bits first.
 */
public final class UuidUtils {

    private UuidUtils() {}

    public static byte[] asBytes(UUID uuid) {
        if (uuid == null) return null;
        return ByteBuffer.allocate(16)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array();
    }

    // null for a missing or truncated column value
    public static UUID asUuid(byte[] bytes) {
        if (bytes == null || bytes.length < 16) return null;
        ByteBuffer bb = ByteBuffer.wrap(bytes);
        return new UUID(bb.getLong(), bb.getLong());
    }
}
