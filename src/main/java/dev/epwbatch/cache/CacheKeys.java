package dev.epwbatch.cache;

import dev.epwbatch.api.DataType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.zip.CRC32;

final class CacheKeys {
    private CacheKeys() {}

    /** Payload file name: SHA-256 of the logical key plus the data type's extension. */
    static String fileName(String key, DataType dataType) {
        return sha256Hex(key) + dataType.extension();
    }

    static String crc32Hex(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return String.format("%08x", crc.getValue());
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new RuntimeException("SHA-256 unavailable", e);
        }
    }
}
