package com.areakeeper.service.lint;

import com.areakeeper.domain.NormalizedRecord;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 over the logical content of a normalized record.
 *
 * Map entries are hashed in key order, so tag insertion order does not matter. Numbers hash by
 * value ({@code 5}, {@code 5.0} and {@code 5.00} are equal). Each value is prefixed with a type
 * marker and strings with their length, so distinct contents cannot collide by concatenation.
 */
public final class RecordFingerprint {

    private RecordFingerprint() {}

    public static String of(NormalizedRecord record, String ruleSetVersion) {
        Hasher hasher = Hashing.sha256().newHasher();
        putString(hasher, ruleSetVersion);
        putString(hasher, record.id());
        putString(hasher, record.type().tag());
        putTimestamp(hasher, record.updatedAt());
        putTimestamp(hasher, record.deletedAt());
        putValue(hasher, record.tags());
        return hasher.hash().toString();
    }

    private static void putValue(Hasher hasher, Object value) {
        if (value == null) {
            hasher.putByte((byte) 'z');
        } else if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), v));
            hasher.putByte((byte) 'm').putInt(sorted.size());
            sorted.forEach((k, v) -> {
                putString(hasher, k);
                putValue(hasher, v);
            });
        } else if (value instanceof Iterable<?> items) {
            hasher.putByte((byte) 'l');
            int count = 0;
            for (Object item : items) {
                putValue(hasher, item);
                count++;
            }
            hasher.putInt(count);
        } else if (value instanceof Number number) {
            hasher.putByte((byte) 'n');
            putString(hasher, canonicalNumber(number));
        } else if (value instanceof Boolean bool) {
            hasher.putByte((byte) 'b').putBoolean(bool);
        } else {
            hasher.putByte((byte) 's');
            putString(hasher, value.toString());
        }
    }

    private static String canonicalNumber(Number number) {
        BigDecimal decimal;
        if (number instanceof BigDecimal bd) {
            decimal = bd;
        } else if (number instanceof BigInteger bi) {
            decimal = new BigDecimal(bi);
        } else if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) return Double.toString(d);
            decimal = BigDecimal.valueOf(d);
        } else {
            decimal = BigDecimal.valueOf(number.longValue());
        }
        return decimal.compareTo(BigDecimal.ZERO) == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
    }

    private static void putTimestamp(Hasher hasher, OffsetDateTime timestamp) {
        putString(hasher, timestamp == null ? "" : timestamp.toInstant().toString());
    }

    private static void putString(Hasher hasher, String value) {
        hasher.putInt(value.length()).putString(value, StandardCharsets.UTF_8);
    }
}
