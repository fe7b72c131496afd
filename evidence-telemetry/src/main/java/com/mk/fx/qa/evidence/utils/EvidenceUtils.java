package com.mk.fx.qa.evidence.utils;

import com.google.common.hash.Hashing;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public final class EvidenceUtils {

    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    private EvidenceUtils() {
        // Utility class, no instantiation
    }

    /** Whole numbers without a fraction ({@code 80}), everything else as is ({@code 0.1}). */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    public static String percent(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /** {@code 1536} becomes {@code "1.50 KB"}. */
    public static String humanReadableBytes(long bytes) {
        if (bytes <= 0) return "0 B";
        int unit = (int) Math.min(SIZE_UNITS.length - 1, Math.floor(Math.log(bytes) / Math.log(1024)));
        return String.format(Locale.ROOT, "%.2f %s", bytes / Math.pow(1024, unit), SIZE_UNITS[unit]);
    }

    /** First {@code length} hex characters of the MD5 digest of {@code value}. */
    @SuppressWarnings("deprecation")
    public static String md5Prefix(String value, int length) {
        return Hashing.md5().hashString(value, StandardCharsets.UTF_8).toString().substring(0, length);
    }

    public static String sha256Hex(byte[] content) {
        return Hashing.sha256().hashBytes(content).toString();
    }

    /** Host part of {@code url}, or null when it is not an absolute URL. */
    public static String hostOf(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            return URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
