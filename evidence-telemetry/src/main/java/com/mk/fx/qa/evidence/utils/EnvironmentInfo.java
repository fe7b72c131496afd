package com.mk.fx.qa.evidence.utils;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Host facts recorded in the metadata of every evidence collection.
 */
public final class EnvironmentInfo {

    private EnvironmentInfo() {
        // Prevent instantiation
    }

    /**
     * @return the host name, or {@code "unknown"} if it cannot be determined.
     */
    public static String host() {
        String env = firstNonBlank(System.getenv("HOSTNAME"), System.getenv("COMPUTERNAME"), null);
        if (env != null) return env;

        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }

    public static String triggeredBy() {
        return firstNonBlank(System.getenv("TRIGGERED_BY"), System.getProperty("user.name"), "unknown");
    }

    public static String platform() {
        return System.getProperty("os.name", "unknown") + " " + System.getProperty("os.arch", "");
    }

    public static String runtime() {
        return "Java " + Runtime.version();
    }

    private static String firstNonBlank(String a, String b, String def) {
        if (a != null && !a.isBlank()) return a;
        if (b != null && !b.isBlank()) return b;
        return def;
    }
}
