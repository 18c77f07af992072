package io.mdbroker.utils;

import static java.util.Map.Entry;

import java.util.Locale;
import java.util.Properties;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

/**
 * Case-insensitive, typed access to JVM system properties (e.g. '-Dmdp.heartBeat=5' VM argument).
 *
 * N.B. keys are first looked up verbatim and only then compared ignoring case, so that 'mdp.heartbeat' and
 * 'MDP.heartBeat' resolve to the same setting.
 */
public final class SystemProperties { //NOPMD -- nomen est omen
    private static final Properties SYSTEM_PROPERTIES = System.getProperties();

    private SystemProperties() {
        // utility class
    }

    public static String getPropertyIgnoreCase(String key, String defaultValue) {
        String value = SYSTEM_PROPERTIES.getProperty(key);
        if (null != value) {
            return value;
        }

        // Not matching with the actual key then
        Set<Entry<Object, Object>> systemProperties = SYSTEM_PROPERTIES.entrySet();
        for (final Entry<Object, Object> entry : systemProperties) {
            if (key.equalsIgnoreCase(entry.getKey().toString())) {
                return entry.getValue().toString();
            }
        }
        return defaultValue;
    }

    public static String getPropertyIgnoreCase(String key) {
        return getPropertyIgnoreCase(key, null);
    }

    public static int getValueIgnoreCase(String key, int defaultValue) {
        final String value = getPropertyIgnoreCase(key);
        return StringUtils.isBlank(value) ? defaultValue : Integer.parseInt(value.trim());
    }

    public static long getValueIgnoreCase(String key, long defaultValue) {
        final String value = getPropertyIgnoreCase(key);
        return StringUtils.isBlank(value) ? defaultValue : Long.parseLong(value.trim());
    }

    /**
     * @param key property name
     * @param defaultValue returned if the property is absent or blank
     * @return {@code true} for 'true', 'yes', 'on' or '1' (ignoring case), {@code false} for any other non-blank value
     */
    public static boolean getValueIgnoreCase(String key, boolean defaultValue) {
        final String value = getPropertyIgnoreCase(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        switch (value.trim().toLowerCase(Locale.UK)) {
        case "true":
        case "yes":
        case "on":
        case "1":
            return true;
        default:
            return false;
        }
    }

    public static String getValueIgnoreCase(String key, String defaultValue) {
        final String value = getPropertyIgnoreCase(key);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }
}
