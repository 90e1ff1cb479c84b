package com.monsterworkshop.core.infrastructure;

import java.io.FileInputStream;
import java.io.IOException;
import java.util.Properties;

/**
 * External configuration.
 * Reads 'monsterworkshop.properties' from the server working directory so
 * values can change without a rebuild.
 */
public class CoreConfig {

    public static final String FILE_NAME = "monsterworkshop.properties";

    private static final Properties props = new Properties();

    public static void load() {
        load(FILE_NAME);
    }

    public static void load(String path) {
        props.clear();
        try (FileInputStream in = new FileInputStream(path)) {
            props.load(in);
            System.out.println("⚙️ Configuration loaded from " + path);
        } catch (IOException e) {
            System.out.println("⚠️ " + path + " not found. Using DEFAULT values.");
        }
    }

    /**
     * Replaces the current values, for embedding and tests.
     */
    public static void load(Properties values) {
        props.clear();
        if (values != null) props.putAll(values);
    }

    public static int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            System.err.println("❌ Config error for " + key + ": " + val + " is not a number.");
            return defaultValue;
        }
    }

    public static long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            System.err.println("❌ Config error for " + key + ": " + val + " is not a number.");
            return defaultValue;
        }
    }

    public static String getString(String key, String defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        return val.trim();
    }
}
