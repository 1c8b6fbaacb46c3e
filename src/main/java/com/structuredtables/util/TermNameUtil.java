package com.structuredtables.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;

@UtilityClass
public class TermNameUtil {

    /**
     * Lookup key for a term name: trimmed and lowercased. Null becomes "".
     */
    public static String key(String name) {
        if (name == null) return "";
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
