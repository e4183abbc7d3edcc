package com.talentrelay.relay.util;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes LinkedIn profile links into index keys such as {@code linkedin.com/in/jane-doe}.
 * The same function is used to build the index and to query it.
 */
public final class LinkedInKeys {
    private static final String LINKEDIN_MARKER = "linkedin.com/";
    private static final Pattern SCHEME = Pattern.compile("^[a-z][a-z0-9+.-]*://");
    private static final Pattern HANDLE = Pattern.compile("^[\\p{L}\\p{N}_%.-]+$");

    private LinkedInKeys() {
    }

    /**
     * Returns the normalized key, or {@code null} when the input is not a LinkedIn link.
     */
    public static String normalize(String raw) {
        String value = stripUrlDecorations(raw);
        if (value == null || !value.contains(LINKEDIN_MARKER)) {
            return null;
        }
        return value;
    }

    /**
     * Lower-cases and strips scheme, {@code www.}, query, fragment and trailing slashes.
     */
    public static String stripUrlDecorations(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return null;
        }
        value = SCHEME.matcher(value).replaceFirst("");
        if (value.startsWith("//")) {
            value = value.substring(2);
        }
        if (value.startsWith("www.")) {
            value = value.substring(4);
        }
        int cut = firstIndexOf(value, '?', '#');
        if (cut >= 0) {
            value = value.substring(0, cut);
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.isEmpty() ? null : value;
    }

    /**
     * Accepts either a bare handle ({@code jane-doe}, {@code @jane-doe}) or a full profile URL.
     */
    public static String fromHandle(String rawHandle) {
        if (rawHandle == null) {
            return null;
        }
        String handle = rawHandle.trim();
        if (handle.startsWith("@")) {
            handle = handle.substring(1);
        }
        if (handle.isEmpty()) {
            return null;
        }
        if (handle.toLowerCase(Locale.ROOT).contains(LINKEDIN_MARKER)) {
            return normalize(handle);
        }
        while (handle.endsWith("/")) {
            handle = handle.substring(0, handle.length() - 1);
        }
        if (!HANDLE.matcher(handle).matches()) {
            return null;
        }
        return normalize("linkedin.com/in/" + handle);
    }

    public static Set<String> keysOf(Collection<String> urls) {
        Set<String> keys = new LinkedHashSet<>();
        if (urls == null) {
            return keys;
        }
        for (String url : urls) {
            String key = normalize(url);
            if (key != null) {
                keys.add(key);
            }
        }
        return keys;
    }

    private static int firstIndexOf(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }
}
