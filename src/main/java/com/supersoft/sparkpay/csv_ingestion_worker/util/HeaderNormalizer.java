package com.supersoft.sparkpay.csv_ingestion_worker.util;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical header names. Shared by the worker and any client-side preview; the worker's result
 * is the authoritative one.
 */
public final class HeaderNormalizer {

    private static final char BOM = '\uFEFF';

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u2000-\\u200B\\u3000]+");

    private HeaderNormalizer() {
    }

    /**
     * Normalizes a header record: names are cleaned with {@link #normalizeName(String)}, blank names
     * become {@code col_{n}} (1-based position) and repeated names get {@code _2}, {@code _3}, ...
     */
    public static List<String> normalizeHeaders(List<String> rawHeaders) {
        List<String> headers = new ArrayList<>(rawHeaders.size());
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < rawHeaders.size(); i++) {
            String name = normalizeName(rawHeaders.get(i));
            if (name.isEmpty()) {
                name = "col_" + (i + 1);
            }
            if (seen.contains(name)) {
                int suffix = 2;
                while (seen.contains(name + "_" + suffix)) {
                    suffix++;
                }
                name = name + "_" + suffix;
            }
            seen.add(name);
            headers.add(name);
        }
        return headers;
    }

    /**
     * Strips leading byte-order marks, trims, collapses internal whitespace to one space and lower-cases.
     * Also used to resolve the source headers named in a column mapping.
     */
    public static String normalizeName(String raw) {
        if (raw == null) {
            return "";
        }
        int start = 0;
        while (start < raw.length() && raw.charAt(start) == BOM) {
            start++;
        }
        String collapsed = WHITESPACE.matcher(raw.substring(start)).replaceAll(" ").trim();
        return collapsed.toLowerCase(Locale.ROOT);
    }
}
