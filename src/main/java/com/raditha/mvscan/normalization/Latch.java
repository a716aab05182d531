package com.raditha.mvscan.normalization;

import org.jspecify.annotations.Nullable;

/**
 * A latch variable guarding one-time code.
 *
 * @param name       Normalized latch name as it appears in the predicate
 * @param form       Predicate form
 * @param comparedTo Right-hand side for {@link LatchForm#EQ}, otherwise null
 */
public record Latch(String name, LatchForm form, @Nullable String comparedTo) {

    public static Latch of(String name, LatchForm form) {
        return new Latch(name, form, null);
    }

    /**
     * Name with leading underscores removed, lower-cased. Used to match
     * assignments to the latch.
     */
    public String canonicalName() {
        return stripUnderscores(name).toLowerCase();
    }

    static String stripUnderscores(String text) {
        int i = 0;
        while (i < text.length() && text.charAt(i) == '_') {
            i++;
        }
        return text.substring(i);
    }
}
