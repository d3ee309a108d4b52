package com.ai.tpr.matching;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cleans administrative place names so that facility-register spellings and
 * boundary-registry spellings compare equal.
 * <p>
 * {@code "ad Bille Ward"} becomes {@code "BILLE"},
 * {@code "ad Fufore Local Government Area"} becomes {@code "FUFORE"}.
 * Prefix and suffix stripping repeat until nothing changes, so the output is a
 * fixed point and {@code normalize(normalize(x)) == normalize(x)}.
 */
public final class Normalizer {

    private static final Pattern CODE_PREFIX = Pattern.compile("^[A-Z]{2,3}\\s+(?=\\S)");
    private static final Pattern APOSTROPHES = Pattern.compile("['`’]");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N} ]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Normalizer() {
    }

    public static String normalize(String name, NameRole role) {
        if (StringUtils.isBlank(name)) return "";
        String s = name.toUpperCase(Locale.ROOT);
        s = APOSTROPHES.matcher(s).replaceAll("");
        s = PUNCTUATION.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();

        String previous;
        do {
            previous = s;
            s = stripSuffixes(s, role);
            s = CODE_PREFIX.matcher(s).replaceFirst("");
        } while (!s.equals(previous));
        return s;
    }

    private static String stripSuffixes(String s, NameRole role) {
        for (String suffix : role.getSuffixes()) {
            if (s.length() > suffix.length() && s.endsWith(suffix)) {
                return s.substring(0, s.length() - suffix.length()).trim();
            }
        }
        return s;
    }
}
