package com.ai.tpr.matching;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Token-order-insensitive similarity in [0, 1]. Tokens of each name are sorted
 * and re-joined, then compared with the indel ratio
 * {@code 2 * LCS / (len(a) + len(b))}, so "ZUM HOSERI" and "HOSERI ZUM" score 1.0.
 */
public final class TokenSortSimilarity {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TokenSortSimilarity() {
    }

    public static double score(String left, String right) {
        String a = sortTokens(left);
        String b = sortTokens(right);
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        if (a.equals(b)) return 1.0;
        int common = LCS.apply(a, b);
        return 2.0 * common / (a.length() + b.length());
    }

    static String sortTokens(String value) {
        if (value == null) return "";
        String trimmed = value.trim();
        if (trimmed.isEmpty()) return "";
        return Arrays.stream(WHITESPACE.split(trimmed))
                .sorted()
                .collect(Collectors.joining(" "));
    }
}
