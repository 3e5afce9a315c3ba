package com.caura.txmapper.similarity;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

/**
 * Edit-distance based string similarity on the classic fuzzy-ratio scale, returned as a
 * fraction in [0.0, 1.0] rounded to two decimals.
 * <p>
 * {@link #ratio} is the indel similarity {@code 2 * LCS / (|a| + |b|)}. {@link #partialRatio}
 * compares the shorter string against every equally long window of the longer one and keeps
 * the best ratio, so a name or street buried in a longer description still scores 1.0.
 */
public final class StringSimilarity {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private StringSimilarity() {
    }

    /**
     * Whole-string similarity. Two empty strings are identical; one empty string scores 0.0.
     */
    public static double ratio(String a, String b) {
        String left = a != null ? a : "";
        String right = b != null ? b : "";
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        return round(rawRatio(left, right));
    }

    /**
     * Best-matching-substring similarity. An empty argument scores 0.0.
     */
    public static double partialRatio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer = a.length() <= b.length() ? b : a;

        if (longer.contains(shorter)) {
            return 1.0;
        }

        int window = shorter.length();
        double best = 0.0;
        for (int start = 0; start + window <= longer.length(); start++) {
            double score = rawRatio(shorter, longer.substring(start, start + window));
            if (score > best) {
                best = score;
            }
        }
        return round(best);
    }

    private static double rawRatio(CharSequence left, CharSequence right) {
        int total = left.length() + right.length();
        if (total == 0) {
            return 1.0;
        }
        int common = LCS.apply(left, right);
        return (2.0 * common) / total;
    }

    private static double round(double score) {
        return Math.round(score * 100.0) / 100.0;
    }
}
