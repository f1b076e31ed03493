package com.proofline.core.text;

/**
 * Normalised edit similarity between an original text and its correction.
 * <p>
 * The score is {@code 100 * (1 - indel / (len(a) + len(b)))} where {@code indel}
 * is the insertion/deletion distance, i.e. {@code len(a) + len(b) - 2 * lcs(a, b)}.
 * Lengths count Unicode code points, so an emoji is one character, not two.
 * Two empty strings score 100.
 */
public final class TextSimilarity {

    private TextSimilarity() {}

    public static double score(String original, String corrected) {
        int[] a = original == null ? new int[0] : original.codePoints().toArray();
        int[] b = corrected == null ? new int[0] : corrected.codePoints().toArray();
        int total = a.length + b.length;
        if (total == 0) {
            return 100.0;
        }
        int lcs = longestCommonSubsequence(a, b);
        double ratio = 100.0 * (2.0 * lcs) / total;
        return Math.round(ratio * 100.0) / 100.0;
    }

    static int longestCommonSubsequence(String a, String b) {
        return longestCommonSubsequence(a.codePoints().toArray(), b.codePoints().toArray());
    }

    // two-row DP over code points
    private static int longestCommonSubsequence(int[] a, int[] b) {
        if (a.length == 0 || b.length == 0) {
            return 0;
        }
        int[] previous = new int[b.length + 1];
        int[] current = new int[b.length + 1];
        for (int i = 1; i <= a.length; i++) {
            int ca = a[i - 1];
            for (int j = 1; j <= b.length; j++) {
                if (ca == b[j - 1]) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length];
    }
}
