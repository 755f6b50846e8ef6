package com.finhelm.reconcile.matching;

/**
 * Length-normalized Levenshtein similarity in [0,1], insensitive to case, punctuation and
 * whitespace.
 */
public final class SimilarityScorer {

    private SimilarityScorer() {
    }

    public static double similarity(String a, String b) {
        return foldedSimilarity(fold(a), fold(b));
    }

    /**
     * Same as {@link #similarity(String, String)} for inputs that already went through {@link #fold(String)}.
     */
    public static double foldedSimilarity(String a, String b) {
        if (a.equals(b)) {
            return 1.0d;
        }
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 1.0d;
        }
        double score = 1.0d - (double) editDistance(a, b) / maxLength;
        return clamp(score);
    }

    public static String fold(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString();
    }

    static int editDistance(String a, String b) {
        // keep the shorter string on the row axis
        if (a.length() < b.length()) {
            String swap = a;
            a = b;
            b = swap;
        }
        int columns = b.length();
        if (columns == 0) {
            return a.length();
        }
        int[] previous = new int[columns + 1];
        int[] current = new int[columns + 1];
        for (int j = 0; j <= columns; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= columns; j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(previous[j] + 1, current[j - 1] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[columns];
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0d;
        }
        return Math.max(0d, Math.min(1d, value));
    }
}
