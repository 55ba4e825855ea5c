package app.qbank.core.bank;

import java.util.Locale;

final class TextMatching {

    private TextMatching() {
    }

    static String normalize(String value, boolean caseSensitive) {
        String trimmed = value.trim();
        return caseSensitive ? trimmed : trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * 1 minus the edit distance relative to the longer string. Two empty strings are identical.
     */
    static double similarity(String a, String b) {
        if (a.isEmpty()) return b.isEmpty() ? 1.0 : 0.0;
        if (b.isEmpty()) return 0.0;
        int longest = Math.max(a.length(), b.length());
        return 1.0 - (double) levenshtein(a, b) / longest;
    }

    static int levenshtein(String a, String b) {
        if (a.length() > b.length()) {
            String t = a;
            a = b;
            b = t;
        }
        int[] previous = new int[a.length() + 1];
        int[] current = new int[a.length() + 1];
        for (int i = 0; i <= a.length(); i++) {
            previous[i] = i;
        }
        for (int j = 1; j <= b.length(); j++) {
            current[0] = j;
            for (int i = 1; i <= a.length(); i++) {
                int substitution = previous[i - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[i] = Math.min(substitution, Math.min(previous[i] + 1, current[i - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[a.length()];
    }
}
