package com.finhelm.reconcile.matching;

/**
 * Canonical form for account codes: lower case, separators stripped, and leading zeros removed
 * from purely numeric codes so "0001000", "1000" and "1-000" compare equal.
 */
public final class AccountCodeNormalizer {

    private AccountCodeNormalizer() {
    }

    public static String normalize(String code) {
        if (code == null || code.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(code.length());
        boolean numeric = true;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                continue;
            }
            if (!isAsciiDigit(c)) {
                numeric = false;
            }
            sb.append(Character.toLowerCase(c));
        }
        String folded = sb.toString();
        if (folded.isEmpty() || !numeric) {
            return folded;
        }
        int start = 0;
        while (start < folded.length() - 1 && folded.charAt(start) == '0') {
            start++;
        }
        return folded.substring(start);
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
