package com.example.tieredcache.tiered;

/**
 * Translation of the regex subset used for key invalidation into a store-side glob. Only anchors,
 * literals, escaped punctuation, {@code .}, {@code .*} and {@code .+} have an exact glob form; an
 * unanchored side becomes {@code *} because the memory tier matches with {@code find()}.
 */
final class GlobPatterns {

    private static final String REGEX_ONLY = "+?*|(){}[]^$";

    private GlobPatterns() {
    }

    /**
     * @return the equivalent glob, or {@code null} when the regex uses anything without an exact
     *         glob form (classes like {@code \d}, quantifiers, groups, alternation, brackets)
     */
    static String fromRegex(String regex) {
        String body = regex;
        boolean anchoredStart = body.startsWith("^");
        if (anchoredStart) {
            body = body.substring(1);
        }
        boolean anchoredEnd = body.endsWith("$") && !endsEscaped(body);
        if (anchoredEnd) {
            body = body.substring(0, body.length() - 1);
        }

        StringBuilder glob = new StringBuilder();
        if (!anchoredStart) {
            appendWildcard(glob);
        }
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            char next = i + 1 < body.length() ? body.charAt(i + 1) : 0;
            if (c == '\\') {
                if (next == 0 || Character.isLetterOrDigit(next)) {
                    return null;
                }
                if (next == '*' || next == '?' || next == '[' || next == ']' || next == '\\') {
                    glob.append('\\');
                }
                glob.append(next);
                i++;
            } else if (c == '.' && next == '*') {
                appendWildcard(glob);
                i++;
            } else if (c == '.' && next == '+') {
                glob.append("?*");
                i++;
            } else if (c == '.') {
                glob.append('?');
            } else if (REGEX_ONLY.indexOf(c) >= 0) {
                return null;
            } else {
                glob.append(c);
            }
        }
        if (!anchoredEnd) {
            appendWildcard(glob);
        }
        return glob.toString();
    }

    // Adjacent wildcards collapse; an escaped star before it stays literal.
    private static void appendWildcard(StringBuilder glob) {
        int n = glob.length();
        boolean endsWithWildcard = n > 0 && glob.charAt(n - 1) == '*' && (n < 2 || glob.charAt(n - 2) != '\\');
        if (!endsWithWildcard) {
            glob.append('*');
        }
    }

    private static boolean endsEscaped(String body) {
        int backslashes = 0;
        for (int i = body.length() - 2; i >= 0 && body.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }
}
