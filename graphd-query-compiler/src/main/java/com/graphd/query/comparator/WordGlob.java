package com.graphd.query.comparator;

/**
 * Word-oriented wildcard matching for {@code ~=}.
 *
 * <ul>
 *   <li>{@code ^} at the start anchors the match at the start of the
 *       value; otherwise the pattern may start at any word.</li>
 *   <li>{@code $} at the end means only punctuation may follow.</li>
 *   <li>White space in the pattern matches any run of non-word
 *       characters; punctuation in the pattern is optional.</li>
 *   <li>Pattern words match whole words unless followed or preceded by
 *       {@code *}, which matches a word or a fragment of one.</li>
 *   <li>{@code \} makes the next character literal.</li>
 * </ul>
 *
 * <p>Word characters are ASCII letters and digits and every non-ASCII
 * character.</p>
 */
final class WordGlob {

    /** Private constructor to prevent instantiation. */
    private WordGlob() {
        // Utility class
    }

    /**
     * Match a value against a pattern.
     *
     * @param pat the pattern
     * @param s the value
     * @param caseSensitive false to fold unescaped letters
     * @return true on a match
     */
    static boolean match(final String pat, final String s,
            final boolean caseSensitive) {
        int pe = pat.length();
        if (pe > 0 && pat.charAt(0) == '^') {
            return step(pat, 1, s, 0, caseSensitive);
        }

        int pot = 0;
        while (pot < pe && pat.charAt(pot) == '*') {
            pot++;
        }
        char ch = 'a';
        char chPot = 'a';
        if (pe >= 2 && pat.charAt(0) == '\\') {
            ch = pat.charAt(1);
            chPot = ch;
        } else if (pe - pot >= 2 && pat.charAt(pot) == '\\') {
            chPot = pat.charAt(pot + 1);
        }

        int e = s.length();
        int r = 0;
        while (r < e) {
            while (r < e && s.charAt(r) != chPot && !isWord(s.charAt(r))) {
                r++;
            }
            if (step(pat, 0, s, r, caseSensitive)) {
                return true;
            }
            r++;
            while (r < e && (s.charAt(r) == ch || isWord(s.charAt(r)))) {
                r++;
            }
        }

        // An empty value matches a pattern without words.
        int p = 0;
        while (p < pe && pat.charAt(p) != '\\' && !isWord(pat.charAt(p))) {
            p++;
        }
        return p >= pe;
    }

    private static boolean step(final String pat, final int patStart,
            final String s, final int start, final boolean caseSensitive) {
        int pr = patStart;
        int r = start;
        int pe = pat.length();
        int e = s.length();
        boolean inWord = false;

        for (;;) {
            if (pr >= pe || Character.isWhitespace(pat.charAt(pr))) {
                if (inWord) {
                    if (r < e && isWord(s.charAt(r))) {
                        return false;
                    }
                    inWord = false;
                }
                if (pr >= pe) {
                    return true;
                }
                pr++;
                continue;
            }

            char pc = pat.charAt(pr);
            if (pc == '$' && pr + 1 == pe) {
                while (r < e && !isWord(s.charAt(r))) {
                    r++;
                }
                return r >= e;
            }

            if (pc == '*') {
                while (pr < pe && pat.charAt(pr) == '*') {
                    pr++;
                }
                char ch = 'a';
                if (pe - pr >= 2 && pat.charAt(pr) == '\\') {
                    ch = pat.charAt(pr + 1);
                }
                if (!inWord) {
                    while (r < e && !isWord(s.charAt(r)) && s.charAt(r) != ch) {
                        r++;
                    }
                    if (r >= e) {
                        return false;
                    }
                    inWord = true;
                }
                if (pr >= pe
                        || (pat.charAt(pr) != '\\' && !isWord(pat.charAt(pr)))) {
                    // "*" alone skips a word.
                    while (r < e && isWord(s.charAt(r))) {
                        r++;
                    }
                    inWord = false;
                    continue;
                }
                // "*" as part of a word.
                int r0 = r;
                while (r < e && ((r == r0 && s.charAt(r) == ch)
                        || isWord(s.charAt(r)))) {
                    if (step(pat, pr, s, r, caseSensitive)) {
                        return true;
                    }
                    r++;
                }
                continue;
            }

            if (pr + 1 < pe && pc == '\\') {
                pr++;
                char lit = pat.charAt(pr);
                if (!inWord) {
                    while (r < e && !isWord(s.charAt(r)) && s.charAt(r) != lit) {
                        r++;
                    }
                    inWord = true;
                }
                if (r < e && s.charAt(r) == lit) {
                    pr++;
                    r++;
                    continue;
                }
                return false;
            }

            if (!isWord(pc)) {
                // Punctuation: optional white space.
                if (inWord && (r >= e || !isWord(s.charAt(r)))) {
                    inWord = false;
                }
                pr++;
                continue;
            }

            if (!inWord) {
                while (r < e && !isWord(s.charAt(r)) && s.charAt(r) != pc) {
                    r++;
                }
                inWord = true;
            }
            while (pr < pe && isWord(pat.charAt(pr))) {
                if (r >= e || !same(s.charAt(r), pat.charAt(pr), caseSensitive)) {
                    return false;
                }
                pr++;
                r++;
            }
        }
    }

    private static boolean same(final char a, final char b,
            final boolean caseSensitive) {
        return caseSensitive ? a == b
            : Character.toLowerCase(a) == Character.toLowerCase(b);
    }

    static boolean isWord(final char ch) {
        return ch >= 0x80 || (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z')
            || (ch >= '0' && ch <= '9');
    }
}
