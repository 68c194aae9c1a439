package io.slotkv.storage;

/**
 * Redis-style glob matching for KEYS: '*', '?', '[...]' (with '^' negation
 * and 'a-z' ranges) and backslash escapes. Operates on raw bytes.
 */
final class GlobMatcher {

    private GlobMatcher() {
        // utility
    }

    static boolean matches(byte[] pattern, byte[] s) {
        return match(pattern, 0, s, 0);
    }

    private static boolean match(byte[] p, int pi, byte[] s, int si) {
        while (pi < p.length) {
            byte c = p[pi];
            switch (c) {
                case '*' -> {
                    while (pi + 1 < p.length && p[pi + 1] == '*') pi++;
                    if (pi + 1 == p.length) return true;
                    for (int k = si; k <= s.length; k++) {
                        if (match(p, pi + 1, s, k)) return true;
                    }
                    return false;
                }
                case '?' -> {
                    if (si >= s.length) return false;
                    pi++;
                    si++;
                }
                case '[' -> {
                    if (si >= s.length) return false;
                    int i = pi + 1;
                    boolean negate = i < p.length && p[i] == '^';
                    if (negate) i++;
                    boolean hit = false;
                    while (i < p.length && p[i] != ']') {
                        if (p[i] == '\\' && i + 1 < p.length) {
                            i++;
                            if (p[i] == s[si]) hit = true;
                            i++;
                        } else if (i + 2 < p.length && p[i + 1] == '-' && p[i + 2] != ']') {
                            int lo = Math.min(p[i] & 0xFF, p[i + 2] & 0xFF);
                            int hi = Math.max(p[i] & 0xFF, p[i + 2] & 0xFF);
                            int ch = s[si] & 0xFF;
                            if (ch >= lo && ch <= hi) hit = true;
                            i += 3;
                        } else {
                            if (p[i] == s[si]) hit = true;
                            i++;
                        }
                    }
                    if (hit == negate) return false;
                    pi = i < p.length ? i + 1 : i;
                    si++;
                }
                case '\\' -> {
                    if (pi + 1 < p.length) pi++;
                    if (si >= s.length || p[pi] != s[si]) return false;
                    pi++;
                    si++;
                }
                default -> {
                    if (si >= s.length || c != s[si]) return false;
                    pi++;
                    si++;
                }
            }
        }
        return si == s.length;
    }
}
