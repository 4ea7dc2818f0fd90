package site.kvmini.common;

/**
 * Redis 风格的 glob 匹配，支持 {@code *}、{@code ?}、{@code [abc]}、{@code [^a-z]} 与反斜杠转义。
 *
 * <p>直接在字节上匹配，频道名不要求是合法的 UTF-8。
 *
 * @author hnfy258
 * @since 1.0
 */
public final class GlobMatcher {

    private GlobMatcher() {
    }

    public static boolean matches(final byte[] pattern, final byte[] text) {
        return matches(pattern, 0, text, 0);
    }

    private static boolean matches(final byte[] p, int pi, final byte[] s, int si) {
        while (pi < p.length) {
            final byte c = p[pi];
            switch (c) {
                case '*':
                    // 连续的星号等价于一个
                    while (pi + 1 < p.length && p[pi + 1] == '*') {
                        pi++;
                    }
                    if (pi + 1 == p.length) {
                        return true;
                    }
                    for (int i = si; i <= s.length; i++) {
                        if (matches(p, pi + 1, s, i)) {
                            return true;
                        }
                    }
                    return false;
                case '?':
                    if (si >= s.length) {
                        return false;
                    }
                    si++;
                    pi++;
                    break;
                case '[': {
                    if (si >= s.length) {
                        return false;
                    }
                    final int end = matchClass(p, pi + 1, s[si]);
                    if (end < 0) {
                        return false;
                    }
                    pi = end;
                    si++;
                    break;
                }
                case '\\':
                    if (pi + 1 < p.length) {
                        pi++;
                    }
                    // fall through
                default:
                    if (si >= s.length || p[pi] != s[si]) {
                        return false;
                    }
                    pi++;
                    si++;
                    break;
            }
        }
        return si == s.length;
    }

    /**
     * 匹配字符类。
     *
     * @return 匹配成功时返回字符类结束后的下标，否则返回 -1
     */
    private static int matchClass(final byte[] p, int pi, final byte ch) {
        boolean negate = false;
        if (pi < p.length && p[pi] == '^') {
            negate = true;
            pi++;
        }
        boolean matched = false;
        while (pi < p.length && p[pi] != ']') {
            if (p[pi] == '\\' && pi + 1 < p.length) {
                pi++;
                if (p[pi] == ch) {
                    matched = true;
                }
                pi++;
            } else if (pi + 2 < p.length && p[pi + 1] == '-' && p[pi + 2] != ']') {
                int lo = p[pi] & 0xFF;
                int hi = p[pi + 2] & 0xFF;
                if (lo > hi) {
                    final int tmp = lo;
                    lo = hi;
                    hi = tmp;
                }
                final int v = ch & 0xFF;
                if (v >= lo && v <= hi) {
                    matched = true;
                }
                pi += 3;
            } else {
                if (p[pi] == ch) {
                    matched = true;
                }
                pi++;
            }
        }
        if (pi < p.length) {
            // 跳过 ']'
            pi++;
        }
        return matched != negate ? pi : -1;
    }
}
