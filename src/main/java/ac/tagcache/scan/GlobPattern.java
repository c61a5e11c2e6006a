package ac.tagcache.scan;

import java.util.regex.Pattern;

/**
 * Glob matcher with the semantics of the Redis {@code MATCH} option:
 * {@code *}, {@code ?}, {@code [abc]}, {@code [^abc]}, {@code [a-z]} and
 * {@code \} escapes. Used to filter full listings locally.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        if (glob == null) {
            throw new IllegalArgumentException("Pattern cannot be null");
        }
        StringBuilder sb = new StringBuilder(glob.length() * 2);
        int n = glob.length();
        for (int i = 0; i < n; i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    sb.append(".*");
                    break;
                case '?':
                    sb.append('.');
                    break;
                case '\\':
                    if (i + 1 < n) {
                        i++;
                    }
                    appendLiteral(sb, glob.charAt(i));
                    break;
                case '[':
                    i = appendClass(glob, i, sb);
                    break;
                default:
                    appendLiteral(sb, c);
            }
        }
        return new GlobPattern(glob, Pattern.compile(sb.toString(), Pattern.DOTALL));
    }

    /**
     * Escapes glob metacharacters so that {@code literal} only matches itself.
     */
    public static String escape(String literal) {
        StringBuilder sb = new StringBuilder(literal.length());
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    public boolean matches(String candidate) {
        return candidate != null && regex.matcher(candidate).matches();
    }

    public String getGlob() {
        return glob;
    }

    // returns the index of the closing bracket, or the last index when unterminated
    private static int appendClass(String glob, int start, StringBuilder sb) {
        int n = glob.length();
        int j = start + 1;
        boolean negate = j < n && glob.charAt(j) == '^';
        if (negate) {
            j++;
        }
        StringBuilder body = new StringBuilder();
        while (j < n && glob.charAt(j) != ']') {
            char c = glob.charAt(j);
            if (c == '\\' && j + 1 < n) {
                appendLiteral(body, glob.charAt(j + 1));
                j += 2;
            } else if (j + 2 < n && glob.charAt(j + 1) == '-' && glob.charAt(j + 2) != ']') {
                char lo = c;
                char hi = glob.charAt(j + 2);
                if (lo > hi) {
                    char tmp = lo;
                    lo = hi;
                    hi = tmp;
                }
                appendLiteral(body, lo);
                body.append('-');
                appendLiteral(body, hi);
                j += 3;
            } else {
                appendLiteral(body, c);
                j++;
            }
        }
        if (body.length() == 0) {
            // "[]" matches nothing, "[^]" any single character
            sb.append(negate ? "." : "(?!)");
        } else {
            sb.append('[');
            if (negate) {
                sb.append('^');
            }
            sb.append(body).append(']');
        }
        return Math.min(j, n - 1);
    }

    private static void appendLiteral(StringBuilder sb, char c) {
        if (!Character.isLetterOrDigit(c)) {
            sb.append('\\');
        }
        sb.append(c);
    }

    @Override
    public String toString() {
        return glob;
    }
}
