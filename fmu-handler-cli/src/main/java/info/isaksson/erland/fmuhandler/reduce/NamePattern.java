package info.isaksson.erland.fmuhandler.reduce;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Shell-style name pattern as used in reduction configs.
 *
 * <ul>
 *   <li>{@code *} matches any sequence, dots included,</li>
 *   <li>{@code ?} matches one character,</li>
 *   <li>{@code [abc]}, {@code [a-z]} match one character of the set, {@code [!abc]} one character not in it.</li>
 * </ul>
 *
 * <p>Matching is case sensitive and covers the whole name. A {@code [} without closing bracket is
 * a literal.</p>
 */
public final class NamePattern {

    public final String glob;
    private final Pattern regex;

    private NamePattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static NamePattern compile(String glob) {
        if (glob == null) throw new IllegalArgumentException("glob must not be null");
        return new NamePattern(glob, Pattern.compile(toRegex(glob), Pattern.DOTALL));
    }

    public boolean matches(String name) {
        return name != null && regex.matcher(name).matches();
    }

    static String toRegex(String glob) {
        StringBuilder re = new StringBuilder(glob.length() * 2);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                re.append(".*");
            } else if (c == '?') {
                re.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') j++;
                if (j < n && glob.charAt(j) == ']') j++;
                while (j < n && glob.charAt(j) != ']') j++;
                if (j >= n) {
                    re.append("\\[");
                } else {
                    String set = glob.substring(i, j);
                    i = j + 1;
                    re.append('[');
                    int k = 0;
                    if (set.startsWith("!")) {
                        re.append('^');
                        k = 1;
                    }
                    for (; k < set.length(); k++) {
                        char s = set.charAt(k);
                        if (s == '-' && k > 0 && k < set.length() - 1 && !(k == 1 && set.startsWith("!"))) {
                            re.append('-');
                        } else if (Character.isLetterOrDigit(s)) {
                            re.append(s);
                        } else {
                            re.append('\\').append(s);
                        }
                    }
                    re.append(']');
                }
            } else {
                re.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return re.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamePattern)) return false;
        return glob.equals(((NamePattern) o).glob);
    }

    @Override
    public int hashCode() {
        return Objects.hash(glob);
    }

    @Override
    public String toString() {
        return glob;
    }
}
