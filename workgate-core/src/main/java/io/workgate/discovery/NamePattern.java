package io.workgate.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Case-insensitive glob match on an item's base name.
 *
 * <p>Supports {@code *}, {@code ?} and {@code [...]} classes ({@code [!...]} negates).
 * An empty pattern list or one containing {@code "*"} matches everything.
 */
final class NamePattern {
    private final List<Pattern> patterns;
    private final boolean matchAll;

    private NamePattern(List<Pattern> patterns, boolean matchAll) {
        this.patterns = patterns;
        this.matchAll = matchAll;
    }

    static NamePattern of(List<String> globs) {
        if (globs == null || globs.isEmpty() || globs.contains("*")) {
            return new NamePattern(List.of(), true);
        }
        List<Pattern> compiled = new ArrayList<>(globs.size());
        for (String glob : globs) {
            if (glob != null && !glob.isBlank()) {
                compiled.add(Pattern.compile(toRegex(glob.trim()),
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            }
        }
        return new NamePattern(List.copyOf(compiled), compiled.isEmpty());
    }

    boolean matches(String name) {
        if (matchAll) {
            return true;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(name).matches()) {
                return true;
            }
        }
        return false;
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    int close = glob.indexOf(']', i + 1);
                    if (close < 0) {
                        regex.append("\\[");
                        break;
                    }
                    String body = glob.substring(i, close);
                    i = close + 1;
                    regex.append('[');
                    if (body.startsWith("!")) {
                        regex.append('^');
                        body = body.substring(1);
                    }
                    regex.append(body.replace("\\", "\\\\").replace("[", "\\["));
                    regex.append(']');
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }
}
