package io.workgate.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for one-level JSON objects.
 */
public final class FlatJsonCodec implements JsonCodec {
    static final FlatJsonCodec INSTANCE = new FlatJsonCodec();

    FlatJsonCodec() {
    }

    @Override
    public String toJson(Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return "{}";
        }
        StringBuilder out = new StringBuilder("{");
        for (Map.Entry<String, String> field : fields.entrySet()) {
            if (field.getKey() == null) {
                throw new IllegalArgumentException("null keys are not allowed");
            }
            if (out.length() > 1) {
                out.append(',');
            }
            quote(out, field.getKey());
            out.append(':');
            if (field.getValue() == null) {
                out.append("null");
            } else {
                quote(out, field.getValue());
            }
        }
        return out.append('}').toString();
    }

    @Override
    public Map<String, String> parseObject(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        Cursor cursor = new Cursor(json);
        cursor.expect('{');
        Map<String, String> result = new LinkedHashMap<>();
        if (cursor.consumeIf('}')) {
            cursor.requireEnd();
            return result;
        }
        do {
            String key = cursor.readString();
            cursor.expect(':');
            String value = cursor.readScalar();
            if (value != null) {
                result.put(key, value);
            }
        } while (cursor.consumeIf(','));
        cursor.expect('}');
        cursor.requireEnd();
        return result;
    }

    private static void quote(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    private static final class Cursor {
        private final String input;
        private int pos;

        Cursor(String input) {
            this.input = input;
        }

        void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        void expect(char c) {
            skipWhitespace();
            if (pos >= input.length() || input.charAt(pos) != c) {
                throw new IllegalArgumentException("Expected '" + c + "' at position " + pos);
            }
            pos++;
        }

        boolean consumeIf(char c) {
            skipWhitespace();
            if (pos < input.length() && input.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        void requireEnd() {
            skipWhitespace();
            if (pos != input.length()) {
                throw new IllegalArgumentException("Trailing content at position " + pos);
            }
        }

        String readScalar() {
            skipWhitespace();
            if (pos >= input.length()) {
                throw new IllegalArgumentException("Unexpected end of JSON");
            }
            if (input.charAt(pos) == '"') {
                return readString();
            }
            int start = pos;
            while (pos < input.length() && ",}".indexOf(input.charAt(pos)) < 0
                    && !Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
            String literal = input.substring(start, pos);
            if (literal.isEmpty() || literal.startsWith("{") || literal.startsWith("[")) {
                throw new IllegalArgumentException("Unsupported value at position " + start);
            }
            return "null".equals(literal) ? null : literal;
        }

        String readString() {
            expect('"');
            StringBuilder sb = new StringBuilder();
            while (pos < input.length()) {
                char c = input.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (pos >= input.length()) {
                    break;
                }
                char escaped = input.charAt(pos++);
                switch (escaped) {
                    case '"', '\\', '/' -> sb.append(escaped);
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'u' -> {
                        if (pos + 4 > input.length()) {
                            throw new IllegalArgumentException("Invalid unicode escape");
                        }
                        try {
                            sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Invalid unicode escape", e);
                        }
                        pos += 4;
                    }
                    default -> throw new IllegalArgumentException("Unsupported escape: \\" + escaped);
                }
            }
            throw new IllegalArgumentException("Unterminated string");
        }
    }
}
