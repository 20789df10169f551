package json.ecma.text;

import java.util.logging.Logger;

import json.ecma.value.JsArray;
import json.ecma.value.JsBoolean;
import json.ecma.value.JsNull;
import json.ecma.value.JsNumber;
import json.ecma.value.JsPlainObject;
import json.ecma.value.JsString;
import json.ecma.value.JsValue;

/// A recursive descent parser for the JSON grammar of RFC 8259, which is
/// also the grammar `JSON.parse` accepts.
///
/// - whitespace is space, tab, CR and LF only
/// - no trailing commas, no leading zeros, no control characters in strings
/// - duplicate object keys are allowed: the last value wins, the first position is kept
/// - numbers are doubles; `-0` stays negative zero
///
/// Objects become {@link JsPlainObject}s and arrays {@link JsArray}s.
/// Instances are immutable and may be shared between threads.
public final class JsonTokenizer implements JsonTextParser {

    private static final Logger LOG = Logger.getLogger(JsonTokenizer.class.getName());

    /// The nesting limit used by {@link #JsonTokenizer()}.
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final int EOF = -1;

    private static final int STATE_EMPTY = 0;
    private static final int STATE_ELEMENT_PARSED = 1;
    private static final int STATE_COMMA_PARSED = 2;

    private final int maxDepth;

    public JsonTokenizer() {
        this(DEFAULT_MAX_DEPTH);
    }

    /// @param maxDepth the deepest nesting of arrays and objects accepted
    public JsonTokenizer(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    @Override
    public JsValue parseText(String text) {
        final Scan scan = new Scan(text);
        try {
            final JsValue value = scan.parseLiteral();
            scan.skipWhiteSpace();
            if (scan.pos < scan.length) {
                throw scan.expectedError(scan.pos, "end of input", describe(scan.peek()));
            }
            return value;
        } catch (JsonTextParseException e) {
            LOG.fine(() -> "Invalid JSON text: " + e.getMessage());
            throw e;
        }
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static String describe(int c) {
        return c == EOF ? "end of input" : "'" + (char) c + "'";
    }

    /// The cursor of one parse.
    private final class Scan {
        final String source;
        final int length;
        int pos;
        int depth;

        Scan(String source) {
            this.source = source;
            this.length = source.length();
        }

        JsValue parseLiteral() {
            skipWhiteSpace();
            final int c = peek();
            if (c == EOF) {
                throw expectedError(pos, "a JSON value", "end of input");
            }
            return switch (c) {
                case '{' -> parseObject();
                case '[' -> parseArray();
                case '"' -> JsString.of(parseString());
                case 'f' -> parseKeyword("false", JsBoolean.FALSE);
                case 't' -> parseKeyword("true", JsBoolean.TRUE);
                case 'n' -> parseKeyword("null", JsNull.of());
                default -> {
                    if (isDigit(c) || c == '-') {
                        yield parseNumber();
                    }
                    throw expectedError(pos, "a JSON value", describe(c));
                }
            };
        }

        private void descend() {
            if (++depth > maxDepth) {
                throw error("Nesting exceeds the maximum depth of " + maxDepth, pos);
            }
        }

        private JsValue parseObject() {
            descend();
            final JsPlainObject object = new JsPlainObject();
            int state = STATE_EMPTY;
            pos++;

            while (pos < length) {
                skipWhiteSpace();
                final int c = peek();
                switch (c) {
                    case '"' -> {
                        if (state == STATE_ELEMENT_PARSED) {
                            throw expectedError(pos, "',' or '}'", describe(c));
                        }
                        final String key = parseString();
                        expectColon();
                        object.setProperty(key, parseLiteral());
                        state = STATE_ELEMENT_PARSED;
                    }
                    case ',' -> {
                        if (state != STATE_ELEMENT_PARSED) {
                            throw error("Unexpected ','", pos);
                        }
                        state = STATE_COMMA_PARSED;
                        pos++;
                    }
                    case '}' -> {
                        if (state == STATE_COMMA_PARSED) {
                            throw error("Trailing comma in object", pos);
                        }
                        pos++;
                        depth--;
                        return object;
                    }
                    default -> throw expectedError(pos,
                            state == STATE_ELEMENT_PARSED ? "',' or '}'" : "a property name", describe(c));
                }
            }
            throw expectedError(pos, "',' or '}'", "end of input");
        }

        private JsValue parseArray() {
            descend();
            final JsArray array = new JsArray();
            int state = STATE_EMPTY;
            pos++;

            while (pos < length) {
                skipWhiteSpace();
                final int c = peek();
                switch (c) {
                    case ',' -> {
                        if (state != STATE_ELEMENT_PARSED) {
                            throw error("Unexpected ','", pos);
                        }
                        state = STATE_COMMA_PARSED;
                        pos++;
                    }
                    case ']' -> {
                        if (state == STATE_COMMA_PARSED) {
                            throw error("Trailing comma in array", pos);
                        }
                        pos++;
                        depth--;
                        return array;
                    }
                    default -> {
                        if (state == STATE_ELEMENT_PARSED) {
                            throw expectedError(pos, "',' or ']'", describe(c));
                        }
                        array.add(parseLiteral());
                        state = STATE_ELEMENT_PARSED;
                    }
                }
            }
            throw expectedError(pos, "',' or ']'", "end of input");
        }

        private void expectColon() {
            skipWhiteSpace();
            final int n = next();
            if (n != ':') {
                throw expectedError(pos - 1, "':'", describe(n));
            }
        }

        private String parseString() {
            // the builder is only needed once an escape shows up
            int start = ++pos;
            StringBuilder sb = null;

            while (pos < length) {
                final int c = next();
                if (c <= 0x1f) {
                    throw error("Control character in string", pos - 1);
                } else if (c == '\\') {
                    if (sb == null) {
                        sb = new StringBuilder(pos - start + 16);
                    }
                    sb.append(source, start, pos - 1);
                    sb.append(parseEscapeSequence());
                    start = pos;
                } else if (c == '"') {
                    if (sb != null) {
                        sb.append(source, start, pos - 1);
                        return sb.toString();
                    }
                    return source.substring(start, pos - 1);
                }
            }
            throw error("Unterminated string", length);
        }

        private char parseEscapeSequence() {
            final int c = next();
            return switch (c) {
                case '"' -> '"';
                case '\\' -> '\\';
                case '/' -> '/';
                case 'b' -> '\b';
                case 'f' -> '\f';
                case 'n' -> '\n';
                case 'r' -> '\r';
                case 't' -> '\t';
                case 'u' -> parseUnicodeEscape();
                default -> throw error("Invalid escape character " + describe(c), pos - 1);
            };
        }

        private char parseUnicodeEscape() {
            return (char) (parseHexDigit() << 12 | parseHexDigit() << 8 | parseHexDigit() << 4 | parseHexDigit());
        }

        private int parseHexDigit() {
            final int c = next();
            if (c >= '0' && c <= '9') {
                return c - '0';
            } else if (c >= 'A' && c <= 'F') {
                return c + 10 - 'A';
            } else if (c >= 'a' && c <= 'f') {
                return c + 10 - 'a';
            }
            throw error("Invalid hex digit " + describe(c), pos - 1);
        }

        private void skipDigits() {
            while (pos < length && isDigit(peek())) {
                pos++;
            }
        }

        private JsValue parseNumber() {
            final int start = pos;
            int c = next();

            if (c == '-') {
                c = next();
            }
            if (!isDigit(c)) {
                throw error("Invalid number", start);
            }
            // no more digits allowed after 0
            if (c != '0') {
                skipDigits();
            }

            if (peek() == '.') {
                pos++;
                if (!isDigit(next())) {
                    throw error("Invalid number", pos - 1);
                }
                skipDigits();
            }

            c = peek();
            if (c == 'e' || c == 'E') {
                pos++;
                c = next();
                if (c == '-' || c == '+') {
                    c = next();
                }
                if (!isDigit(c)) {
                    throw error("Invalid number", pos - 1);
                }
                skipDigits();
            }

            return JsNumber.of(Double.parseDouble(source.substring(start, pos)));
        }

        private JsValue parseKeyword(String keyword, JsValue value) {
            if (!source.regionMatches(pos, keyword, 0, keyword.length())) {
                throw expectedError(pos, "a JSON value", describe(peek()));
            }
            pos += keyword.length();
            return value;
        }

        int peek() {
            return pos >= length ? EOF : source.charAt(pos);
        }

        private int next() {
            final int next = peek();
            pos++;
            return next;
        }

        void skipWhiteSpace() {
            while (pos < length) {
                switch (peek()) {
                    case '\t', '\r', '\n', ' ' -> pos++;
                    default -> {
                        return;
                    }
                }
            }
        }

        JsonTextParseException error(String reason, int offset) {
            return JsonTextParseException.at(reason, source, Math.min(offset, length));
        }

        JsonTextParseException expectedError(int offset, String expected, String found) {
            return error("Expected " + expected + " but found " + found, offset);
        }
    }
}
