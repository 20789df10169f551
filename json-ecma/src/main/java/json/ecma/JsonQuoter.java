package json.ecma;

/// `QuoteJSONString`: wraps a string in double quotes and escapes it.
///
/// `"` and `\` are backslash-escaped, `\b \f \n \r \t` use their short
/// forms, other code units below `0x20` and unpaired surrogates become
/// six-character escapes (a backslash, `u` and four lowercase hex digits).
/// Everything else, including well-formed surrogate pairs, is copied
/// verbatim.
public final class JsonQuoter {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private JsonQuoter() {}

    public static String quote(String value) {
        final int start = firstEscape(value);
        if (start < 0) {
            return '"' + value + '"';
        }
        final StringBuilder product = new StringBuilder(value.length() + 16);
        product.append('"').append(value, 0, start);
        quoteFrom(value, start, product);
        return product.append('"').toString();
    }

    /// Appends the quoted form of `value` to `out`.
    static void quote(String value, StringBuilder out) {
        final int start = firstEscape(value);
        out.append('"');
        if (start < 0) {
            out.append(value);
        } else {
            out.append(value, 0, start);
            quoteFrom(value, start, out);
        }
        out.append('"');
    }

    private static void quoteFrom(String value, int start, StringBuilder product) {
        final int length = value.length();
        for (int i = start; i < length; i++) {
            final char ch = value.charAt(i);
            switch (ch) {
                case '"' -> product.append("\\\"");
                case '\\' -> product.append("\\\\");
                case '\b' -> product.append("\\b");
                case '\f' -> product.append("\\f");
                case '\n' -> product.append("\\n");
                case '\r' -> product.append("\\r");
                case '\t' -> product.append("\\t");
                default -> {
                    if (ch < ' ') {
                        unicodeEscape(ch, product);
                    } else if (Character.isHighSurrogate(ch)) {
                        if (i + 1 < length && Character.isLowSurrogate(value.charAt(i + 1))) {
                            product.append(ch).append(value.charAt(++i));
                        } else {
                            unicodeEscape(ch, product);
                        }
                    } else if (Character.isLowSurrogate(ch)) {
                        unicodeEscape(ch, product);
                    } else {
                        product.append(ch);
                    }
                }
            }
        }
    }

    /// {@return the index of the first code unit that needs escaping, or -1}
    private static int firstEscape(String value) {
        final int length = value.length();
        for (int i = 0; i < length; i++) {
            final char ch = value.charAt(i);
            if (ch < ' ' || ch == '"' || ch == '\\') {
                return i;
            }
            if (Character.isSurrogate(ch)) {
                if (Character.isHighSurrogate(ch) && i + 1 < length && Character.isLowSurrogate(value.charAt(i + 1))) {
                    i++;
                } else {
                    return i;
                }
            }
        }
        return -1;
    }

    private static void unicodeEscape(char ch, StringBuilder out) {
        out.append("\\u")
                .append(HEX[(ch >> 12) & 0xF])
                .append(HEX[(ch >> 8) & 0xF])
                .append(HEX[(ch >> 4) & 0xF])
                .append(HEX[ch & 0xF]);
    }
}
