package json.ecma.text;

/// Thrown when JSON text cannot be parsed.
///
/// Offsets count UTF-16 code units from 0; lines and columns count from 1.
public class JsonTextParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String reason;
    private final int offset;
    private final int line;
    private final int column;

    public JsonTextParseException(String reason, int offset, int line, int column) {
        super(formatMessage(reason, offset, line, column));
        this.reason = reason;
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    /// Creates an exception locating `offset` in `source`.
    public static JsonTextParseException at(String reason, String source, int offset) {
        int line = 1;
        int lineStart = 0;
        final int end = Math.min(offset, source.length());
        for (int i = 0; i < end; i++) {
            final char c = source.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'))) {
                line++;
                lineStart = i + 1;
            }
        }
        return new JsonTextParseException(reason, offset, line, offset - lineStart + 1);
    }

    /// Returns the description of the problem without location details.
    public String reason() {
        return reason;
    }

    /// Returns the offset in the text where the error was detected.
    public int offset() {
        return offset;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    private static String formatMessage(String reason, int offset, int line, int column) {
        if (offset < 0) {
            return reason;
        }
        return reason + " at line " + line + " column " + column + " (offset " + offset + ")";
    }
}
