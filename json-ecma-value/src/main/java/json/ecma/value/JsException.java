package json.ecma.value;

import java.util.Objects;

/// A script-level error (`SyntaxError`, `TypeError`, `RangeError`) raised by
/// the value model or the JSON engine.
///
/// Errors abort the whole operation that raised them; nothing is retried.
/// Exceptions thrown by user callbacks are not wrapped in this type.
public class JsException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final JsErrorType type;
    private final int position;

    public JsException(JsErrorType type, String message) {
        this(type, message, -1, null);
    }

    public JsException(JsErrorType type, String message, int position, Throwable cause) {
        super(message, cause);
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.position = position;
    }

    public static JsException syntaxError(String message, int position, Throwable cause) {
        return new JsException(JsErrorType.SYNTAX_ERROR, message, position, cause);
    }

    public static JsException typeError(String message) {
        return new JsException(JsErrorType.TYPE_ERROR, message);
    }

    public static JsException rangeError(String message) {
        return new JsException(JsErrorType.RANGE_ERROR, message);
    }

    public JsErrorType type() {
        return type;
    }

    /// {@return the offset into the source text where the error was detected, or -1 if unknown}
    public int position() {
        return position;
    }

    @Override
    public String toString() {
        return type.errorName() + ": " + getMessage();
    }
}
