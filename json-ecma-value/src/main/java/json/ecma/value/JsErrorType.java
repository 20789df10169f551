package json.ecma.value;

/// The ECMAScript error constructor a {@link JsException} stands for.
public enum JsErrorType {
    SYNTAX_ERROR("SyntaxError"),
    TYPE_ERROR("TypeError"),
    RANGE_ERROR("RangeError");

    private final String errorName;

    JsErrorType(String errorName) {
        this.errorName = errorName;
    }

    /// {@return the script-visible name, e.g. `TypeError`}
    public String errorName() {
        return errorName;
    }
}
