package json.ecma.value;

/// A symbol primitive. Symbols are compared by identity only and are never
/// serializable as JSON.
public final class JsSymbol implements JsValue {

    private final String description;

    private JsSymbol(String description) {
        this.description = description;
    }

    /// {@return a new, unique symbol}
    ///
    /// @param description the description shown by {@link #toString()}; may be null
    public static JsSymbol of(String description) {
        return new JsSymbol(description);
    }

    public String description() {
        return description;
    }

    @Override
    public JsType typeKind() {
        return JsType.SYMBOL;
    }

    @Override
    public String toString() {
        return "Symbol(" + (description == null ? "" : description) + ")";
    }
}
