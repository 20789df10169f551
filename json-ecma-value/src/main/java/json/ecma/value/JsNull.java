package json.ecma.value;

/// The `null` value.
public final class JsNull implements JsValue {

    private static final JsNull INSTANCE = new JsNull();

    private JsNull() {}

    /// {@return the `null` value}
    public static JsNull of() {
        return INSTANCE;
    }

    @Override
    public JsType typeKind() {
        return JsType.NULL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
