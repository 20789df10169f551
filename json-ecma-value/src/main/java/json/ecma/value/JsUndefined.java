package json.ecma.value;

/// The `undefined` value.
public final class JsUndefined implements JsValue {

    private static final JsUndefined INSTANCE = new JsUndefined();

    private JsUndefined() {}

    /// {@return the `undefined` value}
    public static JsUndefined of() {
        return INSTANCE;
    }

    /// {@return `true` if `value` is `undefined`}
    public static boolean is(JsValue value) {
        return value == INSTANCE;
    }

    @Override
    public JsType typeKind() {
        return JsType.UNDEFINED;
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
