package json.ecma.value;

/// A boolean primitive. There are exactly two instances.
public final class JsBoolean implements JsValue {

    public static final JsBoolean TRUE = new JsBoolean(true);
    public static final JsBoolean FALSE = new JsBoolean(false);

    private final boolean value;

    private JsBoolean(boolean value) {
        this.value = value;
    }

    public static JsBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean value() {
        return value;
    }

    @Override
    public JsType typeKind() {
        return JsType.BOOLEAN;
    }

    @Override
    public String toString() {
        return value ? "true" : "false";
    }
}
