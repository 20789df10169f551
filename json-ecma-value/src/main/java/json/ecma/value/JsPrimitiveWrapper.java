package json.ecma.value;

import java.util.Objects;

/// A wrapper object around a number, string or boolean primitive
/// (`new Number(1)`, `new String("a")`, `new Boolean(false)`).
///
/// Conversions look up `valueOf` / `toString` on the wrapper first, so a host
/// can override them by defining those properties; otherwise the wrapped
/// primitive is used.
public class JsPrimitiveWrapper extends JsPlainObject {

    private final JsValue primitive;
    private final JsType type;

    private JsPrimitiveWrapper(JsValue primitive, JsType type) {
        this.primitive = primitive;
        this.type = type;
    }

    public static JsPrimitiveWrapper ofNumber(JsNumber value) {
        return new JsPrimitiveWrapper(Objects.requireNonNull(value), JsType.NUMBER_OBJECT);
    }

    public static JsPrimitiveWrapper ofNumber(double value) {
        return ofNumber(JsNumber.of(value));
    }

    public static JsPrimitiveWrapper ofString(String value) {
        return new JsPrimitiveWrapper(JsString.of(value), JsType.STRING_OBJECT);
    }

    public static JsPrimitiveWrapper ofBoolean(boolean value) {
        return new JsPrimitiveWrapper(JsBoolean.of(value), JsType.BOOLEAN_OBJECT);
    }

    /// {@return the wrapped primitive}
    public JsValue primitive() {
        return primitive;
    }

    @Override
    public JsType typeKind() {
        return type;
    }

    @Override
    public String toString() {
        return primitive.toString();
    }
}
