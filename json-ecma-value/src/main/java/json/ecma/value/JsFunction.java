package json.ecma.value;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// A callable object backed by a Java lambda.
///
/// Like any object a function can carry properties. Exceptions thrown by the
/// body propagate unchanged to whoever invoked the function.
///
/// ## Example
/// ```java
/// JsFunction twice = JsFunction.of("twice", (self, args) ->
///     JsNumber.of(2 * JsConversions.toNumber(JsFunction.argument(args, 1))));
/// ```
public class JsFunction extends JsPlainObject {

    /// The behavior of a function.
    @FunctionalInterface
    public interface Body {
        /// @param thisValue the receiver of the call
        /// @param arguments the call arguments; unmodifiable
        /// @return the result, never the Java `null`
        JsValue apply(JsValue thisValue, List<JsValue> arguments);
    }

    private final String name;
    private final Body body;

    public JsFunction(String name, Body body) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    public static JsFunction of(String name, Body body) {
        return new JsFunction(name, body);
    }

    public static JsFunction of(Body body) {
        return new JsFunction("", body);
    }

    /// {@return the argument at `index`, or `undefined` when fewer were passed}
    public static JsValue argument(List<JsValue> arguments, int index) {
        return index < arguments.size() ? arguments.get(index) : JsUndefined.of();
    }

    /// Calls this function.
    ///
    /// @return the value the body returned
    /// @throws NullPointerException if the body returned the Java `null`
    @Override
    public JsValue invoke(JsValue thisValue, JsValue... args) {
        Objects.requireNonNull(thisValue, "thisValue must not be null");
        JsValue result = body.apply(thisValue, List.copyOf(Arrays.asList(args)));
        return Objects.requireNonNull(result, () -> "function " + name + " returned null");
    }

    public String name() {
        return name;
    }

    @Override
    public JsType typeKind() {
        return JsType.FUNCTION;
    }

    @Override
    public boolean isCallable() {
        return true;
    }

    @Override
    public String toString() {
        return "function " + name + "() { [native code] }";
    }
}
