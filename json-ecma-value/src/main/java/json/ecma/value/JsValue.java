package json.ecma.value;

/// The interface that represents a value of the host language.
///
/// This is the capability contract the JSON engine is written against.
/// Primitives (`undefined`, `null`, booleans, numbers, strings and symbols)
/// are immutable. Objects are mutable and implement {@link JsObject};
/// hosts can plug their own object model in by implementing that interface,
/// usually by extending {@link AbstractJsObject}.
///
/// The Java `null` reference is never a valid `JsValue`; use {@link JsNull#of()}.
public sealed interface JsValue
        permits JsUndefined, JsNull, JsBoolean, JsNumber, JsString, JsSymbol, JsObject {

    /// {@return the type tag of this value}
    JsType typeKind();

    /// {@return `true` if this value is an array, native or host-provided}
    default boolean isArray() {
        return false;
    }

    /// {@return `true` if this value can be invoked}
    default boolean isCallable() {
        return false;
    }

    /// {@return `true` if this value is an object of any kind}
    default boolean isObject() {
        return typeKind().isObject();
    }

    /// {@return the handle used to compare values by identity}
    ///
    /// Two values are the same object exactly when their identities are the
    /// same reference.
    default Object identity() {
        return this;
    }
}
