package json.ecma.value;

/// The type tag of a {@link JsValue}.
///
/// Wrapper objects for the primitive types have their own tags so that
/// the serializer can unbox them without inspecting the object further.
public enum JsType {
    UNDEFINED,
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    SYMBOL,
    /// An ordinary object or any host object that is neither an array nor callable.
    OBJECT,
    ARRAY,
    FUNCTION,
    NUMBER_OBJECT,
    STRING_OBJECT,
    BOOLEAN_OBJECT;

    /// {@return `true` for every tag that denotes an object rather than a primitive}
    public boolean isObject() {
        return ordinal() >= OBJECT.ordinal();
    }
}
