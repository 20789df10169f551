package json.ecma.value;

import java.util.List;

/// The capability interface of an object.
///
/// Everything the JSON engine needs from a host object goes through these
/// methods; the engine never looks at the concrete class. Implementations
/// must return a fresh snapshot from {@link #getOwnEnumerableKeys()} so that
/// callbacks mutating the object during a traversal do not disturb the
/// traversal itself.
///
/// {@link JsPlainObject}, {@link JsArray}, {@link JsFunction} and
/// {@link JsPrimitiveWrapper} are the reference implementations. Hosts with
/// their own object model usually extend {@link AbstractJsObject}.
public non-sealed interface JsObject extends JsValue {

    /// {@return a snapshot of the own enumerable string keys, in enumeration order}
    ///
    /// Integer-like keys come first in ascending numeric order, then the
    /// other keys in insertion order.
    List<String> getOwnEnumerableKeys();

    /// {@return the value of the property `key`, or `undefined` if it is absent}
    ///
    /// This is an ordinary property read: accessor properties run their getter
    /// and the prototype chain is consulted.
    JsValue getProperty(String key);

    /// {@return the value of the element at `index`}
    default JsValue getProperty(long index) {
        return getProperty(Long.toString(index));
    }

    /// Creates or updates the own property `key`.
    void setProperty(String key, JsValue value);

    /// Removes the own property `key`.
    ///
    /// @return `true` if the property is gone after the call
    boolean deleteProperty(String key);

    /// {@return the prototype of this object, or `null` at the end of the chain}
    default JsObject prototype() {
        return null;
    }

    /// Calls this object. Only objects whose {@link #isCallable()} answers
    /// `true` support this.
    ///
    /// @throws JsException a `TypeError` if this object is not callable
    default JsValue invoke(JsValue thisValue, JsValue... args) {
        throw JsException.typeError(this + " is not a function");
    }

    /// {@return the array length of this object}
    ///
    /// Native arrays answer their own length; everything else reads the
    /// `length` property and applies `ToLength`.
    default long arrayLength() {
        return JsConversions.toLength(getProperty("length"));
    }

    @Override
    default JsType typeKind() {
        return JsType.OBJECT;
    }

    @Override
    default boolean isObject() {
        return true;
    }
}
