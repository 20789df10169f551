package json.ecma.value;

import java.util.List;
import java.util.Objects;

/// An ordinary object: an ordered map of own properties plus an optional
/// prototype link.
///
/// Properties are enumerable data properties unless created with
/// {@link #defineHidden(String, JsValue)} or
/// {@link #defineAccessor(String, JsFunction, JsFunction)}.
///
/// ## Example
/// ```java
/// JsPlainObject point = new JsPlainObject()
///     .put("x", JsNumber.of(1))
///     .put("y", JsNumber.of(2));
/// ```
public class JsPlainObject implements JsObject {

    private final PropertyMap properties = new PropertyMap();
    private JsObject prototype;

    public JsPlainObject() {
        this(null);
    }

    /// @param prototype the prototype, or `null` for none
    public JsPlainObject(JsObject prototype) {
        this.prototype = prototype;
    }

    /// Sets an enumerable data property and returns this object for chaining.
    public JsPlainObject put(String key, JsValue value) {
        setProperty(key, value);
        return this;
    }

    /// Defines a non-enumerable data property. It is readable through
    /// {@link #getProperty(String)} but never listed by
    /// {@link #getOwnEnumerableKeys()}.
    public JsPlainObject defineHidden(String key, JsValue value) {
        Objects.requireNonNull(value, "value must not be null");
        PropertyMap.Slot slot = properties.findOrCreate(Objects.requireNonNull(key));
        slot.getter = null;
        slot.setter = null;
        slot.value = value;
        slot.enumerable = false;
        return this;
    }

    /// Defines an enumerable accessor property.
    ///
    /// @param getter invoked with this object as `this`; may be null
    /// @param setter invoked with this object as `this` and the new value; may be null
    public JsPlainObject defineAccessor(String key, JsFunction getter, JsFunction setter) {
        PropertyMap.Slot slot = properties.findOrCreate(Objects.requireNonNull(key));
        slot.value = JsUndefined.of();
        slot.getter = getter;
        slot.setter = setter;
        slot.enumerable = true;
        return this;
    }

    /// {@return `true` if `key` is an own property, enumerable or not}
    public boolean hasOwnProperty(String key) {
        return properties.find(Objects.requireNonNull(key)) != null;
    }

    @Override
    public List<String> getOwnEnumerableKeys() {
        return properties.enumerableKeys();
    }

    @Override
    public JsValue getProperty(String key) {
        return get(key, this);
    }

    /// Property read with an explicit receiver, so that getters found on a
    /// prototype run against the object the read started from.
    protected JsValue get(String key, JsObject receiver) {
        Objects.requireNonNull(key);
        PropertyMap.Slot slot = properties.find(key);
        if (slot != null) {
            if (slot.isAccessor()) {
                return slot.getter == null ? JsUndefined.of() : slot.getter.invoke(receiver);
            }
            return slot.value;
        }
        JsObject proto = prototype;
        if (proto == null) {
            return JsUndefined.of();
        }
        if (proto instanceof JsPlainObject plain) {
            return plain.get(key, receiver);
        }
        return proto.getProperty(key);
    }

    @Override
    public void setProperty(String key, JsValue value) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(value, "value must not be null");
        PropertyMap.Slot slot = properties.find(key);
        if (slot != null && slot.isAccessor()) {
            if (slot.setter != null) {
                slot.setter.invoke(this, value);
            }
            return;
        }
        properties.findOrCreate(key).value = value;
    }

    @Override
    public boolean deleteProperty(String key) {
        properties.remove(Objects.requireNonNull(key));
        return true;
    }

    @Override
    public JsObject prototype() {
        return prototype;
    }

    public void setPrototype(JsObject prototype) {
        for (JsObject p = prototype; p != null; p = p.prototype()) {
            if (p == this) {
                throw JsException.typeError("Cyclic __proto__ value");
            }
        }
        this.prototype = prototype;
    }

    /// {@return the number of own properties, enumerable or not}
    public int ownPropertyCount() {
        return properties.size();
    }

    @Override
    public String toString() {
        return "[object Object]";
    }
}
