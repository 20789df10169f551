package json.ecma.value;

import java.util.List;
import java.util.Objects;

/// Base class for host objects that expose a fixed or computed set of
/// properties. By default the object has no properties, ignores writes and
/// reports deletes as failed.
///
/// Subclasses override the methods they support. A host array-like overrides
/// {@link #isArray()} and answers `length` from {@link #getProperty(String)}.
public abstract class AbstractJsObject implements JsObject {

    protected AbstractJsObject() {}

    @Override
    public List<String> getOwnEnumerableKeys() {
        return List.of();
    }

    @Override
    public JsValue getProperty(String key) {
        Objects.requireNonNull(key);
        return JsUndefined.of();
    }

    @Override
    public void setProperty(String key, JsValue value) {
        Objects.requireNonNull(key);
        //empty
    }

    @Override
    public boolean deleteProperty(String key) {
        Objects.requireNonNull(key);
        return false;
    }

    @Override
    public String toString() {
        return "[object " + getClass().getSimpleName() + "]";
    }
}
