package json.ecma.value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// A native array: a dense list of elements that may contain holes, plus
/// any named properties an ordinary object can carry.
///
/// A hole is an index below `length` with no element. Reading a hole falls
/// through to the prototype chain and usually answers `undefined`.
public class JsArray extends JsPlainObject {

    /// Arrays are backed by a Java list, so their length is bounded by it.
    public static final int MAX_LENGTH = Integer.MAX_VALUE - 8;

    private final ArrayList<JsValue> elements;

    public JsArray() {
        this.elements = new ArrayList<>();
    }

    public static JsArray of(JsValue... values) {
        JsArray array = new JsArray();
        for (JsValue v : values) {
            array.add(v);
        }
        return array;
    }

    public static JsArray of(List<? extends JsValue> values) {
        JsArray array = new JsArray();
        values.forEach(array::add);
        return array;
    }

    /// Appends an element.
    public JsArray add(JsValue value) {
        elements.add(Objects.requireNonNull(value, "value must not be null"));
        return this;
    }

    /// {@return the element at `index`, or the Java `null` for a hole or an index out of range}
    public JsValue element(int index) {
        return index >= 0 && index < elements.size() ? elements.get(index) : null;
    }

    /// Stores an element, growing the array with holes if needed.
    public void set(long index, JsValue value) {
        Objects.requireNonNull(value, "value must not be null");
        if (index < 0 || index >= MAX_LENGTH) {
            throw JsException.rangeError("Invalid array index " + index);
        }
        int i = (int) index;
        while (elements.size() <= i) {
            elements.add(null);
        }
        elements.set(i, value);
    }

    /// Turns the element at `index` into a hole. The length does not change.
    public void delete(long index) {
        if (index >= 0 && index < elements.size()) {
            elements.set((int) index, null);
        }
    }

    /// {@return `true` if `index` is below the length and has no element}
    public boolean isHole(int index) {
        return index >= 0 && index < elements.size() && elements.get(index) == null;
    }

    public int length() {
        return elements.size();
    }

    /// Truncates or extends (with holes) the array.
    public void setLength(long length) {
        if (length < 0 || length > MAX_LENGTH) {
            throw JsException.rangeError("Invalid array length");
        }
        int n = (int) length;
        if (n < elements.size()) {
            elements.subList(n, elements.size()).clear();
        } else {
            elements.ensureCapacity(n);
            while (elements.size() < n) {
                elements.add(null);
            }
        }
    }

    @Override
    public long arrayLength() {
        return elements.size();
    }

    @Override
    public JsValue getProperty(long index) {
        if (index >= 0 && index < elements.size()) {
            JsValue v = elements.get((int) index);
            if (v != null) {
                return v;
            }
        }
        return super.getProperty(Long.toString(index));
    }

    @Override
    protected JsValue get(String key, JsObject receiver) {
        if ("length".equals(key)) {
            return JsNumber.of(elements.size());
        }
        long index = JsConversions.arrayIndex(key);
        if (index >= 0 && index < elements.size()) {
            JsValue v = elements.get((int) index);
            if (v != null) {
                return v;
            }
        }
        return super.get(key, receiver);
    }

    @Override
    public void setProperty(String key, JsValue value) {
        Objects.requireNonNull(key);
        if ("length".equals(key)) {
            double n = JsConversions.toNumber(value);
            long len = JsConversions.toUint32(value);
            if (len != n) {
                throw JsException.rangeError("Invalid array length");
            }
            setLength(len);
            return;
        }
        long index = JsConversions.arrayIndex(key);
        if (index >= 0) {
            set(index, value);
        } else {
            super.setProperty(key, value);
        }
    }

    @Override
    public boolean deleteProperty(String key) {
        Objects.requireNonNull(key);
        if ("length".equals(key)) {
            return false;
        }
        long index = JsConversions.arrayIndex(key);
        if (index >= 0) {
            delete(index);
            return true;
        }
        return super.deleteProperty(key);
    }

    @Override
    public List<String> getOwnEnumerableKeys() {
        List<String> keys = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) != null) {
                keys.add(Integer.toString(i));
            }
        }
        keys.addAll(super.getOwnEnumerableKeys());
        return keys;
    }

    /// {@return a copy of the elements, with holes as the Java `null`}
    public List<JsValue> elements() {
        return Arrays.asList(elements.toArray(new JsValue[0]));
    }

    @Override
    public JsType typeKind() {
        return JsType.ARRAY;
    }

    @Override
    public boolean isArray() {
        return true;
    }

    @Override
    public String toString() {
        return "JsArray[length=" + elements.size() + "]";
    }
}
