package json.ecma.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// Ordered own-property storage for {@link JsPlainObject}.
///
/// Array-index keys live in a sorted map and always enumerate first, in
/// ascending numeric order; every other key keeps insertion order.
final class PropertyMap {

    /// A data property (`getter == null`) or an accessor property.
    static final class Slot {
        JsValue value;
        JsFunction getter;
        JsFunction setter;
        boolean enumerable;

        Slot(JsValue value, boolean enumerable) {
            this.value = value;
            this.enumerable = enumerable;
        }

        boolean isAccessor() {
            return getter != null || setter != null;
        }
    }

    private final TreeMap<Long, Slot> indexed = new TreeMap<>();
    private final LinkedHashMap<String, Slot> named = new LinkedHashMap<>();

    Slot find(String key) {
        long index = JsConversions.arrayIndex(key);
        return index >= 0 ? indexed.get(index) : named.get(key);
    }

    Slot findOrCreate(String key) {
        long index = JsConversions.arrayIndex(key);
        Slot slot = index >= 0 ? indexed.get(index) : named.get(key);
        if (slot == null) {
            slot = new Slot(JsUndefined.of(), true);
            if (index >= 0) {
                indexed.put(index, slot);
            } else {
                named.put(key, slot);
            }
        }
        return slot;
    }

    boolean remove(String key) {
        long index = JsConversions.arrayIndex(key);
        return (index >= 0 ? indexed.remove(index) : named.remove(key)) != null;
    }

    int size() {
        return indexed.size() + named.size();
    }

    List<String> enumerableKeys() {
        List<String> keys = new ArrayList<>(size());
        for (Map.Entry<Long, Slot> e : indexed.entrySet()) {
            if (e.getValue().enumerable) {
                keys.add(Long.toString(e.getKey()));
            }
        }
        for (Map.Entry<String, Slot> e : named.entrySet()) {
            if (e.getValue().enumerable) {
                keys.add(e.getKey());
            }
        }
        return keys;
    }
}
