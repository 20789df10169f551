package json.ecma;

import java.util.List;
import java.util.logging.Logger;

import json.ecma.value.JsException;
import json.ecma.value.JsObject;
import json.ecma.value.JsPlainObject;
import json.ecma.value.JsString;
import json.ecma.value.JsType;
import json.ecma.value.JsValue;

/// The `InternalizeJSONProperty` walk that applies a reviver to a freshly
/// parsed value, bottom-up.
///
/// Each property is replaced by what the reviver returns for it; a property
/// the reviver maps to `undefined` is deleted. Deleting an array element
/// leaves a hole, the length stays the same.
final class JsonReviver {

    private static final Logger LOG = Logger.getLogger(JsonReviver.class.getName());

    private final JsObject reviver;
    private final int maxDepth;
    private int depth;

    JsonReviver(JsObject reviver, int maxDepth) {
        this.reviver = reviver;
        this.maxDepth = maxDepth;
    }

    JsValue revive(JsValue unfiltered) {
        LOG.fine(() -> "Revive walk started with " + reviver);
        final JsPlainObject root = new JsPlainObject();
        root.put("", unfiltered);
        return walk(root, "");
    }

    private JsValue walk(JsObject holder, String name) {
        final JsValue val = holder.getProperty(name);
        if (val.isObject()) {
            if (++depth > maxDepth) {
                throw JsException.rangeError("Maximum call stack size exceeded");
            }
            try {
                final JsObject valueObj = (JsObject) val;
                if (valueObj.isArray()) {
                    final long length = valueObj.arrayLength();
                    for (long i = 0; i < length; i++) {
                        internalize(valueObj, Long.toString(i));
                    }
                } else {
                    final List<String> keys = valueObj.getOwnEnumerableKeys();
                    for (String key : keys) {
                        internalize(valueObj, key);
                    }
                }
            } finally {
                depth--;
            }
        }
        return reviver.invoke(holder, JsString.of(name), val);
    }

    private void internalize(JsObject valueObj, String key) {
        final JsValue newElement = walk(valueObj, key);
        if (newElement.typeKind() == JsType.UNDEFINED) {
            valueObj.deleteProperty(key);
        } else {
            valueObj.setProperty(key, newElement);
        }
    }
}
