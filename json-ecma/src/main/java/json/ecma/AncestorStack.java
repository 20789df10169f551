package json.ecma;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import json.ecma.value.JsException;
import json.ecma.value.JsObject;

/// The objects currently being serialized, innermost last.
///
/// Membership is by {@link JsObject#identity()}, never by `equals`. Entering
/// returns a {@link Scope} that must be closed in a try-with-resources block,
/// so the object leaves the stack however its serialization ends.
final class AncestorStack {

    private final ArrayDeque<Object> stack = new ArrayDeque<>();
    private final Set<Object> members = Collections.newSetFromMap(new IdentityHashMap<>());

    /// Pushes `value`.
    ///
    /// @throws JsException a `TypeError` if `value` is already on the stack
    Scope enter(JsObject value) {
        final Object id = value.identity();
        if (!members.add(id)) {
            throw JsException.typeError("Converting circular structure to JSON");
        }
        stack.push(id);
        return new Scope(id);
    }

    boolean contains(JsObject value) {
        return members.contains(value.identity());
    }

    int size() {
        return stack.size();
    }

    /// The stack entry of one object. Closing it pops the entry.
    final class Scope implements AutoCloseable {
        private final Object id;
        private boolean closed;

        private Scope(Object id) {
            this.id = id;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            if (stack.peek() != id) {
                throw new InternalError("Ancestor stack popped out of order");
            }
            stack.pop();
            members.remove(id);
            closed = true;
        }
    }
}
