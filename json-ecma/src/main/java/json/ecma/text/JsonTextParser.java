package json.ecma.text;

import json.ecma.value.JsValue;

/// Turns JSON text into a fresh value graph.
///
/// {@link JsonTokenizer} is the built-in implementation; hosts can supply
/// their own to `EcmaJson` as long as it produces plain objects and native
/// arrays the reviver walk can mutate.
@FunctionalInterface
public interface JsonTextParser {

    /// @param text the complete JSON text
    /// @return the value the text denotes
    /// @throws JsonTextParseException if the text is not valid JSON
    JsValue parseText(String text);
}
