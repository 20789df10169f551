/// ECMA-262 `JSON.stringify` and `JSON.parse`.
///
/// {@link json.ecma.EcmaJson} is the entry point. Values come from the
/// `json.ecma.value` module; JSON text is read by a
/// {@link json.ecma.text.JsonTextParser}.
package json.ecma;
