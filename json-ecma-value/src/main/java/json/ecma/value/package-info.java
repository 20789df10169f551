/// The host value model the JSON engine is written against: primitives,
/// the {@link json.ecma.value.JsObject} capability interface with its
/// reference implementations, the ECMA-262 type conversions and the
/// script-level error type.
package json.ecma.value;
