package json.ecma;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import json.ecma.text.JsonTextParseException;
import json.ecma.text.JsonTextParser;
import json.ecma.text.JsonTokenizer;
import json.ecma.value.JsConversions;
import json.ecma.value.JsException;
import json.ecma.value.JsFunction;
import json.ecma.value.JsObject;
import json.ecma.value.JsPlainObject;
import json.ecma.value.JsString;
import json.ecma.value.JsUndefined;
import json.ecma.value.JsValue;

/// `JSON.stringify` and `JSON.parse` with the semantics of ECMA-262
/// section 25.5, over the {@link JsValue} capability interface.
///
/// Instances are immutable and thread-safe; the value graphs they work on
/// are not, and must not be mutated by other threads during a call.
///
/// ## Example
/// ```java
/// EcmaJson json = EcmaJson.standard();
/// JsValue value = json.parse("{\"a\":[1,2]}");
/// String text = json.stringify(value, JsUndefined.of(), JsNumber.of(2)).orElseThrow();
/// ```
///
/// ## Errors
/// All failures are {@link JsException}s:
/// - `TypeError` for cyclic structures and failed primitive conversions
/// - `RangeError` when output or nesting exceeds the {@link JsonOptions} limits
/// - `SyntaxError` for invalid JSON text, with {@link JsException#position()} set
///
/// Exceptions thrown by `toJSON` methods, replacers, revivers and getters
/// propagate unchanged.
public final class EcmaJson {

    private static final Logger LOG = Logger.getLogger(EcmaJson.class.getName());

    private static final EcmaJson STANDARD = new EcmaJson(JsonOptions.defaults(), null);

    private final JsonOptions options;
    private final JsonTextParser textParser;

    private EcmaJson(JsonOptions options, JsonTextParser textParser) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.textParser = textParser != null ? textParser : new JsonTokenizer(options.maxDepth());
    }

    /// {@return an instance using {@link JsonOptions#defaults()}}
    public static EcmaJson standard() {
        return STANDARD;
    }

    /// {@return an instance applying the given limits}
    public static EcmaJson withOptions(JsonOptions options) {
        return new EcmaJson(options, null);
    }

    /// {@return a copy of this instance that reads JSON text with `parser`}
    public EcmaJson withTextParser(JsonTextParser parser) {
        return new EcmaJson(options, Objects.requireNonNull(parser, "parser must not be null"));
    }

    public JsonOptions options() {
        return options;
    }

    /// {@return the JSON text for `value`, or empty if `value` is not serializable}
    public Optional<String> stringify(JsValue value) {
        return stringify(value, JsUndefined.of(), JsUndefined.of());
    }

    /// `JSON.stringify(value, replacer, space)`.
    ///
    /// @param replacer a function, an array of property names, or anything else for none
    /// @param space    a number of spaces or an indent string; anything else for compact output
    /// @return the JSON text, or empty when the root value is `undefined`, a
    ///         symbol or a function (possibly after `toJSON` and the replacer ran)
    public Optional<String> stringify(JsValue value, JsValue replacer, JsValue space) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(replacer, "replacer must not be null");
        Objects.requireNonNull(space, "space must not be null");
        final ReplacerConfig replacerConfig = ReplacerConfig.resolve(replacer);
        final GapConfig gap = GapConfig.resolve(space);
        return Optional.ofNullable(new StringifySession(replacerConfig, gap, options).run(value));
    }

    /// As {@link #stringify(JsValue, JsValue, JsValue)}, but answers a
    /// `JsString` or `undefined` like the script-level function.
    public JsValue stringifyValue(JsValue value, JsValue replacer, JsValue space) {
        return stringify(value, replacer, space).<JsValue>map(JsString::of).orElse(JsUndefined.of());
    }

    /// {@return the value denoted by the JSON text}
    ///
    /// @throws JsException a `SyntaxError` if `text` is `null` or not valid JSON
    public JsValue parse(String text) {
        if (text == null) {
            throw missingText();
        }
        return parse(JsString.of(text), JsUndefined.of());
    }

    /// `JSON.parse(text, reviver)`.
    ///
    /// @param text    converted with `ToString`; the Java `null` means the argument is missing
    /// @param reviver applied bottom-up when callable, ignored otherwise
    public JsValue parse(JsValue text, JsValue reviver) {
        if (text == null) {
            throw missingText();
        }
        Objects.requireNonNull(reviver, "reviver must not be null");
        final String source = JsConversions.toString(text);
        final JsValue unfiltered;
        try {
            unfiltered = textParser.parseText(source);
        } catch (JsonTextParseException e) {
            throw JsException.syntaxError("JSON.parse: " + e.getMessage(), e.offset(), e);
        }
        if (!reviver.isCallable()) {
            return unfiltered;
        }
        return new JsonReviver((JsObject) reviver, options.maxDepth()).revive(unfiltered);
    }

    /// {@return a `JSON` object whose `stringify` and `parse` methods call this instance}
    ///
    /// Missing arguments behave as in a script: `stringify()` answers
    /// `undefined` and `parse()` throws a `SyntaxError`.
    public JsPlainObject builtins() {
        final JsPlainObject json = new JsPlainObject();
        json.defineHidden("stringify", JsFunction.of("stringify", (self, args) -> stringifyValue(
                JsFunction.argument(args, 0), JsFunction.argument(args, 1), JsFunction.argument(args, 2))));
        json.defineHidden("parse", JsFunction.of("parse", (self, args) ->
                parse(args.isEmpty() ? null : args.get(0), JsFunction.argument(args, 1))));
        LOG.fine(() -> "Created JSON builtins with " + options);
        return json;
    }

    private static JsException missingText() {
        return JsException.syntaxError("JSON.parse: missing text argument", -1, null);
    }
}
