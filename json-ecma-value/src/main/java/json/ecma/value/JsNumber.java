package json.ecma.value;

import java.math.BigDecimal;
import java.math.BigInteger;

/// A number primitive.
///
/// Most numbers are IEEE 754 doubles. Hosts that carry exact 64-bit integers
/// (signed or unsigned) can keep them exact with {@link #ofInt64(long)} and
/// {@link #ofUint64(long)}; their {@link #toString()} prints every digit
/// while {@link #value()} still answers the nearest double.
public final class JsNumber implements JsValue {

    private enum Kind { DOUBLE, INT64, UINT64 }

    private static final JsNumber ZERO = new JsNumber(0.0, Kind.DOUBLE, 0L);
    private static final JsNumber NAN = new JsNumber(Double.NaN, Kind.DOUBLE, 0L);

    private final double value;
    private final Kind kind;
    private final long bits;

    private JsNumber(double value, Kind kind, long bits) {
        this.value = value;
        this.kind = kind;
        this.bits = bits;
    }

    /// {@return a number with the given double value}
    public static JsNumber of(double value) {
        if (value == 0.0 && Double.doubleToRawLongBits(value) == 0L) {
            return ZERO;
        }
        if (Double.isNaN(value)) {
            return NAN;
        }
        return new JsNumber(value, Kind.DOUBLE, 0L);
    }

    /// {@return a number holding the exact signed 64-bit integer}
    public static JsNumber ofInt64(long value) {
        return new JsNumber((double) value, Kind.INT64, value);
    }

    /// {@return a number holding the exact unsigned 64-bit integer `value`}
    public static JsNumber ofUint64(long value) {
        double d = value >= 0 ? (double) value : ((double) (value >>> 1)) * 2.0 + (value & 1L);
        return new JsNumber(d, Kind.UINT64, value);
    }

    /// {@return the value as a double}
    public double value() {
        return value;
    }

    /// {@return `true` unless the value is NaN or an infinity}
    public boolean isFinite() {
        return Double.isFinite(value);
    }

    /// {@return `true` if this number was created from an exact 64-bit integer}
    public boolean isInt64Variant() {
        return kind != Kind.DOUBLE;
    }

    /// {@return the canonical ECMAScript string form of this number}
    ///
    /// @see JsNumberFormatter#format(double)
    @Override
    public String toString() {
        return switch (kind) {
            case INT64 -> Long.toString(bits);
            case UINT64 -> Long.toUnsignedString(bits);
            case DOUBLE -> JsNumberFormatter.format(value);
        };
    }

    @Override
    public JsType typeKind() {
        return JsType.NUMBER;
    }

    /// Numbers compare with SameValueZero semantics: `NaN` equals `NaN`, and
    /// `0` equals `-0`. When either side is an exact 64-bit integer the exact
    /// values are compared, so `ofInt64(2^60 + 1)` does not equal `of(2^60)`.
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof JsNumber other)) {
            return false;
        }
        if (kind == Kind.DOUBLE && other.kind == Kind.DOUBLE) {
            return value == other.value || (Double.isNaN(value) && Double.isNaN(other.value));
        }
        if (!isFinite() || !other.isFinite()) {
            return false;
        }
        return exact().compareTo(other.exact()) == 0;
    }

    private BigDecimal exact() {
        return switch (kind) {
            case INT64 -> BigDecimal.valueOf(bits);
            case UINT64 -> new BigDecimal(new BigInteger(Long.toUnsignedString(bits)));
            case DOUBLE -> new BigDecimal(value);
        };
    }

    @Override
    public int hashCode() {
        return value == 0.0 ? 0 : Double.hashCode(value);
    }
}
