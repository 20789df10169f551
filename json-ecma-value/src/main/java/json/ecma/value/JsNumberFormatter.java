package json.ecma.value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/// `Number::toString(x)` of ECMA-262 (section 6.1.6.1.20) for radix 10.
///
/// The digits are the shortest decimal that reads back as the same double;
/// among candidates of that length the one closest to the exact value wins.
/// Layout:
/// - `k <= n <= 21`: the digits followed by `n - k` zeros (`1e21` is the first exponential integer)
/// - `0 < n <= 21`: a decimal point after the first `n` digits
/// - `-6 < n <= 0`: `0.` then `-n` zeros then the digits
/// - otherwise exponential: `d.ddde+x` / `de-x`
///
/// where `k` is the digit count and `n` the decimal exponent such that the
/// value is `digits * 10^(n - k)`.
public final class JsNumberFormatter {

    private static final long EXACT_INTEGER_LIMIT = 1L << 53;

    private JsNumberFormatter() {}

    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (value == 0.0) {
            return "0";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value < 0) {
            return "-" + format(-value);
        }
        if (value < EXACT_INTEGER_LIMIT && value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        BigDecimal shortest = shortestDecimal(value);
        String digits = shortest.unscaledValue().toString();
        int k = digits.length();
        int n = k - shortest.scale();
        return layout(digits, k, n);
    }

    private static final RoundingMode[] ROUNDINGS = {
            RoundingMode.HALF_EVEN, RoundingMode.FLOOR, RoundingMode.CEILING};

    /// The interval of decimals that read back as `value` is asymmetric at
    /// powers of two, so the nearest candidate at a precision may miss while
    /// the one on the wide side reads back. Among the candidates that read
    /// back the closest wins; ties go to the even (`HALF_EVEN`) one.
    private static BigDecimal shortestDecimal(double value) {
        BigDecimal exact = new BigDecimal(value);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal best = null;
            for (RoundingMode mode : ROUNDINGS) {
                BigDecimal candidate = exact.round(new MathContext(precision, mode));
                if (candidate.doubleValue() == value
                        && (best == null || distance(candidate, exact).compareTo(distance(best, exact)) < 0)) {
                    best = candidate;
                }
            }
            if (best != null) {
                return best.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    private static BigDecimal distance(BigDecimal candidate, BigDecimal exact) {
        return candidate.subtract(exact).abs();
    }

    private static String layout(String digits, int k, int n) {
        StringBuilder sb = new StringBuilder(k + 8);
        if (k <= n && n <= 21) {
            sb.append(digits);
            for (int i = 0; i < n - k; i++) {
                sb.append('0');
            }
        } else if (0 < n && n <= 21) {
            sb.append(digits, 0, n).append('.').append(digits, n, k);
        } else if (-6 < n && n <= 0) {
            sb.append("0.");
            for (int i = 0; i < -n; i++) {
                sb.append('0');
            }
            sb.append(digits);
        } else {
            int e = n - 1;
            sb.append(digits.charAt(0));
            if (k > 1) {
                sb.append('.').append(digits, 1, k);
            }
            sb.append('e').append(e < 0 ? '-' : '+').append(Math.abs(e));
        }
        return sb.toString();
    }
}
