package com.py2smt.tree;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Renders doubles the way Python's {@code repr(float)} does: shortest round-tripping
 * digits, plain notation for decimal exponents in [-4, 16), scientific otherwise.
 */
final class FloatFormat {

    private FloatFormat() {
    }

    static String pythonRepr(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return (1 / value < 0) ? "-0.0" : "0.0";
        }

        BigDecimal decimal = shortestDigits(value);
        int exponent = decimal.precision() - decimal.scale() - 1;

        if (exponent < -4 || exponent >= 16) {
            String digits = decimal.unscaledValue().abs().toString();
            StringBuilder sb = new StringBuilder();
            if (decimal.signum() < 0) {
                sb.append('-');
            }
            sb.append(digits.charAt(0));
            if (digits.length() > 1) {
                sb.append('.').append(digits, 1, digits.length());
            }
            sb.append('e').append(exponent < 0 ? '-' : '+');
            sb.append(String.format("%02d", Math.abs(exponent)));
            return sb.toString();
        }

        String plain = decimal.toPlainString();
        return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }

    // Double.toString may emit more digits than needed to round-trip, so search upward.
    private static BigDecimal shortestDigits(double value) {
        BigDecimal exact = new BigDecimal(value);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal rounded = exact.round(new MathContext(precision));
            if (rounded.doubleValue() == value) {
                return rounded.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(17)).stripTrailingZeros();
    }
}
