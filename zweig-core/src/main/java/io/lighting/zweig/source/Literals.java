package io.lighting.zweig.source;

import io.lighting.zweig.ast.Expr;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Canonical Python notation for scalar literal values, matching what {@code repr} prints.
 */
public final class Literals {
    private static final String INFINITY = "1e309";
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Literals() {
    }

    public static String number(Number value) {
        Objects.requireNonNull(value, "value");
        if (Expr.Num.isIntegral(value)) {
            return value.toString();
        }
        if (value instanceof Float floatValue) {
            // Float#toString keeps the short decimal form; widening first would not.
            return floating(Double.parseDouble(Float.toString(floatValue)));
        }
        if (value instanceof Double doubleValue) {
            return floating(doubleValue);
        }
        throw new IllegalArgumentException("Unsupported numeric literal type: " + value.getClass().getName());
    }

    public static String floating(double value) {
        if (Double.isNaN(value)) {
            return "(" + INFINITY + " - " + INFINITY + ")";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? INFINITY : "-" + INFINITY;
        }
        if (value == 0) {
            return 1 / value < 0 ? "-0.0" : "0.0";
        }
        BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
        String digits = decimal.unscaledValue().toString();
        int exponent = digits.length() - decimal.scale() - 1;
        StringBuilder out = new StringBuilder(digits.length() + 8);
        if (value < 0) {
            out.append('-');
        }
        if (exponent < -4 || exponent >= 16) {
            out.append(digits.charAt(0));
            if (digits.length() > 1) {
                out.append('.').append(digits, 1, digits.length());
            }
            out.append('e').append(exponent < 0 ? '-' : '+');
            int magnitude = Math.abs(exponent);
            if (magnitude < 10) {
                out.append('0');
            }
            out.append(magnitude);
        } else if (exponent < 0) {
            out.append("0.").append("0".repeat(-exponent - 1)).append(digits);
        } else if (digits.length() <= exponent + 1) {
            out.append(digits).append("0".repeat(exponent + 1 - digits.length())).append(".0");
        } else {
            out.append(digits, 0, exponent + 1).append('.').append(digits, exponent + 1, digits.length());
        }
        return out.toString();
    }

    public static String string(String value) {
        Objects.requireNonNull(value, "value");
        char quote = quoteFor(value.indexOf('\'') >= 0, value.indexOf('"') >= 0);
        StringBuilder out = new StringBuilder(value.length() + 2);
        out.append(quote);
        value.codePoints().forEach(codePoint -> appendCodePoint(out, codePoint, quote));
        out.append(quote);
        return out.toString();
    }

    public static String bytes(byte[] value) {
        Objects.requireNonNull(value, "value");
        boolean hasSingle = false;
        boolean hasDouble = false;
        for (byte b : value) {
            hasSingle |= b == '\'';
            hasDouble |= b == '"';
        }
        char quote = quoteFor(hasSingle, hasDouble);
        StringBuilder out = new StringBuilder(value.length + 3);
        out.append('b').append(quote);
        for (byte b : value) {
            int unsigned = b & 0xff;
            if (unsigned == quote || unsigned == '\\') {
                out.append('\\').append((char) unsigned);
            } else if (unsigned == '\t') {
                out.append("\\t");
            } else if (unsigned == '\n') {
                out.append("\\n");
            } else if (unsigned == '\r') {
                out.append("\\r");
            } else if (unsigned < 0x20 || unsigned >= 0x7f) {
                appendHex(out, "\\x", unsigned, 2);
            } else {
                out.append((char) unsigned);
            }
        }
        out.append(quote);
        return out.toString();
    }

    /**
     * {@code True}, {@code False}, or {@code None} for {@code null}.
     */
    public static String nameConstant(Boolean value) {
        if (value == null) {
            return "None";
        }
        return value ? "True" : "False";
    }

    private static char quoteFor(boolean hasSingle, boolean hasDouble) {
        return hasSingle && !hasDouble ? '"' : '\'';
    }

    private static void appendCodePoint(StringBuilder out, int codePoint, char quote) {
        if (codePoint == quote || codePoint == '\\') {
            out.append('\\').append((char) codePoint);
        } else if (codePoint == '\t') {
            out.append("\\t");
        } else if (codePoint == '\n') {
            out.append("\\n");
        } else if (codePoint == '\r') {
            out.append("\\r");
        } else if (codePoint < 0x20 || codePoint == 0x7f) {
            appendHex(out, "\\x", codePoint, 2);
        } else if (codePoint < 0x7f || isPrintable(codePoint)) {
            out.appendCodePoint(codePoint);
        } else if (codePoint <= 0xff) {
            appendHex(out, "\\x", codePoint, 2);
        } else if (codePoint <= 0xffff) {
            appendHex(out, "\\u", codePoint, 4);
        } else {
            appendHex(out, "\\U", codePoint, 8);
        }
    }

    private static boolean isPrintable(int codePoint) {
        switch (Character.getType(codePoint)) {
            case Character.CONTROL:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.UNASSIGNED:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
            case Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }

    private static void appendHex(StringBuilder out, String prefix, int value, int width) {
        out.append(prefix);
        for (int shift = (width - 1) * 4; shift >= 0; shift -= 4) {
            out.append(HEX[(value >> shift) & 0xf]);
        }
    }
}
