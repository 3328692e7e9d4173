package io.github.clickin.flatquery.core;

import java.math.BigInteger;
import java.util.Base64;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in scalar shapes.
 *
 * <p>Signed integers map to their Java boxes; {@code i128} and {@code u128} use
 * {@link BigInteger}. Unsigned types are carried by the next wider box ({@code u8}/{@code u16} in
 * {@link Integer}, {@code u32} in {@link Long}) except {@code u64}, which uses a {@link Long} read
 * with unsigned arithmetic ({@link Long#toUnsignedString(long)}). Every parser accepts only values
 * inside its own range.
 *
 * <p>Numeric literals are plain ASCII decimals: an optional sign (never {@code -} for unsigned
 * types), digits, and for floats an optional fraction and exponent. Floats also accept
 * {@code inf}, {@code infinity} and {@code nan} in any case. Whitespace, type suffixes, hex
 * notation and non-ASCII digits are rejected.
 */
public final class Scalars {
    private Scalars() {}

    private static final BigInteger I128_MIN = BigInteger.ONE.shiftLeft(127).negate();
    private static final BigInteger I128_MAX = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    private static final BigInteger U128_MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private static final Pattern SIGNED = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern UNSIGNED = Pattern.compile("\\+?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");
    private static final Pattern NON_FINITE = Pattern.compile("([+-]?)(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    public static final ScalarShape<Boolean> BOOL = new ScalarShape<>("bool", String::valueOf, Scalars::parseBool);

    public static final ScalarShape<Byte> I8 = new ScalarShape<>("i8", String::valueOf, s -> Byte.parseByte(signed(s)));
    public static final ScalarShape<Short> I16 = new ScalarShape<>("i16", String::valueOf, s -> Short.parseShort(signed(s)));
    public static final ScalarShape<Integer> I32 = new ScalarShape<>("i32", String::valueOf, s -> Integer.parseInt(signed(s)));
    public static final ScalarShape<Long> I64 = new ScalarShape<>("i64", String::valueOf, s -> Long.parseLong(signed(s)));
    public static final ScalarShape<BigInteger> I128 = new ScalarShape<>("i128",
            v -> checkRange(v, I128_MIN, I128_MAX).toString(),
            s -> checkRange(new BigInteger(signed(s)), I128_MIN, I128_MAX));

    public static final ScalarShape<Integer> U8 = new ScalarShape<>("u8",
            v -> String.valueOf(checkRange(v, 0xFF)),
            s -> checkRange(Integer.parseInt(unsigned(s)), 0xFF));
    public static final ScalarShape<Integer> U16 = new ScalarShape<>("u16",
            v -> String.valueOf(checkRange(v, 0xFFFF)),
            s -> checkRange(Integer.parseInt(unsigned(s)), 0xFFFF));
    public static final ScalarShape<Long> U32 = new ScalarShape<>("u32",
            v -> String.valueOf(checkRange(v, 0xFFFF_FFFFL)),
            s -> checkRange(Long.parseLong(unsigned(s)), 0xFFFF_FFFFL));
    public static final ScalarShape<Long> U64 = new ScalarShape<>("u64", Long::toUnsignedString,
            s -> Long.parseUnsignedLong(unsigned(s)));
    public static final ScalarShape<BigInteger> U128 = new ScalarShape<>("u128",
            v -> checkRange(v, BigInteger.ZERO, U128_MAX).toString(),
            s -> checkRange(new BigInteger(unsigned(s)), BigInteger.ZERO, U128_MAX));

    public static final ScalarShape<Float> F32 = new ScalarShape<>("f32", String::valueOf, s -> Float.parseFloat(floatLiteral(s)));
    public static final ScalarShape<Double> F64 = new ScalarShape<>("f64", String::valueOf, s -> Double.parseDouble(floatLiteral(s)));

    public static final ScalarShape<Character> CHAR = new ScalarShape<>("char", String::valueOf, Scalars::parseChar);
    public static final ScalarShape<String> STRING = new ScalarShape<>("string", v -> v, s -> s);

    /**
     * Standard base64 (RFC 4648), no line wrapping. Unpadded input is accepted.
     */
    public static final ScalarShape<byte[]> BYTES = new ScalarShape<>("bytes",
            v -> Base64.getEncoder().withoutPadding().encodeToString(v),
            s -> Base64.getDecoder().decode(s));

    /**
     * Unit enum constants, written by {@link Enum#name()}.
     */
    public static <E extends Enum<E>> ScalarShape<E> enumOf(Class<E> type) {
        Objects.requireNonNull(type, "type");
        return new ScalarShape<>(type.getSimpleName(), Enum::name, s -> Enum.valueOf(type, s));
    }

    /**
     * Caller-defined scalar.
     *
     * @param name type name used in error messages
     */
    public static <T> ScalarShape<T> custom(String name, ScalarShape.Formatter<T> formatter, ScalarShape.Parser<T> parser) {
        return new ScalarShape<>(name, formatter, parser);
    }

    private static Boolean parseBool(String s) {
        if ("true".equals(s)) return Boolean.TRUE;
        if ("false".equals(s)) return Boolean.FALSE;
        throw new IllegalArgumentException("provided string was not `true` or `false`: \"" + s + "\"");
    }

    private static Character parseChar(String s) {
        if (s.length() != 1) {
            throw new IllegalArgumentException("expected exactly one character, got " + s.length());
        }
        return s.charAt(0);
    }

    private static String signed(String s) {
        if (!SIGNED.matcher(s).matches()) {
            throw new NumberFormatException("For input string: \"" + s + "\"");
        }
        return s;
    }

    private static String unsigned(String s) {
        if (!UNSIGNED.matcher(s).matches()) {
            throw new NumberFormatException("For input string: \"" + s + "\"");
        }
        return s;
    }

    // returns the literal in the spelling Float/Double.parseXxx expect
    private static String floatLiteral(String s) {
        if (DECIMAL.matcher(s).matches()) {
            return s;
        }
        Matcher m = NON_FINITE.matcher(s);
        if (!m.matches()) {
            throw new NumberFormatException("invalid float literal: \"" + s + "\"");
        }
        if (m.group(2).equalsIgnoreCase("nan")) {
            return "NaN";
        }
        return "-".equals(m.group(1)) ? "-Infinity" : "Infinity";
    }

    private static int checkRange(int v, int max) {
        if (v < 0 || v > max) {
            throw new NumberFormatException("Value out of range. Value:\"" + v + "\" Radix:10");
        }
        return v;
    }

    private static long checkRange(long v, long max) {
        if (v < 0 || v > max) {
            throw new NumberFormatException("Value out of range. Value:\"" + v + "\" Radix:10");
        }
        return v;
    }

    private static BigInteger checkRange(BigInteger v, BigInteger min, BigInteger max) {
        if (v.compareTo(min) < 0 || v.compareTo(max) > 0) {
            throw new NumberFormatException("Value out of range. Value:\"" + v + "\" Radix:10");
        }
        return v;
    }
}
