package cinder.commands;

import cinder.db.ByteString;
import cinder.protocol.Command;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Argument parsing shared by the handlers.
 */
public final class Args {
    private Args() { }

    public static ByteString key(Command command, int index) {
        return ByteString.copyOf(command.arg(index));
    }

    /** Keys at {@code from}, {@code from + step}, ... up to the last argument. */
    public static List<ByteString> keys(Command command, int from, int step) {
        List<ByteString> keys = new ArrayList<>();
        for (int i = from; i < command.argCount(); i += step) {
            keys.add(ByteString.copyOf(command.arg(i)));
        }
        return keys;
    }

    public static String upper(byte[] arg) {
        return new String(arg, StandardCharsets.UTF_8).toUpperCase(Locale.ROOT);
    }

    /**
     * Strict signed 64-bit decimal: optional '-', digits only, no spaces, no '+', no leading zeros.
     */
    public static long parseLong(byte[] raw) {
        int len = raw.length;
        if (len == 0 || len > 20) throw new FormatException(FormatException.NOT_AN_INTEGER);
        int i = 0;
        boolean negative = false;
        if (raw[0] == '-') {
            negative = true;
            i = 1;
            if (len == 1) throw new FormatException(FormatException.NOT_AN_INTEGER);
        }
        if (raw[i] == '0' && len > i + 1) throw new FormatException(FormatException.NOT_AN_INTEGER);
        if (negative && raw[i] == '0') throw new FormatException(FormatException.NOT_AN_INTEGER);
        long value = 0;
        for (; i < len; i++) {
            byte b = raw[i];
            if (b < '0' || b > '9') throw new FormatException(FormatException.NOT_AN_INTEGER);
            int digit = b - '0';
            // accumulate negatively so Long.MIN_VALUE fits
            if (value < (Long.MIN_VALUE + digit) / 10) throw new FormatException(FormatException.NOT_AN_INTEGER);
            value = value * 10 - digit;
        }
        if (!negative) {
            if (value == Long.MIN_VALUE) throw new FormatException(FormatException.NOT_AN_INTEGER);
            value = -value;
        }
        return value;
    }

    /**
     * Float argument. Accepts {@code inf}, {@code +inf} and {@code -inf}; NaN is rejected.
     */
    public static double parseDouble(byte[] raw) {
        String s = new String(raw, StandardCharsets.UTF_8);
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.equals("inf") || lower.equals("+inf") || lower.equals("infinity") || lower.equals("+infinity")) {
            return Double.POSITIVE_INFINITY;
        }
        if (lower.equals("-inf") || lower.equals("-infinity")) {
            return Double.NEGATIVE_INFINITY;
        }
        if (s.isEmpty() || Character.isWhitespace(s.charAt(0)) || Character.isWhitespace(s.charAt(s.length() - 1))) {
            throw new FormatException(FormatException.NOT_A_FLOAT);
        }
        double d;
        try {
            d = Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new FormatException(FormatException.NOT_A_FLOAT);
        }
        // Double.parseDouble also takes "NaN", "1d" and "0x1p3"
        if (Double.isNaN(d) || !isPlainDecimal(s)) throw new FormatException(FormatException.NOT_A_FLOAT);
        return d;
    }

    private static boolean isPlainDecimal(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!(c >= '0' && c <= '9') && c != '.' && c != '-' && c != '+' && c != 'e' && c != 'E') return false;
        }
        return true;
    }

    /**
     * Score text: integral values without a fraction, infinities as {@code inf} / {@code -inf},
     * anything else as {@code %.17g} with trailing zeros dropped (so {@code 1.5e20} reads {@code 1.5e+20}).
     */
    public static String formatDouble(double d) {
        if (d == Double.POSITIVE_INFINITY) return "inf";
        if (d == Double.NEGATIVE_INFINITY) return "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e17) return Long.toString((long) d);
        String s = String.format(Locale.ROOT, "%.17g", d);
        int e = s.indexOf('e');
        String mantissa = e < 0 ? s : s.substring(0, e);
        String exponent = e < 0 ? "" : s.substring(e);
        if (mantissa.indexOf('.') >= 0) {
            int end = mantissa.length();
            while (mantissa.charAt(end - 1) == '0') end--;
            if (mantissa.charAt(end - 1) == '.') end--;
            mantissa = mantissa.substring(0, end);
        }
        return mantissa + exponent;
    }

    /**
     * Absolute expiry instant in milliseconds for an expire-style argument.
     *
     * @param now       current clock reading
     * @param amount    the raw number given by the client
     * @param millis    whether {@code amount} is in milliseconds rather than seconds
     * @param absolute  whether {@code amount} is a unix time rather than a delay
     * @param command   lower-case verb for the error message
     */
    public static long expireAt(long now, long amount, boolean millis, boolean absolute, String command) {
        try {
            long ms = millis ? amount : Math.multiplyExact(amount, 1000L);
            return absolute ? ms : Math.addExact(now, ms);
        } catch (ArithmeticException e) {
            throw invalidExpire(command);
        }
    }

    public static CommandException invalidExpire(String command) {
        return new CommandException("invalid expire time in '" + command + "' command");
    }

    public static CommandException wrongArity(String command) {
        return new CommandException("wrong number of arguments for '" + command.toLowerCase(Locale.ROOT) + "' command");
    }

    public static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] bytes(long n) {
        return Long.toString(n).getBytes(StandardCharsets.US_ASCII);
    }
}
