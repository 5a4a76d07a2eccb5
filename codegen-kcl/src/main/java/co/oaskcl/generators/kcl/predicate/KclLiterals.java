package co.oaskcl.generators.kcl.predicate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

/** Renders JSON values as KCL literals. */
public final class KclLiterals {

    private KclLiterals() {
    }

    public static String render(Object value) {
        if (value == null) return "None";
        if (value instanceof Boolean b) return b ? "True" : "False";
        if (value instanceof String s) return string(s);
        if (value instanceof Number n) return number(n);
        if (value instanceof Collection<?> c) {
            StringBuilder out = new StringBuilder("[");
            Iterator<?> it = c.iterator();
            while (it.hasNext()) {
                out.append(render(it.next()));
                if (it.hasNext()) out.append(", ");
            }
            return out.append(']').toString();
        }
        if (value instanceof Map<?, ?> m) {
            StringBuilder out = new StringBuilder("{");
            Iterator<? extends Map.Entry<?, ?>> it = m.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> e = it.next();
                out.append(string(String.valueOf(e.getKey()))).append(": ").append(render(e.getValue()));
                if (it.hasNext()) out.append(", ");
            }
            return out.append('}').toString();
        }
        return string(value.toString());
    }

    /** A double-quoted string literal. */
    public static String string(String s) {
        StringBuilder out = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                // braces would start string interpolation
                case '$' -> out.append(i + 1 < s.length() && s.charAt(i + 1) == '{' ? "\\$" : "$");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }

    public static String number(Number n) {
        BigDecimal d = toBigDecimal(n);
        if (d.signum() == 0) return "0";
        BigDecimal stripped = d.stripTrailingZeros();
        if (stripped.scale() <= 0 && (n instanceof Integer || n instanceof Long || n instanceof BigInteger
            || d.scale() <= 0)) {
            return stripped.toBigIntegerExact().toString();
        }
        String plain = stripped.toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }

    public static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal d) return d;
        if (n instanceof BigInteger i) return new BigDecimal(i);
        if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
        return BigDecimal.valueOf(n.longValue());
    }

    /** True when {@code n} has no fractional part. */
    public static boolean isIntegral(Number n) {
        BigDecimal d = toBigDecimal(n);
        return d.signum() == 0 || d.stripTrailingZeros().scale() <= 0;
    }
}
