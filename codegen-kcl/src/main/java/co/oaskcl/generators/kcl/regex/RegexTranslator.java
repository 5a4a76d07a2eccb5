package co.oaskcl.generators.kcl.regex;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translates ECMA-262 patterns, as used by JSON Schema, into the RE2 dialect of the KCL
 * {@code regex} module.
 *
 * <p>Rewrites, in scan order:
 * <pre>
 *   \d  \w              → [0-9]  [a-zA-Z0-9_]   (bare ranges inside a class)
 *   \p{Letter} \p{L}    → \pL, likewise Number, Punctuation, Symbol, Mark, Separator
 *   \p{Lu}              → \p{Lu}
 *   \\uXXXX \\u{X}        → \x{XXXX}
 *   (?&lt;name&gt;            → (?P&lt;name&gt;
 *   lookaround groups   → dropped, with a warning
 *   backreferences      → (?:.*), with a warning
 * </pre>
 * Dropping a construct only ever widens the set of accepted strings.
 */
public final class RegexTranslator {

    private static final String DIGIT = "0-9";
    private static final String WORD = "a-zA-Z0-9_";

    private static final Map<String, String> CATEGORIES = Map.ofEntries(
        Map.entry("Letter", "L"),
        Map.entry("Lowercase_Letter", "Ll"),
        Map.entry("Uppercase_Letter", "Lu"),
        Map.entry("Titlecase_Letter", "Lt"),
        Map.entry("Modifier_Letter", "Lm"),
        Map.entry("Other_Letter", "Lo"),
        Map.entry("Number", "N"),
        Map.entry("Decimal_Number", "Nd"),
        Map.entry("Letter_Number", "Nl"),
        Map.entry("Other_Number", "No"),
        Map.entry("Punctuation", "P"),
        Map.entry("Symbol", "S"),
        Map.entry("Mark", "M"),
        Map.entry("Separator", "Z"),
        Map.entry("Space_Separator", "Zs"),
        Map.entry("Other", "C"),
        Map.entry("Control", "Cc")
    );

    private RegexTranslator() {
    }

    public static TranslatedPattern translate(String source) {
        if (source == null || source.isEmpty()) {
            return new TranslatedPattern(source == null ? "" : source, "", List.of());
        }
        Scanner s = new Scanner(source);
        s.run();
        return new TranslatedPattern(source, s.out.toString(), s.warnings);
    }

    private static final class Scanner {
        private final String in;
        private final StringBuilder out = new StringBuilder();
        private final List<String> warnings = new ArrayList<>();
        private int pos;
        private boolean inClass;

        Scanner(String in) {
            this.in = in;
        }

        void run() {
            while (pos < in.length()) {
                char c = in.charAt(pos);
                if (c == '\\') {
                    escape();
                } else if (inClass) {
                    if (c == ']') inClass = false;
                    out.append(c);
                    pos++;
                } else if (c == '[') {
                    inClass = true;
                    out.append(c);
                    pos++;
                    // a leading ']' (after an optional '^') is a literal
                    if (pos < in.length() && in.charAt(pos) == '^') out.append(in.charAt(pos++));
                    if (pos < in.length() && in.charAt(pos) == ']') {
                        out.append("\\]");
                        pos++;
                    }
                } else if (c == '(') {
                    group();
                } else {
                    out.append(c);
                    pos++;
                }
            }
        }

        private void group() {
            if (in.startsWith("(?=", pos) || in.startsWith("(?!", pos)
                || in.startsWith("(?<=", pos) || in.startsWith("(?<!", pos)) {
                int end = closingParen(pos);
                String construct = in.substring(pos, end);
                warnings.add("lookaround " + construct + " is not supported and was dropped");
                pos = end;
                return;
            }
            if (in.startsWith("(?<", pos)) {
                out.append("(?P<");
                pos += 3;
                return;
            }
            out.append('(');
            pos++;
        }

        private void escape() {
            if (pos + 1 >= in.length()) {
                // trailing backslash: keep it escaped so the result still compiles
                out.append("\\\\");
                pos++;
                return;
            }
            char e = in.charAt(pos + 1);
            switch (e) {
                case 'd' -> {
                    out.append(inClass ? DIGIT : "[" + DIGIT + "]");
                    pos += 2;
                }
                case 'w' -> {
                    out.append(inClass ? WORD : "[" + WORD + "]");
                    pos += 2;
                }
                case 'D' -> {
                    out.append(inClass ? "\\D" : "[^" + DIGIT + "]");
                    pos += 2;
                }
                case 'W' -> {
                    out.append(inClass ? "\\W" : "[^" + WORD + "]");
                    pos += 2;
                }
                case 'p', 'P' -> unicodeProperty(e);
                case 'u' -> unicodeEscape();
                case 'k' -> {
                    if (!inClass && in.startsWith("<", pos + 2) && in.indexOf('>', pos) > 0) {
                        int end = in.indexOf('>', pos) + 1;
                        backReference(in.substring(pos, end), end);
                    } else {
                        out.append("\\k");
                        pos += 2;
                    }
                }
                default -> {
                    if (!inClass && e >= '1' && e <= '9') {
                        int end = pos + 2;
                        while (end < in.length() && Character.isDigit(in.charAt(end))) end++;
                        backReference(in.substring(pos, end), end);
                    } else {
                        out.append('\\').append(e);
                        pos += 2;
                    }
                }
            }
        }

        private void unicodeProperty(char p) {
            int open = pos + 2;
            if (open >= in.length() || in.charAt(open) != '{') {
                // already in single-letter form, e.g. \pL
                out.append('\\').append(p);
                pos += 2;
                return;
            }
            int close = in.indexOf('}', open);
            if (close < 0) {
                out.append('\\').append(p);
                pos += 2;
                return;
            }
            String name = in.substring(open + 1, close);
            int eq = name.indexOf('=');
            if (eq >= 0) {
                // Script=Greek, sc=Greek, General_Category=Letter
                name = name.substring(eq + 1);
            }
            String code = CATEGORIES.getOrDefault(name, name);
            out.append('\\').append(p);
            if (code.length() == 1) {
                out.append(code);
            } else {
                out.append('{').append(code).append('}');
            }
            pos = close + 1;
        }

        private void unicodeEscape() {
            int start = pos + 2;
            if (start < in.length() && in.charAt(start) == '{') {
                int close = in.indexOf('}', start);
                if (close > start) {
                    out.append("\\x{").append(in, start + 1, close).append('}');
                    pos = close + 1;
                    return;
                }
            }
            if (start + 4 <= in.length() && isHex(in.substring(start, start + 4))) {
                out.append("\\x{").append(in, start, start + 4).append('}');
                pos = start + 4;
                return;
            }
            out.append("\\u");
            pos += 2;
        }

        private void backReference(String construct, int end) {
            warnings.add("backreference " + construct + " is not supported and was widened to any text");
            out.append("(?:.*)");
            pos = end;
        }

        /** Index just past the parenthesis closing the group opened at {@code start}. */
        private int closingParen(int start) {
            int depth = 0;
            boolean cls = false;
            for (int i = start; i < in.length(); i++) {
                char c = in.charAt(i);
                if (c == '\\') {
                    i++;
                } else if (cls) {
                    if (c == ']') cls = false;
                } else if (c == '[') {
                    cls = true;
                } else if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                    if (depth == 0) return i + 1;
                }
            }
            return in.length();
        }

        private static boolean isHex(String s) {
            for (int i = 0; i < s.length(); i++) {
                if (Character.digit(s.charAt(i), 16) < 0) return false;
            }
            return true;
        }
    }
}
