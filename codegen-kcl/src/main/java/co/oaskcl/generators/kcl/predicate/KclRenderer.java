package co.oaskcl.generators.kcl.predicate;

import co.oaskcl.generators.kcl.format.FormatRegistry;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Renders predicates as KCL expressions.
 *
 * <p>One renderer is used per generated schema: it accumulates the modules the rendered
 * expressions need and the helper lambdas they call, so both can be emitted with the schema.
 */
public final class KclRenderer implements Predicate.Visitor<String> {

    private static final String EPSILON = "1e-10";
    private static final String JSON = "json";

    private final Set<String> imports = new TreeSet<>();
    private final Map<String, Predicate.HelperCall> helpers = new LinkedHashMap<>();

    public String render(Predicate p) {
        return p.accept(this);
    }

    /** {@code <expr>, "<message>"} as written in a check block. */
    public String renderCheck(Check check) {
        return render(check.predicate()) + ", " + KclLiterals.string(check.message());
    }

    public Set<String> imports() {
        return imports;
    }

    /**
     * Definitions of every helper called so far, including helpers called from other helpers'
     * bodies, each as a private lambda attribute.
     */
    public List<String> helperDefinitions(String indent) {
        List<String> out = new ArrayList<>();
        List<String> done = new ArrayList<>();
        // bodies may register further helpers while they render
        while (done.size() < helpers.size()) {
            List<Predicate.HelperCall> pending = new ArrayList<>();
            for (Map.Entry<String, Predicate.HelperCall> e : helpers.entrySet()) {
                if (!done.contains(e.getKey())) pending.add(e.getValue());
            }
            for (Predicate.HelperCall h : pending) {
                done.add(h.name());
                String body = render(h.body());
                out.add(indent + h.name() + " = lambda " + Predicate.HelperCall.PARAMETER + ": any -> bool {\n"
                    + indent + "    " + body + "\n"
                    + indent + "}");
            }
        }
        return out;
    }

    // ===== Leaves =====

    @Override
    public String visitConstant(Predicate.Constant p) {
        return p.value() ? "True" : "False";
    }

    @Override
    public String visitAbsent(Predicate.Absent p) {
        return p.ref().render() + " == None";
    }

    @Override
    public String visitPresent(Predicate.Present p) {
        return p.ref().render() + " != None";
    }

    @Override
    public String visitTypeIs(Predicate.TypeIs p) {
        String ref = p.ref().render();
        Set<String> names = new TreeSet<>();
        Set<Predicate.JsonType> types = p.types().isEmpty() ? EnumSet.noneOf(Predicate.JsonType.class) : EnumSet.copyOf(p.types());
        for (Predicate.JsonType t : types) {
            switch (t) {
                case OBJECT -> names.add("dict");
                case ARRAY -> names.add("list");
                case STRING -> names.add("str");
                case INTEGER -> names.add("int");
                case NUMBER -> {
                    names.add("int");
                    names.add("float");
                }
                case BOOLEAN -> names.add("bool");
                case NULL -> {
                    // None has no typeof name; handled below
                }
            }
        }
        String typeTest;
        if (names.isEmpty()) {
            typeTest = null;
        } else if (names.size() == 1) {
            typeTest = "typeof(" + ref + ") == " + KclLiterals.string(names.iterator().next());
        } else {
            typeTest = "typeof(" + ref + ") in " + KclLiterals.render(new ArrayList<>(names));
        }
        if (!types.contains(Predicate.JsonType.NULL)) return typeTest == null ? "False" : typeTest;
        return typeTest == null ? ref + " == None" : ref + " == None or " + typeTest;
    }

    @Override
    public String visitCompare(Predicate.Compare p) {
        String operand = p.measure() == Predicate.Measure.LENGTH ? "len(" + p.ref().render() + ")" : p.ref().render();
        return operand + " " + p.op().symbol() + " " + KclLiterals.number(p.bound());
    }

    @Override
    public String visitMultipleOf(Predicate.MultipleOf p) {
        String ref = p.ref().render();
        String divisor = KclLiterals.number(p.divisor());
        if (p.integral()) {
            return ref + " % " + divisor + " == 0";
        }
        String quotient = ref + " / " + divisor;
        return "abs(" + quotient + " - round(" + quotient + ")) < " + EPSILON;
    }

    @Override
    public String visitMatches(Predicate.Matches p) {
        imports.add(FormatRegistry.REGEX);
        return "regex.search(" + p.ref().render() + ", " + p.pattern().literal() + ")";
    }

    @Override
    public String visitInSet(Predicate.InSet p) {
        return p.ref().render() + " in " + KclLiterals.render(p.values());
    }

    @Override
    public String visitEqualsValue(Predicate.EqualsValue p) {
        return p.ref().render() + " == " + KclLiterals.render(p.value());
    }

    @Override
    public String visitUniqueItems(Predicate.UniqueItems p) {
        // keyed by the JSON encoding so that 1 and "1" stay distinct
        imports.add(JSON);
        String ref = p.ref().render();
        return "len(" + ref + ") == len({json.encode(e): None for e in " + ref + "})";
    }

    @Override
    public String visitFormatValid(Predicate.FormatValid p) {
        imports.addAll(p.format().imports());
        return p.format().predicate(p.ref().render());
    }

    // ===== Quantifiers =====

    @Override
    public String visitAllItems(Predicate.AllItems p) {
        return "all " + p.variable() + " in " + p.ref().render() + " { " + render(p.body()) + " }";
    }

    @Override
    public String visitAllEntries(Predicate.AllEntries p) {
        return "all " + p.keyVariable() + ", " + p.valueVariable() + " in " + p.ref().render()
            + " { " + render(p.body()) + " }";
    }

    // ===== Connectives =====

    @Override
    public String visitAnd(Predicate.And p) {
        List<String> parts = new ArrayList<>();
        for (Predicate t : p.terms()) {
            parts.add(t instanceof Predicate.Or || t instanceof Predicate.And || isCompound(t) ? "(" + render(t) + ")" : render(t));
        }
        return String.join(" and ", parts);
    }

    @Override
    public String visitOr(Predicate.Or p) {
        List<String> parts = new ArrayList<>();
        for (Predicate t : p.terms()) {
            parts.add(t instanceof Predicate.And || t instanceof Predicate.Or || isCompound(t) ? "(" + render(t) + ")" : render(t));
        }
        return String.join(" or ", parts);
    }

    @Override
    public String visitNot(Predicate.Not p) {
        Predicate t = p.term();
        boolean atomic = t instanceof Predicate.HelperCall || t instanceof Predicate.Constant;
        return atomic ? "not " + render(t) : "not (" + render(t) + ")";
    }

    @Override
    public String visitConditional(Predicate.Conditional p) {
        if (p.otherwise().equals(Predicate.TRUE)) {
            return "not " + wrap(p.condition()) + " or " + wrap(p.then());
        }
        return wrap(p.then()) + " if " + wrap(p.condition()) + " else " + wrap(p.otherwise());
    }

    @Override
    public String visitCountTrue(Predicate.CountTrue p) {
        List<String> terms = new ArrayList<>();
        for (Predicate t : p.terms()) terms.add(render(t));
        return "len([ok for ok in [" + String.join(", ", terms) + "] if ok]) == " + p.expected();
    }

    @Override
    public String visitHelperCall(Predicate.HelperCall p) {
        helpers.putIfAbsent(p.name(), p);
        return p.name() + "(" + p.argument().render() + ")";
    }

    private String wrap(Predicate p) {
        boolean atomic = p instanceof Predicate.HelperCall || p instanceof Predicate.Constant;
        return atomic ? render(p) : "(" + render(p) + ")";
    }

    /** Expressions that bind looser than {@code and}/{@code or} or contain them at top level. */
    private static boolean isCompound(Predicate p) {
        return p instanceof Predicate.Conditional
            || p instanceof Predicate.FormatValid
            || (p instanceof Predicate.TypeIs t && t.types().contains(Predicate.JsonType.NULL));
    }
}
