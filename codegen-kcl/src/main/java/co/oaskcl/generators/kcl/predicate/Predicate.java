package co.oaskcl.generators.kcl.predicate;

import co.oaskcl.generators.kcl.format.FormatTemplate;
import co.oaskcl.generators.kcl.regex.TranslatedPattern;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A validation predicate over values addressed by {@link ValueRef}s.
 *
 * <p>Predicates are immutable trees. {@link KclRenderer} turns them into KCL expressions; the
 * factory methods below apply the simplifications every consumer wants (flattening nested
 * conjunctions, dropping {@code True} terms, folding negated presence tests).
 */
public sealed interface Predicate {

    Predicate TRUE = new Constant(true);
    Predicate FALSE = new Constant(false);

    <R> R accept(Visitor<R> visitor);

    // ===== Leaves =====

    record Constant(boolean value) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitConstant(this);
        }
    }

    /** The value is None or missing. */
    record Absent(ValueRef ref) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitAbsent(this);
        }
    }

    /** The value is present and not None. */
    record Present(ValueRef ref) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitPresent(this);
        }
    }

    /** The value has one of the given JSON types. */
    record TypeIs(ValueRef ref, Set<JsonType> types) implements Predicate {
        public TypeIs {
            types = Set.copyOf(types);
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitTypeIs(this);
        }
    }

    /** {@code value op bound}, or {@code len(value) op bound} for {@link Measure#LENGTH}. */
    record Compare(ValueRef ref, Measure measure, Comparison op, BigDecimal bound) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitCompare(this);
        }
    }

    /** Exact remainder test when {@code integral}, epsilon-tolerant quotient test otherwise. */
    record MultipleOf(ValueRef ref, BigDecimal divisor, boolean integral) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitMultipleOf(this);
        }
    }

    /** Unanchored search, as JSON Schema's {@code pattern} keyword. */
    record Matches(ValueRef ref, TranslatedPattern pattern) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitMatches(this);
        }
    }

    record InSet(ValueRef ref, List<Object> values) implements Predicate {
        public InSet {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitInSet(this);
        }
    }

    record EqualsValue(ValueRef ref, Object value) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitEqualsValue(this);
        }
    }

    /** No two items of the list serialize to the same text. */
    record UniqueItems(ValueRef ref) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitUniqueItems(this);
        }
    }

    record FormatValid(ValueRef ref, FormatTemplate format) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitFormatValid(this);
        }
    }

    // ===== Quantifiers =====

    /** {@code body} holds for every item of the list, bound to {@code variable}. */
    record AllItems(ValueRef ref, String variable, Predicate body) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitAllItems(this);
        }
    }

    /** {@code body} holds for every entry of the dict, bound to {@code keyVariable}/{@code valueVariable}. */
    record AllEntries(ValueRef ref, String keyVariable, String valueVariable, Predicate body) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitAllEntries(this);
        }
    }

    // ===== Connectives =====

    record And(List<Predicate> terms) implements Predicate {
        public And {
            terms = List.copyOf(terms);
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitAnd(this);
        }
    }

    record Or(List<Predicate> terms) implements Predicate {
        public Or {
            terms = List.copyOf(terms);
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitOr(this);
        }
    }

    record Not(Predicate term) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitNot(this);
        }
    }

    /** {@code then} when {@code condition} holds, {@code otherwise} when it does not. */
    record Conditional(Predicate condition, Predicate then, Predicate otherwise) implements Predicate {
        public <R> R accept(Visitor<R> v) {
            return v.visitConditional(this);
        }
    }

    /** Exactly {@code expected} of the terms hold. */
    record CountTrue(List<Predicate> terms, int expected) implements Predicate {
        public CountTrue {
            terms = List.copyOf(terms);
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitCountTrue(this);
        }
    }

    /**
     * A call of the named helper on {@code argument}. The helper's body is written over
     * {@link #PARAMETER}.
     */
    record HelperCall(String name, ValueRef argument, Predicate body) implements Predicate {
        public static final String PARAMETER = "v";

        public <R> R accept(Visitor<R> v) {
            return v.visitHelperCall(this);
        }
    }

    enum Measure { VALUE, LENGTH }

    enum Comparison {
        GE(">="), GT(">"), LE("<="), LT("<");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum JsonType { OBJECT, ARRAY, STRING, NUMBER, INTEGER, BOOLEAN, NULL }

    interface Visitor<R> {
        R visitConstant(Constant p);

        R visitAbsent(Absent p);

        R visitPresent(Present p);

        R visitTypeIs(TypeIs p);

        R visitCompare(Compare p);

        R visitMultipleOf(MultipleOf p);

        R visitMatches(Matches p);

        R visitInSet(InSet p);

        R visitEqualsValue(EqualsValue p);

        R visitUniqueItems(UniqueItems p);

        R visitFormatValid(FormatValid p);

        R visitAllItems(AllItems p);

        R visitAllEntries(AllEntries p);

        R visitAnd(And p);

        R visitOr(Or p);

        R visitNot(Not p);

        R visitConditional(Conditional p);

        R visitCountTrue(CountTrue p);

        R visitHelperCall(HelperCall p);
    }

    // ===== Factories =====

    static Predicate and(List<Predicate> terms) {
        List<Predicate> flat = new ArrayList<>();
        for (Predicate t : terms) {
            if (t instanceof Constant c) {
                if (!c.value()) return FALSE;
            } else if (t instanceof And a) {
                flat.addAll(a.terms());
            } else {
                flat.add(t);
            }
        }
        if (flat.isEmpty()) return TRUE;
        return flat.size() == 1 ? flat.get(0) : new And(flat);
    }

    static Predicate and(Predicate... terms) {
        return and(List.of(terms));
    }

    static Predicate or(List<Predicate> terms) {
        List<Predicate> flat = new ArrayList<>();
        for (Predicate t : terms) {
            if (t instanceof Constant c) {
                if (c.value()) return TRUE;
            } else if (t instanceof Or o) {
                flat.addAll(o.terms());
            } else {
                flat.add(t);
            }
        }
        if (flat.isEmpty()) return FALSE;
        return flat.size() == 1 ? flat.get(0) : new Or(flat);
    }

    static Predicate or(Predicate... terms) {
        return or(List.of(terms));
    }

    static Predicate not(Predicate term) {
        if (term instanceof Constant c) return c.value() ? FALSE : TRUE;
        if (term instanceof Present p) return new Absent(p.ref());
        if (term instanceof Absent a) return new Present(a.ref());
        if (term instanceof Not n) return n.term();
        return new Not(term);
    }

    /** {@code then} must hold whenever {@code condition} does. */
    static Predicate implies(Predicate condition, Predicate then) {
        return conditional(condition, then, TRUE);
    }

    static Predicate conditional(Predicate condition, Predicate then, Predicate otherwise) {
        if (condition instanceof Constant c) return c.value() ? then : otherwise;
        if (then.equals(TRUE) && otherwise.equals(TRUE)) return TRUE;
        return new Conditional(condition, then, otherwise);
    }

    /** Vacuously true when the value at {@code ref} is absent. */
    static Predicate optional(ValueRef ref, Predicate check) {
        if (check instanceof Constant c && c.value()) return TRUE;
        return or(new Absent(ref), check);
    }
}
