package co.oaskcl.generators.kcl;

import co.oaskcl.core.Constraint;
import co.oaskcl.core.Diagnostic;
import co.oaskcl.core.NodeType;
import co.oaskcl.core.model.AnyNode;
import co.oaskcl.core.model.ArrayNode;
import co.oaskcl.core.model.CompositionNode;
import co.oaskcl.core.model.ConditionalNode;
import co.oaskcl.core.model.NumericNode;
import co.oaskcl.core.model.ObjectNode;
import co.oaskcl.core.model.ReferenceNode;
import co.oaskcl.core.model.ScalarNode;
import co.oaskcl.core.model.SchemaNode;
import co.oaskcl.core.model.SchemaNodeVisitor;
import co.oaskcl.core.model.StringNode;
import co.oaskcl.core.naming.Identifiers;
import co.oaskcl.generators.kcl.format.FormatRegistry;
import co.oaskcl.generators.kcl.predicate.Check;
import co.oaskcl.generators.kcl.predicate.KclLiterals;
import co.oaskcl.generators.kcl.predicate.Predicate;
import co.oaskcl.generators.kcl.predicate.Predicate.Comparison;
import co.oaskcl.generators.kcl.predicate.Predicate.JsonType;
import co.oaskcl.generators.kcl.predicate.Predicate.Measure;
import co.oaskcl.generators.kcl.predicate.ValueRef;
import co.oaskcl.generators.kcl.regex.RegexTranslator;
import co.oaskcl.generators.kcl.regex.TranslatedPattern;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Turns IR constraints into predicates.
 *
 * <ul>
 *   <li>{@link #fieldChecks} gives the check-block lines for one attribute of a generated schema,
 *       short-circuited when the attribute is optional;</li>
 *   <li>{@link #matches} gives a single predicate that holds exactly when a value satisfies a
 *       node, used inside composition helpers and list/dict quantifiers.</li>
 * </ul>
 * Composition semantics live in {@link CompositionHandler}.
 */
final class ConstraintCompiler {

    private final GenerationContext ctx;
    private final TypeResolver types;
    private final CompositionHandler compositions;
    private final Deque<String> resolving = new ArrayDeque<>();
    private final Map<String, TranslatedPattern> patterns = new HashMap<>();
    private final Map<String, Integer> variables = new HashMap<>();

    ConstraintCompiler(GenerationContext ctx, TypeResolver types) {
        this.ctx = ctx;
        this.types = types;
        this.compositions = new CompositionHandler(this);
    }

    // ===== Attribute checks =====

    /**
     * Checks for the value at {@code ref}. Without {@code required}, every predicate is guarded so
     * that an absent value passes.
     */
    List<Check> fieldChecks(SchemaNode node, ValueRef ref, boolean required) {
        List<Check> out = new ArrayList<>();
        if (required) {
            out.add(new Check(new Predicate.Present(ref), ref.label() + " is required"));
        }
        for (Check c : inlineChecks(node, ref)) {
            out.add(required ? c : new Check(Predicate.optional(ref, c.predicate()), c.message()));
        }
        return out;
    }

    /** Unguarded checks a parent carries for a child that has no schema of its own. */
    List<Check> inlineChecks(SchemaNode node, ValueRef ref) {
        if (types.isSelfValidating(node) && !node.typeUnion()) {
            return List.of();
        }
        if (node instanceof ReferenceNode r) {
            return withResolving(r, () -> inlineChecks(ctx.resolve(r), ref), List.of());
        }
        if (node instanceof CompositionNode || node instanceof ConditionalNode || node.typeUnion()) {
            Predicate p = matches(node, ref);
            if (p.equals(Predicate.TRUE)) return List.of();
            String message = node instanceof CompositionNode c
                ? CompositionHandler.message(c, ref.label())
                : ref.label() + " must satisfy " + node.schemaName();
            return List.of(new Check(p, message));
        }

        List<Check> out = new ArrayList<>(valueChecks(node, ref));
        if (node instanceof ArrayNode a && a.items().isPresent() && !types.isSelfValidating(a.items().get())) {
            String item = nextVariable("item");
            Predicate body = matches(a.items().get(), ValueRef.variable(item));
            if (!body.equals(Predicate.TRUE)) {
                out.add(new Check(new Predicate.AllItems(ref, item, body), ref.label() + " items must satisfy " + a.items().get().schemaName()));
            }
        }
        if (node instanceof ObjectNode o && o.additionalProperties().isPresent()) {
            String key = nextVariable("key");
            String value = nextVariable("val");
            Predicate body = matches(o.additionalProperties().get(), ValueRef.variable(value));
            if (!body.equals(Predicate.TRUE)) {
                out.add(new Check(new Predicate.AllEntries(ref, key, value, body), ref.label() + " values must satisfy " + o.additionalProperties().get().schemaName()));
            }
        }
        return out;
    }

    // ===== Schema-level checks =====

    /** Check-block lines of a node that is emitted as its own schema, over the instance. */
    List<Check> hostChecks(SchemaNode node) {
        ValueRef self = ValueRef.instance();
        if (node instanceof ObjectNode o) {
            return objectChecks(o);
        }
        if (node instanceof ReferenceNode r) {
            return withResolving(r, () -> hostChecks(ctx.resolve(r)), List.of());
        }
        if (node instanceof CompositionNode c) {
            return compositions.hostChecks(c);
        }
        if (node instanceof ConditionalNode c) {
            return compositions.hostChecks(c);
        }
        Predicate p = matches(node, self);
        return p.equals(Predicate.TRUE) ? List.of() : List.of(new Check(p, "value must satisfy " + node.schemaName()));
    }

    private List<Check> objectChecks(ObjectNode o) {
        ValueRef self = ValueRef.instance();
        List<Check> out = new ArrayList<>();
        Map<String, String> attributes = attributeNames(o);
        for (Map.Entry<String, SchemaNode> p : o.properties().entrySet()) {
            ValueRef member = self.member(p.getKey(), attributes.get(p.getKey()));
            out.addAll(fieldChecks(p.getValue(), member, o.isRequired(p.getKey())));
        }
        for (String r : o.required()) {
            if (!o.properties().containsKey(r)) {
                out.add(new Check(new Predicate.Present(self.member(r, attributes.get(r))), r + " is required"));
            }
        }
        out.addAll(valueChecks(o, self));
        out.addAll(dynamicKeyChecks(o, self));
        return out;
    }

    /** Attribute names for an object's declared and required properties, unique after sanitizing. */
    static Map<String, String> attributeNames(ObjectNode o) {
        Map<String, String> out = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>();
        List<String> keys = new ArrayList<>(o.properties().keySet());
        for (String r : o.required()) {
            if (!keys.contains(r)) keys.add(r);
        }
        for (String key : keys) {
            String attr = Identifiers.sanitizeProperty(key);
            String unique = attr;
            for (int n = 2; !taken.add(unique); n++) unique = attr + "_" + n;
            out.put(key, unique);
        }
        return out;
    }

    /** patternProperties and additionalProperties over every key of the dict at {@code ref}. */
    private List<Check> dynamicKeyChecks(ObjectNode o, ValueRef ref) {
        List<Check> out = new ArrayList<>();
        for (Map.Entry<String, SchemaNode> p : o.patternProperties().entrySet()) {
            String key = nextVariable("key");
            String value = nextVariable("val");
            Predicate body = matches(p.getValue(), ValueRef.variable(value));
            if (body.equals(Predicate.TRUE)) continue;
            Predicate keyMatches = new Predicate.Matches(ValueRef.variable(key), pattern(p.getKey(), o.schemaName()));
            out.add(new Check(new Predicate.AllEntries(ref, key, value, Predicate.implies(keyMatches, body)),
                "properties matching " + p.getKey() + " must satisfy " + p.getValue().schemaName()));
        }

        if (o.additionalPropertiesForbidden() || o.additionalProperties().isPresent()) {
            String key = nextVariable("key");
            String value = nextVariable("val");
            List<Predicate> declared = new ArrayList<>();
            if (!o.properties().isEmpty()) {
                declared.add(new Predicate.InSet(ValueRef.variable(key), new ArrayList<>(o.properties().keySet())));
            }
            for (String pattern : o.patternProperties().keySet()) {
                declared.add(new Predicate.Matches(ValueRef.variable(key), pattern(pattern, o.schemaName())));
            }
            if (o.additionalPropertiesForbidden()) {
                out.add(new Check(new Predicate.AllEntries(ref, key, value, Predicate.or(declared)),
                    "no properties other than the declared ones are allowed"));
            } else {
                Predicate body = matches(o.additionalProperties().get(), ValueRef.variable(value));
                if (!body.equals(Predicate.TRUE)) {
                    declared.add(body);
                    out.add(new Check(new Predicate.AllEntries(ref, key, value, Predicate.or(declared)),
                        "additional properties must satisfy " + o.additionalProperties().get().schemaName()));
                }
            }
        }
        return out;
    }

    // ===== Keyword checks =====

    /**
     * Checks for the keywords that constrain the value itself, by the node's type. Under a type
     * union the type-specific keywords only apply to values of the node's own type.
     */
    List<Check> valueChecks(SchemaNode node, ValueRef ref) {
        return valueChecks(node, ref, node.typeUnion());
    }

    private List<Check> valueChecks(SchemaNode node, ValueRef ref, boolean guarded) {
        List<Check> typed = new ArrayList<>();
        String label = ref.label();
        if (node instanceof NumericNode n) {
            numericChecks(n, ref, label, typed);
        } else if (node instanceof StringNode s) {
            lengthCheck(node, Constraint.MIN_LENGTH, Comparison.GE, ref, label + " must be at least ", " characters long", typed);
            lengthCheck(node, Constraint.MAX_LENGTH, Comparison.LE, ref, label + " must be at most ", " characters long", typed);
            node.constraint(Constraint.PATTERN).ifPresent(p -> typed.add(new Check(
                new Predicate.Matches(ref, pattern((String) p, node.schemaName())),
                label + " must match pattern " + p)));
            if (types.formatOf(s).isEmpty()) {
                s.format().flatMap(FormatRegistry::lookup).ifPresent(f -> typed.add(new Check(
                    new Predicate.FormatValid(ref, f), label + " must be a valid " + f.format())));
            }
        } else if (node instanceof ArrayNode) {
            lengthCheck(node, Constraint.MIN_ITEMS, Comparison.GE, ref, label + " must have at least ", " items", typed);
            lengthCheck(node, Constraint.MAX_ITEMS, Comparison.LE, ref, label + " must have at most ", " items", typed);
            if (Boolean.TRUE.equals(node.constraints().get(Constraint.UNIQUE_ITEMS))) {
                typed.add(new Check(new Predicate.UniqueItems(ref), label + " items must be unique"));
            }
        } else if (node instanceof ObjectNode) {
            lengthCheck(node, Constraint.MIN_PROPERTIES, Comparison.GE, ref, label + " must have at least ", " properties", typed);
            lengthCheck(node, Constraint.MAX_PROPERTIES, Comparison.LE, ref, label + " must have at most ", " properties", typed);
        }

        List<Check> out = new ArrayList<>(typed.size() + 2);
        for (Check c : typed) {
            out.add(guarded ? new Check(onlyForOwnType(node, ref, c.predicate()), c.message()) : c);
        }
        if (node.constraint(Constraint.ENUM).orElse(null) instanceof List<?> values) {
            out.add(new Check(new Predicate.InSet(ref, new ArrayList<>(values)),
                label + " must be one of " + KclLiterals.render(values)));
        }
        if (node.has(Constraint.CONST)) {
            Object value = node.constraints().get(Constraint.CONST);
            out.add(new Check(new Predicate.EqualsValue(ref, value), label + " must be " + KclLiterals.render(value)));
        }
        return out;
    }

    /** {@code p} for values of the node's own kind; values of any other type pass. */
    private static Predicate onlyForOwnType(SchemaNode node, ValueRef ref, Predicate p) {
        JsonType own;
        if (node instanceof NumericNode) {
            own = JsonType.NUMBER;
        } else if (node instanceof StringNode) {
            own = JsonType.STRING;
        } else if (node instanceof ArrayNode) {
            own = JsonType.ARRAY;
        } else if (node instanceof ObjectNode) {
            own = JsonType.OBJECT;
        } else {
            return p;
        }
        return Predicate.implies(new Predicate.TypeIs(ref, Set.of(own)), p);
    }

    /**
     * Whether a matched value must be type-tested before its keywords apply: under a type union, or
     * when no type is declared and nothing else fixes the value's type.
     */
    private static boolean needsTypeGuard(SchemaNode node, ValueRef ref) {
        return node.typeUnion() || (!node.typeDeclared() && !(ref.isInstance() && ref.path().isEmpty()));
    }

    private void numericChecks(NumericNode n, ValueRef ref, String label, List<Check> out) {
        Object exclusiveMin = n.constraints().get(Constraint.EXCLUSIVE_MINIMUM);
        Object exclusiveMax = n.constraints().get(Constraint.EXCLUSIVE_MAXIMUM);
        n.constraint(Constraint.MINIMUM).ifPresent(min -> {
            // draft-4 spells exclusivity as a boolean next to minimum
            boolean strict = Boolean.TRUE.equals(exclusiveMin);
            out.add(compare(ref, strict ? Comparison.GT : Comparison.GE, (Number) min,
                label + (strict ? " must be greater than " : " must be at least ")));
        });
        n.constraint(Constraint.MAXIMUM).ifPresent(max -> {
            boolean strict = Boolean.TRUE.equals(exclusiveMax);
            out.add(compare(ref, strict ? Comparison.LT : Comparison.LE, (Number) max,
                label + (strict ? " must be less than " : " must be at most ")));
        });
        if (exclusiveMin instanceof Number bound) {
            out.add(compare(ref, Comparison.GT, bound, label + " must be greater than "));
        }
        if (exclusiveMax instanceof Number bound) {
            out.add(compare(ref, Comparison.LT, bound, label + " must be less than "));
        }
        n.constraint(Constraint.MULTIPLE_OF).ifPresent(m -> {
            BigDecimal divisor = KclLiterals.toBigDecimal((Number) m);
            boolean integral = n.isInteger() && KclLiterals.isIntegral(divisor);
            out.add(new Check(new Predicate.MultipleOf(ref, divisor, integral),
                label + " must be a multiple of " + KclLiterals.number(divisor)));
        });
    }

    private static Check compare(ValueRef ref, Comparison op, Number bound, String message) {
        BigDecimal b = KclLiterals.toBigDecimal(bound);
        return new Check(new Predicate.Compare(ref, Measure.VALUE, op, b), message + KclLiterals.number(bound));
    }

    private static void lengthCheck(SchemaNode node, Constraint c, Comparison op, ValueRef ref,
                                    String prefix, String suffix, List<Check> out) {
        node.constraint(c).ifPresent(n -> {
            BigDecimal bound = KclLiterals.toBigDecimal((Number) n);
            out.add(new Check(new Predicate.Compare(ref, Measure.LENGTH, op, bound),
                prefix + KclLiterals.number((Number) n) + suffix));
        });
    }

    // ===== Full match =====

    /** A predicate that holds exactly when the value at {@code ref} satisfies {@code node}. */
    Predicate matches(SchemaNode node, ValueRef ref) {
        return node.accept(new SchemaNodeVisitor<>() {
            @Override
            public Predicate visitObject(ObjectNode n) {
                List<Predicate> terms = new ArrayList<>();
                terms.add(typeTest(n, ref));
                Map<String, String> attributes = attributeNames(n);
                for (String r : n.required()) {
                    terms.add(new Predicate.Present(ref.member(r, attributes.get(r))));
                }
                for (Map.Entry<String, SchemaNode> p : n.properties().entrySet()) {
                    ValueRef member = ref.member(p.getKey(), attributes.get(p.getKey()));
                    terms.add(Predicate.optional(member, matches(p.getValue(), member)));
                }
                terms.addAll(predicates(valueChecks(n, ref, needsTypeGuard(n, ref))));
                terms.addAll(predicates(dynamicKeyChecks(n, ref)));
                return Predicate.and(terms);
            }

            @Override
            public Predicate visitArray(ArrayNode n) {
                List<Predicate> terms = new ArrayList<>();
                terms.add(typeTest(n, ref));
                terms.addAll(predicates(valueChecks(n, ref, needsTypeGuard(n, ref))));
                n.items().ifPresent(items -> {
                    String item = nextVariable("item");
                    Predicate body = matches(items, ValueRef.variable(item));
                    if (!body.equals(Predicate.TRUE)) terms.add(new Predicate.AllItems(ref, item, body));
                });
                return Predicate.and(terms);
            }

            @Override
            public Predicate visitString(StringNode n) {
                List<Predicate> terms = new ArrayList<>();
                terms.add(typeTest(n, ref));
                boolean guarded = needsTypeGuard(n, ref);
                terms.addAll(predicates(valueChecks(n, ref, guarded)));
                types.formatOf(n).ifPresent(f -> {
                    Predicate valid = new Predicate.FormatValid(ref, f);
                    terms.add(guarded ? onlyForOwnType(n, ref, valid) : valid);
                });
                return Predicate.and(terms);
            }

            @Override
            public Predicate visitNumeric(NumericNode n) {
                List<Predicate> terms = new ArrayList<>();
                terms.add(typeTest(n, ref));
                terms.addAll(predicates(valueChecks(n, ref, needsTypeGuard(n, ref))));
                return Predicate.and(terms);
            }

            @Override
            public Predicate visitScalar(ScalarNode n) {
                List<Predicate> terms = new ArrayList<>();
                terms.add(typeTest(n, ref));
                terms.addAll(predicates(valueChecks(n, ref)));
                return Predicate.and(terms);
            }

            @Override
            public Predicate visitAny(AnyNode n) {
                return Predicate.and(predicates(valueChecks(n, ref)));
            }

            @Override
            public Predicate visitComposition(CompositionNode n) {
                return compositions.matches(n, ref);
            }

            @Override
            public Predicate visitConditional(ConditionalNode n) {
                return compositions.matches(n, ref);
            }

            @Override
            public Predicate visitReference(ReferenceNode n) {
                return withResolving(n, () -> matches(ctx.resolve(n), ref), Predicate.TRUE);
            }
        });
    }

    /** A type test for declared types; none at the instance itself, whose type the schema fixes. */
    private static Predicate typeTest(SchemaNode node, ValueRef ref) {
        if (!node.typeDeclared() || (ref.isInstance() && ref.path().isEmpty())) return Predicate.TRUE;
        Set<JsonType> accepted = EnumSet.noneOf(JsonType.class);
        for (String t : node.declaredTypes()) {
            NodeType.fromTypeName(t).ifPresent(k -> accepted.add(JsonType.valueOf(k.name())));
        }
        return accepted.isEmpty() ? Predicate.TRUE : new Predicate.TypeIs(ref, accepted);
    }

    private static List<Predicate> predicates(List<Check> checks) {
        List<Predicate> out = new ArrayList<>(checks.size());
        for (Check c : checks) out.add(c.predicate());
        return out;
    }

    // ===== Support =====

    /** Helper call validating the value at {@code ref} against {@code sub}. */
    Predicate.HelperCall helper(SchemaNode sub, ValueRef ref) {
        String name = "_is_valid_" + sub.schemaName().toLowerCase(Locale.ROOT);
        Predicate body = matches(sub, ValueRef.variable(Predicate.HelperCall.PARAMETER));
        return new Predicate.HelperCall(name, ref, body);
    }

    /**
     * Runs {@code action} with the reference's target marked as being resolved; a reference back
     * into a target already being resolved yields {@code onCycle}.
     */
    <T> T withResolving(ReferenceNode ref, Supplier<T> action, T onCycle) {
        String target = ctx.dereference(ref).schemaName();
        if (resolving.contains(target)) return onCycle;
        resolving.push(target);
        try {
            return action.get();
        } finally {
            resolving.pop();
        }
    }

    /** Marks a generated schema as being resolved while its checks are compiled. */
    void enterSchema(String name) {
        resolving.push(name);
    }

    void exitSchema() {
        resolving.pop();
    }

    TranslatedPattern pattern(String source, String schemaName) {
        return patterns.computeIfAbsent(source, s -> {
            TranslatedPattern t = RegexTranslator.translate(s);
            for (String w : t.warnings()) {
                ctx.warn(Diagnostic.Kind.UNSUPPORTED_REGEX, schemaName, "pattern " + s + ": " + w);
            }
            return t;
        });
    }

    /** Fresh quantifier variable name, unique within one generated schema. */
    String nextVariable(String base) {
        int n = variables.merge(base, 1, Integer::sum) - 1;
        return n == 0 ? base : base + n;
    }

    void resetVariables() {
        variables.clear();
    }
}
