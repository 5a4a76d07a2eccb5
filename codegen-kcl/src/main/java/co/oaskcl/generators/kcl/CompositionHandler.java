package co.oaskcl.generators.kcl;

import co.oaskcl.core.NodeType;
import co.oaskcl.core.model.CompositionNode;
import co.oaskcl.core.model.ConditionalNode;
import co.oaskcl.core.model.SchemaNode;
import co.oaskcl.generators.kcl.predicate.Check;
import co.oaskcl.generators.kcl.predicate.Predicate;
import co.oaskcl.generators.kcl.predicate.ValueRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * allOf, anyOf, oneOf, not and if/then/else.
 *
 * <p>Branches other than allOf's are validated through helper lambdas, one per branch schema, so
 * that each branch is checked against the whole value on its own. allOf is a plain conjunction and
 * needs none.
 */
final class CompositionHandler {

    private final ConstraintCompiler compiler;

    CompositionHandler(ConstraintCompiler compiler) {
        this.compiler = compiler;
    }

    /** Check-block lines of a composition emitted as its own schema. */
    List<Check> hostChecks(CompositionNode node) {
        List<Check> out = new ArrayList<>();
        node.base().ifPresent(b -> out.addAll(compiler.hostChecks(b)));
        if (node.type() == NodeType.ALL_OF) {
            for (SchemaNode sub : node.subSchemas()) out.addAll(compiler.hostChecks(sub));
            return out;
        }
        Predicate p = combine(node, ValueRef.instance());
        if (!p.equals(Predicate.TRUE)) out.add(new Check(p, message(node, "value")));
        return out;
    }

    List<Check> hostChecks(ConditionalNode node) {
        List<Check> out = new ArrayList<>();
        node.base().ifPresent(b -> out.addAll(compiler.hostChecks(b)));
        Predicate p = conditional(node, ValueRef.instance());
        if (!p.equals(Predicate.TRUE)) out.add(new Check(p, message(node)));
        return out;
    }

    Predicate matches(CompositionNode node, ValueRef ref) {
        List<Predicate> terms = new ArrayList<>();
        node.base().ifPresent(b -> terms.add(compiler.matches(b, ref)));
        if (node.type() == NodeType.ALL_OF) {
            for (SchemaNode sub : node.subSchemas()) terms.add(compiler.matches(sub, ref));
        } else {
            terms.add(combine(node, ref));
        }
        return Predicate.and(terms);
    }

    Predicate matches(ConditionalNode node, ValueRef ref) {
        List<Predicate> terms = new ArrayList<>();
        node.base().ifPresent(b -> terms.add(compiler.matches(b, ref)));
        terms.add(conditional(node, ref));
        return Predicate.and(terms);
    }

    /** anyOf, oneOf or not over helper calls. */
    private Predicate combine(CompositionNode node, ValueRef ref) {
        List<Predicate> calls = new ArrayList<>();
        for (SchemaNode sub : node.subSchemas()) calls.add(branch(sub, ref));
        return switch (node.type()) {
            case ANY_OF -> Predicate.or(calls);
            case ONE_OF -> calls.size() == 1 ? calls.get(0) : new Predicate.CountTrue(calls, 1);
            case NOT -> Predicate.not(calls.get(0));
            default -> throw new IllegalArgumentException("not a combining composition: " + node.type());
        };
    }

    private Predicate conditional(ConditionalNode node, ValueRef ref) {
        Predicate condition = branch(node.condition(), ref);
        Predicate then = branchOrTrue(node.branch(NodeType.THEN), ref);
        Predicate otherwise = branchOrTrue(node.branch(NodeType.ELSE), ref);
        return Predicate.conditional(condition, then, otherwise);
    }

    private Predicate branchOrTrue(Optional<SchemaNode> branch, ValueRef ref) {
        return branch.map(b -> branch(b, ref)).orElse(Predicate.TRUE);
    }

    /** A helper call, or the constant itself when the branch accepts or rejects everything. */
    private Predicate branch(SchemaNode sub, ValueRef ref) {
        Predicate.HelperCall call = compiler.helper(sub, ref);
        return call.body() instanceof Predicate.Constant c ? c : call;
    }

    static String message(CompositionNode node, String label) {
        List<String> names = new ArrayList<>();
        for (SchemaNode sub : node.subSchemas()) names.add(sub.schemaName());
        return switch (node.type()) {
            case ANY_OF -> label + " must match at least one of: " + String.join(", ", names);
            case ONE_OF -> label + " must match exactly one of: " + String.join(", ", names);
            case NOT -> label + " must not match " + names.get(0);
            default -> label + " must match all of: " + String.join(", ", names);
        };
    }

    private static String message(ConditionalNode node) {
        return "value must satisfy the conditional rules of " + node.schemaName();
    }
}
