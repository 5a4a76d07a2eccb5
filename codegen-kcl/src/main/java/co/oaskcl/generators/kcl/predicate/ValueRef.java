package co.oaskcl.generators.kcl.predicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A path to a value inside the data being validated.
 *
 * <p>A path starts either at the schema instance itself, whose attributes are referred to by
 * (sanitized) name, or at a variable bound by a helper or a quantifier. Deeper steps index by key.
 * Each step keeps the original JSON key alongside the rendered name.
 */
public final class ValueRef {

    /** Attribute mapping of the schema instance, used where the instance is needed as a dict. */
    public static final String INSTANCE_DICT = "__dict__";

    /** One step of a path. */
    public record Step(String key, String attribute) {
    }

    private final String variable;
    private final List<Step> path;

    private ValueRef(String variable, List<Step> path) {
        this.variable = variable;
        this.path = Collections.unmodifiableList(path);
    }

    /** The schema instance being checked. */
    public static ValueRef instance() {
        return new ValueRef(null, List.of());
    }

    /** A variable bound by a helper lambda or a quantifier. */
    public static ValueRef variable(String name) {
        return new ValueRef(Objects.requireNonNull(name), List.of());
    }

    /**
     * The member {@code key}, rendered as {@code attribute} when it is an attribute of the instance.
     */
    public ValueRef member(String key, String attribute) {
        List<Step> next = new ArrayList<>(path);
        next.add(new Step(key, attribute));
        return new ValueRef(variable, next);
    }

    /** The member {@code key} of a dict value. */
    public ValueRef member(String key) {
        return member(key, key);
    }

    public boolean isInstance() {
        return variable == null;
    }

    /** Bound variable name, or null for instance paths. */
    public String variable() {
        return variable;
    }

    public List<Step> path() {
        return path;
    }

    /** Original key of the last step, or the variable name for a bare variable. */
    public String label() {
        if (path.isEmpty()) return variable == null ? "value" : variable;
        return path.get(path.size() - 1).key();
    }

    public String render() {
        StringBuilder out = new StringBuilder();
        int from = 0;
        if (variable != null) {
            out.append(variable);
        } else if (path.isEmpty()) {
            return INSTANCE_DICT;
        } else {
            out.append(path.get(0).attribute());
            from = 1;
        }
        for (int i = from; i < path.size(); i++) {
            out.append('[').append(KclLiterals.string(path.get(i).key())).append(']');
        }
        return out.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueRef other)) return false;
        return Objects.equals(variable, other.variable) && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, path);
    }

    @Override
    public String toString() {
        return render();
    }
}
