package co.oaskcl.generators.kcl.predicate;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class PredicateTest {

  private final ValueRef a = ValueRef.instance().member("a", "a");
  private final ValueRef b = ValueRef.instance().member("b", "b");

  @Test
  void conjunctionDropsTrueAndFlattens() {
    Predicate p = Predicate.and(Predicate.TRUE, new Predicate.Present(a),
        Predicate.and(new Predicate.Present(b), Predicate.TRUE));
    assertThat(p).isEqualTo(new Predicate.And(List.of(new Predicate.Present(a), new Predicate.Present(b))));
  }

  @Test
  void conjunctionWithFalseIsFalse() {
    assertThat(Predicate.and(new Predicate.Present(a), Predicate.FALSE)).isEqualTo(Predicate.FALSE);
    assertThat(Predicate.and(List.of())).isEqualTo(Predicate.TRUE);
  }

  @Test
  void disjunctionShortCircuitsOnTrue() {
    assertThat(Predicate.or(new Predicate.Present(a), Predicate.TRUE)).isEqualTo(Predicate.TRUE);
    assertThat(Predicate.or(List.of())).isEqualTo(Predicate.FALSE);
    assertThat(Predicate.or(Predicate.FALSE, new Predicate.Present(a))).isEqualTo(new Predicate.Present(a));
  }

  @Test
  void negationFoldsPresence() {
    assertThat(Predicate.not(new Predicate.Present(a))).isEqualTo(new Predicate.Absent(a));
    assertThat(Predicate.not(new Predicate.Absent(a))).isEqualTo(new Predicate.Present(a));
    assertThat(Predicate.not(Predicate.TRUE)).isEqualTo(Predicate.FALSE);
    Predicate unique = new Predicate.UniqueItems(a);
    assertThat(Predicate.not(Predicate.not(unique))).isEqualTo(unique);
  }

  @Test
  void optionalOfTrueIsTrue() {
    assertThat(Predicate.optional(a, Predicate.TRUE)).isEqualTo(Predicate.TRUE);
    assertThat(Predicate.optional(a, new Predicate.UniqueItems(a)))
        .isEqualTo(new Predicate.Or(List.of(new Predicate.Absent(a), new Predicate.UniqueItems(a))));
  }

  @Test
  void conditionalWithConstantConditionPicksBranch() {
    Predicate then = new Predicate.Present(a);
    Predicate otherwise = new Predicate.Present(b);
    assertThat(Predicate.conditional(Predicate.TRUE, then, otherwise)).isEqualTo(then);
    assertThat(Predicate.conditional(Predicate.FALSE, then, otherwise)).isEqualTo(otherwise);
    assertThat(Predicate.implies(new Predicate.Present(b), Predicate.TRUE)).isEqualTo(Predicate.TRUE);
  }

  @Test
  void evaluatorFollowsAbsentSemantics() {
    Predicate p = Predicate.optional(a, new Predicate.UniqueItems(a));
    assertThat(PredicateEvaluator.evaluate(p, "{}")).isTrue();
    assertThat(PredicateEvaluator.evaluate(p, "{\"a\": null}")).isTrue();
    assertThat(PredicateEvaluator.evaluate(p, "{\"a\": [1, 1]}")).isFalse();
  }
}
