package co.oaskcl.generators.kcl.predicate;

import co.oaskcl.generators.kcl.format.FormatRegistry;
import co.oaskcl.generators.kcl.predicate.Predicate.Comparison;
import co.oaskcl.generators.kcl.predicate.Predicate.JsonType;
import co.oaskcl.generators.kcl.predicate.Predicate.Measure;
import co.oaskcl.generators.kcl.regex.RegexTranslator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class KclRendererTest {

  private KclRenderer renderer;
  private final ValueRef age = ValueRef.instance().member("age", "age");
  private final ValueRef name = ValueRef.instance().member("name", "name");

  @BeforeEach
  void setUp() {
    renderer = new KclRenderer();
  }

  @Test
  void optionalPredicateShortCircuitsOnNone() {
    Predicate p = Predicate.optional(age, new Predicate.Compare(age, Measure.VALUE, Comparison.GE, BigDecimal.ZERO));
    assertThat(renderer.render(p)).isEqualTo("age == None or age >= 0");
  }

  @Test
  void rendersLengthComparisons() {
    Predicate p = new Predicate.Compare(name, Measure.LENGTH, Comparison.LE, new BigDecimal("5"));
    assertThat(renderer.render(p)).isEqualTo("len(name) <= 5");
  }

  @Test
  void integralMultipleOfUsesModulo() {
    Predicate p = new Predicate.MultipleOf(age, new BigDecimal("5"), true);
    assertThat(renderer.render(p)).isEqualTo("age % 5 == 0");
  }

  @Test
  void floatMultipleOfUsesEpsilon() {
    ValueRef weight = ValueRef.instance().member("weight", "weight");
    Predicate p = new Predicate.MultipleOf(weight, new BigDecimal("0.1"), false);
    assertThat(renderer.render(p)).isEqualTo("abs(weight / 0.1 - round(weight / 0.1)) < 1e-10");
  }

  @Test
  void patternSearchImportsRegex() {
    Predicate p = new Predicate.Matches(name, RegexTranslator.translate("^\\d+$"));
    assertThat(renderer.render(p)).isEqualTo("regex.search(name, \"^[0-9]+$\")");
    assertThat(renderer.imports()).containsExactly("regex");
  }

  @Test
  void formatPredicateImportsItsModules() {
    Predicate p = new Predicate.FormatValid(name, FormatRegistry.lookup("ipv4").orElseThrow());
    assertThat(renderer.render(p)).isEqualTo("net.is_IPv4(name)");
    assertThat(renderer.imports()).containsExactly("net");
  }

  @Test
  void rendersMembershipAndEquality() {
    ValueRef color = ValueRef.instance().member("color", "color");
    assertThat(renderer.render(new Predicate.InSet(color, List.of("red", "green"))))
        .isEqualTo("color in [\"red\", \"green\"]");
    assertThat(renderer.render(new Predicate.EqualsValue(color, null))).isEqualTo("color == None");
    assertThat(renderer.render(new Predicate.EqualsValue(age, 3))).isEqualTo("age == 3");
  }

  @Test
  void uniqueItemsComparesJsonEncodedCount() {
    ValueRef tags = ValueRef.instance().member("tags", "tags");
    assertThat(renderer.render(new Predicate.UniqueItems(tags)))
        .isEqualTo("len(tags) == len({json.encode(e): None for e in tags})");
    assertThat(renderer.imports()).containsExactly("json");
  }

  @Test
  void typeGuardedKeyword() {
    ValueRef item = ValueRef.variable("item");
    Predicate guarded = Predicate.implies(
        new Predicate.TypeIs(item, EnumSet.of(JsonType.NUMBER)),
        new Predicate.Compare(item, Measure.VALUE, Comparison.GE, BigDecimal.valueOf(5)));
    assertThat(renderer.render(guarded)).isEqualTo("not (typeof(item) in [\"float\", \"int\"]) or (item >= 5)");
  }

  @Test
  void typeTests() {
    ValueRef v = ValueRef.variable("v");
    assertThat(renderer.render(new Predicate.TypeIs(v, EnumSet.of(JsonType.STRING))))
        .isEqualTo("typeof(v) == \"str\"");
    assertThat(renderer.render(new Predicate.TypeIs(v, EnumSet.of(JsonType.NUMBER))))
        .isEqualTo("typeof(v) in [\"float\", \"int\"]");
    assertThat(renderer.render(new Predicate.TypeIs(v, EnumSet.of(JsonType.STRING, JsonType.NULL))))
        .isEqualTo("v == None or typeof(v) == \"str\"");
    assertThat(renderer.render(new Predicate.TypeIs(v, EnumSet.of(JsonType.NULL)))).isEqualTo("v == None");
  }

  @Test
  void variableRefsIndexByKey() {
    ValueRef v = ValueRef.variable("v").member("first-name");
    assertThat(renderer.render(new Predicate.Present(v))).isEqualTo("v[\"first-name\"] != None");
  }

  @Test
  void parenthesizesNestedConnectives() {
    Predicate p = Predicate.and(
        new Predicate.Present(name),
        Predicate.or(new Predicate.Absent(age), new Predicate.Compare(age, Measure.VALUE, Comparison.LT, BigDecimal.TEN)));
    assertThat(renderer.render(p)).isEqualTo("name != None and (age == None or age < 10)");
  }

  @Test
  void implicationRendersAsNegatedCondition() {
    ValueRef kind = ValueRef.instance().member("kind", "kind");
    ValueRef number = ValueRef.instance().member("number", "number");
    Predicate p = Predicate.implies(new Predicate.EqualsValue(kind, "card"), new Predicate.Present(number));
    assertThat(renderer.render(p)).isEqualTo("not (kind == \"card\") or (number != None)");
  }

  @Test
  void conditionalWithElseRendersAsTernary() {
    ValueRef kind = ValueRef.instance().member("kind", "kind");
    Predicate p = Predicate.conditional(new Predicate.EqualsValue(kind, "card"),
        new Predicate.Present(ValueRef.instance().member("number", "number")),
        new Predicate.Present(ValueRef.instance().member("iban", "iban")));
    assertThat(renderer.render(p)).isEqualTo("(number != None) if (kind == \"card\") else (iban != None)");
  }

  @Test
  void countTrueUsesListComprehension() {
    Predicate p = new Predicate.CountTrue(List.of(new Predicate.Present(name), new Predicate.Present(age)), 1);
    assertThat(renderer.render(p)).isEqualTo("len([ok for ok in [name != None, age != None] if ok]) == 1");
  }

  @Test
  void quantifiersBindTheirVariables() {
    ValueRef tags = ValueRef.instance().member("tags", "tags");
    Predicate items = new Predicate.AllItems(tags, "item",
        new Predicate.Compare(ValueRef.variable("item"), Measure.LENGTH, Comparison.GE, BigDecimal.ONE));
    assertThat(renderer.render(items)).isEqualTo("all item in tags { len(item) >= 1 }");

    Predicate entries = new Predicate.AllEntries(ValueRef.instance(), "key", "val",
        new Predicate.InSet(ValueRef.variable("key"), List.of("a")));
    assertThat(renderer.render(entries)).isEqualTo("all key, val in __dict__ { key in [\"a\"] }");
  }

  @Test
  void helperCallsAreEmittedAsLambdas() {
    Predicate body = new Predicate.Present(ValueRef.variable("v").member("x"));
    Predicate call = new Predicate.HelperCall("_is_valid_a", ValueRef.instance(), body);

    assertThat(renderer.render(Predicate.not(call))).isEqualTo("not _is_valid_a(__dict__)");
    assertThat(renderer.helperDefinitions("    ")).containsExactly(
        "    _is_valid_a = lambda v: any -> bool {\n"
            + "        v[\"x\"] != None\n"
            + "    }");
  }

  @Test
  void helpersCalledFromHelpersAreAlsoEmitted() {
    Predicate inner = new Predicate.HelperCall("_is_valid_inner", ValueRef.variable("v").member("a"),
        new Predicate.Present(ValueRef.variable("v")));
    Predicate outer = new Predicate.HelperCall("_is_valid_outer", ValueRef.instance(), inner);

    renderer.render(outer);

    assertThat(renderer.helperDefinitions(""))
        .hasSize(2)
        .anySatisfy(h -> assertThat(h).startsWith("_is_valid_outer = lambda").contains("_is_valid_inner(v[\"a\"])"))
        .anySatisfy(h -> assertThat(h).startsWith("_is_valid_inner = lambda").contains("v != None"));
  }

  @Test
  void rendersChecksWithQuotedMessage() {
    Check check = new Check(new Predicate.Present(name), "name is \"required\"");
    assertThat(renderer.renderCheck(check)).isEqualTo("name != None, \"name is \\\"required\\\"\"");
  }
}
