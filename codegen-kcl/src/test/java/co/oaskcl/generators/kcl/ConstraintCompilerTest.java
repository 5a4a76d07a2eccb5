package co.oaskcl.generators.kcl;

import co.oaskcl.core.Diagnostic;
import co.oaskcl.core.SchemaLoader;
import co.oaskcl.core.model.SchemaDocument;
import co.oaskcl.core.tree.BuildContext;
import co.oaskcl.generators.kcl.predicate.Check;
import co.oaskcl.generators.kcl.predicate.Predicate;
import co.oaskcl.generators.kcl.predicate.PredicateEvaluator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class ConstraintCompilerTest {

  private GenerationContext ctx;

  private List<Check> compile(String schema) throws Exception {
    SchemaDocument doc = SchemaLoader.parse(schema, false);
    BuildContext build = new BuildContext();
    KclGenerator.BuiltDocument built = new KclGenerator(GeneratorConfig.defaults().withRootName("Root")).build(doc, build);
    ctx = new GenerationContext(build, built.root(), built.definitions());
    ConstraintCompiler compiler = new ConstraintCompiler(ctx, new TypeResolver(ctx));
    compiler.enterSchema(built.root().schemaName());
    try {
      return compiler.hostChecks(built.root());
    } finally {
      compiler.exitSchema();
    }
  }

  private static boolean accepts(List<Check> checks, String instance) {
    return PredicateEvaluator.evaluate(Predicate.and(checks.stream().map(Check::predicate).toList()), instance);
  }

  private static List<String> messages(List<Check> checks) {
    return checks.stream().map(Check::message).toList();
  }

  @Test
  void integerMultipleOfIsExact() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"n": {"type": "integer", "multipleOf": 5}}}
        """);

    assertThat(messages(checks)).containsExactly("n must be a multiple of 5");
    assertThat(accepts(checks, "{\"n\": 25}")).isTrue();
    assertThat(accepts(checks, "{\"n\": 26}")).isFalse();
    assertThat(accepts(checks, "{}")).isTrue();
    assertThat(accepts(checks, "{\"n\": null}")).isTrue();
  }

  @Test
  void floatMultipleOfToleratesRounding() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"w": {"type": "number", "multipleOf": 0.1}}}
        """);

    Predicate.MultipleOf p = (Predicate.MultipleOf) ((Predicate.Or) checks.get(0).predicate()).terms().get(1);
    assertThat(p.integral()).isFalse();
    assertThat(accepts(checks, "{\"w\": 0.3}")).isTrue();
    assertThat(accepts(checks, "{\"w\": 0.35}")).isFalse();
  }

  @Test
  void requiredStringLengths() throws Exception {
    List<Check> checks = compile("""
        {
          "type": "object",
          "required": ["name"],
          "properties": {"name": {"type": "string", "minLength": 3, "maxLength": 5}}
        }
        """);

    assertThat(messages(checks)).containsExactly(
        "name is required",
        "name must be at least 3 characters long",
        "name must be at most 5 characters long");
    assertThat(accepts(checks, "{\"name\": \"ab\"}")).isFalse();
    assertThat(accepts(checks, "{\"name\": \"abc\"}")).isTrue();
    assertThat(accepts(checks, "{\"name\": \"abcdef\"}")).isFalse();
    assertThat(accepts(checks, "{}")).isFalse();
  }

  @Test
  void uniqueItems() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"tags": {"type": "array", "items": {"type": "string"}, "uniqueItems": true}}}
        """);

    assertThat(messages(checks)).containsExactly("tags items must be unique");
    assertThat(accepts(checks, "{\"tags\": [\"a\", \"b\"]}")).isTrue();
    assertThat(accepts(checks, "{\"tags\": [\"a\", \"a\"]}")).isFalse();
  }

  @Test
  void uniqueItemsTellsNumbersFromStrings() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"tags": {"type": "array", "uniqueItems": true}}}
        """);

    assertThat(accepts(checks, "{\"tags\": [1, \"1\"]}")).isTrue();
    assertThat(accepts(checks, "{\"tags\": [1, 1]}")).isFalse();
  }

  @Test
  void untypedStringKeywordsAreChecked() throws Exception {
    List<Check> checks = compile("""
        {"properties": {"code": {"maxLength": 5, "pattern": "^[A-Z]+$"}}}
        """);

    assertThat(messages(checks)).containsExactly(
        "code must be at most 5 characters long",
        "code must match pattern ^[A-Z]+$");
    assertThat(accepts(checks, "{\"code\": \"ABC\"}")).isTrue();
    assertThat(accepts(checks, "{\"code\": \"ABCDEFG\"}")).isFalse();
    assertThat(accepts(checks, "{\"code\": \"abc\"}")).isFalse();
    assertThat(accepts(checks, "{}")).isTrue();
  }

  @Test
  void untypedItemKeywordsSkipOtherTypes() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"xs": {"type": "array", "items": {"minimum": 5}}}}
        """);

    assertThat(accepts(checks, "{\"xs\": [7, \"abc\"]}")).isTrue();
    assertThat(accepts(checks, "{\"xs\": [3]}")).isFalse();
  }

  @Test
  void typeUnionAppliesNumericKeywordsToNumbersOnly() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"xs": {"type": "array", "items": {"type": ["integer", "string"], "minimum": 5}}}}
        """);

    assertThat(accepts(checks, "{\"xs\": [\"abc\"]}")).isTrue();
    assertThat(accepts(checks, "{\"xs\": [7]}")).isTrue();
    assertThat(accepts(checks, "{\"xs\": [3]}")).isFalse();
    assertThat(accepts(checks, "{\"xs\": [true]}")).isFalse();
  }

  @Test
  void nullableStringLengthIgnoresNull() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"xs": {"type": "array", "items": {"type": ["string", "null"], "maxLength": 3}}}}
        """);

    assertThat(accepts(checks, "{\"xs\": [null]}")).isTrue();
    assertThat(accepts(checks, "{\"xs\": [\"ab\", null]}")).isTrue();
    assertThat(accepts(checks, "{\"xs\": [\"abcd\"]}")).isFalse();
  }

  @Test
  void nullablePropertyLengthIgnoresNull() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "required": ["nick"], "properties": {"nick": {"type": ["string", "null"], "maxLength": 3}}}
        """);

    assertThat(accepts(checks, "{\"nick\": \"abc\"}")).isTrue();
    assertThat(accepts(checks, "{\"nick\": \"abcd\"}")).isFalse();
  }

  @Test
  void itemConstraintsAreQuantified() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"codes": {"type": "array", "minItems": 1, "items": {"type": "string", "minLength": 2}}}}
        """);

    assertThat(messages(checks)).containsExactly(
        "codes must have at least 1 items",
        "codes items must satisfy RootCodesItems");
    assertThat(accepts(checks, "{\"codes\": [\"ab\", \"cd\"]}")).isTrue();
    assertThat(accepts(checks, "{\"codes\": [\"ab\", \"c\"]}")).isFalse();
    assertThat(accepts(checks, "{\"codes\": []}")).isFalse();
  }

  @Test
  void oneOfRequiresExactlyOneBranch() throws Exception {
    List<Check> checks = compile("""
        {"oneOf": [{"required": ["x"]}, {"required": ["y"]}]}
        """);

    assertThat(messages(checks)).containsExactly("value must match exactly one of: RootOneOf0, RootOneOf1");
    assertThat(accepts(checks, "{\"x\": 1}")).isTrue();
    assertThat(accepts(checks, "{\"y\": 1}")).isTrue();
    assertThat(accepts(checks, "{\"x\": 1, \"y\": 2}")).isFalse();
    assertThat(accepts(checks, "{}")).isFalse();
  }

  @Test
  void anyOfRequiresSomeBranch() throws Exception {
    List<Check> checks = compile("""
        {"anyOf": [{"required": ["x"]}, {"required": ["y"]}]}
        """);

    assertThat(accepts(checks, "{\"x\": 1, \"y\": 2}")).isTrue();
    assertThat(accepts(checks, "{}")).isFalse();
  }

  @Test
  void negatedPropertySchema() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"code": {"type": "string", "not": {"enum": ["x"]}}}}
        """);

    assertThat(messages(checks)).containsExactly("code must not match RootCodeNot");
    assertThat(accepts(checks, "{\"code\": \"x\"}")).isFalse();
    assertThat(accepts(checks, "{\"code\": \"y\"}")).isTrue();
    assertThat(accepts(checks, "{}")).isTrue();
  }

  @Test
  void ifThenElse() throws Exception {
    List<Check> checks = compile("""
        {
          "type": "object",
          "properties": {"kind": {"type": "string"}},
          "if": {"properties": {"kind": {"const": "card"}}},
          "then": {"required": ["number"]},
          "else": {"required": ["iban"]}
        }
        """);

    assertThat(messages(checks)).containsExactly("value must satisfy the conditional rules of Root");
    assertThat(accepts(checks, "{\"kind\": \"card\", \"number\": \"4111\"}")).isTrue();
    assertThat(accepts(checks, "{\"kind\": \"card\"}")).isFalse();
    assertThat(accepts(checks, "{\"kind\": \"bank\", \"iban\": \"DE00\"}")).isTrue();
    assertThat(accepts(checks, "{\"kind\": \"bank\"}")).isFalse();
  }

  @Test
  void forbiddenAdditionalProperties() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"a": {"type": "string"}}, "additionalProperties": false}
        """);

    assertThat(messages(checks)).containsExactly("no properties other than the declared ones are allowed");
    assertThat(accepts(checks, "{\"a\": \"x\"}")).isTrue();
    assertThat(accepts(checks, "{\"a\": \"x\", \"b\": 1}")).isFalse();
  }

  @Test
  void additionalPropertiesSchema() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"a": {"type": "string"}}, "additionalProperties": {"type": "integer"}}
        """);

    assertThat(accepts(checks, "{\"a\": \"x\", \"b\": 1}")).isTrue();
    assertThat(accepts(checks, "{\"a\": \"x\", \"b\": \"one\"}")).isFalse();
  }

  @Test
  void patternProperties() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "patternProperties": {"^x-": {"type": "string"}}}
        """);

    assertThat(messages(checks)).containsExactly("properties matching ^x- must satisfy RootPatternX");
    assertThat(accepts(checks, "{\"x-a\": \"s\"}")).isTrue();
    assertThat(accepts(checks, "{\"x-a\": 1}")).isFalse();
    assertThat(accepts(checks, "{\"other\": 1}")).isTrue();
  }

  @Test
  void enumAndConst() throws Exception {
    List<Check> checks = compile("""
        {
          "type": "object",
          "properties": {
            "color": {"type": "string", "enum": ["red", "green"]},
            "version": {"const": 2}
          }
        }
        """);

    assertThat(messages(checks)).containsExactly(
        "color must be one of [\"red\", \"green\"]",
        "version must be 2");
    assertThat(accepts(checks, "{\"color\": \"red\", \"version\": 2}")).isTrue();
    assertThat(accepts(checks, "{\"color\": \"blue\"}")).isFalse();
    assertThat(accepts(checks, "{\"version\": 3}")).isFalse();
  }

  @Test
  void draft4BooleanExclusiveBounds() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"n": {"type": "integer", "minimum": 0, "exclusiveMinimum": true}}}
        """);

    assertThat(messages(checks)).containsExactly("n must be greater than 0");
    assertThat(accepts(checks, "{\"n\": 0}")).isFalse();
    assertThat(accepts(checks, "{\"n\": 1}")).isTrue();
  }

  @Test
  void numericExclusiveBounds() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"n": {"type": "number", "minimum": 1, "exclusiveMaximum": 10}}}
        """);

    assertThat(messages(checks)).containsExactly("n must be at least 1", "n must be less than 10");
    assertThat(accepts(checks, "{\"n\": 10}")).isFalse();
    assertThat(accepts(checks, "{\"n\": 9.5}")).isTrue();
    assertThat(accepts(checks, "{\"n\": 0.5}")).isFalse();
  }

  @Test
  void formatOnlyStringsValidateThroughTheirType() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"email": {"type": "string", "format": "email"}}}
        """);

    assertThat(checks).isEmpty();
  }

  @Test
  void constrainedFormatStringsAreCheckedInline() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"email": {"type": "string", "format": "email", "maxLength": 50}}}
        """);

    assertThat(messages(checks)).containsExactly(
        "email must be at most 50 characters long",
        "email must be a valid email");
    assertThat(accepts(checks, "{\"email\": \"a@example.io\"}")).isTrue();
    assertThat(accepts(checks, "{\"email\": \"nope\"}")).isFalse();
  }

  @Test
  void lossyPatternsAreReported() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"pin": {"type": "string", "pattern": "^(?=.*\\\\d)\\\\w+$"}}}
        """);

    assertThat(messages(checks)).singleElement().asString().startsWith("pin must match pattern ");
    assertThat(ctx.diagnostics())
        .filteredOn(d -> d.kind() == Diagnostic.Kind.UNSUPPORTED_REGEX)
        .singleElement()
        .satisfies(d -> assertThat(d.schemaName()).isEqualTo("RootPin"));
    assertThat(accepts(checks, "{\"pin\": \"abc\"}")).isTrue();
  }

  @Test
  void dictionaryPropertiesQuantifyValues() throws Exception {
    List<Check> checks = compile("""
        {"type": "object", "properties": {"labels": {"type": "object", "additionalProperties": {"type": "string", "maxLength": 3}}}}
        """);

    assertThat(accepts(checks, "{\"labels\": {\"a\": \"abc\"}}")).isTrue();
    assertThat(accepts(checks, "{\"labels\": {\"a\": \"abcd\"}}")).isFalse();
  }
}
