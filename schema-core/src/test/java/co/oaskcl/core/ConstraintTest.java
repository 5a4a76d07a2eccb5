package co.oaskcl.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class ConstraintTest {

  @Test
  void extractsOnlyConstraintKeywords() {
    Map<Constraint, Object> constraints = Constraint.extract(Map.of(
        "type", "string",
        "minLength", 2,
        "pattern", "^a",
        "enum", List.of("ab", "ac"),
        "description", "ignored"));

    assertThat(constraints).containsOnlyKeys(Constraint.MIN_LENGTH, Constraint.PATTERN, Constraint.ENUM);
    assertThat(constraints.get(Constraint.PATTERN)).isEqualTo("^a");
  }

  @Test
  void keepsNullConstButDropsOtherNulls() {
    Map<String, Object> raw = new HashMap<>();
    raw.put("const", null);
    raw.put("maximum", null);

    Map<Constraint, Object> constraints = Constraint.extract(raw);

    assertThat(constraints).containsOnlyKeys(Constraint.CONST);
    assertThat(constraints.get(Constraint.CONST)).isNull();
  }

  @Test
  void keywordsMatchJsonSchemaSpelling() {
    assertThat(Constraint.EXCLUSIVE_MINIMUM.keyword()).isEqualTo("exclusiveMinimum");
    assertThat(Constraint.UNIQUE_ITEMS.keyword()).isEqualTo("uniqueItems");
    assertThat(Constraint.values()).hasSize(15);
  }
}
