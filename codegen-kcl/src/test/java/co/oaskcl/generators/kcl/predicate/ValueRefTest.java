package co.oaskcl.generators.kcl.predicate;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class ValueRefTest {

  @Test
  void instanceRendersAsAttributeMapping() {
    assertThat(ValueRef.instance().render()).isEqualTo(ValueRef.INSTANCE_DICT);
    assertThat(ValueRef.instance().isInstance()).isTrue();
    assertThat(ValueRef.instance().label()).isEqualTo("value");
  }

  @Test
  void firstInstanceStepUsesAttributeName() {
    ValueRef ref = ValueRef.instance().member("first-name", "first_name");
    assertThat(ref.render()).isEqualTo("first_name");
    assertThat(ref.label()).isEqualTo("first-name");
  }

  @Test
  void deeperStepsIndexByOriginalKey() {
    ValueRef ref = ValueRef.instance().member("address", "address").member("zip-code");
    assertThat(ref.render()).isEqualTo("address[\"zip-code\"]");
    assertThat(ref.label()).isEqualTo("zip-code");
  }

  @Test
  void variablesIndexEveryStep() {
    ValueRef ref = ValueRef.variable("v").member("type", "type_");
    assertThat(ref.render()).isEqualTo("v[\"type\"]");
    assertThat(ref.isInstance()).isFalse();
    assertThat(ValueRef.variable("item").label()).isEqualTo("item");
  }

  @Test
  void equalityIsStructural() {
    assertThat(ValueRef.variable("v").member("a")).isEqualTo(ValueRef.variable("v").member("a"));
    assertThat(ValueRef.variable("v").member("a")).isNotEqualTo(ValueRef.variable("w").member("a"));
    assertThat(ValueRef.instance()).isEqualTo(ValueRef.instance());
    assertThat(ValueRef.instance().member("a", "a").hashCode()).isEqualTo(ValueRef.instance().member("a", "a").hashCode());
  }
}
