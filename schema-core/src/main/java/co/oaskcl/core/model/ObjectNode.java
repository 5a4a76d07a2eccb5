package co.oaskcl.core.model;

import co.oaskcl.core.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class ObjectNode extends SchemaNode {

  private final Map<String, SchemaNode> properties;
  private final Map<String, SchemaNode> patternProperties;
  private final Set<String> required;
  private final boolean additionalPropertiesForbidden;
  private final SchemaNode additionalProperties;

  public ObjectNode(String schemaName, Map<String, Object> raw,
                    Map<String, SchemaNode> properties,
                    Map<String, SchemaNode> patternProperties,
                    Set<String> required,
                    boolean additionalPropertiesForbidden,
                    SchemaNode additionalProperties) {
    super(NodeType.OBJECT, schemaName, raw);
    this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    this.patternProperties = Collections.unmodifiableMap(new LinkedHashMap<>(patternProperties));
    this.required = Collections.unmodifiableSet(new LinkedHashSet<>(required));
    this.additionalPropertiesForbidden = additionalPropertiesForbidden;
    this.additionalProperties = additionalProperties;
  }

  public Map<String, SchemaNode> properties() {
    return properties;
  }

  /** Keyed by the original, untranslated regex. */
  public Map<String, SchemaNode> patternProperties() {
    return patternProperties;
  }

  public Set<String> required() {
    return required;
  }

  public boolean isRequired(String property) {
    return required.contains(property);
  }

  /** {@code additionalProperties: false}. */
  public boolean additionalPropertiesForbidden() {
    return additionalPropertiesForbidden;
  }

  /** {@code additionalProperties} given as a schema. */
  public Optional<SchemaNode> additionalProperties() {
    return Optional.ofNullable(additionalProperties);
  }

  /** True when keys outside the declared properties can carry values the schema constrains. */
  public boolean hasDynamicKeys() {
    return !patternProperties.isEmpty() || additionalProperties != null;
  }

  @Override
  public List<SchemaNode> children() {
    List<SchemaNode> out = new ArrayList<>(properties.values());
    out.addAll(patternProperties.values());
    if (additionalProperties != null) out.add(additionalProperties);
    return out;
  }

  @Override
  public <R> R accept(SchemaNodeVisitor<R> visitor) {
    return visitor.visitObject(this);
  }
}
