package com.gentoro.agentops.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Simplified JSON-Schema node describing a tool's input. The root of a tool schema is an {@link
 * Type#OBJECT} whose {@link #getProperties()} are the tool arguments.
 */
public final class ToolProperty {
  public enum Type {
    STRING,
    BOOLEAN,
    INTEGER,
    NUMBER,
    OBJECT,
    ARRAY
  }

  private final String name;
  private final String description;
  private final boolean required;
  private final Type type;
  private final ToolProperty items;
  private final List<ToolProperty> properties;

  public ToolProperty(String name, String description, boolean required, Type type) {
    this(name, description, required, type, null, null);
  }

  public ToolProperty(
      String name,
      String description,
      boolean required,
      Type type,
      ToolProperty items,
      List<ToolProperty> properties) {
    this.name = name;
    this.description = description;
    this.required = required;
    this.type = Objects.requireNonNull(type, "type");
    this.items = items;
    this.properties = properties == null ? List.of() : List.copyOf(properties);
  }

  /** Object schema with the given arguments. */
  public static ToolProperty object(ToolProperty... arguments) {
    return new ToolProperty(null, null, false, Type.OBJECT, null, List.of(arguments));
  }

  public static ToolProperty string(String name, String description, boolean required) {
    return new ToolProperty(name, description, required, Type.STRING);
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isRequired() {
    return required;
  }

  public Type getType() {
    return type;
  }

  public ToolProperty getItems() {
    return items;
  }

  public List<ToolProperty> getProperties() {
    return properties;
  }

  /** Names of required arguments absent from {@code arguments}. */
  public List<String> missingRequired(Map<String, Object> arguments) {
    Map<String, Object> args = arguments == null ? Collections.emptyMap() : arguments;
    List<String> missing = new ArrayList<>();
    for (ToolProperty p : properties) {
      if (p.isRequired() && args.get(p.getName()) == null) {
        missing.add(p.getName());
      }
    }
    return missing;
  }

  /** JSON-Schema shaped map, suitable for serialization into prompts or tool listings. */
  public Map<String, Object> toJsonSchema() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", type.name().toLowerCase());
    if (description != null) out.put("description", description);
    if (items != null) out.put("items", items.toJsonSchema());
    if (type == Type.OBJECT) {
      Map<String, Object> props = new LinkedHashMap<>();
      List<String> requiredNames = new ArrayList<>();
      for (ToolProperty p : properties) {
        props.put(p.getName(), p.toJsonSchema());
        if (p.isRequired()) requiredNames.add(p.getName());
      }
      out.put("properties", props);
      if (!requiredNames.isEmpty()) out.put("required", requiredNames);
    }
    return out;
  }

  /** One-line signature such as {@code (sql: string*)}; starred arguments are required. */
  public String signature() {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < properties.size(); i++) {
      ToolProperty p = properties.get(i);
      if (i > 0) sb.append(", ");
      sb.append(p.getName()).append(": ").append(p.getType().name().toLowerCase());
      if (p.isRequired()) sb.append('*');
    }
    return sb.append(')').toString();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ToolProperty that)) return false;
    return isRequired() == that.isRequired()
        && Objects.equals(getName(), that.getName())
        && Objects.equals(getDescription(), that.getDescription())
        && getType() == that.getType()
        && Objects.equals(getItems(), that.getItems())
        && Objects.equals(getProperties(), that.getProperties());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getName(), getDescription(), isRequired(), getType());
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private String name;
    private String description;
    private boolean required;
    private Type type;
    private ToolProperty items;
    private final List<ToolProperty> properties = new ArrayList<>();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public Builder type(Type type) {
      this.type = type;
      return this;
    }

    public Builder items(ToolProperty items) {
      this.items = items;
      return this;
    }

    public Builder property(ToolProperty property) {
      this.properties.add(property);
      return this;
    }

    public ToolProperty build() {
      return new ToolProperty(name, description, required, type, items, properties);
    }
  }
}
