package com.sysmlgraph.graph;

import java.util.Objects;

/**
 * A single flat property value as the graph store holds it.
 *
 * <p>The store has no nested value type, so structured data travels as {@link JsonBlob}. A {@link
 * Cleared} value is the null marker: merged into an existing node it removes the property.
 */
public interface PropertyValue {

  /** Value handed to the graph store: a String, Number, Boolean, or {@code null}. */
  Object toStorage();

  /** String form, or {@code null} for {@link Cleared}. */
  String asString();

  record Text(String value) implements PropertyValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Object toStorage() {
      return value;
    }

    @Override
    public String asString() {
      return value;
    }
  }

  record Numeric(Number value) implements PropertyValue {
    public Numeric {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Object toStorage() {
      return value;
    }

    @Override
    public String asString() {
      return String.valueOf(value);
    }
  }

  record Flag(boolean value) implements PropertyValue {
    @Override
    public Object toStorage() {
      return value;
    }

    @Override
    public String asString() {
      return String.valueOf(value);
    }
  }

  /** JSON text of a structured field. */
  record JsonBlob(String json) implements PropertyValue {
    public JsonBlob {
      Objects.requireNonNull(json, "json");
    }

    @Override
    public Object toStorage() {
      return json;
    }

    @Override
    public String asString() {
      return json;
    }
  }

  enum Cleared implements PropertyValue {
    INSTANCE;

    @Override
    public Object toStorage() {
      return null;
    }

    @Override
    public String asString() {
      return null;
    }
  }

  static PropertyValue text(String value) {
    return new Text(value);
  }

  static PropertyValue number(Number value) {
    return new Numeric(value);
  }

  static PropertyValue flag(boolean value) {
    return new Flag(value);
  }

  static PropertyValue json(String json) {
    return new JsonBlob(json);
  }

  static PropertyValue cleared() {
    return Cleared.INSTANCE;
  }

  static boolean isScalar(Object raw) {
    return raw instanceof String || raw instanceof Number || raw instanceof Boolean;
  }

  /**
   * Wrap a value read back from the store. Strings come back as {@link Text} even when they hold
   * JSON: only the codec knows which properties are structured.
   */
  static PropertyValue fromStorage(Object raw) {
    if (raw == null) return Cleared.INSTANCE;
    if (raw instanceof String s) return new Text(s);
    if (raw instanceof Number n) return new Numeric(n);
    if (raw instanceof Boolean b) return new Flag(b);
    return new Text(String.valueOf(raw));
  }
}
