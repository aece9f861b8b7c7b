package com.sysmlgraph.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmlgraph.exception.SerializationException;
import com.sysmlgraph.graph.GraphProperties;
import com.sysmlgraph.graph.PropertyValue;
import com.sysmlgraph.logging.LoggingService;
import com.sysmlgraph.spec.ActionReference;
import com.sysmlgraph.spec.ActionValue;
import com.sysmlgraph.spec.ElementSpec;
import com.sysmlgraph.spec.RelationshipSpec;
import com.sysmlgraph.spec.SpecField;
import com.sysmlgraph.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Converts element and relationship specs to flat graph properties and back.
 *
 * <p>Every optional field is handled according to its {@link com.sysmlgraph.spec.FieldStrategy}
 * in the {@link SpecField} table. Encoding omits every field left undefined, so the result can
 * be merged into a stored node without touching other properties. Decoding never fails as a
 * whole: a property holding corrupt JSON is skipped and reported, the rest of the element still
 * decodes.
 *
 * <p>No validation happens here; required fields, kinds and references are the caller's concern.
 */
public final class PropertyCodec {
  private static final Logger log = LoggingService.getLogger(PropertyCodec.class);

  public static final String ID = "id";
  public static final String NAME = "name";
  public static final String LABEL = "label";
  public static final String CREATED_AT = "createdAt";
  public static final String UPDATED_AT = "updatedAt";

  private static final Set<String> RELATIONSHIP_RESERVED =
      Set.of(ID, "type", "source", "target", LABEL);
  private static final Set<String> TIMESTAMPS = Set.of(CREATED_AT, UPDATED_AT);

  private PropertyCodec() {}

  // ---------------------------------------------------------------------------------------------
  // Elements
  // ---------------------------------------------------------------------------------------------

  public static GraphProperties encode(ElementSpec spec) {
    GraphProperties props = new GraphProperties();
    if (spec.getId() != null) props.putText(ID, spec.getId());
    if (spec.getName() != null) props.putText(NAME, spec.getName());

    for (SpecField<?> field : SpecField.values()) {
      if (!spec.isDefined(field)) continue;
      encodeField(field, spec.get(field)).ifPresent(v -> props.put(field.storageKey(), v));
    }
    return props;
  }

  private static Optional<PropertyValue> encodeField(SpecField<?> field, Object value) {
    switch (field.strategy()) {
      case SCALAR:
        if (value instanceof String s && !s.isEmpty()) {
          return Optional.of(PropertyValue.text(s));
        }
        return Optional.empty();
      case JSON:
        return value == null ? Optional.empty() : toJson(field, value);
      case CLEARABLE_JSON:
        if (value instanceof Collection<?> c && !c.isEmpty()) {
          return toJson(field, value);
        }
        return Optional.of(PropertyValue.cleared());
      case ACTION:
        if (value instanceof ActionValue action) {
          if (action.isReference()) {
            return toJson(field, action.getReference().get());
          }
          if (!action.isBlank()) {
            return Optional.of(PropertyValue.text(action.getText()));
          }
        }
        return Optional.of(PropertyValue.cleared());
      case DERIVED:
      default:
        return Optional.empty();
    }
  }

  private static Optional<PropertyValue> toJson(SpecField<?> field, Object value) {
    try {
      return Optional.of(PropertyValue.json(JacksonUtility.toJson(value)));
    } catch (SerializationException e) {
      log.warn("Skipping field '{}': {}", field.name(), e.getMessage(), e);
      return Optional.empty();
    }
  }

  /** Decode a property map exactly as a graph store returned it. */
  public static ElementSpec decode(Map<String, ?> properties) {
    return decode(GraphProperties.fromMap(properties));
  }

  public static ElementSpec decode(GraphProperties props) {
    return decodeWithDiagnostics(props).spec();
  }

  /** Like {@link #decode(GraphProperties)}, but also returns the fields that were skipped. */
  public static DecodeResult decodeWithDiagnostics(GraphProperties props) {
    ElementSpec spec =
        new ElementSpec(props.getString(ID).orElse(null), props.getString(NAME).orElse(null));
    List<DecodeIssue> issues = new ArrayList<>();

    for (SpecField<?> field : SpecField.values()) {
      Optional<String> stored = props.getString(field.storageKey()).filter(s -> !s.isEmpty());
      if (stored.isEmpty()) continue;

      switch (field.strategy()) {
        case SCALAR:
          put(spec, field, stored.get());
          break;
        case JSON:
        case CLEARABLE_JSON:
          try {
            putJson(spec, field, stored.get());
          } catch (SerializationException e) {
            String reason = rootMessage(e);
            log.warn(
                "Failed to parse {} JSON of element {}: {}", field.storageKey(), spec.getId(), reason);
            issues.add(new DecodeIssue(field.name(), field.storageKey(), reason));
          }
          break;
        case ACTION:
          put(spec, field, decodeAction(stored.get()));
          break;
        case DERIVED:
        default:
          break;
      }
    }
    return new DecodeResult(spec, issues);
  }

  /** Stored JSON objects are references; anything else is legacy plain text. */
  private static ActionValue decodeAction(String stored) {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    try {
      JsonNode node = mapper.readTree(stored);
      if (node != null && node.isObject()) {
        return ActionValue.reference(mapper.treeToValue(node, ActionReference.class));
      }
    } catch (JsonProcessingException e) {
      log.debug("Action value is not JSON, keeping it as text: {}", stored);
    }
    return ActionValue.text(stored);
  }

  private static <T> void put(ElementSpec spec, SpecField<T> field, Object value) {
    spec.set(field, field.cast(value));
  }

  private static <T> void putJson(ElementSpec spec, SpecField<T> field, String json) {
    T value = JacksonUtility.fromJson(json, field.type());
    if (value != null) spec.set(field, value);
  }

  private static String rootMessage(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null) {
      root = root.getCause();
    }
    if (root instanceof JsonProcessingException jpe) {
      return jpe.getOriginalMessage();
    }
    return String.valueOf(root.getMessage());
  }

  // ---------------------------------------------------------------------------------------------
  // Relationships
  // ---------------------------------------------------------------------------------------------

  /**
   * Properties stored on a relationship: {@code id}, a non-empty {@code label}, and every scalar
   * extra property. Type and endpoints are carried by the relationship itself.
   */
  public static GraphProperties encodeRelationship(RelationshipSpec spec) {
    GraphProperties props = new GraphProperties();
    if (spec.getId() != null) props.putText(ID, spec.getId());
    if (spec.getLabel() != null && !spec.getLabel().isEmpty()) {
      props.putText(LABEL, spec.getLabel());
    }
    for (Map.Entry<String, Object> e : spec.getProperties().entrySet()) {
      String key = e.getKey();
      Object value = e.getValue();
      if (RELATIONSHIP_RESERVED.contains(key) || value == null) continue;
      if (value instanceof String s) {
        if (!s.isEmpty()) props.putText(key, s);
      } else if (value instanceof Number n) {
        props.put(key, PropertyValue.number(n));
      } else if (value instanceof Boolean b) {
        props.put(key, PropertyValue.flag(b));
      } else {
        log.debug(
            "Dropping non-scalar property '{}' of relationship {}", key, spec.getId());
      }
    }
    return props;
  }

  /**
   * Rebuild a relationship from its storage type, endpoints and properties. Relationships stored
   * without an id get {@code <source>-<edge kind>-<target>}.
   */
  public static RelationshipSpec decodeRelationship(
      String relType, String sourceId, String targetId, GraphProperties props) {
    String edgeKind = KindTranslator.relTypeToEdgeKind(relType);
    String id =
        props
            .getString(ID)
            .filter(s -> !s.isEmpty())
            .orElse(sourceId + "-" + edgeKind + "-" + targetId);
    RelationshipSpec spec = new RelationshipSpec(id, edgeKind, sourceId, targetId);
    props.getString(LABEL).ifPresent(spec::setLabel);

    for (Map.Entry<String, PropertyValue> e : props.asMap().entrySet()) {
      String key = e.getKey();
      if (ID.equals(key) || LABEL.equals(key) || TIMESTAMPS.contains(key)) continue;
      Object value = e.getValue().toStorage();
      if (value != null) spec.setProperty(key, value);
    }
    return spec;
  }
}
