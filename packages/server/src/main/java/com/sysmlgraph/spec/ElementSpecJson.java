package com.sysmlgraph.spec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Jackson binding for {@link ElementSpec}, driven by the {@link SpecField} table.
 *
 * <p>An explicit JSON {@code null} is kept as "defined, cleared", and serialized back as {@code
 * null}; an absent property stays undefined.
 */
final class ElementSpecJson {
  private ElementSpecJson() {}

  public static final class Serializer extends StdSerializer<ElementSpec> {
    public Serializer() {
      super(ElementSpec.class);
    }

    @Override
    public void serialize(ElementSpec spec, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      if (spec.getId() != null) gen.writeStringField("id", spec.getId());
      if (spec.getName() != null) gen.writeStringField("name", spec.getName());
      for (SpecField<?> field : spec.definedFields()) {
        Object value = spec.getRaw(field);
        if (value == null) {
          gen.writeNullField(field.name());
        } else {
          provider.defaultSerializeField(field.name(), value, gen);
        }
      }
      for (Map.Entry<String, Object> extra : spec.getExtras().entrySet()) {
        provider.defaultSerializeField(extra.getKey(), extra.getValue(), gen);
      }
      gen.writeEndObject();
    }
  }

  public static final class Deserializer extends StdDeserializer<ElementSpec> {
    public Deserializer() {
      super(ElementSpec.class);
    }

    @Override
    public ElementSpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JsonNode tree = ctxt.readTree(p);
      if (!tree.isObject()) {
        return ctxt.reportInputMismatch(
            ElementSpec.class, "Element spec must be a JSON object, got %s", tree.getNodeType());
      }
      ElementSpec spec = new ElementSpec();
      Iterator<Map.Entry<String, JsonNode>> it = tree.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> entry = it.next();
        String key = entry.getKey();
        JsonNode node = entry.getValue();
        if ("id".equals(key)) {
          spec.setId(node.isNull() ? null : node.asText());
          continue;
        }
        if ("name".equals(key)) {
          spec.setName(node.isNull() ? null : node.asText());
          continue;
        }
        Optional<SpecField<?>> field = SpecField.byName(key);
        if (field.isPresent()) {
          Object value = node.isNull() ? null : ctxt.readTreeAsValue(node, field.get().type());
          spec.setRaw(field.get(), value);
        } else {
          spec.putExtra(key, node.isNull() ? null : ctxt.readTreeAsValue(node, Object.class));
        }
      }
      return spec;
    }
  }
}
