// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.github.simbo1905.envelope.JsonValues.MAPPER;

/// JSON text form of a TypeDescriptor as stored in the schema block.
///
/// A scalar is a JSON string. An array is `{"type":"array","elementType":...}` and an object is
/// `{"type":"object","properties":{...}}`.
final class SchemaText {

  static final String TYPE = "type";
  static final String ELEMENT_TYPE = "elementType";
  static final String PROPERTIES = "properties";
  static final String ARRAY = "array";
  static final String OBJECT = "object";

  private SchemaText() {
  }

  static String write(TypeDescriptor descriptor) {
    try {
      return MAPPER.writeValueAsString(toNode(descriptor));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Schema tree could not be rendered as JSON", e);
    }
  }

  static JsonNode toNode(TypeDescriptor descriptor) {
    final JsonNodeFactory nodes = MAPPER.getNodeFactory();
    if (descriptor instanceof TypeDescriptor.Scalar scalar) {
      return nodes.textNode(scalar.name());
    }
    final ObjectNode node = nodes.objectNode();
    if (descriptor instanceof TypeDescriptor.ArrayOf array) {
      node.put(TYPE, ARRAY);
      node.set(ELEMENT_TYPE, toNode(array.element()));
    } else {
      final ObjectNode properties = nodes.objectNode();
      ((TypeDescriptor.ObjectOf) descriptor).properties().forEach((name, child) -> properties.set(name, toNode(child)));
      node.put(TYPE, OBJECT);
      node.set(PROPERTIES, properties);
    }
    return node;
  }

  /// Parse the top level schema block. A bare JSON object of property descriptors without the
  /// `{"type":"object"}` wrapper is also accepted, which is how older writers laid it out.
  static TypeDescriptor.ObjectOf parseTopLevel(String text) {
    final JsonNode root;
    try {
      root = MAPPER.readTree(text);
    } catch (JsonProcessingException e) {
      throw new FramingException("Schema block is not valid JSON: " + e.getOriginalMessage());
    }
    if (root == null || !root.isObject()) {
      throw new FramingException("Schema block is not a JSON object: " + text);
    }
    if (isWrappedObject(root)) {
      return (TypeDescriptor.ObjectOf) fromNode(root);
    }
    return new TypeDescriptor.ObjectOf(properties(root));
  }

  static TypeDescriptor fromNode(JsonNode node) {
    if (node.isTextual()) {
      return new TypeDescriptor.Scalar(node.textValue());
    }
    if (!node.isObject()) {
      throw new FramingException("Schema node is neither a type name nor an object: " + node);
    }
    final String type = node.path(TYPE).asText(OBJECT);
    return switch (type) {
      case ARRAY -> new TypeDescriptor.ArrayOf(node.has(ELEMENT_TYPE) ? fromNode(node.get(ELEMENT_TYPE)) : TypeDescriptor.OBJECT);
      case OBJECT -> new TypeDescriptor.ObjectOf(node.has(PROPERTIES) ? properties(node.get(PROPERTIES)) : Map.of());
      default -> throw new FramingException("Unknown schema container type '" + type + "'");
    };
  }

  private static boolean isWrappedObject(JsonNode node) {
    return OBJECT.equals(node.path(TYPE).textValue()) && node.path(PROPERTIES).isObject();
  }

  private static Map<String, TypeDescriptor> properties(JsonNode node) {
    if (!node.isObject()) {
      throw new FramingException("Schema properties must be a JSON object: " + node);
    }
    final Map<String, TypeDescriptor> properties = new LinkedHashMap<>();
    node.fields().forEachRemaining(entry -> properties.put(entry.getKey(), fromNode(entry.getValue())));
    return properties;
  }
}
