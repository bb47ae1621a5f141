/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.profilecat.profiletype.provider;

import ai.floedb.profilecat.profiletype.def.FieldConstraint;
import ai.floedb.profilecat.profiletype.def.FieldSpec;
import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import ai.floedb.profilecat.profiletype.def.SupportStatus;
import ai.floedb.profilecat.profiletype.error.InvalidSchemaException;
import ai.floedb.profilecat.profiletype.support.ReleaseVersionComparator;
import ai.floedb.profilecat.types.FieldType;
import ai.floedb.profilecat.types.FieldValueCoercions;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads profile type definition documents.
 *
 * <pre>{@code
 * {
 *   "type_name": "os.heat.stack",
 *   "schema": {"timeout": {"type": "Integer", "updatable": true}},
 *   "support_status": {"1.0": [{"status": "SUPPORTED", "since": "2016.04"}]}
 * }
 * }</pre>
 *
 * <p>A document yields one {@link ProfileTypeSchema} per version key of {@code support_status}.
 * Each schema holds the top-level fields whose {@code min_version}/{@code max_version} window
 * admits that version; fields without a window appear in every version. Every problem found in
 * the document is reported at once through {@link InvalidSchemaException#errors()}. Structural
 * rules (required vs default, ledger order, constraint applicability) are left to registration.
 */
public final class ProfileTypeDefinitionParser {

  private static final ObjectMapper JSON =
      new ObjectMapper()
          .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
          .enable(DeserializationFeature.USE_LONG_FOR_INTS)
          .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  private static final Set<String> DOCUMENT_ATTRIBUTES =
      Set.of("type_name", "schema", "support_status");
  private static final Set<String> FIELD_ATTRIBUTES =
      Set.of("type", "default", "description", "required", "updatable", "schema", "constraints");
  private static final Set<String> TOP_LEVEL_FIELD_ATTRIBUTES =
      Set.of(
          "type",
          "default",
          "description",
          "required",
          "updatable",
          "schema",
          "constraints",
          "min_version",
          "max_version");
  private static final Set<String> ENTRY_ATTRIBUTES = Set.of("status", "since");

  private ProfileTypeDefinitionParser() {}

  public static List<ProfileTypeSchema> parse(String json) {
    try {
      return parse(JSON.readTree(json));
    } catch (JsonProcessingException e) {
      throw malformed(e);
    }
  }

  public static List<ProfileTypeSchema> parse(InputStream in) {
    try {
      return parse(JSON.readTree(in));
    } catch (JsonProcessingException e) {
      throw malformed(e);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read profile type definition", e);
    }
  }

  /** Parses a classpath resource such as {@code /profile-types/os.heat.stack.json}. */
  public static List<ProfileTypeSchema> parseResource(Class<?> anchor, String resourcePath) {
    InputStream in = anchor.getResourceAsStream(resourcePath);
    if (in == null) {
      throw new IllegalStateException("Profile type definition not found: " + resourcePath);
    }
    try (in) {
      return parse(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close profile type definition " + resourcePath, e);
    }
  }

  /** Parses an already-read document tree. */
  public static List<ProfileTypeSchema> parse(JsonNode root) {
    List<String> errors = new ArrayList<>();
    if (root == null || !root.isObject()) {
      throw new InvalidSchemaException(null, null, List.of("definition.root.type"));
    }
    unknownAttributes(root, DOCUMENT_ATTRIBUTES, "definition.attribute.unknown:", "", errors);

    JsonNode typeNameNode = root.get("type_name");
    String typeName =
        typeNameNode != null && typeNameNode.isTextual() && !typeNameNode.asText().isBlank()
            ? typeNameNode.asText().trim()
            : null;
    if (typeName == null) {
      errors.add("definition.type_name.required");
    }

    List<FieldSpec> fields = new ArrayList<>();
    JsonNode schemaNode = root.get("schema");
    if (schemaNode == null || !schemaNode.isObject()) {
      errors.add("definition.schema.required");
    } else {
      fields.addAll(parseFields(schemaNode, "", errors));
    }

    JsonNode statusNode = root.get("support_status");
    if (statusNode == null || !statusNode.isObject() || statusNode.isEmpty()) {
      errors.add("definition.support_status.required");
    } else {
      unusedFields(fields, statusNode, errors);
    }

    if (!errors.isEmpty()) {
      throw new InvalidSchemaException(typeName, null, errors);
    }

    List<ProfileTypeSchema> schemas = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> versions = statusNode.fields();
    while (versions.hasNext()) {
      Map.Entry<String, JsonNode> version = versions.next();
      String key = version.getKey().trim();
      if (key.isEmpty()) {
        errors.add("definition.support_status.version");
        continue;
      }
      ProfileTypeSchema.Builder builder = ProfileTypeSchema.builder(typeName, key);
      for (FieldSpec field : fields) {
        if (field.availableIn(key)) {
          builder.field(field);
        }
      }
      parseLedger(key, version.getValue(), builder, errors);
      schemas.add(builder.build());
    }

    if (!errors.isEmpty()) {
      throw new InvalidSchemaException(typeName, null, errors);
    }
    return List.copyOf(schemas);
  }

  // ------------------------------------------------------------
  // Fields
  // ------------------------------------------------------------

  private static List<FieldSpec> parseFields(JsonNode schema, String prefix, List<String> errors) {
    List<FieldSpec> out = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> it = schema.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      String name = entry.getKey();
      FieldSpec spec = parseField(name, entry.getValue(), prefix + name, errors);
      if (spec != null) {
        out.add(spec);
      }
    }
    return out;
  }

  private static FieldSpec parseField(
      String name, JsonNode node, String path, List<String> errors) {
    if (!node.isObject()) {
      errors.add("field.definition.type:" + path);
      return null;
    }
    int before = errors.size();
    boolean topLevel = path.equals(name);
    unknownAttributes(
        node,
        topLevel ? TOP_LEVEL_FIELD_ATTRIBUTES : FIELD_ATTRIBUTES,
        "field.attribute.unknown:",
        path + ".",
        errors);

    FieldType type = null;
    JsonNode typeNode = node.get("type");
    if (typeNode == null || !typeNode.isTextual()) {
      errors.add("field.type.required:" + path);
    } else {
      try {
        type = FieldType.fromName(typeNode.asText());
      } catch (IllegalArgumentException e) {
        errors.add("field.type.unknown:" + path);
      }
    }

    boolean required = flag(node, "required", path, errors);
    boolean updatable = flag(node, "updatable", path, errors);
    String description = "";
    JsonNode descriptionNode = node.get("description");
    if (descriptionNode != null && !descriptionNode.isNull()) {
      if (descriptionNode.isTextual()) {
        description = descriptionNode.asText();
      } else {
        errors.add("field.attribute.type:" + path + ".description");
      }
    }

    String minVersion = text(node, "min_version", path, errors);
    String maxVersion = text(node, "max_version", path, errors);
    if (minVersion != null
        && maxVersion != null
        && ReleaseVersionComparator.INSTANCE.compare(minVersion, maxVersion) > 0) {
      errors.add("field.version.range:" + path);
    }

    if (type == null) {
      return null;
    }
    FieldSpec.Builder builder =
        FieldSpec.builder(name, type)
            .required(required)
            .updatable(updatable)
            .description(description)
            .versions(minVersion, maxVersion);

    JsonNode defaultNode = node.get("default");
    if (defaultNode != null && !defaultNode.isNull()) {
      builder.defaultValue(defaultOf(type, defaultNode));
    }

    JsonNode nested = node.get("schema");
    if (nested != null && !nested.isNull()) {
      if (!nested.isObject()) {
        errors.add("field.attribute.type:" + path + ".schema");
      } else if (type == FieldType.LIST) {
        String itemPath = path + "[*]";
        Iterator<Map.Entry<String, JsonNode>> it = nested.fields();
        while (it.hasNext()) {
          Map.Entry<String, JsonNode> entry = it.next();
          String key = entry.getKey();
          boolean isItem = FieldSpec.ITEM_KEY.equals(key);
          String nestedPath = isItem ? itemPath : path + "." + key;
          FieldSpec item = parseField(key, entry.getValue(), nestedPath, errors);
          if (item == null) {
            continue;
          }
          if (isItem) {
            builder.items(item);
          } else {
            builder.field(item);
          }
        }
      } else {
        parseFields(nested, path + ".", errors).forEach(builder::field);
      }
    }

    JsonNode constraints = node.get("constraints");
    if (constraints != null && !constraints.isNull()) {
      if (!constraints.isArray()) {
        errors.add("field.attribute.type:" + path + ".constraints");
      } else {
        for (JsonNode constraint : constraints) {
          FieldConstraint parsed = parseConstraint(constraint, path, errors);
          if (parsed != null) {
            builder.constraint(parsed);
          }
        }
      }
    }

    return errors.size() == before ? builder.build() : null;
  }

  private static boolean flag(JsonNode node, String attribute, String path, List<String> errors) {
    JsonNode value = node.get(attribute);
    if (value == null || value.isNull()) {
      return false;
    }
    if (!value.isBoolean()) {
      errors.add("field.attribute.type:" + path + "." + attribute);
      return false;
    }
    return value.booleanValue();
  }

  private static String text(JsonNode node, String attribute, String path, List<String> errors) {
    JsonNode value = node.get(attribute);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isTextual() || value.asText().isBlank()) {
      errors.add("field.attribute.type:" + path + "." + attribute);
      return null;
    }
    return value.asText().trim();
  }

  /** A windowed field that no declared version admits would silently vanish from every schema. */
  private static void unusedFields(
      List<FieldSpec> fields, JsonNode statusNode, List<String> errors) {
    for (FieldSpec field : fields) {
      if (!field.hasVersionWindow()) {
        continue;
      }
      boolean used = false;
      Iterator<String> versions = statusNode.fieldNames();
      while (versions.hasNext() && !used) {
        String version = versions.next().trim();
        used = !version.isEmpty() && field.availableIn(version);
      }
      if (!used) {
        errors.add("field.version.excluded:" + field.name());
      }
    }
  }

  /**
   * Declared defaults are stored in the field's normalized form when they conform; otherwise the
   * raw value is kept so registration reports the mismatch.
   */
  private static Object defaultOf(FieldType type, JsonNode node) {
    Object raw = JSON.convertValue(node, Object.class);
    return FieldValueCoercions.conforms(type, raw) ? FieldValueCoercions.coerce(type, raw) : raw;
  }

  // ------------------------------------------------------------
  // Constraints
  // ------------------------------------------------------------

  private static FieldConstraint parseConstraint(
      JsonNode node, String path, List<String> errors) {
    if (!node.isObject()) {
      errors.add("constraint.definition.type:" + path);
      return null;
    }
    String kind = node.path("type").asText("");
    switch (kind) {
      case "AllowedValues" -> {
        unknownAttributes(
            node, Set.of("type", "values"), "constraint.attribute.unknown:", path + ".", errors);
        JsonNode values = node.get("values");
        if (values == null || !values.isArray()) {
          errors.add("constraint.attribute.type:" + path + ".values");
          return null;
        }
        List<Object> allowed = new ArrayList<>();
        values.forEach(v -> allowed.add(JSON.convertValue(v, Object.class)));
        return new FieldConstraint.AllowedValues(allowed);
      }
      case "Range" -> {
        unknownAttributes(
            node,
            Set.of("type", "min", "max"),
            "constraint.attribute.unknown:",
            path + ".",
            errors);
        Double min = bound(node, "min", path, errors);
        Double max = bound(node, "max", path, errors);
        return new FieldConstraint.Range(min, max);
      }
      default -> {
        errors.add("constraint.type.unknown:" + path);
        return null;
      }
    }
  }

  private static Double bound(JsonNode node, String attribute, String path, List<String> errors) {
    JsonNode value = node.get(attribute);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isNumber()) {
      errors.add("constraint.attribute.type:" + path + "." + attribute);
      return null;
    }
    return value.doubleValue();
  }

  // ------------------------------------------------------------
  // Support status
  // ------------------------------------------------------------

  private static void parseLedger(
      String version, JsonNode entries, ProfileTypeSchema.Builder builder, List<String> errors) {
    if (!entries.isArray()) {
      errors.add("definition.support_status.entries:" + version);
      return;
    }
    for (JsonNode entry : entries) {
      if (!entry.isObject()
          || !entry.path("status").isTextual()
          || !entry.path("since").isTextual()) {
        errors.add("definition.support_status.entries:" + version);
        continue;
      }
      unknownAttributes(
          entry, ENTRY_ATTRIBUTES, "definition.attribute.unknown:", version + ".", errors);
      try {
        builder.status(
            SupportStatus.fromName(entry.get("status").asText()), entry.get("since").asText());
      } catch (IllegalArgumentException e) {
        errors.add("definition.support_status.status:" + version);
      }
    }
  }

  // ------------------------------------------------------------
  // Helpers
  // ------------------------------------------------------------

  private static void unknownAttributes(
      JsonNode node, Set<String> allowed, String code, String prefix, List<String> errors) {
    Iterator<String> names = node.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (!allowed.contains(name)) {
        errors.add(code + prefix + name);
      }
    }
  }

  private static InvalidSchemaException malformed(JsonProcessingException e) {
    return new InvalidSchemaException(
        null, null, List.of("definition.json:" + e.getOriginalMessage()), e);
  }
}
