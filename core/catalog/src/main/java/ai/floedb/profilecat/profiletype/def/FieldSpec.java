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

package ai.floedb.profilecat.profiletype.def;

import ai.floedb.profilecat.profiletype.support.ReleaseVersionComparator;
import ai.floedb.profilecat.types.FieldType;
import ai.floedb.profilecat.types.FieldValues;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declaration of one named field of a profile type.
 *
 * <p>A {@code null} {@link #defaultValue()} means the field declares no default. {@link #schema()}
 * is only meaningful for container types: a {@link FieldType#MAP} lists its nested fields by
 * name, a {@link FieldType#LIST} holds exactly one item declaration under {@link #ITEM_KEY}.
 *
 * <p>{@link #minVersion()} and {@link #maxVersion()} bound the profile type versions that may use a
 * top-level field; either may be {@code null} for an open end. Both ends are inclusive.
 *
 * <p>The record does not reject contradictory declarations (for example a required field with a
 * default); those are reported by the registry's schema validator so all problems of a definition
 * surface together.
 */
public record FieldSpec(
    String name,
    FieldType type,
    Object defaultValue,
    boolean required,
    boolean updatable,
    String description,
    Map<String, FieldSpec> schema,
    List<FieldConstraint> constraints,
    String minVersion,
    String maxVersion) {

  /** Key of the single item declaration in a List field's nested schema. */
  public static final String ITEM_KEY = "*";

  public FieldSpec {
    name = name == null ? "" : name.trim();
    Objects.requireNonNull(type, "type");
    defaultValue = FieldValues.immutableCopy(defaultValue);
    description = description == null ? "" : description;
    schema =
        schema == null || schema.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(schema));
    constraints = List.copyOf(constraints == null ? List.of() : constraints);
    minVersion = minVersion == null || minVersion.isBlank() ? null : minVersion.trim();
    maxVersion = maxVersion == null || maxVersion.isBlank() ? null : maxVersion.trim();
  }

  public boolean hasVersionWindow() {
    return minVersion != null || maxVersion != null;
  }

  /** Whether profile type version {@code version} falls inside this field's version window. */
  public boolean availableIn(String version) {
    var cmp = ReleaseVersionComparator.INSTANCE;
    return (minVersion == null || cmp.compare(version, minVersion) >= 0)
        && (maxVersion == null || cmp.compare(version, maxVersion) <= 0);
  }

  /** Whether {@code version} is the last version allowed to use this field. */
  public boolean lastSupportedIn(String version) {
    return maxVersion != null
        && ReleaseVersionComparator.INSTANCE.compare(version, maxVersion) == 0;
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }

  public boolean hasSchema() {
    return !schema.isEmpty();
  }

  /** Item declaration of a List field, if one is declared. */
  public Optional<FieldSpec> itemSpec() {
    return type == FieldType.LIST ? Optional.ofNullable(schema.get(ITEM_KEY)) : Optional.empty();
  }

  public static Builder builder(String name, FieldType type) {
    return new Builder(name, type);
  }

  /** Fluent builder; fields default to optional, immutable, undocumented and unconstrained. */
  public static final class Builder {
    private final String name;
    private final FieldType type;
    private Object defaultValue;
    private boolean required;
    private boolean updatable;
    private String description = "";
    private final Map<String, FieldSpec> schema = new LinkedHashMap<>();
    private final List<FieldConstraint> constraints = new ArrayList<>();
    private String minVersion;
    private String maxVersion;

    private Builder(String name, FieldType type) {
      this.name = name;
      this.type = type;
    }

    public Builder defaultValue(Object value) {
      this.defaultValue = value;
      return this;
    }

    public Builder required(boolean value) {
      this.required = value;
      return this;
    }

    public Builder updatable(boolean value) {
      this.updatable = value;
      return this;
    }

    public Builder description(String value) {
      this.description = value;
      return this;
    }

    /** Adds a nested field (Map fields). */
    public Builder field(FieldSpec nested) {
      schema.put(nested.name(), nested);
      return this;
    }

    /** Declares the item shape (List fields). */
    public Builder items(FieldSpec item) {
      schema.put(ITEM_KEY, item);
      return this;
    }

    public Builder constraint(FieldConstraint constraint) {
      constraints.add(constraint);
      return this;
    }

    /** Restricts the field to profile type versions {@code min..max}; either end may be null. */
    public Builder versions(String min, String max) {
      this.minVersion = min;
      this.maxVersion = max;
      return this;
    }

    public FieldSpec build() {
      return new FieldSpec(
          name,
          type,
          defaultValue,
          required,
          updatable,
          description,
          schema,
          constraints,
          minVersion,
          maxVersion);
    }
  }
}
