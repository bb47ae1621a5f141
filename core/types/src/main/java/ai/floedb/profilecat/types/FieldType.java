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

package ai.floedb.profilecat.types;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of value types a profile field may declare.
 *
 * <p>Scalar kinds ({@link #BOOLEAN}, {@link #INTEGER}, {@link #FLOAT}, {@link #STRING}) normalize
 * to {@code Boolean}, {@code Long}, {@code Double} and {@code String}. Container kinds ({@link
 * #MAP}, {@link #LIST}) normalize to unmodifiable {@code Map<String, Object>} and {@code
 * List<Object>}; their element shape is described by an optional nested schema on the field, not
 * by this enum.
 */
public enum FieldType {
  BOOLEAN("Boolean", false),
  INTEGER("Integer", false),
  FLOAT("Float", false),
  STRING("String", false),
  MAP("Map", true),
  LIST("List", true);

  private static final Map<String, FieldType> ALIASES;

  static {
    Map<String, FieldType> m = new HashMap<>();
    for (FieldType type : values()) {
      m.put(type.name(), type);
    }
    m.put("BOOL", BOOLEAN);
    m.put("INT", INTEGER);
    m.put("NUMBER", FLOAT);
    m.put("DICT", MAP);
    ALIASES = Map.copyOf(m);
  }

  private final String displayName;
  private final boolean container;

  FieldType(String displayName, boolean container) {
    this.displayName = displayName;
    this.container = container;
  }

  /** Name used in definition documents and error messages, e.g. {@code "Integer"}. */
  public String displayName() {
    return displayName;
  }

  /** True for {@link #MAP} and {@link #LIST}, the only kinds that may carry a nested schema. */
  public boolean isContainer() {
    return container;
  }

  /**
   * Resolves a declared type name to a {@link FieldType}.
   *
   * <p>The lookup is case-insensitive, so {@code "Integer"}, {@code "integer"} and {@code "INT"}
   * all resolve to {@link #INTEGER}. {@code "Number"} is accepted as an alias of {@link #FLOAT}
   * and {@code "Dict"} of {@link #MAP}.
   *
   * @param candidate declared type name
   * @return the matching type
   * @throws IllegalArgumentException if {@code candidate} is null, blank or not recognised
   */
  public static FieldType fromName(String candidate) {
    if (candidate == null) {
      throw new IllegalArgumentException("Field type must not be null");
    }
    String normalized = candidate.trim().toUpperCase(Locale.ROOT);
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("Field type must not be blank");
    }
    FieldType type = ALIASES.get(normalized);
    if (type == null) {
      throw new IllegalArgumentException("Unknown field type: " + candidate);
    }
    return type;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
