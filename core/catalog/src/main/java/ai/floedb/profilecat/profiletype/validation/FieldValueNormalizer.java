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

package ai.floedb.profilecat.profiletype.validation;

import ai.floedb.profilecat.profiletype.def.FieldConstraint;
import ai.floedb.profilecat.profiletype.def.FieldSpec;
import ai.floedb.profilecat.profiletype.error.ConstraintViolatedException;
import ai.floedb.profilecat.profiletype.error.MissingRequiredFieldException;
import ai.floedb.profilecat.profiletype.error.TypeMismatchException;
import ai.floedb.profilecat.profiletype.error.UnknownFieldException;
import ai.floedb.profilecat.types.FieldType;
import ai.floedb.profilecat.types.FieldValueCoercions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field-level normalization shared by spec validation, patch validation and registration-time
 * default checks.
 *
 * <p>Paths in errors are dotted for nested map fields and indexed for list items, e.g. {@code
 * networks[0].port}.
 */
public final class FieldValueNormalizer {

  private FieldValueNormalizer() {}

  /**
   * Normalizes a full field set: rejects undeclared keys, applies defaults, enforces required
   * fields. Unset optional fields without a default are left out of the result.
   *
   * @param prefix path prefix for error reporting; empty at the top level
   */
  public static Map<String, Object> normalizeFields(
      Map<String, FieldSpec> fields, String prefix, Map<?, ?> raw) {
    rejectUnknownKeys(fields, prefix, raw);

    Map<String, Object> out = new LinkedHashMap<>();
    for (FieldSpec spec : fields.values()) {
      String path = prefix + spec.name();
      Object value = raw.get(spec.name());
      if (value != null) {
        out.put(spec.name(), normalizeValue(spec, path, value));
      } else if (spec.required()) {
        throw new MissingRequiredFieldException(path);
      } else if (spec.hasDefault()) {
        out.put(spec.name(), defaultValue(spec, path));
      }
    }
    return out;
  }

  /**
   * Normalizes only the keys present in {@code raw}. Explicit nulls are kept as reset markers; no
   * defaults are applied and required fields are not enforced.
   */
  public static Map<String, Object> normalizePartial(
      Map<String, FieldSpec> fields, String prefix, Map<?, ?> raw) {
    rejectUnknownKeys(fields, prefix, raw);

    Map<String, Object> out = new LinkedHashMap<>();
    for (FieldSpec spec : fields.values()) {
      if (!raw.containsKey(spec.name())) {
        continue;
      }
      Object value = raw.get(spec.name());
      out.put(
          spec.name(), value == null ? null : normalizeValue(spec, prefix + spec.name(), value));
    }
    return out;
  }

  /** Fresh normalized copy of the field's declared default. */
  public static Object defaultValue(FieldSpec spec, String path) {
    return normalizeValue(spec, path, spec.defaultValue());
  }

  /** Type-checks, coerces and constraint-checks one supplied value. */
  public static Object normalizeValue(FieldSpec spec, String path, Object raw) {
    Object value;
    try {
      value = FieldValueCoercions.coerce(spec.type(), raw);
    } catch (IllegalArgumentException e) {
      throw new TypeMismatchException(path, spec.type(), raw, e);
    }

    if (spec.hasSchema()) {
      value = normalizeNested(spec, path, value);
    }

    for (FieldConstraint constraint : spec.constraints()) {
      if (!constraint.accepts(spec.type(), value)) {
        throw new ConstraintViolatedException(path, constraint.describe(), value);
      }
    }
    return value;
  }

  private static Object normalizeNested(FieldSpec spec, String path, Object value) {
    if (spec.type() == FieldType.MAP) {
      Map<?, ?> nested = (Map<?, ?>) value;
      return Collections.unmodifiableMap(normalizeFields(spec.schema(), path + ".", nested));
    }

    Optional<FieldSpec> item = spec.itemSpec();
    if (item.isEmpty()) {
      return value;
    }
    List<?> elements = (List<?>) value;
    List<Object> out = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      out.add(normalizeValue(item.get(), path + "[" + i + "]", elements.get(i)));
    }
    return Collections.unmodifiableList(out);
  }

  private static void rejectUnknownKeys(
      Map<String, FieldSpec> fields, String prefix, Map<?, ?> raw) {
    Optional<String> unknown =
        raw.keySet().stream()
            .map(String::valueOf)
            .filter(key -> !fields.containsKey(key))
            .sorted()
            .findFirst();
    if (unknown.isPresent()) {
      throw new UnknownFieldException(prefix + unknown.get());
    }
  }
}
