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

import ai.floedb.profilecat.profiletype.def.FieldSpec;
import ai.floedb.profilecat.profiletype.def.ProfileSpec;
import ai.floedb.profilecat.profiletype.def.ProfileSpecPatch;
import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import ai.floedb.profilecat.profiletype.error.ImmutableFieldChangedException;
import ai.floedb.profilecat.profiletype.error.MissingRequiredFieldException;
import ai.floedb.profilecat.profiletype.error.UnknownFieldException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether a proposed update may be applied to an existing specification.
 *
 * <p>Updates are partial: a field absent from the patch keeps its current value, and a field
 * explicitly set to {@code null} is reset to its default (or cleared). Only fields whose resulting
 * value differs from the current one are checked against {@link FieldSpec#updatable()}, so
 * resubmitting an unchanged immutable value is allowed.
 *
 * <p>The enforcer compares values as given. Callers validate the proposed values first (see
 * {@link ProfileSpecValidator#validatePatch}) so both sides are in normalized form.
 */
public final class UpdatePolicyEnforcer {

  private UpdatePolicyEnforcer() {}

  public static ProfileSpec authorizeUpdate(
      ProfileTypeSchema schema, ProfileSpec current, ProfileSpecPatch proposed) {
    if (schema == null || current == null || proposed == null) {
      throw new IllegalArgumentException("schema, current and proposed specs are required");
    }
    requireSameSchema(schema, current.key().toString(), current.key().equals(schema.key()));
    requireSameSchema(schema, proposed.key().toString(), proposed.key().equals(schema.key()));

    Map<String, Object> merged = new LinkedHashMap<>(current.values());
    for (Map.Entry<String, Object> change : proposed.changes().entrySet()) {
      String name = change.getKey();
      FieldSpec spec = schema.field(name).orElseThrow(() -> new UnknownFieldException(name));

      Object next = change.getValue();
      if (next == null) {
        if (spec.required()) {
          throw new MissingRequiredFieldException(name);
        }
        next = spec.hasDefault() ? FieldValueNormalizer.defaultValue(spec, name) : null;
      }

      Object previous = current.values().get(name);
      if (Objects.equals(previous, next)) {
        continue;
      }
      if (!spec.updatable()) {
        throw new ImmutableFieldChangedException(name, previous, next);
      }
      if (next == null) {
        merged.remove(name);
      } else {
        merged.put(name, next);
      }
    }

    // keep declaration order regardless of which fields were added
    Map<String, Object> ordered = new LinkedHashMap<>();
    for (String name : schema.fields().keySet()) {
      if (merged.containsKey(name)) {
        ordered.put(name, merged.get(name));
      }
    }
    return new ProfileSpec(schema.key(), ordered);
  }

  /** Convenience for callers holding an already-normalized partial map. */
  public static ProfileSpec authorizeUpdate(
      ProfileTypeSchema schema, ProfileSpec current, Map<String, ?> proposed) {
    if (schema == null) {
      throw new IllegalArgumentException("schema is required");
    }
    Map<String, Object> changes = new LinkedHashMap<>();
    if (proposed != null) {
      changes.putAll(proposed);
    }
    return authorizeUpdate(schema, current, new ProfileSpecPatch(schema.key(), changes));
  }

  private static void requireSameSchema(ProfileTypeSchema schema, String other, boolean same) {
    if (!same) {
      throw new IllegalArgumentException(
          "Specification for " + other + " cannot be updated with schema " + schema.key());
    }
  }
}
