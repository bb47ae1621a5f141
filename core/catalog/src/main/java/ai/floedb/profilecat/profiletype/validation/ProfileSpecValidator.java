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
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Validates raw, user-supplied specifications against a resolved schema and produces normalized
 * {@link ProfileSpec}s.
 *
 * <p>Checks run in a fixed order so the same input always yields the same error: undeclared keys
 * first (lowest key wins), then declared fields in declaration order. Both operations are pure;
 * the returned objects share no mutable state with the input or the schema.
 *
 * <p>Setting a field in the last version its {@code max_version} allows is accepted with a
 * warning.
 */
public final class ProfileSpecValidator {

  private static final Logger LOG = Logger.getLogger(ProfileSpecValidator.class);

  private ProfileSpecValidator() {}

  /**
   * Normalizes a complete specification.
   *
   * @throws ai.floedb.profilecat.profiletype.error.UnknownFieldException for undeclared keys
   * @throws ai.floedb.profilecat.profiletype.error.MissingRequiredFieldException for absent
   *     required fields
   * @throws ai.floedb.profilecat.profiletype.error.TypeMismatchException for non-conforming values
   * @throws ai.floedb.profilecat.profiletype.error.ConstraintViolatedException for values outside
   *     declared constraints
   */
  public static ProfileSpec validate(ProfileTypeSchema schema, Map<String, ?> rawSpec) {
    if (schema == null) {
      throw new IllegalArgumentException("schema is required");
    }
    Map<String, ?> raw = rawSpec == null ? Map.of() : rawSpec;
    warnLastSupported(schema, raw);
    return new ProfileSpec(
        schema.key(), FieldValueNormalizer.normalizeFields(schema.fields(), "", raw));
  }

  /** Normalizes the fields present in an update request without applying defaults. */
  public static ProfileSpecPatch validatePatch(ProfileTypeSchema schema, Map<String, ?> rawPatch) {
    if (schema == null) {
      throw new IllegalArgumentException("schema is required");
    }
    Map<String, ?> raw = rawPatch == null ? Map.of() : rawPatch;
    warnLastSupported(schema, raw);
    return new ProfileSpecPatch(
        schema.key(), FieldValueNormalizer.normalizePartial(schema.fields(), "", raw));
  }

  private static void warnLastSupported(ProfileTypeSchema schema, Map<String, ?> raw) {
    for (FieldSpec field : schema.fields().values()) {
      if (raw.get(field.name()) != null && field.lastSupportedIn(schema.version())) {
        LOG.warnf(
            "Field %s of %s is supported up to version %s only",
            field.name(), schema.key(), field.maxVersion());
      }
    }
  }
}
