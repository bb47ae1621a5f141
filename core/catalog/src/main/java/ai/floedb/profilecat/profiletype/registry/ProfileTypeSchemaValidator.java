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

package ai.floedb.profilecat.profiletype.registry;

import ai.floedb.profilecat.profiletype.def.FieldConstraint;
import ai.floedb.profilecat.profiletype.def.FieldSpec;
import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import ai.floedb.profilecat.profiletype.def.SupportStatusEntry;
import ai.floedb.profilecat.profiletype.error.ConstraintViolatedException;
import ai.floedb.profilecat.profiletype.error.ProfileTypeException;
import ai.floedb.profilecat.profiletype.error.TypeMismatchException;
import ai.floedb.profilecat.profiletype.support.ReleaseVersionComparator;
import ai.floedb.profilecat.profiletype.validation.FieldValueNormalizer;
import ai.floedb.profilecat.types.FieldType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Performs structural validation of profile type schemas before they are registered.
 *
 * <p>Returns machine-readable codes ({@code field.required_with_default:timeout}); {@link
 * ProfileTypeValidationFormatter} turns them into messages.
 */
public final class ProfileTypeSchemaValidator {

  private ProfileTypeSchemaValidator() {}

  /** Runs validation and returns every error found; an empty list means the schema is valid. */
  public static List<String> validate(ProfileTypeSchema schema) {
    List<String> errors = new ArrayList<>();
    if (schema == null) {
      errors.add("schema.null");
      return errors;
    }

    validateFields(schema.fields(), "", errors);
    validateVersionWindows(schema, errors);
    validateSupportStatus(schema.supportStatus(), errors);
    return errors;
  }

  // ------------------------------------------------------------
  // Fields
  // ------------------------------------------------------------

  private static void validateFields(
      Map<String, FieldSpec> fields, String prefix, List<String> errors) {
    for (Map.Entry<String, FieldSpec> entry : fields.entrySet()) {
      String key = entry.getKey() == null ? "" : entry.getKey();
      FieldSpec spec = entry.getValue();
      if (key.isBlank() || spec == null || spec.name().isBlank()) {
        errors.add(prefix.isEmpty() ? "field.name.required" : "field.name.required:" + prefix);
        continue;
      }
      String path = prefix + key;
      if (!key.equals(spec.name())) {
        errors.add("field.name.mismatch:" + path);
      }
      if (!prefix.isEmpty() && spec.hasVersionWindow()) {
        errors.add("field.version.nested:" + path);
      }
      validateField(spec, path, errors);
    }
  }

  private static void validateField(FieldSpec spec, String path, List<String> errors) {
    int before = errors.size();

    if (spec.required() && spec.hasDefault()) {
      errors.add("field.required_with_default:" + path);
    }

    if (spec.hasSchema()) {
      if (!spec.type().isContainer()) {
        errors.add("field.schema.scalar:" + path);
      } else if (spec.type() == FieldType.LIST) {
        if (spec.schema().size() != 1 || spec.itemSpec().isEmpty()) {
          errors.add("field.schema.item:" + path);
        } else {
          FieldSpec item = spec.itemSpec().get();
          if (item.hasVersionWindow()) {
            errors.add("field.version.nested:" + path + "[*]");
          }
          validateField(item, path + "[*]", errors);
        }
      } else {
        validateFields(spec.schema(), path + ".", errors);
      }
    }

    for (FieldConstraint constraint : spec.constraints()) {
      errors.addAll(constraint.declarationErrors(spec.type(), path));
    }

    // the default can only be checked against a well-formed declaration
    if (spec.hasDefault() && errors.size() == before) {
      validateDefault(spec, path, errors);
    }
  }

  private static void validateDefault(FieldSpec spec, String path, List<String> errors) {
    try {
      FieldValueNormalizer.defaultValue(spec, path);
    } catch (TypeMismatchException e) {
      errors.add("field.default.type:" + path);
    } catch (ConstraintViolatedException e) {
      errors.add("field.default.constraint:" + path);
    } catch (ProfileTypeException e) {
      errors.add("field.default.invalid:" + path);
    }
  }

  /** Top-level windows must be ordered and must admit the schema's own version. */
  private static void validateVersionWindows(ProfileTypeSchema schema, List<String> errors) {
    for (FieldSpec spec : schema.fields().values()) {
      if (spec == null || !spec.hasVersionWindow()) {
        continue;
      }
      if (spec.minVersion() != null
          && spec.maxVersion() != null
          && ReleaseVersionComparator.INSTANCE.compare(spec.minVersion(), spec.maxVersion()) > 0) {
        errors.add("field.version.range:" + spec.name());
      } else if (!spec.availableIn(schema.version())) {
        errors.add("field.version.excluded:" + spec.name());
      }
    }
  }

  // ------------------------------------------------------------
  // Support status
  // ------------------------------------------------------------

  private static void validateSupportStatus(List<SupportStatusEntry> entries, List<String> errors) {
    if (entries.isEmpty()) {
      errors.add("support_status.empty");
      return;
    }

    String previous = null;
    for (SupportStatusEntry entry : entries) {
      if (entry.since().isBlank()) {
        errors.add("support_status.since.required");
        continue;
      }
      if (previous != null
          && ReleaseVersionComparator.INSTANCE.compare(entry.since(), previous) <= 0) {
        errors.add("support_status.order:" + entry.since());
      }
      previous = entry.since();
    }
  }
}
