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

import java.util.List;

/** Shared formatter for schema validation codes. */
public final class ProfileTypeValidationFormatter {

  private ProfileTypeValidationFormatter() {}

  public static String describeError(String code) {
    if (code == null) {
      return "";
    }
    switch (code) {
      case "schema.null":
        return "Schema payload is null";
      case "field.name.required":
        return "Field name is required";
      case "support_status.empty":
        return "Schema declares no support status";
      case "support_status.since.required":
        return "Support status entry requires a 'since' release";
      case "definition.root.type":
        return "Definition must be a JSON object";
      case "definition.type_name.required":
        return "Definition requires a non-blank 'type_name'";
      case "definition.schema.required":
        return "Definition requires a 'schema' object";
      case "definition.support_status.required":
        return "Definition requires a non-empty 'support_status' object";
      case "definition.support_status.version":
        return "Support status versions must be non-blank";
    }
    if (code.startsWith("definition.json:")) {
      return "Definition is not valid JSON: " + suffix(code);
    }
    if (code.startsWith("definition.attribute.unknown:")) {
      return "Unknown definition attribute '" + suffix(code) + "'";
    }
    if (code.startsWith("definition.support_status.entries:")) {
      return "Support status of version '"
          + suffix(code)
          + "' must be a list of {status, since} entries";
    }
    if (code.startsWith("field.version.range:")) {
      return "Field '" + suffix(code) + "' declares min_version above max_version";
    }
    if (code.startsWith("field.version.excluded:")) {
      return "Version window of field '" + suffix(code) + "' admits none of its schema versions";
    }
    if (code.startsWith("field.version.nested:")) {
      return "Nested field '" + suffix(code) + "' cannot declare a version window";
    }
    if (code.startsWith("definition.support_status.status:")) {
      return "Support status of version '" + suffix(code) + "' names an unknown status";
    }
    if (code.startsWith("field.definition.type:")) {
      return "Field '" + suffix(code) + "' must be declared as an object";
    }
    if (code.startsWith("field.attribute.unknown:")) {
      return "Unknown field attribute '" + suffix(code) + "'";
    }
    if (code.startsWith("field.attribute.type:")) {
      return "Field attribute '" + suffix(code) + "' has the wrong type";
    }
    if (code.startsWith("field.type.required:")) {
      return "Field '" + suffix(code) + "' must declare a type";
    }
    if (code.startsWith("field.type.unknown:")) {
      return "Field '" + suffix(code) + "' declares an unknown type";
    }
    if (code.startsWith("constraint.definition.type:")) {
      return "Constraints of field '" + suffix(code) + "' must be objects";
    }
    if (code.startsWith("constraint.type.unknown:")) {
      return "Field '" + suffix(code) + "' declares an unknown constraint";
    }
    if (code.startsWith("constraint.attribute.unknown:")) {
      return "Unknown constraint attribute '" + suffix(code) + "'";
    }
    if (code.startsWith("constraint.attribute.type:")) {
      return "Constraint attribute '" + suffix(code) + "' has the wrong type";
    }
    if (code.startsWith("field.name.required:")) {
      return "Field name is required inside '" + suffix(code) + "'";
    }
    if (code.startsWith("field.name.mismatch:")) {
      return "Field '" + suffix(code) + "' is registered under a different name";
    }
    if (code.startsWith("field.required_with_default:")) {
      return "Field '" + suffix(code) + "' is required and must not declare a default";
    }
    if (code.startsWith("field.schema.scalar:")) {
      return "Nested schema is valid only for List or Map, not field '" + suffix(code) + "'";
    }
    if (code.startsWith("field.schema.item:")) {
      return "List field '" + suffix(code) + "' must declare exactly one item schema";
    }
    if (code.startsWith("field.default.type:")) {
      return "Default of field '" + suffix(code) + "' does not match its type";
    }
    if (code.startsWith("field.default.constraint:")) {
      return "Default of field '" + suffix(code) + "' violates its constraints";
    }
    if (code.startsWith("field.default.invalid:")) {
      return "Default of field '" + suffix(code) + "' does not match its nested schema";
    }
    if (code.startsWith("constraint.allowed.container:")) {
      return "AllowedValues cannot apply to container field '" + suffix(code) + "'";
    }
    if (code.startsWith("constraint.allowed.empty:")) {
      return "AllowedValues of field '" + suffix(code) + "' lists no values";
    }
    if (code.startsWith("constraint.allowed.type:")) {
      return "AllowedValues of field '" + suffix(code) + "' contains values of the wrong type";
    }
    if (code.startsWith("constraint.range.type:")) {
      return "Range cannot apply to Boolean field '" + suffix(code) + "'";
    }
    if (code.startsWith("constraint.range.unbounded:")) {
      return "Range of field '" + suffix(code) + "' declares neither min nor max";
    }
    if (code.startsWith("constraint.range.bounds:")) {
      return "Range of field '" + suffix(code) + "' has min greater than max";
    }
    if (code.startsWith("support_status.order:")) {
      return "Support status entry since '" + suffix(code) + "' does not follow the previous entry";
    }
    return code;
  }

  public static List<String> describeErrors(List<String> codes) {
    return codes.stream().map(ProfileTypeValidationFormatter::describeError).toList();
  }

  private static String suffix(String code) {
    int idx = code.indexOf(':');
    return idx == -1 ? "" : code.substring(idx + 1);
  }
}
