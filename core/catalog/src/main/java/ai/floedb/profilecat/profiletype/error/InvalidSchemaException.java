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

package ai.floedb.profilecat.profiletype.error;

import java.util.List;

/**
 * Thrown when a schema definition is malformed or internally contradictory. Carries every
 * validation code reported for the schema, not just the first.
 */
public final class InvalidSchemaException extends ProfileTypeException {

  private final List<String> errors;

  public InvalidSchemaException(String typeName, String version, List<String> errors) {
    this(typeName, version, errors, null);
  }

  public InvalidSchemaException(
      String typeName, String version, List<String> errors, Throwable cause) {
    super(
        ErrorCode.INVALID_SCHEMA,
        "Invalid schema for profile type "
            + label(typeName, version)
            + ": "
            + String.join("; ", errors),
        details("type_name", typeName, "version", version, "errors", String.join(",", errors)),
        cause);
    this.errors = List.copyOf(errors);
  }

  /** Raw validation codes, e.g. {@code field.required_with_default:timeout}. */
  public List<String> errors() {
    return errors;
  }

  private static String label(String typeName, String version) {
    String name = typeName == null || typeName.isBlank() ? "<unnamed>" : typeName;
    return version == null || version.isBlank() ? name : name + "-" + version;
  }
}
