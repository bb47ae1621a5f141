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

/** Thrown when no schema is registered for the requested type name (and version). */
public final class UnknownSchemaException extends ProfileTypeException {

  public UnknownSchemaException(String typeName, String version) {
    super(
        ErrorCode.UNKNOWN_SCHEMA,
        version == null
            ? "No profile type registered with name '" + typeName + "'"
            : "Profile type '" + typeName + "' has no registered version '" + version + "'",
        details("type_name", typeName, "version", version),
        null);
  }

  public UnknownSchemaException(String typeName) {
    this(typeName, null);
  }
}
