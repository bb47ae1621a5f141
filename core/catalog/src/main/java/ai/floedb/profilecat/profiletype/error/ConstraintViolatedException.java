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

import ai.floedb.profilecat.types.FieldValues;

/** Thrown when a well-typed value breaks one of the field's declared constraints. */
public final class ConstraintViolatedException extends ProfileTypeException {

  public ConstraintViolatedException(String field, String constraint, Object value) {
    super(
        ErrorCode.CONSTRAINT_VIOLATION,
        "Field '" + field + "' value " + FieldValues.describe(value) + " violates " + constraint,
        details("field", field, "constraint", constraint, "received", FieldValues.describe(value)),
        null);
  }
}
