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

import ai.floedb.profilecat.types.FieldType;
import ai.floedb.profilecat.types.FieldValues;

/** Thrown when a supplied value does not conform to the field's declared type. */
public final class TypeMismatchException extends ProfileTypeException {

  public TypeMismatchException(String field, FieldType expected, Object received, Throwable cause) {
    super(
        ErrorCode.TYPE_MISMATCH,
        "Field '"
            + field
            + "' expects "
            + expected.displayName()
            + " but received "
            + FieldValues.describe(received),
        details(
            "field",
            field,
            "expected",
            expected.displayName(),
            "received",
            FieldValues.describe(received)),
        cause);
  }
}
