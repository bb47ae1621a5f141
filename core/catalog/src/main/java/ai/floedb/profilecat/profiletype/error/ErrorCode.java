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

/** Kinds of failure surfaced by the profile type engine. */
public enum ErrorCode {
  DUPLICATE_SCHEMA,
  INVALID_SCHEMA,
  UNKNOWN_SCHEMA,
  MISSING_REQUIRED_FIELD,
  UNKNOWN_FIELD,
  TYPE_MISMATCH,
  CONSTRAINT_VIOLATION,
  IMMUTABLE_FIELD_CHANGED,
  UNSUPPORTED_VERSION
}
