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

package ai.floedb.profilecat.profiletype;

import java.util.Locale;

/**
 * What {@link ProfileTypeEngine} does with a schema version that is UNSUPPORTED at the current
 * release.
 */
public enum UnsupportedPolicy {
  /** Log a warning and continue. */
  WARN,
  /** Fail the call with an UnsupportedVersionException. */
  REJECT;

  public static UnsupportedPolicy fromName(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return WARN;
    }
    String normalized = candidate.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "WARN" -> WARN;
      case "REJECT" -> REJECT;
      default ->
          throw new IllegalArgumentException(
              "Invalid " + ProfileTypeEngineConfig.UNSUPPORTED_POLICY_PROPERTY + ": " + candidate);
    };
  }
}
