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

package ai.floedb.profilecat.profiletype.def;

import java.util.Locale;

/**
 * Lifecycle states of a profile type version. Declaration order is the conventional lifecycle
 * order; nothing enforces it, and a ledger may move from {@link #UNSUPPORTED} back to {@link
 * #SUPPORTED}.
 */
public enum SupportStatus {
  SUPPORTED,
  DEPRECATED,
  UNSUPPORTED;

  public static SupportStatus fromName(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      throw new IllegalArgumentException("Support status must be provided");
    }
    try {
      return valueOf(candidate.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown support status: " + candidate, e);
    }
  }
}
