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

import java.util.Objects;

/** One transition of a version's support ledger: {@code status} applies from {@code since} on. */
public record SupportStatusEntry(SupportStatus status, String since) {

  public SupportStatusEntry {
    Objects.requireNonNull(status, "status");
    since = since == null ? "" : since.trim();
  }

  public static SupportStatusEntry of(SupportStatus status, String since) {
    return new SupportStatusEntry(status, since);
  }
}
