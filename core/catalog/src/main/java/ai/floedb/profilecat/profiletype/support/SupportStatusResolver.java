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

package ai.floedb.profilecat.profiletype.support;

import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import ai.floedb.profilecat.profiletype.def.SupportStatusEntry;
import ai.floedb.profilecat.profiletype.error.UnsupportedVersionException;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the support status of a schema version at a reference release.
 *
 * <p>The ledger is walked in release order and the last entry whose {@code since} is not newer than
 * the reference release wins. No status is treated as terminal: an UNSUPPORTED entry followed by a
 * later SUPPORTED entry resolves to SUPPORTED from that later release on.
 */
public final class SupportStatusResolver {

  private static final Comparator<SupportStatusEntry> BY_RELEASE =
      Comparator.comparing(SupportStatusEntry::since, ReleaseVersionComparator.INSTANCE);

  private SupportStatusResolver() {}

  public static SupportResolution resolve(ProfileTypeSchema schema, String referenceRelease) {
    if (schema == null) {
      throw new IllegalArgumentException("schema is required");
    }
    if (referenceRelease == null || referenceRelease.isBlank()) {
      throw new IllegalArgumentException("reference release must be provided");
    }

    List<SupportStatusEntry> ordered = schema.supportStatus().stream().sorted(BY_RELEASE).toList();
    SupportStatusEntry current = null;
    for (SupportStatusEntry entry : ordered) {
      if (ReleaseVersionComparator.INSTANCE.compare(entry.since(), referenceRelease) > 0) {
        break;
      }
      current = entry;
    }

    if (current == null) {
      String reason =
          ordered.isEmpty()
              ? "no support status declared"
              : "release predates first support status (since " + ordered.get(0).since() + ")";
      throw new UnsupportedVersionException(schema.key(), referenceRelease.trim(), reason);
    }
    return SupportResolution.of(current);
  }
}
