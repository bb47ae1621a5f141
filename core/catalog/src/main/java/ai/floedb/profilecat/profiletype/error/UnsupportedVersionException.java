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

import ai.floedb.profilecat.profiletype.def.ProfileTypeKey;

/**
 * Thrown when a profile type version cannot be used at a reference release: either the release
 * predates the version's first support-status entry, or the engine policy rejects the status in
 * effect at that release.
 */
public final class UnsupportedVersionException extends ProfileTypeException {

  public UnsupportedVersionException(ProfileTypeKey key, String release, String reason) {
    super(
        ErrorCode.UNSUPPORTED_VERSION,
        "Profile type " + key + " is not usable at release " + release + ": " + reason,
        details(
            "type_name", key.typeName(), "version", key.version(), "release", release,
            "reason", reason),
        null);
  }
}
