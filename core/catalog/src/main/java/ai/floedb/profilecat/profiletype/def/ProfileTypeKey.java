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

/** Registry identity of a profile type schema: type name plus schema version. */
public record ProfileTypeKey(String typeName, String version) {

  public ProfileTypeKey {
    if (typeName == null || typeName.isBlank()) {
      throw new IllegalArgumentException("type_name must be provided");
    }
    if (version == null || version.isBlank()) {
      throw new IllegalArgumentException("version must be provided");
    }
    typeName = typeName.trim();
    version = version.trim();
  }

  public static ProfileTypeKey of(String typeName, String version) {
    return new ProfileTypeKey(typeName, version);
  }

  /** Renders as {@code os.heat.stack-1.0}. */
  @Override
  public String toString() {
    return typeName + "-" + version;
  }
}
