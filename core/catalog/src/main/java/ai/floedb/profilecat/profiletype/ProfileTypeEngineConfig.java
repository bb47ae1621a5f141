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

import java.util.Optional;

/**
 * Runtime settings of {@link ProfileTypeEngine}.
 *
 * @param currentRelease release the process runs as; {@code null} disables the support gate
 * @param unsupportedPolicy handling of versions resolved as UNSUPPORTED at {@code currentRelease}
 */
public record ProfileTypeEngineConfig(String currentRelease, UnsupportedPolicy unsupportedPolicy) {

  public static final String CURRENT_RELEASE_PROPERTY = "profilecat.current-release";
  public static final String UNSUPPORTED_POLICY_PROPERTY = "profilecat.unsupported-policy";

  public ProfileTypeEngineConfig {
    currentRelease =
        currentRelease == null || currentRelease.isBlank() ? null : currentRelease.trim();
    unsupportedPolicy = unsupportedPolicy == null ? UnsupportedPolicy.WARN : unsupportedPolicy;
  }

  /** No support gate, UNSUPPORTED only warns. */
  public static ProfileTypeEngineConfig defaults() {
    return new ProfileTypeEngineConfig(null, UnsupportedPolicy.WARN);
  }

  /**
   * Reads {@value #CURRENT_RELEASE_PROPERTY} and {@value #UNSUPPORTED_POLICY_PROPERTY}, falling
   * back to the {@code PROFILECAT_CURRENT_RELEASE} and {@code PROFILECAT_UNSUPPORTED_POLICY}
   * environment variables.
   */
  public static ProfileTypeEngineConfig fromSystemProperties() {
    return new ProfileTypeEngineConfig(
        setting(CURRENT_RELEASE_PROPERTY, "PROFILECAT_CURRENT_RELEASE"),
        UnsupportedPolicy.fromName(
            setting(UNSUPPORTED_POLICY_PROPERTY, "PROFILECAT_UNSUPPORTED_POLICY")));
  }

  public Optional<String> release() {
    return Optional.ofNullable(currentRelease);
  }

  public ProfileTypeEngineConfig withCurrentRelease(String release) {
    return new ProfileTypeEngineConfig(release, unsupportedPolicy);
  }

  public ProfileTypeEngineConfig withUnsupportedPolicy(UnsupportedPolicy policy) {
    return new ProfileTypeEngineConfig(currentRelease, policy);
  }

  private static String setting(String property, String env) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value;
  }
}
