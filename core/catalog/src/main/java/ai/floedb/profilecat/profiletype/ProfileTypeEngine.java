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

import ai.floedb.profilecat.profiletype.def.ProfileSpec;
import ai.floedb.profilecat.profiletype.def.ProfileSpecPatch;
import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import ai.floedb.profilecat.profiletype.def.SupportStatus;
import ai.floedb.profilecat.profiletype.error.UnsupportedVersionException;
import ai.floedb.profilecat.profiletype.provider.ProfileTypeDescriptions;
import ai.floedb.profilecat.profiletype.registry.ProfileTypeRegistry;
import ai.floedb.profilecat.profiletype.support.SupportResolution;
import ai.floedb.profilecat.profiletype.support.SupportStatusResolver;
import ai.floedb.profilecat.profiletype.validation.ProfileSpecValidator;
import ai.floedb.profilecat.profiletype.validation.UpdatePolicyEnforcer;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Entry point for callers that address profile types by name and version.
 *
 * <p>Every call resolves its schema from a single registry snapshot. When a current release is
 * configured, {@link #validate} and {@link #authorizeUpdate} first resolve the schema's support
 * status at that release: DEPRECATED versions are logged, UNSUPPORTED ones are logged or rejected
 * depending on {@link ProfileTypeEngineConfig#unsupportedPolicy()}.
 */
public final class ProfileTypeEngine {

  private static final Logger LOG = Logger.getLogger(ProfileTypeEngine.class);

  private final ProfileTypeRegistry registry;
  private final ProfileTypeEngineConfig config;

  public ProfileTypeEngine(ProfileTypeRegistry registry) {
    this(registry, ProfileTypeEngineConfig.fromSystemProperties());
  }

  public ProfileTypeEngine(ProfileTypeRegistry registry, ProfileTypeEngineConfig config) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.config = Objects.requireNonNull(config, "config");
  }

  public ProfileTypeRegistry registry() {
    return registry;
  }

  public ProfileTypeEngineConfig config() {
    return config;
  }

  public void register(ProfileTypeSchema schema) {
    registry.register(schema);
  }

  public ProfileSpec validate(String typeName, String version, Map<String, ?> rawSpec) {
    ProfileTypeSchema schema = registry.lookup(typeName, version);
    checkSupport(schema);
    return ProfileSpecValidator.validate(schema, rawSpec);
  }

  /**
   * Validates {@code proposed} as a partial update and merges it into {@code current}.
   *
   * <p>Absent keys keep their current value; explicit {@code null} resets a field to its default.
   */
  public ProfileSpec authorizeUpdate(
      String typeName, String version, ProfileSpec current, Map<String, ?> proposed) {
    ProfileTypeSchema schema = registry.lookup(typeName, version);
    checkSupport(schema);
    ProfileSpecPatch patch = ProfileSpecValidator.validatePatch(schema, proposed);
    return UpdatePolicyEnforcer.authorizeUpdate(schema, current, patch);
  }

  public SupportResolution resolveSupport(
      String typeName, String version, String referenceRelease) {
    return SupportStatusResolver.resolve(registry.lookup(typeName, version), referenceRelease);
  }

  /** Definition document of a registered version. */
  public Map<String, Object> describe(String typeName, String version) {
    return ProfileTypeDescriptions.describe(registry.lookup(typeName, version));
  }

  private void checkSupport(ProfileTypeSchema schema) {
    String release = config.currentRelease();
    if (release == null) {
      return;
    }
    SupportResolution resolution = SupportStatusResolver.resolve(schema, release);
    if (resolution.status() == SupportStatus.DEPRECATED) {
      LOG.warnf(
          "Profile type %s is deprecated since %s (current release %s)",
          schema.key(), resolution.since(), release);
    } else if (resolution.status() == SupportStatus.UNSUPPORTED) {
      if (config.unsupportedPolicy() == UnsupportedPolicy.REJECT) {
        throw new UnsupportedVersionException(
            schema.key(), release, "unsupported since " + resolution.since());
      }
      LOG.warnf(
          "Profile type %s is unsupported since %s (current release %s)",
          schema.key(), resolution.since(), release);
    }
  }
}
