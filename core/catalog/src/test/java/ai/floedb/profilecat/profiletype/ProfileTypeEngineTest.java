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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.profilecat.profiletype.def.ProfileSpec;
import ai.floedb.profilecat.profiletype.def.SupportStatus;
import ai.floedb.profilecat.profiletype.error.DuplicateSchemaException;
import ai.floedb.profilecat.profiletype.error.ImmutableFieldChangedException;
import ai.floedb.profilecat.profiletype.error.TypeMismatchException;
import ai.floedb.profilecat.profiletype.error.UnknownFieldException;
import ai.floedb.profilecat.profiletype.error.UnknownSchemaException;
import ai.floedb.profilecat.profiletype.error.UnsupportedVersionException;
import ai.floedb.profilecat.profiletype.provider.ServiceLoaderProfileTypeProvider;
import ai.floedb.profilecat.profiletype.registry.ProfileTypeRegistry;
import ai.floedb.profilecat.profiletype.support.SupportResolution;
import ai.floedb.profilecat.profiletype.testsupport.ProfileTypeTestSchemas;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** End-to-end tests of {@link ProfileTypeEngine} against the builtin and shared schemas. */
class ProfileTypeEngineTest {

  private static final String HEAT = ProfileTypeTestSchemas.HEAT_STACK;
  private static final String NOVA = ProfileTypeTestSchemas.NOVA_SERVER;

  private ProfileTypeRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new ProfileTypeRegistry();
    registry.initialize(new ServiceLoaderProfileTypeProvider());
    registry.register(ProfileTypeTestSchemas.novaServer());
  }

  private ProfileTypeEngine engine() {
    return new ProfileTypeEngine(registry, ProfileTypeEngineConfig.defaults());
  }

  private ProfileTypeEngine engineAt(String release, UnsupportedPolicy policy) {
    return new ProfileTypeEngine(registry, new ProfileTypeEngineConfig(release, policy));
  }

  @Test
  void validateAppliesBuiltinDefaults() {
    ProfileSpec spec = engine().validate(HEAT, "1.0", Map.of("template_url", "http://x/y.yaml"));

    assertThat(spec.values())
        .containsEntry("disable_rollback", true)
        .containsEntry("environment", Map.of())
        .containsEntry("files", Map.of())
        .containsEntry("parameters", Map.of())
        .containsEntry("template", Map.of())
        .containsEntry("template_url", "http://x/y.yaml")
        .doesNotContainKey("timeout");
  }

  @Test
  void validateRejectsUnknownFieldsAndTypes() {
    assertThatThrownBy(() -> engine().validate(HEAT, "1.0", Map.of("bogus_field", 1)))
        .isInstanceOf(UnknownFieldException.class);
    assertThatThrownBy(() -> engine().validate(HEAT, "1.0", Map.of("timeout", "1h")))
        .isInstanceOf(TypeMismatchException.class);
  }

  @Test
  void unknownSchemaIsReported() {
    assertThatThrownBy(() -> engine().validate(HEAT, "9.9", Map.of()))
        .isInstanceOf(UnknownSchemaException.class);
    assertThatThrownBy(() -> engine().resolveSupport("os.missing", "1.0", "2017.01"))
        .isInstanceOf(UnknownSchemaException.class);
  }

  @Test
  void registerThroughEngineRejectsDuplicates() {
    assertThatThrownBy(() -> engine().register(ProfileTypeTestSchemas.heatStack()))
        .isInstanceOf(DuplicateSchemaException.class);

    engine().register(ProfileTypeTestSchemas.heatStack("1.1"));
    assertThat(registry.lookupLatest(HEAT).version()).isEqualTo("1.1");
  }

  @Test
  void updatableFieldsChange() {
    ProfileTypeEngine engine = engine();
    ProfileSpec current = engine.validate(HEAT, "1.0", Map.of("disable_rollback", true));

    ProfileSpec updated =
        engine.authorizeUpdate(
            HEAT, "1.0", current, Map.of("disable_rollback", false, "timeout", 60));

    assertThat(updated.values())
        .containsEntry("disable_rollback", false)
        .containsEntry("timeout", 60L);
  }

  @Test
  void immutableContextCannotChange() {
    ProfileTypeEngine engine = engine();
    ProfileSpec current = engine.validate(HEAT, "1.0", Map.of());

    assertThatThrownBy(
            () ->
                engine.authorizeUpdate(
                    HEAT, "1.0", current, Map.of("context", Map.of("region_name", "RegionTwo"))))
        .isInstanceOf(ImmutableFieldChangedException.class)
        .hasMessageContaining("context");
  }

  @Test
  void updateValidatesProposedValues() {
    ProfileTypeEngine engine = engine();
    ProfileSpec current = engine.validate(HEAT, "1.0", Map.of());

    assertThatThrownBy(() -> engine.authorizeUpdate(HEAT, "1.0", current, Map.of("timeout", "x")))
        .isInstanceOf(TypeMismatchException.class);
    assertThat(engine.authorizeUpdate(HEAT, "1.0", current, Map.of("timeout", "15")).values())
        .containsEntry("timeout", 15L);
  }

  @Test
  void resolveSupportForHeatStack() {
    assertThatThrownBy(() -> engine().resolveSupport(HEAT, "1.0", "2015.01"))
        .isInstanceOf(UnsupportedVersionException.class);

    SupportResolution resolution = engine().resolveSupport(HEAT, "1.0", "2017.01");
    assertThat(resolution.status()).isEqualTo(SupportStatus.SUPPORTED);
    assertThat(resolution.since()).isEqualTo("2016.04");
  }

  @Test
  void gateRejectsReleasesBeforeTheLedger() {
    ProfileTypeEngine engine = engineAt("2015.01", UnsupportedPolicy.WARN);

    assertThatThrownBy(() -> engine.validate(HEAT, "1.0", Map.of()))
        .isInstanceOf(UnsupportedVersionException.class);
  }

  @Test
  void deprecatedVersionsStillValidate() {
    ProfileSpec spec =
        engineAt("2018.10", UnsupportedPolicy.REJECT)
            .validate(NOVA, "1.0", Map.of("flavor", "small"));

    assertThat(spec.values()).containsEntry("flavor", "small");
  }

  @Test
  void unsupportedVersionsWarnByDefault() {
    ProfileTypeEngine engine = engineAt("2020.01", UnsupportedPolicy.WARN);

    ProfileSpec spec = engine.validate(NOVA, "1.0", Map.of("flavor", "large"));

    assertThat(spec.values()).containsEntry("flavor", "large");
  }

  @Test
  void unsupportedVersionsFailUnderRejectPolicy() {
    ProfileTypeEngine engine = engineAt("2020.01", UnsupportedPolicy.REJECT);
    ProfileSpec current = engine().validate(NOVA, "1.0", Map.of("flavor", "small"));

    assertThatThrownBy(() -> engine.validate(NOVA, "1.0", Map.of("flavor", "small")))
        .isInstanceOf(UnsupportedVersionException.class)
        .hasMessageContaining("2019.10");
    assertThatThrownBy(() -> engine.authorizeUpdate(NOVA, "1.0", current, Map.of()))
        .isInstanceOf(UnsupportedVersionException.class);
    assertThat(engine.resolveSupport(NOVA, "1.0", "2020.01").status())
        .isEqualTo(SupportStatus.UNSUPPORTED);
  }

  @Test
  void describeReturnsDefinitionDocument() {
    Map<String, Object> doc = engine().describe(HEAT, "1.0");

    assertThat(doc).containsEntry("type_name", HEAT).containsKeys("schema", "support_status");
  }
}
