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

package ai.floedb.profilecat.profiletype.builtin;

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.profilecat.profiletype.def.FieldSpec;
import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import ai.floedb.profilecat.profiletype.registry.ProfileTypeSchemaValidator;
import ai.floedb.profilecat.profiletype.testsupport.ProfileTypeTestSchemas;
import java.util.List;
import org.junit.jupiter.api.Test;

class BuiltinProfileTypeExtensionTest {

  private final BuiltinProfileTypeExtension extension = new BuiltinProfileTypeExtension();

  @Test
  void shipsHeatStackOneDotZero() {
    List<ProfileTypeSchema> schemas = extension.loadProfileTypes();

    assertThat(extension.id()).isEqualTo("builtin");
    assertThat(schemas).extracting(s -> s.key().toString()).containsExactly("os.heat.stack-1.0");
    assertThat(ProfileTypeSchemaValidator.validate(schemas.get(0))).isEmpty();
  }

  @Test
  void heatStackDeclarationsMatchTheKnownLayout() {
    ProfileTypeSchema builtin = extension.loadProfileTypes().get(0);
    ProfileTypeSchema expected = ProfileTypeTestSchemas.heatStack();

    assertThat(builtin.fields().keySet()).containsExactlyElementsOf(expected.fields().keySet());
    for (FieldSpec field : expected.fields().values()) {
      FieldSpec actual = builtin.field(field.name()).orElseThrow();
      assertThat(actual.type()).as(field.name()).isEqualTo(field.type());
      assertThat(actual.defaultValue()).as(field.name()).isEqualTo(field.defaultValue());
      assertThat(actual.required()).as(field.name()).isEqualTo(field.required());
      assertThat(actual.updatable()).as(field.name()).isEqualTo(field.updatable());
      assertThat(actual.description()).as(field.name()).isNotBlank();
    }
    assertThat(builtin.supportStatus()).isEqualTo(expected.supportStatus());
  }
}
