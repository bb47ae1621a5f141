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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ProfileTypeKeyTest {

  @Test
  void trimsAndRendersNameDashVersion() {
    ProfileTypeKey key = ProfileTypeKey.of(" os.heat.stack ", "1.0 ");

    assertThat(key.typeName()).isEqualTo("os.heat.stack");
    assertThat(key.version()).isEqualTo("1.0");
    assertThat(key).hasToString("os.heat.stack-1.0");
    assertThat(key).isEqualTo(ProfileTypeKey.of("os.heat.stack", "1.0"));
  }

  @Test
  void rejectsBlankParts() {
    assertThatThrownBy(() -> ProfileTypeKey.of(" ", "1.0"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("type_name");
    assertThatThrownBy(() -> ProfileTypeKey.of("os.heat.stack", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("version");
  }

  @ParameterizedTest
  @CsvSource({"supported, SUPPORTED", "Deprecated, DEPRECATED", " UNSUPPORTED , UNSUPPORTED"})
  void supportStatusNamesResolve(String name, SupportStatus expected) {
    assertThat(SupportStatus.fromName(name)).isEqualTo(expected);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "EXPERIMENTAL"})
  void unknownSupportStatusThrows(String name) {
    assertThatThrownBy(() -> SupportStatus.fromName(name))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
