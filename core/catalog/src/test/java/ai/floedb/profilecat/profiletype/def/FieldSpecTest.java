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

import ai.floedb.profilecat.types.FieldType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldSpecTest {

  @Test
  void builderDefaultsToOptionalImmutableField() {
    FieldSpec spec = FieldSpec.builder("timeout", FieldType.INTEGER).build();

    assertThat(spec.required()).isFalse();
    assertThat(spec.updatable()).isFalse();
    assertThat(spec.hasDefault()).isFalse();
    assertThat(spec.description()).isEmpty();
    assertThat(spec.hasSchema()).isFalse();
    assertThat(spec.constraints()).isEmpty();
  }

  @Test
  @SuppressWarnings("unchecked")
  void defaultValueIsCopiedOnConstruction() {
    Map<String, Object> value = new HashMap<>();
    value.put("region", "east");

    FieldSpec spec = FieldSpec.builder("context", FieldType.MAP).defaultValue(value).build();
    value.put("region", "west");

    assertThat(spec.defaultValue()).isEqualTo(Map.of("region", "east"));
    assertThatThrownBy(() -> ((Map<String, Object>) spec.defaultValue()).put("x", 1))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void versionWindowIsInclusiveAndOpenEnded() {
    FieldSpec windowed =
        FieldSpec.builder("key_name", FieldType.STRING).versions("1.0", "2.0").build();

    assertThat(windowed.availableIn("0.9")).isFalse();
    assertThat(windowed.availableIn("1.0")).isTrue();
    assertThat(windowed.availableIn("1.1")).isTrue();
    assertThat(windowed.availableIn("2.0")).isTrue();
    assertThat(windowed.availableIn("2.1")).isFalse();
    assertThat(windowed.lastSupportedIn("2.0")).isTrue();
    assertThat(windowed.lastSupportedIn("1.1")).isFalse();

    FieldSpec upToTwo = FieldSpec.builder("a", FieldType.STRING).versions(null, "2.0").build();
    assertThat(upToTwo.availableIn("1.0")).isTrue();
    assertThat(upToTwo.availableIn("2.1")).isFalse();

    FieldSpec fromOne = FieldSpec.builder("b", FieldType.STRING).versions("1.0", " ").build();
    assertThat(fromOne.maxVersion()).isNull();
    assertThat(fromOne.availableIn("0.5")).isFalse();
    assertThat(fromOne.availableIn("2.3")).isTrue();

    FieldSpec open = FieldSpec.builder("c", FieldType.STRING).build();
    assertThat(open.hasVersionWindow()).isFalse();
    assertThat(open.availableIn("1.0")).isTrue();
    assertThat(open.lastSupportedIn("1.0")).isFalse();
  }

  @Test
  void itemSpecOnlyForLists() {
    FieldSpec item = FieldSpec.builder("*", FieldType.STRING).build();
    FieldSpec list = FieldSpec.builder("tags", FieldType.LIST).items(item).build();
    FieldSpec map = FieldSpec.builder("meta", FieldType.MAP).field(item).build();

    assertThat(list.itemSpec()).contains(item);
    assertThat(list.schema()).containsOnlyKeys(FieldSpec.ITEM_KEY);
    assertThat(map.itemSpec()).isEmpty();
  }

  @Test
  void schemaDefaultValueListIsCopied() {
    List<Object> tags = new ArrayList<>(List.of("a"));
    ProfileTypeSchema schema =
        ProfileTypeSchema.builder("t", "1.0")
            .field(FieldSpec.builder("tags", FieldType.LIST).defaultValue(tags).build())
            .status(SupportStatus.SUPPORTED, "1.0")
            .build();
    tags.add("b");

    assertThat(schema.field("tags").orElseThrow().defaultValue()).isEqualTo(List.of("a"));
    assertThat(schema.field("missing")).isEmpty();
    assertThat(schema.key()).isEqualTo(ProfileTypeKey.of("t", "1.0"));
  }
}
