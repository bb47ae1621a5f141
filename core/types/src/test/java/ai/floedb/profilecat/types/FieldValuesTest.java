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

package ai.floedb.profilecat.types;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldValuesTest {

  @Test
  void immutableCopyPreservesOrderAndNulls() {
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("z", 1);
    input.put("a", null);
    input.put("m", new ArrayList<>(Arrays.asList("x", null)));

    Map<String, Object> copy = FieldValues.immutableCopy(input);

    assertThat(copy.keySet()).containsExactly("z", "a", "m");
    assertThat(copy.get("a")).isNull();
    assertThat(copy.get("m")).isEqualTo(Arrays.asList("x", null));
    assertThat(copy).isNotSameAs(input);
  }

  @Test
  void immutableCopyReturnsScalarsAsIs() {
    String value = "text";
    assertThat(FieldValues.immutableCopy(value)).isSameAs(value);
    assertThat(FieldValues.<Object>immutableCopy(null)).isNull();
  }

  @Test
  void sizeOfCoversStringsAndContainers() {
    assertThat(FieldValues.sizeOf("abcd")).isEqualTo(4);
    assertThat(FieldValues.sizeOf(List.of(1, 2))).isEqualTo(2);
    assertThat(FieldValues.sizeOf(Map.of("a", 1))).isEqualTo(1);
    assertThat(FieldValues.sizeOf(5L)).isEqualTo(-1);
  }

  @Test
  void describeIncludesKind() {
    assertThat(FieldValues.describe("abc")).isEqualTo("'abc' (String)");
    assertThat(FieldValues.describe(60L)).isEqualTo("60 (Long)");
    assertThat(FieldValues.describe(Map.of())).isEqualTo("{} (Map)");
    assertThat(FieldValues.describe(null)).isEqualTo("null");
  }

  @Test
  void describeTruncatesLongValues() {
    String longText = "x".repeat(200);
    assertThat(FieldValues.describe(longText)).endsWith("... (String)").hasSizeLessThan(90);
  }
}
