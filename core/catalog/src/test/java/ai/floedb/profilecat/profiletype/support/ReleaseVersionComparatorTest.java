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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ReleaseVersionComparatorTest {

  private static final ReleaseVersionComparator CMP = ReleaseVersionComparator.INSTANCE;

  @ParameterizedTest(name = "{0} < {1}")
  @CsvSource({
    "1.0, 1.1",
    "1.9, 1.10",
    "1.0, 2.0",
    "2015.01, 2016.04",
    "2016.04, 2016.10",
    "2016.10, 2017.01",
    "1.0-rc1, 1.0",
    "1.0-alpha, 1.0-beta",
    "1.0-1, 1.0-alpha",
    "1.0-rc.1, 1.0-rc.2",
    "1.0rc1, 1.0",
    "1.0-rc, 1.0-rc.1",
    "1.0-rc.9, 1.0-rc.10",
  })
  void ordersAscending(String lower, String higher) {
    assertThat(CMP.compare(lower, higher)).isNegative();
    assertThat(CMP.compare(higher, lower)).isPositive();
  }

  @ParameterizedTest(name = "{0} == {1}")
  @CsvSource({"1.0, 1", "2016.04, 2016.4", "1.0.0, 1.0", "' 1.2 ', 1.2"})
  void equivalentVersionsCompareEqual(String left, String right) {
    assertThat(CMP.compare(left, right)).isZero();
  }

  @Test
  void blankAndNullNormalizeToZero() {
    assertThat(ReleaseVersionComparator.normalize(null)).isEqualTo("0");
    assertThat(ReleaseVersionComparator.normalize("  ")).isEqualTo("0");
    assertThat(CMP.compare(null, "0")).isZero();
  }

  @Test
  void hugeSegmentsDoNotOverflow() {
    assertThat(CMP.compare("99999999999999999999999", "1")).isPositive();
  }

  @Test
  void strictOrderSeparatesEquivalentSpellings() {
    assertThat(ReleaseVersionComparator.STRICT.compare("1.0", "1.00")).isNotZero();

    TreeMap<String, String> versions = new TreeMap<>(ReleaseVersionComparator.STRICT);
    versions.put("1.10", "c");
    versions.put("1.0", "a");
    versions.put("1.00", "b");
    versions.put("1.9", "d");
    assertThat(versions.keySet()).containsExactly("1.0", "1.00", "1.9", "1.10");
  }

  @Test
  void sortsReleaseLists() {
    List<String> releases = new ArrayList<>(List.of("2017.01", "2016.04", "2016.10", "2015.01"));
    releases.sort(CMP);
    assertThat(releases).containsExactly("2015.01", "2016.04", "2016.10", "2017.01");
  }
}
