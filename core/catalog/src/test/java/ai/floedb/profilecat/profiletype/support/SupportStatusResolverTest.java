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

import static ai.floedb.profilecat.profiletype.def.SupportStatus.DEPRECATED;
import static ai.floedb.profilecat.profiletype.def.SupportStatus.SUPPORTED;
import static ai.floedb.profilecat.profiletype.def.SupportStatus.UNSUPPORTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import ai.floedb.profilecat.profiletype.def.SupportStatus;
import ai.floedb.profilecat.profiletype.error.ErrorCode;
import ai.floedb.profilecat.profiletype.error.UnsupportedVersionException;
import ai.floedb.profilecat.profiletype.testsupport.ProfileTypeTestSchemas;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for {@link SupportStatusResolver}.
 *
 * <p>Verifies:
 *
 * <ul>
 *   <li>The latest entry not newer than the reference release wins
 *   <li>Releases before the first entry fail with {@link UnsupportedVersionException}
 *   <li>UNSUPPORTED is not treated as terminal
 *   <li>Ledger order in the schema does not matter
 * </ul>
 */
class SupportStatusResolverTest {

  private static final ProfileTypeSchema LIFECYCLE =
      ProfileTypeTestSchemas.withLedger(
          "os.nova.server", "1.0",
          SUPPORTED, "2016.10",
          DEPRECATED, "2018.04",
          UNSUPPORTED, "2019.10");

  @Test
  void heatStackIsSupportedAfterItsFirstRelease() {
    SupportResolution resolution =
        SupportStatusResolver.resolve(ProfileTypeTestSchemas.heatStack(), "2017.01");

    assertThat(resolution.status()).isEqualTo(SUPPORTED);
    assertThat(resolution.since()).isEqualTo("2016.04");
    assertThat(resolution.isSupported()).isTrue();
  }

  @Test
  void releaseBeforeFirstEntryIsUnsupportedVersion() {
    assertThatThrownBy(
            () -> SupportStatusResolver.resolve(ProfileTypeTestSchemas.heatStack(), "2015.01"))
        .isInstanceOf(UnsupportedVersionException.class)
        .hasMessageContaining("2016.04")
        .satisfies(
            e ->
                assertThat(((UnsupportedVersionException) e).code())
                    .isEqualTo(ErrorCode.UNSUPPORTED_VERSION));
  }

  @ParameterizedTest(name = "{0} -> {1} since {2}")
  @CsvSource({
    "2016.10, SUPPORTED,   2016.10",
    "2017.04, SUPPORTED,   2016.10",
    "2018.04, DEPRECATED,  2018.04",
    "2019.04, DEPRECATED,  2018.04",
    "2019.10, UNSUPPORTED, 2019.10",
    "2030.01, UNSUPPORTED, 2019.10",
  })
  void latestEntryNotNewerThanReferenceWins(
      String release, SupportStatus expected, String since) {
    SupportResolution resolution = SupportStatusResolver.resolve(LIFECYCLE, release);

    assertThat(resolution.status()).isEqualTo(expected);
    assertThat(resolution.since()).isEqualTo(since);
  }

  @Test
  void unsupportedIsNotTerminal() {
    ProfileTypeSchema revived =
        ProfileTypeTestSchemas.withLedger(
            "os.revived", "1.0",
            SUPPORTED, "2016.04",
            UNSUPPORTED, "2017.04",
            SUPPORTED, "2018.10");

    assertThat(SupportStatusResolver.resolve(revived, "2017.10").status()).isEqualTo(UNSUPPORTED);
    assertThat(SupportStatusResolver.resolve(revived, "2018.10").status()).isEqualTo(SUPPORTED);
    assertThat(SupportStatusResolver.resolve(revived, "2020.01").status()).isEqualTo(SUPPORTED);
  }

  @Test
  void ledgerDeclarationOrderDoesNotMatter() {
    ProfileTypeSchema shuffled =
        ProfileTypeTestSchemas.withLedger(
            "os.shuffled", "1.0",
            DEPRECATED, "2018.04",
            SUPPORTED, "2016.10");

    assertThat(SupportStatusResolver.resolve(shuffled, "2017.01").status()).isEqualTo(SUPPORTED);
    assertThat(SupportStatusResolver.resolve(shuffled, "2018.04").status()).isEqualTo(DEPRECATED);
  }

  @Test
  void statusIndexNeverDecreasesAsReleaseAdvances() {
    List<String> releases =
        List.of("2016.10", "2017.01", "2018.01", "2018.04", "2019.01", "2019.10", "2025.01");

    int previous = -1;
    for (String release : releases) {
      int index = SupportStatusResolver.resolve(LIFECYCLE, release).status().ordinal();
      assertThat(index).as("status index at %s", release).isGreaterThanOrEqualTo(previous);
      previous = index;
    }
  }

  @Test
  void emptyLedgerIsUnsupportedVersion() {
    ProfileTypeSchema empty = ProfileTypeTestSchemas.withLedger("os.empty", "1.0");

    assertThatThrownBy(() -> SupportStatusResolver.resolve(empty, "2020.01"))
        .isInstanceOf(UnsupportedVersionException.class)
        .hasMessageContaining("no support status declared");
  }

  @Test
  void blankReleaseIsRejected() {
    assertThatThrownBy(() -> SupportStatusResolver.resolve(LIFECYCLE, " "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SupportStatusResolver.resolve(null, "2020.01"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
