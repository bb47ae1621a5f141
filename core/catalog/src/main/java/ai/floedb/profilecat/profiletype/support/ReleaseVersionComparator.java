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

import java.util.Comparator;
import java.util.List;

/**
 * Orders schema versions ({@code 1.0}, {@code 1.10}) and platform releases ({@code 2016.04},
 * {@code 2017.1-rc1}).
 *
 * <p>Numeric segments are compared segment-by-segment, so {@code 1.10 > 1.9} and {@code 2016.04 ==
 * 2016.4}; missing trailing segments count as zero. A release is greater than any prerelease of
 * the same core. Prerelease identifiers (split on '.') compare numerically when both are digits
 * and lexically otherwise, with numeric identifiers ranking lower (SemVer 2.0.0).
 */
public final class ReleaseVersionComparator implements Comparator<String> {

  /** Compares by version order only; textually different but equivalent versions compare equal. */
  public static final ReleaseVersionComparator INSTANCE = new ReleaseVersionComparator();

  /**
   * Total order consistent with {@link String#equals}: version order first, then the raw text as a
   * tie-breaker. Suitable for sorted maps keyed by exact version strings.
   */
  public static final Comparator<String> STRICT = INSTANCE.thenComparing(Comparator.naturalOrder());

  private ReleaseVersionComparator() {}

  @Override
  public int compare(String left, String right) {
    Release l = Release.parse(left);
    Release r = Release.parse(right);

    int n = Math.max(l.core().size(), r.core().size());
    for (int i = 0; i < n; i++) {
      int cmp = Long.compare(coreSegment(l.core(), i), coreSegment(r.core(), i));
      if (cmp != 0) {
        return cmp;
      }
    }

    // a release outranks its own prereleases
    if (l.prerelease().isEmpty() || r.prerelease().isEmpty()) {
      return Boolean.compare(l.prerelease().isEmpty(), r.prerelease().isEmpty());
    }
    n = Math.max(l.prerelease().size(), r.prerelease().size());
    for (int i = 0; i < n; i++) {
      int cmp = compareIdentifier(identifier(l.prerelease(), i), identifier(r.prerelease(), i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return 0;
  }

  public static String normalize(String version) {
    return (version == null || version.isBlank()) ? "0" : version.trim();
  }

  private static long coreSegment(List<String> core, int i) {
    return i < core.size() ? numeric(core.get(i)) : 0;
  }

  private static String identifier(List<String> prerelease, int i) {
    return i < prerelease.size() ? prerelease.get(i) : "";
  }

  /** Digits only, saturating at {@code Long.MAX_VALUE}; anything else counts as zero. */
  private static long numeric(String segment) {
    if (!isNumeric(segment)) {
      return 0;
    }
    try {
      return Long.parseLong(segment);
    } catch (NumberFormatException e) {
      return Long.MAX_VALUE;
    }
  }

  private static boolean isNumeric(String segment) {
    return !segment.isEmpty() && segment.chars().allMatch(Character::isDigit);
  }

  private static int compareIdentifier(String a, String b) {
    if (a.isEmpty() || b.isEmpty()) {
      return Boolean.compare(!a.isEmpty(), !b.isEmpty());
    }
    boolean aNum = isNumeric(a);
    boolean bNum = isNumeric(b);
    if (aNum != bNum) {
      return aNum ? -1 : 1;
    }
    return aNum ? Long.compare(numeric(a), numeric(b)) : a.compareToIgnoreCase(b);
  }

  /**
   * A version split into its dotted core and its prerelease identifiers. The prerelease starts
   * after a '-' or at the first character of the core that is neither a digit nor a dot.
   */
  private record Release(List<String> core, List<String> prerelease) {

    static Release parse(String version) {
      String v = normalize(version);
      int cut = v.indexOf('-');
      int rest = cut + 1;
      if (cut < 0) {
        cut = 0;
        while (cut < v.length() && (Character.isDigit(v.charAt(cut)) || v.charAt(cut) == '.')) {
          cut++;
        }
        rest = cut;
      }
      List<String> core = List.of(v.substring(0, cut).split("\\."));
      List<String> prerelease =
          rest >= v.length() ? List.of() : List.of(v.substring(rest).split("\\."));
      return new Release(core, prerelease);
    }
  }
}
