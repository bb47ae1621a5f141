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

package ai.floedb.profilecat.profiletype.registry;

import ai.floedb.profilecat.profiletype.def.ProfileTypeKey;
import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import ai.floedb.profilecat.profiletype.error.DuplicateSchemaException;
import ai.floedb.profilecat.profiletype.error.UnknownSchemaException;
import ai.floedb.profilecat.profiletype.support.ReleaseVersionComparator;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable view of every registered profile type schema.
 *
 * <p>Snapshots are never modified; registration builds a new snapshot with {@link #with}. Versions
 * of one type are kept in ascending release-version order.
 */
public final class ProfileTypeRegistrySnapshot {

  private static final ProfileTypeRegistrySnapshot EMPTY =
      new ProfileTypeRegistrySnapshot(Map.of(), 0L);

  private final Map<String, List<ProfileTypeSchema>> versionsByType;
  private final long generation;

  private ProfileTypeRegistrySnapshot(
      Map<String, List<ProfileTypeSchema>> versionsByType, long generation) {
    this.versionsByType = versionsByType;
    this.generation = generation;
  }

  public static ProfileTypeRegistrySnapshot empty() {
    return EMPTY;
  }

  /**
   * Monotonic counter of the registry state this snapshot was built from; 0 for the empty
   * snapshot.
   */
  public long generation() {
    return generation;
  }

  /**
   * @throws IllegalArgumentException if the type name or version is blank
   * @throws UnknownSchemaException if no such schema is registered
   */
  public ProfileTypeSchema lookup(String typeName, String version) {
    ProfileTypeKey key = ProfileTypeKey.of(typeName, version);
    return find(key.typeName(), key.version())
        .orElseThrow(() -> new UnknownSchemaException(key.typeName(), key.version()));
  }

  public Optional<ProfileTypeSchema> find(String typeName, String version) {
    if (typeName == null || version == null) {
      return Optional.empty();
    }
    String wanted = version.trim();
    return list(typeName).stream().filter(s -> s.version().equals(wanted)).findFirst();
  }

  public ProfileTypeSchema lookupLatest(String typeName) {
    List<ProfileTypeSchema> versions = list(typeName);
    if (versions.isEmpty()) {
      throw new UnknownSchemaException(typeName);
    }
    return versions.get(versions.size() - 1);
  }

  /** Registered versions of {@code typeName} in ascending order; empty when none. */
  public List<ProfileTypeSchema> list(String typeName) {
    if (typeName == null) {
      return List.of();
    }
    return versionsByType.getOrDefault(typeName.trim(), List.of());
  }

  /** Registered type names in lexical order. */
  public List<String> typeNames() {
    return List.copyOf(versionsByType.keySet());
  }

  public List<ProfileTypeSchema> all() {
    List<ProfileTypeSchema> out = new ArrayList<>();
    versionsByType.values().forEach(out::addAll);
    return Collections.unmodifiableList(out);
  }

  public boolean contains(ProfileTypeKey key) {
    return find(key.typeName(), key.version()).isPresent();
  }

  public int size() {
    return versionsByType.values().stream().mapToInt(List::size).sum();
  }

  /**
   * Returns a new snapshot holding this snapshot's schemas plus {@code additions}.
   *
   * @throws DuplicateSchemaException if any key is already present or repeated in {@code
   *     additions}
   */
  ProfileTypeRegistrySnapshot with(Collection<ProfileTypeSchema> additions) {
    Map<String, TreeMap<String, ProfileTypeSchema>> working = new TreeMap<>();
    versionsByType.forEach(
        (type, versions) -> versions.forEach(s -> versionsOf(working, type).put(s.version(), s)));

    for (ProfileTypeSchema schema : additions) {
      TreeMap<String, ProfileTypeSchema> versions = versionsOf(working, schema.typeName());
      if (versions.putIfAbsent(schema.version(), schema) != null) {
        throw new DuplicateSchemaException(schema.key());
      }
    }

    Map<String, List<ProfileTypeSchema>> frozen = new LinkedHashMap<>();
    working.forEach((type, versions) -> frozen.put(type, List.copyOf(versions.values())));
    return new ProfileTypeRegistrySnapshot(Collections.unmodifiableMap(frozen), generation + 1);
  }

  /** Returns the empty state with a generation following this one. */
  ProfileTypeRegistrySnapshot cleared() {
    return new ProfileTypeRegistrySnapshot(Map.of(), generation + 1);
  }

  private static TreeMap<String, ProfileTypeSchema> versionsOf(
      Map<String, TreeMap<String, ProfileTypeSchema>> working, String typeName) {
    return working.computeIfAbsent(typeName, t -> new TreeMap<>(ReleaseVersionComparator.STRICT));
  }
}
