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

import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import ai.floedb.profilecat.profiletype.error.InvalidSchemaException;
import ai.floedb.profilecat.profiletype.provider.ProfileTypeProvider;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.jboss.logging.Logger;

/**
 * Process-wide catalog of profile type schemas keyed by type name and version.
 *
 * <p>State lives in an immutable {@link ProfileTypeRegistrySnapshot} held by an {@link
 * AtomicReference}. Reads never lock. Writes are serialized by a single lock, build a complete new
 * snapshot and swap it in atomically, so callers that captured {@link #snapshot()} keep a
 * consistent view across a whole operation even while schemas are being reloaded.
 *
 * <p>The registry performs no discovery; schemas arrive through {@link #register}, {@link
 * #registerAll} or a {@link ProfileTypeProvider} passed to {@link #initialize}.
 */
public final class ProfileTypeRegistry {

  private static final Logger LOG = Logger.getLogger(ProfileTypeRegistry.class);

  private final AtomicReference<ProfileTypeRegistrySnapshot> current =
      new AtomicReference<>(ProfileTypeRegistrySnapshot.empty());
  private final ReentrantLock writeLock = new ReentrantLock();

  /**
   * Registers one schema.
   *
   * @throws InvalidSchemaException if the schema fails structural validation
   * @throws ai.floedb.profilecat.profiletype.error.DuplicateSchemaException if the type name and
   *     version are already registered
   */
  public void register(ProfileTypeSchema schema) {
    registerAll(List.of(checked(schema)));
  }

  /** Registers a batch atomically: either every schema is added or none is. */
  public void registerAll(Collection<ProfileTypeSchema> schemas) {
    List<ProfileTypeSchema> additions = validated(schemas);
    writeLock.lock();
    try {
      ProfileTypeRegistrySnapshot next = current.get().with(additions);
      current.set(next);
      LOG.debugf(
          "Registered %d profile type schema(s), generation=%d",
          additions.size(), next.generation());
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Replaces every registered schema with {@code schemas}. The new set is fully validated before
   * the swap; on failure the previous snapshot stays in place.
   */
  public void replaceAll(Collection<ProfileTypeSchema> schemas) {
    List<ProfileTypeSchema> replacement = validated(schemas);
    writeLock.lock();
    try {
      ProfileTypeRegistrySnapshot previous = current.get();
      ProfileTypeRegistrySnapshot next = previous.cleared().with(replacement);
      current.set(next);
      LOG.infof(
          "Reloaded profile types: %d schema(s) replaced by %d, generation=%d",
          previous.size(), next.size(), next.generation());
    } finally {
      writeLock.unlock();
    }
  }

  /** Loads and registers every schema supplied by {@code provider}. */
  public void initialize(ProfileTypeProvider provider) {
    Objects.requireNonNull(provider, "provider");
    List<ProfileTypeSchema> schemas = provider.load();
    registerAll(schemas);
    LOG.infof(
        "Initialized profile type registry with %d schema(s) from %s",
        schemas.size(), provider.getClass().getSimpleName());
  }

  /** Current immutable state; use one snapshot for all reads belonging to a single operation. */
  public ProfileTypeRegistrySnapshot snapshot() {
    return current.get();
  }

  public ProfileTypeSchema lookup(String typeName, String version) {
    return snapshot().lookup(typeName, version);
  }

  public ProfileTypeSchema lookupLatest(String typeName) {
    return snapshot().lookupLatest(typeName);
  }

  public List<ProfileTypeSchema> list(String typeName) {
    return snapshot().list(typeName);
  }

  public List<String> typeNames() {
    return snapshot().typeNames();
  }

  /** Test-only: drops every registered schema. */
  public void clear() {
    writeLock.lock();
    try {
      current.set(current.get().cleared());
    } finally {
      writeLock.unlock();
    }
  }

  private static List<ProfileTypeSchema> validated(Collection<ProfileTypeSchema> schemas) {
    Objects.requireNonNull(schemas, "schemas");
    List<ProfileTypeSchema> out = new ArrayList<>(schemas.size());
    for (ProfileTypeSchema schema : schemas) {
      out.add(checked(schema));
    }
    return out;
  }

  private static ProfileTypeSchema checked(ProfileTypeSchema schema) {
    List<String> errors = ProfileTypeSchemaValidator.validate(schema);
    if (!errors.isEmpty()) {
      throw new InvalidSchemaException(
          schema == null ? null : schema.typeName(),
          schema == null ? null : schema.version(),
          errors);
    }
    return schema;
  }
}
