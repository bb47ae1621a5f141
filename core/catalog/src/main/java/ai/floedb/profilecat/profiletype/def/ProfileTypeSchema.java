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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable schema of one profile type version: its declared fields and the support-status ledger
 * of that version.
 *
 * <p>Field iteration follows declaration order. The map is keyed by field name; the registry's
 * schema validator checks that each key matches the {@link FieldSpec#name()} it maps to.
 */
public record ProfileTypeSchema(
    ProfileTypeKey key, Map<String, FieldSpec> fields, List<SupportStatusEntry> supportStatus) {

  public ProfileTypeSchema {
    Objects.requireNonNull(key, "key");
    fields =
        fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    supportStatus = List.copyOf(supportStatus == null ? List.of() : supportStatus);
  }

  public String typeName() {
    return key.typeName();
  }

  public String version() {
    return key.version();
  }

  public Optional<FieldSpec> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  public static Builder builder(String typeName, String version) {
    return new Builder(ProfileTypeKey.of(typeName, version));
  }

  public static final class Builder {
    private final ProfileTypeKey key;
    private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
    private final List<SupportStatusEntry> supportStatus = new ArrayList<>();

    private Builder(ProfileTypeKey key) {
      this.key = key;
    }

    public Builder field(FieldSpec field) {
      fields.put(field.name(), field);
      return this;
    }

    public Builder status(SupportStatus status, String since) {
      supportStatus.add(SupportStatusEntry.of(status, since));
      return this;
    }

    public ProfileTypeSchema build() {
      return new ProfileTypeSchema(key, fields, supportStatus);
    }
  }
}
