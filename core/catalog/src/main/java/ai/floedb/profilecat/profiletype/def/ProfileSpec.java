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

import ai.floedb.profilecat.types.FieldValues;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A normalized profile specification: field values conforming to exactly one schema.
 *
 * <p>Instances are deeply immutable. Fields that were neither supplied nor defaulted are absent
 * rather than mapped to {@code null}.
 */
public record ProfileSpec(ProfileTypeKey key, Map<String, Object> values) {

  public ProfileSpec {
    Objects.requireNonNull(key, "key");
    values = FieldValues.immutableCopy(values == null ? Map.of() : values);
  }

  public Optional<Object> get(String field) {
    return Optional.ofNullable(values.get(field));
  }

  public boolean contains(String field) {
    return values.containsKey(field);
  }
}
