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

/**
 * Field-level changes proposed for an existing {@link ProfileSpec}.
 *
 * <p>A field missing from {@link #changes()} keeps its current value. A field mapped to {@code
 * null} is reset: it takes its schema default again, or is cleared when it has none.
 */
public record ProfileSpecPatch(ProfileTypeKey key, Map<String, Object> changes) {

  public ProfileSpecPatch {
    Objects.requireNonNull(key, "key");
    changes = FieldValues.immutableCopy(changes == null ? Map.of() : changes);
  }

  public boolean resets(String field) {
    return changes.containsKey(field) && changes.get(field) == null;
  }
}
