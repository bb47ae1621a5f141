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

package ai.floedb.profilecat.profiletype.provider;

import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import java.util.Arrays;
import java.util.List;

/** Provider backed by a fixed schema list. Used in tests and embedded setups. */
public final class StaticProfileTypeProvider implements ProfileTypeProvider {

  private final List<ProfileTypeSchema> schemas;

  public StaticProfileTypeProvider(List<ProfileTypeSchema> schemas) {
    this.schemas = List.copyOf(schemas);
  }

  public static StaticProfileTypeProvider of(ProfileTypeSchema... schemas) {
    return new StaticProfileTypeProvider(Arrays.asList(schemas));
  }

  @Override
  public List<ProfileTypeSchema> load() {
    return schemas;
  }
}
