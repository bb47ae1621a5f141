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

package ai.floedb.profilecat.profiletype.builtin;

import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import ai.floedb.profilecat.profiletype.provider.ProfileTypeDefinitionParser;
import ai.floedb.profilecat.profiletype.spi.ProfileTypeExtension;
import java.util.ArrayList;
import java.util.List;

/**
 * Profile types shipped with the catalog itself. Each type is one definition document under
 * {@code /profile-types/} on the classpath.
 */
public class BuiltinProfileTypeExtension implements ProfileTypeExtension {

  static final List<String> DEFINITIONS = List.of("os.heat.stack");

  @Override
  public String id() {
    return "builtin";
  }

  @Override
  public List<ProfileTypeSchema> loadProfileTypes() {
    List<ProfileTypeSchema> out = new ArrayList<>();
    for (String typeName : DEFINITIONS) {
      out.addAll(ProfileTypeDefinitionParser.parseResource(getClass(), getResourcePath(typeName)));
    }
    return List.copyOf(out);
  }

  /** Resource holding the definition of {@code typeName}. Subclasses may relocate definitions. */
  protected String getResourcePath(String typeName) {
    return "/profile-types/" + typeName + ".json";
  }
}
