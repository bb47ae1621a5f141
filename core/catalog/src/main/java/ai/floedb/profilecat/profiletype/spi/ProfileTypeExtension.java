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

package ai.floedb.profilecat.profiletype.spi;

import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import java.util.List;

/**
 * SPI for plugins that contribute profile types.
 *
 * <p>Implemented by plugin JARs discovered via Java ServiceLoader.
 */
public interface ProfileTypeExtension {

  /** Globally unique plugin identifier (e.g. "builtin", "os.nova"). */
  String id();

  /** Returns every schema version this plugin contributes. */
  List<ProfileTypeSchema> loadProfileTypes();

  /** Optional hook invoked when {@link #loadProfileTypes()} fails, before the plugin is skipped. */
  default void onLoadError(Exception e) {}
}
