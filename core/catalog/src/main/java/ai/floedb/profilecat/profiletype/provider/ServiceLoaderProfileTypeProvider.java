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
import ai.floedb.profilecat.profiletype.spi.ProfileTypeExtension;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Production implementation of ProfileTypeProvider. Discovers ProfileTypeExtension implementations
 * using ServiceLoader.
 *
 * <p>Plugins with a blank or already-seen id are ignored. A plugin whose {@code loadProfileTypes}
 * throws is logged and skipped so one broken JAR cannot keep the others from loading.
 */
public final class ServiceLoaderProfileTypeProvider implements ProfileTypeProvider {

  private static final Logger LOG = Logger.getLogger(ServiceLoaderProfileTypeProvider.class);

  private final Map<String, ProfileTypeExtension> plugins;

  public ServiceLoaderProfileTypeProvider() {
    this(ServiceLoader.load(ProfileTypeExtension.class));
  }

  public ServiceLoaderProfileTypeProvider(ClassLoader classLoader) {
    this(ServiceLoader.load(ProfileTypeExtension.class, classLoader));
  }

  ServiceLoaderProfileTypeProvider(Iterable<ProfileTypeExtension> extensions) {
    Map<String, ProfileTypeExtension> tmp = new LinkedHashMap<>();
    for (ProfileTypeExtension ext : extensions) {
      String id = ext.id() == null ? "" : ext.id().trim().toLowerCase(Locale.ROOT);

      if (id.isEmpty()) {
        LOG.warnf("Ignoring profile type plugin with empty id: %s", ext.getClass().getName());
        continue;
      }
      if (tmp.containsKey(id)) {
        LOG.warnf(
            "Duplicate profile type plugin '%s': using %s, ignoring %s",
            id, tmp.get(id).getClass().getName(), ext.getClass().getName());
        continue;
      }

      LOG.infof("Discovered profile type plugin '%s': %s", id, ext.getClass().getName());
      tmp.put(id, ext);
    }
    this.plugins = tmp;
  }

  public Set<String> pluginIds() {
    return Set.copyOf(plugins.keySet());
  }

  @Override
  public List<ProfileTypeSchema> load() {
    List<ProfileTypeSchema> out = new ArrayList<>();
    plugins.forEach(
        (id, ext) -> {
          try {
            List<ProfileTypeSchema> schemas = ext.loadProfileTypes();
            LOG.infof("Loaded %d profile type schema(s) from plugin '%s'", schemas.size(), id);
            out.addAll(schemas);
          } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to load profile types from plugin '%s', skipping it", id);
            ext.onLoadError(e);
          }
        });
    return List.copyOf(out);
  }
}
