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

import ai.floedb.profilecat.profiletype.def.FieldConstraint;
import ai.floedb.profilecat.profiletype.def.FieldSpec;
import ai.floedb.profilecat.profiletype.def.ProfileTypeSchema;
import ai.floedb.profilecat.profiletype.def.SupportStatusEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders registered schemas back into the definition document shape read by {@link
 * ProfileTypeDefinitionParser}, for listing endpoints and tooling.
 */
public final class ProfileTypeDescriptions {

  private static final ObjectMapper JSON = new ObjectMapper();

  private ProfileTypeDescriptions() {}

  public static Map<String, Object> describe(ProfileTypeSchema schema) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type_name", schema.typeName());
    out.put("schema", describeFields(schema.fields()));

    List<Map<String, Object>> ledger = new ArrayList<>();
    for (SupportStatusEntry entry : schema.supportStatus()) {
      Map<String, Object> e = new LinkedHashMap<>();
      e.put("status", entry.status().name());
      e.put("since", entry.since());
      ledger.add(e);
    }
    Map<String, Object> status = new LinkedHashMap<>();
    status.put(schema.version(), ledger);
    out.put("support_status", status);
    return out;
  }

  public static String toJson(ProfileTypeSchema schema) {
    try {
      return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(describe(schema));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render profile type " + schema.key(), e);
    }
  }

  private static Map<String, Object> describeFields(Map<String, FieldSpec> fields) {
    Map<String, Object> out = new LinkedHashMap<>();
    fields.forEach((name, spec) -> out.put(name, describeField(spec)));
    return out;
  }

  private static Map<String, Object> describeField(FieldSpec spec) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", spec.type().displayName());
    out.put("description", spec.description());
    if (spec.hasDefault()) {
      out.put("default", spec.defaultValue());
    }
    out.put("required", spec.required());
    out.put("updatable", spec.updatable());
    if (spec.minVersion() != null) {
      out.put("min_version", spec.minVersion());
    }
    if (spec.maxVersion() != null) {
      out.put("max_version", spec.maxVersion());
    }
    if (spec.hasSchema()) {
      out.put("schema", describeFields(spec.schema()));
    }
    if (!spec.constraints().isEmpty()) {
      List<Map<String, Object>> constraints = new ArrayList<>();
      spec.constraints().forEach(c -> constraints.add(describeConstraint(c)));
      out.put("constraints", constraints);
    }
    return out;
  }

  private static Map<String, Object> describeConstraint(FieldConstraint constraint) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", constraint.kind());
    if (constraint instanceof FieldConstraint.AllowedValues allowed) {
      out.put("values", allowed.values());
    } else if (constraint instanceof FieldConstraint.Range range) {
      if (range.min() != null) {
        out.put("min", range.min());
      }
      if (range.max() != null) {
        out.put("max", range.max());
      }
    }
    return out;
  }
}
