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

package ai.floedb.profilecat.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Helpers for copying and describing field values. */
public final class FieldValues {

  private static final int DESCRIBE_LIMIT = 64;

  private FieldValues() {}

  /**
   * Deep copy of a value tree into unmodifiable maps and lists. Map iteration order is preserved
   * and map keys are converted to strings; scalars are returned as-is.
   */
  @SuppressWarnings("unchecked")
  public static <T> T immutableCopy(T value) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> out = new LinkedHashMap<>(map.size());
      map.forEach((k, v) -> out.put(String.valueOf(k), immutableCopy(v)));
      return (T) Collections.unmodifiableMap(out);
    }
    if (value instanceof List<?> list) {
      List<Object> out = new ArrayList<>(list.size());
      for (Object element : list) {
        out.add(immutableCopy(element));
      }
      return (T) Collections.unmodifiableList(out);
    }
    return value;
  }

  /** Length of a string, or size of a map or list; -1 for anything else. */
  public static int sizeOf(Object value) {
    if (value instanceof String s) {
      return s.length();
    }
    if (value instanceof Map<?, ?> map) {
      return map.size();
    }
    if (value instanceof List<?> list) {
      return list.size();
    }
    return -1;
  }

  /**
   * Short, human-readable rendering of a value and its Java-side kind, used in error messages,
   * e.g. {@code 'abc' (String)} or {@code 60 (Integer)}.
   */
  public static String describe(Object value) {
    if (value == null) {
      return "null";
    }
    String text = value instanceof String s ? "'" + s + "'" : String.valueOf(value);
    if (text.length() > DESCRIBE_LIMIT) {
      text = text.substring(0, DESCRIBE_LIMIT) + "...";
    }
    return text + " (" + kindOf(value) + ")";
  }

  private static String kindOf(Object value) {
    if (value instanceof Map<?, ?>) {
      return "Map";
    }
    if (value instanceof List<?>) {
      return "List";
    }
    return value.getClass().getSimpleName();
  }
}
