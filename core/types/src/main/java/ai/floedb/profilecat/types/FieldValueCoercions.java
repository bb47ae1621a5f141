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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts loosely typed input values into the canonical representation of a {@link FieldType}.
 *
 * <p>Accepted inputs per type:
 *
 * <ul>
 *   <li>{@code BOOLEAN}: {@link Boolean} only
 *   <li>{@code INTEGER}: integral {@link Number}s within the {@code long} range, or a string that
 *       is entirely a signed decimal integer ({@code "60"}, {@code "-3"})
 *   <li>{@code FLOAT}: any finite {@link Number}, or a string that is entirely a decimal number
 *       ({@code "1.5"}, {@code "2e3"})
 *   <li>{@code STRING}: {@link String} only
 *   <li>{@code MAP}: a {@link Map} whose keys are all strings
 *   <li>{@code LIST}: a {@link List}
 * </ul>
 *
 * Maps nested anywhere inside a container value must have string keys as well. Everything else is
 * rejected with an {@link IllegalArgumentException}.
 */
public final class FieldValueCoercions {

  private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+");
  private static final Pattern DECIMAL_TEXT =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private FieldValueCoercions() {}

  /**
   * Coerces {@code value} to the canonical representation of {@code type}.
   *
   * <p>Container values are returned as deep, unmodifiable copies so the result never shares
   * structure with the caller's input.
   *
   * @throws IllegalArgumentException if the value does not conform and no coercion applies
   */
  public static Object coerce(FieldType type, Object value) {
    if (value == null) {
      throw new IllegalArgumentException("null is not a valid " + type.displayName());
    }
    return switch (type) {
      case BOOLEAN -> {
        if (value instanceof Boolean b) {
          yield b;
        }
        throw mismatch(type, value);
      }
      case INTEGER -> toLong(value);
      case FLOAT -> toDouble(value);
      case STRING -> {
        if (value instanceof String s) {
          yield s;
        }
        throw mismatch(type, value);
      }
      case MAP -> {
        if (value instanceof Map<?, ?> map) {
          requireStringKeys(map);
          yield FieldValues.immutableCopy(map);
        }
        throw mismatch(type, value);
      }
      case LIST -> {
        if (value instanceof List<?> list) {
          requireStringKeys(list);
          yield FieldValues.immutableCopy(list);
        }
        throw mismatch(type, value);
      }
    };
  }

  /** Returns true when {@link #coerce} would accept {@code value} for {@code type}. */
  public static boolean conforms(FieldType type, Object value) {
    try {
      coerce(type, value);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  private static void requireStringKeys(Object value) {
    if (value instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String)) {
          throw new IllegalArgumentException(
              "Map keys must be strings, got " + FieldValues.describe(entry.getKey()));
        }
        requireStringKeys(entry.getValue());
      }
    } else if (value instanceof List<?> list) {
      for (Object element : list) {
        requireStringKeys(element);
      }
    }
  }

  private static Long toLong(Object value) {
    if (value instanceof Long l) {
      return l;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger big) {
      if (big.compareTo(LONG_MIN) < 0 || big.compareTo(LONG_MAX) > 0) {
        throw new IllegalArgumentException(
            "The value " + big + " is out of range for " + FieldType.INTEGER.displayName());
      }
      return big.longValue();
    }
    if (value instanceof String s && INTEGER_TEXT.matcher(s).matches()) {
      try {
        return Long.parseLong(s);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "The value '" + s + "' is out of range for " + FieldType.INTEGER.displayName(), e);
      }
    }
    throw mismatch(FieldType.INTEGER, value);
  }

  private static Double toDouble(Object value) {
    double d;
    if (value instanceof BigDecimal big) {
      d = big.doubleValue();
    } else if (value instanceof Number n) {
      d = n.doubleValue();
    } else if (value instanceof String s && DECIMAL_TEXT.matcher(s).matches()) {
      d = Double.parseDouble(s);
    } else {
      throw mismatch(FieldType.FLOAT, value);
    }
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      throw new IllegalArgumentException(
          "The value " + FieldValues.describe(value) + " is not a finite number");
    }
    return d;
  }

  private static IllegalArgumentException mismatch(FieldType type, Object value) {
    return new IllegalArgumentException(
        "The value " + FieldValues.describe(value) + " is not a valid " + type.displayName());
  }
}
