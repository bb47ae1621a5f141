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

import ai.floedb.profilecat.types.FieldType;
import ai.floedb.profilecat.types.FieldValueCoercions;
import ai.floedb.profilecat.types.FieldValues;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Additional restriction on a well-typed field value.
 *
 * <p>Constraints are checked after type coercion, so {@link #accepts} always sees the normalized
 * representation of the field type.
 */
public sealed interface FieldConstraint
    permits FieldConstraint.AllowedValues, FieldConstraint.Range {

  /** Constraint name as written in definition documents. */
  String kind();

  /** True when the normalized {@code value} satisfies the constraint. */
  boolean accepts(FieldType type, Object value);

  /** Validation codes for a constraint that cannot apply to a field of {@code type}. */
  List<String> declarationErrors(FieldType type, String path);

  /** Short rendering used in error messages. */
  String describe();

  /** Value must equal one of {@code values} after coercion to the field type. */
  record AllowedValues(List<Object> values) implements FieldConstraint {

    public AllowedValues {
      values = FieldValues.immutableCopy(values == null ? List.of() : values);
    }

    @Override
    public String kind() {
      return "AllowedValues";
    }

    @Override
    public boolean accepts(FieldType type, Object value) {
      for (Object allowed : values) {
        if (FieldValueCoercions.conforms(type, allowed)
            && FieldValueCoercions.coerce(type, allowed).equals(value)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public List<String> declarationErrors(FieldType type, String path) {
      List<String> errors = new ArrayList<>();
      if (type.isContainer()) {
        errors.add("constraint.allowed.container:" + path);
        return errors;
      }
      if (values.isEmpty()) {
        errors.add("constraint.allowed.empty:" + path);
      }
      for (Object allowed : values) {
        if (!FieldValueCoercions.conforms(type, allowed)) {
          errors.add("constraint.allowed.type:" + path);
          break;
        }
      }
      return errors;
    }

    @Override
    public String describe() {
      return "AllowedValues" + values;
    }
  }

  /**
   * Inclusive bounds. Numeric fields compare the value itself; String, List and Map fields compare
   * the length or size. Either bound may be absent, but not both.
   */
  record Range(Double min, Double max) implements FieldConstraint {

    public static Range of(Number min, Number max) {
      return new Range(
          min == null ? null : min.doubleValue(), max == null ? null : max.doubleValue());
    }

    @Override
    public String kind() {
      return "Range";
    }

    @Override
    public boolean accepts(FieldType type, Object value) {
      double measured;
      if (value instanceof Number n) {
        measured = n.doubleValue();
      } else {
        int size = FieldValues.sizeOf(value);
        if (size < 0) {
          return false;
        }
        measured = size;
      }
      return (min == null || measured >= min) && (max == null || measured <= max);
    }

    @Override
    public List<String> declarationErrors(FieldType type, String path) {
      List<String> errors = new ArrayList<>();
      if (type == FieldType.BOOLEAN) {
        errors.add("constraint.range.type:" + path);
      }
      if (min == null && max == null) {
        errors.add("constraint.range.unbounded:" + path);
      } else if (min != null && max != null && min > max) {
        errors.add("constraint.range.bounds:" + path);
      }
      return errors;
    }

    @Override
    public String describe() {
      return "Range[min="
          + Objects.toString(min, "-")
          + ", max="
          + Objects.toString(max, "-")
          + "]";
    }
  }
}
