// This file is part of tsquery.
// Copyright (C) 2024  The tsquery Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsquery.query.expression;

/**
 * A constant argument: a number, a string, a boolean or null.
 *
 * @since 3.0
 */
public class Literal extends ExpressionNode {

  private final Object value;

  /**
   * Default ctor.
   * @param value A {@link Number}, {@link String}, {@link Boolean} or null.
   * @throws IllegalArgumentException for any other type.
   */
  public Literal(final Object value) {
    if (value != null && !(value instanceof Number)
        && !(value instanceof String) && !(value instanceof Boolean)) {
      throw new IllegalArgumentException("Unsupported literal type: "
          + value.getClass());
    }
    this.value = value;
  }

  /** @return The value, may be null. */
  public Object value() {
    return value;
  }

  @Override
  public String toString() {
    if (value == null) {
      return "None";
    }
    if (value instanceof String) {
      return "\"" + value + "\"";
    }
    if (value instanceof Double || value instanceof Float) {
      final double d = ((Number) value).doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d)) {
        return Long.toString((long) d);
      }
    }
    return value.toString();
  }
}
