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
package net.tsquery.data;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;

/**
 * The functions used to reduce a run of datapoints into a single value
 * when lowering the resolution of a series. Every function skips gaps
 * (nulls) and returns a gap only if every value in the run was a gap.
 * Values are accumulated left to right so results are reproducible.
 *
 * @since 3.0
 */
public enum ConsolidationFunction {
  AVG("avg") {
    @Override
    public Double reduce(final List<Double> values, final int from, final int to) {
      double sum = 0;
      int count = 0;
      for (int i = from; i < to; i++) {
        final Double value = values.get(i);
        if (value != null) {
          sum += value;
          count++;
        }
      }
      return count == 0 ? null : sum / count;
    }
  },
  SUM("sum") {
    @Override
    public Double reduce(final List<Double> values, final int from, final int to) {
      double sum = 0;
      boolean found = false;
      for (int i = from; i < to; i++) {
        final Double value = values.get(i);
        if (value != null) {
          sum += value;
          found = true;
        }
      }
      return found ? sum : null;
    }
  },
  MIN("min") {
    @Override
    public Double reduce(final List<Double> values, final int from, final int to) {
      Double min = null;
      for (int i = from; i < to; i++) {
        final Double value = values.get(i);
        if (value != null && (min == null || value < min)) {
          min = value;
        }
      }
      return min;
    }
  },
  MAX("max") {
    @Override
    public Double reduce(final List<Double> values, final int from, final int to) {
      Double max = null;
      for (int i = from; i < to; i++) {
        final Double value = values.get(i);
        if (value != null && (max == null || value > max)) {
          max = value;
        }
      }
      return max;
    }
  },
  FIRST("first") {
    @Override
    public Double reduce(final List<Double> values, final int from, final int to) {
      for (int i = from; i < to; i++) {
        if (values.get(i) != null) {
          return values.get(i);
        }
      }
      return null;
    }
  },
  LAST("last") {
    @Override
    public Double reduce(final List<Double> values, final int from, final int to) {
      for (int i = to - 1; i >= from; i--) {
        if (values.get(i) != null) {
          return values.get(i);
        }
      }
      return null;
    }
  },
  COUNT("count") {
    @Override
    public Double reduce(final List<Double> values, final int from, final int to) {
      int count = 0;
      for (int i = from; i < to; i++) {
        if (values.get(i) != null) {
          count++;
        }
      }
      return count == 0 ? null : (double) count;
    }
  };

  /** The short name used in configs and function arguments. */
  private final String id;

  ConsolidationFunction(final String id) {
    this.id = id;
  }

  /**
   * Reduces the values in {@code [from, to)} to a single value.
   * @param values A non-null list of values with nulls for gaps.
   * @param from The inclusive start index.
   * @param to The exclusive end index.
   * @return The reduced value or null if the run held only gaps.
   */
  public abstract Double reduce(final List<Double> values,
                                final int from,
                                final int to);

  /**
   * @param values A non-null list of values.
   * @return The reduction over the entire list.
   */
  public Double reduce(final List<Double> values) {
    return reduce(values, 0, values.size());
  }

  /** @return The short name, e.g. "avg". */
  @JsonValue
  public String id() {
    return id;
  }

  /**
   * Parses the name of a function. Accepts the short names along with
   * "average" as a synonym for "avg".
   * @param name A non-null and non-empty name, case insensitive.
   * @return The function.
   * @throws IllegalArgumentException if the name was null, empty or
   * unknown.
   */
  public static ConsolidationFunction fromString(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Consolidation function name "
          + "cannot be null or empty.");
    }
    final String lower = name.trim().toLowerCase();
    if (lower.equals("average")) {
      return AVG;
    }
    for (final ConsolidationFunction function : values()) {
      if (function.id.equals(lower)) {
        return function;
      }
    }
    throw new IllegalArgumentException("Unknown consolidation function: "
        + name);
  }

  @Override
  public String toString() {
    return id;
  }
}
