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
package net.tsquery.query.expression.functions;

import java.util.List;

/**
 * Reduces the values of several aligned series at one position. The first
 * group ignores gaps and yields a gap only when every operand is a gap.
 * The others propagate a gap from any operand.
 *
 * @since 3.0
 */
public enum Combiner {
  SUM("sumSeries") {
    @Override
    public Double combine(final List<Double> values) {
      return SeriesStats.sum(values);
    }
  },
  AVERAGE("averageSeries") {
    @Override
    public Double combine(final List<Double> values) {
      return SeriesStats.average(values);
    }
  },
  MIN("minSeries") {
    @Override
    public Double combine(final List<Double> values) {
      return SeriesStats.min(values);
    }
  },
  MAX("maxSeries") {
    @Override
    public Double combine(final List<Double> values) {
      return SeriesStats.max(values);
    }
  },
  RANGE("rangeOfSeries") {
    @Override
    public Double combine(final List<Double> values) {
      final Double max = SeriesStats.max(values);
      return max == null ? null : max - SeriesStats.min(values);
    }
  },
  STDDEV("stddevSeries") {
    @Override
    public Double combine(final List<Double> values) {
      final Double avg = SeriesStats.average(values);
      if (avg == null) {
        return null;
      }
      double sum = 0;
      int count = 0;
      for (final Double value : values) {
        if (value != null) {
          sum += (value - avg) * (value - avg);
          count++;
        }
      }
      return Math.sqrt(sum / count);
    }
  },
  COUNT("countSeries") {
    @Override
    public Double combine(final List<Double> values) {
      int count = 0;
      for (final Double value : values) {
        if (value != null) {
          count++;
        }
      }
      return count == 0 ? null : (double) count;
    }
  },
  DIFF("diffSeries") {
    @Override
    public Double combine(final List<Double> values) {
      double diff = 0;
      for (int i = 0; i < values.size(); i++) {
        final Double value = values.get(i);
        if (value == null) {
          return null;
        }
        diff = i == 0 ? value : diff - value;
      }
      return values.isEmpty() ? null : diff;
    }
  },
  MULTIPLY("multiplySeries") {
    @Override
    public Double combine(final List<Double> values) {
      double product = 1;
      for (final Double value : values) {
        if (value == null) {
          return null;
        }
        product *= value;
      }
      return values.isEmpty() ? null : product;
    }
  };

  /** The name used when rendering output names. */
  private final String function;

  Combiner(final String function) {
    this.function = function;
  }

  /**
   * @param values The values at one position, one per series.
   * @return The combined value or null for a gap.
   */
  public abstract Double combine(final List<Double> values);

  /** @return The canonical function name, e.g. {@code sumSeries}. */
  public String function() {
    return function;
  }

  /**
   * Resolves a combine function by name for callbacks such as
   * {@code groupByNode(a.*.b, 1, "sumSeries")}.
   * @param name A canonical name or one of the short aliases.
   * @return The combiner or null if the name is not a combine function.
   */
  public static Combiner fromFunction(final String name) {
    if ("sum".equals(name)) {
      return SUM;
    }
    if ("avg".equals(name)) {
      return AVERAGE;
    }
    for (final Combiner combiner : values()) {
      if (combiner.function.equals(name)) {
        return combiner;
      }
    }
    return null;
  }
}
