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

import com.google.common.collect.Lists;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;

/**
 * Per series transforms whose output at a position depends on earlier
 * positions: the derivatives, {@code integral} and {@code keepLastValue}.
 *
 * @since 3.0
 */
public class SeriesWalkFunction implements SeriesFunction {

  /** The supported walks. */
  public enum Walk {
    DERIVATIVE("derivative", 1),
    NON_NEGATIVE_DERIVATIVE("nonNegativeDerivative", 2),
    PER_SECOND("perSecond", 2),
    INTEGRAL("integral", 1),
    KEEP_LAST_VALUE("keepLastValue", 2);

    private final String function;
    private final int max_args;

    Walk(final String function, final int max_args) {
      this.function = function;
      this.max_args = max_args;
    }

    /** @return The function name. */
    public String function() {
      return function;
    }
  }

  private final Walk walk;

  public SeriesWalkFunction(final Walk walk) {
    this.walk = walk;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    args.requireCount(1, walk.max_args);
    final List<NormalizedSeries> inputs = args.seriesList(0);
    final List<NormalizedSeries> results = Lists.newArrayListWithCapacity(inputs.size());
    for (final NormalizedSeries series : inputs) {
      final List<Double> values;
      switch (walk) {
      case DERIVATIVE:
        values = derivative(series.values());
        break;
      case NON_NEGATIVE_DERIVATIVE:
        values = nonNegativeDerivative(series.values(), args.number(1, null), 1);
        break;
      case PER_SECOND:
        values = nonNegativeDerivative(series.values(), args.number(1, null),
            series.timeInfo().step());
        break;
      case INTEGRAL:
        values = integral(series.values());
        break;
      case KEEP_LAST_VALUE:
        final Double limit = args.number(1, null);
        values = keepLastValue(series.values(),
            limit == null ? Integer.MAX_VALUE : limit.intValue());
        break;
      default:
        throw new IllegalStateException("Unhandled walk: " + walk);
      }
      final String name = SeriesNames.call(walk.function, series.name());
      results.add(NormalizedSeries.newBuilder(series)
          .setName(name)
          .setPathExpression(name)
          .setValues(values)
          .build());
    }
    return results;
  }

  /**
   * @param values The input.
   * @return The difference to the previous value, a gap where either is a
   * gap and at the first position.
   */
  static List<Double> derivative(final List<Double> values) {
    final List<Double> result = Lists.newArrayListWithCapacity(values.size());
    Double previous = null;
    for (final Double value : values) {
      result.add(previous == null || value == null ? null : value - previous);
      previous = value;
    }
    return result;
  }

  /**
   * Like {@link #derivative(List)} but a decrease is treated as a counter
   * wrap when it is at or under the max value, else as a gap.
   * @param values The input.
   * @param max_value The counter maximum or null.
   * @param divisor Each delta is divided by this, e.g. the step.
   * @return The non negative deltas.
   */
  static List<Double> nonNegativeDerivative(final List<Double> values,
                                            final Double max_value,
                                            final double divisor) {
    final List<Double> result = Lists.newArrayListWithCapacity(values.size());
    Double previous = null;
    for (final Double value : values) {
      if (previous == null || value == null) {
        result.add(null);
      } else {
        final double diff = value - previous;
        if (diff >= 0) {
          result.add(diff / divisor);
        } else if (max_value != null && max_value >= value) {
          result.add(((max_value - previous) + value + 1) / divisor);
        } else {
          result.add(null);
        }
      }
      previous = value;
    }
    return result;
  }

  /**
   * @param values The input.
   * @return The running sum, gaps stay gaps and do not reset the sum.
   */
  static List<Double> integral(final List<Double> values) {
    final List<Double> result = Lists.newArrayListWithCapacity(values.size());
    double sum = 0;
    for (final Double value : values) {
      if (value == null) {
        result.add(null);
      } else {
        sum += value;
        result.add(sum);
      }
    }
    return result;
  }

  /**
   * Fills runs of gaps of at most {@code limit} positions with the value
   * preceding the run. A trailing run is filled when it is shorter than
   * the limit.
   * @param values The input.
   * @param limit The longest run to fill.
   * @return The filled values.
   */
  static List<Double> keepLastValue(final List<Double> values, final int limit) {
    final List<Double> result = Lists.newArrayList(values);
    int gaps = 0;
    for (int i = 1; i < result.size(); i++) {
      if (result.get(i) == null) {
        gaps++;
      } else {
        if (gaps > 0 && gaps <= limit) {
          fill(result, i - gaps, i);
        }
        gaps = 0;
      }
    }
    if (gaps > 0 && gaps < limit) {
      fill(result, result.size() - gaps, result.size());
    }
    return result;
  }

  private static void fill(final List<Double> values, final int from, final int to) {
    final Double last = values.get(from - 1);
    for (int i = from; i < to; i++) {
      values.set(i, last);
    }
  }
}
