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
 * A function mapping each value of each input series independently, e.g.
 * {@code scale(a.b, 2)}. The first argument is the series list, the rest
 * are parameters read by the transform and the namer.
 *
 * @since 3.0
 */
public class PointTransformFunction implements SeriesFunction {

  /** Maps one value, gaps included. */
  public interface Transform {
    /**
     * @param value The value or null for a gap.
     * @param series The series being transformed.
     * @param args The call arguments.
     * @return The new value or null for a gap.
     */
    public Double apply(final Double value,
                        final NormalizedSeries series,
                        final FunctionArguments args);
  }

  /** Renders the output name. */
  public interface Namer {
    public String name(final NormalizedSeries series,
                       final FunctionArguments args);
  }

  private final int min_args;
  private final int max_args;
  private final Namer namer;
  private final Transform transform;

  /**
   * Default ctor.
   * @param min_args The minimum argument count including the series.
   * @param max_args The maximum argument count including the series.
   * @param namer The output namer.
   * @param transform The value transform.
   */
  public PointTransformFunction(final int min_args,
                                final int max_args,
                                final Namer namer,
                                final Transform transform) {
    this.min_args = min_args;
    this.max_args = max_args;
    this.namer = namer;
    this.transform = transform;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    args.requireCount(min_args, max_args);
    final List<NormalizedSeries> inputs = args.seriesList(0);
    final List<NormalizedSeries> results = Lists.newArrayListWithCapacity(inputs.size());
    for (final NormalizedSeries series : inputs) {
      final List<Double> values = Lists.newArrayListWithCapacity(series.size());
      for (final Double value : series.values()) {
        values.add(transform.apply(value, series, args));
      }
      final String name = namer.name(series, args);
      results.add(NormalizedSeries.newBuilder(series)
          .setName(name)
          .setPathExpression(name)
          .setValues(values)
          .build());
    }
    return results;
  }

  /**
   * A namer rendering {@code function(name,arg2,...)} from the literal
   * arguments given.
   * @param function The function name.
   * @return The namer.
   */
  public static Namer callNamer(final String function) {
    return (series, args) -> {
      final Object[] rendered = new Object[args.size()];
      rendered[0] = series.name();
      for (int i = 1; i < args.size(); i++) {
        final Object value = args.value(i);
        rendered[i] = value instanceof Number
            ? SeriesNames.number(((Number) value).doubleValue())
            : value instanceof String ? "\"" + value + "\"" : value;
      }
      return SeriesNames.call(function, rendered);
    };
  }
}
