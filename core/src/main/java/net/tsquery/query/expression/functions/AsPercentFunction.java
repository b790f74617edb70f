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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.exceptions.EvaluationException;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;
import net.tsquery.query.processor.align.SeriesAligner;

/**
 * {@code asPercent(series[, total])}: each value as a percentage of the
 * total. The total is a single series, a number or, when absent, the sum
 * of the input series at each position.
 *
 * @since 3.0
 */
public class AsPercentFunction implements SeriesFunction {

  private final SeriesAligner aligner;

  public AsPercentFunction(final SeriesAligner aligner) {
    this.aligner = aligner;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    args.requireCount(1, 2);
    final List<NormalizedSeries> inputs = args.seriesList(0);
    if (inputs.isEmpty()) {
      return ImmutableList.of();
    }

    final List<NormalizedSeries> series;
    final List<Double> totals;
    final String total_name;
    final Object total = args.size() > 1 ? args.value(1) : null;
    if (total == null) {
      series = aligner.align(inputs);
      final NormalizedSeries sum = CombineSeriesFunction.combine(
          Combiner.SUM, series, "sum");
      totals = sum.values();
      total_name = null;
    } else if (total instanceof List) {
      final List<NormalizedSeries> total_series = args.seriesList(1);
      if (total_series.size() != 1) {
        throw new EvaluationException(args.function(), "total must reference "
            + "exactly one series but found " + total_series.size());
      }
      final List<NormalizedSeries> all = Lists.newArrayList(inputs);
      all.add(total_series.get(0));
      final List<NormalizedSeries> aligned = aligner.align(all);
      series = aligned.subList(0, aligned.size() - 1);
      totals = aligned.get(aligned.size() - 1).values();
      total_name = aligned.get(aligned.size() - 1).name();
    } else {
      final double number = args.number(1);
      return percentOf(inputs, number, SeriesNames.number(number));
    }

    final List<NormalizedSeries> results = Lists.newArrayListWithCapacity(series.size());
    for (final NormalizedSeries s : series) {
      final List<Double> values = Lists.newArrayListWithCapacity(s.size());
      for (int i = 0; i < s.size(); i++) {
        values.add(percent(s.value(i), totals.get(i)));
      }
      results.add(build(s, values,
          total_name == null ? s.pathExpression() : total_name));
    }
    return results;
  }

  private static List<NormalizedSeries> percentOf(final List<NormalizedSeries> series,
                                                  final double total,
                                                  final String total_name) {
    final List<NormalizedSeries> results = Lists.newArrayListWithCapacity(series.size());
    for (final NormalizedSeries s : series) {
      final List<Double> values = Lists.newArrayListWithCapacity(s.size());
      for (int i = 0; i < s.size(); i++) {
        values.add(percent(s.value(i), total));
      }
      results.add(build(s, values, total_name));
    }
    return results;
  }

  private static NormalizedSeries build(final NormalizedSeries series,
                                        final List<Double> values,
                                        final String total_name) {
    final String name = SeriesNames.call("asPercent", series.name(), total_name);
    return NormalizedSeries.newBuilder(series)
        .setName(name)
        .setPathExpression(name)
        .setValues(values)
        .build();
  }

  private static Double percent(final Double value, final Double total) {
    final Double ratio = DivideSeriesFunction.divide(value, total);
    return ratio == null ? null : ratio * 100.0;
  }
}
