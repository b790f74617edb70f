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
import net.tsquery.data.TimeInfo;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;
import net.tsquery.query.processor.align.SeriesAligner;

/**
 * Combines every series of every argument into one series on the common
 * grid, e.g. {@code sumSeries(a.*, b.c)}.
 *
 * @since 3.0
 */
public class CombineSeriesFunction implements SeriesFunction {

  private final Combiner combiner;
  private final SeriesAligner aligner;

  /**
   * Default ctor.
   * @param combiner The per position reduction.
   * @param aligner The aligner for the inputs.
   */
  public CombineSeriesFunction(final Combiner combiner,
                               final SeriesAligner aligner) {
    this.combiner = combiner;
    this.aligner = aligner;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    args.requireCount(1, -1);
    final List<NormalizedSeries> inputs = args.seriesLists(0);
    if (inputs.isEmpty()) {
      return ImmutableList.of();
    }
    final String name = SeriesNames.call(combiner.function(),
        SeriesNames.pathExpressions(inputs));
    return ImmutableList.of(combine(combiner, aligner.align(inputs), name));
  }

  /**
   * Combines series that are already aligned.
   * @param combiner The reduction.
   * @param aligned A non-empty list of series sharing one grid.
   * @param name The output name, also used as its path and expression.
   * @return The combined series.
   */
  public static NormalizedSeries combine(final Combiner combiner,
                                         final List<NormalizedSeries> aligned,
                                         final String name) {
    final TimeInfo time_info = aligned.get(0).timeInfo();
    final int points = time_info.pointCount();
    final List<Double> values = Lists.newArrayListWithCapacity(points);
    final List<Double> row = Lists.newArrayListWithCapacity(aligned.size());
    for (int i = 0; i < points; i++) {
      row.clear();
      for (final NormalizedSeries series : aligned) {
        row.add(series.value(i));
      }
      values.add(combiner.combine(row));
    }
    return NormalizedSeries.newBuilder()
        .setPath(name)
        .setName(name)
        .setPathExpression(name)
        .setTimeInfo(time_info)
        .setValues(values)
        .setConsolidationFunction(aligned.get(0).consolidationFunction())
        .build();
  }
}
