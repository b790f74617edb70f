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

import net.tsquery.data.ConsolidationFunction;
import net.tsquery.data.NormalizedSeries;
import net.tsquery.data.TimeInfo;
import net.tsquery.exceptions.EvaluationException;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;
import net.tsquery.utils.DateTime;

/**
 * {@code summarize(series, "1h"[, func[, alignToFrom]])}: reduces each
 * series into buckets of the interval with the given function, sum by
 * default. Buckets are aligned to multiples of the interval unless
 * {@code alignToFrom} is true, in which case they start at the series
 * start.
 *
 * @since 3.0
 */
public class SummarizeFunction implements SeriesFunction {

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    args.requireCount(2, 4);
    final String interval_string = args.string(1);
    final long interval = DateTime.parseDurationSeconds(interval_string);
    final String func = args.string(2, "sum");
    final boolean align_to_from = args.bool(3, false);
    final ConsolidationFunction function;
    try {
      function = ConsolidationFunction.fromString(func);
    } catch (IllegalArgumentException e) {
      throw new EvaluationException(args.function(),
          "unknown summary function: " + func, e);
    }

    final List<NormalizedSeries> inputs = args.seriesList(0);
    final List<NormalizedSeries> results = Lists.newArrayListWithCapacity(inputs.size());
    for (final NormalizedSeries series : inputs) {
      final TimeInfo source = series.timeInfo();
      final long start;
      final long end;
      if (align_to_from) {
        start = source.start();
        end = source.end();
      } else {
        start = Math.floorDiv(source.start(), interval) * interval;
        end = -Math.floorDiv(-source.end(), interval) * interval;
      }
      final TimeInfo time_info = new TimeInfo(start, end, interval);
      final List<List<Double>> buckets = Lists.newArrayListWithCapacity(
          time_info.pointCount());
      for (int i = 0; i < time_info.pointCount(); i++) {
        buckets.add(Lists.<Double>newArrayList());
      }
      for (int i = 0; i < series.size(); i++) {
        final int bucket = time_info.indexOf(source.timestamp(i));
        if (series.value(i) != null && bucket >= 0 && bucket < buckets.size()) {
          buckets.get(bucket).add(series.value(i));
        }
      }
      final List<Double> values = Lists.newArrayListWithCapacity(buckets.size());
      for (final List<Double> bucket : buckets) {
        values.add(bucket.isEmpty() ? null : function.reduce(bucket));
      }

      final String name = align_to_from
          ? SeriesNames.call("summarize", series.name(),
              "\"" + interval_string + "\"", "\"" + func + "\"", "true")
          : SeriesNames.call("summarize", series.name(),
              "\"" + interval_string + "\"", "\"" + func + "\"");
      results.add(NormalizedSeries.newBuilder(series)
          .setName(name)
          .setPathExpression(name)
          .setTimeInfo(time_info)
          .setValues(values)
          .build());
    }
    return results;
  }
}
