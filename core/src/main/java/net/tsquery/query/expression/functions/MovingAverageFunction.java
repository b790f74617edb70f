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
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.data.TimeInfo;
import net.tsquery.exceptions.EvaluationException;
import net.tsquery.query.QueryWindow;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;
import net.tsquery.utils.DateTime;

/**
 * {@code movingAverage(series, window)}: the average of the points
 * preceding each position. The window is a point count or a duration
 * string such as {@code "5min"}. The input is evaluated a second time
 * over a window extended backwards so the first positions have data.
 *
 * @since 3.0
 */
public class MovingAverageFunction implements SeriesFunction {

  @Override
  public boolean evaluatesOwnArguments() {
    return true;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    args.requireCount(2, 2);
    final Object size = args.value(1);
    final boolean is_duration = size instanceof String;
    final long window_seconds;
    final int window_points;
    final List<NormalizedSeries> inputs = args.evaluateSeriesList(0, context);
    if (inputs.isEmpty()) {
      return ImmutableList.of();
    }
    if (is_duration) {
      window_seconds = DateTime.parseDurationSeconds((String) size);
      window_points = 0;
    } else {
      window_points = args.integer(1);
      if (window_points <= 0) {
        throw new EvaluationException(args.function(),
            "window must be greater than zero: " + window_points);
      }
      long max_step = 0;
      for (final NormalizedSeries series : inputs) {
        max_step = Math.max(max_step, series.timeInfo().step());
      }
      window_seconds = max_step * window_points;
    }

    final QueryWindow extended = new QueryWindow(
        context.start() - window_seconds, context.end(), context.maxPoints());
    final Map<String, NormalizedSeries> bootstraps = Maps.newHashMap();
    for (final NormalizedSeries series :
        args.evaluateSeriesList(0, context.withWindow(extended))) {
      bootstraps.put(series.name(), series);
    }

    final List<NormalizedSeries> results = Lists.newArrayListWithCapacity(inputs.size());
    for (final NormalizedSeries series : inputs) {
      final TimeInfo time_info = series.timeInfo();
      final int points = is_duration
          ? (int) (window_seconds / time_info.step()) : window_points;

      NormalizedSeries bootstrap = bootstraps.get(series.name());
      int offset = bootstrap == null ? -1
          : bootstrap.timeInfo().indexOf(time_info.start());
      if (bootstrap == null || offset < 0
          || bootstrap.timeInfo().step() != time_info.step()
          || bootstrap.timeInfo().timestamp(offset) != time_info.start()) {
        bootstrap = series;
        offset = 0;
      }

      final List<Double> values = Lists.newArrayListWithCapacity(series.size());
      for (int i = 0; i < series.size(); i++) {
        final int to = Math.min(bootstrap.size(), i + offset);
        final int from = Math.max(0, to - points);
        values.add(SeriesStats.average(bootstrap.values().subList(from, to)));
      }
      final String name = SeriesNames.call("movingAverage", series.name(),
          is_duration ? "\"" + size + "\"" : Integer.toString(window_points));
      results.add(NormalizedSeries.newBuilder(series)
          .setName(name)
          .setPathExpression(name)
          .setValues(values)
          .build());
    }
    return results;
  }
}
