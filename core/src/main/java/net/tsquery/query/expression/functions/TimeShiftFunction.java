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
import net.tsquery.data.TimeInfo;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;
import net.tsquery.utils.DateTime;

/**
 * {@code timeShift(series, "7d"[, resetEnd])}: evaluates the input over
 * the window moved by the offset and moves the result back onto the
 * request window. An unsigned offset points into the past. With
 * {@code resetEnd}, the default, points past the request end are
 * dropped.
 *
 * @since 3.0
 */
public class TimeShiftFunction implements SeriesFunction {

  @Override
  public boolean evaluatesOwnArguments() {
    return true;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    args.requireCount(2, 3);
    final String shift = args.string(1);
    final boolean reset_end = args.bool(2, true);
    final long offset = DateTime.parseOffsetSeconds(shift);
    final String display = Character.isDigit(shift.charAt(0))
        ? "-" + shift : shift;

    final List<NormalizedSeries> shifted =
        args.evaluateSeriesList(0, context.shifted(offset));
    final List<NormalizedSeries> results = Lists.newArrayListWithCapacity(shifted.size());
    for (final NormalizedSeries series : shifted) {
      final TimeInfo time_info = series.timeInfo();
      final long start = time_info.start() - offset;
      long end = time_info.end() - offset;
      List<Double> values = series.values();
      if (reset_end && end > context.end()) {
        end = Math.max(start, context.end());
        values = values.subList(0,
            TimeInfo.pointCount(start, end, time_info.step()));
      }
      final String name = SeriesNames.call("timeShift", series.name(),
          "\"" + display + "\"");
      results.add(NormalizedSeries.newBuilder(series)
          .setName(name)
          .setPathExpression(name)
          .setTimeInfo(new TimeInfo(start, end, time_info.step()))
          .setValues(values)
          .build());
    }
    return results;
  }
}
