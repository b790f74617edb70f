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

import net.tsquery.data.NormalizedSeries;
import net.tsquery.data.TimeInfo;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;

/**
 * {@code constantLine(value)}: a single point spanning the request
 * window. The window is read from the context.
 *
 * @since 3.0
 */
public class ConstantLineFunction implements SeriesFunction {

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    args.requireCount(1, 1);
    final double value = args.number(0);
    final long step = Math.max(1, context.end() - context.start());
    final String name = SeriesNames.number(value);
    return ImmutableList.of(NormalizedSeries.newBuilder()
        .setPath(name)
        .setName(name)
        .setPathExpression(SeriesNames.call("constantLine", name))
        .setTimeInfo(new TimeInfo(context.start(), context.start() + step, step))
        .setValues(ImmutableList.of(value))
        .build());
  }
}
