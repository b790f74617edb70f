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
import net.tsquery.exceptions.EvaluationException;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;

/**
 * {@code consolidateBy(series, "max")}: changes the function used when
 * the series is later reduced to fewer points. Values are untouched.
 * Registered as {@code cumulative} with a fixed {@code sum}.
 *
 * @since 3.0
 */
public class ConsolidateByFunction implements SeriesFunction {

  /** A fixed function or null to read it from the second argument. */
  private final ConsolidationFunction fixed;

  /** Reads the function from the arguments. */
  public ConsolidateByFunction() {
    this(null);
  }

  /** @param fixed The function to always apply. */
  public ConsolidateByFunction(final ConsolidationFunction fixed) {
    this.fixed = fixed;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    final ConsolidationFunction function;
    if (fixed == null) {
      args.requireCount(2, 2);
      try {
        function = ConsolidationFunction.fromString(args.string(1));
      } catch (IllegalArgumentException e) {
        throw new EvaluationException(args.function(), e.getMessage(), e);
      }
    } else {
      args.requireCount(1, 1);
      function = fixed;
    }
    final List<NormalizedSeries> inputs = args.seriesList(0);
    final List<NormalizedSeries> results = Lists.newArrayListWithCapacity(inputs.size());
    for (final NormalizedSeries series : inputs) {
      final String name = SeriesNames.call("consolidateBy", series.name(),
          "\"" + function.id() + "\"");
      results.add(NormalizedSeries.newBuilder(series)
          .setName(name)
          .setPathExpression(name)
          .setConsolidationFunction(function)
          .build());
    }
    return results;
  }
}
