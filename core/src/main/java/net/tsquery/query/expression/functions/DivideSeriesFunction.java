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
 * {@code divideSeries(dividends, divisor)}: divides each dividend by the
 * single divisor series. A gap in either operand or a zero divisor yields
 * a gap.
 *
 * @since 3.0
 */
public class DivideSeriesFunction implements SeriesFunction {

  private final SeriesAligner aligner;

  public DivideSeriesFunction(final SeriesAligner aligner) {
    this.aligner = aligner;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    args.requireCount(2, 2);
    final List<NormalizedSeries> dividends = args.seriesList(0);
    final List<NormalizedSeries> divisors = args.seriesList(1);
    if (divisors.size() != 1) {
      throw new EvaluationException(args.function(), "divisor must reference "
          + "exactly one series but found " + divisors.size());
    }
    if (dividends.isEmpty()) {
      return ImmutableList.of();
    }
    final List<NormalizedSeries> all = Lists.newArrayList(dividends);
    all.add(divisors.get(0));
    final List<NormalizedSeries> aligned = aligner.align(all);
    final NormalizedSeries divisor = aligned.get(aligned.size() - 1);

    final List<NormalizedSeries> results = Lists.newArrayListWithCapacity(dividends.size());
    for (int i = 0; i < aligned.size() - 1; i++) {
      final NormalizedSeries dividend = aligned.get(i);
      final List<Double> values = Lists.newArrayListWithCapacity(dividend.size());
      for (int x = 0; x < dividend.size(); x++) {
        values.add(divide(dividend.value(x), divisor.value(x)));
      }
      final String name = SeriesNames.call("divideSeries", dividend.name(),
          divisor.name());
      results.add(NormalizedSeries.newBuilder(dividend)
          .setName(name)
          .setPathExpression(name)
          .setValues(values)
          .build());
    }
    return results;
  }

  /** @return The quotient or a gap for a gap operand or a zero divisor. */
  static Double divide(final Double dividend, final Double divisor) {
    if (dividend == null || divisor == null || divisor == 0) {
      return null;
    }
    return dividend / divisor;
  }
}
