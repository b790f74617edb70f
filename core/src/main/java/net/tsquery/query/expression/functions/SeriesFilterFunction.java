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

import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;

/**
 * Selects series by a whole series statistic: the max, the average or
 * the last non-gap value. Either keeps the top or bottom N, e.g.
 * {@code highestMax(a.*, 5)}, or keeps every series compared to a
 * threshold, e.g. {@code averageAbove(a.*, 25)}. Series whose statistic
 * is a gap rank lowest and never pass a threshold.
 *
 * @since 3.0
 */
public class SeriesFilterFunction implements SeriesFunction {

  /** The statistic to rank or compare by. */
  public enum Statistic {
    MAX(series -> SeriesStats.max(series.values())),
    AVERAGE(series -> SeriesStats.average(series.values())),
    CURRENT(series -> SeriesStats.last(series.values()));

    private final Function<NormalizedSeries, Double> extractor;

    Statistic(final Function<NormalizedSeries, Double> extractor) {
      this.extractor = extractor;
    }

    public Double of(final NormalizedSeries series) {
      return extractor.apply(series);
    }
  }

  /** How to select. */
  public enum Selection {
    /** The N highest, highest first. */
    HIGHEST,
    /** The N lowest, lowest first. */
    LOWEST,
    /** Greater than or equal to the threshold, strictly greater for max. */
    ABOVE,
    /** Less than or equal to the threshold. */
    BELOW
  }

  private final Statistic statistic;
  private final Selection selection;

  public SeriesFilterFunction(final Statistic statistic,
                              final Selection selection) {
    this.statistic = statistic;
    this.selection = selection;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    final List<NormalizedSeries> inputs = args.seriesList(0);
    final Comparator<NormalizedSeries> ascending =
        (a, b) -> SeriesStats.compare(statistic.of(a), statistic.of(b));
    switch (selection) {
    case HIGHEST: {
      args.requireCount(1, 2);
      final int n = args.integer(1, 1);
      final List<NormalizedSeries> sorted = Lists.newArrayList(inputs);
      sorted.sort(ascending.reversed());
      return ImmutableList.copyOf(sorted.subList(0, clamp(n, sorted.size())));
    }
    case LOWEST: {
      args.requireCount(1, 2);
      final int n = args.integer(1, 1);
      final List<NormalizedSeries> sorted = Lists.newArrayList(inputs);
      sorted.sort(ascending);
      return ImmutableList.copyOf(sorted.subList(0, clamp(n, sorted.size())));
    }
    default:
      args.requireCount(2, 2);
      final double threshold = args.number(1);
      final List<NormalizedSeries> kept = Lists.newArrayList();
      for (final NormalizedSeries series : inputs) {
        final Double value = statistic.of(series);
        if (value == null) {
          continue;
        }
        final boolean pass;
        if (selection == Selection.ABOVE) {
          pass = statistic == Statistic.MAX ? value > threshold
              : value >= threshold;
        } else {
          pass = value <= threshold;
        }
        if (pass) {
          kept.add(series);
        }
      }
      return kept;
    }
  }

  private static int clamp(final int n, final int size) {
    return Math.max(0, Math.min(n, size));
  }
}
