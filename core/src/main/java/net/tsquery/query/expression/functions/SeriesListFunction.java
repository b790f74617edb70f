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
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.exceptions.EvaluationException;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;

/**
 * Functions that reorder or drop whole series without touching values.
 *
 * @since 3.0
 */
public class SeriesListFunction implements SeriesFunction {

  public enum Operation {
    /** {@code limit(series, n)}: the first N. */
    LIMIT,
    /** {@code exclude(series, "regex")}: drops names matching the regex. */
    EXCLUDE,
    /** {@code grep(series, "regex")}: keeps names matching the regex. */
    GREP,
    /** {@code removeEmptySeries(series)}: drops all-gap series. */
    REMOVE_EMPTY,
    /** {@code sortByName(series)} */
    SORT_BY_NAME,
    /** {@code sortByMaxima(series)}: ascending by max, gaps first. */
    SORT_BY_MAXIMA
  }

  private final Operation operation;

  public SeriesListFunction(final Operation operation) {
    this.operation = operation;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    final List<NormalizedSeries> inputs = args.seriesList(0);
    switch (operation) {
    case LIMIT:
      args.requireCount(2, 2);
      final int n = Math.max(0, Math.min(args.integer(1), inputs.size()));
      return ImmutableList.copyOf(inputs.subList(0, n));
    case EXCLUDE:
    case GREP:
      args.requireCount(2, 2);
      final Pattern pattern = compile(args);
      final boolean keep_matches = operation == Operation.GREP;
      final List<NormalizedSeries> kept = Lists.newArrayList();
      for (final NormalizedSeries series : inputs) {
        if (pattern.matcher(series.name()).find() == keep_matches) {
          kept.add(series);
        }
      }
      return kept;
    case REMOVE_EMPTY:
      args.requireCount(1, 1);
      final List<NormalizedSeries> non_empty = Lists.newArrayList();
      for (final NormalizedSeries series : inputs) {
        if (!series.isAllGaps()) {
          non_empty.add(series);
        }
      }
      return non_empty;
    case SORT_BY_NAME: {
      args.requireCount(1, 1);
      final List<NormalizedSeries> sorted = Lists.newArrayList(inputs);
      sorted.sort((a, b) -> a.name().compareTo(b.name()));
      return sorted;
    }
    case SORT_BY_MAXIMA: {
      args.requireCount(1, 1);
      final List<NormalizedSeries> sorted = Lists.newArrayList(inputs);
      sorted.sort((a, b) -> SeriesStats.compare(
          SeriesStats.max(a.values()), SeriesStats.max(b.values())));
      return sorted;
    }
    default:
      throw new IllegalStateException("Unhandled operation: " + operation);
    }
  }

  private static Pattern compile(final FunctionArguments args) {
    final String regex = args.string(1);
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new EvaluationException(args.function(),
          "invalid regular expression: " + regex, e);
    }
  }
}
