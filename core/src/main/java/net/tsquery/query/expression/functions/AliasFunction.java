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

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.exceptions.EvaluationException;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;

/**
 * Functions that only change the display name of each series. The path
 * expression is kept so combining functions still name their output
 * after the original expressions.
 *
 * @since 3.0
 */
public class AliasFunction implements SeriesFunction {

  public enum Mode {
    /** {@code alias(series, "name")} */
    ALIAS,
    /** {@code aliasByNode(series, 1, 3)}, negative nodes count from the end. */
    BY_NODE,
    /** {@code aliasByMetric(series)}, the last node. */
    BY_METRIC,
    /** {@code aliasSub(series, "regex", "replacement")} */
    SUB
  }

  private final Mode mode;

  public AliasFunction(final Mode mode) {
    this.mode = mode;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    Pattern search = null;
    String replacement = null;
    switch (mode) {
    case ALIAS:
      args.requireCount(2, 2);
      args.string(1);
      break;
    case BY_NODE:
      args.requireCount(2, -1);
      args.integers(1);
      break;
    case BY_METRIC:
      args.requireCount(1, 1);
      break;
    case SUB:
      args.requireCount(3, 3);
      try {
        search = Pattern.compile(args.string(1));
      } catch (PatternSyntaxException e) {
        throw new EvaluationException(args.function(),
            "invalid regular expression: " + args.string(1), e);
      }
      // Back references are written \1 as well as $1.
      replacement = args.string(2).replaceAll("\\\\(\\d)", "\\$$1");
      break;
    default:
      throw new IllegalStateException("Unhandled mode: " + mode);
    }

    final List<NormalizedSeries> inputs = args.seriesList(0);
    final List<NormalizedSeries> results = Lists.newArrayListWithCapacity(inputs.size());
    for (final NormalizedSeries series : inputs) {
      final String name;
      switch (mode) {
      case ALIAS:
        name = args.string(1);
        break;
      case BY_NODE:
        final List<String> nodes = SeriesNames.nodes(series.name());
        final List<String> picked = Lists.newArrayList();
        for (final int node : args.integers(1)) {
          picked.add(SeriesNames.node(args.function(), nodes, node));
        }
        name = Joiner.on('.').join(picked);
        break;
      case BY_METRIC:
        final List<String> segments = SeriesNames.nodes(series.name());
        name = segments.get(segments.size() - 1);
        break;
      default:
        name = search.matcher(series.name()).replaceAll(replacement);
      }
      results.add(NormalizedSeries.newBuilder(series)
          .setName(name)
          .build());
    }
    return results;
  }
}
