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

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.exceptions.EvaluationException;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;
import net.tsquery.query.processor.align.SeriesAligner;

/**
 * {@code groupByNode(series, node, callback)}: groups the series by the
 * node at the given position of their names and combines each group
 * with the named combine function, e.g. {@code "sumSeries"}.
 *
 * @since 3.0
 */
public class GroupByNodeFunction implements SeriesFunction {

  private final SeriesAligner aligner;

  public GroupByNodeFunction(final SeriesAligner aligner) {
    this.aligner = aligner;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    args.requireCount(3, 3);
    final List<NormalizedSeries> inputs = args.seriesList(0);
    final int node = args.integer(1);
    final String callback = args.string(2);
    final Combiner combiner = Combiner.fromFunction(callback);
    if (combiner == null) {
      throw new EvaluationException(args.function(), "callback must be a "
          + "combine function but was " + callback);
    }

    final Map<String, List<NormalizedSeries>> groups = Maps.newLinkedHashMap();
    for (final NormalizedSeries series : inputs) {
      final String key = SeriesNames.node(args.function(),
          SeriesNames.nodes(series.name()), node);
      groups.computeIfAbsent(key, k -> Lists.newArrayList()).add(series);
    }
    return CombineWithWildcardsFunction.combineGroups(combiner, aligner, groups);
  }
}
