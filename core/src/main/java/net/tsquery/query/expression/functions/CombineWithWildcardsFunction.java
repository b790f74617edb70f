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
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.FunctionArguments;
import net.tsquery.query.expression.SeriesFunction;
import net.tsquery.query.processor.align.SeriesAligner;

/**
 * {@code sumSeriesWithWildcards(series, position...)}: drops the given
 * node positions from each series name and combines the series sharing
 * the remaining name. Groups are emitted in first seen order and named
 * after the remaining nodes.
 *
 * @since 3.0
 */
public class CombineWithWildcardsFunction implements SeriesFunction {

  private final Combiner combiner;
  private final SeriesAligner aligner;

  public CombineWithWildcardsFunction(final Combiner combiner,
                                      final SeriesAligner aligner) {
    this.combiner = combiner;
    this.aligner = aligner;
  }

  @Override
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context) {
    args.requireCount(1, -1);
    final List<NormalizedSeries> inputs = args.seriesList(0);
    final Set<Integer> positions = Sets.newHashSet(args.integers(1));

    final Map<String, List<NormalizedSeries>> groups = Maps.newLinkedHashMap();
    for (final NormalizedSeries series : inputs) {
      final List<String> nodes = SeriesNames.nodes(series.name());
      final List<String> kept = Lists.newArrayListWithCapacity(nodes.size());
      for (int i = 0; i < nodes.size(); i++) {
        if (!positions.contains(i)) {
          kept.add(nodes.get(i));
        }
      }
      groups.computeIfAbsent(Joiner.on('.').join(kept),
          k -> Lists.newArrayList()).add(series);
    }
    return combineGroups(combiner, aligner, groups);
  }

  /**
   * Combines each group into one series named by its key.
   * @param combiner The reduction.
   * @param aligner The aligner.
   * @param groups The groups in output order.
   * @return One series per group.
   */
  static List<NormalizedSeries> combineGroups(final Combiner combiner,
                                              final SeriesAligner aligner,
                                              final Map<String, List<NormalizedSeries>> groups) {
    final List<NormalizedSeries> results = Lists.newArrayListWithCapacity(groups.size());
    for (final Map.Entry<String, List<NormalizedSeries>> entry : groups.entrySet()) {
      final NormalizedSeries combined = CombineSeriesFunction.combine(combiner,
          aligner.align(entry.getValue()), entry.getKey());
      results.add(combined);
    }
    return results;
  }
}
