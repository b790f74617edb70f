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
package net.tsquery.query;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.data.RawSeries;
import net.tsquery.query.expression.SeriesSource;
import net.tsquery.query.fetch.FetchPlanner;
import net.tsquery.query.fetch.FetchResults;
import net.tsquery.query.processor.align.SeriesAligner;
import net.tsquery.query.processor.downsample.ConsolidationRules;
import net.tsquery.storage.FindQuery;
import net.tsquery.storage.FindResults;
import net.tsquery.storage.FinderFederation;
import net.tsquery.storage.LeafNode;

/**
 * Resolves path expressions through the finder federation, fetches every
 * resulting leaf in one plan and aligns the series of each expression.
 * Finder and fetch failures are recorded in the error list, a pattern
 * error or the failure of every finder is thrown.
 *
 * @since 3.0
 */
public class FederatedSeriesSource implements SeriesSource {
  private static final Logger LOG = LoggerFactory.getLogger(FederatedSeriesSource.class);

  private final FinderFederation federation;
  private final FetchPlanner planner;
  private final SeriesAligner aligner;
  private final ConsolidationRules rules;

  /**
   * Default ctor.
   * @param federation The non-null federation.
   * @param planner The non-null fetch planner.
   * @param aligner The non-null aligner.
   * @param rules The non-null consolidation rules.
   */
  public FederatedSeriesSource(final FinderFederation federation,
                               final FetchPlanner planner,
                               final SeriesAligner aligner,
                               final ConsolidationRules rules) {
    this.federation = federation;
    this.planner = planner;
    this.aligner = aligner;
    this.rules = rules;
  }

  @Override
  public Map<String, List<NormalizedSeries>> fetch(
      final Collection<String> path_expressions,
      final QueryWindow window,
      final long deadline_ns,
      final List<Exception> errors) {
    final Map<String, List<LeafNode>> resolved = Maps.newLinkedHashMap();
    final List<LeafNode> all = Lists.newArrayList();
    for (final String expression : path_expressions) {
      final FindResults found = federation.find(FindQuery.newBuilder()
          .setPattern(expression)
          .setStartTime(window.start())
          .setEndTime(window.end())
          .build(), deadline_ns);
      errors.addAll(found.errors());
      resolved.put(expression, found.leaves());
      all.addAll(found.leaves());
    }

    final Map<String, List<NormalizedSeries>> results = Maps.newLinkedHashMap();
    if (all.isEmpty()) {
      for (final String expression : path_expressions) {
        results.put(expression, Lists.<NormalizedSeries>newArrayList());
      }
      return results;
    }

    final FetchResults fetched = planner.fetch(all, window.start(),
        window.end(), window.maxPoints(), deadline_ns);
    errors.addAll(fetched.errors());
    for (final Map.Entry<String, List<LeafNode>> entry : resolved.entrySet()) {
      final List<NormalizedSeries> series =
          Lists.newArrayListWithCapacity(entry.getValue().size());
      for (final LeafNode leaf : entry.getValue()) {
        final RawSeries raw = fetched.get(leaf.path());
        if (raw != null) {
          series.add(NormalizedSeries.fromRaw(raw, entry.getKey(),
              rules.resolve(raw.path())));
        }
      }
      results.put(entry.getKey(), aligner.align(series));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Fetched " + all.size() + " leaves for "
          + path_expressions.size() + " expressions over " + window
          + " with " + errors.size() + " errors so far");
    }
    return results;
  }
}
