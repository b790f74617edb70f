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
package net.tsquery.storage;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsquery.data.FetchResult;
import net.tsquery.data.Interval;
import net.tsquery.data.IntervalSet;
import net.tsquery.data.TimeInfo;
import net.tsquery.exceptions.BackendUnavailableException;

/**
 * A merged view over the readers of several finders that each returned a
 * leaf for the same path. Leaves are kept in finder declaration order.
 * <p>
 * A fetch first looks for a single reader whose intervals cover the whole
 * window, taking the first in declaration order. Otherwise every reader
 * with data in the window (or every reader if none reports any) is
 * fetched and the results are merged onto the finest step, from the
 * earliest start to the latest end. Each point takes the first non-gap
 * value in declaration order. Failing readers are logged and skipped, if
 * all fail the fetch throws.
 *
 * @since 3.0
 */
public class CompositeReader implements Reader {
  private static final Logger LOG = LoggerFactory.getLogger(CompositeReader.class);

  /** The path served. */
  private final String path;

  /** The source leaves in declaration order. */
  private final List<LeafNode> leaves;

  /**
   * Default ctor.
   * @param path A non-null path.
   * @param leaves Two or more leaves, sorted by finder declaration order.
   * @throws IllegalArgumentException if fewer than two leaves were given.
   */
  public CompositeReader(final String path, final List<LeafNode> leaves) {
    if (leaves == null || leaves.size() < 2) {
      throw new IllegalArgumentException("A composite reader requires at "
          + "least two leaves for " + path);
    }
    this.path = path;
    this.leaves = ImmutableList.copyOf(leaves);
  }

  /** @return The source leaves in declaration order. */
  public List<LeafNode> leaves() {
    return leaves;
  }

  @Override
  public FetchResult fetch(final long start, final long end) {
    return fetch(start, end, 0);
  }

  @Override
  public FetchResult fetch(final long start,
                           final long end,
                           final int max_points) {
    final Interval window = new Interval(start, end);
    final List<LeafNode> candidates = Lists.newArrayList();
    LeafNode covering = null;
    for (final LeafNode leaf : leaves) {
      final IntervalSet intervals = intervals(leaf);
      if (intervals == null) {
        continue;
      }
      if (covering == null && intervals.covers(window)) {
        covering = leaf;
      }
      if (intervals.overlaps(window)) {
        candidates.add(leaf);
      }
    }

    Exception last_error = null;
    if (covering != null) {
      try {
        final FetchResult result = fetch(covering, start, end, max_points);
        if (isValid(result)) {
          if (LOG.isTraceEnabled()) {
            LOG.trace("Served " + path + " from " + sourceId(covering));
          }
          return result;
        }
        LOG.warn("Invalid response from " + sourceId(covering) + " for "
            + path + ", falling back to a merge.");
      } catch (Exception e) {
        LOG.warn("Failed to fetch " + path + " from " + sourceId(covering)
            + ", falling back to a merge.", e);
        last_error = e;
      }
      candidates.remove(covering);
    }
    if (candidates.isEmpty() && covering == null) {
      candidates.addAll(leaves);
    }

    final List<FetchResult> results = Lists.newArrayList();
    for (final LeafNode leaf : candidates) {
      try {
        final FetchResult result = fetch(leaf, start, end, max_points);
        if (isValid(result)) {
          results.add(result);
        } else if (result != null && result.timeInfo() != null) {
          LOG.warn("Dropping invalid response from " + sourceId(leaf)
              + " for " + path);
        }
      } catch (Exception e) {
        LOG.warn("Failed to fetch " + path + " from " + sourceId(leaf), e);
        last_error = e;
      }
    }
    if (results.isEmpty()) {
      if (last_error != null) {
        throw new BackendUnavailableException(null, path,
            "Every reader failed for " + path, last_error);
      }
      return new FetchResult(null, null);
    }
    if (results.size() == 1) {
      return results.get(0);
    }
    return merge(results);
  }

  @Override
  public IntervalSet getIntervals() {
    IntervalSet union = IntervalSet.EMPTY;
    for (final LeafNode leaf : leaves) {
      final IntervalSet intervals = intervals(leaf);
      if (intervals != null) {
        union = union.union(intervals);
      }
    }
    return union;
  }

  @Override
  public String toString() {
    return "CompositeReader{path=" + path + ", leaves=" + leaves.size() + "}";
  }

  /**
   * Merges valid results in declaration order.
   * @param results Two or more valid results.
   * @return The merged result.
   */
  static FetchResult merge(final List<FetchResult> results) {
    long step = Long.MAX_VALUE;
    long start = Long.MAX_VALUE;
    long end = Long.MIN_VALUE;
    for (final FetchResult result : results) {
      step = Math.min(step, result.timeInfo().step());
      start = Math.min(start, result.timeInfo().start());
      end = Math.max(end, result.timeInfo().end());
    }
    final TimeInfo time_info = new TimeInfo(start, end, step);
    final Double[] values = new Double[time_info.pointCount()];
    for (int i = 0; i < values.length; i++) {
      final long ts = time_info.timestamp(i);
      for (final FetchResult result : results) {
        final int idx = result.timeInfo().indexOf(ts);
        if (idx >= 0 && idx < result.values().size()
            && result.values().get(idx) != null) {
          values[i] = result.values().get(idx);
          break;
        }
      }
    }
    return new FetchResult(time_info, Arrays.asList(values));
  }

  private FetchResult fetch(final LeafNode leaf,
                            final long start,
                            final long end,
                            final int max_points) {
    if (max_points > 0 && leaf.source() != null
        && leaf.source().isAggregating()) {
      return leaf.reader().fetch(start, end, max_points);
    }
    return leaf.reader().fetch(start, end);
  }

  private IntervalSet intervals(final LeafNode leaf) {
    try {
      final IntervalSet intervals = leaf.reader().getIntervals();
      return intervals == null ? IntervalSet.EMPTY : intervals;
    } catch (Exception e) {
      LOG.warn("Failed to read intervals for " + path + " from "
          + sourceId(leaf), e);
      return null;
    }
  }

  private static boolean isValid(final FetchResult result) {
    return result != null
        && result.timeInfo() != null
        && result.values() != null
        && result.values().size() == result.timeInfo().pointCount();
  }

  private static String sourceId(final LeafNode leaf) {
    return leaf.source() == null ? "unknown" : leaf.source().id();
  }
}
