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
package net.tsquery.query.fetch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Deferred;

import net.tsquery.data.FetchResult;
import net.tsquery.data.MultiFetchResult;
import net.tsquery.data.RawSeries;
import net.tsquery.data.TimeInfo;
import net.tsquery.exceptions.BackendUnavailableException;
import net.tsquery.exceptions.ProtocolViolationException;
import net.tsquery.storage.FinderDescriptor;
import net.tsquery.storage.LeafNode;
import net.tsquery.storage.MultiFetchFinder;
import net.tsquery.threadpools.BackendExecutor;
import net.tsquery.utils.Deferreds;

/**
 * Retrieves one {@link RawSeries} per leaf. Leaves from a multi-fetch
 * finder that share a batching tag are fetched with one call, all other
 * leaves individually. Every group runs on the {@link BackendExecutor} so
 * different backends are fetched concurrently.
 * <p>
 * The planner enforces the gap contract: a response whose value count
 * does not match its time info is a protocol violation and the series
 * becomes all gaps. A failed or timed out fetch also yields all gaps and
 * an error, never failing the sibling fetches. A backend returning no
 * data yields all gaps without an error.
 *
 * @since 3.0
 */
public class FetchPlanner {
  private static final Logger LOG = LoggerFactory.getLogger(FetchPlanner.class);

  /** The pool. */
  private final BackendExecutor executor;

  /** The step for gap series when the backend reported none. */
  private final long default_step;

  /**
   * Default ctor.
   * @param executor A non-null executor.
   * @param default_step The step for all-gap series, greater than 0.
   */
  public FetchPlanner(final BackendExecutor executor, final long default_step) {
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null.");
    }
    if (default_step <= 0) {
      throw new IllegalArgumentException("Default step must be greater "
          + "than zero: " + default_step);
    }
    this.executor = executor;
    this.default_step = default_step;
  }

  /**
   * Fetches the leaves.
   * @param leaves The non-null leaves. Duplicate paths are fetched once.
   * @param start The inclusive start in seconds.
   * @param end The exclusive end in seconds.
   * @param max_points The target point count forwarded to aggregating
   * backends, 0 for none.
   * @param deadline_ns The request deadline from {@link System#nanoTime()}.
   * @return A series for every leaf.
   */
  public FetchResults fetch(final List<LeafNode> leaves,
                            final long start,
                            final long end,
                            final int max_points,
                            final long deadline_ns) {
    if (start >= end) {
      throw new IllegalArgumentException("Start " + start
          + " must be before the end " + end);
    }
    final List<FetchGroup> groups = plan(leaves);
    final List<Deferred<Map<String, RawSeries>>> deferreds =
        Lists.newArrayListWithCapacity(groups.size());
    final List<Exception> errors = Lists.newArrayList();
    for (final FetchGroup group : groups) {
      deferreds.add(executor.submit(
          new GroupTask(group, start, end, max_points, errors)));
    }

    final Map<String, RawSeries> series = new LinkedHashMap<String, RawSeries>();
    final Map<String, RawSeries> fetched = Maps.newHashMap();
    for (int i = 0; i < groups.size(); i++) {
      final FetchGroup group = groups.get(i);
      try {
        fetched.putAll(Deferreds.joinWithin(deferreds.get(i), deadline_ns));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new BackendUnavailableException(id(group.leaves().get(0)),
            "Interrupted while fetching " + group, e);
      } catch (Exception e) {
        // the task itself never throws so this is a timeout
        for (final LeafNode leaf : group.leaves()) {
          final String msg = "Fetch of " + leaf.path() + " from " + id(leaf)
              + (Deferreds.isTimeout(e) ? " timed out" : " failed");
          LOG.warn(msg);
          addError(errors, new BackendUnavailableException(id(leaf),
              leaf.path(), msg, e));
          fetched.put(leaf.path(), gaps(leaf.path(), start, end, default_step));
        }
      }
    }
    for (final LeafNode leaf : leaves) {
      series.put(leaf.path(), fetched.get(leaf.path()));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Fetched " + series.size() + " series in " + groups.size()
          + " groups with " + errors.size() + " errors");
    }
    synchronized (errors) {
      return new FetchResults(series, errors);
    }
  }

  /**
   * Groups leaves by finder and batching tag. Groups are ordered by their
   * first leaf.
   * @param leaves The leaves.
   * @return The non-null list of groups.
   */
  @VisibleForTesting
  List<FetchGroup> plan(final List<LeafNode> leaves) {
    final Map<String, List<LeafNode>> batches = new LinkedHashMap<String, List<LeafNode>>();
    final Map<String, FinderDescriptor> batch_finders = Maps.newHashMap();
    final Map<String, Boolean> seen = Maps.newHashMap();
    for (final LeafNode leaf : leaves) {
      if (seen.put(leaf.path(), Boolean.TRUE) != null) {
        continue;
      }
      final FinderDescriptor source = leaf.source();
      final String key;
      if (source != null && source.batchingTag() != null
          && source.isMultiFetch()) {
        key = "batch:" + source.id() + ":" + source.batchingTag();
        batch_finders.put(key, source);
      } else {
        key = "leaf:" + leaf.path();
      }
      List<LeafNode> batch = batches.get(key);
      if (batch == null) {
        batch = Lists.newArrayList();
        batches.put(key, batch);
      }
      batch.add(leaf);
    }

    final List<FetchGroup> groups = Lists.newArrayListWithCapacity(batches.size());
    for (final Map.Entry<String, List<LeafNode>> entry : batches.entrySet()) {
      if (entry.getValue().size() > 1) {
        groups.add(new FetchGroup(batch_finders.get(entry.getKey()),
            entry.getValue()));
      } else {
        groups.add(new FetchGroup(null, entry.getValue()));
      }
    }
    return groups;
  }

  /**
   * Fetches one group, converting every failure to gaps and an error.
   */
  class GroupTask implements Callable<Map<String, RawSeries>> {
    private final FetchGroup group;
    private final long start;
    private final long end;
    private final int max_points;
    private final List<Exception> errors;

    GroupTask(final FetchGroup group,
              final long start,
              final long end,
              final int max_points,
              final List<Exception> errors) {
      this.group = group;
      this.start = start;
      this.end = end;
      this.max_points = max_points;
      this.errors = errors;
    }

    @Override
    public Map<String, RawSeries> call() {
      final Map<String, RawSeries> results = Maps.newHashMap();
      if (group.isBatched()) {
        fetchBatch(results);
      } else {
        final LeafNode leaf = group.leaves().get(0);
        try {
          final FetchResult result = shouldPushDown(leaf.source())
              ? leaf.reader().fetch(start, end, max_points)
              : leaf.reader().fetch(start, end);
          results.put(leaf.path(), validate(leaf, result == null ? null
              : result.timeInfo(), result == null ? null : result.values()));
        } catch (Exception e) {
          failed(leaf, e, results);
        }
      }
      return results;
    }

    private void fetchBatch(final Map<String, RawSeries> results) {
      final FinderDescriptor finder = group.finder();
      final MultiFetchResult result;
      try {
        result = ((MultiFetchFinder) finder.finder()).fetchMulti(
            group.leaves(), start, end,
            finder.isAggregating() ? max_points : 0);
      } catch (Exception e) {
        for (final LeafNode leaf : group.leaves()) {
          failed(leaf, e, results);
        }
        return;
      }
      if (LOG.isTraceEnabled()) {
        LOG.trace("Multi-fetched " + group.leaves().size() + " leaves from "
            + finder.id());
      }
      for (final LeafNode leaf : group.leaves()) {
        results.put(leaf.path(), validate(leaf,
            result == null ? null : result.timeInfo(),
            result == null ? null : result.values().get(leaf.path())));
      }
    }

    private RawSeries validate(final LeafNode leaf,
                               final TimeInfo time_info,
                               final List<Double> values) {
      if (time_info == null) {
        if (LOG.isTraceEnabled()) {
          LOG.trace("No data for " + leaf.path() + " from " + id(leaf));
        }
        return gaps(leaf.path(), start, end, default_step);
      }
      if (values == null) {
        return RawSeries.allGaps(leaf.path(), time_info);
      }
      if (values.size() != time_info.pointCount()) {
        final ProtocolViolationException e = new ProtocolViolationException(
            leaf.path(), time_info.pointCount(), values.size());
        LOG.warn("Protocol violation from " + id(leaf) + ": " + e.getMessage());
        addError(errors, e);
        return RawSeries.allGaps(leaf.path(), time_info);
      }
      return new RawSeries(leaf.path(), time_info, values);
    }

    private void failed(final LeafNode leaf,
                        final Exception e,
                        final Map<String, RawSeries> results) {
      final String msg = "Fetch of " + leaf.path() + " from " + id(leaf)
          + " failed";
      LOG.warn(msg, e);
      addError(errors, e instanceof BackendUnavailableException ? e
          : new BackendUnavailableException(id(leaf), leaf.path(), msg, e));
      results.put(leaf.path(), gaps(leaf.path(), start, end, default_step));
    }

    private boolean shouldPushDown(final FinderDescriptor source) {
      // composites forward to their aggregating members only
      return max_points > 0 && (source == null || source.isAggregating());
    }
  }

  private static void addError(final List<Exception> errors,
                               final Exception e) {
    synchronized (errors) {
      errors.add(e);
    }
  }

  private static RawSeries gaps(final String path,
                                final long start,
                                final long end,
                                final long step) {
    return RawSeries.allGaps(path, new TimeInfo(start, end, step));
  }

  private static String id(final LeafNode leaf) {
    return leaf.source() == null ? "composite" : leaf.source().id();
  }
}
