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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.stumbleupon.async.Deferred;

import net.tsquery.data.Interval;
import net.tsquery.data.IntervalSet;
import net.tsquery.exceptions.BackendUnavailableException;
import net.tsquery.exceptions.NoBackendsAvailableException;
import net.tsquery.threadpools.BackendExecutor;
import net.tsquery.utils.Deferreds;

/**
 * Resolves a {@link FindQuery} against every registered finder in
 * parallel and merges the results.
 * <ul>
 * <li>The pattern is compiled first so a bad glob fails before any
 * backend is contacted.</li>
 * <li>Each finder runs on the {@link BackendExecutor}. A finder that
 * fails or runs past the deadline contributes nothing and its error is
 * recorded. If no finder succeeds the query fails with a
 * {@link NoBackendsAvailableException}.</li>
 * <li>Nodes not matching the glob are dropped, as are leaves whose
 * intervals miss the query window. Branches are never time filtered.</li>
 * <li>A path that is a branch in any finder stays a branch. A path that
 * is a leaf in several finders becomes one leaf over a
 * {@link CompositeReader}.</li>
 * </ul>
 *
 * @since 3.0
 */
public class FinderFederation {
  private static final Logger LOG = LoggerFactory.getLogger(FinderFederation.class);

  /** The finders in declaration order. */
  private final List<FinderDescriptor> finders;

  /** The pool to run finders on. */
  private final BackendExecutor executor;

  /**
   * Default ctor.
   * @param finders The non-null list of finders in declaration order.
   * @param executor A non-null executor.
   */
  public FinderFederation(final List<FinderDescriptor> finders,
                          final BackendExecutor executor) {
    if (finders == null) {
      throw new IllegalArgumentException("Finders cannot be null.");
    }
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null.");
    }
    this.finders = ImmutableList.copyOf(finders);
    this.executor = executor;
  }

  /** @return The finders in declaration order. */
  public List<FinderDescriptor> finders() {
    return finders;
  }

  /**
   * Runs the query against every finder.
   * @param query A non-null query.
   * @param deadline_ns The request deadline from {@link System#nanoTime()}.
   * @return The merged results.
   * @throws net.tsquery.exceptions.InvalidPatternException if the pattern
   * was malformed.
   * @throws NoBackendsAvailableException if every finder failed.
   */
  public FindResults find(final FindQuery query, final long deadline_ns) {
    final GlobPattern glob = GlobPattern.compile(query.pattern().toString());
    final List<FindTask> tasks = Lists.newArrayListWithCapacity(finders.size());
    final List<Deferred<List<Node>>> deferreds =
        Lists.newArrayListWithCapacity(finders.size());
    for (final FinderDescriptor finder : finders) {
      final FindTask task = new FindTask(finder, query, glob);
      tasks.add(task);
      deferreds.add(executor.submit(task));
    }

    final List<Exception> errors = Lists.newArrayList();
    final Map<String, List<LeafNode>> leaves = new TreeMap<String, List<LeafNode>>();
    final Set<String> branches = Sets.newHashSet();
    int successes = 0;
    for (int i = 0; i < finders.size(); i++) {
      final FinderDescriptor finder = finders.get(i);
      final List<Node> nodes;
      try {
        nodes = Deferreds.joinWithin(deferreds.get(i), deadline_ns);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new BackendUnavailableException(finder.id(),
            "Interrupted while waiting on finder " + finder.id(), e);
      } catch (Exception e) {
        final String msg = Deferreds.isTimeout(e)
            ? "Finder " + finder.id() + " timed out for " + query.pattern()
            : "Finder " + finder.id() + " failed for " + query.pattern();
        LOG.warn(msg, e);
        errors.add(new BackendUnavailableException(finder.id(), msg, e));
        continue;
      }
      successes++;
      errors.addAll(tasks.get(i).errors());
      if (nodes == null) {
        continue;
      }
      for (final Node node : nodes) {
        if (node.isLeaf()) {
          List<LeafNode> extant = leaves.get(node.path());
          if (extant == null) {
            extant = Lists.newArrayListWithExpectedSize(1);
            leaves.put(node.path(), extant);
          }
          extant.add(((LeafNode) node).withSource(finder));
        } else {
          branches.add(node.path());
        }
      }
    }

    if (successes == 0) {
      throw new NoBackendsAvailableException("All " + finders.size()
          + " finders failed for " + query.pattern(), errors);
    }

    final TreeMap<String, Node> merged = new TreeMap<String, Node>();
    for (final String branch : branches) {
      merged.put(branch, new BranchNode(branch));
    }
    for (final Map.Entry<String, List<LeafNode>> entry : leaves.entrySet()) {
      if (merged.containsKey(entry.getKey())) {
        continue;
      }
      final List<LeafNode> sources = entry.getValue();
      if (sources.size() == 1) {
        merged.put(entry.getKey(), sources.get(0));
      } else {
        merged.put(entry.getKey(), new LeafNode(entry.getKey(),
            new CompositeReader(entry.getKey(), sources)));
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Resolved " + query + " to " + merged.size() + " nodes from "
          + successes + " of " + finders.size() + " finders with "
          + errors.size() + " errors");
    }
    return new FindResults(Lists.newArrayList(merged.values()), errors);
  }

  /**
   * Runs a single finder and drops the nodes that do not apply.
   */
  static class FindTask implements Callable<List<Node>> {
    private final FinderDescriptor finder;
    private final FindQuery query;
    private final GlobPattern glob;
    private final List<Exception> errors =
        Collections.synchronizedList(Lists.<Exception>newArrayList());

    FindTask(final FinderDescriptor finder,
             final FindQuery query,
             final GlobPattern glob) {
      this.finder = finder;
      this.query = query;
      this.glob = glob;
    }

    @Override
    public List<Node> call() throws Exception {
      final List<Node> found = finder.finder().findNodes(query);
      if (found == null || found.isEmpty()) {
        return ImmutableList.of();
      }
      final Interval window = query.hasTimeWindow() ? query.interval() : null;
      final List<Node> nodes = Lists.newArrayListWithCapacity(found.size());
      for (final Node node : found) {
        if (node == null || !glob.matches(node.path())) {
          continue;
        }
        if (window != null && node.isLeaf()) {
          final IntervalSet intervals;
          try {
            intervals = ((LeafNode) node).reader().getIntervals();
          } catch (Exception e) {
            // the leaf is dropped, its siblings are kept
            final String msg = "Failed to read the intervals of "
                + node.path() + " from finder " + finder.id();
            LOG.warn(msg, e);
            errors.add(new BackendUnavailableException(finder.id(),
                node.path(), msg, e));
            continue;
          }
          if (intervals == null || !intervals.overlaps(window)) {
            if (LOG.isTraceEnabled()) {
              LOG.trace("Pruned " + node.path() + " from " + finder.id()
                  + " as it has no data in " + window);
            }
            continue;
          }
        }
        nodes.add(node);
      }
      return nodes;
    }

    /** @return The per leaf errors recorded by {@link #call()}. */
    List<Exception> errors() {
      synchronized (errors) {
        return Lists.newArrayList(errors);
      }
    }
  }
}
