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

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.tsquery.data.MetricPath;

/**
 * A finder over an in-memory tree of leaves. Branches are derived from
 * the leaf paths.
 */
public class MockFinder implements Finder {
  protected final Map<String, MockReader> leaves = Maps.newTreeMap();
  private String batching_tag;
  private boolean aggregating;
  private RuntimeException exception;
  private long delay_ms;
  private final AtomicInteger finds = new AtomicInteger();

  public MockFinder addLeaf(final String path, final MockReader reader) {
    leaves.put(path, reader);
    return this;
  }

  public MockFinder setBatchingTag(final String batching_tag) {
    this.batching_tag = batching_tag;
    return this;
  }

  public MockFinder setAggregating(final boolean aggregating) {
    this.aggregating = aggregating;
    return this;
  }

  public MockFinder setException(final RuntimeException exception) {
    this.exception = exception;
    return this;
  }

  public MockFinder setDelay(final long delay_ms) {
    this.delay_ms = delay_ms;
    return this;
  }

  public MockReader reader(final String path) {
    return leaves.get(path);
  }

  public int finds() {
    return finds.get();
  }

  @Override
  public List<Node> findNodes(final FindQuery query) {
    finds.incrementAndGet();
    if (delay_ms > 0) {
      try {
        Thread.sleep(delay_ms);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RuntimeException("Interrupted", e);
      }
    }
    if (exception != null) {
      throw exception;
    }
    final GlobPattern glob = GlobPattern.compile(query.pattern().toString());
    final List<Node> nodes = Lists.newArrayList();
    final Set<String> branches = Sets.newTreeSet();
    for (final Map.Entry<String, MockReader> entry : leaves.entrySet()) {
      final MetricPath path = MetricPath.of(entry.getKey());
      if (path.segmentCount() == glob.segmentCount()) {
        if (glob.matches(path)) {
          nodes.add(new LeafNode(entry.getKey(), entry.getValue()));
        }
      } else if (path.segmentCount() > glob.segmentCount()) {
        final String prefix = prefix(path, glob.segmentCount());
        if (glob.matches(prefix)) {
          branches.add(prefix);
        }
      }
    }
    for (final String branch : branches) {
      nodes.add(new BranchNode(branch));
    }
    return nodes;
  }

  @Override
  public String batchingTag() {
    return batching_tag;
  }

  @Override
  public boolean isAggregating() {
    return aggregating;
  }

  private static String prefix(final MetricPath path, final int segments) {
    final StringBuilder buf = new StringBuilder();
    for (int i = 0; i < segments; i++) {
      if (i > 0) {
        buf.append('.');
      }
      buf.append(path.segment(i));
    }
    return buf.toString();
  }
}
