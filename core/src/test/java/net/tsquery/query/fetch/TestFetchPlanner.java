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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;

import net.tsquery.data.FetchResult;
import net.tsquery.data.RawSeries;
import net.tsquery.data.TimeInfo;
import net.tsquery.exceptions.BackendUnavailableException;
import net.tsquery.exceptions.ProtocolViolationException;
import net.tsquery.storage.FinderDescriptor;
import net.tsquery.storage.LeafNode;
import net.tsquery.storage.MockFinder;
import net.tsquery.storage.MockMultiFetchFinder;
import net.tsquery.storage.MockReader;
import net.tsquery.threadpools.BackendExecutor;

public class TestFetchPlanner {
  private BackendExecutor executor;
  private FetchPlanner planner;

  @Before
  public void before() throws Exception {
    executor = new BackendExecutor(4);
    planner = new FetchPlanner(executor, 60);
  }

  @After
  public void after() throws Exception {
    executor.close();
  }

  @Test
  public void ctor() throws Exception {
    try {
      new FetchPlanner(null, 60);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new FetchPlanner(executor, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void fetchIndividually() throws Exception {
    final MockFinder finder = new MockFinder()
        .addLeaf("a.b", MockReader.of(10, 1.0, 2.0, 3.0))
        .addLeaf("a.c", MockReader.of(10, 4.0, null, 6.0));
    final FinderDescriptor descriptor = new FinderDescriptor("f1", 0, finder);
    final List<LeafNode> leaves = Arrays.asList(
        leaf(finder, descriptor, "a.b"), leaf(finder, descriptor, "a.c"));

    assertEquals(2, planner.plan(leaves).size());
    final FetchResults results = planner.fetch(leaves, 0, 30, 0, deadline(5000));
    assertTrue(results.errors().isEmpty());
    assertEquals(Arrays.asList(1.0, 2.0, 3.0), results.get("a.b").values());
    assertEquals(Arrays.asList(4.0, null, 6.0), results.get("a.c").values());
    assertEquals(new TimeInfo(0, 30, 10), results.get("a.c").timeInfo());
  }

  @Test
  public void batchesByTag() throws Exception {
    final MockMultiFetchFinder finder = new MockMultiFetchFinder();
    finder.addLeaf("a.b", MockReader.of(10, 1.0, 2.0))
        .addLeaf("a.c", MockReader.of(10, 3.0, 4.0))
        .setBatchingTag("cluster1");
    final MockFinder plain = new MockFinder()
        .addLeaf("x.y", MockReader.of(10, 5.0, 6.0));
    final FinderDescriptor batched = new FinderDescriptor("f1", 0, finder);
    final FinderDescriptor single = new FinderDescriptor("f2", 1, plain);
    final List<LeafNode> leaves = Arrays.asList(
        leaf(finder, batched, "a.b"),
        leaf(plain, single, "x.y"),
        leaf(finder, batched, "a.c"));

    final List<FetchGroup> groups = planner.plan(leaves);
    assertEquals(2, groups.size());
    assertTrue(groups.get(0).isBatched());
    assertEquals(2, groups.get(0).leaves().size());
    assertEquals(1, groups.get(1).leaves().size());

    final FetchResults results = planner.fetch(leaves, 0, 20, 0, deadline(5000));
    assertEquals(1, finder.multiFetches());
    assertEquals(0, finder.reader("a.b").fetches());
    assertEquals(Arrays.asList(3.0, 4.0), results.get("a.c").values());
    assertEquals(Arrays.asList(5.0, 6.0), results.get("x.y").values());
    assertEquals(Lists.newArrayList("a.b", "x.y", "a.c"),
        Lists.newArrayList(results.series().keySet()));
  }

  @Test
  public void duplicatePathsFetchedOnce() throws Exception {
    final MockFinder finder = new MockFinder()
        .addLeaf("a.b", MockReader.of(10, 1.0));
    final FinderDescriptor descriptor = new FinderDescriptor("f1", 0, finder);
    final List<LeafNode> leaves = Arrays.asList(
        leaf(finder, descriptor, "a.b"), leaf(finder, descriptor, "a.b"));
    final FetchResults results = planner.fetch(leaves, 0, 10, 0, deadline(5000));
    assertEquals(1, results.series().size());
    assertEquals(1, finder.reader("a.b").fetches());
  }

  @Test
  public void protocolViolation() throws Exception {
    final MockReader reader = MockReader.of(10, 1.0)
        .setFixedResult(new FetchResult(new TimeInfo(0, 100, 10),
            Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0)));
    final MockFinder finder = new MockFinder().addLeaf("a.b", reader);
    final FinderDescriptor descriptor = new FinderDescriptor("f1", 0, finder);
    final FetchResults results = planner.fetch(
        Arrays.asList(leaf(finder, descriptor, "a.b")), 0, 100, 0,
        deadline(5000));
    final RawSeries series = results.get("a.b");
    assertEquals(new TimeInfo(0, 100, 10), series.timeInfo());
    assertEquals(10, series.size());
    assertTrue(series.isAllGaps());
    assertEquals(1, results.errors().size());
    final ProtocolViolationException e =
        (ProtocolViolationException) results.errors().get(0);
    assertEquals(10, e.expected());
    assertEquals(9, e.actual());
  }

  @Test
  public void noDataIsGapsWithoutError() throws Exception {
    final MockReader reader = MockReader.of(10, 1.0)
        .setFixedResult(new FetchResult(null, null));
    final MockFinder finder = new MockFinder().addLeaf("a.b", reader);
    final FinderDescriptor descriptor = new FinderDescriptor("f1", 0, finder);
    final FetchResults results = planner.fetch(
        Arrays.asList(leaf(finder, descriptor, "a.b")), 0, 600, 0,
        deadline(5000));
    assertTrue(results.errors().isEmpty());
    assertEquals(new TimeInfo(0, 600, 60), results.get("a.b").timeInfo());
    assertTrue(results.get("a.b").isAllGaps());
  }

  @Test
  public void failureIsolated() throws Exception {
    final MockFinder finder = new MockFinder()
        .addLeaf("a.b", MockReader.of(10, 1.0, 2.0))
        .addLeaf("a.c", MockReader.of(10, 1.0, 2.0)
            .setException(new RuntimeException("Boo!")));
    final FinderDescriptor descriptor = new FinderDescriptor("f1", 0, finder);
    final FetchResults results = planner.fetch(Arrays.asList(
        leaf(finder, descriptor, "a.b"), leaf(finder, descriptor, "a.c")),
        0, 20, 0, deadline(5000));
    assertEquals(Arrays.asList(1.0, 2.0), results.get("a.b").values());
    assertTrue(results.get("a.c").isAllGaps());
    assertEquals(1, results.errors().size());
    final BackendUnavailableException e =
        (BackendUnavailableException) results.errors().get(0);
    assertEquals("a.c", e.path());
    assertEquals("f1", e.backend());
  }

  @Test
  public void timeout() throws Exception {
    final MockFinder finder = new MockFinder()
        .addLeaf("a.b", MockReader.of(10, 1.0, 2.0))
        .addLeaf("a.c", MockReader.of(10, 1.0, 2.0).setDelay(2000));
    final FinderDescriptor descriptor = new FinderDescriptor("f1", 0, finder);
    final long start = System.nanoTime();
    final FetchResults results = planner.fetch(Arrays.asList(
        leaf(finder, descriptor, "a.b"), leaf(finder, descriptor, "a.c")),
        0, 20, 0, deadline(200));
    assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1500);
    assertEquals(Arrays.asList(1.0, 2.0), results.get("a.b").values());
    assertTrue(results.get("a.c").isAllGaps());
    assertEquals(1, results.errors().size());
    assertTrue(results.errors().get(0).getMessage().contains("timed out"));
  }

  @Test
  public void maxPointsPushedDownToAggregating() throws Exception {
    final MockFinder aggregating = new MockFinder()
        .addLeaf("a.b", MockReader.of(10, 1.0, 2.0))
        .setAggregating(true);
    final MockFinder plain = new MockFinder()
        .addLeaf("a.c", MockReader.of(10, 1.0, 2.0));
    planner.fetch(Arrays.asList(
        leaf(aggregating, new FinderDescriptor("f1", 0, aggregating), "a.b"),
        leaf(plain, new FinderDescriptor("f2", 1, plain), "a.c")),
        0, 20, 500, deadline(5000));
    assertEquals(500, aggregating.reader("a.b").lastMaxPoints());
    assertEquals(0, plain.reader("a.c").lastMaxPoints());
  }

  @Test
  public void badWindow() throws Exception {
    try {
      planner.fetch(Lists.<LeafNode>newArrayList(), 10, 10, 0, deadline(5000));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    assertNull(planner.fetch(Lists.<LeafNode>newArrayList(), 0, 10, 0,
        deadline(5000)).get("a.b"));
  }

  private static LeafNode leaf(final MockFinder finder,
                               final FinderDescriptor descriptor,
                               final String path) {
    return new LeafNode(path, finder.reader(path), descriptor);
  }

  private static long deadline(final long ms) {
    return System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(ms);
  }
}
