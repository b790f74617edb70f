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

import static net.tsquery.query.expression.ExpressionNode.call;
import static net.tsquery.query.expression.ExpressionNode.path;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tsquery.configuration.UnitTestConfiguration;
import net.tsquery.data.NormalizedSeries;
import net.tsquery.exceptions.EvaluationException;
import net.tsquery.exceptions.InvalidPatternException;
import net.tsquery.exceptions.NoBackendsAvailableException;
import net.tsquery.query.expression.ExpressionNode;
import net.tsquery.storage.FindQuery;
import net.tsquery.storage.FindResults;
import net.tsquery.storage.FinderDescriptor;
import net.tsquery.storage.MockFinder;
import net.tsquery.storage.MockReader;

public class TestQueryEngine {
  private Map<String, String> settings;
  private MockFinder web;
  private MockFinder db;
  private QueryEngine engine;

  @Before
  public void before() throws Exception {
    settings = Maps.newHashMap();
    settings.put(QueryEngine.TIMEOUT_KEY, "5000");
    web = new MockFinder()
        .addLeaf("servers.web1.cpu", MockReader.of(60,
            1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0, 10.0))
        .addLeaf("servers.web2.cpu", MockReader.of(60,
            1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0));
    db = new MockFinder()
        .addLeaf("db.load", MockReader.of(60, 0.5, 0.5));
  }

  @After
  public void after() throws Exception {
    if (engine != null) {
      engine.close();
    }
  }

  @Test
  public void ctor() throws Exception {
    try {
      new QueryEngine(null, descriptors());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new QueryEngine(UnitTestConfiguration.getConfiguration(settings), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    settings.put(QueryEngine.TIMEOUT_KEY, "0");
    try {
      new QueryEngine(UnitTestConfiguration.getConfiguration(settings),
          descriptors());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void resolveAndEvaluate() throws Exception {
    engine = new QueryEngine(UnitTestConfiguration.getConfiguration(settings),
        descriptors());
    final List<ExpressionNode> targets = ImmutableList.of(
        path("servers.*.cpu"), call("sumSeries", path("servers.*.cpu")));
    final EvaluationResult result = engine.resolveAndEvaluate(targets,
        new QueryWindow(0, 600));

    assertEquals(ImmutableList.of("servers.*.cpu", "sumSeries(servers.*.cpu)"),
        Lists.newArrayList(result.series().keySet()));
    final List<NormalizedSeries> raw = result.get("servers.*.cpu");
    assertEquals(2, raw.size());
    assertEquals("servers.web1.cpu", raw.get(0).name());
    assertEquals("servers.web2.cpu", raw.get(1).name());
    assertEquals(10, raw.get(0).size());

    final List<NormalizedSeries> sum = result.get("sumSeries(servers.*.cpu)");
    assertEquals(1, sum.size());
    assertEquals("sumSeries(servers.*.cpu)", sum.get(0).name());
    assertEquals(2.0, sum.get(0).value(0), 0.0001);
    assertEquals(11.0, sum.get(0).value(9), 0.0001);

    // the shared expression is fetched once
    assertEquals(1, result.fetchCycles());
    assertEquals(1, web.reader("servers.web1.cpu").fetches());
    assertFalse(result.isPartial());
    assertTrue(result.errors().isEmpty());
  }

  @Test
  public void consolidatesToMaxPoints() throws Exception {
    engine = new QueryEngine(UnitTestConfiguration.getConfiguration(settings),
        descriptors());
    final EvaluationResult result = engine.resolveAndEvaluate(
        ImmutableList.<ExpressionNode>of(path("servers.web1.cpu")),
        new QueryWindow(0, 600, 5));
    final NormalizedSeries series = result.get("servers.web1.cpu").get(0);
    assertEquals(5, series.size());
    assertEquals(120, series.timeInfo().step());
    assertEquals(1.5, series.value(0), 0.0001);
    assertEquals(9.5, series.value(4), 0.0001);
  }

  @Test
  public void consolidationRules() throws Exception {
    settings.put(QueryEngine.RULES_KEY, "{\"servers.*.cpu\":\"max\"}");
    engine = new QueryEngine(UnitTestConfiguration.getConfiguration(settings),
        descriptors());
    final EvaluationResult result = engine.resolveAndEvaluate(
        ImmutableList.<ExpressionNode>of(path("servers.web1.cpu")),
        new QueryWindow(0, 600, 5));
    final NormalizedSeries series = result.get("servers.web1.cpu").get(0);
    assertEquals(2.0, series.value(0), 0.0001);
    assertEquals(10.0, series.value(4), 0.0001);
  }

  @Test
  public void partialResults() throws Exception {
    db.setException(new IllegalStateException("Boo!"));
    engine = new QueryEngine(UnitTestConfiguration.getConfiguration(settings),
        descriptors());
    final EvaluationResult result = engine.resolveAndEvaluate(
        ImmutableList.<ExpressionNode>of(path("servers.*.cpu")),
        new QueryWindow(0, 600));
    assertEquals(2, result.get("servers.*.cpu").size());
    assertTrue(result.isPartial());
    assertEquals(1, result.errors().size());
  }

  @Test
  public void allFindersFail() throws Exception {
    web.setException(new IllegalStateException("Boo!"));
    db.setException(new IllegalStateException("Boo!"));
    engine = new QueryEngine(UnitTestConfiguration.getConfiguration(settings),
        descriptors());
    try {
      engine.resolveAndEvaluate(
          ImmutableList.<ExpressionNode>of(path("servers.*.cpu")),
          new QueryWindow(0, 600));
      fail("Expected NoBackendsAvailableException");
    } catch (NoBackendsAvailableException e) {
      assertEquals(503, e.getStatusCode());
    }
  }

  @Test
  public void noMatches() throws Exception {
    engine = new QueryEngine(UnitTestConfiguration.getConfiguration(settings),
        descriptors());
    final EvaluationResult result = engine.resolveAndEvaluate(
        ImmutableList.<ExpressionNode>of(path("nope.*")),
        new QueryWindow(0, 600));
    assertTrue(result.get("nope.*").isEmpty());
    assertFalse(result.isPartial());
  }

  @Test
  public void disabledFunctions() throws Exception {
    settings.put(QueryEngine.DISABLED_KEY, "sumSeries, scale");
    engine = new QueryEngine(UnitTestConfiguration.getConfiguration(settings),
        descriptors());
    assertFalse(engine.registry().names().contains("sumSeries"));
    assertFalse(engine.registry().names().contains("scale"));
    assertTrue(engine.registry().names().contains("averageSeries"));
    try {
      engine.resolveAndEvaluate(ImmutableList.<ExpressionNode>of(
          call("sumSeries", path("servers.*.cpu"))), new QueryWindow(0, 600));
      fail("Expected EvaluationException");
    } catch (EvaluationException e) { }
  }

  @Test
  public void find() throws Exception {
    engine = new QueryEngine(UnitTestConfiguration.getConfiguration(settings),
        descriptors());
    FindResults results = engine.find(FindQuery.newBuilder()
        .setPattern("servers.*.cpu")
        .build());
    assertEquals(2, results.leaves().size());

    results = engine.find(FindQuery.newBuilder()
        .setPattern("*")
        .build());
    assertEquals(2, results.nodes().size());
    assertTrue(results.leaves().isEmpty());

    try {
      engine.find(FindQuery.newBuilder().setPattern("servers.{web1.cpu").build());
      fail("Expected InvalidPatternException");
    } catch (InvalidPatternException e) { }
  }

  private List<FinderDescriptor> descriptors() {
    return ImmutableList.of(new FinderDescriptor("web", 0, web),
        new FinderDescriptor("db", 1, db));
  }
}
