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

import static net.tsquery.query.expression.ExpressionNode.call;
import static net.tsquery.query.expression.ExpressionNode.literal;
import static net.tsquery.query.expression.ExpressionNode.path;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.query.QueryWindow;

public class TestDivideSeriesFunction extends BaseFunctionTest {

  @Before
  public void before() throws Exception {
    window = new QueryWindow(0, 180);
    source.add("a.b", 0, 60, 1.0, null, 3.0)
          .add("a.c", 0, 60, 5.0, 5.0, null)
          .add("d.e", 0, 60, 2.0, 0.0, null);
  }

  @Test
  public void divide() throws Exception {
    final List<NormalizedSeries> series = evaluate(call("divideSeries",
        path("a.*"), path("d.e")));
    assertEquals(2, series.size());
    assertEquals("divideSeries(a.b,d.e)", series.get(0).name());
    assertEquals("divideSeries(a.c,d.e)", series.get(1).name());
    assertValues(series.get(0), 0.5, null, null);
    // division by zero is a gap
    assertValues(series.get(1), 2.5, null, null);
  }

  @Test
  public void divisorMustBeOneSeries() throws Exception {
    assertEvaluationFails(call("divideSeries", path("a.b"), path("a.*")));
    assertEvaluationFails(call("divideSeries", path("a.b"), path("nothing")));
    assertEvaluationFails(call("divideSeries", path("a.b")));
    assertTrue(evaluate(call("divideSeries", path("nothing"), path("d.e")))
        .isEmpty());
  }

  @Test
  public void divideHelper() throws Exception {
    assertEquals(2.0, DivideSeriesFunction.divide(4.0, 2.0), 0.0001);
    assertNull(DivideSeriesFunction.divide(4.0, 0.0));
    assertNull(DivideSeriesFunction.divide(null, 2.0));
    assertNull(DivideSeriesFunction.divide(4.0, null));
  }

  @Test
  public void asPercentOfSum() throws Exception {
    final List<NormalizedSeries> series = evaluate(call("asPercent", path("a.*")));
    assertEquals(2, series.size());
    assertEquals("asPercent(a.b,a.*)", series.get(0).name());
    assertValues(series.get(0), 100.0 / 6, null, 100.0);
    assertValues(series.get(1), 500.0 / 6, 100.0, null);
  }

  @Test
  public void asPercentOfSeries() throws Exception {
    final List<NormalizedSeries> series = evaluate(call("asPercent",
        path("a.b"), path("d.e")));
    assertEquals("asPercent(a.b,d.e)", series.get(0).name());
    assertValues(series.get(0), 50.0, null, null);
    assertEvaluationFails(call("asPercent", path("a.b"), path("a.*")));
  }

  @Test
  public void asPercentOfNumber() throws Exception {
    final List<NormalizedSeries> series = evaluate(call("asPercent",
        path("a.b"), literal(10)));
    assertEquals("asPercent(a.b,10)", series.get(0).name());
    assertValues(series.get(0), 10.0, null, 30.0);
    assertValues(evaluate(call("asPercent", path("a.b"), literal(0))).get(0),
        null, null, null);
  }
}
