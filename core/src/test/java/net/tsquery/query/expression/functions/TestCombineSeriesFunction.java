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
import static net.tsquery.query.expression.ExpressionNode.path;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.data.TimeInfo;
import net.tsquery.query.QueryWindow;

public class TestCombineSeriesFunction extends BaseFunctionTest {

  @Before
  public void before() throws Exception {
    window = new QueryWindow(0, 180);
    source.add("a.b", 0, 60, 1.0, null, 3.0)
          .add("a.c", 0, 60, 5.0, 5.0, null)
          .add("x.y", 0, 120, 10.0, 20.0);
  }

  @Test
  public void sum() throws Exception {
    final List<NormalizedSeries> series = evaluate(call("sumSeries", path("a.*")));
    assertEquals(1, series.size());
    assertEquals("sumSeries(a.*)", series.get(0).name());
    assertEquals("sumSeries(a.*)", series.get(0).pathExpression());
    assertEquals(new TimeInfo(0, 180, 60), series.get(0).timeInfo());
    // a gap plus 5 is 5
    assertValues(series.get(0), 6.0, 5.0, 3.0);

    assertEquals("sumSeries(a.*)", evaluate(call("sum", path("a.*"))).get(0).name());
  }

  @Test
  public void multipleArgumentsNamedByUniqueExpressions() throws Exception {
    final List<NormalizedSeries> series = evaluate(
        call("sumSeries", path("a.c"), path("a.b"), path("a.b")));
    assertEquals("sumSeries(a.b,a.c)", series.get(0).name());
    assertValues(series.get(0), 7.0, 5.0, 6.0);
  }

  @Test
  public void gapIgnoringCombiners() throws Exception {
    assertValues(evaluate(call("averageSeries", path("a.*"))).get(0), 3.0, 5.0, 3.0);
    assertValues(evaluate(call("minSeries", path("a.*"))).get(0), 1.0, 5.0, 3.0);
    assertValues(evaluate(call("maxSeries", path("a.*"))).get(0), 5.0, 5.0, 3.0);
    assertValues(evaluate(call("rangeOfSeries", path("a.*"))).get(0), 4.0, 0.0, 0.0);
    assertValues(evaluate(call("countSeries", path("a.*"))).get(0), 2.0, 1.0, 1.0);
    assertValues(evaluate(call("stddevSeries", path("a.*"))).get(0), 2.0, 0.0, 0.0);
  }

  @Test
  public void gapPropagatingCombiners() throws Exception {
    final NormalizedSeries diff = evaluate(call("diffSeries", path("a.b"),
        path("a.c"))).get(0);
    assertEquals("diffSeries(a.b,a.c)", diff.name());
    assertValues(diff, -4.0, null, null);
    assertValues(evaluate(call("multiplySeries", path("a.*"))).get(0),
        5.0, null, null);
  }

  @Test
  public void differentStepsAligned() throws Exception {
    final NormalizedSeries sum = evaluate(call("sumSeries", path("a.b"),
        path("x.y"))).get(0);
    assertEquals(120, sum.timeInfo().step());
    assertEquals(new TimeInfo(0, 240, 120), sum.timeInfo());
    // a.b averages to 1 and 3 on the coarser grid
    assertValues(sum, 11.0, 23.0);
  }

  @Test
  public void emptyInput() throws Exception {
    assertTrue(evaluate(call("sumSeries", path("nothing.*"))).isEmpty());
    assertEvaluationFails(call("sumSeries"));
  }

  @Test
  public void combiners() throws Exception {
    final List<Double> row = Arrays.asList(2.0, null, 6.0);
    assertEquals(8.0, Combiner.SUM.combine(row), 0.0001);
    assertEquals(4.0, Combiner.AVERAGE.combine(row), 0.0001);
    assertNull(Combiner.DIFF.combine(row));
    assertEquals(-4.0, Combiner.DIFF.combine(Arrays.asList(2.0, 6.0)), 0.0001);
    assertNull(Combiner.SUM.combine(Arrays.<Double>asList(null, null)));
    assertNull(Combiner.COUNT.combine(Arrays.<Double>asList(null, null)));

    assertSame(Combiner.SUM, Combiner.fromFunction("sum"));
    assertSame(Combiner.AVERAGE, Combiner.fromFunction("avg"));
    assertSame(Combiner.MAX, Combiner.fromFunction("maxSeries"));
    assertNull(Combiner.fromFunction("movingAverage"));
  }
}
