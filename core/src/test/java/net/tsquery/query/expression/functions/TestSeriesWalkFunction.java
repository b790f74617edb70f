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

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import net.tsquery.data.NormalizedSeries;

public class TestSeriesWalkFunction extends BaseFunctionTest {

  @Test
  public void derivative() throws Exception {
    assertEquals(Arrays.asList(null, 2.0, null, null, 4.0),
        SeriesWalkFunction.derivative(Arrays.asList(1.0, 3.0, null, 6.0, 10.0)));

    source.add("a.b", 0, 60, 1.0, 3.0, 6.0, 10.0, 15.0);
    final NormalizedSeries series = evaluate(call("derivative", path("a.b"))).get(0);
    assertEquals("derivative(a.b)", series.name());
    assertEquals("derivative(a.b)", series.pathExpression());
    assertValues(series, null, 2.0, 3.0, 4.0, 5.0);
  }

  @Test
  public void nonNegativeDerivative() throws Exception {
    final List<Double> counter = Arrays.asList(1.0, 3.0, 2.0, 5.0);
    assertEquals(Arrays.asList(null, 2.0, null, 3.0),
        SeriesWalkFunction.nonNegativeDerivative(counter, null, 1));
    // wraps at the max value
    assertEquals(Arrays.asList(null, 2.0, 10.0, 3.0),
        SeriesWalkFunction.nonNegativeDerivative(counter, 10.0, 1));
    // but not when the value is above the max
    assertEquals(Arrays.asList(null, 2.0, null, 3.0),
        SeriesWalkFunction.nonNegativeDerivative(counter, 1.0, 1));

    source.add("a.b", 0, 60, 1.0, 3.0, 2.0, 5.0, 5.0);
    assertEquals("nonNegativeDerivative(a.b)",
        evaluate(call("nonNegativeDerivative", path("a.b"))).get(0).name());
    assertValues(evaluate(call("nonNegativeDerivative", path("a.b"),
        literal(10))).get(0), null, 2.0, 10.0, 3.0, 0.0);
  }

  @Test
  public void perSecond() throws Exception {
    source.add("a.b", 0, 60, 0.0, 60.0, 180.0, 0.0, 60.0);
    final NormalizedSeries series = evaluate(call("perSecond", path("a.b"))).get(0);
    assertEquals("perSecond(a.b)", series.name());
    assertValues(series, null, 1.0, 2.0, null, 1.0);
  }

  @Test
  public void integral() throws Exception {
    assertEquals(Arrays.asList(1.0, null, 3.0, 6.0),
        SeriesWalkFunction.integral(Arrays.asList(1.0, null, 2.0, 3.0)));
    source.add("a.b", 0, 60, 1.0, 1.0, null, 1.0, 1.0);
    assertValues(evaluate(call("integral", path("a.b"))).get(0),
        1.0, 2.0, null, 3.0, 4.0);
  }

  @Test
  public void keepLastValue() throws Exception {
    final List<Double> values = Arrays.asList(1.0, null, null, 4.0, null);
    assertEquals(Arrays.asList(1.0, 1.0, 1.0, 4.0, 4.0),
        SeriesWalkFunction.keepLastValue(values, Integer.MAX_VALUE));
    assertEquals(Arrays.asList(1.0, null, null, 4.0, null),
        SeriesWalkFunction.keepLastValue(values, 1));
    assertEquals(Arrays.asList(1.0, 1.0, 1.0, 4.0, 4.0),
        SeriesWalkFunction.keepLastValue(values, 2));
    assertEquals(Arrays.asList(null, null, 3.0),
        SeriesWalkFunction.keepLastValue(Arrays.asList(null, null, 3.0), 5));

    source.add("a.b", 0, 60, 1.0, null, null, 4.0, null);
    final NormalizedSeries series = evaluate(call("keepLastValue", path("a.b"),
        literal(1))).get(0);
    assertEquals("keepLastValue(a.b)", series.name());
    assertValues(series, 1.0, null, null, 4.0, null);
  }

  @Test
  public void arity() throws Exception {
    source.add("a.b", 0, 60, 1.0, 2.0, 3.0, 4.0, 5.0);
    assertEvaluationFails(call("derivative", path("a.b"), literal(1)));
    assertEvaluationFails(call("keepLastValue", path("a.b"), literal("x")));
  }
}
