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

import org.junit.Before;
import org.junit.Test;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.query.QueryWindow;

public class TestPointTransformFunction extends BaseFunctionTest {

  @Before
  public void before() throws Exception {
    window = new QueryWindow(0, 240);
    source.add("a.b", 0, 60, -2.0, null, 0.0, 100.0);
  }

  @Test
  public void scaleAndOffset() throws Exception {
    NormalizedSeries series = evaluate(call("scale", path("a.b"),
        literal(2.5))).get(0);
    assertEquals("scale(a.b,2.5)", series.name());
    assertEquals("scale(a.b,2.5)", series.pathExpression());
    assertEquals("a.b", series.path());
    assertValues(series, -5.0, null, 0.0, 250.0);

    series = evaluate(call("offset", path("a.b"), literal(-1))).get(0);
    assertEquals("offset(a.b,-1)", series.name());
    assertValues(series, -3.0, null, -1.0, 99.0);
  }

  @Test
  public void absoluteAndInvert() throws Exception {
    assertValues(evaluate(call("absolute", path("a.b"))).get(0),
        2.0, null, 0.0, 100.0);
    final NormalizedSeries inverted = evaluate(call("invert", path("a.b"))).get(0);
    assertEquals("invert(a.b)", inverted.name());
    assertValues(inverted, -0.5, null, null, 0.01);
  }

  @Test
  public void scaleToSeconds() throws Exception {
    assertValues(evaluate(call("scaleToSeconds", path("a.b"), literal(1))).get(0),
        -2.0 / 60, null, 0.0, 100.0 / 60);
  }

  @Test
  public void log() throws Exception {
    final NormalizedSeries series = evaluate(call("log", path("a.b"))).get(0);
    assertEquals("log(a.b)", series.name());
    assertValues(series, null, null, null, 2.0);
    assertValues(evaluate(call("logarithm", path("a.b"), literal(10))).get(0),
        null, null, null, 2.0);
    assertEquals("log(a.b,2)", evaluate(call("log", path("a.b"), literal(2)))
        .get(0).name());
  }

  @Test
  public void nulls() throws Exception {
    NormalizedSeries series = evaluate(call("transformNull", path("a.b"))).get(0);
    assertEquals("transformNull(a.b)", series.name());
    assertValues(series, -2.0, 0.0, 0.0, 100.0);
    series = evaluate(call("transformNull", path("a.b"), literal(-1))).get(0);
    assertEquals("transformNull(a.b,-1)", series.name());
    assertValues(series, -2.0, -1.0, 0.0, 100.0);
    assertValues(evaluate(call("isNonNull", path("a.b"))).get(0),
        1.0, 0.0, 1.0, 1.0);
  }

  @Test
  public void removeValues() throws Exception {
    assertValues(evaluate(call("removeBelowValue", path("a.b"), literal(0)))
        .get(0), null, null, 0.0, 100.0);
    assertValues(evaluate(call("removeAboveValue", path("a.b"), literal(0)))
        .get(0), -2.0, null, 0.0, null);
  }

  @Test
  public void arity() throws Exception {
    assertEvaluationFails(call("scale", path("a.b")));
    assertEvaluationFails(call("absolute", path("a.b"), literal(1)));
    assertEvaluationFails(call("scale", literal(1), literal(1)));
  }
}
