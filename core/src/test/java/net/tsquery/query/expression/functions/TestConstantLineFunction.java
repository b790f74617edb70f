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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.data.TimeInfo;
import net.tsquery.query.QueryWindow;

public class TestConstantLineFunction extends BaseFunctionTest {

  @Test
  public void constantLine() throws Exception {
    final List<NormalizedSeries> series = evaluate(call("constantLine", literal(5)));
    assertEquals(1, series.size());
    assertEquals("5", series.get(0).name());
    assertEquals(new TimeInfo(0, 300, 300), series.get(0).timeInfo());
    assertValues(series.get(0), 5.0);
    // no storage access
    assertTrue(source.windows().isEmpty());
  }

  @Test
  public void fraction() throws Exception {
    window = new QueryWindow(600, 1200);
    final List<NormalizedSeries> series = evaluate(call("constantLine", literal(0.25)));
    assertEquals("0.25", series.get(0).name());
    assertEquals(new TimeInfo(600, 1200, 600), series.get(0).timeInfo());
    assertValues(series.get(0), 0.25);
  }

  @Test
  public void badArguments() throws Exception {
    assertEvaluationFails(call("constantLine"));
    assertEvaluationFails(call("constantLine", literal("five")));
    assertEvaluationFails(call("constantLine", literal(1), literal(2)));
  }
}
