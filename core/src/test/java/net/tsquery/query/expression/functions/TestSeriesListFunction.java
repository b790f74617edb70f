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
import static net.tsquery.query.expression.functions.TestSeriesFilterFunction.names;
import static org.junit.Assert.assertEquals;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class TestSeriesListFunction extends BaseFunctionTest {

  @Before
  public void before() throws Exception {
    source.add("s.a", 0, 60, 1.0, 5.0, 2.0)
          .add("s.b", 0, 60, 3.0, 3.0, 3.0)
          .add("s.c", 0, 60, (Double) null, null, null)
          .add("s.d", 0, 60, 0.0, 10.0, null);
  }

  @Test
  public void limit() throws Exception {
    assertEquals(ImmutableList.of("s.a", "s.b"),
        names(evaluate(call("limit", path("s.*"), literal(2)))));
    assertEquals(4, evaluate(call("limit", path("s.*"), literal(10))).size());
    assertEquals(0, evaluate(call("limit", path("s.*"), literal(-1))).size());
  }

  @Test
  public void excludeAndGrep() throws Exception {
    assertEquals(ImmutableList.of("s.c", "s.d"),
        names(evaluate(call("exclude", path("s.*"), literal("[ab]")))));
    assertEquals(ImmutableList.of("s.a", "s.b"),
        names(evaluate(call("grep", path("s.*"), literal("[ab]")))));
    assertEvaluationFails(call("grep", path("s.*"), literal("[")));
    assertEvaluationFails(call("exclude", path("s.*")));
  }

  @Test
  public void removeEmptySeries() throws Exception {
    assertEquals(ImmutableList.of("s.a", "s.b", "s.d"),
        names(evaluate(call("removeEmptySeries", path("s.*")))));
  }

  @Test
  public void sortByName() throws Exception {
    assertEquals(ImmutableList.of("s.a", "s.b", "s.c", "s.d"),
        names(evaluate(call("sortByName",
            call("group", path("s.d"), path("s.b"), path("s.[ac]"))))));
  }

  @Test
  public void sortByMaxima() throws Exception {
    assertEquals(ImmutableList.of("s.c", "s.b", "s.a", "s.d"),
        names(evaluate(call("sortByMaxima", path("s.*")))));
  }
}
