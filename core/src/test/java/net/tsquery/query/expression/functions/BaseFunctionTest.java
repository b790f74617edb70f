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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Before;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.exceptions.EvaluationException;
import net.tsquery.query.QueryWindow;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.ExpressionEvaluator;
import net.tsquery.query.expression.ExpressionNode;
import net.tsquery.query.expression.FunctionRegistry;
import net.tsquery.query.expression.MockSeriesSource;
import net.tsquery.query.expression.SeriesSource;
import net.tsquery.query.processor.align.SeriesAligner;

/**
 * Evaluates expressions with the builtin functions against a
 * {@link MockSeriesSource}.
 */
public abstract class BaseFunctionTest {
  protected MockSeriesSource source;
  protected ExpressionEvaluator evaluator;
  protected QueryWindow window;
  protected EvaluationContext context;

  @Before
  public void beforeBase() throws Exception {
    source = new MockSeriesSource();
    evaluator = new ExpressionEvaluator(BuiltinFunctions.register(
        FunctionRegistry.newBuilder(), new SeriesAligner(86400)).build());
    window = new QueryWindow(0, 300);
  }

  protected List<NormalizedSeries> evaluate(final ExpressionNode target) {
    return evaluate(target, source);
  }

  protected List<NormalizedSeries> evaluate(final ExpressionNode target,
                                            final SeriesSource source) {
    context = new EvaluationContext(window, Long.MAX_VALUE, source);
    return evaluator.evaluate(target, context);
  }

  protected void assertEvaluationFails(final ExpressionNode target) {
    try {
      evaluate(target);
      fail("Expected EvaluationException for " + target);
    } catch (EvaluationException e) { }
  }

  protected static void assertValues(final NormalizedSeries series,
                                     final Double... expected) {
    assertEquals(series.name() + " " + series.values(), expected.length,
        series.size());
    for (int i = 0; i < expected.length; i++) {
      if (expected[i] == null) {
        assertNull(series.name() + " @" + i, series.value(i));
      } else {
        assertEquals(series.name() + " @" + i, expected[i], series.value(i),
            0.0001);
      }
    }
  }
}
