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
package net.tsquery.query.expression;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.exceptions.EvaluationException;
import net.tsquery.exceptions.QueryExecutionException;

/**
 * Evaluates call graphs depth first: arguments are evaluated before the
 * function consuming them, path expressions resolve through the context's
 * cache and literals evaluate to themselves.
 *
 * @since 3.0
 */
public class ExpressionEvaluator {
  private static final Logger LOG = LoggerFactory.getLogger(ExpressionEvaluator.class);

  /** The functions. */
  private final FunctionRegistry registry;

  /**
   * Default ctor.
   * @param registry A non-null registry.
   */
  public ExpressionEvaluator(final FunctionRegistry registry) {
    if (registry == null) {
      throw new IllegalArgumentException("Registry cannot be null.");
    }
    this.registry = registry;
  }

  /**
   * Evaluates a target that must produce a series list.
   * @param node A non-null call graph.
   * @param context The request context.
   * @return The series.
   * @throws EvaluationException if the target evaluates to something other
   * than a series list or a function failed.
   */
  @SuppressWarnings("unchecked")
  public List<NormalizedSeries> evaluate(final ExpressionNode node,
                                         final EvaluationContext context) {
    final Object result = evaluateArgument(node, context);
    if (!(result instanceof List)) {
      throw new EvaluationException(node.toString(),
          "target must evaluate to a series list");
    }
    return (List<NormalizedSeries>) result;
  }

  /**
   * Evaluates any node.
   * @param node A non-null node.
   * @param context The request context.
   * @return A series list for paths and calls, the value for literals.
   */
  public Object evaluateArgument(final ExpressionNode node,
                                 final EvaluationContext context) {
    if (node instanceof PathExpression) {
      return context.fetch(((PathExpression) node).pattern());
    }
    if (node instanceof Literal) {
      return ((Literal) node).value();
    }
    if (node instanceof FunctionCall) {
      return call((FunctionCall) node, context);
    }
    throw new IllegalArgumentException("Unknown node type: " + node.getClass());
  }

  /**
   * Collects every path expression under the nodes, in first seen order.
   * @param nodes The call graphs.
   * @return The unique patterns.
   */
  public static Set<String> collectPaths(final Collection<? extends ExpressionNode> nodes) {
    final Set<String> paths = Sets.newLinkedHashSet();
    for (final ExpressionNode node : nodes) {
      collectPaths(node, paths);
    }
    return paths;
  }

  private static void collectPaths(final ExpressionNode node,
                                   final Set<String> paths) {
    if (node instanceof PathExpression) {
      paths.add(((PathExpression) node).pattern());
    } else if (node instanceof FunctionCall) {
      for (final ExpressionNode arg : ((FunctionCall) node).arguments()) {
        collectPaths(arg, paths);
      }
    }
  }

  private List<NormalizedSeries> call(final FunctionCall call,
                                      final EvaluationContext context) {
    final SeriesFunction function = registry.get(call.name());
    if (function == null) {
      throw new EvaluationException(call.name(), "unknown function");
    }
    final List<Object> values;
    if (function.evaluatesOwnArguments()) {
      values = null;
    } else {
      values = Lists.newArrayListWithCapacity(call.arguments().size());
      for (final ExpressionNode arg : call.arguments()) {
        values.add(evaluateArgument(arg, context));
      }
    }
    final List<NormalizedSeries> result;
    try {
      result = function.evaluate(
          new FunctionArguments(call.name(), call.arguments(), values, this),
          context);
    } catch (QueryExecutionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EvaluationException(call.name(), "failed: " + e.getMessage(), e);
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Evaluated " + call + " to " + result.size() + " series");
    }
    return result;
  }
}
