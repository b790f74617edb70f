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

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.exceptions.EvaluationException;

/**
 * The arguments of one function call with typed accessors. Every accessor
 * throws an {@link EvaluationException} naming the function when an
 * argument is missing or of the wrong type.
 *
 * @since 3.0
 */
public class FunctionArguments {

  /** The function name for errors. */
  private final String function;

  /** The argument nodes. */
  private final List<ExpressionNode> nodes;

  /** The evaluated values, null for lazily evaluated functions. */
  private final List<Object> values;

  /** The evaluator for lazy arguments. */
  private final ExpressionEvaluator evaluator;

  /**
   * Default ctor.
   * @param function The function name.
   * @param nodes The argument nodes.
   * @param values The evaluated values or null if evaluation is deferred.
   * @param evaluator The evaluator to use for deferred arguments.
   */
  public FunctionArguments(final String function,
                           final List<ExpressionNode> nodes,
                           final List<Object> values,
                           final ExpressionEvaluator evaluator) {
    this.function = function;
    this.nodes = nodes;
    this.values = values;
    this.evaluator = evaluator;
  }

  /** @return The function name. */
  public String function() {
    return function;
  }

  /** @return The number of arguments given. */
  public int size() {
    return nodes.size();
  }

  /**
   * @param min The minimum count.
   * @param max The maximum count, or -1 for no maximum.
   * @throws EvaluationException if the count was outside the range.
   */
  public void requireCount(final int min, final int max) {
    if (nodes.size() < min || (max >= 0 && nodes.size() > max)) {
      throw new EvaluationException(function, "expected "
          + (max < 0 ? "at least " + min
              : min == max ? String.valueOf(min) : min + " to " + max)
          + " arguments but got " + nodes.size());
    }
  }

  /**
   * @param index The argument index.
   * @return The argument node.
   */
  public ExpressionNode node(final int index) {
    require(index);
    return nodes.get(index);
  }

  /**
   * @param index The argument index.
   * @return The evaluated argument, may be null. When the function
   * evaluates its own arguments only literals are available here.
   */
  public Object value(final int index) {
    require(index);
    if (values == null) {
      final ExpressionNode node = nodes.get(index);
      if (node instanceof Literal) {
        return ((Literal) node).value();
      }
      throw new IllegalStateException("Argument " + (index + 1) + " of "
          + function + " is evaluated by the function.");
    }
    return values.get(index);
  }

  /**
   * @param index The argument index.
   * @return The series list at the index.
   */
  @SuppressWarnings("unchecked")
  public List<NormalizedSeries> seriesList(final int index) {
    final Object value = value(index);
    if (!(value instanceof List)) {
      throw new EvaluationException(function, "argument " + (index + 1)
          + " must be a series list but was " + describe(value));
    }
    return (List<NormalizedSeries>) value;
  }

  /**
   * @param from The first index.
   * @return Every series list from the index on, concatenated.
   */
  public List<NormalizedSeries> seriesLists(final int from) {
    final ImmutableList.Builder<NormalizedSeries> all = ImmutableList.builder();
    for (int i = from; i < nodes.size(); i++) {
      all.addAll(seriesList(i));
    }
    return all.build();
  }

  /**
   * Evaluates a deferred argument in the given context.
   * @param index The argument index.
   * @param context The context, e.g. with a shifted window.
   * @return The series list.
   */
  public List<NormalizedSeries> evaluateSeriesList(final int index,
                                                   final EvaluationContext context) {
    final Object value = evaluator.evaluateArgument(node(index), context);
    if (!(value instanceof List)) {
      throw new EvaluationException(function, "argument " + (index + 1)
          + " must be a series list but was " + describe(value));
    }
    @SuppressWarnings("unchecked")
    final List<NormalizedSeries> series = (List<NormalizedSeries>) value;
    return series;
  }

  /**
   * @param index The argument index.
   * @return The numeric argument.
   */
  public double number(final int index) {
    final Object value = value(index);
    if (!(value instanceof Number)) {
      throw new EvaluationException(function, "argument " + (index + 1)
          + " must be a number but was " + describe(value));
    }
    return ((Number) value).doubleValue();
  }

  /**
   * @param index The argument index.
   * @param default_value Returned when the argument is absent or null.
   * @return The numeric argument.
   */
  public Double number(final int index, final Double default_value) {
    if (index >= nodes.size() || value(index) == null) {
      return default_value;
    }
    return number(index);
  }

  /**
   * @param index The argument index.
   * @return The integral argument.
   */
  public int integer(final int index) {
    final double value = number(index);
    if (value != Math.rint(value)) {
      throw new EvaluationException(function, "argument " + (index + 1)
          + " must be an integer but was " + value);
    }
    return (int) value;
  }

  /**
   * @param index The argument index.
   * @param default_value Returned when the argument is absent.
   * @return The integral argument.
   */
  public int integer(final int index, final int default_value) {
    return index >= nodes.size() ? default_value : integer(index);
  }

  /**
   * @param index The argument index.
   * @return The string argument.
   */
  public String string(final int index) {
    final Object value = value(index);
    if (!(value instanceof String)) {
      throw new EvaluationException(function, "argument " + (index + 1)
          + " must be a string but was " + describe(value));
    }
    return (String) value;
  }

  /**
   * @param index The argument index.
   * @param default_value Returned when the argument is absent.
   * @return The string argument.
   */
  public String string(final int index, final String default_value) {
    return index >= nodes.size() ? default_value : string(index);
  }

  /**
   * @param index The argument index.
   * @param default_value Returned when the argument is absent.
   * @return The boolean argument.
   */
  public boolean bool(final int index, final boolean default_value) {
    if (index >= nodes.size()) {
      return default_value;
    }
    final Object value = value(index);
    if (!(value instanceof Boolean)) {
      throw new EvaluationException(function, "argument " + (index + 1)
          + " must be a boolean but was " + describe(value));
    }
    return (Boolean) value;
  }

  /**
   * @param from The first index.
   * @return The integral arguments from the index on.
   */
  public List<Integer> integers(final int from) {
    final ImmutableList.Builder<Integer> ints = ImmutableList.builder();
    for (int i = from; i < nodes.size(); i++) {
      ints.add(integer(i));
    }
    return ints.build();
  }

  private void require(final int index) {
    if (index < 0 || index >= nodes.size()) {
      throw new EvaluationException(function, "missing argument "
          + (index + 1));
    }
  }

  private static String describe(final Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof List) {
      return "a series list";
    }
    return value.getClass().getSimpleName() + " " + value;
  }
}
