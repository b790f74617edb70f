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

import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.Sets;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.exceptions.EvaluationException;

/**
 * Helpers for the display names of function output.
 *
 * @since 3.0
 */
public final class SeriesNames {
  private static final Joiner COMMA = Joiner.on(',');
  private static final Splitter DOT = Splitter.on('.');

  private SeriesNames() {
    // static helpers
  }

  /**
   * Renders a call shaped name.
   * @param function The function name.
   * @param args The rendered arguments.
   * @return E.g. {@code scale(a.b,2)}.
   */
  public static String call(final String function, final Object... args) {
    return function + "(" + COMMA.join(args) + ")";
  }

  /**
   * @param series The input series.
   * @return The sorted unique path expressions of the series joined by a
   * comma.
   */
  public static String pathExpressions(final Collection<NormalizedSeries> series) {
    final Set<String> expressions = Sets.newTreeSet();
    for (final NormalizedSeries s : series) {
      expressions.add(s.pathExpression());
    }
    return COMMA.join(expressions);
  }

  /**
   * Formats a number without a trailing ".0" when it is integral.
   * @param value A value.
   * @return The rendered value.
   */
  public static String number(final double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value)
        && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  /**
   * Extracts the dotted metric from a name that may be wrapped in
   * function calls, e.g. {@code a.b.c} from {@code scale(a.b.c,2)}.
   * @param name A display name.
   * @return The dotted metric.
   */
  public static String metric(final String name) {
    String metric = name;
    final int open = metric.lastIndexOf('(');
    if (open >= 0) {
      metric = metric.substring(open + 1);
    }
    for (int i = 0; i < metric.length(); i++) {
      final char c = metric.charAt(i);
      if (c == ',' || c == ')') {
        return metric.substring(0, i);
      }
    }
    return metric;
  }

  /**
   * @param name A display name.
   * @return The segments of the dotted metric in the name.
   */
  public static List<String> nodes(final String name) {
    return DOT.splitToList(metric(name));
  }

  /**
   * Resolves a node index that may count from the end.
   * @param function The function name for errors.
   * @param nodes The segments.
   * @param index The index, negative values count from the end.
   * @return The segment.
   */
  static String node(final String function,
                     final List<String> nodes,
                     final int index) {
    final int resolved = index < 0 ? nodes.size() + index : index;
    if (resolved < 0 || resolved >= nodes.size()) {
      throw new EvaluationException(function,
          "node " + index + " is out of range for " + Joiner.on('.').join(nodes));
    }
    return nodes.get(resolved);
  }
}
