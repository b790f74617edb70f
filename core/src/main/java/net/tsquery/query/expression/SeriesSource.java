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
import java.util.Map;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.query.QueryWindow;

/**
 * Runs the find, fetch and align cycle for a batch of path expressions.
 * Implementations must record non-fatal errors in the given list and only
 * throw for request level failures.
 *
 * @since 3.0
 */
public interface SeriesSource {

  /**
   * @param path_expressions The non-empty expressions to resolve.
   * @param window The window to fetch.
   * @param deadline_ns The request deadline from {@link System#nanoTime()}.
   * @param errors A list to append non-fatal errors to.
   * @return The series per expression, sorted by path. Every expression
   * is present, possibly with an empty list.
   */
  public Map<String, List<NormalizedSeries>> fetch(
      final Collection<String> path_expressions,
      final QueryWindow window,
      final long deadline_ns,
      final List<Exception> errors);
}
