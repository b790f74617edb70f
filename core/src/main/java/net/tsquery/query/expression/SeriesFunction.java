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

import net.tsquery.data.NormalizedSeries;

/**
 * A named transformation over series lists. Implementations are
 * stateless, never mutate their inputs and read the time window only
 * from the given context.
 *
 * @since 3.0
 */
public interface SeriesFunction {

  /**
   * @param args The arguments, evaluated unless
   * {@link #evaluatesOwnArguments()} returns true.
   * @param context The request context.
   * @return A non-null list of new series.
   * @throws net.tsquery.exceptions.EvaluationException if the arguments
   * violate the function's contract.
   */
  public List<NormalizedSeries> evaluate(final FunctionArguments args,
                                         final EvaluationContext context);

  /**
   * @return True if the function evaluates its arguments itself, e.g. to
   * use a different window. Defaults to false.
   */
  public default boolean evaluatesOwnArguments() {
    return false;
  }
}
