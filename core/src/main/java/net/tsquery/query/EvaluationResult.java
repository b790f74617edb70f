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
package net.tsquery.query;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.tsquery.data.NormalizedSeries;

/**
 * The output of a render request: the series of each target keyed by the
 * target's canonical string in request order, plus the non-fatal errors
 * met along the way.
 *
 * @since 3.0
 */
public class EvaluationResult {

  private final Map<String, List<NormalizedSeries>> series;
  private final List<Exception> errors;
  private final int fetch_cycles;

  /**
   * Default ctor.
   * @param series The series per target in target order.
   * @param errors The non-fatal errors.
   * @param fetch_cycles The number of batched fetch cycles issued.
   */
  public EvaluationResult(final Map<String, List<NormalizedSeries>> series,
                          final List<Exception> errors,
                          final int fetch_cycles) {
    this.series = ImmutableMap.copyOf(series);
    this.errors = ImmutableList.copyOf(errors);
    this.fetch_cycles = fetch_cycles;
  }

  /** @return The series per target, in target order. */
  public Map<String, List<NormalizedSeries>> series() {
    return series;
  }

  /**
   * @param target The canonical string of a target.
   * @return The series or null if the target was not part of the request.
   */
  public List<NormalizedSeries> get(final String target) {
    return series.get(target);
  }

  /** @return The non-fatal errors. */
  public List<Exception> errors() {
    return errors;
  }

  /** @return True if any backend failed while serving the request. */
  public boolean isPartial() {
    return !errors.isEmpty();
  }

  /** @return The number of batched fetch cycles issued. */
  public int fetchCycles() {
    return fetch_cycles;
  }
}
