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
package net.tsquery.query.fetch;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.tsquery.data.RawSeries;

/**
 * One {@link RawSeries} per requested leaf, keyed by path in the order
 * the leaves were given, plus the non-fatal errors raised while fetching.
 *
 * @since 3.0
 */
public class FetchResults {

  private final Map<String, RawSeries> series;
  private final List<Exception> errors;

  /**
   * Default ctor.
   * @param series The series keyed by path.
   * @param errors The errors, may be null.
   */
  public FetchResults(final Map<String, RawSeries> series,
                      final List<Exception> errors) {
    this.series = ImmutableMap.copyOf(series);
    this.errors = errors == null ? Collections.<Exception>emptyList()
        : ImmutableList.copyOf(errors);
  }

  /** @return The series keyed by leaf path. */
  public Map<String, RawSeries> series() {
    return series;
  }

  /**
   * @param path A leaf path.
   * @return The series or null if the path was not requested.
   */
  public RawSeries get(final String path) {
    return series.get(path);
  }

  /** @return The non-fatal errors. */
  public List<Exception> errors() {
    return errors;
  }
}
