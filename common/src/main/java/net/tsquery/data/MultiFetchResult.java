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
package net.tsquery.data;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The response of a batched fetch: one grid shared by every path in the
 * batch and the values keyed by path. Paths missing from the map are
 * treated as all-gap by the fetch planner.
 *
 * @since 3.0
 */
public class MultiFetchResult {

  private final TimeInfo time_info;
  private final Map<String, List<Double>> values;

  /**
   * Default ctor.
   * @param time_info The shared grid, may be null if nothing was found.
   * @param values The values keyed by path, may be null.
   */
  public MultiFetchResult(final TimeInfo time_info,
                          final Map<String, List<Double>> values) {
    this.time_info = time_info;
    this.values = values == null
        ? Collections.<String, List<Double>>emptyMap() : values;
  }

  /** @return The shared grid, may be null. */
  public TimeInfo timeInfo() {
    return time_info;
  }

  /** @return The non-null map of path to values. */
  public Map<String, List<Double>> values() {
    return values;
  }
}
