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

import java.util.List;

/**
 * The response of a single reader fetch: the grid the reader reported and
 * the values on that grid. The value count is NOT validated here, the
 * fetch planner checks it against {@link TimeInfo#pointCount()} and
 * treats a mismatch as a protocol violation.
 *
 * @since 3.0
 */
public class FetchResult {

  /** The grid reported by the backend. */
  private final TimeInfo time_info;

  /** The values, nulls for gaps. */
  private final List<Double> values;

  /**
   * Default ctor.
   * @param time_info The grid, may be null if the backend had nothing.
   * @param values The values, may be null if the backend had nothing.
   */
  public FetchResult(final TimeInfo time_info, final List<Double> values) {
    this.time_info = time_info;
    this.values = values;
  }

  /** @return The reported grid, may be null. */
  public TimeInfo timeInfo() {
    return time_info;
  }

  /** @return The values, may be null. */
  public List<Double> values() {
    return values;
  }

  @Override
  public String toString() {
    return "FetchResult{" + time_info + ", values="
        + (values == null ? "null" : values.size()) + "}";
  }
}
