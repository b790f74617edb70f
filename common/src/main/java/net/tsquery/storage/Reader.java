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
package net.tsquery.storage;

import net.tsquery.data.FetchResult;
import net.tsquery.data.IntervalSet;

/**
 * Reads the data for a single metric path from a backend. Implementations
 * must tolerate concurrent calls. Failures are reported by throwing any
 * runtime exception, the engine isolates them per leaf.
 *
 * @since 3.0
 */
public interface Reader {

  /**
   * Fetches the values within {@code [start, end)} at the backend's
   * native resolution.
   * @param start The inclusive start in seconds.
   * @param end The exclusive end in seconds.
   * @return A non-null result whose value count must equal the point count
   * of its time info.
   */
  public FetchResult fetch(final long start, final long end);

  /**
   * Fetches the values within {@code [start, end)}, allowing the backend
   * to pre-aggregate to at most {@code max_points} values. Only called for
   * readers whose finder is aggregating. Defaults to ignoring the hint.
   * @param start The inclusive start in seconds.
   * @param end The exclusive end in seconds.
   * @param max_points The target point count, 0 for no limit.
   * @return A non-null result.
   */
  public default FetchResult fetch(final long start,
                                   final long end,
                                   final int max_points) {
    return fetch(start, end);
  }

  /** @return The ranges for which the backend has data, never null. */
  public IntervalSet getIntervals();
}
