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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The time range of a render request and the optional target point count.
 *
 * @since 3.0
 */
public final class QueryWindow {

  private final long start;
  private final long end;
  private final int max_points;

  /**
   * Ctor without a point target.
   * @param start The inclusive start in seconds.
   * @param end The exclusive end in seconds.
   */
  public QueryWindow(final long start, final long end) {
    this(start, end, 0);
  }

  /**
   * Default ctor.
   * @param start The inclusive start in seconds.
   * @param end The exclusive end in seconds.
   * @param max_points The target point count, 0 for no limit.
   * @throws IllegalArgumentException if the range was empty or the point
   * count negative.
   */
  public QueryWindow(final long start, final long end, final int max_points) {
    if (start >= end) {
      throw new IllegalArgumentException("Start " + start
          + " must be before the end " + end);
    }
    if (max_points < 0) {
      throw new IllegalArgumentException("Max points cannot be negative: "
          + max_points);
    }
    this.start = start;
    this.end = end;
    this.max_points = max_points;
  }

  @JsonProperty("start")
  public long start() {
    return start;
  }

  @JsonProperty("end")
  public long end() {
    return end;
  }

  /** @return The point target or 0. */
  @JsonProperty("maxPoints")
  public int maxPoints() {
    return max_points;
  }

  /**
   * @param offset Seconds to add to both ends.
   * @return A shifted copy.
   */
  public QueryWindow shift(final long offset) {
    return new QueryWindow(start + offset, end + offset, max_points);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueryWindow)) {
      return false;
    }
    final QueryWindow other = (QueryWindow) o;
    return start == other.start && end == other.end
        && max_points == other.max_points;
  }

  @Override
  public int hashCode() {
    return (Long.hashCode(start) * 31 + Long.hashCode(end)) * 31 + max_points;
  }

  @Override
  public String toString() {
    return "QueryWindow{start=" + start + ", end=" + end + ", maxPoints="
        + max_points + "}";
  }
}
