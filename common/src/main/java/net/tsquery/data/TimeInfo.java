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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Describes the regular grid of a fetched series: the start and end
 * timestamps and the step between points, all in seconds. Point
 * {@code i} covers {@code [start + i * step, start + (i + 1) * step)}
 * and a series on this grid must have exactly {@link #pointCount()}
 * values.
 *
 * @since 3.0
 */
public final class TimeInfo {

  /** The inclusive start. */
  private final long start;

  /** The exclusive end. */
  private final long end;

  /** The step between points. */
  private final long step;

  /**
   * Default ctor.
   * @param start The start timestamp in seconds.
   * @param end The end timestamp in seconds, must be >= start.
   * @param step The step in seconds, must be > 0.
   * @throws IllegalArgumentException if the step or range were invalid.
   */
  public TimeInfo(final long start, final long end, final long step) {
    if (step <= 0) {
      throw new IllegalArgumentException("Step must be greater than zero: "
          + step);
    }
    if (end < start) {
      throw new IllegalArgumentException("End " + end
          + " cannot be less than the start " + start);
    }
    this.start = start;
    this.end = end;
    this.step = step;
  }

  /** @return The start in seconds. */
  @JsonProperty("start")
  public long start() {
    return start;
  }

  /** @return The end in seconds. */
  @JsonProperty("end")
  public long end() {
    return end;
  }

  /** @return The step in seconds. */
  @JsonProperty("step")
  public long step() {
    return step;
  }

  /** @return The number of points, {@code ceil((end - start) / step)}. */
  @JsonIgnore
  public int pointCount() {
    return pointCount(start, end, step);
  }

  /**
   * @param index A point index.
   * @return The timestamp at which the point starts.
   */
  public long timestamp(final int index) {
    return start + index * step;
  }

  /**
   * @param timestamp A timestamp in seconds.
   * @return The index of the point covering the timestamp. May be
   * negative or beyond the point count if the timestamp is outside the
   * grid.
   */
  public int indexOf(final long timestamp) {
    return (int) Math.floorDiv(timestamp - start, step);
  }

  /** @return The covered range or null if the grid is empty. */
  @JsonIgnore
  public Interval interval() {
    return Interval.ofNullable(start, start + pointCount() * step);
  }

  /**
   * @param start The start in seconds.
   * @param end The end in seconds.
   * @param step The step in seconds.
   * @return The ceiling of the range over the step.
   */
  public static int pointCount(final long start,
                               final long end,
                               final long step) {
    if (end <= start) {
      return 0;
    }
    return (int) ((end - start + step - 1) / step);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeInfo)) {
      return false;
    }
    final TimeInfo other = (TimeInfo) o;
    return start == other.start && end == other.end && step == other.step;
  }

  @Override
  public int hashCode() {
    return (Long.hashCode(start) * 31 + Long.hashCode(end)) * 31
        + Long.hashCode(step);
  }

  @Override
  public String toString() {
    return "TimeInfo{start=" + start + ", end=" + end + ", step=" + step + "}";
  }
}
