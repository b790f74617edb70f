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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A half-open range of Unix epoch seconds, {@code [start, end)}. An
 * interval is never empty, attempting to build one with
 * {@code start >= end} throws. Unbounded ends are represented with
 * {@link Long#MIN_VALUE} and {@link Long#MAX_VALUE}.
 *
 * @since 3.0
 */
public final class Interval implements Comparable<Interval> {

  /** An interval covering all representable time. */
  public static final Interval ALL = new Interval(Long.MIN_VALUE, Long.MAX_VALUE);

  /** The inclusive start. */
  private final long start;

  /** The exclusive end. */
  private final long end;

  /**
   * Default ctor.
   * @param start The inclusive start timestamp in seconds.
   * @param end The exclusive end timestamp in seconds.
   * @throws IllegalArgumentException if the start is not before the end.
   */
  public Interval(final long start, final long end) {
    if (start >= end) {
      throw new IllegalArgumentException("Interval start " + start
          + " must be less than the end " + end);
    }
    this.start = start;
    this.end = end;
  }

  /**
   * Helper that returns null instead of throwing when the range would be
   * empty.
   * @param start The inclusive start.
   * @param end The exclusive end.
   * @return An interval or null if {@code start >= end}.
   */
  public static Interval ofNullable(final long start, final long end) {
    return start < end ? new Interval(start, end) : null;
  }

  /** @return The inclusive start in seconds. */
  @JsonProperty("start")
  public long start() {
    return start;
  }

  /** @return The exclusive end in seconds. */
  @JsonProperty("end")
  public long end() {
    return end;
  }

  /** @return The number of seconds covered, saturated at Long.MAX_VALUE. */
  public long size() {
    final long size = end - start;
    // overflow when both ends are unbounded-ish
    return size < 0 ? Long.MAX_VALUE : size;
  }

  /**
   * @param timestamp A timestamp in seconds.
   * @return True if the timestamp is within {@code [start, end)}.
   */
  public boolean contains(final long timestamp) {
    return timestamp >= start && timestamp < end;
  }

  /**
   * @param other A non-null interval.
   * @return True if the other interval lies entirely within this one.
   */
  public boolean covers(final Interval other) {
    return other.start >= start && other.end <= end;
  }

  /**
   * @param other A non-null interval.
   * @return True if the two intervals share at least one second.
   */
  public boolean overlaps(final Interval other) {
    return start < other.end && other.start < end;
  }

  /**
   * @param other A non-null interval.
   * @return True if the intervals overlap or one ends exactly where the
   * other starts.
   */
  public boolean overlapsOrTouches(final Interval other) {
    return start <= other.end && other.start <= end;
  }

  /**
   * @param other A non-null interval.
   * @return The overlapping range or null if the intervals do not overlap.
   */
  public Interval intersect(final Interval other) {
    return ofNullable(Math.max(start, other.start), Math.min(end, other.end));
  }

  /**
   * Merges the two intervals.
   * @param other A non-null interval that overlaps or touches this one.
   * @return The smallest interval covering both.
   * @throws IllegalArgumentException if the two are disjoint.
   */
  public Interval union(final Interval other) {
    if (!overlapsOrTouches(other)) {
      throw new IllegalArgumentException("Cannot union disjoint intervals "
          + this + " and " + other);
    }
    return new Interval(Math.min(start, other.start), Math.max(end, other.end));
  }

  @Override
  public int compareTo(final Interval other) {
    final int cmp = Long.compare(start, other.start);
    return cmp != 0 ? cmp : Long.compare(end, other.end);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Interval)) {
      return false;
    }
    final Interval other = (Interval) o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(start) * 31 + Long.hashCode(end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
