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

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * An immutable, sorted list of non-overlapping and non-adjacent
 * {@link Interval}s describing where a backend has data. Every mutation
 * returns a new set with overlapping or touching members merged. An
 * empty set is valid and means no data is available.
 *
 * @since 3.0
 */
public final class IntervalSet implements Iterable<Interval> {

  /** The empty set. */
  public static final IntervalSet EMPTY =
      new IntervalSet(ImmutableList.<Interval>of());

  /** The normalized intervals. */
  private final List<Interval> intervals;

  /**
   * Private ctor, the list must be normalized already.
   * @param intervals The normalized list.
   */
  private IntervalSet(final List<Interval> intervals) {
    this.intervals = intervals;
  }

  /**
   * Builds a set from the given intervals, merging as needed. Null
   * entries are skipped.
   * @param intervals A collection of intervals, may be null or empty.
   * @return A non-null set.
   */
  public static IntervalSet of(final Collection<Interval> intervals) {
    if (intervals == null || intervals.isEmpty()) {
      return EMPTY;
    }
    final List<Interval> sorted = Lists.newArrayListWithCapacity(intervals.size());
    for (final Interval interval : intervals) {
      if (interval != null) {
        sorted.add(interval);
      }
    }
    Collections.sort(sorted);
    return new IntervalSet(merge(sorted));
  }

  /**
   * @param intervals Zero or more intervals.
   * @return A non-null set.
   */
  public static IntervalSet of(final Interval... intervals) {
    return of(Lists.newArrayList(intervals));
  }

  /**
   * Returns a set with the range added. Empty ranges are discarded.
   * @param start The inclusive start.
   * @param end The exclusive end.
   * @return A non-null set, this one if the range was empty.
   */
  public IntervalSet with(final long start, final long end) {
    final Interval interval = Interval.ofNullable(start, end);
    return interval == null ? this : with(interval);
  }

  /**
   * Returns a set with the interval merged in.
   * @param interval A non-null interval.
   * @return A non-null set.
   */
  public IntervalSet with(final Interval interval) {
    final List<Interval> merged = Lists.newArrayList(intervals);
    merged.add(interval);
    return of(merged);
  }

  /**
   * @param other A non-null set.
   * @return The union of both sets.
   */
  public IntervalSet union(final IntervalSet other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    final List<Interval> merged = Lists.newArrayList(intervals);
    merged.addAll(other.intervals);
    return of(merged);
  }

  /**
   * @param other A non-null set.
   * @return The ranges present in both sets.
   */
  public IntervalSet intersect(final IntervalSet other) {
    final List<Interval> result = Lists.newArrayList();
    int i = 0;
    int j = 0;
    while (i < intervals.size() && j < other.intervals.size()) {
      final Interval a = intervals.get(i);
      final Interval b = other.intervals.get(j);
      final Interval overlap = a.intersect(b);
      if (overlap != null) {
        result.add(overlap);
      }
      if (a.end() < b.end()) {
        i++;
      } else {
        j++;
      }
    }
    return result.isEmpty() ? EMPTY : new IntervalSet(ImmutableList.copyOf(result));
  }

  /**
   * @param interval A non-null interval.
   * @return The portions of this set within the interval.
   */
  public IntervalSet intersect(final Interval interval) {
    return intersect(of(interval));
  }

  /**
   * @param interval A non-null interval.
   * @return True if any member overlaps the interval.
   */
  public boolean overlaps(final Interval interval) {
    for (final Interval member : intervals) {
      if (member.overlaps(interval)) {
        return true;
      }
      if (member.start() >= interval.end()) {
        break;
      }
    }
    return false;
  }

  /**
   * @param interval A non-null interval.
   * @return True if a single member covers the whole interval. Since
   * members never touch, that is the only way the set can cover it.
   */
  public boolean covers(final Interval interval) {
    for (final Interval member : intervals) {
      if (member.covers(interval)) {
        return true;
      }
    }
    return false;
  }

  /**
   * @param interval A non-null interval.
   * @return The number of seconds of the interval covered by this set.
   */
  public long coverage(final Interval interval) {
    return intersect(interval).size();
  }

  /** @return The total number of seconds covered, saturated. */
  public long size() {
    long total = 0;
    for (final Interval interval : intervals) {
      total += interval.size();
      if (total < 0) {
        return Long.MAX_VALUE;
      }
    }
    return total;
  }

  /** @return True if no intervals are present. */
  public boolean isEmpty() {
    return intervals.isEmpty();
  }

  /** @return The immutable, sorted list of members. */
  @JsonProperty("intervals")
  public List<Interval> intervals() {
    return intervals;
  }

  @Override
  public Iterator<Interval> iterator() {
    return intervals.iterator();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IntervalSet)) {
      return false;
    }
    return intervals.equals(((IntervalSet) o).intervals);
  }

  @Override
  public int hashCode() {
    return intervals.hashCode();
  }

  @Override
  public String toString() {
    return "IntervalSet" + intervals;
  }

  /**
   * Merges a sorted list in a single pass.
   * @param sorted The sorted list.
   * @return An immutable merged list.
   */
  private static List<Interval> merge(final List<Interval> sorted) {
    final ImmutableList.Builder<Interval> builder = ImmutableList.builder();
    Interval current = null;
    for (final Interval interval : sorted) {
      if (current == null) {
        current = interval;
      } else if (current.overlapsOrTouches(interval)) {
        current = current.union(interval);
      } else {
        builder.add(current);
        current = interval;
      }
    }
    if (current != null) {
      builder.add(current);
    }
    return builder.build();
  }
}
