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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;

/**
 * A series of values on a regular grid as returned by a backend. Gaps
 * are nulls and are positional, i.e. the number of values always equals
 * {@link TimeInfo#pointCount()} even when the backend had no data.
 * Instances are immutable once built.
 *
 * @since 3.0
 */
public class RawSeries {

  /** The resolved metric path. */
  protected final String path;

  /** The grid. */
  protected final TimeInfo time_info;

  /** The immutable values. */
  protected final List<Double> values;

  /**
   * Default ctor.
   * @param path A non-null and non-empty path.
   * @param time_info A non-null grid.
   * @param values A non-null list of values, copied.
   * @throws IllegalArgumentException if a param was null or the value
   * count did not match the grid.
   */
  public RawSeries(final String path,
                   final TimeInfo time_info,
                   final List<Double> values) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    if (time_info == null) {
      throw new IllegalArgumentException("Time info cannot be null.");
    }
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    if (values.size() != time_info.pointCount()) {
      throw new IllegalArgumentException("Series " + path + " has "
          + values.size() + " values but the grid " + time_info
          + " requires " + time_info.pointCount());
    }
    this.path = path;
    this.time_info = time_info;
    this.values = Collections.unmodifiableList(
        Arrays.asList(values.toArray(new Double[values.size()])));
  }

  /**
   * Builds a series of nothing but gaps.
   * @param path A non-null path.
   * @param time_info A non-null grid.
   * @return A non-null series.
   */
  public static RawSeries allGaps(final String path, final TimeInfo time_info) {
    return new RawSeries(path, time_info,
        Arrays.asList(new Double[time_info.pointCount()]));
  }

  /** @return The resolved metric path. */
  @JsonProperty("path")
  public String path() {
    return path;
  }

  /** @return The grid. */
  @JsonProperty("timeInfo")
  public TimeInfo timeInfo() {
    return time_info;
  }

  /** @return The immutable values with nulls for gaps. */
  @JsonProperty("values")
  public List<Double> values() {
    return values;
  }

  /** @return The number of points. */
  public int size() {
    return values.size();
  }

  /**
   * @param index The point index.
   * @return The value or null for a gap.
   */
  public Double value(final int index) {
    return values.get(index);
  }

  /**
   * @param index The point index.
   * @return True if the point is a gap.
   */
  public boolean isGap(final int index) {
    return values.get(index) == null;
  }

  /** @return True if every point is a gap, including an empty series. */
  @JsonIgnore
  public boolean isAllGaps() {
    for (final Double value : values) {
      if (value != null) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || o.getClass() != getClass()) {
      return false;
    }
    final RawSeries other = (RawSeries) o;
    return path.equals(other.path)
        && time_info.equals(other.time_info)
        && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return (path.hashCode() * 31 + time_info.hashCode()) * 31
        + values.hashCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{path=" + path + ", " + time_info
        + ", values=" + values + "}";
  }
}
