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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import net.tsquery.data.Interval;
import net.tsquery.data.MetricPath;

/**
 * A namespace query: a glob pattern plus an optional time window used to
 * prune leaves whose data cannot overlap it.
 *
 * @since 3.0
 */
public final class FindQuery {

  private final MetricPath pattern;
  private final Long start;
  private final Long end;

  private FindQuery(final Builder builder) {
    if (builder.pattern == null) {
      throw new IllegalArgumentException("Pattern cannot be null.");
    }
    if (builder.start != null && builder.end != null
        && builder.start >= builder.end) {
      throw new IllegalArgumentException("Start " + builder.start
          + " must be before the end " + builder.end);
    }
    pattern = builder.pattern;
    start = builder.start;
    end = builder.end;
  }

  /** @return The pattern. */
  @JsonProperty("pattern")
  public MetricPath pattern() {
    return pattern;
  }

  /** @return The optional start in seconds. */
  @JsonProperty("startTime")
  public Long startTime() {
    return start;
  }

  /** @return The optional end in seconds. */
  @JsonProperty("endTime")
  public Long endTime() {
    return end;
  }

  /** @return True if either end of the window was given. */
  @JsonIgnore
  public boolean hasTimeWindow() {
    return start != null || end != null;
  }

  /** @return The window with unbounded ends open. */
  @JsonIgnore
  public Interval interval() {
    return new Interval(start == null ? Long.MIN_VALUE : start,
                        end == null ? Long.MAX_VALUE : end);
  }

  /** @return True if the pattern has no glob syntax. */
  @JsonIgnore
  public boolean isExact() {
    return !pattern.isPattern();
  }

  @Override
  public String toString() {
    return "FindQuery{pattern=" + pattern + ", start=" + start
        + ", end=" + end + "}";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private MetricPath pattern;
    private Long start;
    private Long end;

    public Builder setPattern(final String pattern) {
      this.pattern = MetricPath.of(pattern);
      return this;
    }

    public Builder setPattern(final MetricPath pattern) {
      this.pattern = pattern;
      return this;
    }

    public Builder setStartTime(final Long start) {
      this.start = start;
      return this;
    }

    public Builder setEndTime(final Long end) {
      this.end = end;
      return this;
    }

    public FindQuery build() {
      return new FindQuery(this);
    }
  }
}
