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
package net.tsquery.query.expression.functions;

import java.util.List;

/**
 * Gap aware statistics over a whole series. Each returns null when every
 * value is a gap.
 *
 * @since 3.0
 */
public final class SeriesStats {

  private SeriesStats() {
    // static helpers
  }

  public static Double max(final List<Double> values) {
    Double max = null;
    for (final Double value : values) {
      if (value != null && (max == null || value > max)) {
        max = value;
      }
    }
    return max;
  }

  public static Double min(final List<Double> values) {
    Double min = null;
    for (final Double value : values) {
      if (value != null && (min == null || value < min)) {
        min = value;
      }
    }
    return min;
  }

  public static Double sum(final List<Double> values) {
    double sum = 0;
    boolean any = false;
    for (final Double value : values) {
      if (value != null) {
        sum += value;
        any = true;
      }
    }
    return any ? sum : null;
  }

  public static Double average(final List<Double> values) {
    double sum = 0;
    int count = 0;
    for (final Double value : values) {
      if (value != null) {
        sum += value;
        count++;
      }
    }
    return count == 0 ? null : sum / count;
  }

  /** @return The last non-gap value. */
  public static Double last(final List<Double> values) {
    for (int i = values.size() - 1; i >= 0; i--) {
      if (values.get(i) != null) {
        return values.get(i);
      }
    }
    return null;
  }

  /** Compares nullable statistics with gaps ordered first. */
  static int compare(final Double a, final Double b) {
    if (a == null) {
      return b == null ? 0 : -1;
    }
    if (b == null) {
      return 1;
    }
    return Double.compare(a, b);
  }
}
