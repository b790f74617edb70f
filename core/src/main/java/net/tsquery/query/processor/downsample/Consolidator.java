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
package net.tsquery.query.processor.downsample;

import java.util.Arrays;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.data.TimeInfo;

/**
 * Lowers the resolution of a series to at most a target number of points.
 * <p>
 * With {@code n} native points, each bucket holds
 * {@code ceil(n / max_points)} points and there are
 * {@code ceil(n / bucket_size)} buckets anchored at the series start, so
 * the last bucket may be shorter. Each bucket is reduced with the
 * series' consolidation function and the new step is the native step
 * times the bucket size. Series already within the target are returned
 * unchanged.
 *
 * @since 3.0
 */
public final class Consolidator {

  private Consolidator() { }

  /**
   * @param series A non-null series.
   * @param max_points The target, 0 or less for no limit.
   * @return The consolidated series or the input if no reduction was
   * needed.
   */
  public static NormalizedSeries consolidate(final NormalizedSeries series,
                                             final int max_points) {
    final int n = series.size();
    if (max_points <= 0 || n <= max_points) {
      return series;
    }
    final int bucket_size = bucketSize(n, max_points);
    final int buckets = (n + bucket_size - 1) / bucket_size;
    final Double[] values = new Double[buckets];
    for (int i = 0; i < buckets; i++) {
      values[i] = series.consolidationFunction().reduce(series.values(),
          i * bucket_size, Math.min(n, (i + 1) * bucket_size));
    }
    final TimeInfo native_ti = series.timeInfo();
    return NormalizedSeries.newBuilder(series)
        .setTimeInfo(new TimeInfo(native_ti.start(), native_ti.end(),
            native_ti.step() * bucket_size))
        .setValues(Arrays.asList(values))
        .build();
  }

  /**
   * @param points The native point count.
   * @param max_points The target, greater than 0.
   * @return The number of native points per bucket.
   */
  public static int bucketSize(final int points, final int max_points) {
    return (points + max_points - 1) / max_points;
  }
}
