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
package net.tsquery.query.processor.align;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.Lists;
import com.google.common.math.LongMath;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.data.TimeInfo;

/**
 * Places series of differing step, start and end onto one common grid.
 * <p>
 * The grid step is the least common multiple of the input steps. When
 * that exceeds the configured maximum the largest input step is used.
 * The grid start is the earliest input start rounded down to a multiple
 * of the step and the end is the latest input end rounded up.
 * <p>
 * Series finer than the grid are consolidated into each cell with their
 * own consolidation function, taking every point whose timestamp falls in
 * the cell. Series coarser than the grid repeat each value across the
 * cells it covers. Cells without data are gaps.
 *
 * @since 3.0
 */
public class SeriesAligner {

  /** The cap on the grid step in seconds. */
  private final long max_step;

  /**
   * Default ctor.
   * @param max_step The cap on the LCM grid step, greater than 0.
   */
  public SeriesAligner(final long max_step) {
    if (max_step <= 0) {
      throw new IllegalArgumentException("Max step must be greater than "
          + "zero: " + max_step);
    }
    this.max_step = max_step;
  }

  /**
   * Aligns the series on the common grid. Series that already share
   * step, start and end are returned as is.
   * @param series A non-null list.
   * @return The aligned series in the same order.
   */
  public List<NormalizedSeries> align(final List<NormalizedSeries> series) {
    if (series.size() < 2 || isAligned(series)) {
      return series;
    }
    return alignTo(series, gridStep(series));
  }

  /**
   * Aligns the series on a grid with the given step.
   * @param series A non-null list.
   * @param step The grid step, greater than 0.
   * @return The aligned series in the same order.
   */
  public List<NormalizedSeries> alignTo(final List<NormalizedSeries> series,
                                        final long step) {
    if (series.isEmpty()) {
      return series;
    }
    long start = Long.MAX_VALUE;
    long end = Long.MIN_VALUE;
    for (final NormalizedSeries s : series) {
      start = Math.min(start, s.timeInfo().start());
      end = Math.max(end, s.timeInfo().end());
    }
    final TimeInfo grid = new TimeInfo(Math.floorDiv(start, step) * step,
        -Math.floorDiv(-end, step) * step, step);
    final List<NormalizedSeries> aligned = Lists.newArrayListWithCapacity(series.size());
    for (final NormalizedSeries s : series) {
      aligned.add(resample(s, grid));
    }
    return aligned;
  }

  /**
   * Places one series on the grid.
   * @param series A non-null series.
   * @param grid The target grid.
   * @return The series on the grid, the same instance if already there.
   */
  public static NormalizedSeries resample(final NormalizedSeries series,
                                          final TimeInfo grid) {
    final TimeInfo native_ti = series.timeInfo();
    if (native_ti.equals(grid)) {
      return series;
    }
    final Double[] values = new Double[grid.pointCount()];
    final long native_step = native_ti.step();
    final long step = grid.step();
    for (int i = 0; i < values.length; i++) {
      final long cell = grid.timestamp(i);
      if (native_step > step) {
        final int idx = native_ti.indexOf(cell);
        if (idx >= 0 && idx < series.size()) {
          values[i] = series.value(idx);
        }
      } else {
        final int from = Math.max(0, ceilIndex(native_ti, cell));
        final int to = Math.min(series.size(), ceilIndex(native_ti, cell + step));
        if (from < to) {
          values[i] = series.consolidationFunction().reduce(
              series.values(), from, to);
        }
      }
    }
    return NormalizedSeries.newBuilder(series)
        .setTimeInfo(grid)
        .setValues(Arrays.asList(values))
        .build();
  }

  /**
   * @param series The series.
   * @return The LCM of the steps or the largest step if the LCM is over
   * the cap.
   */
  public long gridStep(final List<NormalizedSeries> series) {
    long lcm = 1;
    long largest = 1;
    boolean capped = false;
    for (final NormalizedSeries s : series) {
      final long step = s.timeInfo().step();
      largest = Math.max(largest, step);
      if (!capped) {
        final long gcd = LongMath.gcd(lcm, step);
        final long next = (lcm / gcd) * step;
        if (next / step != lcm / gcd || next > max_step) {
          capped = true;
        } else {
          lcm = next;
        }
      }
    }
    return capped ? largest : lcm;
  }

  /**
   * @param series A non-null list.
   * @return True if every series shares the first one's grid.
   */
  public static boolean isAligned(final List<NormalizedSeries> series) {
    if (series.isEmpty()) {
      return true;
    }
    final TimeInfo first = series.get(0).timeInfo();
    for (int i = 1; i < series.size(); i++) {
      if (!first.equals(series.get(i).timeInfo())) {
        return false;
      }
    }
    return true;
  }

  /** @return The index of the first native point at or after the time. */
  private static int ceilIndex(final TimeInfo time_info, final long timestamp) {
    return (int) -Math.floorDiv(-(timestamp - time_info.start()),
        time_info.step());
  }
}
