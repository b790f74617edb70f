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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.util.Arrays;

import org.junit.Test;

import net.tsquery.data.ConsolidationFunction;
import net.tsquery.data.NormalizedSeries;
import net.tsquery.data.TimeInfo;

public class TestConsolidator {

  @Test
  public void withinTarget() throws Exception {
    final NormalizedSeries series = series(10, ConsolidationFunction.AVG);
    assertSame(series, Consolidator.consolidate(series, 10));
    assertSame(series, Consolidator.consolidate(series, 0));
  }

  @Test
  public void evenBuckets() throws Exception {
    final NormalizedSeries series = series(60, ConsolidationFunction.AVG);
    final NormalizedSeries consolidated = Consolidator.consolidate(series, 10);
    assertEquals(10, consolidated.size());
    assertEquals(new TimeInfo(0, 3600, 360), consolidated.timeInfo());
    // values are the index, so the first bucket averages 0 to 5
    assertEquals(2.5, consolidated.value(0), 0.0001);
    assertEquals(56.5, consolidated.value(9), 0.0001);
    assertEquals(series.name(), consolidated.name());
  }

  @Test
  public void shortLastBucket() throws Exception {
    final NormalizedSeries series = series(65, ConsolidationFunction.COUNT);
    final NormalizedSeries consolidated = Consolidator.consolidate(series, 10);
    assertEquals(7, Consolidator.bucketSize(65, 10));
    assertEquals(10, consolidated.size());
    assertEquals(420, consolidated.timeInfo().step());
    assertEquals(7.0, consolidated.value(0), 0.0001);
    assertEquals(2.0, consolidated.value(9), 0.0001);
  }

  @Test
  public void gapsIgnored() throws Exception {
    final NormalizedSeries series = NormalizedSeries.newBuilder()
        .setPath("a.b")
        .setTimeInfo(new TimeInfo(0, 40, 10))
        .setValues(Arrays.asList(null, 4.0, null, null))
        .setConsolidationFunction(ConsolidationFunction.SUM)
        .build();
    final NormalizedSeries consolidated = Consolidator.consolidate(series, 2);
    assertEquals(4.0, consolidated.value(0), 0.0001);
    assertNull(consolidated.value(1));
  }

  private static NormalizedSeries series(final int points,
                                         final ConsolidationFunction function) {
    final Double[] values = new Double[points];
    for (int i = 0; i < points; i++) {
      values[i] = (double) i;
    }
    return NormalizedSeries.newBuilder()
        .setPath("a.b")
        .setTimeInfo(new TimeInfo(0, points * 60L, 60))
        .setValues(Arrays.asList(values))
        .setConsolidationFunction(function)
        .build();
  }
}
