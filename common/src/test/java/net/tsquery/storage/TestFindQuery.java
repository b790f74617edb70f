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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.tsquery.data.Interval;

public class TestFindQuery {

  @Test
  public void builder() throws Exception {
    final FindQuery query = FindQuery.newBuilder()
        .setPattern("servers.*.cpu")
        .setStartTime(100L)
        .setEndTime(200L)
        .build();
    assertEquals("servers.*.cpu", query.pattern().toString());
    assertEquals(100, (long) query.startTime());
    assertEquals(200, (long) query.endTime());
    assertTrue(query.hasTimeWindow());
    assertFalse(query.isExact());
    assertEquals(new Interval(100, 200), query.interval());
  }

  @Test
  public void openEnded() throws Exception {
    final FindQuery query = FindQuery.newBuilder()
        .setPattern("servers.web1.cpu")
        .build();
    assertNull(query.startTime());
    assertFalse(query.hasTimeWindow());
    assertTrue(query.isExact());
    assertEquals(Interval.ALL, query.interval());
  }

  @Test
  public void validation() throws Exception {
    try {
      FindQuery.newBuilder().build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      FindQuery.newBuilder()
          .setPattern("a")
          .setStartTime(200L)
          .setEndTime(100L)
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
