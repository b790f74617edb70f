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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestMetricPath {

  @Test
  public void segments() throws Exception {
    final MetricPath path = MetricPath.of("servers.web1.cpu");
    assertEquals(3, path.segmentCount());
    assertEquals("web1", path.segment(1));
    assertEquals("cpu", path.name());
    assertEquals("servers.web1.cpu", path.toString());
    assertFalse(path.isPattern());
  }

  @Test
  public void isPattern() throws Exception {
    assertTrue(MetricPath.isPattern("servers.*.cpu"));
    assertTrue(MetricPath.isPattern("servers.web?.cpu"));
    assertTrue(MetricPath.isPattern("servers.web[12].cpu"));
    assertTrue(MetricPath.isPattern("servers.{a,b}.cpu"));
    assertFalse(MetricPath.isPattern("servers.web-1.cpu"));
  }

  @Test
  public void nullOrEmpty() throws Exception {
    try {
      MetricPath.of(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      MetricPath.of("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
