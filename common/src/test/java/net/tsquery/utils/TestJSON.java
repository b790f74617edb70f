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
package net.tsquery.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableMap;

public class TestJSON {

  @Test
  public void parseToObjectClass() throws Exception {
    final Map<?, ?> map = JSON.parseToObject("{\"a\":\"sum\"}", Map.class);
    assertEquals("sum", map.get("a"));

    try {
      JSON.parseToObject("{\"a\":", Map.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      JSON.parseToObject("", Map.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      JSON.parseToObject("{}", (Class<Map>) null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void parseToObjectTypeReference() throws Exception {
    final List<Long> list = JSON.parseToObject("[1,2,3]",
        new TypeReference<List<Long>>() { });
    assertEquals(3, list.size());
    assertEquals(3L, (long) list.get(2));

    try {
      JSON.parseToObject("[\"a\"]", new TypeReference<List<Long>>() { });
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void serialize() throws Exception {
    assertEquals("{\"target\":\"a.b\"}",
        JSON.serializeToString(ImmutableMap.of("target", "a.b")));
    assertEquals("[1,2]", new String(JSON.serializeToBytes(new int[] { 1, 2 }),
        StandardCharsets.UTF_8));
    try {
      JSON.serializeToString(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
