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

import net.tsquery.exceptions.InvalidPatternException;

public class TestGlobPattern {

  @Test
  public void literal() throws Exception {
    final GlobPattern glob = GlobPattern.compile("servers.web1.cpu");
    assertEquals(3, glob.segmentCount());
    assertTrue(glob.isLiteral(0));
    assertEquals("web1", glob.literal(1));
    assertTrue(glob.matches("servers.web1.cpu"));
    assertFalse(glob.matches("servers.web1.cpux"));
    assertFalse(glob.matches("servers.web1"));
    assertFalse(glob.matches("servers.web1.cpu.user"));
  }

  @Test
  public void star() throws Exception {
    final GlobPattern glob = GlobPattern.compile("servers.*.cpu");
    assertFalse(glob.isLiteral(1));
    assertNull(glob.literal(1));
    assertTrue(glob.matches("servers.web1.cpu"));
    assertTrue(glob.matches("servers.db.cpu"));
    assertFalse(glob.matches("servers.web1.mem"));
    // a star never crosses a separator
    assertFalse(glob.matches("servers.web.1.cpu"));

    final GlobPattern partial = GlobPattern.compile("servers.web*.cpu");
    assertTrue(partial.matches("servers.web.cpu"));
    assertTrue(partial.matches("servers.web12.cpu"));
    assertFalse(partial.matches("servers.db1.cpu"));
  }

  @Test
  public void questionMark() throws Exception {
    final GlobPattern glob = GlobPattern.compile("servers.web?.cpu");
    assertTrue(glob.matches("servers.web1.cpu"));
    assertFalse(glob.matches("servers.web.cpu"));
    assertFalse(glob.matches("servers.web12.cpu"));
  }

  @Test
  public void characterClass() throws Exception {
    GlobPattern glob = GlobPattern.compile("servers.web[12].cpu");
    assertTrue(glob.matches("servers.web1.cpu"));
    assertTrue(glob.matches("servers.web2.cpu"));
    assertFalse(glob.matches("servers.web3.cpu"));

    glob = GlobPattern.compile("servers.web[0-9].cpu");
    assertTrue(glob.matches("servers.web7.cpu"));
    assertFalse(glob.matches("servers.weba.cpu"));

    glob = GlobPattern.compile("servers.web[!1].cpu");
    assertFalse(glob.matches("servers.web1.cpu"));
    assertTrue(glob.matches("servers.web2.cpu"));
  }

  @Test
  public void alternation() throws Exception {
    final GlobPattern glob = GlobPattern.compile("servers.{web1,db*}.cpu");
    assertTrue(glob.matches("servers.web1.cpu"));
    assertTrue(glob.matches("servers.db42.cpu"));
    assertFalse(glob.matches("servers.web2.cpu"));
    assertTrue(glob.matchesSegment(1, "db"));
  }

  @Test
  public void regexCharactersAreLiteral() throws Exception {
    final GlobPattern glob = GlobPattern.compile("a+b.c$");
    assertTrue(glob.matches("a+b.c$"));
    assertFalse(glob.matches("aab.c"));
  }

  @Test
  public void invalid() throws Exception {
    assertInvalid(null);
    assertInvalid("");
    assertInvalid("servers..cpu");
    assertInvalid("servers.cpu.");
    assertInvalid("servers.[ab.cpu");
    assertInvalid("servers.{a,b.cpu");
    assertInvalid("servers.a}.cpu");
    assertInvalid("servers.{a,{b,c}}.cpu");
    assertInvalid("servers.{a.b}.cpu");
    assertInvalid("servers.cpu\\");
    // dots always separate segments
    assertInvalid("servers.web1\\.cpu");
    assertInvalid("a\\.b");
  }

  private static void assertInvalid(final String pattern) {
    try {
      GlobPattern.compile(pattern);
      fail("Expected InvalidPatternException for " + pattern);
    } catch (InvalidPatternException e) {
      assertEquals(400, e.getStatusCode());
    }
  }
}
