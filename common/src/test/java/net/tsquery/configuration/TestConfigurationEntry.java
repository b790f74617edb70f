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
package net.tsquery.configuration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

public class TestConfigurationEntry {
  private ConfigurationEntrySchema schema;

  @Before
  public void before() throws Exception {
    schema = ConfigurationEntrySchema.newBuilder()
        .setKey("key")
        .setType(String.class)
        .setDefaultValue("default_value")
        .setDescription("Desc")
        .build();
  }

  @Test
  public void lastOverrideWins() throws Exception {
    final ConfigurationEntry entry = new ConfigurationEntry(schema);
    assertEquals("default_value", entry.getValue());
    assertEquals("default", entry.getSource());

    entry.addOverride(override("file", "a"));
    entry.addOverride(override("env", "b"));
    assertEquals("b", entry.getValue());
    assertEquals("env", entry.getSource());

    // a source replaces its own value and moves to the top
    entry.addOverride(override("file", "c"));
    assertEquals("c", entry.getValue());
    assertEquals("file", entry.getSource());

    assertTrue(entry.removeOverride("file"));
    assertEquals("b", entry.getValue());
    assertFalse(entry.removeOverride("file"));
  }

  @Test
  public void nullNotAllowed() throws Exception {
    final ConfigurationEntry entry = new ConfigurationEntry(schema);
    try {
      entry.addOverride(override("file", null));
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    try {
      new ConfigurationEntry(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  private static ConfigurationOverride override(final String source,
                                                final Object value) {
    return ConfigurationOverride.newBuilder()
        .setSource(source)
        .setValue(value)
        .build();
  }
}
