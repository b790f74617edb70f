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
package net.tsquery.configuration.provider;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.After;
import org.junit.Test;

import net.tsquery.configuration.ConfigurationOverride;

public class TestSystemPropertiesProvider {
  private static final String KEY = "tsquery.test.system_property";

  @After
  public void after() throws Exception {
    System.clearProperty(KEY);
  }

  @Test
  public void getSetting() throws Exception {
    final SystemPropertiesProvider provider = new SystemPropertiesProvider();
    assertNull(provider.getSetting(KEY));

    System.setProperty(KEY, "42");
    final ConfigurationOverride setting = provider.getSetting(KEY);
    assertEquals("42", setting.getValue());
    assertEquals(SystemPropertiesProvider.SOURCE, setting.getSource());
    assertEquals(SystemPropertiesProvider.SOURCE, provider.source());
    provider.close();
  }
}
