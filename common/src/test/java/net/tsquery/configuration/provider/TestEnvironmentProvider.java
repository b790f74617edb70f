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

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.tsquery.configuration.ConfigurationOverride;

public class TestEnvironmentProvider {

  @Test
  public void getSetting() throws Exception {
    final EnvironmentProvider provider = new EnvironmentProvider(
        ImmutableMap.of("tsquery.query.timeout", "1000",
                        "TSQUERY_EXECUTOR_THREADS", "4"));
    ConfigurationOverride setting = provider.getSetting("tsquery.query.timeout");
    assertEquals("1000", setting.getValue());
    assertEquals(EnvironmentProvider.SOURCE, setting.getSource());

    setting = provider.getSetting("tsquery.executor.threads");
    assertEquals("4", setting.getValue());

    assertNull(provider.getSetting("tsquery.align.max_step"));
    assertEquals("TSQUERY_ALIGN_MAX_STEP",
        EnvironmentProvider.envName("tsquery.align.max_step"));
  }
}
