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

import java.io.IOException;

import net.tsquery.configuration.ConfigurationOverride;

/**
 * Pulls values from the JVM system properties, e.g.
 * {@code -Dtsquery.query.timeout=5000}.
 *
 * @since 3.0
 */
public class SystemPropertiesProvider implements Provider {
  public static final String SOURCE = SystemPropertiesProvider.class.getSimpleName();

  @Override
  public ConfigurationOverride getSetting(final String key) {
    final String value = System.getProperty(key);
    if (value == null) {
      return null;
    }
    return ConfigurationOverride.newBuilder()
        .setSource(SOURCE)
        .setValue(value)
        .build();
  }

  @Override
  public String source() {
    return SOURCE;
  }

  @Override
  public void close() throws IOException {
    // no-op
  }
}
