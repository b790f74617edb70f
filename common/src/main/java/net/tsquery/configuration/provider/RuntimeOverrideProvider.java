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
import java.util.Map;

import com.google.common.collect.Maps;

import net.tsquery.configuration.ConfigurationOverride;

/**
 * Holds values set at runtime through
 * {@link net.tsquery.configuration.Configuration#addOverride(String, Object)}.
 * The most significant provider.
 *
 * @since 3.0
 */
public class RuntimeOverrideProvider implements Provider {
  public static final String SOURCE = RuntimeOverrideProvider.class.getSimpleName();

  /** Null values are wrapped so they can be told apart from missing. */
  private static final Object NULL = new Object();

  private final Map<String, Object> overrides = Maps.newConcurrentMap();

  /**
   * @param key A non-null key.
   * @param value A value, may be null.
   */
  public void put(final String key, final Object value) {
    overrides.put(key, value == null ? NULL : value);
  }

  /**
   * @param key A non-null key.
   */
  public void remove(final String key) {
    overrides.remove(key);
  }

  @Override
  public ConfigurationOverride getSetting(final String key) {
    final Object value = overrides.get(key);
    if (value == null) {
      return null;
    }
    return ConfigurationOverride.newBuilder()
        .setSource(SOURCE)
        .setValue(value == NULL ? null : value)
        .build();
  }

  @Override
  public String source() {
    return SOURCE;
  }

  @Override
  public void close() throws IOException {
    overrides.clear();
  }
}
