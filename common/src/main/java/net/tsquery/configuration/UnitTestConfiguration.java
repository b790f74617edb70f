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

import java.io.IOException;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import net.tsquery.configuration.provider.Provider;
import net.tsquery.configuration.provider.RuntimeOverrideProvider;

/**
 * A helper for unit testing configuration consumers. Only the
 * {@link RuntimeOverrideProvider} and an in-memory map are consulted so
 * tests are isolated from the environment and files on the host.
 *
 * @since 3.0
 */
public class UnitTestConfiguration extends Configuration {

  /**
   * Private ctor.
   * @param settings The map to read from.
   */
  private UnitTestConfiguration(final Map<String, String> settings) {
    super(ImmutableList.<Provider>of(new RuntimeOverrideProvider(),
                                     new UnitTestProvider(settings)));
  }

  /** @return A configuration backed by an empty map. */
  public static UnitTestConfiguration getConfiguration() {
    return new UnitTestConfiguration(Maps.<String, String>newHashMap());
  }

  /**
   * @param settings A map of key values to load, read at registration.
   * @return A non-null config.
   */
  public static UnitTestConfiguration getConfiguration(
      final Map<String, String> settings) {
    return new UnitTestConfiguration(settings);
  }

  /**
   * Allows a test to change a value after registration.
   * @param key A non-null and non-empty registered key.
   * @param value A value to inject.
   */
  public void override(final String key, final Object value) {
    addOverride(key, value);
  }

  /** Reads from the map. */
  public static class UnitTestProvider implements Provider {
    public static final String SOURCE = "UnitTest";

    private final Map<String, String> kvs;

    public UnitTestProvider(final Map<String, String> kvs) {
      this.kvs = kvs;
    }

    @Override
    public ConfigurationOverride getSetting(final String key) {
      if (kvs != null && kvs.containsKey(key)) {
        return ConfigurationOverride.newBuilder()
            .setSource(SOURCE)
            .setValue(kvs.get(key))
            .build();
      }
      return null;
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
}
