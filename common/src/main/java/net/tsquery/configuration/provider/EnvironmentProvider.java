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

import com.google.common.annotations.VisibleForTesting;

import net.tsquery.configuration.ConfigurationOverride;

/**
 * Pulls values from the environment. The key is looked up as is and then
 * in the upper case, underscore form, e.g. {@code tsquery.query.timeout}
 * is also read from {@code TSQUERY_QUERY_TIMEOUT}.
 *
 * @since 3.0
 */
public class EnvironmentProvider implements Provider {
  public static final String SOURCE = EnvironmentProvider.class.getSimpleName();

  /** The environment to read. */
  private final Map<String, String> environment;

  /**
   * Default ctor reading the process environment.
   */
  public EnvironmentProvider() {
    this(System.getenv());
  }

  /**
   * Ctor for tests.
   * @param environment A non-null map standing in for the environment.
   */
  @VisibleForTesting
  EnvironmentProvider(final Map<String, String> environment) {
    this.environment = environment;
  }

  @Override
  public ConfigurationOverride getSetting(final String key) {
    String value = environment.get(key);
    if (value == null) {
      value = environment.get(envName(key));
    }
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

  /**
   * @param key A non-null key.
   * @return The key in upper case with dots replaced by underscores.
   */
  static String envName(final String key) {
    return key.replace('.', '_').toUpperCase();
  }
}
