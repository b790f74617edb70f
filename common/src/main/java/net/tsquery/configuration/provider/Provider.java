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

import java.io.Closeable;

import net.tsquery.configuration.Configuration;
import net.tsquery.configuration.ConfigurationOverride;

/**
 * A source of configuration values for {@link Configuration}.
 *
 * @since 3.0
 */
public interface Provider extends Closeable {

  /**
   * Called by the {@link Configuration} class to load the current value
   * for the given key when a schema is registered.
   * @param key A non-null and non-empty key.
   * @return An override if the provider had data for the key or null if
   * not.
   */
  public ConfigurationOverride getSetting(final String key);

  /**
   * The name of this provider.
   * @return A non-null string.
   */
  public String source();

}
