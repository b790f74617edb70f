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

import java.util.List;

import com.google.common.collect.Lists;

/**
 * A registered key with the overrides found for it. Overrides are stored
 * from least to most significant so the last one wins.
 *
 * @since 3.0
 */
public class ConfigurationEntry {

  /** The schema. */
  private final ConfigurationEntrySchema schema;

  /** Overrides, least significant first. */
  private final List<ConfigurationOverride> settings;

  /**
   * Default ctor.
   * @param schema A non-null schema.
   */
  public ConfigurationEntry(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    this.schema = schema;
    settings = Lists.newArrayListWithExpectedSize(2);
  }

  /** @return The schema. */
  public ConfigurationEntrySchema schema() {
    return schema;
  }

  /**
   * Adds an override that takes precedence over every existing one.
   * @param override A non-null override.
   * @throws ConfigurationException if the value was null and the schema
   * is not nullable.
   */
  public synchronized void addOverride(final ConfigurationOverride override) {
    if (override.getValue() == null && !schema.isNullable()) {
      throw new ConfigurationException("Null value from "
          + override.getSource() + " is not allowed for key: "
          + schema.getKey());
    }
    // a provider replaces its own earlier value
    for (int i = 0; i < settings.size(); i++) {
      if (settings.get(i).getSource().equals(override.getSource())) {
        settings.remove(i);
        break;
      }
    }
    settings.add(override);
  }

  /**
   * @param source A provider source.
   * @return True if an override from the source was removed.
   */
  public synchronized boolean removeOverride(final String source) {
    for (int i = 0; i < settings.size(); i++) {
      if (settings.get(i).getSource().equals(source)) {
        settings.remove(i);
        return true;
      }
    }
    return false;
  }

  /** @return The effective value, the most significant override or the
   * default. */
  public synchronized Object getValue() {
    if (settings.isEmpty()) {
      return schema.getDefaultValue();
    }
    return settings.get(settings.size() - 1).getValue();
  }

  /** @return The source of the effective value. */
  public synchronized String getSource() {
    if (settings.isEmpty()) {
      return "default";
    }
    return settings.get(settings.size() - 1).getSource();
  }

  @Override
  public String toString() {
    return "schema={" + schema + "}, settings=" + settings;
  }
}
