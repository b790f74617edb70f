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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import net.tsquery.configuration.ConfigurationException;
import net.tsquery.configuration.ConfigurationOverride;

/**
 * Parses a Java style properties file, i.e. key = value. If a specific
 * file is not given then {@link #fromDefaults()} searches, in order:
 * <ol><li>tsquery.conf</li>
 * <li>/etc/tsquery/tsquery.conf</li>
 * </ol>
 *
 * @since 3.0
 */
public class PropertiesFileProvider implements Provider {
  private static final Logger LOG = LoggerFactory.getLogger(
      PropertiesFileProvider.class);

  /** The default locations searched. */
  @VisibleForTesting
  static final ImmutableList<String> DEFAULT_FILES = ImmutableList.of(
      "tsquery.conf", "/etc/tsquery/tsquery.conf");

  /** The file name. */
  private final String file_name;

  /** The entries loaded. */
  private final Map<String, String> cache;

  /**
   * Loads the given file.
   * @param file_name A non-null and non-empty file name.
   * @throws IllegalArgumentException if the file name was null or empty.
   * @throws ConfigurationException if the file could not be read.
   */
  public PropertiesFileProvider(final String file_name) {
    if (Strings.isNullOrEmpty(file_name)) {
      throw new IllegalArgumentException("File name cannot be null or empty.");
    }
    this.file_name = file_name;
    cache = Maps.newConcurrentMap();

    final Properties properties = new Properties();
    try (final InputStream stream = new FileInputStream(file_name)) {
      properties.load(stream);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to load config file: "
          + file_name, e);
    }
    for (final String key : properties.stringPropertyNames()) {
      cache.put(key, properties.getProperty(key).trim());
    }
    LOG.info("Loaded " + cache.size() + " entries from config file: "
        + file_name);
  }

  /**
   * Searches the default locations.
   * @return A provider for the first file found or null if none exist.
   */
  public static PropertiesFileProvider fromDefaults() {
    for (final String name : DEFAULT_FILES) {
      final File file = new File(name);
      if (file.exists() && file.canRead()) {
        return new PropertiesFileProvider(name);
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("No config file found at: " + file.getAbsolutePath());
      }
    }
    return null;
  }

  @Override
  public ConfigurationOverride getSetting(final String key) {
    final String value = cache.get(key);
    if (value == null) {
      return null;
    }
    return ConfigurationOverride.newBuilder()
        .setSource(file_name)
        .setValue(value)
        .build();
  }

  @Override
  public String source() {
    return file_name;
  }

  @Override
  public void close() throws IOException {
    cache.clear();
  }

  @Override
  public String toString() {
    return "PropertiesFileProvider{" + file_name + "}";
  }
}
