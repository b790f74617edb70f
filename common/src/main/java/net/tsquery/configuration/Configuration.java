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

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tsquery.configuration.provider.EnvironmentProvider;
import net.tsquery.configuration.provider.PropertiesFileProvider;
import net.tsquery.configuration.provider.Provider;
import net.tsquery.configuration.provider.RuntimeOverrideProvider;
import net.tsquery.configuration.provider.SystemPropertiesProvider;

/**
 * The configuration for the query engine. Keys must be registered with a
 * {@link ConfigurationEntrySchema} before they can be read. On
 * registration every provider is asked for a value, from the least to the
 * most significant, and the most significant value found wins. If no
 * provider has a value the schema default is used.
 * <p>
 * The default provider order, most significant first, is:
 * <ol>
 * <li>{@link RuntimeOverrideProvider} - values set via
 * {@link #addOverride(String, Object)}</li>
 * <li>{@link SystemPropertiesProvider} - JVM {@code -D} flags</li>
 * <li>{@link EnvironmentProvider} - environment variables</li>
 * <li>{@link PropertiesFileProvider} - {@code tsquery.conf}</li>
 * </ol>
 * Values are converted to the registered type with Jackson. String values
 * holding JSON are parsed for complex types such as maps.
 *
 * @since 3.0
 */
public class Configuration implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(Configuration.class);

  /** Shared mapper for conversions. */
  protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  /** The providers, most significant first. */
  protected final List<Provider> providers;

  /** The registered entries. */
  protected final Map<String, ConfigurationEntry> merged_config;

  /**
   * Default ctor loading the default providers.
   */
  public Configuration() {
    this(defaultProviders());
  }

  /**
   * Ctor with a list of providers.
   * @param providers A non-null list of providers, most significant first.
   * @throws IllegalArgumentException if the list was null.
   */
  public Configuration(final List<Provider> providers) {
    if (providers == null) {
      throw new IllegalArgumentException("Providers cannot be null.");
    }
    this.providers = Lists.newArrayList(providers);
    merged_config = Maps.newConcurrentMap();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Initialized configuration with providers: "
          + this.providers);
    }
  }

  /**
   * Helper to register a schema builder.
   * @param builder A non-null builder.
   */
  public void register(final ConfigurationEntrySchema.Builder builder) {
    if (builder == null) {
      throw new IllegalArgumentException("Builder cannot be null.");
    }
    register(builder.build());
  }

  /**
   * Registers the schema and loads any values the providers have for the
   * key.
   * @param schema A non-null schema.
   * @throws IllegalArgumentException if the schema was null.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    final ConfigurationEntry entry = new ConfigurationEntry(schema);
    final ConfigurationEntry extant =
        merged_config.putIfAbsent(schema.getKey(), entry);
    if (extant != null) {
      throw new ConfigurationException("Schema already exists for "
          + "key: " + schema.getKey());
    }

    // pull from the least significant first so later ones win
    for (int i = providers.size() - 1; i >= 0; i--) {
      final ConfigurationOverride setting = providers.get(i)
          .getSetting(schema.getKey());
      if (setting != null) {
        entry.addOverride(setting);
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered key [" + schema.getKey() + "] with value from "
          + entry.getSource());
    }
  }

  /**
   * Helper that registers a nullable key of the given type.
   * @param key A non-null and non-empty key.
   * @param type The non-null type.
   * @param default_value A default value, may be null.
   * @param description A non-null and non-empty description.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final Class<?> type,
                       final Object default_value,
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setType(type)
        .setDefaultValue(default_value)
        .setDescription(description)
        .isNullable());
  }

  /**
   * Sets a runtime override for the key that takes precedence over every
   * provider.
   * @param key A non-null and non-empty registered key.
   * @param value The value, may be null if the schema allows it.
   * @throws ConfigurationException if the key was not registered.
   */
  public void addOverride(final String key, final Object value) {
    final ConfigurationEntry entry = getEntry(key);
    for (final Provider provider : providers) {
      if (provider instanceof RuntimeOverrideProvider) {
        ((RuntimeOverrideProvider) provider).put(key, value);
      }
    }
    entry.addOverride(ConfigurationOverride.newBuilder()
        .setSource(RuntimeOverrideProvider.SOURCE)
        .setValue(value)
        .build());
  }

  /**
   * Removes a runtime override, restoring the provider or default value.
   * @param key A non-null and non-empty registered key.
   * @return True if an override was removed.
   */
  public boolean removeRuntimeOverride(final String key) {
    final ConfigurationEntry entry = getEntry(key);
    for (final Provider provider : providers) {
      if (provider instanceof RuntimeOverrideProvider) {
        ((RuntimeOverrideProvider) provider).remove(key);
      }
    }
    return entry.removeOverride(RuntimeOverrideProvider.SOURCE);
  }

  /**
   * Returns the value converted to the given type.
   * @param key The non-null and non-empty key.
   * @param type A non-null class to convert to.
   * @return The value, may be null if set to null for non-primitive types.
   * @throws IllegalArgumentException if the key or type were null.
   * @throws ConfigurationException if the key was not registered or the
   * value could not be converted.
   */
  @SuppressWarnings("unchecked")
  public <T> T getTyped(final String key, final Class<?> type) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    final Object value = getEntry(key).getValue();
    if (value == null) {
      if (type.isPrimitive()) {
        throw new ConfigurationException("Cannot cast null to a "
            + "primitive type: " + type + " for key: " + key);
      }
      return null;
    }
    if (value.getClass().equals(type)) {
      return (T) value;
    }
    return (T) convert(key, value, OBJECT_MAPPER.constructType(type));
  }

  /**
   * Returns the value converted to a complex type such as a map.
   * @param key The non-null and non-empty key.
   * @param type A non-null type reference.
   * @return The value, may be null.
   * @throws ConfigurationException if the key was not registered or the
   * value could not be converted.
   */
  @SuppressWarnings("unchecked")
  public <T> T getTyped(final String key, final TypeReference<?> type) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    final Object value = getEntry(key).getValue();
    if (value == null) {
      return null;
    }
    return (T) convert(key, value, OBJECT_MAPPER.constructType(type));
  }

  /**
   * @param key The non-null and non-empty key.
   * @return The value as a string, may be null.
   */
  public String getString(final String key) {
    return getTyped(key, String.class);
  }

  /**
   * @param key The non-null and non-empty key.
   * @return The value as an integer.
   */
  public int getInt(final String key) {
    return (int) getTyped(key, int.class);
  }

  /**
   * @param key The non-null and non-empty key.
   * @return The value as a long.
   */
  public long getLong(final String key) {
    return (long) getTyped(key, long.class);
  }

  /**
   * Checks to see if the value of the key is true or false. Nulls count
   * as false and only the values in the set [true, 1, yes] count as
   * true (case insensitive).
   * @param key The non-null and non-empty key.
   * @return The boolean value.
   */
  public boolean getBoolean(final String key) {
    final Object value = getEntry(key).getValue();
    if (value == null) {
      return false;
    }
    final String bool = value.toString().toLowerCase().trim();
    return bool.equals("true") || bool.equals("1") || bool.equals("yes");
  }

  /**
   * @param key A non-null and non-empty key.
   * @return True if the key was registered.
   */
  public boolean hasProperty(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return merged_config.containsKey(key);
  }

  /**
   * @param key A non-null and non-empty key.
   * @return The name of the provider the effective value came from or
   * "default".
   */
  public String getSource(final String key) {
    return getEntry(key).getSource();
  }

  /** @return The unmodifiable provider list, most significant first. */
  public List<Provider> providers() {
    return Collections.unmodifiableList(providers);
  }

  @Override
  public void close() throws IOException {
    for (final Provider provider : providers) {
      try {
        provider.close();
      } catch (IOException e) {
        LOG.error("Failed to close provider: " + provider, e);
      }
    }
    LOG.info("Completed shutdown of config providers.");
  }

  /**
   * @param key The key.
   * @return The non-null entry.
   * @throws ConfigurationException if not registered.
   */
  protected ConfigurationEntry getEntry(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final ConfigurationEntry entry = merged_config.get(key);
    if (entry == null) {
      throw new ConfigurationException("No registration found for key: " + key);
    }
    return entry;
  }

  /**
   * Converts with Jackson, parsing JSON strings for containers and beans.
   * @param key The key for errors.
   * @param value The non-null value.
   * @param type The target type.
   * @return The converted value.
   */
  private static Object convert(final String key,
                                final Object value,
                                final JavaType type) {
    try {
      if (value instanceof String && isComplex(type)) {
        return OBJECT_MAPPER.readValue((String) value, type);
      }
      return OBJECT_MAPPER.convertValue(value, type);
    } catch (IOException | IllegalArgumentException e) {
      throw new ConfigurationException("Unable to convert the value for key "
          + key + " to " + type, e);
    }
  }

  /**
   * @param type The target type.
   * @return True for containers and beans that a string must be parsed
   * into as JSON.
   */
  private static boolean isComplex(final JavaType type) {
    if (type.isContainerType()) {
      return true;
    }
    final Class<?> raw = type.getRawClass();
    return !raw.isPrimitive() && !raw.isEnum()
        && !raw.getName().startsWith("java.");
  }

  /** @return The default providers. */
  private static List<Provider> defaultProviders() {
    final List<Provider> providers = Lists.newArrayList();
    providers.add(new RuntimeOverrideProvider());
    providers.add(new SystemPropertiesProvider());
    providers.add(new EnvironmentProvider());
    final PropertiesFileProvider file = PropertiesFileProvider.fromDefaults();
    if (file != null) {
      providers.add(file);
    } else {
      LOG.info("No properties file found, using defaults.");
    }
    return providers;
  }
}
