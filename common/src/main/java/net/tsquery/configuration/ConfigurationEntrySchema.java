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

import java.lang.reflect.Type;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Strings;

/**
 * The registration of a configuration key: its type, default value and a
 * description. Values are only readable for registered keys.
 *
 * @since 3.0
 */
public class ConfigurationEntrySchema {

  /** The key. */
  protected final String key;

  /** A simple type, null if a type reference was given. */
  protected final Class<?> type;

  /** A complex type, null if a simple type was given. */
  protected final TypeReference<?> type_reference;

  /** The default value, may be null. */
  protected final Object default_value;

  /** A description for users. */
  protected final String description;

  /** Whether or not the value may be null. */
  protected final boolean nullable;

  /** The class or component that registered the key. */
  protected final String source;

  /**
   * Protected ctor.
   * @param builder A non-null builder.
   * @throws IllegalArgumentException if required values were missing.
   */
  protected ConfigurationEntrySchema(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (builder.type == null && builder.type_reference == null) {
      throw new IllegalArgumentException("A type or type reference must "
          + "be given for key: " + builder.key);
    }
    if (Strings.isNullOrEmpty(builder.description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty for key: " + builder.key);
    }
    if (!builder.nullable && builder.default_value == null) {
      throw new IllegalArgumentException("The schema for " + builder.key
          + " was marked as not-nullable yet the default value was null.");
    }
    key = builder.key;
    type = builder.type;
    type_reference = builder.type_reference;
    default_value = builder.default_value;
    description = builder.description;
    nullable = builder.nullable;
    source = builder.source;
  }

  /** @return The key. */
  public String getKey() {
    return key;
  }

  /** @return The simple type or null. */
  public Class<?> getType() {
    return type;
  }

  /** @return The type reference or null. */
  public TypeReference<?> getTypeReference() {
    return type_reference;
  }

  /** @return The reflected type, whichever was given. */
  public Type getReflectedType() {
    return type != null ? type : type_reference.getType();
  }

  /** @return The default value, may be null. */
  public Object getDefaultValue() {
    return default_value;
  }

  /** @return The description. */
  public String getDescription() {
    return description;
  }

  /** @return Whether or not null is allowed. */
  public boolean isNullable() {
    return nullable;
  }

  /** @return The source that registered the key, may be null. */
  public String getSource() {
    return source;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("key=")
        .append(key)
        .append(", type=")
        .append(getReflectedType().getTypeName())
        .append(", defaultValue=")
        .append(default_value)
        .append(", source=")
        .append(source)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String key;
    private Class<?> type;
    private TypeReference<?> type_reference;
    private Object default_value;
    private String description;
    private boolean nullable;
    private String source;

    public Builder setKey(final String key) {
      this.key = key;
      return this;
    }

    public Builder setType(final Class<?> type) {
      this.type = type;
      type_reference = null;
      return this;
    }

    public Builder setType(final TypeReference<?> type_reference) {
      this.type_reference = type_reference;
      type = null;
      return this;
    }

    public Builder setDefaultValue(final Object default_value) {
      this.default_value = default_value;
      return this;
    }

    public Builder setDescription(final String description) {
      this.description = description;
      return this;
    }

    public Builder isNullable() {
      nullable = true;
      return this;
    }

    public Builder setSource(final String source) {
      this.source = source;
      return this;
    }

    public ConfigurationEntrySchema build() {
      return new ConfigurationEntrySchema(this);
    }
  }
}
