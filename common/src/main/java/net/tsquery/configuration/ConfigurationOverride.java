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

import com.google.common.base.Strings;

/**
 * A value for a setting supplied by a provider. The source is the name of
 * the provider so that the effective value can be traced.
 *
 * @since 3.0
 */
public class ConfigurationOverride {

  /** The source of the override. */
  protected final String source;

  /** The value of the override. */
  protected final Object value;

  /**
   * Protected builder.
   * @param builder A non-null builder to load from.
   */
  protected ConfigurationOverride(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.source)) {
      throw new IllegalArgumentException("Source cannot be null or empty.");
    }
    source = builder.source;
    value = builder.value;
  }

  /** @return The non-null and non-empty source of this override. */
  public String getSource() {
    return source;
  }

  /** @return The value, may be null. */
  public Object getValue() {
    return value;
  }

  @Override
  public String toString() {
    return "source=" + source + ", value=" + value;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String source;
    private Object value;

    public Builder setSource(final String source) {
      this.source = source;
      return this;
    }

    public Builder setValue(final Object value) {
      this.value = value;
      return this;
    }

    public ConfigurationOverride build() {
      return new ConfigurationOverride(this);
    }
  }
}
