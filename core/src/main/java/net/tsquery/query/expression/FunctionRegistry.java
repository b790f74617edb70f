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
package net.tsquery.query.expression;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * An immutable map of function names to implementations. Built once when
 * the engine starts and never changed while serving requests.
 *
 * @since 3.0
 */
public final class FunctionRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(FunctionRegistry.class);

  private final Map<String, SeriesFunction> functions;

  private FunctionRegistry(final Builder builder) {
    functions = ImmutableMap.copyOf(builder.functions);
  }

  /**
   * @param name A function name.
   * @return The function or null if not registered.
   */
  public SeriesFunction get(final String name) {
    return functions.get(name);
  }

  /** @return The registered names. */
  public Set<String> names() {
    return functions.keySet();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private final Map<String, SeriesFunction> functions = Maps.newLinkedHashMap();

    /**
     * @param name A non-null and non-empty name.
     * @param function A non-null function.
     * @return The builder.
     * @throws IllegalArgumentException if the name was already registered.
     */
    public Builder register(final String name, final SeriesFunction function) {
      if (Strings.isNullOrEmpty(name)) {
        throw new IllegalArgumentException("Name cannot be null or empty.");
      }
      if (function == null) {
        throw new IllegalArgumentException("Function cannot be null.");
      }
      if (functions.put(name, function) != null) {
        throw new IllegalArgumentException("Function already registered: "
            + name);
      }
      return this;
    }

    /**
     * @param names Function names to drop, unknown names are logged.
     * @return The builder.
     */
    public Builder disable(final Collection<String> names) {
      for (final String name : names) {
        if (functions.remove(name) == null) {
          LOG.warn("Cannot disable unknown function: " + name);
        } else {
          LOG.info("Disabled function: " + name);
        }
      }
      return this;
    }

    public FunctionRegistry build() {
      return new FunctionRegistry(this);
    }
  }
}
