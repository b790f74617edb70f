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
package net.tsquery.query.processor.downsample;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import net.tsquery.data.ConsolidationFunction;
import net.tsquery.storage.GlobPattern;

/**
 * Picks the consolidation function for a metric path: the first rule
 * whose glob matches in configuration order, or the default.
 *
 * @since 3.0
 */
public class ConsolidationRules {
  private static final Logger LOG = LoggerFactory.getLogger(ConsolidationRules.class);

  /** The default function. */
  private final ConsolidationFunction default_function;

  /** The rules in order. */
  private final List<Rule> rules;

  /**
   * Default ctor.
   * @param default_function The non-null default.
   * @param rules Glob to function name in match order, may be null.
   * @throws net.tsquery.exceptions.InvalidPatternException if a glob was
   * malformed.
   * @throws IllegalArgumentException if a function name was unknown.
   */
  public ConsolidationRules(final ConsolidationFunction default_function,
                            final Map<String, String> rules) {
    if (default_function == null) {
      throw new IllegalArgumentException("Default function cannot be null.");
    }
    this.default_function = default_function;
    final ImmutableList.Builder<Rule> builder = ImmutableList.builder();
    if (rules != null) {
      for (final Map.Entry<String, String> entry : rules.entrySet()) {
        builder.add(new Rule(GlobPattern.compile(entry.getKey()),
            ConsolidationFunction.fromString(entry.getValue())));
      }
    }
    this.rules = builder.build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Loaded " + this.rules.size() + " consolidation rules with "
          + "default " + default_function);
    }
  }

  /**
   * @param path A metric path.
   * @return The function for the path.
   */
  public ConsolidationFunction resolve(final String path) {
    for (final Rule rule : rules) {
      if (rule.pattern.matches(path)) {
        return rule.function;
      }
    }
    return default_function;
  }

  /** @return The default function. */
  public ConsolidationFunction defaultFunction() {
    return default_function;
  }

  private static class Rule {
    private final GlobPattern pattern;
    private final ConsolidationFunction function;

    Rule(final GlobPattern pattern, final ConsolidationFunction function) {
      this.pattern = pattern;
      this.function = function;
    }
  }
}
